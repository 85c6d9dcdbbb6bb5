package astro.lightcurve.filter;

import static astro.lightcurve.test.TestUtils.filterFile;
import static astro.lightcurve.utils.NumericUtils.ANGSTROM;
import static astro.lightcurve.utils.NumericUtils.SPEED_OF_LIGHT;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import astro.lightcurve.filter.FilterResponse.FilterFormatException;
import java.io.IOException;
import org.junit.Test;

public class FilterResponseTest {

  @Test
  public void wavelengthDomainInterpolatesTable() throws IOException {
    FilterResponse filter = FilterResponse.load(filterFile("gauss5000.dat"), false);
    assertFalse(filter.isFrequencyDomain());
    assertEquals("gauss5000.dat", filter.getName());
    assertEquals(4000., filter.getLowerBound(), 0.);
    assertEquals(6000., filter.getUpperBound(), 0.);
    assertEquals(1., filter.value(5000.), 1E-12);
    assertEquals(Math.exp(-1.), filter.value(5400.), 1E-6);
    // between nodes the spline follows the smooth curve
    assertEquals(Math.exp(-Math.pow(50. / 400., 2)), filter.value(5050.), 1E-3);
  }

  @Test
  public void zeroOutsideTabulatedRange() throws IOException {
    FilterResponse filter = FilterResponse.load(filterFile("gauss5000.dat"), false);
    assertArrayEquals(new double[]{0., 0., 0.},
        filter.value(new double[]{3000., 3999.9, 6500.}), 0.);
  }

  @Test
  public void frequencyDomainIndexedByHertz() throws IOException {
    FilterResponse filter = FilterResponse.load(filterFile("gauss5000.dat"), true);
    assertTrue(filter.isFrequencyDomain());
    double peak = SPEED_OF_LIGHT / (5000. * ANGSTROM);
    assertEquals(1., filter.value(peak), 1E-9);
    assertEquals(SPEED_OF_LIGHT / (6000. * ANGSTROM), filter.getLowerBound(), 1.);
    assertEquals(SPEED_OF_LIGHT / (4000. * ANGSTROM), filter.getUpperBound(), 1.);
    assertEquals(0., filter.value(5000.), 0.);
  }

  @Test(expected = FilterFormatException.class)
  public void descendingTableRejected() throws IOException {
    FilterResponse.load(filterFile("descending.dat"), false);
  }

  @Test(expected = FilterFormatException.class)
  public void nonNumericTableRejected() throws IOException {
    FilterResponse.load(filterFile("malformed.dat"), true);
  }

  @Test(expected = IllegalArgumentException.class)
  public void tooShortTableRejected() {
    new FilterResponse("short", new double[]{1., 2.}, new double[]{0.5, 0.5}, false);
  }
}
