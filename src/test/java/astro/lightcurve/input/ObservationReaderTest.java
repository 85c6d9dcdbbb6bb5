package astro.lightcurve.input;

import static astro.lightcurve.test.TestUtils.observationFile;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import astro.lightcurve.input.DatasetRecord.Representation;
import java.io.IOException;
import java.util.List;
import org.junit.Test;

public class ObservationReaderTest {

  @Test
  public void readsAllThreeLayouts() throws IOException {
    List<DatasetRecord> records = ObservationReader.read(observationFile("observations.txt"));
    assertEquals(3, records.size());

    DatasetRecord first = records.get(0);
    assertEquals("V", first.getId());
    assertEquals("V.dat", first.getFileName());
    assertEquals(Representation.MAGNITUDE, first.getRepresentation());
    assertEquals(0.03, first.getCalibrationError(), 0.);
    assertEquals(0., first.getSoftening(), 0.);
    assertEquals(5, first.size());
    assertArrayEquals(new double[]{17.20, 17.00, 17.30, 17.05, 17.22}, first.getValues(), 0.);
    assertArrayEquals(new double[]{0.05, 0.05, 0.05, 0.05, 0.05}, first.getErrors(), 0.);
    // last phase 1.10 is reduced to 0.10
    assertArrayEquals(new double[]{0., 0.25, 0.5, 0.75, 0.1}, first.getPhase(), 1E-12);

    // shift of 0.1 applied before reduction
    DatasetRecord second = records.get(1);
    assertArrayEquals(new double[]{0.9, 0.15, 0.4, 0.65, 0.}, second.getPhase(), 1E-12);

    DatasetRecord third = records.get(2);
    assertEquals("B", third.getId());
    assertEquals(0.05, third.getCalibrationError(), 0.);
    assertEquals(4, third.size());
    assertArrayEquals(new double[]{0.08, 0.08, 0.08, 0.08}, third.getErrors(), 0.);
  }

  @Test
  public void coherentDatasetKeepsUnwrappedPhases() throws IOException {
    List<DatasetRecord> records = ObservationReader.read(observationFile("coherent.txt"));
    DatasetRecord coherent = records.get(0);
    assertEquals("V_long", coherent.getId());
    assertEquals(1.10, coherent.getPhase()[4], 1E-12);

    DatasetRecord flux = records.get(1);
    assertEquals(Representation.FLUX, flux.getRepresentation());
    assertEquals(1.0e-10, flux.getSoftening(), 0.);
    assertArrayEquals(new double[]{0.1, 0.4, 0.7}, flux.getPhase(), 1E-12);
    assertArrayEquals(new double[]{2.0e-29, -1.0e-30, 5.0e-30}, flux.getValues(), 0.);
  }

  @Test(expected = ObservationFormatException.class)
  public void unsupportedColumnCountRejected() throws IOException {
    ObservationReader.read(observationFile("bad_columns.txt"));
  }

  @Test
  public void unknownRepresentationFlagRejected() throws IOException {
    try {
      ObservationReader.read(observationFile("bad_flag.txt"));
      fail("Expected a format exception for the 'counts' flag");
    } catch (ObservationFormatException e) {
      assertTrue(e.getMessage().contains("counts"));
      assertTrue(e.getMessage().contains("bad_flag.txt"));
    }
  }

  @Test
  public void missingDataColumnNamesDataset() throws IOException {
    try {
      ObservationReader.read(observationFile("bad_table.txt"));
      fail("Expected a format exception for column 5");
    } catch (ObservationFormatException e) {
      assertTrue(e.getMessage().contains("Dataset V"));
      assertTrue(e.getMessage().contains("V.dat"));
    }
  }

  @Test
  public void nonFinitePhaseRejected() throws IOException {
    try {
      ObservationReader.read(observationFile("nan_phase.txt"));
      fail("Expected a format exception for the NaN phase");
    } catch (ObservationFormatException e) {
      assertTrue(e.getMessage().contains("Dataset V"));
      assertTrue(e.getMessage().contains("nan_phase.dat"));
      assertTrue(e.getMessage().contains("not finite"));
    }
  }

  @Test
  public void missingDataTableIsIOException() {
    try {
      ObservationReader.read(observationFile("missing_table.txt"));
      fail("Expected an IOException for the missing table");
    } catch (IOException e) {
      assertFalse(e instanceof ObservationFormatException);
    }
  }

  @Test
  public void representationFlags() {
    assertEquals(Representation.MAGNITUDE, Representation.fromFlag("mag"));
    assertEquals(Representation.FLUX, Representation.fromFlag("flux"));
    assertEquals(null, Representation.fromFlag("counts"));
  }
}
