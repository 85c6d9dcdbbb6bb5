package astro.lightcurve.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class AxisInterpolatorTest {

  @Test
  public void interiorQueriesReconstructExactly() {
    double[] grid = {0., 0.5, 1.5, 3., 5.};
    double[] query = {0.1, 0.5, 1., 2.9, 4.99};
    AxisInterpolator pos = AxisInterpolator.locate(grid, query);
    for (int k = 0; k < query.length; ++k) {
      int i = pos.getIndex(k);
      double w = pos.getWeight(k);
      assertEquals(query[k], grid[i] * (1. - w) + grid[i + 1] * w, 1E-12);
      assertTrue(w >= 0. && w <= 1.);
    }
  }

  @Test
  public void boundaryQueriesClampToEdgeSegments() {
    double[] grid = {1., 2., 3.};
    AxisInterpolator pos = AxisInterpolator.locate(grid, new double[]{0., 3., 4.});
    assertArrayEquals(new int[]{0, 1, 1}, pos.getIndices());
    assertEquals(-1., pos.getWeight(0), 1E-15);
    assertEquals(1., pos.getWeight(1), 1E-15);
    assertEquals(2., pos.getWeight(2), 1E-15);
    // extrapolation continues the edge segments
    double[] values = {10., 20., 40.};
    assertArrayEquals(new double[]{0., 40., 60.}, pos.interpolate(values), 1E-12);
  }

  @Test
  public void descendingGridLocated() {
    double[] grid = {5., 4., 2., 1.};
    AxisInterpolator pos = AxisInterpolator.locate(grid, new double[]{3., 4.5});
    assertEquals(1, pos.getIndex(0));
    assertEquals(0.5, pos.getWeight(0), 1E-15);
    assertEquals(0, pos.getIndex(1));
    assertEquals(0.5, pos.getWeight(1), 1E-15);
  }

  @Test
  public void evenlySpacedMatchesGeneralLocate() {
    double[] grid = {2., 2.5, 3., 3.5, 4.};
    double[] query = {2.1, 2.75, 3.99, 4.3};
    AxisInterpolator general = AxisInterpolator.locate(grid, query);
    AxisInterpolator even = AxisInterpolator.locateEvenlySpaced(2., 0.5, grid.length, query);
    assertArrayEquals(general.getIndices(), even.getIndices());
    assertArrayEquals(general.getWeights(), even.getWeights(), 1E-12);
    assertEquals(4, even.size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void singlePointGridRejected() {
    AxisInterpolator.locate(new double[]{1.}, new double[]{1.});
  }

  @Test(expected = IllegalArgumentException.class)
  public void nonMonotonicGridRejected() {
    AxisInterpolator.locate(new double[]{1., 2., 2., 3.}, new double[]{1.5});
  }
}
