package astro.lightcurve.utils;

/**
 * Locates query values on a strictly monotonic reference grid. For every query the index of the
 * bracketing grid segment and the linear interpolation weight within it are stored, such that
 * query = grid[index] * (1 - weight) + grid[index + 1] * weight.
 *
 * The index is clamped to [0, N-2]; queries beyond either end of the grid therefore land on the
 * first or last segment with a weight outside [0, 1], which turns interpolation into linear
 * extrapolation rather than an error.
 *
 * The same positions can be re-used to interpolate any number of value arrays sampled on the grid,
 * which is how a coarse model light curve is mapped back onto observed phases and how spectra are
 * resampled.
 */
public class AxisInterpolator {

  private final int[] indices;
  private final double[] weights;

  private AxisInterpolator(int[] indices, double[] weights) {
    this.indices = indices;
    this.weights = weights;
  }

  /**
   * Locate query values on a strictly monotonic (ascending or descending) grid.
   *
   * @param grid Reference grid of at least two points
   * @param query Values to locate
   * @return Bracketing indices and weights for each query value
   * @throws IllegalArgumentException if the grid is too short or not strictly monotonic
   */
  public static AxisInterpolator locate(double[] grid, double[] query) {
    int n = grid.length;
    if (n < 2) {
      throw new IllegalArgumentException("Reference grid needs at least 2 points, got " + n);
    }
    double direction = Math.signum(grid[1] - grid[0]);
    for (int i = 1; i < n; ++i) {
      if (!(Math.signum(grid[i] - grid[i - 1]) == direction) || direction == 0.) {
        throw new IllegalArgumentException(
            "Reference grid is not strictly monotonic at index " + i);
      }
    }

    int[] indices = new int[query.length];
    double[] weights = new double[query.length];
    for (int k = 0; k < query.length; ++k) {
      double target = direction * query[k];
      // largest index whose grid value is at or before the query, along the grid direction
      int lo = 0;
      int hi = n - 2;
      while (lo < hi) {
        int mid = (lo + hi + 1) >>> 1;
        if (direction * grid[mid] <= target) {
          lo = mid;
        } else {
          hi = mid - 1;
        }
      }
      indices[k] = lo;
      weights[k] = (query[k] - grid[lo]) / (grid[lo + 1] - grid[lo]);
    }
    return new AxisInterpolator(indices, weights);
  }

  /**
   * Locate query values on an evenly spaced grid start + i * step, i = 0 .. length - 1, without
   * materializing the grid.
   *
   * @param start First grid value
   * @param step Grid spacing (non-zero)
   * @param length Number of grid points (at least 2)
   * @param query Values to locate
   * @return Bracketing indices and weights for each query value
   */
  public static AxisInterpolator locateEvenlySpaced(double start, double step, int length,
      double[] query) {
    if (length < 2) {
      throw new IllegalArgumentException("Reference grid needs at least 2 points, got " + length);
    }
    if (step == 0. || Double.isNaN(step)) {
      throw new IllegalArgumentException("Grid step must be non-zero, got " + step);
    }
    int[] indices = new int[query.length];
    double[] weights = new double[query.length];
    for (int k = 0; k < query.length; ++k) {
      double position = (query[k] - start) / step;
      int index = (int) Math.floor(position);
      index = Math.max(0, Math.min(length - 2, index));
      indices[k] = index;
      weights[k] = position - index;
    }
    return new AxisInterpolator(indices, weights);
  }

  /**
   * Interpolate values sampled on the reference grid at the located query positions.
   *
   * @param values Values sampled on the reference grid (same length as the grid)
   * @return Linearly interpolated (or edge-extrapolated) value for each query
   */
  public double[] interpolate(double[] values) {
    double[] result = new double[indices.length];
    for (int k = 0; k < indices.length; ++k) {
      int i = indices[k];
      result[k] = values[i] * (1. - weights[k]) + values[i + 1] * weights[k];
    }
    return result;
  }

  public int[] getIndices() {
    return indices.clone();
  }

  public double[] getWeights() {
    return weights.clone();
  }

  public int getIndex(int query) {
    return indices[query];
  }

  public double getWeight(int query) {
    return weights[query];
  }

  public int size() {
    return indices.length;
  }
}
