package astro.lightcurve.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;

/**
 * Class containing small numeric helpers shared by the fitting and band-integration code:
 * physical constants, array concatenation, trapezoidal integration of sampled data and
 * construction of evenly spaced grids.
 */
public class NumericUtils {

  /**
   * 2 * Pi, sometimes also referred to as Tau.
   * The number of radians in a full circle.
   */
  public final static double TAU = Math.PI * 2; // radians in full circle

  /**
   * Speed of light in vacuum, m/s
   */
  public final static double SPEED_OF_LIGHT = 299792458.0;

  /**
   * Conversion factor from angstrom to metres
   */
  public final static double ANGSTROM = 1E-10;

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.###");
        setInfinityPrintable(format);
        return format;
      });

  /**
   * Sets decimalformat object so that infinity can be printed in a report string
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }

  /**
   * Merge arrays from multiple datasets into a single object
   *
   * @param arrs Series of arrays
   * @return All inputted arrays concatenated into a single array, in order
   */
  public static double[] concatAll(double[]... arrs) {
    int len = 0;
    for (double[] arr : arrs) {
      len += arr.length;
    }

    double[] result = new double[len];
    int start = 0;
    for (double[] arr : arrs) {
      System.arraycopy(arr, 0, result, start, arr.length);
      start += arr.length;
    }
    return result;
  }

  /**
   * Merge a list of arrays into a single array in order.
   *
   * @param list List of arrays to merge all together into a single array
   * @return Single array holding each array's data in sequence.
   */
  public static double[] concatAll(List<double[]> list) {
    return concatAll(list.toArray(new double[list.size()][]));
  }

  /**
   * Trapezoidal-rule integral of sampled data. The abscissa does not have to be evenly spaced;
   * a descending abscissa gives the negated integral, as with any definite integral.
   *
   * @param y Sampled function values
   * @param x Abscissa of each sample
   * @return Integral of y over x
   */
  public static double trapezoid(double[] y, double[] x) {
    if (y.length != x.length) {
      throw new IllegalArgumentException(
          "Cannot integrate " + y.length + " values over " + x.length + " abscissa points");
    }
    double sum = 0.;
    for (int i = 1; i < x.length; ++i) {
      sum += (x[i] - x[i - 1]) * (y[i] + y[i - 1]) / 2.;
    }
    return sum;
  }

  /**
   * Evenly spaced values start, start + step, ... strictly below stop (half-open range)
   *
   * @param start First value
   * @param stop Exclusive upper bound
   * @param step Positive spacing
   * @return Array of grid values, empty if stop &lt;= start
   */
  public static double[] arange(double start, double stop, double step) {
    if (!(step > 0.)) {
      throw new IllegalArgumentException("Grid step must be positive, got " + step);
    }
    int count = (int) Math.max(0, Math.ceil((stop - start) / step));
    double[] grid = new double[count];
    for (int i = 0; i < count; ++i) {
      grid[i] = start + i * step;
    }
    return grid;
  }

  /**
   * Get count evenly spaced orbital phases covering [0, 1), i.e., i / count.
   *
   * @param count Number of phases
   * @return Phases 0, 1/count, ..., (count-1)/count
   */
  public static double[] evenPhases(int count) {
    if (count < 1) {
      throw new IllegalArgumentException("Number of phases must be positive, got " + count);
    }
    double[] phases = new double[count];
    for (int i = 0; i < count; ++i) {
      phases[i] = i / (double) count;
    }
    return phases;
  }

  /**
   * Reduce an orbital phase to the range [0, 1)
   *
   * @param phase Unwrapped phase
   * @return Phase modulo 1, non-negative
   */
  public static double reducePhase(double phase) {
    double reduced = phase % 1.;
    if (reduced < 0.) {
      reduced += 1.;
    }
    // guards against -1e-17 % 1 + 1 rounding to exactly 1
    return reduced >= 1. ? 0. : reduced;
  }
}
