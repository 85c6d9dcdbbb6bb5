package astro.lightcurve.utils;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Precision;

/**
 * Weighted least-squares fit of a line y = slope * x + intercept, where either parameter may be
 * held fixed. Weights are taken as 1/error^2 for each point, so the quantity minimized is the
 * usual chi-square sum(((y - slope * x - intercept) / error)^2).
 *
 * With both parameters free the 2x2 weighted normal equations are solved; with one of them fixed
 * the reduced single-parameter problem has a closed form; with both fixed no fitting takes place
 * and only the chi-square is evaluated.
 *
 * Instances are immutable results of a call to one of the static fit methods.
 */
public class LinearFit {

  /**
   * Relative size below which the determinant of the normal equations is treated as zero
   * (i.e., the abscissa carries no usable spread for the given weights)
   */
  private static final double DETERMINANT_TOLERANCE = 1E-12;

  private final double intercept;
  private final double slope;
  private final double chiSquare;

  private LinearFit(double intercept, double slope, double chiSquare) {
    this.intercept = intercept;
    this.slope = slope;
    this.chiSquare = chiSquare;
  }

  /**
   * Fit a constant (slope fixed at 0) to the given values; the intercept is the weighted mean.
   *
   * @param y Values to fit
   * @param error Per-point errors, or null for unit weights
   * @return Fit result with the weighted mean as intercept
   */
  public static LinearFit fitConstant(double[] y, double[] error) {
    return fit(y, null, error, null, 0.);
  }

  /**
   * Fit a line to the given data, optionally holding the intercept and/or the slope fixed.
   *
   * @param y Ordinate values (required)
   * @param x Abscissa values, or null to use zero for every point (in which case the slope has
   * no effect and is held at 0 when not otherwise fixed)
   * @param error Per-point errors used to weight the fit as 1/error^2, or null for unit weights
   * @param fixedIntercept Value to hold the intercept at, or null to fit it
   * @param fixedSlope Value to hold the slope at, or null to fit it
   * @return Fit result holding the (fitted or fixed) intercept and slope and the weighted
   * chi-square of the residuals under those values
   * @throws DegenerateFitException if the weights are non-finite, all zero, or too few points
   * carry weight for the number of free parameters
   */
  public static LinearFit fit(double[] y, double[] x, double[] error,
      Double fixedIntercept, Double fixedSlope) {

    int n = y.length;
    if (x != null && x.length != n) {
      throw new IllegalArgumentException(
          "Abscissa length " + x.length + " does not match ordinate length " + n);
    }
    if (error != null && error.length != n) {
      throw new IllegalArgumentException(
          "Error length " + error.length + " does not match ordinate length " + n);
    }
    if (x == null) {
      x = new double[n];
      if (fixedSlope == null) {
        fixedSlope = 0.;
      }
    }

    double[] weights = getWeights(error, n);
    int weighted = 0;
    for (double weight : weights) {
      if (weight > 0.) {
        ++weighted;
      }
    }
    int freeParameters = (fixedIntercept == null ? 1 : 0) + (fixedSlope == null ? 1 : 0);
    if (weighted == 0) {
      throw new DegenerateFitException("All " + n + " points have zero weight");
    }
    if (weighted < freeParameters) {
      throw new DegenerateFitException("Only " + weighted + " weighted point(s) available to fit "
          + freeParameters + " free parameters");
    }

    double intercept;
    double slope;

    if (fixedIntercept == null && fixedSlope == null) {
      double s = 0., sx = 0., sy = 0., sxx = 0., sxy = 0.;
      for (int i = 0; i < n; ++i) {
        double w = weights[i];
        s += w;
        sx += w * x[i];
        sy += w * y[i];
        sxx += w * x[i] * x[i];
        sxy += w * x[i] * y[i];
      }
      double determinant = s * sxx - sx * sx;
      if (!(determinant > DETERMINANT_TOLERANCE * s * sxx)) {
        throw new DegenerateFitException(
            "Normal equations are singular; abscissa values have no weighted spread");
      }
      RealMatrix normal = MatrixUtils.createRealMatrix(new double[][]{{s, sx}, {sx, sxx}});
      RealVector rhs = MatrixUtils.createRealVector(new double[]{sy, sxy});
      DecompositionSolver solver = new LUDecomposition(normal, Precision.SAFE_MIN).getSolver();
      RealVector solution = solver.solve(rhs);
      intercept = solution.getEntry(0);
      slope = solution.getEntry(1);
    } else if (fixedSlope == null) {
      intercept = fixedIntercept;
      double numerator = 0.;
      double denominator = 0.;
      for (int i = 0; i < n; ++i) {
        numerator += weights[i] * x[i] * (y[i] - intercept);
        denominator += weights[i] * x[i] * x[i];
      }
      if (denominator == 0.) {
        throw new DegenerateFitException(
            "Cannot fit slope with fixed intercept; all weighted abscissa values are zero");
      }
      slope = numerator / denominator;
    } else if (fixedIntercept == null) {
      slope = fixedSlope;
      double numerator = 0.;
      double denominator = 0.;
      for (int i = 0; i < n; ++i) {
        numerator += weights[i] * (y[i] - slope * x[i]);
        denominator += weights[i];
      }
      intercept = numerator / denominator;
    } else {
      intercept = fixedIntercept;
      slope = fixedSlope;
    }

    double chiSquare = 0.;
    for (int i = 0; i < n; ++i) {
      double residual = y[i] - (slope * x[i] + intercept);
      chiSquare += weights[i] * residual * residual;
    }
    return new LinearFit(intercept, slope, chiSquare);
  }

  private static double[] getWeights(double[] error, int n) {
    double[] weights = new double[n];
    for (int i = 0; i < n; ++i) {
      if (error == null) {
        weights[i] = 1.;
        continue;
      }
      double weight = 1. / (error[i] * error[i]);
      if (Double.isNaN(weight) || Double.isInfinite(weight)) {
        throw new DegenerateFitException(
            "Non-finite weight at point " + i + " (error = " + error[i] + ")");
      }
      weights[i] = weight;
    }
    return weights;
  }

  public double getIntercept() {
    return intercept;
  }

  public double getSlope() {
    return slope;
  }

  public double getChiSquare() {
    return chiSquare;
  }

  /**
   * Value of the fitted line at the given abscissa
   * @param x Abscissa to evaluate at
   * @return slope * x + intercept
   */
  public double evaluate(double x) {
    return slope * x + intercept;
  }
}
