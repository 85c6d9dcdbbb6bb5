package astro.lightcurve.output;

import static astro.lightcurve.utils.NumericUtils.DECIMAL_FORMAT;

import astro.lightcurve.fit.SurfaceParameters;

/**
 * Outcome of one chi-square evaluation: the total chi-square and its data-level and band-level
 * parts, the calibration offset left for each band once the distance modulus and extinction
 * contributions are removed, the (fitted or fixed) distance modulus and extinction, and optionally
 * the normalized residuals of every observation.
 *
 * A new result is produced by every evaluation and belongs to the caller.
 */
public class FitResult {

  private final double chiSquareData;
  private final double chiSquareBand;
  private final double[] offsets;
  private final double distanceModulus;
  private final double extinction;
  private final double[][] residuals;
  private final SurfaceParameters parameters;

  public FitResult(double chiSquareData, double chiSquareBand, double[] offsets,
      double distanceModulus, double extinction, double[][] residuals,
      SurfaceParameters parameters) {
    this.chiSquareData = chiSquareData;
    this.chiSquareBand = chiSquareBand;
    this.offsets = offsets.clone();
    this.distanceModulus = distanceModulus;
    this.extinction = extinction;
    this.residuals = copy(residuals);
    this.parameters = parameters;
  }

  /**
   * @return Sum of the data-level and band-level chi-square
   */
  public double getChiSquare() {
    return chiSquareData + chiSquareBand;
  }

  public double getChiSquareData() {
    return chiSquareData;
  }

  public double getChiSquareBand() {
    return chiSquareBand;
  }

  /**
   * Calibration offset of each band (magnitudes), net of the extinction coefficient times A_V and
   * the distance modulus. All zero when band offsets were not free.
   * @return per-band offsets
   */
  public double[] getOffsets() {
    return offsets.clone();
  }

  public double getDistanceModulus() {
    return distanceModulus;
  }

  public double getExtinction() {
    return extinction;
  }

  /**
   * Residuals (data - model - offset) / error for every observation, grouped by dataset
   * @return residuals, or null if they were not requested
   */
  public double[][] getResiduals() {
    return copy(residuals);
  }

  public boolean hasResiduals() {
    return residuals != null;
  }

  public SurfaceParameters getParameters() {
    return parameters;
  }

  /**
   * Human-readable summary of the fit statistics
   * @return multi-line report string
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Chi-square: ").append(DECIMAL_FORMAT.get().format(getChiSquare()));
    sb.append("\nChi-square (data): ").append(DECIMAL_FORMAT.get().format(chiSquareData));
    sb.append("\nChi-square (band offset): ").append(DECIMAL_FORMAT.get().format(chiSquareBand));
    sb.append("\nDistance modulus: ").append(DECIMAL_FORMAT.get().format(distanceModulus));
    sb.append("\nExtinction (V band): ").append(DECIMAL_FORMAT.get().format(extinction));
    for (int i = 0; i < offsets.length; ++i) {
      sb.append("\nOffset [").append(i).append("]: ");
      sb.append(DECIMAL_FORMAT.get().format(offsets[i]));
    }
    return sb.toString();
  }

  private static double[][] copy(double[][] array) {
    if (array == null) {
      return null;
    }
    double[][] copy = new double[array.length][];
    for (int i = 0; i < array.length; ++i) {
      copy[i] = array[i].clone();
    }
    return copy;
  }
}
