package astro.lightcurve.utils;

import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Pair;

/**
 * Conversions between magnitudes and fluxes, with first-order propagation of the errors.
 *
 * Standard magnitudes follow flux = zeroPoint * 10^(-0.4 * mag). Softened ("asinh") magnitudes,
 * as defined by Lupton, Gunn &amp; Szalay (1999), follow
 * mag = -(2.5 / ln 10) * [asinh((flux / zeroPoint) / (2 * b)) + ln b] for a softening b &gt; 0, which
 * stays finite for fluxes near or below zero (faint detections, upper limits).
 *
 * Every method returns the converted values first and the propagated errors second; the errors
 * are null when no input errors were given.
 */
public class UnitConverter {

  /**
   * Pogson's ratio, 2.5 / ln(10)
   */
  public static final double POGSON = 2.5 / FastMath.log(10.);

  /**
   * Convert standard magnitudes to fluxes.
   *
   * @param mag Magnitudes
   * @param magErr Magnitude errors, or null
   * @param zeroPoint Flux of a zero-magnitude source
   * @return Pair of flux values and flux errors
   */
  public static Pair<double[], double[]> magToFlux(double[] mag, double[] magErr,
      double zeroPoint) {
    double[] flux = new double[mag.length];
    double[] fluxErr = magErr == null ? null : new double[mag.length];
    for (int i = 0; i < mag.length; ++i) {
      flux[i] = zeroPoint * FastMath.pow(10., -0.4 * mag[i]);
      if (fluxErr != null) {
        fluxErr[i] = flux[i] * magErr[i] / POGSON;
      }
    }
    return new Pair<>(flux, fluxErr);
  }

  /**
   * Convert fluxes to standard magnitudes. Non-positive fluxes have no standard magnitude and
   * come out as NaN; use {@link #fluxToAsinh(double[], double[], double, double)} for those.
   *
   * @param flux Flux values
   * @param fluxErr Flux errors, or null
   * @param zeroPoint Flux of a zero-magnitude source
   * @return Pair of magnitudes and magnitude errors
   */
  public static Pair<double[], double[]> fluxToMag(double[] flux, double[] fluxErr,
      double zeroPoint) {
    double[] mag = new double[flux.length];
    double[] magErr = fluxErr == null ? null : new double[flux.length];
    for (int i = 0; i < flux.length; ++i) {
      mag[i] = -2.5 * FastMath.log10(flux[i] / zeroPoint);
      if (magErr != null) {
        magErr[i] = POGSON * fluxErr[i] / FastMath.abs(flux[i]);
      }
    }
    return new Pair<>(mag, magErr);
  }

  /**
   * Convert asinh magnitudes to fluxes. A softening of zero falls back to standard magnitudes.
   *
   * @param mag Asinh magnitudes
   * @param magErr Magnitude errors, or null
   * @param zeroPoint Flux of a zero-magnitude source
   * @param softening Softening parameter b, in units of the zero-point flux
   * @return Pair of flux values and flux errors
   * @throws InvalidSofteningException if the softening is negative
   */
  public static Pair<double[], double[]> asinhToFlux(double[] mag, double[] magErr,
      double zeroPoint, double softening) {
    checkSoftening(softening);
    if (softening == 0.) {
      return magToFlux(mag, magErr, zeroPoint);
    }
    double logSoftening = FastMath.log(softening);
    double[] flux = new double[mag.length];
    double[] fluxErr = magErr == null ? null : new double[mag.length];
    for (int i = 0; i < mag.length; ++i) {
      double ratio = 2. * softening * FastMath.sinh(-mag[i] / POGSON - logSoftening);
      flux[i] = zeroPoint * ratio;
      if (fluxErr != null) {
        double derivative = FastMath.sqrt(4. * softening * softening + ratio * ratio) / POGSON;
        fluxErr[i] = zeroPoint * derivative * magErr[i];
      }
    }
    return new Pair<>(flux, fluxErr);
  }

  /**
   * Convert fluxes to asinh magnitudes. A softening of zero falls back to standard magnitudes.
   *
   * @param flux Flux values (may be zero or negative)
   * @param fluxErr Flux errors, or null
   * @param zeroPoint Flux of a zero-magnitude source
   * @param softening Softening parameter b, in units of the zero-point flux
   * @return Pair of asinh magnitudes and magnitude errors
   * @throws InvalidSofteningException if the softening is negative
   */
  public static Pair<double[], double[]> fluxToAsinh(double[] flux, double[] fluxErr,
      double zeroPoint, double softening) {
    checkSoftening(softening);
    if (softening == 0.) {
      return fluxToMag(flux, fluxErr, zeroPoint);
    }
    double logSoftening = FastMath.log(softening);
    double[] mag = new double[flux.length];
    double[] magErr = fluxErr == null ? null : new double[flux.length];
    for (int i = 0; i < flux.length; ++i) {
      double ratio = flux[i] / zeroPoint;
      mag[i] = -POGSON * (FastMath.asinh(ratio / (2. * softening)) + logSoftening);
      if (magErr != null) {
        double scale = FastMath.sqrt(4. * softening * softening + ratio * ratio);
        magErr[i] = POGSON * (fluxErr[i] / zeroPoint) / scale;
      }
    }
    return new Pair<>(mag, magErr);
  }

  private static void checkSoftening(double softening) {
    if (softening < 0. || Double.isNaN(softening)) {
      throw new InvalidSofteningException(softening);
    }
  }
}
