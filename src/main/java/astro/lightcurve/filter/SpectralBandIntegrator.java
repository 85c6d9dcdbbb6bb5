package astro.lightcurve.filter;

import static astro.lightcurve.utils.NumericUtils.ANGSTROM;
import static astro.lightcurve.utils.NumericUtils.SPEED_OF_LIGHT;

import astro.lightcurve.input.FitConfiguration;
import astro.lightcurve.utils.AxisInterpolator;
import astro.lightcurve.utils.LinearFit;
import astro.lightcurve.utils.NumericUtils;
import java.util.Arrays;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.util.FastMath;
import org.apache.log4j.Logger;

/**
 * Synthetic photometry: integration of spectra through filter response curves. These functions
 * are used offline to derive the calibration constants of a band (zero points, effective
 * wavelengths, Doppler boosting factors), not by the light-curve fitter itself.
 *
 * Wavelengths are in angstrom and frequencies in Hz. Flux densities are per angstrom or per Hz to
 * match. The filter must be indexed in the same domain as the spectrum (see
 * {@link FilterResponse#isFrequencyDomain()}).
 *
 * See Bessell and Murphy (2012), eq. 2 and A5, and Linnell, DeStefano and Hubeny (2013), eq. 5
 * and 6, for the integrals.
 */
public class SpectralBandIntegrator {

  private static final Logger logger = Logger.getLogger(SpectralBandIntegrator.class);

  /**
   * Mean flux density of a spectrum through a filter.
   *
   * <ul>
   * <li>AB, frequency input: int(T f / nu dnu) / int(T / nu dnu), per Hz.</li>
   * <li>AB, wavelength input: the spectrum is converted to SI units and the result is the
   * equivalent per-Hz flux density int(T f lambda dlambda) / int(T c / lambda dlambda).</li>
   * <li>ST, frequency input: int(T f / nu dnu) / int(T c / nu^3 dnu), converted to per angstrom.
   * </li>
   * <li>ST, wavelength input: int(T f lambda dlambda) / int(T lambda dlambda), per angstrom.</li>
   * </ul>
   *
   * Both ST branches return a flux density per angstrom: the frequency branch is scaled by 1e-10
   * from per metre, while the wavelength branch already integrates over angstrom and takes no
   * extra factor.
   *
   * @param filter Filter response, in the domain of the spectrum grid
   * @param grid Wavelengths (angstrom) or frequencies (Hz) of the spectrum
   * @param flux Flux density at each grid point
   * @param frequencyInput Whether the grid holds frequencies rather than wavelengths
   * @param abSystem Whether to return an AB (per Hz) rather than ST (per angstrom) flux density
   * @return Band-integrated flux density
   */
  public static double integrateBand(UnivariateFunction filter, double[] grid, double[] flux,
      boolean frequencyInput, boolean abSystem) {
    if (grid.length != flux.length) {
      throw new IllegalArgumentException(
          "Spectrum has " + grid.length + " grid points but " + flux.length + " flux values");
    }
    int n = grid.length;
    double[] band = transmission(filter, grid);
    double[] numerator = new double[n];
    double[] denominator = new double[n];

    if (frequencyInput) {
      for (int i = 0; i < n; ++i) {
        numerator[i] = band[i] * flux[i] / grid[i];
        if (abSystem) {
          denominator[i] = band[i] / grid[i];
        } else {
          denominator[i] = band[i] * SPEED_OF_LIGHT / (grid[i] * grid[i] * grid[i]);
        }
      }
      double result = ratio(numerator, denominator, grid);
      return abSystem ? result : result * ANGSTROM;
    }

    if (abSystem) {
      double[] wavelength = new double[n];
      for (int i = 0; i < n; ++i) {
        wavelength[i] = grid[i] * ANGSTROM;
        numerator[i] = band[i] * (flux[i] / ANGSTROM) * wavelength[i];
        denominator[i] = band[i] * SPEED_OF_LIGHT / wavelength[i];
      }
      return ratio(numerator, denominator, wavelength);
    }

    for (int i = 0; i < n; ++i) {
      numerator[i] = band[i] * flux[i] * grid[i];
      denominator[i] = band[i] * grid[i];
    }
    return ratio(numerator, denominator, grid);
  }

  /**
   * Transmission-weighted mean of the grid over a filter, int(T x dx) / int(T dx).
   *
   * @param filter Filter response, in the domain of the grid
   * @param grid Wavelengths (angstrom) or frequencies (Hz)
   * @return Effective wavelength or frequency of the filter
   */
  public static double effectiveWavelength(UnivariateFunction filter, double[] grid) {
    double[] band = transmission(filter, grid);
    double[] weighted = new double[grid.length];
    for (int i = 0; i < grid.length; ++i) {
      weighted[i] = band[i] * grid[i];
    }
    return ratio(weighted, band, grid);
  }

  /**
   * Trim a spectrum to a range and/or resample it at a constant interval by linear interpolation.
   *
   * @param grid Ascending wavelengths or frequencies
   * @param flux Flux density at each grid point
   * @param range Inclusive {min, max} to keep, or null to keep the whole spectrum
   * @param step New sampling interval in the units of the grid, or null to only trim
   * @return Trimmed and resampled spectrum; the new grid runs from the first kept point up to and
   * including the last one when it falls on the new sampling
   */
  public static Spectrum resampleSpectrum(double[] grid, double[] flux, double[] range,
      Double step) {
    if (grid.length != flux.length) {
      throw new IllegalArgumentException(
          "Spectrum has " + grid.length + " grid points but " + flux.length + " flux values");
    }
    double[] w = grid;
    double[] f = flux;
    if (range != null) {
      if (range.length != 2) {
        throw new IllegalArgumentException("Trim range must be {min, max}");
      }
      int count = 0;
      for (double value : grid) {
        if (value >= range[0] && value <= range[1]) {
          ++count;
        }
      }
      w = new double[count];
      f = new double[count];
      int k = 0;
      for (int i = 0; i < grid.length; ++i) {
        if (grid[i] >= range[0] && grid[i] <= range[1]) {
          w[k] = grid[i];
          f[k] = flux[i];
          ++k;
        }
      }
    }
    if (step == null) {
      return new Spectrum(w, f);
    }
    if (w.length < 2) {
      throw new IllegalArgumentException(
          "Cannot resample a spectrum of " + w.length + " point(s) in range "
              + Arrays.toString(range));
    }
    // half a step past the end so that a last point falling on the new sampling is kept
    double[] resampled = NumericUtils.arange(w[0], w[w.length - 1] + step * 0.5, step);
    return new Spectrum(resampled, AxisInterpolator.locate(w, resampled).interpolate(f));
  }

  /**
   * Doppler shift a spectrum sampled on an evenly spaced wavelength grid. The flux observed at
   * wavelength w is the rest-frame flux at w * sqrt((1 - v/c) / (1 + v/c)), linearly interpolated.
   *
   * @param spectrum Rest-frame flux at each wavelength
   * @param wavelengths Evenly spaced wavelengths
   * @param velocity Line-of-sight velocity in m/s, positive away from the observer
   * @return Shifted flux on the same wavelengths
   */
  public static double[] shiftSpectrum(double[] spectrum, double[] wavelengths, double velocity) {
    if (wavelengths.length < 2) {
      throw new IllegalArgumentException("Spectrum needs at least 2 wavelengths to be shifted");
    }
    double beta = velocity / SPEED_OF_LIGHT;
    double factor = FastMath.sqrt((1. - beta) / (1. + beta));
    double[] rest = new double[wavelengths.length];
    for (int i = 0; i < rest.length; ++i) {
      rest[i] = wavelengths[i] * factor;
    }
    double start = wavelengths[0];
    double step = wavelengths[1] - wavelengths[0];
    return AxisInterpolator.locateEvenlySpaced(start, step, wavelengths.length, rest)
        .interpolate(spectrum);
  }

  /**
   * Doppler boosting factor of a spectrum in a band: the spectrum is shifted over a range of
   * velocities, the photon-weighted band flux (including the relativistic beaming term) is
   * computed for each, normalized at zero velocity, and the slope of a line through 1 against v/c
   * is returned.
   *
   * @param spectrum Flux density sampled at the wavelengths
   * @param bandpass Filter transmission sampled at the wavelengths
   * @param wavelengths Evenly spaced wavelengths (angstrom)
   * @param maxVelocity Largest velocity sampled, in m/s
   * @param velocityStep Velocity sampling, in m/s
   * @return Boosting factor, such that F(v) = F(0) * (1 + factor * v/c)
   */
  public static double dopplerBoostFactor(double[] spectrum, double[] bandpass,
      double[] wavelengths, double maxVelocity, double velocityStep) {
    if (spectrum.length != wavelengths.length || bandpass.length != wavelengths.length) {
      throw new IllegalArgumentException("Spectrum (" + spectrum.length + "), bandpass ("
          + bandpass.length + ") and wavelengths (" + wavelengths.length
          + ") must have the same length");
    }
    if (!(maxVelocity > 0.)) {
      throw new IllegalArgumentException("Maximum velocity must be positive, got " + maxVelocity);
    }
    double[] velocities =
        NumericUtils.arange(-maxVelocity, maxVelocity + velocityStep, velocityStep);
    double[] beta = new double[velocities.length];
    double[] bandFlux = new double[velocities.length];
    for (int k = 0; k < velocities.length; ++k) {
      beta[k] = velocities[k] / SPEED_OF_LIGHT;
      double[] shifted = shiftSpectrum(spectrum, wavelengths, velocities[k]);
      double beaming = FastMath.pow(1. - beta[k], 5);
      double sum = 0.;
      for (int i = 0; i < wavelengths.length; ++i) {
        sum += shifted[i] * bandpass[i] * wavelengths[i] / beaming;
      }
      bandFlux[k] = sum;
    }

    double reference = bandFlux[velocities.length / 2];
    if (reference == 0.) {
      throw new IllegalArgumentException("Spectrum has no flux in the bandpass");
    }
    for (int k = 0; k < bandFlux.length; ++k) {
      bandFlux[k] /= reference;
    }
    double boost = LinearFit.fit(bandFlux, beta, null, 1., null).getSlope();
    logger.debug("Doppler boosting factor over +/-" + maxVelocity + " m/s: " + boost);
    return boost;
  }

  /**
   * Doppler boosting factor using the velocity range and step from the configuration
   * (DopplerBoost.MaxVelocity, DopplerBoost.VelocityStep)
   *
   * @param spectrum Flux density sampled at the wavelengths
   * @param bandpass Filter transmission sampled at the wavelengths
   * @param wavelengths Evenly spaced wavelengths (angstrom)
   * @return Boosting factor
   */
  public static double dopplerBoostFactor(double[] spectrum, double[] bandpass,
      double[] wavelengths) {
    FitConfiguration config = FitConfiguration.getInstance();
    return dopplerBoostFactor(spectrum, bandpass, wavelengths,
        config.getMaxBoostVelocity(), config.getBoostVelocityStep());
  }

  private static double[] transmission(UnivariateFunction filter, double[] grid) {
    double[] band = new double[grid.length];
    for (int i = 0; i < grid.length; ++i) {
      band[i] = filter.value(grid[i]);
    }
    return band;
  }

  private static double ratio(double[] numerator, double[] denominator, double[] grid) {
    double norm = NumericUtils.trapezoid(denominator, grid);
    if (norm == 0.) {
      throw new IllegalArgumentException("Filter has no transmission over the spectrum grid");
    }
    return NumericUtils.trapezoid(numerator, grid) / norm;
  }
}
