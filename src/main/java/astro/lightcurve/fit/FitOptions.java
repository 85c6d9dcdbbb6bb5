package astro.lightcurve.fit;

import astro.lightcurve.input.FitConfiguration;

/**
 * Settings of a chi-square evaluation. Instances are immutable; each {@code with...} method
 * returns a modified copy.
 *
 * <ul>
 * <li>offsetFree: if false, the model (shifted by DM and A_V) is compared to the data directly; if
 * true, each band first gets its own best-fit offset and those offsets are then fit against the
 * bands' extinction coefficients, weighted by the calibration errors.</li>
 * <li>distanceModulus, extinction: nuisance values to hold fixed, or null to fit them.</li>
 * <li>sampleCount: evaluate the model at this many evenly spaced phases and interpolate onto the
 * observations, or null to evaluate at every observed phase.</li>
 * <li>inFluxDomain: fit band offsets as flux ratios rather than magnitude differences. Only
 * affects offset-free fits.</li>
 * </ul>
 */
public class FitOptions {

  private final boolean offsetFree;
  private final Double distanceModulus;
  private final Double extinction;
  private final Integer sampleCount;
  private final boolean inFluxDomain;

  private FitOptions(boolean offsetFree, Double distanceModulus, Double extinction,
      Integer sampleCount, boolean inFluxDomain) {
    if (sampleCount != null && sampleCount < 1) {
      throw new IllegalArgumentException("Sample count must be positive, got " + sampleCount);
    }
    this.offsetFree = offsetFree;
    this.distanceModulus = distanceModulus;
    this.extinction = extinction;
    this.sampleCount = sampleCount;
    this.inFluxDomain = inFluxDomain;
  }

  /**
   * Options with band offsets free, DM = 0, A_V = 0, no resampling, magnitude domain
   * @return default options
   */
  public static FitOptions create() {
    return new FitOptions(true, 0., 0., null, false);
  }

  /**
   * Options taking their offset mode and sampling from the configuration file, with DM = 0 and
   * A_V = 0 and the magnitude domain
   * @param config Configuration to read defaults from
   * @return configured options
   */
  public static FitOptions fromConfiguration(FitConfiguration config) {
    Integer samples = config.getSampleCount() > 0 ? config.getSampleCount() : null;
    return new FitOptions(config.isOffsetFree(), 0., 0., samples, false);
  }

  public FitOptions withOffsetFree(boolean offsetFree) {
    return new FitOptions(offsetFree, distanceModulus, extinction, sampleCount, inFluxDomain);
  }

  /**
   * @param distanceModulus Distance modulus to hold fixed, or null to fit it
   * @return modified copy
   */
  public FitOptions withDistanceModulus(Double distanceModulus) {
    return new FitOptions(offsetFree, distanceModulus, extinction, sampleCount, inFluxDomain);
  }

  /**
   * @param extinction V-band extinction to hold fixed, or null to fit it
   * @return modified copy
   */
  public FitOptions withExtinction(Double extinction) {
    return new FitOptions(offsetFree, distanceModulus, extinction, sampleCount, inFluxDomain);
  }

  /**
   * @param sampleCount Number of model phases to interpolate from, or null for none
   * @return modified copy
   */
  public FitOptions withSampleCount(Integer sampleCount) {
    return new FitOptions(offsetFree, distanceModulus, extinction, sampleCount, inFluxDomain);
  }

  public FitOptions withFluxDomain(boolean inFluxDomain) {
    return new FitOptions(offsetFree, distanceModulus, extinction, sampleCount, inFluxDomain);
  }

  public boolean isOffsetFree() {
    return offsetFree;
  }

  public Double getDistanceModulus() {
    return distanceModulus;
  }

  public Double getExtinction() {
    return extinction;
  }

  public Integer getSampleCount() {
    return sampleCount;
  }

  public boolean isInFluxDomain() {
    return inFluxDomain;
  }
}
