package astro.lightcurve.input;

/**
 * Photometric calibration metadata of the atmosphere grid used to model one band. The grid itself
 * (specific intensities as a function of temperature, gravity and emission angle) is consumed by
 * the surface model; the fitting code only needs the band's zero point and extinction.
 */
public interface AtmosphereGrid {

  /**
   * @return Name of the band this grid models
   */
  String getName();

  /**
   * @return Flux of a zero-magnitude source in this band
   */
  double getZeroPointFlux();

  /**
   * @return Extinction in this band per unit of V-band extinction (A_band / A_V)
   */
  double getExtinctionCoefficient();
}
