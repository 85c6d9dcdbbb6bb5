package astro.lightcurve.fit;

import astro.lightcurve.input.AtmosphereGrid;

/**
 * Model of the irradiated star's surface. Building the surface (Roche geometry, gravity darkening,
 * irradiation) is expensive, so it is done once per parameter set by
 * {@link #makeSurface(SurfaceParameters)}; the flux and velocity at any orbital phase are then
 * integrated over the visible part of that surface.
 *
 * Implementations hold the built surface as mutable state and are not expected to be thread-safe.
 * Failures are reported as {@link SurfaceModelException}.
 */
public interface SurfaceModel {

  /**
   * Creates surface models at a given surface resolution
   */
  interface Factory {

    /**
     * @param resolution Number of surface divisions; sets how coarse or fine the surface grid is
     * @return New, not yet built, surface model
     */
    SurfaceModel create(int resolution);
  }

  /**
   * Build the surface for the given parameters, replacing any previously built surface.
   *
   * @param parameters Physical parameters of the system
   */
  void makeSurface(SurfaceParameters parameters);

  /**
   * Integrated magnitude of the built surface seen at the given orbital phase.
   *
   * @param phase Orbital phase; 0 is the modelled star at inferior conjunction
   * @param grid Atmosphere grid of the band to integrate in
   * @return Apparent magnitude before distance modulus and extinction
   */
  double magnitudeAtPhase(double phase, AtmosphereGrid grid);

  /**
   * Luminosity-weighted line-of-sight velocity of the built surface at the given orbital phase.
   *
   * @param phase Orbital phase
   * @param grid Atmosphere grid of the band used to weight the surface elements
   * @return Velocity in m/s
   */
  double velocityAtPhase(double phase, AtmosphereGrid grid);
}
