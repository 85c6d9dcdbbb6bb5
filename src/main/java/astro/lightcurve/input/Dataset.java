package astro.lightcurve.input;

import astro.lightcurve.input.DatasetRecord.Representation;

/**
 * One band's normalized observations: phases, magnitudes and fluxes with their errors, together
 * with the band's calibration error, asinh softening and the extinction coefficient and zero-point
 * flux supplied by its atmosphere grid. Only one of magnitude or flux was read from file (see
 * {@link #getRepresentation()}); the other was derived from it.
 *
 * Datasets are built once by {@link ObservationSet} and are not modified afterwards. Arrays are
 * copied on the way in and on the way out.
 */
public class Dataset {

  private final String id;
  private final String fileName;
  private final double[] phase;
  private final double[] magnitude;
  private final double[] magnitudeError;
  private final double[] flux;
  private final double[] fluxError;
  private final Representation representation;
  private final double calibrationError;
  private final double softening;
  private final double extinctionCoefficient;
  private final double zeroPointFlux;

  Dataset(DatasetRecord record, double[] magnitude, double[] magnitudeError, double[] flux,
      double[] fluxError, AtmosphereGrid grid) {
    this.id = record.getId();
    this.fileName = record.getFileName();
    this.phase = record.getPhase();
    this.representation = record.getRepresentation();
    this.calibrationError = record.getCalibrationError();
    this.softening = record.getSoftening();
    this.magnitude = magnitude.clone();
    this.magnitudeError = magnitudeError.clone();
    this.flux = flux.clone();
    this.fluxError = fluxError.clone();
    this.extinctionCoefficient = grid.getExtinctionCoefficient();
    this.zeroPointFlux = grid.getZeroPointFlux();
  }

  public String getId() {
    return id;
  }

  public String getFileName() {
    return fileName;
  }

  public double[] getPhase() {
    return phase.clone();
  }

  public double[] getMagnitude() {
    return magnitude.clone();
  }

  public double[] getMagnitudeError() {
    return magnitudeError.clone();
  }

  public double[] getFlux() {
    return flux.clone();
  }

  public double[] getFluxError() {
    return fluxError.clone();
  }

  public Representation getRepresentation() {
    return representation;
  }

  public double getCalibrationError() {
    return calibrationError;
  }

  public double getSoftening() {
    return softening;
  }

  public double getExtinctionCoefficient() {
    return extinctionCoefficient;
  }

  public double getZeroPointFlux() {
    return zeroPointFlux;
  }

  /**
   * @return True if phases were kept unwrapped rather than reduced modulo 1
   */
  public boolean isPhaseCoherent() {
    return id.indexOf(ObservationReader.COHERENCE_MARKER) != -1;
  }

  public int size() {
    return phase.length;
  }
}
