package astro.lightcurve.input;

/**
 * One band's observations exactly as read from the observation file and its data table: phases
 * after the phase-zero shift (and reduction, where applicable), plus either magnitudes or fluxes
 * with their errors. The other representation is only derived once the band's atmosphere grid is
 * known; see {@link ObservationSet}.
 */
public class DatasetRecord {

  /**
   * Which quantity the value and error columns of the data table hold
   */
  public enum Representation {
    MAGNITUDE("mag"),
    FLUX("flux");

    private final String flag;

    Representation(String flag) {
      this.flag = flag;
    }

    /**
     * @return Flag used for this representation in 9-column observation files
     */
    public String getFlag() {
      return flag;
    }

    /**
     * @param flag Flag read from an observation file
     * @return Matching representation, or null if the flag is not recognized
     */
    public static Representation fromFlag(String flag) {
      for (Representation representation : values()) {
        if (representation.flag.equals(flag)) {
          return representation;
        }
      }
      return null;
    }
  }

  private final String id;
  private final String fileName;
  private final double[] phase;
  private final double[] values;
  private final double[] errors;
  private final Representation representation;
  private final double calibrationError;
  private final double softening;

  public DatasetRecord(String id, String fileName, double[] phase, double[] values,
      double[] errors, Representation representation, double calibrationError,
      double softening) {
    if (phase.length != values.length || phase.length != errors.length) {
      throw new IllegalArgumentException("Dataset " + id + " has " + phase.length + " phases, "
          + values.length + " values and " + errors.length + " errors");
    }
    this.id = id;
    this.fileName = fileName;
    this.phase = phase.clone();
    this.values = values.clone();
    this.errors = errors.clone();
    this.representation = representation;
    this.calibrationError = calibrationError;
    this.softening = softening;
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

  /**
   * @return Magnitudes or fluxes, depending on {@link #getRepresentation()}
   */
  public double[] getValues() {
    return values.clone();
  }

  public double[] getErrors() {
    return errors.clone();
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

  public int size() {
    return phase.length;
  }
}
