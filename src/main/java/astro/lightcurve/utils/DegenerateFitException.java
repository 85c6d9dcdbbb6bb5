package astro.lightcurve.utils;

/**
 * Thrown when a weighted least-squares problem cannot be solved for the requested number of free
 * parameters, e.g., a band where every point has zero weight, a single point with both slope and
 * intercept free, or an abscissa with no spread.
 */
public class DegenerateFitException extends ArithmeticException {

  private static final long serialVersionUID = 1L;

  public DegenerateFitException(String message) {
    super(message);
  }
}
