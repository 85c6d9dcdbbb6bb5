package astro.lightcurve.utils;

/**
 * Thrown when an asinh magnitude conversion is given a negative softening parameter.
 */
public class InvalidSofteningException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public InvalidSofteningException(double softening) {
    super("Softening parameter must be non-negative, got " + softening);
  }
}
