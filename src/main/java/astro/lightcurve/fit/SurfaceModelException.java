package astro.lightcurve.fit;

/**
 * Raised by a {@link SurfaceModel} that cannot build or integrate a surface, e.g., for a parameter
 * set describing an unphysical geometry. The fitting code lets it propagate unchanged; it aborts
 * the current evaluation only.
 */
public class SurfaceModelException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public SurfaceModelException(String message) {
    super(message);
  }

  public SurfaceModelException(String message, Throwable cause) {
    super(message, cause);
  }
}
