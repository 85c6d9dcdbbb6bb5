package astro.lightcurve.fit;

/**
 * Thrown when fit options are requested together that the fit cannot honour, such as residuals
 * from a flux-domain offset fit (the fitted flux ratios do not define magnitude residuals).
 */
public class UnsupportedCombinationException extends UnsupportedOperationException {

  private static final long serialVersionUID = 1L;

  public UnsupportedCombinationException(String message) {
    super(message);
  }
}
