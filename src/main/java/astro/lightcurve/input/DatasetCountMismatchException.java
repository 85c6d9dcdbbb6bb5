package astro.lightcurve.input;

/**
 * Thrown when the number of observed datasets does not match the number of atmosphere grids
 * supplied for them. Each dataset needs exactly one grid, in the same order.
 */
public class DatasetCountMismatchException extends Exception {

  private static final long serialVersionUID = 1L;

  public DatasetCountMismatchException(int datasets, int grids) {
    super("The number of atmosphere grids (" + grids + ") and datasets (" + datasets
        + ") do not match");
  }
}
