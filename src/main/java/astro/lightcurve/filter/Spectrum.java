package astro.lightcurve.filter;

/**
 * Spectrum sampled on a grid of wavelengths (angstrom) or frequencies (Hz).
 */
public class Spectrum {

  private final double[] grid;
  private final double[] flux;

  public Spectrum(double[] grid, double[] flux) {
    if (grid.length != flux.length) {
      throw new IllegalArgumentException(
          "Spectrum has " + grid.length + " grid points but " + flux.length + " flux values");
    }
    this.grid = grid;
    this.flux = flux;
  }

  public double[] getGrid() {
    return grid;
  }

  public double[] getFlux() {
    return flux;
  }

  public int size() {
    return grid.length;
  }
}
