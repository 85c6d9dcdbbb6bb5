package astro.lightcurve.filter;

import static astro.lightcurve.utils.NumericUtils.ANGSTROM;
import static astro.lightcurve.utils.NumericUtils.SPEED_OF_LIGHT;

import astro.lightcurve.input.FitConfiguration;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.log4j.Logger;

/**
 * Transmission curve of a photometric filter, interpolated with a cubic spline so that it can be
 * multiplied directly with a spectrum sampled on any grid. Outside the tabulated range the
 * transmission is zero.
 *
 * Filter files have two whitespace-delimited columns, wavelength in angstrom (strictly ascending)
 * and transmission; further columns are ignored. In the frequency domain the curve is indexed by
 * frequency in Hz instead, which reverses the order of the table.
 */
public class FilterResponse implements UnivariateFunction {

  private static final Logger logger = Logger.getLogger(FilterResponse.class);

  private final String name;
  private final boolean frequencyDomain;
  private final PolynomialSplineFunction spline;
  private final double lowerBound;
  private final double upperBound;

  /**
   * Filter response from a tabulated curve.
   *
   * @param name Name of the filter, for messages
   * @param wavelengths Wavelengths in angstrom, strictly ascending, at least 3 points
   * @param transmission Transmission at each wavelength
   * @param frequencyDomain Whether to index the curve by frequency (Hz) rather than wavelength
   * @throws IllegalArgumentException if the table is too short or not strictly ascending
   */
  public FilterResponse(String name, double[] wavelengths, double[] transmission,
      boolean frequencyDomain) {
    if (wavelengths.length != transmission.length) {
      throw new IllegalArgumentException("Filter " + name + " has " + wavelengths.length
          + " wavelengths but " + transmission.length + " transmission values");
    }
    if (wavelengths.length < 3) {
      throw new IllegalArgumentException(
          "Filter " + name + " needs at least 3 points for cubic interpolation");
    }
    for (int i = 1; i < wavelengths.length; ++i) {
      if (!(wavelengths[i] > wavelengths[i - 1])) {
        throw new IllegalArgumentException("Filter " + name + " wavelengths are not strictly "
            + "ascending at row " + i + " (" + wavelengths[i - 1] + ", " + wavelengths[i] + ")");
      }
    }

    this.name = name;
    this.frequencyDomain = frequencyDomain;
    int n = wavelengths.length;
    double[] x = new double[n];
    double[] y = new double[n];
    if (frequencyDomain) {
      // ascending wavelength is descending frequency
      for (int i = 0; i < n; ++i) {
        x[i] = SPEED_OF_LIGHT / (wavelengths[n - 1 - i] * ANGSTROM);
        y[i] = transmission[n - 1 - i];
      }
    } else {
      System.arraycopy(wavelengths, 0, x, 0, n);
      System.arraycopy(transmission, 0, y, 0, n);
    }
    this.spline = new SplineInterpolator().interpolate(x, y);
    this.lowerBound = x[0];
    this.upperBound = x[n - 1];
  }

  /**
   * Load a filter response file in the domain given by the configuration
   * (Filter.FrequencyDomain)
   *
   * @param filterFile Two-column file of wavelength (angstrom) and transmission
   * @return Interpolated filter response
   * @throws IOException if the file cannot be read
   * @throws FilterFormatException if the file is not a valid filter table
   */
  public static FilterResponse load(File filterFile) throws IOException {
    return load(filterFile, FitConfiguration.getInstance().isFilterFrequencyDomain());
  }

  /**
   * Load a filter response file.
   *
   * @param filterFile Two-column file of wavelength (angstrom) and transmission
   * @param frequencyDomain Whether to index the curve by frequency (Hz) rather than wavelength
   * @return Interpolated filter response
   * @throws IOException if the file cannot be read
   * @throws FilterFormatException if the file is not a valid filter table
   */
  public static FilterResponse load(File filterFile, boolean frequencyDomain)
      throws IOException {
    List<Double> wavelengths = new ArrayList<>();
    List<Double> transmission = new ArrayList<>();
    try (BufferedReader br = new BufferedReader(new FileReader(filterFile))) {
      String line;
      int lineNumber = 0;
      while ((line = br.readLine()) != null) {
        ++lineNumber;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        String[] args = trimmed.split("\\s+");
        if (args.length < 2) {
          throw new FilterFormatException("Filter file " + filterFile.getName() + ", line "
              + lineNumber + ": expected wavelength and transmission, got " + args.length
              + " column(s)");
        }
        try {
          wavelengths.add(Double.parseDouble(args[0]));
          transmission.add(Double.parseDouble(args[1]));
        } catch (NumberFormatException e) {
          throw new FilterFormatException("Filter file " + filterFile.getName() + ", line "
              + lineNumber + ": values could not be parsed", e);
        }
      }
    }

    double[] w = new double[wavelengths.size()];
    double[] t = new double[transmission.size()];
    for (int i = 0; i < w.length; ++i) {
      w[i] = wavelengths.get(i);
      t[i] = transmission.get(i);
    }
    FilterResponse response;
    try {
      response = new FilterResponse(filterFile.getName(), w, t, frequencyDomain);
    } catch (IllegalArgumentException e) {
      throw new FilterFormatException(e.getMessage(), e);
    }
    logger.info("Loaded filter " + filterFile.getName() + ": " + w.length + " points, "
        + (frequencyDomain ? "frequency" : "wavelength") + " domain");
    return response;
  }

  /**
   * @param x Wavelength (angstrom) or frequency (Hz), according to the domain of this filter
   * @return Interpolated transmission, 0 outside the tabulated range
   */
  @Override
  public double value(double x) {
    if (x < lowerBound || x > upperBound || Double.isNaN(x)) {
      return 0.;
    }
    return spline.value(x);
  }

  /**
   * @param x Wavelengths (angstrom) or frequencies (Hz), according to the domain of this filter
   * @return Interpolated transmission at each point
   */
  public double[] value(double[] x) {
    double[] result = new double[x.length];
    for (int i = 0; i < x.length; ++i) {
      result[i] = value(x[i]);
    }
    return result;
  }

  public String getName() {
    return name;
  }

  public boolean isFrequencyDomain() {
    return frequencyDomain;
  }

  public double getLowerBound() {
    return lowerBound;
  }

  public double getUpperBound() {
    return upperBound;
  }

  /**
   * Exception thrown when a filter file is not a valid two-column ascending table
   */
  public static class FilterFormatException extends IOException {

    private static final long serialVersionUID = -3198561250742387012L;

    public FilterFormatException(String message) {
      super(message);
    }

    public FilterFormatException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
