package astro.lightcurve.input;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.ConversionException;
import org.apache.commons.configuration.PropertiesConfiguration;
import org.apache.log4j.Logger;

/**
 * Atmosphere grid that only carries the photometric metadata of a band, read from a properties
 * file of the form
 * <pre>
 * zp = 3.631e-20
 * ext = 0.479
 * </pre>
 * where zp is the zero-point flux and ext the extinction coefficient relative to the V band.
 * This is sufficient for the normalization and chi-square stages, which never touch the
 * intensity tables themselves.
 */
public class MetadataAtmosphereGrid implements AtmosphereGrid {

  /**
   * Reader suitable for {@link AtmosphereGridList#read(File, AtmosphereGridReader)}
   */
  public static final AtmosphereGridReader READER = MetadataAtmosphereGrid::load;

  static final String ZERO_POINT_KEY = "zp";
  static final String EXTINCTION_KEY = "ext";

  private static final Logger logger = Logger.getLogger(MetadataAtmosphereGrid.class);

  private final String name;
  private final double zeroPointFlux;
  private final double extinctionCoefficient;

  public MetadataAtmosphereGrid(String name, double zeroPointFlux, double extinctionCoefficient) {
    this.name = name;
    this.zeroPointFlux = zeroPointFlux;
    this.extinctionCoefficient = extinctionCoefficient;
  }

  /**
   * Load the metadata of a band from a properties file
   *
   * @param name Band name
   * @param file Properties file holding the zp and ext keys
   * @return Grid holding the file's zero point and extinction coefficient
   * @throws IOException if the file cannot be parsed or lacks one of the keys
   */
  public static MetadataAtmosphereGrid load(String name, File file) throws IOException {
    if (!file.isFile()) {
      throw new FileNotFoundException("Atmosphere metadata file not found: " + file.getPath());
    }
    PropertiesConfiguration config;
    try {
      config = new PropertiesConfiguration(file);
    } catch (ConfigurationException e) {
      throw new IOException("Could not read atmosphere metadata from " + file.getName(), e);
    }
    if (!config.containsKey(ZERO_POINT_KEY) || !config.containsKey(EXTINCTION_KEY)) {
      throw new ObservationFormatException("Atmosphere metadata " + file.getName()
          + " must define both '" + ZERO_POINT_KEY + "' and '" + EXTINCTION_KEY + "'");
    }
    double zeroPoint;
    double extinction;
    try {
      zeroPoint = config.getDouble(ZERO_POINT_KEY);
      extinction = config.getDouble(EXTINCTION_KEY);
    } catch (ConversionException e) {
      throw new ObservationFormatException(
          "Non-numeric atmosphere metadata in " + file.getName(), e);
    }
    logger.info("Band " + name + ": zero point " + zeroPoint + ", extinction " + extinction);
    return new MetadataAtmosphereGrid(name, zeroPoint, extinction);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public double getZeroPointFlux() {
    return zeroPointFlux;
  }

  @Override
  public double getExtinctionCoefficient() {
    return extinctionCoefficient;
  }
}
