package astro.lightcurve.input;

import java.io.File;
import java.net.MalformedURLException;
import java.net.URL;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file holding the defaults used by the fitting and band-integration code when a
 * caller does not give explicit values: the light-curve sampling, whether band offsets are free,
 * the number of phases used to estimate the effective velocity semi-amplitude, the velocity range
 * used to estimate Doppler boosting and the domain filters are loaded into.
 *
 * The file is looked up in the working directory first and otherwise read from the copy embedded
 * in the jar. Values missing from the file keep their defaults.
 */
public class FitConfiguration {

  private static FitConfiguration instance;

  static final String DEFAULT_CONFIG_PATH = "lightcurve-config.xml";
  private static final Logger logger = Logger.getLogger(FitConfiguration.class);

  private String loadedConfigPath = null;

  private int sampleCount = 0; // 0 means model evaluated at each observed phase
  private boolean offsetFree = true;
  private int velocityPhases = 20;
  private double maxBoostVelocity = 500E3; // m/s
  private double boostVelocityStep = 1E3; // m/s
  private boolean filterFrequencyDomain = true;

  /**
   * Configuration holding only the default values
   */
  FitConfiguration() {
  }

  FitConfiguration(URL configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      sampleCount = config.getInt("Fitting.SampleCount", sampleCount);
      offsetFree = config.getBoolean("Fitting.OffsetFree", offsetFree);
      velocityPhases = config.getInt("Fitting.VelocityPhases", velocityPhases);
      maxBoostVelocity = config.getDouble("DopplerBoost.MaxVelocity", maxBoostVelocity);
      boostVelocityStep = config.getDouble("DopplerBoost.VelocityStep", boostVelocityStep);
      filterFrequencyDomain =
          config.getBoolean("Filter.FrequencyDomain", filterFrequencyDomain);

      loadedConfigPath = configLocation.toString();
      logger.info("Successfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   * @return the current configuration instance
   */
  synchronized public static FitConfiguration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists. If the file does not exist, the configuration embedded in the jar is used instead.
   * @param configLocation Configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static FitConfiguration getInstance(String configLocation) {
    if (instance == null) {
      instance = load(configLocation);
    }
    return instance;
  }

  /**
   * Read a configuration from the given file without touching the shared instance.
   * @param configLocation Configuration file location to read from
   * @return configuration read from the file, the embedded file, or the defaults, in that order
   */
  public static FitConfiguration load(String configLocation) {
    File config = new File(configLocation);
    if (config.exists()) {
      try {
        return new FitConfiguration(config.toURI().toURL());
      } catch (MalformedURLException e) {
        logger.warn("Could not convert config location to URL: " + configLocation, e);
      }
    } else {
      logger.warn("Could not find config file at " + configLocation + ", using embedded config");
    }
    URL embedded = FitConfiguration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
    if (embedded == null) {
      logger.error("Major error: config XML file not part of resources!!");
      return new FitConfiguration();
    }
    return new FitConfiguration(embedded);
  }

  /**
   * @return Location the configuration was read from, or null if only defaults are in use
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Number of evenly spaced phases the model light curve is sampled at before being interpolated
   * onto the observed phases. The property is defined from Fitting.SampleCount.
   * @return Sample count, or 0 to evaluate the model at every observed phase
   */
  public int getSampleCount() {
    return sampleCount;
  }

  /**
   * Whether each band gets a free calibration offset by default (Fitting.OffsetFree)
   * @return true if band offsets are free by default
   */
  public boolean isOffsetFree() {
    return offsetFree;
  }

  /**
   * Number of phases used to fit the effective velocity semi-amplitude (Fitting.VelocityPhases)
   * @return number of phases
   */
  public int getVelocityPhases() {
    return velocityPhases;
  }

  /**
   * Largest line-of-sight velocity sampled when estimating Doppler boosting, in m/s
   * (DopplerBoost.MaxVelocity)
   * @return maximum velocity
   */
  public double getMaxBoostVelocity() {
    return maxBoostVelocity;
  }

  /**
   * Velocity sampling interval when estimating Doppler boosting, in m/s
   * (DopplerBoost.VelocityStep)
   * @return velocity step
   */
  public double getBoostVelocityStep() {
    return boostVelocityStep;
  }

  /**
   * Whether filter responses are loaded in the frequency domain by default
   * (Filter.FrequencyDomain)
   * @return true for frequency (Hz), false for wavelength (angstrom)
   */
  public boolean isFilterFrequencyDomain() {
    return filterFrequencyDomain;
  }
}
