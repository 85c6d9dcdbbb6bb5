package astro.lightcurve.input;

import static astro.lightcurve.test.TestUtils.TEST_DATA_LOCATION;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class FitConfigurationTest {

  @Test
  public void readsValuesFromFile() {
    FitConfiguration config =
        FitConfiguration.load(TEST_DATA_LOCATION + "config/lightcurve-config-test.xml");
    assertNotNull(config.getLoadedConfigPath());
    assertEquals(50, config.getSampleCount());
    assertFalse(config.isOffsetFree());
    assertEquals(32, config.getVelocityPhases());
    assertEquals(200E3, config.getMaxBoostVelocity(), 0.);
    assertEquals(2E3, config.getBoostVelocityStep(), 0.);
    assertFalse(config.isFilterFrequencyDomain());
  }

  @Test
  public void missingFileFallsBackToEmbeddedConfig() {
    FitConfiguration config = FitConfiguration.load(TEST_DATA_LOCATION + "no-such-config.xml");
    assertTrue(config.getLoadedConfigPath().endsWith(FitConfiguration.DEFAULT_CONFIG_PATH));
    assertEquals(0, config.getSampleCount());
    assertTrue(config.isOffsetFree());
    assertEquals(20, config.getVelocityPhases());
    assertTrue(config.isFilterFrequencyDomain());
  }

  @Test
  public void defaultsWithoutFile() {
    FitConfiguration config = new FitConfiguration();
    assertNull(config.getLoadedConfigPath());
    assertEquals(500E3, config.getMaxBoostVelocity(), 0.);
    assertEquals(1E3, config.getBoostVelocityStep(), 0.);
  }
}
