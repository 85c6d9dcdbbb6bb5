package astro.lightcurve.input;

import java.io.File;
import java.io.IOException;

/**
 * Loads the atmosphere grid for one band from the file named in an atmosphere list file.
 */
public interface AtmosphereGridReader {

  /**
   * @param bandName Band name given in the list file
   * @param gridFile Grid file given in the list file
   * @return Loaded atmosphere grid
   * @throws IOException if the grid cannot be read
   */
  AtmosphereGrid read(String bandName, File gridFile) throws IOException;
}
