package astro.lightcurve.input;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Reads the list of atmosphere grids, one per observed dataset. Each non-comment line of the list
 * file names a band and the file holding its grid:
 * <pre>
 * # band  grid-file
 * i       atmo_i.txt
 * g       atmo_g.txt
 * </pre>
 * Lines starting with '#' and blank lines are ignored. Relative grid filenames are resolved against
 * the directory of the list file. The order of the lines must match the order of the datasets in
 * the observation file.
 */
public class AtmosphereGridList {

  private static final Logger logger = Logger.getLogger(AtmosphereGridList.class);

  /**
   * Read every grid named in the list file.
   *
   * @param listFile Atmosphere list file
   * @param reader Reader used to load each named grid
   * @return Grids in file order (unmodifiable)
   * @throws IOException if the list file or one of the grids cannot be read
   * @throws ObservationFormatException if a line does not have at least two columns
   */
  public static List<AtmosphereGrid> read(File listFile, AtmosphereGridReader reader)
      throws IOException {
    List<AtmosphereGrid> grids = new ArrayList<>();
    File parent = listFile.getAbsoluteFile().getParentFile();

    try (BufferedReader br = new BufferedReader(new FileReader(listFile))) {
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
          throw new ObservationFormatException("Line " + lineNumber + " of atmosphere list "
              + listFile.getName() + " needs a band name and a grid filename");
        }
        File gridFile = new File(args[1]);
        if (!gridFile.isAbsolute()) {
          gridFile = new File(parent, args[1]);
        }
        grids.add(reader.read(args[0], gridFile));
      }
    }

    logger.info("Read " + grids.size() + " atmosphere grid(s) from " + listFile.getName());
    return Collections.unmodifiableList(grids);
  }
}
