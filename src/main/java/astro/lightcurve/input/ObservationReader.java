package astro.lightcurve.input;

import astro.lightcurve.input.DatasetRecord.Representation;
import astro.lightcurve.utils.NumericUtils;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Reads an observation file describing one photometric dataset per line, along with the data
 * tables each line references. Three layouts are supported, distinguished by their column count:
 * <pre>
 * 7: name phase-col mag-col err-col phase-shift calib-err data-file
 * 8: name phase-col mag-col err-col phase-shift calib-err softening data-file
 * 9: name phase-col value-col err-col phase-shift calib-err softening mag|flux data-file
 * </pre>
 * Column ids are zero-based indices into the whitespace-delimited data table. Calibration errors
 * are in magnitudes. A softening of 0 means standard (non-asinh) magnitudes. Lines starting with
 * '#' and blank lines are skipped, both in the observation file and in the data tables.
 *
 * Phases are shifted by the phase-zero offset and reduced modulo 1, except for datasets whose name
 * contains the long-term coherence marker '_', which keep their unwrapped phases.
 */
public class ObservationReader {

  /**
   * A dataset name containing this character keeps its phases unwrapped (not taken modulo 1)
   */
  public static final char COHERENCE_MARKER = '_';

  private static final Logger logger = Logger.getLogger(ObservationReader.class);

  /**
   * Read every dataset described in the observation file. Relative data table filenames are
   * resolved against the observation file's directory.
   *
   * @param observationFile File listing the datasets
   * @return Records in file order (unmodifiable)
   * @throws ObservationFormatException If a line or data table does not have the expected layout
   * @throws IOException If a file cannot be read
   */
  public static List<DatasetRecord> read(File observationFile) throws IOException {
    List<DatasetRecord> records = new ArrayList<>();
    File parent = observationFile.getAbsoluteFile().getParentFile();

    try (BufferedReader br = new BufferedReader(new FileReader(observationFile))) {
      String line;
      int lineNumber = 0;
      while ((line = br.readLine()) != null) {
        ++lineNumber;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        String where = observationFile.getName() + ", line " + lineNumber;
        records.add(parseRecord(trimmed.split("\\s+"), parent, where));
      }
    }
    return Collections.unmodifiableList(records);
  }

  /**
   * Parse one observation line (already split on whitespace) and load its data table.
   *
   * @param args Columns of the line
   * @param parent Directory against which relative data table names are resolved
   * @param where Description of the line's location, used in error messages
   * @return Record for the dataset
   * @throws IOException If the line or its data table is malformed or unreadable
   */
  static DatasetRecord parseRecord(String[] args, File parent, String where) throws IOException {
    String id = args[0];
    double softening = 0.;
    Representation representation = Representation.MAGNITUDE;

    // only the softening and the representation flag differ between the layouts
    switch (args.length) {
      case 7:
        break;
      case 8:
        softening = parseValue(args[6], "softening", id, where);
        break;
      case 9:
        softening = parseValue(args[6], "softening", id, where);
        representation = Representation.fromFlag(args[7]);
        if (representation == null) {
          throw new ObservationFormatException("Dataset " + id + " (" + where
              + "): expected 'mag' or 'flux' flag, found '" + args[7] + "'");
        }
        break;
      default:
        throw new ObservationFormatException("Dataset " + id + " (" + where
            + "): expected 7, 8 or 9 columns, found " + args.length);
    }

    int[] columns = new int[3];
    for (int i = 0; i < columns.length; ++i) {
      try {
        columns[i] = Integer.parseInt(args[i + 1]);
      } catch (NumberFormatException e) {
        throw new ObservationFormatException("Dataset " + id + " (" + where
            + "): column id '" + args[i + 1] + "' is not an integer", e);
      }
      if (columns[i] < 0) {
        throw new ObservationFormatException("Dataset " + id + " (" + where
            + "): column id " + columns[i] + " is negative");
      }
    }
    double phaseShift = parseValue(args[4], "phase shift", id, where);
    double calibrationError = parseValue(args[5], "calibration error", id, where);

    String fileName = args[args.length - 1];
    File dataFile = new File(fileName);
    if (!dataFile.isAbsolute()) {
      dataFile = new File(parent, fileName);
    }
    double[][] table = loadColumns(dataFile, columns, id);

    boolean coherent = id.indexOf(COHERENCE_MARKER) != -1;
    double[] phase = table[0];
    for (int i = 0; i < phase.length; ++i) {
      if (Double.isNaN(phase[i]) || Double.isInfinite(phase[i])) {
        throw new ObservationFormatException("Dataset " + id + " (" + dataFile.getName()
            + "): phase value " + phase[i] + " at row " + i + " is not finite");
      }
      phase[i] -= phaseShift;
      if (!coherent) {
        phase[i] = NumericUtils.reducePhase(phase[i]);
      }
    }

    logger.info("Read dataset " + id + ": " + phase.length + " " + representation.getFlag()
        + " point(s) from " + dataFile.getName());
    return new DatasetRecord(id, fileName, phase, table[1], table[2], representation,
        calibrationError, softening);
  }

  /**
   * Load the selected columns of a whitespace-delimited numeric table.
   *
   * @param dataFile Table to read
   * @param columns Zero-based indices of the columns to keep
   * @param id Dataset the table belongs to, used in error messages
   * @return One array per selected column, in the order requested
   * @throws IOException If the table is unreadable, empty, too narrow or non-numeric
   */
  static double[][] loadColumns(File dataFile, int[] columns, String id) throws IOException {
    List<double[]> rows = new ArrayList<>();
    try (BufferedReader br = new BufferedReader(new FileReader(dataFile))) {
      String line;
      int lineNumber = 0;
      while ((line = br.readLine()) != null) {
        ++lineNumber;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        String[] args = trimmed.split("\\s+");
        double[] row = new double[columns.length];
        for (int i = 0; i < columns.length; ++i) {
          if (columns[i] >= args.length) {
            throw new ObservationFormatException("Dataset " + id + " (" + dataFile.getName()
                + ", line " + lineNumber + "): no column " + columns[i] + " in a row of "
                + args.length + " columns");
          }
          try {
            row[i] = Double.parseDouble(args[columns[i]]);
          } catch (NumberFormatException e) {
            throw new ObservationFormatException("Dataset " + id + " (" + dataFile.getName()
                + ", line " + lineNumber + "): could not parse '" + args[columns[i]] + "'", e);
          }
        }
        rows.add(row);
      }
    }
    if (rows.isEmpty()) {
      throw new ObservationFormatException(
          "Dataset " + id + " (" + dataFile.getName() + "): data table has no rows");
    }

    double[][] table = new double[columns.length][rows.size()];
    for (int j = 0; j < rows.size(); ++j) {
      double[] row = rows.get(j);
      for (int i = 0; i < columns.length; ++i) {
        table[i][j] = row[i];
      }
    }
    return table;
  }

  private static double parseValue(String value, String field, String id, String where)
      throws ObservationFormatException {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new ObservationFormatException("Dataset " + id + " (" + where + "): " + field
          + " '" + value + "' is not a number", e);
    }
  }
}
