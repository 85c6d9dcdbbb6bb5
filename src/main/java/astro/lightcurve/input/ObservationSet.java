package astro.lightcurve.input;

import astro.lightcurve.input.DatasetRecord.Representation;
import astro.lightcurve.utils.UnitConverter;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.util.Pair;

/**
 * Immutable collection of normalized datasets, built in one step from the records read from an
 * observation file and the atmosphere grids matching them (one grid per record, same order).
 *
 * Construction derives each dataset's missing representation (flux from magnitudes or magnitudes
 * from flux, through the asinh relations when the dataset has a non-zero softening), computes the
 * grouping of datasets that share a band identifier and builds the aggregated observation arrays.
 * Nothing is recomputed afterwards.
 */
public class ObservationSet {

  private final List<Dataset> datasets;
  private final List<AtmosphereGrid> grids;
  private final int[] grouping;
  private final AggregatedObservations aggregated;

  /**
   * Normalize the given records against their atmosphere grids.
   *
   * @param records Datasets as read from file
   * @param grids Atmosphere grid for each dataset, in the same order
   * @throws DatasetCountMismatchException if there are not as many grids as datasets
   */
  public ObservationSet(List<DatasetRecord> records, List<AtmosphereGrid> grids)
      throws DatasetCountMismatchException {
    if (records.size() != grids.size()) {
      throw new DatasetCountMismatchException(records.size(), grids.size());
    }
    List<Dataset> normalized = new ArrayList<>();
    for (int i = 0; i < records.size(); ++i) {
      normalized.add(normalize(records.get(i), grids.get(i)));
    }
    this.datasets = Collections.unmodifiableList(normalized);
    this.grids = Collections.unmodifiableList(new ArrayList<>(grids));
    this.grouping = computeGrouping(datasets);
    this.aggregated = new AggregatedObservations(datasets);
  }

  /**
   * Read the observation file and normalize its datasets against the given grids.
   *
   * @param observationFile Observation file (7, 8 or 9 column layout)
   * @param grids Atmosphere grid for each dataset, in file order
   * @return Normalized observations
   * @throws IOException if the observation file or a data table is unreadable or malformed
   * @throws DatasetCountMismatchException if there are not as many grids as datasets
   */
  public static ObservationSet fromFile(File observationFile, List<AtmosphereGrid> grids)
      throws IOException, DatasetCountMismatchException {
    return new ObservationSet(ObservationReader.read(observationFile), grids);
  }

  /**
   * Derive the missing magnitude or flux representation of a dataset.
   *
   * @param record Dataset as read from file
   * @param grid Atmosphere grid of the dataset's band, giving the zero-point flux
   * @return Normalized dataset
   */
  static Dataset normalize(DatasetRecord record, AtmosphereGrid grid) {
    double zeroPoint = grid.getZeroPointFlux();
    double softening = record.getSoftening();
    if (record.getRepresentation() == Representation.MAGNITUDE) {
      Pair<double[], double[]> flux =
          UnitConverter.asinhToFlux(record.getValues(), record.getErrors(), zeroPoint, softening);
      return new Dataset(record, record.getValues(), record.getErrors(),
          flux.getFirst(), flux.getSecond(), grid);
    }
    Pair<double[], double[]> mag =
        UnitConverter.fluxToAsinh(record.getValues(), record.getErrors(), zeroPoint, softening);
    return new Dataset(record, mag.getFirst(), mag.getSecond(),
        record.getValues(), record.getErrors(), grid);
  }

  /**
   * For every dataset, find the first dataset carrying the same identifier. Datasets in the same
   * group are observations of the same band, whose model only needs to be evaluated once.
   *
   * @param datasets Datasets in order
   * @return grouping[i] = smallest j &lt;= i such that datasets j and i share their identifier
   */
  static int[] computeGrouping(List<Dataset> datasets) {
    int[] grouping = new int[datasets.size()];
    for (int i = 0; i < grouping.length; ++i) {
      grouping[i] = i;
      for (int j = 0; j < i; ++j) {
        if (datasets.get(j).getId().equals(datasets.get(i).getId())) {
          grouping[i] = j;
          break;
        }
      }
    }
    return grouping;
  }

  public List<Dataset> getDatasets() {
    return datasets;
  }

  public Dataset getDataset(int index) {
    return datasets.get(index);
  }

  public List<AtmosphereGrid> getAtmosphereGrids() {
    return grids;
  }

  public AtmosphereGrid getAtmosphereGrid(int index) {
    return grids.get(index);
  }

  /**
   * @return Copy of the grouping array; see {@link #computeGrouping(List)}
   */
  public int[] getGrouping() {
    return grouping.clone();
  }

  public int getGroup(int index) {
    return grouping[index];
  }

  public AggregatedObservations getAggregated() {
    return aggregated;
  }

  /**
   * @return Extinction coefficient of each dataset
   */
  public double[] getExtinctionCoefficients() {
    double[] ext = new double[datasets.size()];
    for (int i = 0; i < ext.length; ++i) {
      ext[i] = datasets.get(i).getExtinctionCoefficient();
    }
    return ext;
  }

  /**
   * @return Calibration error (magnitudes) of each dataset
   */
  public double[] getCalibrationErrors() {
    double[] calib = new double[datasets.size()];
    for (int i = 0; i < calib.length; ++i) {
      calib[i] = datasets.get(i).getCalibrationError();
    }
    return calib;
  }

  public int size() {
    return datasets.size();
  }
}
