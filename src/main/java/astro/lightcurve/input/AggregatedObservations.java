package astro.lightcurve.input;

import astro.lightcurve.utils.NumericUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Concatenation, in dataset order, of every dataset's per-observation arrays. The extinction array
 * repeats each dataset's extinction coefficient once per observation so that a single global line
 * can be fit against it. Built once from the datasets; getters return copies.
 */
public class AggregatedObservations {

  private final double[] phase;
  private final double[] magnitude;
  private final double[] magnitudeError;
  private final double[] flux;
  private final double[] fluxError;
  private final double[] extinction;
  private final int[] starts;

  AggregatedObservations(List<Dataset> datasets) {
    List<double[]> phases = new ArrayList<>();
    List<double[]> magnitudes = new ArrayList<>();
    List<double[]> magnitudeErrors = new ArrayList<>();
    List<double[]> fluxes = new ArrayList<>();
    List<double[]> fluxErrors = new ArrayList<>();
    List<double[]> extinctions = new ArrayList<>();
    starts = new int[datasets.size() + 1];

    for (int i = 0; i < datasets.size(); ++i) {
      Dataset dataset = datasets.get(i);
      phases.add(dataset.getPhase());
      magnitudes.add(dataset.getMagnitude());
      magnitudeErrors.add(dataset.getMagnitudeError());
      fluxes.add(dataset.getFlux());
      fluxErrors.add(dataset.getFluxError());
      double[] ext = new double[dataset.size()];
      Arrays.fill(ext, dataset.getExtinctionCoefficient());
      extinctions.add(ext);
      starts[i + 1] = starts[i] + dataset.size();
    }

    phase = NumericUtils.concatAll(phases);
    magnitude = NumericUtils.concatAll(magnitudes);
    magnitudeError = NumericUtils.concatAll(magnitudeErrors);
    flux = NumericUtils.concatAll(fluxes);
    fluxError = NumericUtils.concatAll(fluxErrors);
    extinction = NumericUtils.concatAll(extinctions);
  }

  /**
   * Split a flattened array back into one array per dataset
   *
   * @param flat Array with one value per observation, in dataset order
   * @return Per-dataset arrays
   */
  public double[][] split(double[] flat) {
    if (flat.length != size()) {
      throw new IllegalArgumentException(
          "Expected " + size() + " values to split, got " + flat.length);
    }
    double[][] split = new double[starts.length - 1][];
    for (int i = 0; i < split.length; ++i) {
      split[i] = Arrays.copyOfRange(flat, starts[i], starts[i + 1]);
    }
    return split;
  }

  public double[] getPhase() {
    return phase.clone();
  }

  public double[] getMagnitude() {
    return magnitude.clone();
  }

  public double[] getMagnitudeError() {
    return magnitudeError.clone();
  }

  public double[] getFlux() {
    return flux.clone();
  }

  public double[] getFluxError() {
    return fluxError.clone();
  }

  public double[] getExtinction() {
    return extinction.clone();
  }

  public int size() {
    return phase.length;
  }
}
