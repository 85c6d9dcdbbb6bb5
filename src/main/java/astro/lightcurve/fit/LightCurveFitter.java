package astro.lightcurve.fit;

import static astro.lightcurve.utils.NumericUtils.DECIMAL_FORMAT;

import astro.lightcurve.input.AggregatedObservations;
import astro.lightcurve.input.AtmosphereGrid;
import astro.lightcurve.input.AtmosphereGridList;
import astro.lightcurve.input.AtmosphereGridReader;
import astro.lightcurve.input.Dataset;
import astro.lightcurve.input.DatasetCountMismatchException;
import astro.lightcurve.input.FitConfiguration;
import astro.lightcurve.input.ObservationSet;
import astro.lightcurve.output.FitResult;
import astro.lightcurve.utils.AxisInterpolator;
import astro.lightcurve.utils.DegenerateFitException;
import astro.lightcurve.utils.LinearFit;
import astro.lightcurve.utils.NumericUtils;
import astro.lightcurve.utils.UnitConverter;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.util.FastMath;
import org.apache.log4j.Logger;

/**
 * Compares the light curves predicted by a surface model to multi-band photometric observations.
 *
 * For a trial parameter set the surface is built once, the model magnitude is evaluated for every
 * band (either at each observed phase, or on a shared grid of evenly spaced phases which is then
 * interpolated onto the observed phases) and the chi-square of the data against the model is
 * computed, optionally letting every band float by its own calibration offset. Bands that appear
 * in several datasets are only evaluated once when the sampling phases allow it.
 *
 * The observations are read once at construction and never modified. The surface model, on the
 * other hand, holds the last built surface; a fitter must therefore be used from a single thread
 * and each call that takes parameters rebuilds the surface first.
 */
public class LightCurveFitter {

  private static final Logger logger = Logger.getLogger(LightCurveFitter.class);

  private final ObservationSet observations;
  private final SurfaceModel surface;

  /**
   * @param observations Normalized observations, one atmosphere grid per dataset
   * @param surface Surface model used to predict the light curves
   */
  public LightCurveFitter(ObservationSet observations, SurfaceModel surface) {
    this.observations = observations;
    this.surface = surface;
  }

  /**
   * Build a fitter from an atmosphere grid list and an observation file.
   *
   * @param atmosphereList File listing one atmosphere grid per dataset
   * @param gridReader Reader used to load each listed grid
   * @param observationFile Observation file (7, 8 or 9 column layout)
   * @param modelFactory Creates the surface model
   * @param resolution Surface resolution passed to the factory
   * @return Fitter ready to evaluate parameter sets
   * @throws IOException if any of the files is unreadable or malformed
   * @throws DatasetCountMismatchException if the grid and dataset counts differ
   */
  public static LightCurveFitter fromFiles(File atmosphereList, AtmosphereGridReader gridReader,
      File observationFile, SurfaceModel.Factory modelFactory, int resolution)
      throws IOException, DatasetCountMismatchException {
    List<AtmosphereGrid> grids = AtmosphereGridList.read(atmosphereList, gridReader);
    ObservationSet observations = ObservationSet.fromFile(observationFile, grids);
    logger.info("Fitter initialized with " + observations.size() + " datasets ("
        + observations.getAggregated().size() + " observations), surface resolution "
        + resolution);
    return new LightCurveFitter(observations, modelFactory.create(resolution));
  }

  public ObservationSet getObservations() {
    return observations;
  }

  public SurfaceModel getSurfaceModel() {
    return surface;
  }

  /**
   * Build the model surface for the given parameters. Any failure of the surface model propagates
   * unchanged.
   *
   * @param parameters Physical parameters of the system
   */
  public void makeSurface(SurfaceParameters parameters) {
    if (logger.isDebugEnabled()) {
      logger.debug("Making surface for " + parameters);
    }
    surface.makeSurface(parameters);
  }

  /**
   * Predicted magnitudes of every dataset at its observed phases, shifted by the extinction and
   * distance modulus.
   *
   * @param parameters Physical parameters of the system
   * @param sampleCount Number of evenly spaced phases to sample the model at before interpolating
   * onto the observed phases, or null to evaluate the model at every observed phase
   * @param distanceModulus Distance modulus added to every band, null meaning 0
   * @param extinction V-band extinction, scaled by each band's extinction coefficient, null
   * meaning 0
   * @return Predicted magnitudes, one array per dataset
   */
  public double[][] predictFlux(SurfaceParameters parameters, Integer sampleCount,
      Double distanceModulus, Double extinction) {
    makeSurface(parameters);
    double[][] model;
    if (sampleCount == null) {
      model = evaluateAtObservedPhases();
    } else {
      model = evaluateResampled(sampleCount);
    }
    applyShift(model, distanceModulus, extinction);
    return model;
  }

  /**
   * Same as {@link #predictFlux(SurfaceParameters, Integer, Double, Double)}, concatenated in
   * dataset order so it lines up with the aggregated observations.
   *
   * @param parameters Physical parameters of the system
   * @param sampleCount Number of model phases to interpolate from, or null for none
   * @param distanceModulus Distance modulus, null meaning 0
   * @param extinction V-band extinction, null meaning 0
   * @return Predicted magnitudes of every observation
   */
  public double[] predictFluxFlat(SurfaceParameters parameters, Integer sampleCount,
      Double distanceModulus, Double extinction) {
    return NumericUtils.concatAll(
        predictFlux(parameters, sampleCount, distanceModulus, extinction));
  }

  /**
   * Predicted magnitudes at arbitrary phases, e.g., to draw model curves over the data.
   *
   * @param parameters Physical parameters of the system
   * @param phases Phases to evaluate for each dataset (one array per dataset)
   * @param distanceModulus Distance modulus, null meaning 0
   * @param extinction V-band extinction, null meaning 0
   * @return Predicted magnitudes, one array per dataset
   */
  public double[][] predictFluxTheoretical(SurfaceParameters parameters, double[][] phases,
      Double distanceModulus, Double extinction) {
    if (phases.length != observations.size()) {
      throw new IllegalArgumentException("Expected phases for " + observations.size()
          + " datasets, got " + phases.length);
    }
    makeSurface(parameters);
    double[][] model = evaluate(phases);
    applyShift(model, distanceModulus, extinction);
    return model;
  }

  /**
   * Chi-square of the observations against the model for the given parameters.
   *
   * @param parameters Physical parameters of the system
   * @param options Offset mode, nuisance parameters and sampling
   * @return Total chi-square
   */
  public double computeChiSquare(SurfaceParameters parameters, FitOptions options) {
    return evaluateFit(parameters, options, false).getChiSquare();
  }

  /**
   * Chi-square of the observations against the model, with the fitted offsets, nuisance
   * parameters and normalized residuals.
   *
   * @param parameters Physical parameters of the system
   * @param options Offset mode, nuisance parameters and sampling
   * @return Full fit result
   * @throws UnsupportedCombinationException if band offsets are free and fit in the flux domain,
   * for which residuals in magnitudes are not defined
   */
  public FitResult computeFit(SurfaceParameters parameters, FitOptions options) {
    if (options.isOffsetFree() && options.isInFluxDomain()) {
      throw new UnsupportedCombinationException(
          "Residuals cannot be returned for band offsets fit in the flux domain");
    }
    return evaluateFit(parameters, options, true);
  }

  private FitResult evaluateFit(SurfaceParameters parameters, FitOptions options,
      boolean withResiduals) {
    FitResult result;
    if (options.isOffsetFree()) {
      result = fitFreeOffsets(parameters, options, withResiduals);
    } else {
      result = fitFixedOffsets(parameters, options, withResiduals);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("chi2: " + DECIMAL_FORMAT.get().format(result.getChiSquare())
          + ", chi2 (data): " + DECIMAL_FORMAT.get().format(result.getChiSquareData())
          + ", chi2 (band offset): " + DECIMAL_FORMAT.get().format(result.getChiSquareBand())
          + ", DM: " + DECIMAL_FORMAT.get().format(result.getDistanceModulus())
          + ", AV: " + DECIMAL_FORMAT.get().format(result.getExtinction()));
    }
    return result;
  }

  /**
   * Single global fit of data - model against the extinction coefficients; the distance modulus
   * and extinction are the intercept and slope, fixed where given.
   */
  private FitResult fitFixedOffsets(SurfaceParameters parameters, FitOptions options,
      boolean withResiduals) {
    AggregatedObservations aggregated = observations.getAggregated();
    double[] predicted = predictFluxFlat(parameters, options.getSampleCount(), 0., 0.);
    double[] magnitude = aggregated.getMagnitude();
    double[] error = aggregated.getMagnitudeError();
    double[] ext = aggregated.getExtinction();

    double[] diff = new double[magnitude.length];
    for (int i = 0; i < diff.length; ++i) {
      diff[i] = magnitude[i] - predicted[i];
    }
    LinearFit fit;
    try {
      fit = LinearFit.fit(diff, ext, error,
          options.getDistanceModulus(), options.getExtinction());
    } catch (DegenerateFitException e) {
      throw new DegenerateFitException(
          "Global distance modulus and extinction fit failed: " + e.getMessage());
    }
    double dm = fit.getIntercept();
    double av = fit.getSlope();

    double[][] residuals = null;
    if (withResiduals) {
      double[] flat = new double[diff.length];
      for (int i = 0; i < flat.length; ++i) {
        flat[i] = (diff[i] - (ext[i] * av + dm)) / error[i];
      }
      residuals = aggregated.split(flat);
    }
    return new FitResult(fit.getChiSquare(), 0., new double[observations.size()], dm, av,
        residuals, parameters);
  }

  /**
   * Two-stage fit: one offset per dataset, then a line through those offsets against the
   * extinction coefficients weighted by the calibration errors.
   */
  private FitResult fitFreeOffsets(SurfaceParameters parameters, FitOptions options,
      boolean withResiduals) {
    double[][] predicted = predictFlux(parameters, options.getSampleCount(), 0., 0.);
    int count = observations.size();
    double[] offsets = new double[count];
    double chiSquareData = 0.;
    double[][] residuals = withResiduals ? new double[count][] : null;

    for (int i = 0; i < count; ++i) {
      Dataset dataset = observations.getDataset(i);
      LinearFit fit;
      if (options.isInFluxDomain()) {
        fit = fitFluxRatio(dataset, predicted[i]);
        offsets[i] = -2.5 * FastMath.log10(fit.getSlope());
      } else {
        double[] diff = difference(dataset.getMagnitude(), predicted[i]);
        fit = fitDatasetOffset(dataset, diff);
        offsets[i] = fit.getIntercept();
        if (withResiduals) {
          double[] error = dataset.getMagnitudeError();
          residuals[i] = new double[diff.length];
          for (int j = 0; j < diff.length; ++j) {
            residuals[i][j] = (diff[j] - offsets[i]) / error[j];
          }
        }
      }
      chiSquareData += fit.getChiSquare();
    }

    double[] ext = observations.getExtinctionCoefficients();
    LinearFit bandFit;
    try {
      bandFit = LinearFit.fit(offsets, ext, observations.getCalibrationErrors(),
          options.getDistanceModulus(), options.getExtinction());
    } catch (DegenerateFitException e) {
      throw new DegenerateFitException("Band offset fit over " + count + " datasets failed: "
          + e.getMessage());
    }
    double dm = bandFit.getIntercept();
    double av = bandFit.getSlope();
    for (int i = 0; i < count; ++i) {
      offsets[i] -= ext[i] * av + dm;
    }
    return new FitResult(chiSquareData, bandFit.getChiSquare(), offsets, dm, av, residuals,
        parameters);
  }

  private static LinearFit fitDatasetOffset(Dataset dataset, double[] diff) {
    try {
      return LinearFit.fitConstant(diff, dataset.getMagnitudeError());
    } catch (DegenerateFitException e) {
      throw new DegenerateFitException("Offset fit of dataset " + dataset.getId() + " ("
          + dataset.getFileName() + ") failed: " + e.getMessage());
    }
  }

  /**
   * Fit observed flux = ratio * model flux; the ratio must be positive to convert to magnitudes.
   */
  private static LinearFit fitFluxRatio(Dataset dataset, double[] predicted) {
    double[] modelFlux =
        UnitConverter.magToFlux(predicted, null, dataset.getZeroPointFlux()).getFirst();
    LinearFit fit;
    try {
      fit = LinearFit.fit(dataset.getFlux(), modelFlux, dataset.getFluxError(), 0., null);
    } catch (DegenerateFitException e) {
      throw new DegenerateFitException("Flux ratio fit of dataset " + dataset.getId() + " ("
          + dataset.getFileName() + ") failed: " + e.getMessage());
    }
    if (!(fit.getSlope() > 0.)) {
      throw new DegenerateFitException("Flux ratio of dataset " + dataset.getId() + " ("
          + dataset.getFileName() + ") is not positive: " + fit.getSlope());
    }
    return fit;
  }

  /**
   * Effective projected velocity semi-amplitude of the star: the luminosity-weighted velocity is
   * sampled at evenly spaced phases and the amplitude of a sine through those samples is returned.
   *
   * @param parameters Physical parameters of the system
   * @param phaseCount Number of phases to sample the velocity at
   * @param bandIndex Dataset whose atmosphere grid weights the surface elements
   * @param recomputeSurface Whether to rebuild the surface first; false re-uses the last surface
   * @return Velocity semi-amplitude in m/s
   */
  public double effectiveVelocitySemiAmplitude(SurfaceParameters parameters, int phaseCount,
      int bandIndex, boolean recomputeSurface) {
    if (recomputeSurface) {
      makeSurface(parameters);
    }
    AtmosphereGrid grid = observations.getAtmosphereGrid(bandIndex);
    double[] phases = NumericUtils.evenPhases(phaseCount);
    double[] velocities = new double[phaseCount];
    double[] sines = new double[phaseCount];
    for (int i = 0; i < phaseCount; ++i) {
      velocities[i] = surface.velocityAtPhase(phases[i], grid);
      sines[i] = FastMath.sin(NumericUtils.TAU * phases[i]);
    }
    return LinearFit.fit(velocities, sines, null, 0., null).getSlope();
  }

  /**
   * Effective velocity semi-amplitude using the configured number of phases
   *
   * @param parameters Physical parameters of the system
   * @param bandIndex Dataset whose atmosphere grid weights the surface elements
   * @param recomputeSurface Whether to rebuild the surface first
   * @return Velocity semi-amplitude in m/s
   */
  public double effectiveVelocitySemiAmplitude(SurfaceParameters parameters, int bandIndex,
      boolean recomputeSurface) {
    int phaseCount = FitConfiguration.getInstance().getVelocityPhases();
    return effectiveVelocitySemiAmplitude(parameters, phaseCount, bandIndex, recomputeSurface);
  }

  private double[][] evaluateAtObservedPhases() {
    double[][] phases = new double[observations.size()][];
    for (int i = 0; i < phases.length; ++i) {
      phases[i] = observations.getDataset(i).getPhase();
    }
    return evaluate(phases);
  }

  /**
   * Model magnitudes at the given phases. A dataset whose band was already evaluated at exactly
   * the same phases gets a copy of that result.
   */
  private double[][] evaluate(double[][] phases) {
    double[][] model = new double[phases.length][];
    for (int i = 0; i < phases.length; ++i) {
      int group = observations.getGroup(i);
      if (group < i && Arrays.equals(phases[group], phases[i])) {
        model[i] = model[group].clone();
      } else {
        model[i] = evaluate(phases[i], observations.getAtmosphereGrid(i));
      }
    }
    return model;
  }

  private double[] evaluate(double[] phases, AtmosphereGrid grid) {
    double[] mag = new double[phases.length];
    for (int j = 0; j < phases.length; ++j) {
      mag[j] = surface.magnitudeAtPhase(phases[j], grid);
    }
    return mag;
  }

  /**
   * Evaluate every band on one shared periodic grid of sampleCount phases, then interpolate onto
   * each dataset's observed phases (reduced modulo 1).
   */
  private double[][] evaluateResampled(int sampleCount) {
    if (sampleCount < 1) {
      throw new IllegalArgumentException("Sample count must be positive, got " + sampleCount);
    }
    double[] samplePhases = NumericUtils.evenPhases(sampleCount);
    double step = 1. / sampleCount;
    double[][] samples = new double[observations.size()][];
    double[][] model = new double[observations.size()][];

    for (int i = 0; i < model.length; ++i) {
      int group = observations.getGroup(i);
      if (group < i) {
        samples[i] = samples[group];
      } else {
        double[] mag = evaluate(samplePhases, observations.getAtmosphereGrid(i));
        // closing sample at phase 1 so that every reduced phase is bracketed
        samples[i] = Arrays.copyOf(mag, sampleCount + 1);
        samples[i][sampleCount] = mag[0];
      }
      if (samples[i].length != sampleCount + 1) {
        throw new IllegalStateException("Dataset " + observations.getDataset(i).getId()
            + " does not share the sample grid of its band");
      }

      double[] observed = observations.getDataset(i).getPhase();
      double[] reduced = new double[observed.length];
      for (int j = 0; j < observed.length; ++j) {
        reduced[j] = NumericUtils.reducePhase(observed[j]);
      }
      model[i] = AxisInterpolator.locateEvenlySpaced(0., step, sampleCount + 1, reduced)
          .interpolate(samples[i]);
    }
    return model;
  }

  private void applyShift(double[][] model, Double distanceModulus, Double extinction) {
    double dm = distanceModulus == null ? 0. : distanceModulus;
    double av = extinction == null ? 0. : extinction;
    for (int i = 0; i < model.length; ++i) {
      double shift = observations.getDataset(i).getExtinctionCoefficient() * av + dm;
      for (int j = 0; j < model[i].length; ++j) {
        model[i][j] += shift;
      }
    }
  }

  private static double[] difference(double[] observed, double[] predicted) {
    double[] diff = new double[observed.length];
    for (int i = 0; i < diff.length; ++i) {
      diff[i] = observed[i] - predicted[i];
    }
    return diff;
  }
}
