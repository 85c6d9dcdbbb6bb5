package astro.lightcurve.fit;

import static astro.lightcurve.test.TestUtils.atmosphereFile;
import static astro.lightcurve.test.TestUtils.observationFile;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import astro.lightcurve.input.AtmosphereGrid;
import astro.lightcurve.input.DatasetRecord;
import astro.lightcurve.input.DatasetRecord.Representation;
import astro.lightcurve.input.MetadataAtmosphereGrid;
import astro.lightcurve.input.ObservationSet;
import astro.lightcurve.output.FitResult;
import astro.lightcurve.utils.DegenerateFitException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

public class LightCurveFitterTest {

  private static final double ZERO_POINT = 3.631e-20;
  private static final double ERROR = 0.05;

  private static final SurfaceParameters PARAMETERS =
      new SurfaceParameters(10., 7200., Math.PI / 2, 300E3, 1., 0.9, 0.08, 4000., 5000.);

  private static final double[] V_PHASES = {0., 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9};
  private static final double[] V_SHIFTED_PHASES =
      {0.05, 0.15, 0.25, 0.35, 0.45, 0.55, 0.65, 0.75, 0.85, 0.95};
  private static final double[] B_PHASES = {0.02, 0.17, 0.33, 0.48, 0.61, 0.77, 0.93};

  private List<AtmosphereGrid> grids;
  private SinusoidalSurfaceModel model;

  @Before
  public void setUp() {
    grids = Arrays.asList(
        new MetadataAtmosphereGrid("V", ZERO_POINT, 1.0),
        new MetadataAtmosphereGrid("V", ZERO_POINT, 1.0),
        new MetadataAtmosphereGrid("B", ZERO_POINT, 1.324));
    model = new SinusoidalSurfaceModel(16);
  }

  /**
   * Fitter over V, V, B datasets holding the model magnitudes plus a constant offset per dataset
   */
  private LightCurveFitter fitter(double[] offsets, boolean sharedPhases, double[] bErrors)
      throws Exception {
    double[][] phases = {V_PHASES, sharedPhases ? V_PHASES : V_SHIFTED_PHASES, B_PHASES};
    String[] ids = {"V", "V", "B"};
    List<DatasetRecord> records = new ArrayList<>();
    for (int i = 0; i < ids.length; ++i) {
      double[] mag = new double[phases[i].length];
      double[] err = new double[phases[i].length];
      for (int j = 0; j < mag.length; ++j) {
        mag[j] = SinusoidalSurfaceModel.magnitude(PARAMETERS, phases[i][j], grids.get(i))
            + offsets[i];
        err[j] = (i == 2 && bErrors != null) ? bErrors[j] : ERROR;
      }
      double calibration = i == 2 ? 0.05 : 0.03;
      records.add(new DatasetRecord(ids[i], ids[i] + ".dat", phases[i].clone(), mag, err,
          Representation.MAGNITUDE, calibration, 0.));
    }
    return new LightCurveFitter(new ObservationSet(records, grids), model);
  }

  private LightCurveFitter fitter(double[] offsets) throws Exception {
    return fitter(offsets, false, null);
  }

  @Test
  public void predictionAtObservedPhasesIsDirectEvaluation() throws Exception {
    LightCurveFitter fitter = fitter(new double[3]);
    double[][] predicted = fitter.predictFlux(PARAMETERS, null, null, null);
    for (int i = 0; i < predicted.length; ++i) {
      double[] phase = fitter.getObservations().getDataset(i).getPhase();
      double[] expected = new double[phase.length];
      for (int j = 0; j < phase.length; ++j) {
        expected[j] = SinusoidalSurfaceModel.magnitude(PARAMETERS, phase[j], grids.get(i));
      }
      assertArrayEquals(expected, predicted[i], 0.);
    }
    assertEquals(1, model.getSurfaceCount());
  }

  @Test
  public void duplicateBandReusedOnlyForIdenticalPhases() throws Exception {
    fitter(new double[3], true, null).predictFlux(PARAMETERS, null, null, null);
    assertEquals(V_PHASES.length + B_PHASES.length, model.getMagnitudeCount());

    model.resetCounts();
    fitter(new double[3], false, null).predictFlux(PARAMETERS, null, null, null);
    assertEquals(2 * V_PHASES.length + B_PHASES.length, model.getMagnitudeCount());
  }

  @Test
  public void resampledBandsEvaluatedOncePerGroup() throws Exception {
    LightCurveFitter fitter = fitter(new double[3]);
    double[][] predicted = fitter.predictFlux(PARAMETERS, 10, null, null);
    assertEquals(20, model.getMagnitudeCount());
    // first V dataset lies on the sample grid
    for (int j = 0; j < V_PHASES.length; ++j) {
      double expected = SinusoidalSurfaceModel.magnitude(PARAMETERS, V_PHASES[j], grids.get(0));
      assertEquals(expected, predicted[0][j], 1E-12);
    }
  }

  @Test
  public void resampledPredictionCloseToModel() throws Exception {
    LightCurveFitter fitter = fitter(new double[3]);
    double[][] predicted = fitter.predictFlux(PARAMETERS, 200, null, null);
    for (int j = 0; j < B_PHASES.length; ++j) {
      double expected = SinusoidalSurfaceModel.magnitude(PARAMETERS, B_PHASES[j], grids.get(2));
      assertEquals(expected, predicted[2][j], 1E-4);
    }
    // phases just below 1 interpolate towards the phase 0 sample
    for (int j = 0; j < V_SHIFTED_PHASES.length; ++j) {
      double expected =
          SinusoidalSurfaceModel.magnitude(PARAMETERS, V_SHIFTED_PHASES[j], grids.get(1));
      assertEquals(expected, predicted[1][j], 1E-4);
    }
  }

  @Test
  public void unwrappedPhasesReducedForResampledLookup() throws Exception {
    List<DatasetRecord> records = new ArrayList<>();
    records.add(new DatasetRecord("V_long", "V_long.dat", new double[]{1.25, 2.5, -0.75},
        new double[]{15., 15., 15.}, new double[]{ERROR, ERROR, ERROR},
        Representation.MAGNITUDE, 0.03, 0.));
    LightCurveFitter fitter = new LightCurveFitter(
        new ObservationSet(records, grids.subList(0, 1)), model);
    double[] predicted = fitter.predictFlux(PARAMETERS, 4, null, null)[0];
    AtmosphereGrid grid = grids.get(0);
    assertEquals(SinusoidalSurfaceModel.magnitude(PARAMETERS, 0.25, grid), predicted[0], 1E-12);
    assertEquals(SinusoidalSurfaceModel.magnitude(PARAMETERS, 0.5, grid), predicted[1], 1E-12);
    assertEquals(SinusoidalSurfaceModel.magnitude(PARAMETERS, 0.25, grid), predicted[2], 1E-12);
  }

  @Test
  public void shiftAddsExtinctionAndDistanceModulus() throws Exception {
    LightCurveFitter fitter = fitter(new double[3]);
    double[] plain = fitter.predictFluxFlat(PARAMETERS, null, null, null);
    double[] shifted = fitter.predictFluxFlat(PARAMETERS, null, 2., 1.);
    assertEquals(2 * V_PHASES.length + B_PHASES.length, shifted.length);
    assertEquals(3., shifted[0] - plain[0], 1E-12);
    assertEquals(3.324, shifted[shifted.length - 1] - plain[plain.length - 1], 1E-12);
  }

  @Test
  public void theoreticalCurveAtRequestedPhases() throws Exception {
    LightCurveFitter fitter = fitter(new double[3]);
    double[][] phases = {{0.5}, {0.5}, {0., 0.25}};
    double[][] curve = fitter.predictFluxTheoretical(PARAMETERS, phases, 1., null);
    assertEquals(SinusoidalSurfaceModel.magnitude(PARAMETERS, 0.5, grids.get(0)) + 1.,
        curve[1][0], 1E-12);
    assertEquals(2, curve[2].length);
    // second V copied from the first
    assertEquals(3, model.getMagnitudeCount());
  }

  @Test(expected = IllegalArgumentException.class)
  public void theoreticalCurveNeedsPhasesForEveryDataset() throws Exception {
    fitter(new double[3]).predictFluxTheoretical(PARAMETERS, new double[][]{{0.}}, 0., 0.);
  }

  @Test
  public void fixedOffsetsOnExactDataGiveZeroChiSquare() throws Exception {
    LightCurveFitter fitter = fitter(new double[3]);
    FitOptions options = FitOptions.create().withOffsetFree(false);
    assertEquals(0., fitter.computeChiSquare(PARAMETERS, options), 1E-18);
  }

  @Test
  public void fixedOffsetsSumNormalizedResiduals() throws Exception {
    LightCurveFitter fitter = fitter(new double[]{0.1, 0.1, 0.1});
    FitOptions options = FitOptions.create().withOffsetFree(false);
    int count = 2 * V_PHASES.length + B_PHASES.length;
    double expected = count * (0.1 / ERROR) * (0.1 / ERROR);
    assertEquals(expected, fitter.computeChiSquare(PARAMETERS, options), 1E-9);

    FitResult result = fitter.computeFit(PARAMETERS, options);
    assertEquals(0., result.getChiSquareBand(), 0.);
    assertArrayEquals(new double[3], result.getOffsets(), 0.);
    assertEquals(2., result.getResiduals()[2][0], 1E-9);
  }

  @Test
  public void fixedOffsetsFitFreeNuisanceParameters() throws Exception {
    double dm = 3.;
    double av = 0.5;
    LightCurveFitter fitter = fitter(new double[]{dm + av, dm + av, dm + 1.324 * av});
    FitOptions options = FitOptions.create().withOffsetFree(false)
        .withDistanceModulus(null).withExtinction(null);
    FitResult result = fitter.computeFit(PARAMETERS, options);
    assertEquals(dm, result.getDistanceModulus(), 1E-9);
    assertEquals(av, result.getExtinction(), 1E-9);
    assertEquals(0., result.getChiSquare(), 1E-12);
    for (double[] residuals : result.getResiduals()) {
      for (double residual : residuals) {
        assertEquals(0., residual, 1E-6);
      }
    }
  }

  @Test
  public void freeOffsetsRecoverDistanceModulusAndExtinction() throws Exception {
    double dm = 3.;
    double av = 0.5;
    LightCurveFitter fitter = fitter(new double[]{dm + av, dm + av, dm + 1.324 * av});
    FitOptions options = FitOptions.create().withDistanceModulus(null).withExtinction(null);
    FitResult result = fitter.computeFit(PARAMETERS, options);
    assertEquals(dm, result.getDistanceModulus(), 1E-9);
    assertEquals(av, result.getExtinction(), 1E-9);
    assertEquals(0., result.getChiSquareData(), 1E-12);
    assertEquals(0., result.getChiSquareBand(), 1E-12);
    assertArrayEquals(new double[3], result.getOffsets(), 1E-9);
    assertEquals(3, result.getResiduals().length);
  }

  @Test
  public void freeOffsetsReportCalibrationResidual() throws Exception {
    LightCurveFitter fitter = fitter(new double[]{3.52, 3.52, 3.662 - 0.01});
    FitOptions options = FitOptions.create().withDistanceModulus(3.).withExtinction(0.5);
    FitResult result = fitter.computeFit(PARAMETERS, options);
    assertArrayEquals(new double[]{0.02, 0.02, -0.01}, result.getOffsets(), 1E-9);
    double band = 2 * (0.02 / 0.03) * (0.02 / 0.03) + (0.01 / 0.05) * (0.01 / 0.05);
    assertEquals(band, result.getChiSquareBand(), 1E-9);
    assertEquals(0., result.getChiSquareData(), 1E-12);
    assertEquals(band, fitter.computeChiSquare(PARAMETERS, options), 1E-9);
  }

  @Test
  public void fluxDomainOffsetsMatchMagnitudeOffsets() throws Exception {
    LightCurveFitter fitter = fitter(new double[]{3.5, 3.5, 3.662});
    FitOptions options = FitOptions.create().withDistanceModulus(null).withExtinction(null)
        .withFluxDomain(true);
    assertEquals(0., fitter.computeChiSquare(PARAMETERS, options), 1E-6);
  }

  @Test(expected = UnsupportedCombinationException.class)
  public void fluxDomainResidualsUnsupported() throws Exception {
    FitOptions options = FitOptions.create().withFluxDomain(true);
    fitter(new double[3]).computeFit(PARAMETERS, options);
  }

  @Test
  public void fluxDomainIgnoredWithFixedOffsets() throws Exception {
    FitOptions options = FitOptions.create().withOffsetFree(false).withFluxDomain(true);
    FitResult result = fitter(new double[3]).computeFit(PARAMETERS, options);
    assertTrue(result.hasResiduals());
    assertEquals(0., result.getChiSquare(), 1E-18);
  }

  @Test
  public void zeroWeightDatasetNamedInError() throws Exception {
    double[] errors = new double[B_PHASES.length];
    Arrays.fill(errors, Double.POSITIVE_INFINITY);
    LightCurveFitter fitter = fitter(new double[3], false, errors);
    try {
      fitter.computeChiSquare(PARAMETERS, FitOptions.create());
      fail("Expected a degenerate fit for dataset B");
    } catch (DegenerateFitException e) {
      assertTrue(e.getMessage().contains("dataset B"));
    }
  }

  @Test
  public void surfaceModelFailurePropagates() throws Exception {
    SurfaceParameters overflowing =
        new SurfaceParameters(10., 7200., Math.PI / 2, 300E3, 1., 1.2, 0.08, 4000., 5000.);
    try {
      fitter(new double[3]).computeChiSquare(overflowing, FitOptions.create());
      fail("Expected the surface model to reject the filling factor");
    } catch (SurfaceModelException e) {
      assertTrue(e.getMessage().contains("Filling factor"));
    }
  }

  @Test
  public void effectiveVelocityIsSineAmplitude() throws Exception {
    LightCurveFitter fitter = fitter(new double[3]);
    assertEquals(300E3, fitter.effectiveVelocitySemiAmplitude(PARAMETERS, 20, 0, true), 1E-6);
    // surface already built; phase count from the configuration, weighted by the B band
    assertEquals(300E3, fitter.effectiveVelocitySemiAmplitude(PARAMETERS, 2, false), 1E-6);
    assertEquals(1, model.getSurfaceCount());
  }

  @Test(expected = SurfaceModelException.class)
  public void effectiveVelocityNeedsSurface() throws Exception {
    fitter(new double[3]).effectiveVelocitySemiAmplitude(PARAMETERS, 20, 0, false);
  }

  @Test
  public void buildsFromFiles() throws Exception {
    LightCurveFitter fitter = LightCurveFitter.fromFiles(atmosphereFile("atmo-list.txt"),
        MetadataAtmosphereGrid.READER, observationFile("observations.txt"),
        SinusoidalSurfaceModel::new, 16);
    assertEquals(3, fitter.getObservations().size());
    assertArrayEquals(new int[]{0, 0, 2}, fitter.getObservations().getGrouping());
    assertEquals(16, ((SinusoidalSurfaceModel) fitter.getSurfaceModel()).getResolution());

    FitResult result = fitter.computeFit(PARAMETERS,
        FitOptions.create().withDistanceModulus(null).withExtinction(null));
    assertFalse(Double.isNaN(result.getChiSquare()));
    assertEquals(3, result.getResiduals().length);
  }
}
