package astro.lightcurve.fit;

import static astro.lightcurve.utils.NumericUtils.DECIMAL_FORMAT;

import org.apache.commons.math3.util.FastMath;

/**
 * The nine physical parameters from which the surface of the irradiated star is built.
 *
 * <ol start="0">
 * <li>Mass ratio q = M2/M1, where M1 is the modelled star.</li>
 * <li>Orbital period in seconds.</li>
 * <li>Orbital inclination in radians.</li>
 * <li>K1, the projected velocity semi-amplitude, in m/s.</li>
 * <li>Corotation factor, P_rotation/P_orbital.</li>
 * <li>Roche-lobe filling, as a fraction of x_nose/L1.</li>
 * <li>Gravity darkening exponent; 0.25 for radiative envelopes, 0.08 for convective ones.</li>
 * <li>Base temperature at the pole before gravity darkening, in K.</li>
 * <li>Irradiation temperature at the centre of mass location, in K. The effective temperature
 * follows T^4 = T_base^4 + T_irr^4, including projection and distance effects.</li>
 * </ol>
 *
 * The order above is the one used by {@link #fromArray(double...)} and {@link #toArray()}, which
 * exist for optimizers and command-line front ends that work on plain vectors.
 */
public class SurfaceParameters {

  /**
   * Number of parameters describing a surface
   */
  public static final int COUNT = 9;

  private final double massRatio;
  private final double orbitalPeriod;
  private final double inclination;
  private final double velocitySemiAmplitude;
  private final double corotationFactor;
  private final double fillingFactor;
  private final double gravityDarkening;
  private final double baseTemperature;
  private final double irradiationTemperature;

  public SurfaceParameters(double massRatio, double orbitalPeriod, double inclination,
      double velocitySemiAmplitude, double corotationFactor, double fillingFactor,
      double gravityDarkening, double baseTemperature, double irradiationTemperature) {
    this.massRatio = massRatio;
    this.orbitalPeriod = orbitalPeriod;
    this.inclination = inclination;
    this.velocitySemiAmplitude = velocitySemiAmplitude;
    this.corotationFactor = corotationFactor;
    this.fillingFactor = fillingFactor;
    this.gravityDarkening = gravityDarkening;
    this.baseTemperature = baseTemperature;
    this.irradiationTemperature = irradiationTemperature;
  }

  /**
   * Build parameters from a positional vector, in the order documented on this class.
   *
   * @param values Exactly nine parameter values
   * @return Parameters holding the given values
   */
  public static SurfaceParameters fromArray(double... values) {
    if (values.length != COUNT) {
      throw new IllegalArgumentException(
          "Expected " + COUNT + " surface parameters, got " + values.length);
    }
    return new SurfaceParameters(values[0], values[1], values[2], values[3], values[4],
        values[5], values[6], values[7], values[8]);
  }

  /**
   * @return Parameters as a positional vector, in the order documented on this class
   */
  public double[] toArray() {
    return new double[]{massRatio, orbitalPeriod, inclination, velocitySemiAmplitude,
        corotationFactor, fillingFactor, gravityDarkening, baseTemperature,
        irradiationTemperature};
  }

  public double getMassRatio() {
    return massRatio;
  }

  public double getOrbitalPeriod() {
    return orbitalPeriod;
  }

  public double getInclination() {
    return inclination;
  }

  public double getVelocitySemiAmplitude() {
    return velocitySemiAmplitude;
  }

  public double getCorotationFactor() {
    return corotationFactor;
  }

  public double getFillingFactor() {
    return fillingFactor;
  }

  public double getGravityDarkening() {
    return gravityDarkening;
  }

  public double getBaseTemperature() {
    return baseTemperature;
  }

  public double getIrradiationTemperature() {
    return irradiationTemperature;
  }

  /**
   * Temperature of the irradiated side at the centre of mass location, (T_base^4 + T_irr^4)^(1/4)
   * @return dayside temperature in K
   */
  public double getDaysideTemperature() {
    double base = baseTemperature * baseTemperature;
    double irradiation = irradiationTemperature * irradiationTemperature;
    return FastMath.pow(base * base + irradiation * irradiation, 0.25);
  }

  /**
   * Human-readable summary of the parameters, in customary units
   * @return multi-line report string
   */
  public String getReportString() {
    return "Mass ratio (M2/M1): " + DECIMAL_FORMAT.get().format(massRatio)
        + "\nOrbital period: " + DECIMAL_FORMAT.get().format(orbitalPeriod / 3600.) + " hrs"
        + "\nInclination: " + DECIMAL_FORMAT.get().format(inclination) + " rad ("
        + DECIMAL_FORMAT.get().format(FastMath.toDegrees(inclination)) + " deg)"
        + "\nK1: " + DECIMAL_FORMAT.get().format(velocitySemiAmplitude / 1000.) + " km/s"
        + "\nCorotation factor: " + DECIMAL_FORMAT.get().format(corotationFactor)
        + "\nFilling factor: " + DECIMAL_FORMAT.get().format(fillingFactor)
        + "\nGravity darkening: " + DECIMAL_FORMAT.get().format(gravityDarkening)
        + "\nBase temperature: " + DECIMAL_FORMAT.get().format(baseTemperature) + " K"
        + "\nDayside temperature: " + DECIMAL_FORMAT.get().format(getDaysideTemperature()) + " K";
  }

  @Override
  public String toString() {
    return "SurfaceParameters[q=" + massRatio + ", porb=" + orbitalPeriod + ", incl="
        + inclination + ", k1=" + velocitySemiAmplitude + ", omega=" + corotationFactor
        + ", filling=" + fillingFactor + ", tempgrav=" + gravityDarkening + ", temp="
        + baseTemperature + ", tirr=" + irradiationTemperature + "]";
  }
}
