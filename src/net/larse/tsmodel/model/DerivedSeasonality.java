package net.larse.tsmodel.model;

import java.util.LinkedHashMap;
import java.util.Map;

/** Seasonality metrics derived from the annual (frequency 2) term of a harmonic model. */
public final class DerivedSeasonality {
  private final Band band;
  private final double amplitude;
  private final double phase;
  private final int peakJulianDay;
  private final double areaUnderCurve;

  public DerivedSeasonality(Band band, double amplitude, double phase, int peakJulianDay,
      double areaUnderCurve) {
    this.band = band;
    this.amplitude = amplitude;
    this.phase = phase;
    this.peakJulianDay = peakJulianDay;
    this.areaUnderCurve = areaUnderCurve;
  }

  public Band band() {
    return band;
  }

  /** Amplitude of the annual cycle, >= 0. */
  public double amplitude() {
    return amplitude;
  }

  /** Position of the annual peak as a fraction of the year, in [0, 1). */
  public double phase() {
    return phase;
  }

  /** Day of year of the annual peak, in [1, 365]. */
  public int peakJulianDay() {
    return peakJulianDay;
  }

  public double areaUnderCurve() {
    return areaUnderCurve;
  }

  public Map<String, Double> toMap() {
    String prefix = band.bandName() + "_";
    Map<String, Double> out = new LinkedHashMap<>();
    out.put(prefix + "amplitude", amplitude);
    out.put(prefix + "phase", phase);
    out.put(prefix + "peakJulianDay", (double) peakJulianDay);
    out.put(prefix + "AUC", areaUnderCurve);
    return out;
  }

  @Override
  public String toString() {
    return band.bandName() + "{amplitude=" + amplitude + ", phase=" + phase
        + ", peakJulianDay=" + peakJulianDay + ", AUC=" + areaUnderCurve + "}";
  }
}
