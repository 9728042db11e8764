package net.larse.tsmodel.model;

/**
 * The trajectory value at one year, with the attributes of the segment that year falls in.
 */
public final class AnnualFit {
  private final int year;
  private final double fitted;
  private final double magnitude;
  private final double slope;
  private final int duration;

  public AnnualFit(int year, double fitted, double magnitude, double slope, int duration) {
    this.year = year;
    this.fitted = fitted;
    this.magnitude = magnitude;
    this.slope = slope;
    this.duration = duration;
  }

  public int year() {
    return year;
  }

  public double fitted() {
    return fitted;
  }

  public double magnitude() {
    return magnitude;
  }

  public double slope() {
    return slope;
  }

  public int duration() {
    return duration;
  }

  @Override
  public String toString() {
    return year + ": fitted=" + fitted + " mag=" + magnitude + " slope=" + slope
        + " dur=" + duration;
  }
}
