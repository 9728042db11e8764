package net.larse.tsmodel.model;

import com.google.common.base.Preconditions;

/**
 * A loss or gain over one trajectory segment. The magnitude is the raw change of the fitted
 * value, end minus start, in the band's units.
 */
public final class ChangeEvent {
  /** How fast a loss happened, relative to the slow-loss duration threshold. */
  public enum Pace {
    SLOW,
    FAST,
    /** Gains, and losses that have not been filtered yet. */
    UNCLASSIFIED
  }

  private final ChangeDirection direction;
  private final int startYear;
  private final int endYear;
  private final double magnitude;
  private final int improvementDirection;
  private final Pace pace;

  public ChangeEvent(ChangeDirection direction, int startYear, int endYear, double magnitude,
      int improvementDirection, Pace pace) {
    Preconditions.checkArgument(endYear > startYear, "empty segment %s-%s", startYear, endYear);
    this.direction = direction;
    this.startYear = startYear;
    this.endYear = endYear;
    this.magnitude = magnitude;
    this.improvementDirection = improvementDirection;
    this.pace = pace;
  }

  /** The event spanning two consecutive vertices, or null when the value did not change. */
  public static ChangeEvent between(Vertex start, Vertex end, int improvementDirection) {
    double magnitude = end.fittedValue() - start.fittedValue();
    if (magnitude == 0) {
      return null;
    }
    return new ChangeEvent(ChangeDirection.classify(magnitude, improvementDirection),
        start.year(), end.year(), magnitude, improvementDirection, Pace.UNCLASSIFIED);
  }

  public ChangeEvent withPace(Pace pace) {
    return new ChangeEvent(direction, startYear, endYear, magnitude, improvementDirection, pace);
  }

  public ChangeDirection direction() {
    return direction;
  }

  public int startYear() {
    return startYear;
  }

  public int endYear() {
    return endYear;
  }

  /** The first year the change is visible. */
  public int yearOfDetection() {
    return startYear + 1;
  }

  public int duration() {
    return endYear - startYear;
  }

  public double magnitude() {
    return magnitude;
  }

  /** Magnitude times the improvement direction: negative for losses, positive for gains. */
  public double adjustedMagnitude() {
    return magnitude * improvementDirection;
  }

  public double slope() {
    return magnitude / duration();
  }

  public Pace pace() {
    return pace;
  }

  @Override
  public String toString() {
    return direction.label() + "[" + startYear + "-" + endYear + " mag=" + magnitude
        + " slope=" + slope() + (pace == Pace.UNCLASSIFIED ? "" : " " + pace) + "]";
  }
}
