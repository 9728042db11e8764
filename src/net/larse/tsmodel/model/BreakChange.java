package net.larse.tsmodel.model;

/** A break of a segmented harmonic run, classified as loss or gain. */
public final class BreakChange {
  private final ChangeDirection direction;
  private final double breakDate;
  private final double magnitude;

  public BreakChange(ChangeDirection direction, double breakDate, double magnitude) {
    this.direction = direction;
    this.breakDate = breakDate;
    this.magnitude = magnitude;
  }

  public ChangeDirection direction() {
    return direction;
  }

  public double breakDate() {
    return breakDate;
  }

  /** The calendar year of the break. */
  public int year() {
    return (int) Math.floor(breakDate);
  }

  public double magnitude() {
    return magnitude;
  }

  @Override
  public String toString() {
    return direction.label() + "@" + breakDate + " mag=" + magnitude;
  }
}
