package net.larse.tsmodel.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;

/**
 * One temporal segment of a segmented harmonic run (as produced by CCDC): a harmonic model valid
 * over [start, end), plus the break that ended the segment.
 */
public final class Segment {
  private final HarmonicModel model;
  private final double breakDate;
  private final double changeProbability;
  private final double magnitude;

  /**
   * @param model the segment model; must carry a validity interval.
   * @param breakDate time of the break that ended the segment, 0 if none was detected.
   * @param changeProbability probability that the break is a real change, in [0, 1].
   * @param magnitude magnitude of the break for the model's band.
   */
  public Segment(HarmonicModel model, double breakDate, double changeProbability,
      double magnitude) {
    Preconditions.checkArgument(model.validity().isPresent(),
        "a segment model needs a validity interval");
    this.model = model;
    this.breakDate = breakDate;
    this.changeProbability = changeProbability;
    this.magnitude = magnitude;
  }

  /** A segment without a recorded break. */
  public static Segment of(HarmonicModel model) {
    return new Segment(model, 0, 0, 0);
  }

  public HarmonicModel model() {
    return model;
  }

  public Range<Double> validity() {
    return model.validity().get();
  }

  public double start() {
    return validity().lowerEndpoint();
  }

  public double end() {
    return validity().upperEndpoint();
  }

  public double breakDate() {
    return breakDate;
  }

  public boolean hasBreak() {
    return breakDate > 0;
  }

  public double changeProbability() {
    return changeProbability;
  }

  public double magnitude() {
    return magnitude;
  }

  @Override
  public String toString() {
    return "[" + start() + ", " + end() + ") tBreak=" + breakDate
        + " changeProb=" + changeProbability + " magnitude=" + magnitude;
  }
}
