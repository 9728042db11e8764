package net.larse.tsmodel.model;

/** Whether a change degraded or improved the pixel, given its band's improvement direction. */
public enum ChangeDirection {
  LOSS("loss"),
  GAIN("gain");

  private final String label;

  ChangeDirection(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Classifies a non-zero change: a loss if it moves against the improvement direction (+1 or
   * -1), a gain otherwise.
   */
  public static ChangeDirection classify(double magnitude, int improvementDirection) {
    return magnitude * improvementDirection < 0 ? LOSS : GAIN;
  }
}
