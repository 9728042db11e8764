package net.larse.tsmodel.model;

import java.util.Comparator;

/** Criteria for ranking the change events of a pixel. */
public enum SelectionRule {
  NEWEST("newest", Comparator.comparingInt(ChangeEvent::endYear).reversed()),
  OLDEST("oldest", Comparator.comparingInt(ChangeEvent::startYear)),
  LARGEST("largest", Comparator.comparingDouble((ChangeEvent e) -> Math.abs(e.magnitude()))
      .reversed()),
  SMALLEST("smallest", Comparator.comparingDouble(e -> Math.abs(e.magnitude()))),
  STEEPEST("steepest", Comparator.comparingDouble((ChangeEvent e) -> Math.abs(e.slope()))
      .reversed()),
  MOST_GRADUAL("mostGradual", Comparator.comparingDouble(e -> Math.abs(e.slope()))),
  SHORTEST("shortest", Comparator.comparingInt(ChangeEvent::duration)),
  LONGEST("longest", Comparator.comparingInt(ChangeEvent::duration).reversed());

  /** Secondary key for every rule. Remaining ties keep their input order. */
  private static final Comparator<ChangeEvent> TIE_BREAK =
      Comparator.comparingInt(ChangeEvent::endYear).reversed();

  private final String ruleName;
  private final Comparator<ChangeEvent> order;

  SelectionRule(String ruleName, Comparator<ChangeEvent> primary) {
    this.ruleName = ruleName;
    this.order = primary;
  }

  public String ruleName() {
    return ruleName;
  }

  /** The full ordering: the rule's key, then end year descending. */
  public Comparator<ChangeEvent> comparator() {
    return order.thenComparing(TIE_BREAK);
  }

  /**
   * Parses the rule names used by the change detection parameters ("newest", "mostGradual",
   * ...).
   */
  public static SelectionRule fromName(String name) {
    for (SelectionRule rule : values()) {
      if (rule.ruleName.equals(name)) {
        return rule;
      }
    }
    throw new IllegalArgumentException("Unknown selection rule: " + name);
  }
}
