package net.larse.tsmodel.model;

import com.google.common.collect.ImmutableList;

import java.util.List;

/** The events of one pixel that passed the thresholds, split by direction. */
public final class RankedEvents {
  private final ImmutableList<ChangeEvent> losses;
  private final ImmutableList<ChangeEvent> gains;

  public RankedEvents(List<ChangeEvent> losses, List<ChangeEvent> gains) {
    this.losses = ImmutableList.copyOf(losses);
    this.gains = ImmutableList.copyOf(gains);
  }

  public ImmutableList<ChangeEvent> losses() {
    return losses;
  }

  public ImmutableList<ChangeEvent> gains() {
    return gains;
  }

  public ImmutableList<ChangeEvent> get(ChangeDirection direction) {
    return direction == ChangeDirection.LOSS ? losses : gains;
  }

  @Override
  public String toString() {
    return "loss=" + losses + " gain=" + gains;
  }
}
