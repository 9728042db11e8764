package net.larse.tsmodel.model;

import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The selected losses and gains of one band of a pixel, at most howManyToPull of each, in rank
 * order.
 */
public final class ChangeSummary {
  private final Band band;
  private final int howManyToPull;
  private final ImmutableList<ChangeEvent> losses;
  private final ImmutableList<ChangeEvent> gains;

  public ChangeSummary(Band band, int howManyToPull, List<ChangeEvent> losses,
      List<ChangeEvent> gains) {
    this.band = band;
    this.howManyToPull = howManyToPull;
    this.losses = ImmutableList.copyOf(losses);
    this.gains = ImmutableList.copyOf(gains);
  }

  public Band band() {
    return band;
  }

  public ImmutableList<ChangeEvent> losses() {
    return losses;
  }

  public ImmutableList<ChangeEvent> gains() {
    return gains;
  }

  /**
   * Flat record with one entry per rank and attribute, e.g. NBR_LT_loss_yr_1, NBR_LT_loss_dur_1,
   * NBR_LT_loss_mag_1, NBR_LT_loss_slope_1. Ranks without an event are NaN so every pixel
   * exports the same keys.
   */
  public Map<String, Double> toMap() {
    Map<String, Double> out = new LinkedHashMap<>();
    put(out, ChangeDirection.LOSS, losses);
    put(out, ChangeDirection.GAIN, gains);
    return out;
  }

  private void put(Map<String, Double> out, ChangeDirection direction, List<ChangeEvent> events) {
    String prefix = band.bandName() + "_LT_" + direction.label();
    for (int i = 0; i < howManyToPull; i++) {
      ChangeEvent e = i < events.size() ? events.get(i) : null;
      int rank = i + 1;
      out.put(prefix + "_yr_" + rank, e == null ? Double.NaN : e.yearOfDetection());
      out.put(prefix + "_dur_" + rank, e == null ? Double.NaN : e.duration());
      out.put(prefix + "_mag_" + rank, e == null ? Double.NaN : e.magnitude());
      out.put(prefix + "_slope_" + rank, e == null ? Double.NaN : e.slope());
    }
  }

  @Override
  public String toString() {
    return band.bandName() + " loss=" + losses + " gain=" + gains;
  }
}
