package net.larse.tsmodel.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Per-band settings, resolved once when a run is configured: the frequencies to model the band
 * with and the sign convention for change.
 */
public final class BandConfig {
  private final Band band;
  private final int improvementDirection;
  private final ImmutableSortedSet<Integer> frequencies;

  public BandConfig(Band band, int improvementDirection, Collection<Integer> frequencies) {
    Preconditions.checkNotNull(band, "band");
    Preconditions.checkArgument(improvementDirection == 1 || improvementDirection == -1,
        "improvementDirection must be +1 or -1, was %s", improvementDirection);
    this.band = band;
    this.improvementDirection = improvementDirection;
    this.frequencies = checkFrequencies(frequencies);
  }

  /** A band configured with its default improvement direction. */
  public static BandConfig of(Band band, Integer... frequencies) {
    return new BandConfig(band, band.improvementDirection(), Arrays.asList(frequencies));
  }

  /**
   * Validates a frequency set: non-empty, positive integers. Duplicates are collapsed and the
   * result is sorted ascending.
   */
  public static ImmutableSortedSet<Integer> checkFrequencies(Collection<Integer> frequencies) {
    Preconditions.checkNotNull(frequencies, "frequencies");
    Preconditions.checkArgument(!frequencies.isEmpty(), "at least one frequency is required");
    for (Integer k : frequencies) {
      Preconditions.checkArgument(k != null && k > 0, "frequencies must be positive: %s",
          frequencies);
    }
    return ImmutableSortedSet.copyOf(frequencies);
  }

  public Band band() {
    return band;
  }

  public int improvementDirection() {
    return improvementDirection;
  }

  public ImmutableSortedSet<Integer> frequencies() {
    return frequencies;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BandConfig)) {
      return false;
    }
    BandConfig that = (BandConfig) o;
    return band == that.band
        && improvementDirection == that.improvementDirection
        && frequencies.equals(that.frequencies);
  }

  @Override
  public int hashCode() {
    return Objects.hash(band, improvementDirection, frequencies);
  }

  @Override
  public String toString() {
    return band.bandName() + frequencies + (improvementDirection > 0 ? "+" : "-");
  }
}
