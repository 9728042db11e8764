/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.tsmodel.algorithms;

import com.google.common.base.Preconditions;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import net.larse.tsmodel.model.Band;
import net.larse.tsmodel.model.BreakChange;
import net.larse.tsmodel.model.ChangeDirection;
import net.larse.tsmodel.model.Segment;
import net.larse.tsmodel.model.SegmentSet;

/**
 * Picks the loss and gain of a CCDC run: among the breaks that are likely enough to be real
 * changes, the most recent one or the one with the highest magnitude, per direction.
 */
public class BreakChangeDetector {
  public enum SortingMethod {
    MOST_RECENT("mostRecent",
        Comparator.comparingDouble(BreakChange::breakDate).reversed()),
    HIGHEST_MAGNITUDE("highestMag",
        Comparator.comparingDouble((BreakChange b) -> Math.abs(b.magnitude())).reversed());

    private final String methodName;
    private final Comparator<BreakChange> order;

    SortingMethod(String methodName, Comparator<BreakChange> order) {
      this.methodName = methodName;
      this.order = order;
    }

    public String methodName() {
      return methodName;
    }

    public static SortingMethod fromName(String name) {
      for (SortingMethod method : values()) {
        if (method.methodName.equals(name)) {
          return method;
        }
      }
      throw new IllegalArgumentException("Unknown sorting method: " + name);
    }
  }

  public static final class Config {
    private final double changeProbabilityThreshold;
    private final SortingMethod sortingMethod;

    public Config(double changeProbabilityThreshold, SortingMethod sortingMethod) {
      Preconditions.checkArgument(
          changeProbabilityThreshold >= 0 && changeProbabilityThreshold <= 1,
          "changeProbabilityThreshold must be in [0, 1]");
      this.changeProbabilityThreshold = changeProbabilityThreshold;
      this.sortingMethod = Preconditions.checkNotNull(sortingMethod);
    }

    /** Confirmed breaks only, most recent first. */
    public static Config defaults() {
      return new Config(1.0, SortingMethod.MOST_RECENT);
    }

    public double changeProbabilityThreshold() {
      return changeProbabilityThreshold;
    }

    public SortingMethod sortingMethod() {
      return sortingMethod;
    }
  }

  /** The selected loss and gain breaks of one band. */
  public static final class Result {
    private final Band band;
    private final BreakChange loss;
    private final BreakChange gain;

    Result(Band band, BreakChange loss, BreakChange gain) {
      this.band = band;
      this.loss = loss;
      this.gain = gain;
    }

    public Band band() {
      return band;
    }

    public Optional<BreakChange> loss() {
      return Optional.ofNullable(loss);
    }

    public Optional<BreakChange> gain() {
      return Optional.ofNullable(gain);
    }

    public Optional<BreakChange> get(ChangeDirection direction) {
      return direction == ChangeDirection.LOSS ? loss() : gain();
    }

    /** Flat record keyed e.g. NDVI_CCDC_loss_year, NDVI_CCDC_loss_mag; NaN when absent. */
    public Map<String, Double> toMap() {
      Map<String, Double> out = new LinkedHashMap<>();
      for (ChangeDirection direction : ChangeDirection.values()) {
        String prefix = band.bandName() + "_CCDC_" + direction.label();
        Optional<BreakChange> b = get(direction);
        out.put(prefix + "_year", b.isPresent() ? b.get().year() : Double.NaN);
        out.put(prefix + "_mag", b.isPresent() ? b.get().magnitude() : Double.NaN);
      }
      return out;
    }

    @Override
    public String toString() {
      return band.bandName() + " loss=" + loss + " gain=" + gain;
    }
  }

  private final Config config;

  public BreakChangeDetector(Config config) {
    this.config = Preconditions.checkNotNull(config);
  }

  /** Selects the loss and gain breaks of set, using the band's default improvement direction. */
  public Result detect(SegmentSet set) {
    return detect(set, set.band().improvementDirection());
  }

  public Result detect(SegmentSet set, int improvementDirection) {
    Preconditions.checkArgument(improvementDirection == 1 || improvementDirection == -1,
        "improvementDirection must be +1 or -1");
    Comparator<BreakChange> order = config.sortingMethod().order;
    BreakChange loss = null;
    BreakChange gain = null;
    for (Segment segment : set.segments()) {
      if (!segment.hasBreak()
          || segment.changeProbability() < config.changeProbabilityThreshold()) {
        continue;
      }
      ChangeDirection direction =
          ChangeDirection.classify(segment.magnitude(), improvementDirection);
      BreakChange candidate =
          new BreakChange(direction, segment.breakDate(), segment.magnitude());
      // strict comparison keeps the earlier segment on ties
      if (direction == ChangeDirection.LOSS) {
        if (loss == null || order.compare(candidate, loss) < 0) {
          loss = candidate;
        }
      } else if (gain == null || order.compare(candidate, gain) < 0) {
        gain = candidate;
      }
    }
    return new Result(set.band(), loss, gain);
  }
}
