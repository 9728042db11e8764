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
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

import net.larse.tsmodel.model.AnnualFit;
import net.larse.tsmodel.model.Band;
import net.larse.tsmodel.model.BandConfig;
import net.larse.tsmodel.model.ChangeDirection;
import net.larse.tsmodel.model.ChangeEvent;
import net.larse.tsmodel.model.ChangeSummary;
import net.larse.tsmodel.model.RankedEvents;
import net.larse.tsmodel.model.SelectionRule;
import net.larse.tsmodel.model.Trajectory;
import net.larse.tsmodel.model.Vertex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the vertices of a LandTrendr trajectory into loss and gain events, filters out the
 * insignificant ones and picks the top events of each direction.
 *
 * <p>Thresholds are signed like the changes they describe (negative for losses) but are compared
 * by absolute value, so a loss threshold of -0.15 and one of 0.15 behave the same.
 */
public class TrajectorySegmenter {
  private static final Logger log = LoggerFactory.getLogger(TrajectorySegmenter.class);

  public static final class Config {
    private final double lossMagnitudeThreshold;
    private final double lossSlopeThreshold;
    private final double gainMagnitudeThreshold;
    private final double gainSlopeThreshold;
    private final int slowLossDurationThreshold;
    private final SelectionRule lossRule;
    private final SelectionRule gainRule;
    private final int howManyToPull;

    public Config(double lossMagnitudeThreshold, double lossSlopeThreshold,
        double gainMagnitudeThreshold, double gainSlopeThreshold, int slowLossDurationThreshold,
        SelectionRule lossRule, SelectionRule gainRule, int howManyToPull) {
      Preconditions.checkArgument(howManyToPull >= 1, "howManyToPull must be >= 1");
      Preconditions.checkArgument(slowLossDurationThreshold >= 1,
          "slowLossDurationThreshold must be >= 1");
      this.lossMagnitudeThreshold = lossMagnitudeThreshold;
      this.lossSlopeThreshold = lossSlopeThreshold;
      this.gainMagnitudeThreshold = gainMagnitudeThreshold;
      this.gainSlopeThreshold = gainSlopeThreshold;
      this.slowLossDurationThreshold = slowLossDurationThreshold;
      this.lossRule = Preconditions.checkNotNull(lossRule);
      this.gainRule = Preconditions.checkNotNull(gainRule);
      this.howManyToPull = howManyToPull;
    }

    /** The thresholds used for NBR-scaled indices: largest single loss and gain. */
    public static Config defaults() {
      return new Config(-0.15, -0.05, 0.1, 0.05, 3,
          SelectionRule.LARGEST, SelectionRule.LARGEST, 1);
    }

    public Config withHowManyToPull(int howManyToPull) {
      return new Config(lossMagnitudeThreshold, lossSlopeThreshold, gainMagnitudeThreshold,
          gainSlopeThreshold, slowLossDurationThreshold, lossRule, gainRule, howManyToPull);
    }

    public Config withRules(SelectionRule lossRule, SelectionRule gainRule) {
      return new Config(lossMagnitudeThreshold, lossSlopeThreshold, gainMagnitudeThreshold,
          gainSlopeThreshold, slowLossDurationThreshold, lossRule, gainRule, howManyToPull);
    }

    public double lossMagnitudeThreshold() {
      return lossMagnitudeThreshold;
    }

    public double lossSlopeThreshold() {
      return lossSlopeThreshold;
    }

    public double gainMagnitudeThreshold() {
      return gainMagnitudeThreshold;
    }

    public double gainSlopeThreshold() {
      return gainSlopeThreshold;
    }

    public int slowLossDurationThreshold() {
      return slowLossDurationThreshold;
    }

    public SelectionRule lossRule() {
      return lossRule;
    }

    public SelectionRule gainRule() {
      return gainRule;
    }

    public int howManyToPull() {
      return howManyToPull;
    }
  }

  private final Config config;

  public TrajectorySegmenter(Config config) {
    this.config = Preconditions.checkNotNull(config);
  }

  public Config config() {
    return config;
  }

  /**
   * One event per pair of consecutive vertices whose fitted values differ, in chronological
   * order.
   */
  public static List<ChangeEvent> extractEvents(Trajectory trajectory, int improvementDirection) {
    Preconditions.checkArgument(improvementDirection == 1 || improvementDirection == -1,
        "improvementDirection must be +1 or -1");
    List<ChangeEvent> events = new ArrayList<>();
    for (int i = 0; i < trajectory.numSegments(); i++) {
      ChangeEvent event =
          ChangeEvent.between(trajectory.get(i), trajectory.get(i + 1), improvementDirection);
      if (event != null) {
        events.add(event);
      }
    }
    return events;
  }

  /**
   * Drops events that are both smaller than magThreshold and flatter than slopeThreshold, and
   * tags the remaining losses as slow when they last at least durationThreshold years. Applies
   * the same thresholds to both directions; each output list stays in chronological order.
   */
  public static RankedEvents filterAndRank(List<ChangeEvent> events, double magThreshold,
      double slopeThreshold, int durationThreshold) {
    List<ChangeEvent> losses = new ArrayList<>();
    List<ChangeEvent> gains = new ArrayList<>();
    for (ChangeEvent e : events) {
      if (!isSignificant(e, magThreshold, slopeThreshold)) {
        continue;
      }
      if (e.direction() == ChangeDirection.LOSS) {
        losses.add(tagPace(e, durationThreshold));
      } else {
        gains.add(e);
      }
    }
    return new RankedEvents(losses, gains);
  }

  /** Like filterAndRank, with the configured loss and gain thresholds. */
  public RankedEvents filter(List<ChangeEvent> events) {
    List<ChangeEvent> losses = new ArrayList<>();
    List<ChangeEvent> gains = new ArrayList<>();
    for (ChangeEvent e : events) {
      if (e.direction() == ChangeDirection.LOSS) {
        if (isSignificant(e, config.lossMagnitudeThreshold(), config.lossSlopeThreshold())) {
          losses.add(tagPace(e, config.slowLossDurationThreshold()));
        }
      } else if (isSignificant(e, config.gainMagnitudeThreshold(), config.gainSlopeThreshold())) {
        gains.add(e);
      }
    }
    return new RankedEvents(losses, gains);
  }

  /**
   * The first k events under rule. Ties are broken by end year, newest first, and then by the
   * order of events.
   */
  public static List<ChangeEvent> selectTopK(List<ChangeEvent> events, SelectionRule rule,
      int k) {
    Preconditions.checkArgument(k >= 1, "k must be >= 1");
    List<ChangeEvent> sorted = new ArrayList<>(events);
    // List.sort is stable
    sorted.sort(rule.comparator());
    return ImmutableList.copyOf(sorted.subList(0, Math.min(k, sorted.size())));
  }

  /** Extracts, filters and ranks the events of one band's trajectory. */
  public ChangeSummary summarize(Trajectory trajectory, BandConfig band) {
    return summarize(trajectory, band.band(), band.improvementDirection());
  }

  /** Like summarize(Trajectory, BandConfig), with the band's default improvement direction. */
  public ChangeSummary summarize(Trajectory trajectory, Band band) {
    return summarize(trajectory, band, band.improvementDirection());
  }

  private ChangeSummary summarize(Trajectory trajectory, Band band, int improvementDirection) {
    List<ChangeEvent> events = extractEvents(trajectory, improvementDirection);
    RankedEvents retained = filter(events);
    List<ChangeEvent> losses =
        selectTopK(retained.losses(), config.lossRule(), config.howManyToPull());
    List<ChangeEvent> gains =
        selectTopK(retained.gains(), config.gainRule(), config.howManyToPull());
    log.debug("{}: {} events, {} losses and {} gains retained", band, events.size(),
        retained.losses().size(), retained.gains().size());
    return new ChangeSummary(band, config.howManyToPull(), losses, gains);
  }

  /**
   * The fitted value of every year from startYear to endYear inclusive, with the change
   * attributes of the segment each year falls in. Years outside the trajectory take the value of
   * the nearest vertex and the attributes of the nearest segment.
   */
  public static List<AnnualFit> fitAnnual(Trajectory trajectory, int startYear, int endYear) {
    Preconditions.checkArgument(startYear <= endYear, "startYear after endYear");
    List<AnnualFit> out = new ArrayList<>(endYear - startYear + 1);
    for (int year = startYear; year <= endYear; year++) {
      int segment = trajectory.segmentIndex(year);
      Vertex a = trajectory.get(segment);
      Vertex b = trajectory.get(segment + 1);
      int duration = b.year() - a.year();
      double magnitude = b.fittedValue() - a.fittedValue();
      out.add(new AnnualFit(year, trajectory.valueAt(year), magnitude, magnitude / duration,
          duration));
    }
    return out;
  }

  private static boolean isSignificant(ChangeEvent e, double magThreshold,
      double slopeThreshold) {
    boolean small = Math.abs(e.magnitude()) < Math.abs(magThreshold);
    boolean flat = Math.abs(e.slope()) < Math.abs(slopeThreshold);
    return !(small && flat);
  }

  private static ChangeEvent tagPace(ChangeEvent loss, int durationThreshold) {
    return loss.withPace(loss.duration() >= durationThreshold
        ? ChangeEvent.Pace.SLOW : ChangeEvent.Pace.FAST);
  }
}
