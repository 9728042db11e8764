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
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Range;

import java.util.Collection;
import java.util.Optional;

import net.larse.tsmodel.model.HarmonicModel;
import net.larse.tsmodel.model.Segment;
import net.larse.tsmodel.model.SegmentSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Predicts values from segmented harmonic runs, optionally blending two runs (e.g. an older
 * archive and a newer one) linearly across a feather window.
 */
public class SegmentedPredictor {
  private static final Logger log = LoggerFactory.getLogger(SegmentedPredictor.class);

  /** The feather window is empty, reversed, or outside the runs being blended. */
  public static class InvalidFeatherWindowException extends IllegalArgumentException {
    public InvalidFeatherWindowException(String message) {
      super(message);
    }
  }

  public static final class Config {
    private final boolean fillGaps;
    private final Double featherStart;
    private final Double featherEnd;
    private final ImmutableSortedSet<Integer> harmonics;

    /**
     * @param fillGaps carry a segment forward over the gap up to its break date.
     * @param featherStart start of the feather window, or null to predict from one run only.
     * @param featherEnd end of the feather window, or null.
     * @param harmonics frequencies to use when predicting, or null for all of them.
     */
    public Config(boolean fillGaps, Double featherStart, Double featherEnd,
        Collection<Integer> harmonics) {
      Preconditions.checkArgument((featherStart == null) == (featherEnd == null),
          "featherStart and featherEnd must be given together");
      if (featherStart != null && !(featherStart < featherEnd)) {
        throw new InvalidFeatherWindowException(String.format(
            "featherStart (%s) must be before featherEnd (%s)", featherStart, featherEnd));
      }
      this.fillGaps = fillGaps;
      this.featherStart = featherStart;
      this.featherEnd = featherEnd;
      this.harmonics = harmonics == null ? null : ImmutableSortedSet.copyOf(harmonics);
    }

    public static Config of(boolean fillGaps) {
      return new Config(fillGaps, null, null, null);
    }

    public static Config feathered(boolean fillGaps, double featherStart, double featherEnd) {
      return new Config(fillGaps, featherStart, featherEnd, null);
    }

    public boolean fillGaps() {
      return fillGaps;
    }

    public boolean isFeathered() {
      return featherStart != null;
    }

    public double featherStart() {
      Preconditions.checkState(isFeathered(), "no feather window");
      return featherStart;
    }

    public double featherEnd() {
      Preconditions.checkState(isFeathered(), "no feather window");
      return featherEnd;
    }

    public Optional<ImmutableSortedSet<Integer>> harmonics() {
      return Optional.ofNullable(harmonics);
    }
  }

  private final Config config;

  public SegmentedPredictor(Config config) {
    this.config = Preconditions.checkNotNull(config);
  }

  public Config config() {
    return config;
  }

  /**
   * Finds the model to predict t with: the segment whose [start, end) contains t, the latest
   * starting one if segments overlap. With fillGaps, a t falling between segments is predicted by
   * the segment that ended most recently before t, as long as t is before that segment's break
   * date.
   */
  public static Optional<HarmonicModel> selectActiveSegment(SegmentSet set, double t,
      boolean fillGaps) {
    // index of the last segment starting at or before t
    int lo = 0;
    int hi = set.size() - 1;
    int found = -1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      if (set.get(mid).start() <= t) {
        found = mid;
        lo = mid + 1;
      } else {
        hi = mid - 1;
      }
    }
    if (found < 0) {
      return Optional.empty();
    }
    for (int i = found; i >= 0; i--) {
      Segment segment = set.get(i);
      if (t < segment.end()) {
        return Optional.of(segment.model());
      }
    }
    if (!fillGaps) {
      return Optional.empty();
    }
    // none of segments 0..found contains t, so all of them ended at or before t
    Segment preceding = set.get(found);
    for (int i = found - 1; i >= 0; i--) {
      if (set.get(i).end() > preceding.end()) {
        preceding = set.get(i);
      }
    }
    if (preceding.hasBreak() && t < preceding.breakDate()) {
      return Optional.of(preceding.model());
    }
    return Optional.empty();
  }

  /** The value of the active segment at t, NaN if there is none. */
  public double predict(SegmentSet set, double t) {
    Optional<HarmonicModel> model = selectActiveSegment(set, t, config.fillGaps());
    return model.isPresent() ? evaluate(model.get(), t) : Double.NaN;
  }

  /**
   * Blends older run a into newer run b using the configured feather window: a alone before the
   * window, b alone from its end on, and linear weights in between. Inside the window, where one
   * run has no active segment the other is used. Elsewhere a missing segment gives NaN.
   */
  public double predictFeathered(SegmentSet a, SegmentSet b, double t) {
    Preconditions.checkState(config.isFeathered(), "no feather window configured");
    checkFeatherWindow(a, b, config.featherStart(), config.featherEnd());
    return blend(a, b, t);
  }

  /**
   * Feathered prediction with an explicit window.
   *
   * @throws InvalidFeatherWindowException if featherStart is not before featherEnd, or the window
   *     lies outside the combined coverage of a and b.
   */
  public static double predictFeathered(SegmentSet a, SegmentSet b, double t,
      double featherStart, double featherEnd, boolean fillGaps) {
    Config config = new Config(fillGaps, featherStart, featherEnd, null);
    return new SegmentedPredictor(config).predictFeathered(a, b, t);
  }

  /**
   * Predicts every date. Blends a and b when a feather window is configured and b is given,
   * otherwise predicts from a alone.
   */
  public double[] predictSeries(SegmentSet a, SegmentSet b, double[] dates) {
    boolean feather = config.isFeathered() && b != null;
    if (feather) {
      checkFeatherWindow(a, b, config.featherStart(), config.featherEnd());
    }
    double[] out = new double[dates.length];
    int missing = 0;
    for (int i = 0; i < dates.length; i++) {
      out[i] = feather ? blend(a, b, dates[i]) : predict(a, dates[i]);
      if (Double.isNaN(out[i])) {
        missing++;
      }
    }
    if (missing > 0) {
      log.debug("{} of {} dates of band {} have no active segment",
          missing, dates.length, a.band());
    }
    return out;
  }

  private double blend(SegmentSet a, SegmentSet b, double t) {
    double start = config.featherStart();
    double end = config.featherEnd();
    if (t < start) {
      return predict(a, t);
    }
    if (t >= end) {
      return predict(b, t);
    }
    double va = predict(a, t);
    double vb = predict(b, t);
    if (Double.isNaN(va)) {
      return vb;
    }
    if (Double.isNaN(vb)) {
      return va;
    }
    double w = (t - start) / (end - start);
    return (1 - w) * va + w * vb;
  }

  private double evaluate(HarmonicModel model, double t) {
    Optional<ImmutableSortedSet<Integer>> harmonics = config.harmonics();
    if (!harmonics.isPresent()) {
      return model.value(t);
    }
    HarmonicFitter.checkHarmonics(model, harmonics.get());
    return model.value(t, harmonics.get());
  }

  private static void checkFeatherWindow(SegmentSet a, SegmentSet b, double start, double end) {
    Preconditions.checkArgument(a.band() == b.band(),
        "cannot blend band %s into band %s", a.band(), b.band());
    Optional<Range<Double>> coverage = union(a.coverage(), b.coverage());
    if (!coverage.isPresent()) {
      // nothing to predict from, every date yields NaN
      return;
    }
    Range<Double> span = coverage.get();
    if (start < span.lowerEndpoint() || end > span.upperEndpoint()) {
      throw new InvalidFeatherWindowException(String.format(
          "feather window [%s, %s) lies outside the coverage %s of band %s",
          start, end, span, a.band()));
    }
  }

  private static Optional<Range<Double>> union(Optional<Range<Double>> a,
      Optional<Range<Double>> b) {
    if (!a.isPresent()) {
      return b;
    }
    if (!b.isPresent()) {
      return a;
    }
    return Optional.of(a.get().span(b.get()));
  }
}
