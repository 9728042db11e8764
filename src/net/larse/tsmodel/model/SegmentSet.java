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

package net.larse.tsmodel.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The segments one run fit for one band of a pixel, ordered by start time. Validity intervals may
 * overlap or leave gaps. The provenance id names the run (e.g. "early" and "late").
 */
public final class SegmentSet {
  private final String provenance;
  private final Band band;
  private final ImmutableList<Segment> segments;

  public SegmentSet(String provenance, Band band, List<Segment> segments) {
    Preconditions.checkNotNull(provenance, "provenance");
    Preconditions.checkNotNull(band, "band");
    for (Segment segment : segments) {
      Preconditions.checkArgument(segment.model().band() == band,
          "segment band %s does not match %s", segment.model().band(), band);
    }
    List<Segment> sorted = new ArrayList<>(segments);
    sorted.sort(Comparator.comparingDouble(Segment::start));
    this.provenance = provenance;
    this.band = band;
    this.segments = ImmutableList.copyOf(sorted);
  }

  public static SegmentSet empty(String provenance, Band band) {
    return new SegmentSet(provenance, band, ImmutableList.of());
  }

  public String provenance() {
    return provenance;
  }

  public Band band() {
    return band;
  }

  public ImmutableList<Segment> segments() {
    return segments;
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }

  public int size() {
    return segments.size();
  }

  public Segment get(int i) {
    return segments.get(i);
  }

  /** [earliest start, latest end] over all segments, empty for an empty set. */
  public Optional<Range<Double>> coverage() {
    if (segments.isEmpty()) {
      return Optional.empty();
    }
    double start = segments.get(0).start();
    double end = Double.NEGATIVE_INFINITY;
    for (Segment segment : segments) {
      end = Math.max(end, segment.end());
    }
    return Optional.of(Range.closed(start, end));
  }

  @Override
  public String toString() {
    return provenance + "/" + band.bandName() + segments;
  }
}
