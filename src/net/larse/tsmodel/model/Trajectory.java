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

import java.util.ArrayList;
import java.util.List;

/**
 * The piecewise-linear fit of one pixel, as a sequence of at least two vertices with strictly
 * increasing years. Segment i runs from vertex i to vertex i + 1.
 */
public final class Trajectory {
  // LandTrendr output array rows.
  private static final int ROW_YEAR = 0;
  private static final int ROW_FITTED = 2;
  private static final int ROW_IS_VERTEX = 3;

  private final ImmutableList<Vertex> vertices;

  public Trajectory(List<Vertex> vertices) {
    Preconditions.checkArgument(vertices.size() >= 2,
        "a trajectory needs at least 2 vertices, got %s", vertices.size());
    for (int i = 1; i < vertices.size(); i++) {
      Preconditions.checkArgument(vertices.get(i).year() > vertices.get(i - 1).year(),
          "vertex years must be strictly increasing: %s", vertices);
    }
    this.vertices = ImmutableList.copyOf(vertices);
  }

  /** Builds a trajectory from parallel year/value arrays. */
  public static Trajectory of(int[] years, double[] values) {
    Preconditions.checkArgument(years.length == values.length,
        "years and values differ in length");
    List<Vertex> vertices = new ArrayList<>(years.length);
    for (int i = 0; i < years.length; i++) {
      vertices.add(new Vertex(years[i], values[i]));
    }
    return new Trajectory(vertices);
  }

  /**
   * Extracts the vertices from a LandTrendr output array. The array has 4 rows (year, raw value,
   * fitted value, 1 if the year is a vertex else 0) and one column per year. Fitted values are
   * multiplied by multiplier, e.g. 0.0001 to undo a 10000 scaling before export.
   */
  public static Trajectory fromLandTrendrArray(double[][] array, double multiplier) {
    Preconditions.checkArgument(array.length == 4, "expected 4 rows, got %s", array.length);
    List<Vertex> vertices = new ArrayList<>();
    for (int i = 0; i < array[ROW_YEAR].length; i++) {
      if (array[ROW_IS_VERTEX][i] == 1) {
        vertices.add(new Vertex((int) array[ROW_YEAR][i], array[ROW_FITTED][i] * multiplier));
      }
    }
    return new Trajectory(vertices);
  }

  public ImmutableList<Vertex> vertices() {
    return vertices;
  }

  public int size() {
    return vertices.size();
  }

  public int numSegments() {
    return vertices.size() - 1;
  }

  public Vertex get(int i) {
    return vertices.get(i);
  }

  public int firstYear() {
    return vertices.get(0).year();
  }

  public int lastYear() {
    return vertices.get(vertices.size() - 1).year();
  }

  /**
   * Index of the segment containing year: the last segment whose start vertex is at or before
   * year. Years outside the trajectory clamp to the first or last segment.
   */
  public int segmentIndex(int year) {
    int lo = 0;
    int hi = numSegments() - 1;
    while (lo < hi) {
      int mid = (lo + hi + 1) >>> 1;
      if (vertices.get(mid).year() <= year) {
        lo = mid;
      } else {
        hi = mid - 1;
      }
    }
    return lo;
  }

  /**
   * The fitted value at year, interpolating linearly between vertices. Before the first vertex
   * the first value is returned, after the last vertex the last value.
   */
  public double valueAt(double year) {
    if (year <= firstYear()) {
      return vertices.get(0).fittedValue();
    }
    if (year >= lastYear()) {
      return vertices.get(vertices.size() - 1).fittedValue();
    }
    int segment = segmentIndex((int) Math.floor(year));
    Vertex a = vertices.get(segment);
    Vertex b = vertices.get(segment + 1);
    double slope = (b.fittedValue() - a.fittedValue()) / (b.year() - a.year());
    return a.fittedValue() + (year - a.year()) * slope;
  }

  @Override
  public String toString() {
    return vertices.toString();
  }
}
