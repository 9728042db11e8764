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
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Range;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A fitted harmonic model of one band:
 *
 * <pre>
 *   f(t) = intercept + slope * (t - timeOrigin) + sum_k (cos_k * cos(k*PI*t) + sin_k * sin(k*PI*t))
 * </pre>
 *
 * where t is in fractional years and k runs over the model frequencies. A frequency of 2 is one
 * cycle per year, 4 two cycles, and so on. The slope term only exists for detrended models.
 *
 * <p>The coefficient vector is laid out as [intercept, (slope), cos_k1, sin_k1, cos_k2, ...], which
 * is also the layout of a CCDC segment's coefficient array.
 *
 * <p>Instances are immutable.
 */
public final class HarmonicModel {
  /** The frequencies of a CCDC coefficient vector: 1, 2 and 3 cycles per year. */
  public static final ImmutableSortedSet<Integer> CCDC_FREQUENCIES = ImmutableSortedSet.of(2, 4, 6);

  private final Band band;
  private final ImmutableSortedSet<Integer> frequencies;
  private final boolean detrended;
  private final double timeOrigin;
  private final double[] coefficients;
  private final double rmse;
  private final int numObservations;
  private final Range<Double> validity;

  public HarmonicModel(Band band,
      Collection<Integer> frequencies,
      boolean detrended,
      double timeOrigin,
      double[] coefficients,
      double rmse,
      int numObservations,
      Range<Double> validity) {
    Preconditions.checkNotNull(band, "band");
    this.band = band;
    this.frequencies = BandConfig.checkFrequencies(frequencies);
    this.detrended = detrended;
    this.timeOrigin = timeOrigin;
    Preconditions.checkArgument(coefficients.length == coefficientCount(this.frequencies, detrended),
        "expected %s coefficients, got %s", coefficientCount(this.frequencies, detrended),
        coefficients.length);
    this.coefficients = coefficients.clone();
    this.rmse = rmse;
    this.numObservations = numObservations;
    this.validity = validity;
  }

  /**
   * Wraps the coefficients of one band of a CCDC segment, [intercept, slope, cos1, sin1, cos2,
   * sin2, cos3, sin3], valid over [start, end). CCDC measures the slope from year 0.
   */
  public static HarmonicModel fromCcdcCoefficients(Band band, double[] coefs, double start,
      double end) {
    Preconditions.checkArgument(coefs.length == 8, "a CCDC coefficient vector has 8 entries");
    return new HarmonicModel(band, CCDC_FREQUENCIES, true, 0, coefs, Double.NaN, 0,
        Range.closedOpen(start, end));
  }

  /** Number of regression coefficients for a frequency set. */
  public static int coefficientCount(Set<Integer> frequencies, boolean detrended) {
    return 1 + (detrended ? 1 : 0) + 2 * frequencies.size();
  }

  public Band band() {
    return band;
  }

  public ImmutableSortedSet<Integer> frequencies() {
    return frequencies;
  }

  public boolean isDetrended() {
    return detrended;
  }

  public double timeOrigin() {
    return timeOrigin;
  }

  public double[] coefficients() {
    return coefficients.clone();
  }

  public int coefficientCount() {
    return coefficients.length;
  }

  public double rmse() {
    return rmse;
  }

  public int numObservations() {
    return numObservations;
  }

  public double intercept() {
    return coefficients[0];
  }

  /** The trend per year; 0 for models fit without detrending. */
  public double slope() {
    return detrended ? coefficients[1] : 0;
  }

  public double cos(int frequency) {
    return coefficients[harmonicIndex(frequency)];
  }

  public double sin(int frequency) {
    return coefficients[harmonicIndex(frequency) + 1];
  }

  private int harmonicIndex(int frequency) {
    int offset = detrended ? 2 : 1;
    int i = 0;
    for (int k : frequencies) {
      if (k == frequency) {
        return offset + 2 * i;
      }
      i++;
    }
    throw new IllegalArgumentException(
        "frequency " + frequency + " is not part of " + band.bandName() + frequencies);
  }

  public Optional<Range<Double>> validity() {
    return Optional.ofNullable(validity);
  }

  /** True if the model has a validity interval and t falls in it. */
  public boolean covers(double t) {
    return validity != null && validity.contains(t);
  }

  /** A copy of this model restricted to [start, end). */
  public HarmonicModel withValidity(double start, double end) {
    return new HarmonicModel(band, frequencies, detrended, timeOrigin, coefficients, rmse,
        numObservations, Range.closedOpen(start, end));
  }

  /** Evaluates the full model at t. */
  public double value(double t) {
    return value(t, frequencies);
  }

  /**
   * Evaluates the intercept, the trend, and only those harmonic terms whose frequency is in
   * harmonics, which must all be frequencies of this model.
   */
  public double value(double t, Set<Integer> harmonics) {
    Preconditions.checkArgument(frequencies.containsAll(harmonics),
        "%s: harmonics %s not all in %s", band, harmonics, frequencies);
    double v = coefficients[0];
    int idx = 1;
    if (detrended) {
      v += coefficients[idx++] * (t - timeOrigin);
    }
    for (int k : frequencies) {
      if (harmonics.contains(k)) {
        double rx = k * Math.PI * t;
        v += coefficients[idx] * Math.cos(rx) + coefficients[idx + 1] * Math.sin(rx);
      }
      idx += 2;
    }
    return v;
  }

  /** The intercept plus all harmonic terms, without the trend. */
  public double seasonalValue(double t) {
    double v = coefficients[0];
    int idx = detrended ? 2 : 1;
    for (int k : frequencies) {
      double rx = k * Math.PI * t;
      v += coefficients[idx] * Math.cos(rx) + coefficients[idx + 1] * Math.sin(rx);
      idx += 2;
    }
    return v;
  }

  /**
   * Flat export record: intercept, slope (when detrended), cos/sin per frequency and the fit
   * RMSE, keyed by band name, e.g. NDVI_intercept, NDVI_cos2, NDVI_rmse.
   */
  public Map<String, Double> toMap() {
    String prefix = band.bandName() + "_";
    Map<String, Double> out = new LinkedHashMap<>();
    out.put(prefix + "intercept", intercept());
    if (detrended) {
      out.put(prefix + "slope", slope());
    }
    for (int k : frequencies) {
      out.put(prefix + "cos" + k, cos(k));
      out.put(prefix + "sin" + k, sin(k));
    }
    out.put(prefix + "rmse", rmse);
    return out;
  }

  @Override
  public String toString() {
    return band.bandName() + frequencies + (detrended ? " detrended" : "")
        + " coefs=" + Arrays.toString(coefficients)
        + (validity == null ? "" : " valid=" + validity);
  }
}
