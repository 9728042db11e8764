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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import net.larse.tsmodel.helper.LinearLeastSquares;
import net.larse.tsmodel.model.Band;
import net.larse.tsmodel.model.BandConfig;
import net.larse.tsmodel.model.DerivedSeasonality;
import net.larse.tsmodel.model.HarmonicFit;
import net.larse.tsmodel.model.HarmonicModel;
import net.larse.tsmodel.model.Observation;

import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.integration.TrapezoidIntegrator;
import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Harmonic regression of per-pixel time series. Each band is fit by ordinary least squares to
 *
 * <pre>
 *   f(t) = a0 + [b0 * (t - t0)] + sum_k (a_k * cos(k*PI*t) + b_k * sin(k*PI*t))
 * </pre>
 *
 * with t in fractional years, so that frequency 2 is the annual cycle, 4 the semi-annual one, and
 * so on. The trend term is only included when detrending, and is measured from t0, the calendar
 * year of the earliest observation.
 *
 * <p>Bands that share a frequency set and have the same missing observations share one design
 * matrix and are solved together.
 *
 * <p>A fitter holds only its immutable configuration and may be shared between threads.
 */
public class HarmonicFitter {
  private static final Logger log = LoggerFactory.getLogger(HarmonicFitter.class);

  /** The frequency of the annual cycle, which the seasonality metrics are derived from. */
  public static final int ANNUAL_FREQUENCY = 2;

  private static final int DAYS_IN_YEAR = 365;

  private static final double PHASE_TOLERANCE = 1e-9;

  /** A per-pixel failure: the pixel gets no-data for this band, the batch continues. */
  public static class FitException extends Exception {
    private final Band band;

    public FitException(Band band, String message) {
      super(message);
      this.band = band;
    }

    public Band band() {
      return band;
    }
  }

  /** Fewer valid observations than the model needs. */
  public static class InsufficientDataException extends FitException {
    private final int validCount;
    private final int required;

    public InsufficientDataException(Band band, int validCount, int required) {
      super(band, String.format("%s: %d valid observations, %d required",
          band.bandName(), validCount, required));
      this.validCount = validCount;
      this.required = required;
    }

    public int validCount() {
      return validCount;
    }

    public int required() {
      return required;
    }
  }

  /** The design matrix is rank deficient, e.g. all observations share one timestamp. */
  public static class SingularFitException extends FitException {
    public SingularFitException(Band band, int validCount) {
      super(band, String.format("%s: singular design matrix over %d observations",
          band.bandName(), validCount));
    }
  }

  /** Seasonality metrics were requested for a model without the annual frequency. */
  public static class UnsupportedFrequencyException extends IllegalArgumentException {
    public UnsupportedFrequencyException(String message) {
      super(message);
    }
  }

  /** The bands to fit, each with its frequency set, and whether to detrend. */
  public static final class Config {
    private final ImmutableList<BandConfig> bands;
    private final boolean detrend;

    public Config(List<BandConfig> bands, boolean detrend) {
      Preconditions.checkArgument(!bands.isEmpty(), "at least one band is required");
      Set<Band> seen = EnumSet.noneOf(Band.class);
      for (BandConfig bandConfig : bands) {
        Preconditions.checkArgument(seen.add(bandConfig.band()),
            "band %s configured twice", bandConfig.band());
      }
      this.bands = ImmutableList.copyOf(bands);
      this.detrend = detrend;
    }

    /** All bands with the same frequencies and their default improvement directions. */
    public static Config of(Collection<Integer> frequencies, boolean detrend, Band... bands) {
      List<BandConfig> configs = new ArrayList<>();
      for (Band band : bands) {
        configs.add(new BandConfig(band, band.improvementDirection(), frequencies));
      }
      return new Config(configs, detrend);
    }

    public ImmutableList<BandConfig> bands() {
      return bands;
    }

    public boolean detrend() {
      return detrend;
    }
  }

  private final Config config;

  public HarmonicFitter(Config config) {
    this.config = Preconditions.checkNotNull(config);
  }

  public Config config() {
    return config;
  }

  /**
   * Fits every configured band. A band that cannot be fit is recorded in
   * {@link HarmonicFit#failures()} and gets NaN fitted values; the other bands are unaffected.
   *
   * @throws InsufficientDataException if no band has {@link #minimumObservations} valid
   *     observations, or SingularFitException if no band could be solved. The first failure of
   *     the configured bands is thrown.
   */
  public HarmonicFit fit(List<Observation> observations) throws FitException {
    double origin = timeOrigin(observations);

    // group bands that can share a design matrix, keeping the configured order
    Map<DesignKey, List<Band>> groups = new LinkedHashMap<>();
    for (BandConfig bandConfig : config.bands()) {
      BitSet mask = new BitSet(observations.size());
      for (int i = 0; i < observations.size(); i++) {
        if (observations.get(i).isValid(bandConfig.band())) {
          mask.set(i);
        }
      }
      groups.computeIfAbsent(new DesignKey(bandConfig.frequencies(), mask),
          key -> new ArrayList<>()).add(bandConfig.band());
    }
    log.debug("Fitting {} bands over {} observations in {} groups",
        config.bands().size(), observations.size(), groups.size());

    Map<Band, HarmonicModel> models = new EnumMap<>(Band.class);
    Map<Band, double[]> fitted = new EnumMap<>(Band.class);
    Map<Band, String> failures = new EnumMap<>(Band.class);
    FitException firstFailure = null;
    for (Map.Entry<DesignKey, List<Band>> group : groups.entrySet()) {
      DesignKey key = group.getKey();
      try {
        for (HarmonicModel model : solve(observations, key.mask, group.getValue(),
            key.frequencies, config.detrend(), origin)) {
          models.put(model.band(), model);
          fitted.put(model.band(), fittedValues(model, observations));
        }
      } catch (FitException e) {
        log.debug("Bands {} not fit: {}", group.getValue(), e.getMessage());
        if (firstFailure == null) {
          firstFailure = e;
        }
        double[] noData = new double[observations.size()];
        Arrays.fill(noData, Double.NaN);
        for (Band band : group.getValue()) {
          failures.put(band, e.getMessage());
          fitted.put(band, noData);
        }
      }
    }
    if (models.isEmpty()) {
      throw firstFailure;
    }
    return new HarmonicFit(models, fitted, failures);
  }

  /**
   * Fits the observations of the window [centerYear - timeBuffer, centerYear + timeBuffer + 1),
   * e.g. a 3 year moving window for timeBuffer = 1. The returned models are valid over that
   * window; fitted values are reported for the windowed observations only.
   */
  public HarmonicFit fitWindow(List<Observation> observations, int centerYear, int timeBuffer)
      throws FitException {
    Preconditions.checkArgument(timeBuffer >= 0, "timeBuffer must be >= 0");
    double start = centerYear - timeBuffer;
    double end = centerYear + timeBuffer + 1;
    List<Observation> window = new ArrayList<>();
    for (Observation o : observations) {
      if (o.time() >= start && o.time() < end) {
        window.add(o);
      }
    }
    HarmonicFit fit = fit(window);
    Map<Band, HarmonicModel> models = new EnumMap<>(Band.class);
    Map<Band, double[]> fitted = new EnumMap<>(Band.class);
    for (Band band : fit.bands()) {
      fitted.put(band, fit.fitted(band));
    }
    for (HarmonicModel model : fit.models().values()) {
      models.put(model.band(), model.withValidity(start, end));
    }
    return new HarmonicFit(models, fitted, fit.failures());
  }

  /** Fits a single band. */
  public static HarmonicModel fit(List<Observation> observations, Band band,
      Collection<Integer> frequencies, boolean detrend) throws FitException {
    BandConfig bandConfig = new BandConfig(band, band.improvementDirection(), frequencies);
    return new HarmonicFitter(new Config(ImmutableList.of(bandConfig), detrend))
        .fit(observations).model(band);
  }

  /** The frequencies and valid observations that decide the design matrix of a band. */
  private static final class DesignKey {
    final ImmutableSortedSet<Integer> frequencies;
    final BitSet mask;

    DesignKey(ImmutableSortedSet<Integer> frequencies, BitSet mask) {
      this.frequencies = frequencies;
      this.mask = mask;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof DesignKey)) {
        return false;
      }
      DesignKey other = (DesignKey) o;
      return frequencies.equals(other.frequencies) && mask.equals(other.mask);
    }

    @Override
    public int hashCode() {
      return Objects.hash(frequencies, mask);
    }
  }

  /** Solves one group of bands sharing frequencies and valid observations. */
  private static List<HarmonicModel> solve(List<Observation> observations, BitSet mask,
      List<Band> bands, ImmutableSortedSet<Integer> frequencies, boolean detrend, double origin)
      throws FitException {
    int validCount = mask.cardinality();
    int required = minimumObservations(frequencies, detrend);
    if (validCount < required) {
      throw new InsufficientDataException(bands.get(0), validCount, required);
    }

    int numX = HarmonicModel.coefficientCount(frequencies, detrend);
    int numY = bands.size();
    LinearLeastSquares lls = new LinearLeastSquares(numX, numY);
    double[] x = new double[numX];
    double[] y = new double[numY];
    for (int i = mask.nextSetBit(0); i >= 0; i = mask.nextSetBit(i + 1)) {
      Observation o = observations.get(i);
      designRow(o.time(), origin, frequencies, detrend, x);
      for (int b = 0; b < numY; b++) {
        y[b] = o.value(bands.get(b));
      }
      lls.addInput(x, 0, y, 0);
    }

    DenseMatrix64F results = new DenseMatrix64F(numX, numY);
    if (!lls.getSolution(results)) {
      throw new SingularFitException(bands.get(0), validCount);
    }
    double[] rmse = lls.getRmsResiduals(results, numX);

    List<HarmonicModel> models = new ArrayList<>(numY);
    for (int b = 0; b < numY; b++) {
      double[] coefs = new double[numX];
      for (int j = 0; j < numX; j++) {
        coefs[j] = results.get(j, b);
      }
      models.add(new HarmonicModel(bands.get(b), frequencies, detrend, origin, coefs, rmse[b],
          validCount, null));
    }
    return models;
  }

  /**
   * Fills row with the independent variables at time t: 1, [t - origin], then cos and sin for
   * each frequency.
   */
  @VisibleForTesting
  static void designRow(double t, double origin, Set<Integer> frequencies, boolean detrend,
      double[] row) {
    int idx = 0;
    row[idx++] = 1;
    if (detrend) {
      row[idx++] = t - origin;
    }
    for (int k : frequencies) {
      double rx = k * Math.PI * t;
      row[idx++] = Math.cos(rx);
      row[idx++] = Math.sin(rx);
    }
  }

  /** The calendar year of the earliest observation, 0 for an empty series. */
  private static double timeOrigin(List<Observation> observations) {
    double min = Double.POSITIVE_INFINITY;
    for (Observation o : observations) {
      min = Math.min(min, o.time());
    }
    return observations.isEmpty() ? 0 : Math.floor(min);
  }

  private static double[] fittedValues(HarmonicModel model, List<Observation> observations) {
    double[] values = new double[observations.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = model.value(observations.get(i).time());
    }
    return values;
  }

  /**
   * The fewest valid observations a band needs: one more than the number of coefficients, i.e.
   * 2 + 2 * |frequencies|, plus 1 when detrending.
   */
  public static int minimumObservations(Set<Integer> frequencies, boolean detrend) {
    return HarmonicModel.coefficientCount(frequencies, detrend) + 1;
  }

  /**
   * Fails once, at setup, if seasonality metrics cannot be derived for every configured band.
   *
   * @throws UnsupportedFrequencyException if a band lacks the annual frequency.
   */
  public static void checkSeasonalitySupported(Config config) {
    for (BandConfig bandConfig : config.bands()) {
      if (!bandConfig.frequencies().contains(ANNUAL_FREQUENCY)) {
        throw new UnsupportedFrequencyException(String.format(
            "%s: seasonality needs frequency %d, configured %s",
            bandConfig.band().bandName(), ANNUAL_FREQUENCY, bandConfig.frequencies()));
      }
    }
  }

  /**
   * Derives amplitude, phase, peak day and area under the curve from the annual term of a model.
   *
   * <p>The annual term a*cos(2*PI*t) + b*sin(2*PI*t) equals A*cos(2*PI*(t - phase)) with
   * A = hypot(a, b) and phase = atan2(b, a) / (2*PI), so the peak falls at fraction phase of
   * the year. The AUC integrates the positive part of the seasonal curve (intercept and all
   * harmonics, without trend) over one year.
   *
   * @throws UnsupportedFrequencyException if the model has no annual frequency.
   */
  public static DerivedSeasonality derivePhaseAmplitudePeak(HarmonicModel model) {
    if (!model.frequencies().contains(ANNUAL_FREQUENCY)) {
      throw new UnsupportedFrequencyException(String.format(
          "%s: seasonality needs frequency %d, model has %s",
          model.band().bandName(), ANNUAL_FREQUENCY, model.frequencies()));
    }
    double a = model.cos(ANNUAL_FREQUENCY);
    double b = model.sin(ANNUAL_FREQUENCY);
    double amplitude = Math.hypot(a, b);

    double phase = Math.atan2(b, a) / (2 * Math.PI);
    phase -= Math.floor(phase);
    if (phase > 1 - PHASE_TOLERANCE) {
      // tiny negative angles
      phase = 0;
    }
    int peakJulianDay = Math.min(DAYS_IN_YEAR, 1 + (int) Math.floor(phase * DAYS_IN_YEAR));

    return new DerivedSeasonality(model.band(), amplitude, phase, peakJulianDay,
        areaUnderCurve(model));
  }

  @VisibleForTesting
  static double areaUnderCurve(HarmonicModel model) {
    try {
      return new TrapezoidIntegrator()
          .integrate(t -> Math.max(0, model.seasonalValue(t)), 0, 1);
    } catch (MathException e) {
      throw new IllegalStateException("AUC integration failed for " + model, e);
    }
  }

  /**
   * The model value at t. Dates outside the fitted range are extrapolated.
   */
  public static double predict(HarmonicModel model, double t) {
    return model.value(t);
  }

  /**
   * The model value at t using only the listed harmonic frequencies.
   *
   * @throws UnsupportedFrequencyException if the model lacks one of the harmonics.
   */
  public static double predict(HarmonicModel model, double t, Set<Integer> harmonics) {
    checkHarmonics(model, harmonics);
    return model.value(t, harmonics);
  }

  /**
   * Fails if harmonics names a frequency the model was not fit with, e.g. cycle numbers {1, 2, 3}
   * passed for a CCDC model, whose frequencies are {2, 4, 6}.
   *
   * @throws UnsupportedFrequencyException for the first missing frequency.
   */
  public static void checkHarmonics(HarmonicModel model, Set<Integer> harmonics) {
    for (int k : harmonics) {
      if (!model.frequencies().contains(k)) {
        throw new UnsupportedFrequencyException(String.format(
            "%s: requested frequency %d, model has %s",
            model.band().bandName(), k, model.frequencies()));
      }
    }
  }
}
