package net.larse.tsmodel.model;

import com.google.common.base.Preconditions;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One sample of a pixel time series: a time in fractional years and the band values recorded at
 * that time. A band that is absent, or whose value is NaN, is missing for this sample.
 */
public final class Observation {
  private final double time;
  private final Map<Band, Double> values;

  public Observation(double time, Map<Band, Double> values) {
    Preconditions.checkArgument(Double.isFinite(time), "time must be finite: %s", time);
    this.time = time;
    EnumMap<Band, Double> copy = new EnumMap<>(Band.class);
    copy.putAll(values);
    this.values = Collections.unmodifiableMap(copy);
  }

  /** Convenience constructor for a single band. */
  public static Observation of(double time, Band band, double value) {
    EnumMap<Band, Double> values = new EnumMap<>(Band.class);
    values.put(band, value);
    return new Observation(time, values);
  }

  /** Builds an observation from a UTC epoch timestamp. */
  public static Observation atEpochMillis(long epochMillis, Map<Band, Double> values) {
    return new Observation(toFractionalYear(epochMillis), values);
  }

  /**
   * Converts a UTC epoch timestamp to fractional years, e.g. 2020-07-02T00:00Z -> 2020.5 (the
   * fraction is measured against the actual length of that year).
   */
  public static double toFractionalYear(long epochMillis) {
    ZonedDateTime date = Instant.ofEpochMilli(epochMillis).atZone(ZoneOffset.UTC);
    int year = date.getYear();
    long start = LocalDate.of(year, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    long end = LocalDate.of(year + 1, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    return year + (double) (epochMillis - start) / (end - start);
  }

  public double time() {
    return time;
  }

  /** The value of the band, or NaN when it is missing. */
  public double value(Band band) {
    Double v = values.get(band);
    return v == null ? Double.NaN : v;
  }

  public boolean isValid(Band band) {
    return !Double.isNaN(value(band));
  }

  public Map<Band, Double> values() {
    return values;
  }

  @Override
  public String toString() {
    return time + "=" + values;
  }
}
