package net.larse.tsmodel.model;

import com.google.common.collect.ImmutableMap;

import java.time.LocalDate;
import java.time.ZoneOffset;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ObservationTest {
  static long epochMillis(int year, int month, int day) {
    return LocalDate.of(year, month, day).atStartOfDay(ZoneOffset.UTC).toInstant()
        .toEpochMilli();
  }

  @Test
  public void testFractionalYear() {
    assertEquals(2019.0, Observation.toFractionalYear(epochMillis(2019, 1, 1)), 0);
    // 2020 is a leap year, July 2 is day 183 of 366
    assertEquals(2020.5, Observation.toFractionalYear(epochMillis(2020, 7, 2)), 1e-12);
  }

  @Test
  public void testAtEpochMillis() {
    Observation o = Observation.atEpochMillis(epochMillis(2019, 1, 1),
        ImmutableMap.of(Band.NBR, 0.25));
    assertEquals(2019.0, o.time(), 0);
    assertEquals(0.25, o.value(Band.NBR), 0);
  }

  @Test
  public void testMissingValues() {
    Observation o = Observation.of(2001.5, Band.NDVI, 0.4);
    assertTrue(o.isValid(Band.NDVI));
    assertFalse(o.isValid(Band.NBR));
    assertTrue(Double.isNaN(o.value(Band.NBR)));
    assertFalse(Observation.of(2001.5, Band.NDVI, Double.NaN).isValid(Band.NDVI));
  }
}
