package net.larse.tsmodel.helper;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TimeStepsTest {
  @Test
  public void testAnnualSteps() {
    DoubleArrayList dates = TimeSteps.of(2000, 2004, 245, 245, 1);
    assertEquals(5, dates.size());
    for (int i = 0; i < dates.size(); i++) {
      assertEquals(2000 + i + 244 / 365.0, dates.getDouble(i), 1e-9);
    }
  }

  @Test
  public void testDenseSteps() {
    DoubleArrayList dates = TimeSteps.of(2000, 2001, 1, 365, 0.1);
    // ten per year
    assertEquals(20, dates.size());
    assertEquals(2000.0, dates.getDouble(0), 1e-12);
    assertEquals(2000.1, dates.getDouble(1), 1e-9);
    for (int i = 1; i < dates.size(); i++) {
      assertTrue(dates.getDouble(i) > dates.getDouble(i - 1));
    }
  }

  @Test
  public void testSeasonWindow() {
    DoubleArrayList dates = TimeSteps.of(2000, 2002, 152, 258, 0.05);
    for (int i = 0; i < dates.size(); i++) {
      double fraction = dates.getDouble(i) - Math.floor(dates.getDouble(i));
      assertTrue(fraction >= 151 / 365.0 - 1e-9);
      assertTrue(fraction <= 257 / 365.0 + 1e-9);
    }
    assertTrue(dates.size() > 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testStepMustBePositive() {
    TimeSteps.of(2000, 2001, 1, 365, 0);
  }
}
