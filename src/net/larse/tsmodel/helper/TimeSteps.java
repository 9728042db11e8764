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

package net.larse.tsmodel.helper;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

/**
 * Generates the fractional-year dates to predict harmonic models at, e.g. one date per year at a
 * fixed day of year, or a dense series across the season.
 */
public class TimeSteps {
  private static final double DAYS_IN_YEAR = 365.0;

  // tolerance for accumulated roundoff when comparing against the season bounds
  private static final double EPS = 1e-9;

  private TimeSteps() {}

  /**
   * Dates from day startJulian of startYear to day endJulian of endYear, every step years, that
   * fall within [startJulian, endJulian] of their year. With step 1 this gives one date per year
   * at startJulian; with step 0.1 and the whole year, ten dates per year.
   */
  public static DoubleArrayList of(int startYear, int endYear, int startJulian, int endJulian,
      double step) {
    Preconditions.checkArgument(startYear <= endYear, "startYear after endYear");
    Preconditions.checkArgument(1 <= startJulian && startJulian <= endJulian && endJulian <= 366,
        "invalid julian day range %s-%s", startJulian, endJulian);
    Preconditions.checkArgument(step > 0, "step must be positive");

    double first = startYear + (startJulian - 1) / DAYS_IN_YEAR;
    double last = endYear + (endJulian - 1) / DAYS_IN_YEAR;
    double seasonStart = (startJulian - 1) / DAYS_IN_YEAR;
    double seasonEnd = (endJulian - 1) / DAYS_IN_YEAR;

    DoubleArrayList dates = new DoubleArrayList();
    // multiply rather than accumulate so long series do not drift
    for (long i = 0; ; i++) {
      double t = first + i * step;
      if (t > last + EPS) {
        break;
      }
      double dayFraction = t - Math.floor(t + EPS);
      if (dayFraction >= seasonStart - EPS && dayFraction <= seasonEnd + EPS) {
        dates.add(t);
      }
    }
    return dates;
  }
}
