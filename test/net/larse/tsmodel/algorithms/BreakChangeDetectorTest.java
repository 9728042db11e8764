package net.larse.tsmodel.algorithms;

import com.google.common.collect.ImmutableList;

import java.util.Map;

import net.larse.tsmodel.model.Band;
import net.larse.tsmodel.model.HarmonicModel;
import net.larse.tsmodel.model.Segment;
import net.larse.tsmodel.model.SegmentSet;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BreakChangeDetectorTest {
  SegmentSet run;

  static Segment segment(double start, double end, double breakDate, double changeProb,
      double magnitude) {
    double[] coefs = {0.5, 0, 0, 0, 0, 0, 0, 0};
    return new Segment(HarmonicModel.fromCcdcCoefficients(Band.NDVI, coefs, start, end),
        breakDate, changeProb, magnitude);
  }

  @Before
  public void setUp() throws Exception {
    run = new SegmentSet("ccdc", Band.NDVI, ImmutableList.of(
        segment(1985, 1995.4, 1995.5, 1, -0.4),
        segment(1995.6, 2003.2, 2003.3, 1, 0.15),
        segment(2003.4, 2010.7, 2010.8, 1, -0.2),
        segment(2010.9, 2015.1, 2015.2, 0.6, -0.5),
        segment(2015.3, 2022, 0, 0, 0)));
  }

  @Test
  public void testMostRecent() {
    BreakChangeDetector detector = new BreakChangeDetector(BreakChangeDetector.Config.defaults());
    BreakChangeDetector.Result result = detector.detect(run);
    // the 2015 break is below the probability threshold
    assertEquals(2010, result.loss().get().year());
    assertEquals(-0.2, result.loss().get().magnitude(), 0);
    assertEquals(2003, result.gain().get().year());
  }

  @Test
  public void testHighestMagnitude() {
    BreakChangeDetector detector = new BreakChangeDetector(new BreakChangeDetector.Config(
        1.0, BreakChangeDetector.SortingMethod.HIGHEST_MAGNITUDE));
    assertEquals(1995, detector.detect(run).loss().get().year());

    detector = new BreakChangeDetector(new BreakChangeDetector.Config(
        0.5, BreakChangeDetector.SortingMethod.HIGHEST_MAGNITUDE));
    assertEquals(2015, detector.detect(run).loss().get().year());
  }

  @Test
  public void testImprovementDirection() {
    BreakChangeDetector detector = new BreakChangeDetector(BreakChangeDetector.Config.defaults());
    BreakChangeDetector.Result result = detector.detect(run, -1);
    assertEquals(2003, result.loss().get().year());
    assertEquals(2010, result.gain().get().year());
  }

  @Test
  public void testNoBreaks() {
    SegmentSet stable = new SegmentSet("ccdc", Band.NDVI, ImmutableList.of(
        segment(1985, 2022, 0, 0, 0)));
    BreakChangeDetector.Result result =
        new BreakChangeDetector(BreakChangeDetector.Config.defaults()).detect(stable);
    assertFalse(result.loss().isPresent());
    assertFalse(result.gain().isPresent());
    Map<String, Double> out = result.toMap();
    assertEquals(4, out.size());
    assertTrue(Double.isNaN(out.get("NDVI_CCDC_loss_year")));
    assertTrue(Double.isNaN(out.get("NDVI_CCDC_gain_mag")));
  }

  @Test
  public void testExportKeys() {
    Map<String, Double> out =
        new BreakChangeDetector(BreakChangeDetector.Config.defaults()).detect(run).toMap();
    assertEquals(2010, out.get("NDVI_CCDC_loss_year"), 0);
    assertEquals(-0.2, out.get("NDVI_CCDC_loss_mag"), 0);
    assertEquals(2003, out.get("NDVI_CCDC_gain_year"), 0);
    assertEquals(0.15, out.get("NDVI_CCDC_gain_mag"), 0);
  }

  @Test
  public void testSortingMethodNames() {
    assertEquals(BreakChangeDetector.SortingMethod.MOST_RECENT,
        BreakChangeDetector.SortingMethod.fromName("mostRecent"));
    assertEquals(BreakChangeDetector.SortingMethod.HIGHEST_MAGNITUDE,
        BreakChangeDetector.SortingMethod.fromName("highestMag"));
  }
}
