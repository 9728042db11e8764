package net.larse.tsmodel.algorithms;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;

import net.larse.tsmodel.model.AnnualFit;
import net.larse.tsmodel.model.Band;
import net.larse.tsmodel.model.ChangeDirection;
import net.larse.tsmodel.model.ChangeEvent;
import net.larse.tsmodel.model.ChangeSummary;
import net.larse.tsmodel.model.RankedEvents;
import net.larse.tsmodel.model.SelectionRule;
import net.larse.tsmodel.model.Trajectory;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TrajectorySegmenterTest {
  private static final double EPS = 1e-12;

  Trajectory trajectory;
  TrajectorySegmenter segmenter;

  static ChangeEvent loss(int start, int end, double magnitude) {
    return new ChangeEvent(ChangeDirection.LOSS, start, end, magnitude, 1,
        ChangeEvent.Pace.UNCLASSIFIED);
  }

  static void assertOrder(List<ChangeEvent> actual, ChangeEvent... expected) {
    assertEquals(expected.length, actual.size());
    for (int i = 0; i < expected.length; i++) {
      assertSame("rank " + (i + 1), expected[i], actual.get(i));
    }
  }

  @Before
  public void setUp() throws Exception {
    trajectory = Trajectory.of(new int[] {2000, 2005, 2010, 2015},
        new double[] {0.5, 0.5, 0.2, 0.6});
    segmenter = new TrajectorySegmenter(TrajectorySegmenter.Config.defaults());
  }

  @After
  public void tearDown() throws Exception {
    trajectory = null;
    segmenter = null;
  }

  @Test
  public void testExtractEventsSkipsFlatSegments() {
    List<ChangeEvent> events = TrajectorySegmenter.extractEvents(trajectory, 1);
    assertEquals(2, events.size());

    ChangeEvent loss = events.get(0);
    assertEquals(ChangeDirection.LOSS, loss.direction());
    assertEquals(2005, loss.startYear());
    assertEquals(2010, loss.endYear());
    assertEquals(-0.3, loss.magnitude(), EPS);
    assertEquals(-0.06, loss.slope(), EPS);
    assertEquals(5, loss.duration());

    ChangeEvent gain = events.get(1);
    assertEquals(ChangeDirection.GAIN, gain.direction());
    assertEquals(0.4, gain.magnitude(), EPS);
  }

  @Test
  public void testNegativeImprovementDirection() {
    // for a reflectance band a rising value is a loss
    List<ChangeEvent> events = TrajectorySegmenter.extractEvents(trajectory, -1);
    assertEquals(ChangeDirection.GAIN, events.get(0).direction());
    assertEquals(ChangeDirection.LOSS, events.get(1).direction());
    assertEquals(-0.4, events.get(1).adjustedMagnitude(), EPS);
  }

  @Test
  public void testFilterAndRank() {
    List<ChangeEvent> events = TrajectorySegmenter.extractEvents(trajectory, 1);
    RankedEvents ranked = TrajectorySegmenter.filterAndRank(events, -0.1, -0.05, 5);
    assertEquals(1, ranked.losses().size());
    assertEquals(ChangeEvent.Pace.SLOW, ranked.losses().get(0).pace());
    assertEquals(1, ranked.gains().size());
    assertEquals(ChangeEvent.Pace.UNCLASSIFIED, ranked.gains().get(0).pace());

    ranked = TrajectorySegmenter.filterAndRank(events, -0.1, -0.05, 6);
    assertEquals(ChangeEvent.Pace.FAST, ranked.losses().get(0).pace());
  }

  @Test
  public void testEventNeedsToFailBothThresholdsToBeDropped() {
    ChangeEvent smallButSteep = loss(2000, 2001, -0.08);
    ChangeEvent largeButGradual = loss(2001, 2011, -0.2);
    ChangeEvent smallAndGradual = loss(2011, 2015, -0.05);
    RankedEvents ranked = TrajectorySegmenter.filterAndRank(
        ImmutableList.of(smallButSteep, largeButGradual, smallAndGradual), -0.15, -0.05, 3);
    assertEquals(2, ranked.losses().size());
    // chronological order is kept
    assertEquals(2000, ranked.losses().get(0).startYear());
    assertEquals(2001, ranked.losses().get(1).startYear());
  }

  @Test
  public void testLargestLoss() {
    Trajectory t = Trajectory.of(new int[] {2000, 2002, 2005, 2010},
        new double[] {0.8, 0.6, 0.7, 0.2});
    TrajectorySegmenter twoEach = new TrajectorySegmenter(TrajectorySegmenter.Config.defaults()
        .withRules(SelectionRule.LARGEST, SelectionRule.NEWEST).withHowManyToPull(2));
    ChangeSummary summary = twoEach.summarize(t, Band.NDVI);
    assertEquals(2, summary.losses().size());
    assertEquals(2005, summary.losses().get(0).startYear());
    assertEquals(2000, summary.losses().get(1).startYear());
  }

  @Test
  public void testSelectionRules() {
    ChangeEvent a = loss(2000, 2002, -0.4);
    ChangeEvent b = loss(2003, 2010, -0.5);
    ChangeEvent c = loss(2011, 2012, -0.1);
    List<ChangeEvent> events = ImmutableList.of(a, b, c);
    assertOrder(TrajectorySegmenter.selectTopK(events, SelectionRule.NEWEST, 3), c, b, a);
    assertOrder(TrajectorySegmenter.selectTopK(events, SelectionRule.OLDEST, 3), a, b, c);
    assertOrder(TrajectorySegmenter.selectTopK(events, SelectionRule.LARGEST, 3), b, a, c);
    assertOrder(TrajectorySegmenter.selectTopK(events, SelectionRule.SMALLEST, 3), c, a, b);
    assertOrder(TrajectorySegmenter.selectTopK(events, SelectionRule.STEEPEST, 3), a, c, b);
    assertOrder(TrajectorySegmenter.selectTopK(events, SelectionRule.MOST_GRADUAL, 3), b, c, a);
    assertOrder(TrajectorySegmenter.selectTopK(events, SelectionRule.SHORTEST, 3), c, a, b);
    assertOrder(TrajectorySegmenter.selectTopK(events, SelectionRule.LONGEST, 3), b, a, c);
  }

  @Test
  public void testTiesBrokenByEndYearThenInputOrder() {
    ChangeEvent first = loss(2000, 2003, -0.2);
    ChangeEvent second = loss(2005, 2008, -0.2);
    ChangeEvent third = loss(2010, 2012, -0.2);
    ChangeEvent sameEnd = loss(2009, 2012, 0.2);
    List<ChangeEvent> top = TrajectorySegmenter.selectTopK(
        ImmutableList.of(first, third, sameEnd, second), SelectionRule.LARGEST, 4);
    assertOrder(top, third, sameEnd, second, first);
  }

  @Test
  public void testSelectTopKTruncates() {
    ChangeEvent a = loss(2000, 2002, -0.4);
    ChangeEvent b = loss(2003, 2010, -0.5);
    assertOrder(TrajectorySegmenter.selectTopK(ImmutableList.of(a, b), SelectionRule.LARGEST, 1),
        b);
    assertTrue(TrajectorySegmenter.selectTopK(ImmutableList.<ChangeEvent>of(),
        SelectionRule.NEWEST, 2).isEmpty());
  }

  @Test
  public void testSummaryExportKeys() {
    TrajectorySegmenter twoEach =
        new TrajectorySegmenter(TrajectorySegmenter.Config.defaults().withHowManyToPull(2));
    Map<String, Double> out = twoEach.summarize(trajectory, Band.NDVI).toMap();
    assertEquals(16, out.size());
    assertEquals(2006, out.get("NDVI_LT_loss_yr_1"), 0);
    assertEquals(5, out.get("NDVI_LT_loss_dur_1"), 0);
    assertEquals(-0.3, out.get("NDVI_LT_loss_mag_1"), EPS);
    assertEquals(-0.06, out.get("NDVI_LT_loss_slope_1"), EPS);
    assertEquals(2011, out.get("NDVI_LT_gain_yr_1"), 0);
    assertTrue(Double.isNaN(out.get("NDVI_LT_loss_yr_2")));
    assertTrue(Double.isNaN(out.get("NDVI_LT_gain_slope_2")));
  }

  @Test
  public void testDefaultThresholdsDropSmallChanges() {
    Trajectory t = Trajectory.of(new int[] {2000, 2005, 2010},
        new double[] {0.5, 0.4, 0.45});
    ChangeSummary summary = segmenter.summarize(t, Band.NBR);
    assertTrue(summary.losses().isEmpty());
    assertTrue(summary.gains().isEmpty());
  }

  @Test
  public void testFitAnnual() {
    List<AnnualFit> fits = TrajectorySegmenter.fitAnnual(trajectory, 1998, 2017);
    assertEquals(20, fits.size());

    AnnualFit before = fits.get(0);
    assertEquals(1998, before.year());
    assertEquals(0.5, before.fitted(), EPS);

    AnnualFit inLoss = fits.get(2007 - 1998);
    assertEquals(0.38, inLoss.fitted(), EPS);
    assertEquals(-0.3, inLoss.magnitude(), EPS);
    assertEquals(-0.06, inLoss.slope(), EPS);
    assertEquals(5, inLoss.duration());

    // vertex years start the segment that follows them
    assertEquals(0.4, fits.get(2010 - 1998).magnitude(), EPS);

    AnnualFit after = fits.get(fits.size() - 1);
    assertEquals(2017, after.year());
    assertEquals(0.6, after.fitted(), EPS);
  }

  @Test
  public void testFromLandTrendrArray() {
    double[][] array = {
        {2000, 2001, 2002, 2003, 2004},
        {5000, 5100, 3000, 3500, 4100},
        {5050, 4000, 2950, 3500, 4050},
        {1, 0, 1, 0, 1}};
    Trajectory t = Trajectory.fromLandTrendrArray(array, 0.0001);
    assertEquals(3, t.size());
    assertEquals(2002, t.get(1).year());
    assertEquals(0.295, t.get(1).fittedValue(), EPS);

    ChangeSummary summary = segmenter.summarize(t, Band.NBR);
    assertEquals(1, summary.losses().size());
    assertEquals(2001, summary.losses().get(0).yearOfDetection());
    assertEquals(ChangeEvent.Pace.FAST, summary.losses().get(0).pace());
    assertEquals(1, summary.gains().size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testHowManyToPullMustBePositive() {
    TrajectorySegmenter.Config.defaults().withHowManyToPull(0);
  }
}
