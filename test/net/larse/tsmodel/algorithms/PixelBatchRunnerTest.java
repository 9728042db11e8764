package net.larse.tsmodel.algorithms;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import net.larse.tsmodel.model.Band;
import net.larse.tsmodel.model.HarmonicModel;
import net.larse.tsmodel.model.Observation;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PixelBatchRunnerTest {
  PixelBatchRunner runner;

  @Before
  public void setUp() throws Exception {
    runner = new PixelBatchRunner(4);
  }

  @After
  public void tearDown() throws Exception {
    runner.close();
    runner = null;
  }

  /** A pixel with n yearly-cycle observations around level. */
  static List<Observation> pixel(int n, double level) {
    List<Observation> obs = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      double t = 2000 + i / 12.0;
      obs.add(Observation.of(t, Band.NDVI, level + 0.1 * Math.cos(2 * Math.PI * t)));
    }
    return obs;
  }

  @Test
  public void testResultsInInputOrder() {
    List<Integer> pixels = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      pixels.add(i);
    }
    List<Optional<Integer>> results = runner.run(pixels, p -> p * 2);
    assertEquals(200, results.size());
    for (int i = 0; i < 200; i++) {
      assertEquals(Integer.valueOf(2 * i), results.get(i).get());
    }
  }

  @Test
  public void testFailedPixelsAreEmpty() {
    List<List<Observation>> pixels = ImmutableList.of(
        pixel(36, 0.3), pixel(2, 0.5), pixel(36, 0.7));
    List<Optional<HarmonicModel>> results = runner.run(pixels,
        obs -> HarmonicFitter.fit(obs, Band.NDVI, ImmutableList.of(2), false));
    assertTrue(results.get(0).isPresent());
    assertFalse(results.get(1).isPresent());
    assertEquals(0.7, results.get(2).get().intercept(), 1e-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUncheckedExceptionAbortsBatch() {
    runner.run(ImmutableList.of(1, 2, 3), p -> {
      if (p == 2) {
        throw new IllegalArgumentException("bad pixel configuration");
      }
      return p;
    });
  }

  @Test
  public void testOneThreadPerProcessor() {
    try (PixelBatchRunner perCpu = PixelBatchRunner.withAvailableProcessors()) {
      assertEquals(Runtime.getRuntime().availableProcessors(), perCpu.numThreads());
      assertEquals(1, perCpu.run(ImmutableList.of("a"), String::length).get(0).get().intValue());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNeedsAThread() {
    new PixelBatchRunner(0);
  }
}
