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

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a per-pixel function over many pixels on a fixed pool of worker threads. Pixels are
 * independent: one that fails to fit becomes a no-data result, and the rest of the batch goes on.
 */
public class PixelBatchRunner implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PixelBatchRunner.class);

  /** The work for one pixel. Must not touch state shared with other pixels. */
  public interface PixelFunction<I, O> {
    O apply(I pixel) throws HarmonicFitter.FitException;
  }

  private final int numThreads;
  private final ExecutorService executor;

  public PixelBatchRunner(int numThreads) {
    Preconditions.checkArgument(numThreads >= 1, "numThreads must be >= 1");
    this.numThreads = numThreads;
    this.executor = Executors.newFixedThreadPool(numThreads);
  }

  /** A runner with one thread per available processor. */
  public static PixelBatchRunner withAvailableProcessors() {
    return new PixelBatchRunner(Runtime.getRuntime().availableProcessors());
  }

  public int numThreads() {
    return numThreads;
  }

  /**
   * Applies fn to every pixel. The results are in the order of pixels; a pixel whose function
   * throws a FitException yields an empty result.
   *
   * @throws IllegalStateException if the calling thread is interrupted while waiting.
   * @throws RuntimeException any unchecked exception thrown by fn, which aborts the batch.
   */
  public <I, O> List<Optional<O>> run(List<I> pixels, PixelFunction<I, O> fn) {
    Preconditions.checkNotNull(fn);
    List<Future<Optional<O>>> futures = new ArrayList<>(pixels.size());
    for (int i = 0; i < pixels.size(); i++) {
      final int index = i;
      final I pixel = pixels.get(i);
      Callable<Optional<O>> task = () -> {
        try {
          return Optional.ofNullable(fn.apply(pixel));
        } catch (HarmonicFitter.FitException e) {
          log.debug("Pixel {} has no result: {}", index, e.getMessage());
          return Optional.empty();
        }
      };
      futures.add(executor.submit(task));
    }

    List<Optional<O>> results = new ArrayList<>(pixels.size());
    int failed = 0;
    try {
      for (Future<Optional<O>> future : futures) {
        Optional<O> result = future.get();
        if (!result.isPresent()) {
          failed++;
        }
        results.add(result);
      }
    } catch (InterruptedException e) {
      cancelAll(futures);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while processing pixels", e);
    } catch (ExecutionException e) {
      cancelAll(futures);
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Pixel processing failed", cause);
    }
    if (failed > 0) {
      log.warn("{} of {} pixels could not be fit", failed, pixels.size());
    }
    log.info("Processed {} pixels on {} threads", pixels.size(), numThreads);
    return results;
  }

  private static void cancelAll(List<? extends Future<?>> futures) {
    for (Future<?> future : futures) {
      future.cancel(true);
    }
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
        log.warn("Worker threads did not finish in time, interrupting them");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
