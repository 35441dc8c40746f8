package com.mk.fx.qa.load.reporter.flush;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.reporter.buffer.SwapBuffer;
import com.mk.fx.qa.load.reporter.metrics.ReporterStats;
import com.mk.fx.qa.load.reporter.model.Sample;
import com.mk.fx.qa.load.reporter.storage.StorageSink;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Drains the sample buffer on a dedicated daemon thread and hands each epoch to the {@link
 * StorageSink} as one batch.
 *
 * <p>While running, the loop sleeps {@code interval} between drains, so samples reach storage at
 * most roughly one interval after they were recorded. Once {@link #finish()} is called the loop
 * keeps draining without sleeping until a drain started after the flag was seen comes back empty,
 * then exits. A batch the sink fails to write is dropped; the loop carries on with the next
 * epoch.
 */
@Slf4j
public class BackgroundFlusher {

  private final SwapBuffer<Sample> buffer;
  private final StorageSink sink;
  private final Duration interval;
  private final ReporterStats stats;
  private final String name;
  private final AtomicLong drainAttempts = new AtomicLong();

  private volatile boolean finished;
  private ExecutorService executor;
  private Future<?> loop;

  public BackgroundFlusher(
      SwapBuffer<Sample> buffer,
      StorageSink sink,
      Duration interval,
      ReporterStats stats,
      String name) {
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.name = Objects.requireNonNull(name, "name");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Flush interval must be positive: " + interval);
    }
  }

  /**
   * Starts the flush loop.
   *
   * @throws IllegalStateException if the flusher was already started
   */
  public synchronized void start() {
    if (executor != null) {
      throw new IllegalStateException("Flusher " + name + " already started");
    }
    executor =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("sample-flusher-" + name);
              t.setDaemon(true);
              return t;
            });
    loop = executor.submit(this::run);
    executor.shutdown();
    log.info("Sample flusher {} started (interval={})", name, interval);
  }

  /** Asks the loop to write what is left in the buffer and exit. */
  public void finish() {
    finished = true;
  }

  public boolean isFinishing() {
    return finished;
  }

  public synchronized boolean isRunning() {
    return loop != null && !loop.isDone();
  }

  /**
   * Waits for the loop to exit after {@link #finish()}.
   *
   * @return {@code true} if the loop has exited (or was never started), {@code false} on timeout
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    Future<?> current;
    synchronized (this) {
      current = loop;
    }
    if (current == null) {
      return true;
    }
    try {
      current.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (ExecutionException e) {
      log.error("Sample flusher {} terminated abnormally", name, e.getCause());
      return true;
    }
  }

  @VisibleForTesting
  public long drainAttempts() {
    return drainAttempts.get();
  }

  void run() {
    var interrupted = false;
    while (true) {
      var done = finished || interrupted;
      List<Sample> batch = buffer.drainAll();
      drainAttempts.incrementAndGet();
      if (!batch.isEmpty()) {
        write(batch);
      } else if (done) {
        break;
      }
      if (done) {
        continue;
      }
      try {
        TimeUnit.MILLISECONDS.sleep(interval.toMillis());
      } catch (InterruptedException e) {
        log.warn("Sample flusher {} interrupted, draining remaining samples", name);
        interrupted = true;
      }
    }
    log.info("Sample flusher {} stopped after {} drains", name, drainAttempts.get());
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void write(List<Sample> batch) {
    boolean written;
    try {
      written = sink.writeSamples(batch);
    } catch (RuntimeException e) {
      log.error("Failed to write {} samples: {}", batch.size(), e.toString());
      written = false;
    }
    if (written) {
      stats.recordBatchWritten(batch.size());
    } else {
      stats.recordBatchFailed(batch.size());
    }
  }
}
