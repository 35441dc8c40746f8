package com.mk.fx.qa.load.reporter.shutdown;

import com.mk.fx.qa.load.reporter.flush.BackgroundFlusher;
import com.mk.fx.qa.load.reporter.lifecycle.RunLifecycleTracker;
import com.mk.fx.qa.load.reporter.storage.StorageSink;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Sequences the reporter's shutdown so that no buffered sample is lost.
 *
 * <p>On quitting: flag the flusher, drop the remaining exit hooks so a repeated signal does not
 * re-enter, wait for the flusher's final drain, then run the exit sequence (close the run, close
 * storage). Both the quitting notification and the process exit hook end up here; every step runs
 * at most once, and a caller arriving while the sequence is in progress blocks until it completes
 * so that nothing downstream is torn down under the final drain.
 */
@Slf4j
public class ShutdownCoordinator {

  private static final Duration EXIT_GRACE = Duration.ofSeconds(5);

  private final BackgroundFlusher flusher;
  private final RunLifecycleTracker tracker;
  private final StorageSink sink;
  private final ShutdownHookRegistry hooks;
  private final Duration drainTimeout;
  private final Consumer<Optional<String>> onExit;
  private final AtomicBoolean quitting = new AtomicBoolean(false);
  private final AtomicBoolean exited = new AtomicBoolean(false);
  private final CountDownLatch exitCompleted = new CountDownLatch(1);

  /**
   * Creates a coordinator for one reporter.
   *
   * @param drainTimeout upper bound on the wait for the flusher's final drain
   * @param onExit called once after storage is closed, with the dashboard link if one was produced
   */
  public ShutdownCoordinator(
      BackgroundFlusher flusher,
      RunLifecycleTracker tracker,
      StorageSink sink,
      ShutdownHookRegistry hooks,
      Duration drainTimeout,
      Consumer<Optional<String>> onExit) {
    this.flusher = Objects.requireNonNull(flusher, "flusher");
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.hooks = Objects.requireNonNull(hooks, "hooks");
    this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
    this.onExit = Objects.requireNonNull(onExit, "onExit");
  }

  /** Registers the full shutdown sequence to run on process exit. */
  public void registerExitHook() {
    hooks.register("load-reporter-" + tracker.getRun().testplan(), this::onQuitting);
  }

  /**
   * Handles the quitting notification. A repeated notification does not start the sequence again;
   * it waits for the one in progress to complete.
   */
  public void onQuitting() {
    if (!quitting.compareAndSet(false, true)) {
      log.debug("Shutdown already in progress, waiting for it to complete");
      awaitExit();
      return;
    }
    log.info("Shutting down reporter for run {}", tracker.getRun().runId());
    flusher.finish();
    hooks.clear();
    try {
      if (!flusher.awaitTermination(drainTimeout)) {
        log.warn(
            "Sample flusher did not finish within {}, remaining samples may be lost", drainTimeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the final sample drain");
    }
    exit();
  }

  /**
   * Closes the run and releases storage. The flusher is told to stop if quitting was never
   * signalled. A second call waits for the first to complete.
   */
  public void exit() {
    if (!exited.compareAndSet(false, true)) {
      log.debug("Exit sequence already ran");
      awaitExit();
      return;
    }
    if (quitting.compareAndSet(false, true)) {
      flusher.finish();
      hooks.clear();
    }
    try {
      Optional<String> link = Optional.empty();
      try {
        link = tracker.finish();
      } catch (RuntimeException e) {
        log.error("Failed to close run {}", tracker.getRun().runId(), e);
      } finally {
        sink.close();
      }
      onExit.accept(link);
    } finally {
      exitCompleted.countDown();
    }
  }

  private void awaitExit() {
    Duration bound = drainTimeout.plus(EXIT_GRACE);
    try {
      if (!exitCompleted.await(bound.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Shutdown in progress did not complete within {}", bound);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the shutdown in progress");
    }
  }

  public boolean isQuitting() {
    return quitting.get();
  }

  public boolean hasExited() {
    return exited.get();
  }
}
