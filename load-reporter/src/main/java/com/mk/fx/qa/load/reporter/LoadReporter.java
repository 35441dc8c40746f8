package com.mk.fx.qa.load.reporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.reporter.buffer.SwapBuffer;
import com.mk.fx.qa.load.reporter.context.ExecutionContext;
import com.mk.fx.qa.load.reporter.events.LoadEventBus;
import com.mk.fx.qa.load.reporter.events.SampleRecorder;
import com.mk.fx.qa.load.reporter.flush.BackgroundFlusher;
import com.mk.fx.qa.load.reporter.lifecycle.InvocationArguments;
import com.mk.fx.qa.load.reporter.lifecycle.RunIds;
import com.mk.fx.qa.load.reporter.lifecycle.RunLifecycleTracker;
import com.mk.fx.qa.load.reporter.metrics.ReporterStats;
import com.mk.fx.qa.load.reporter.metrics.ReporterSummary;
import com.mk.fx.qa.load.reporter.model.ReporterRole;
import com.mk.fx.qa.load.reporter.model.Sample;
import com.mk.fx.qa.load.reporter.model.TestRun;
import com.mk.fx.qa.load.reporter.shutdown.ShutdownCoordinator;
import com.mk.fx.qa.load.reporter.shutdown.ShutdownHookRegistry;
import com.mk.fx.qa.load.reporter.storage.StorageSink;
import com.mk.fx.qa.load.reporter.utils.JsonUtil;
import com.mk.fx.qa.load.reporter.utils.OriginResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Reports a load test's request outcomes and run lifecycle to a time-series store.
 *
 * <p>Once {@link #start() started}, the reporter listens on the {@link LoadEventBus}: request
 * notifications are buffered in memory and written in batches by a background flusher, and the
 * quitting notification (or process exit, through the {@link ShutdownHookRegistry}) drains the
 * buffer, closes the run and releases storage.
 *
 * <p>In a distributed run, the leader ({@code --master}) and every follower ({@code --worker})
 * create their own reporter; all of them tag samples with the run id the leader hands out, and only
 * the leader writes the run records.
 */
@Slf4j
public class LoadReporter implements AutoCloseable {

  @Getter private final TestRun run;
  @Getter private final ReporterRole role;
  @Getter private final String origin;
  @Getter private final ReporterStats stats = new ReporterStats();

  private final LoadEventBus bus;
  private final Clock clock;
  private final SwapBuffer<Sample> buffer = new SwapBuffer<>();
  private final RunLifecycleTracker tracker;
  private final SampleRecorder recorder;
  private final BackgroundFlusher flusher;
  private final ShutdownCoordinator coordinator;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private volatile ReporterSummary summary;

  /**
   * Creates a reporter. Nothing is written and no notification is consumed until {@link #start()}.
   *
   * @throws ReporterInitializationException if this reporter participates in a distributed run but
   *     no valid run id was supplied
   */
  public LoadReporter(
      ReporterSettings settings,
      StorageSink sink,
      LoadEventBus bus,
      ExecutionContext executionContext,
      ShutdownHookRegistry hooks,
      Clock clock) {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(sink, "sink");
    this.bus = Objects.requireNonNull(bus, "bus");
    this.clock = Objects.requireNonNull(clock, "clock");

    this.role = InvocationArguments.role(settings.args());
    this.origin = OriginResolver.resolve(settings.origin());
    this.run =
        new TestRun(
            resolveRunId(settings, clock),
            settings.testplan(),
            settings.profileName(),
            InvocationArguments.clientCount(settings.args()),
            settings.targetRps(),
            settings.description());

    this.tracker = new RunLifecycleTracker(run, role, sink, clock, settings.dashboardUrl());
    this.flusher =
        new BackgroundFlusher(buffer, sink, settings.flushInterval(), stats, run.testplan());
    this.coordinator =
        new ShutdownCoordinator(
            flusher, tracker, sink, hooks, settings.drainTimeout(), this::onExit);
    this.recorder =
        new SampleRecorder(
            buffer, run, origin, executionContext, clock, stats, coordinator::onQuitting);
  }

  /**
   * Starts flushing, records the run start and subscribes to notifications. If recording the run
   * start fails, the flusher is stopped again and the failure is rethrown.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Reporter for run " + run.runId() + " already started");
    }
    flusher.start();
    try {
      tracker.start();
      recorder.subscribe(bus);
      coordinator.registerExitHook();
    } catch (RuntimeException e) {
      flusher.finish();
      bus.unregister(recorder);
      throw e;
    }
    log.info(
        "Load reporter started: testplan={}, runId={}, role={}, origin={}",
        run.testplan(),
        run.runId(),
        role,
        origin);
  }

  /** Same as a quitting notification: drains the buffer, closes the run and releases storage. */
  @Override
  public void close() {
    coordinator.onQuitting();
  }

  public boolean isClosed() {
    return coordinator.hasExited();
  }

  public int pendingSamples() {
    return buffer.size();
  }

  public Optional<ReporterSummary> summary() {
    return Optional.ofNullable(summary);
  }

  @VisibleForTesting
  RunLifecycleTracker tracker() {
    return tracker;
  }

  @VisibleForTesting
  BackgroundFlusher flusher() {
    return flusher;
  }

  /**
   * Followers must reuse the leader's run id. The leader uses the id it handed out when there is
   * one; a standalone run starts a fresh id from the clock.
   */
  @VisibleForTesting
  static Instant resolveRunId(ReporterSettings settings, Clock clock) {
    List<String> args = settings.args();
    String supplied = settings.runId();
    boolean hasSupplied = supplied != null && !supplied.isBlank();
    if (InvocationArguments.isFollower(args) && !hasSupplied) {
      throw new ReporterInitializationException(
          "A run id must be supplied (LOAD_RUN_ID) when running as a distributed worker");
    }
    if (hasSupplied && InvocationArguments.isDistributed(args)) {
      try {
        return RunIds.parse(supplied);
      } catch (IllegalArgumentException e) {
        throw new ReporterInitializationException("Invalid run id: " + e.getMessage(), e);
      }
    }
    return clock.instant();
  }

  private void onExit(Optional<String> link) {
    bus.unregister(recorder);
    summary = ReporterSummary.of(run, role, origin, clock.instant(), stats, link.orElse(null));
    try {
      log.info("Load reporter summary:\n{}", JsonUtil.toJson(summary));
    } catch (JsonProcessingException e) {
      log.info("Load reporter summary (unformatted): {}", summary);
    }
  }
}
