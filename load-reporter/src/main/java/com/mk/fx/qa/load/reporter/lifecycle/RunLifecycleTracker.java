package com.mk.fx.qa.load.reporter.lifecycle;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.reporter.model.ReporterRole;
import com.mk.fx.qa.load.reporter.model.TestRun;
import com.mk.fx.qa.load.reporter.storage.StorageSink;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the run's lifecycle records.
 *
 * <p>Moves through {@code UNINITIALIZED -> RUNNING -> CLOSED}. Only a {@link
 * ReporterRole#COORDINATOR} writes the run start and run end records and announces the dashboard
 * link; a {@link ReporterRole#PARTICIPANT} passes through the same states without touching
 * storage. Each transition happens at most once.
 */
@Slf4j
public class RunLifecycleTracker {

  /** Lifecycle state of the tracked run. */
  public enum State {
    UNINITIALIZED,
    RUNNING,
    CLOSED
  }

  @Getter private final TestRun run;
  @Getter private final ReporterRole role;
  private final StorageSink sink;
  private final Clock clock;
  private final String dashboardBaseUrl;
  private final AtomicReference<State> state = new AtomicReference<>(State.UNINITIALIZED);
  private volatile Instant endTime;

  public RunLifecycleTracker(
      TestRun run, ReporterRole role, StorageSink sink, Clock clock, String dashboardBaseUrl) {
    this.run = Objects.requireNonNull(run, "run");
    this.role = Objects.requireNonNull(role, "role");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.dashboardBaseUrl = dashboardBaseUrl;
  }

  /**
   * Marks the run as started, writing the start record when coordinating.
   *
   * @throws IllegalStateException if the run was already started or closed
   */
  public void start() {
    if (!state.compareAndSet(State.UNINITIALIZED, State.RUNNING)) {
      throw new IllegalStateException("Run " + run.runId() + " is already " + state.get());
    }
    if (role == ReporterRole.COORDINATOR) {
      sink.writeRunStart(run);
      log.info(
          "Test run {} started (testplan={}, clients={}, rps={})",
          run.runId(),
          run.testplan(),
          run.numClients(),
          run.targetRps());
    } else {
      log.info("Participating in test run {} (testplan={})", run.runId(), run.testplan());
    }
  }

  /**
   * Closes the run. When coordinating, writes the end record stamped with the current time and
   * logs the dashboard link. Calls after the first are ignored.
   *
   * @return the dashboard link, if one was produced by this call
   */
  public Optional<String> finish() {
    State previous = state.getAndSet(State.CLOSED);
    if (previous == State.CLOSED) {
      log.debug("Run {} already closed", run.runId());
      return Optional.empty();
    }
    if (previous == State.UNINITIALIZED) {
      log.warn("Run {} closed before it was started, no end record written", run.runId());
      return Optional.empty();
    }
    if (role != ReporterRole.COORDINATOR) {
      return Optional.empty();
    }
    Instant end = clock.instant();
    endTime = end;
    sink.writeRunEnd(run, end);
    Optional<String> link = dashboardUrl(end);
    link.ifPresentOrElse(
        url -> log.info("Report: {}", url),
        () -> log.info("Test run {} finished at {}", run.runId(), end));
    return link;
  }

  public State state() {
    return state.get();
  }

  public Optional<Instant> endTime() {
    return Optional.ofNullable(endTime);
  }

  /**
   * Builds the dashboard link covering the run from its start to one second past {@code end}.
   * Empty when no dashboard base URL is configured.
   */
  @VisibleForTesting
  Optional<String> dashboardUrl(Instant end) {
    if (dashboardBaseUrl == null || dashboardBaseUrl.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(
        dashboardBaseUrl
            + "&var-testplan="
            + URLEncoder.encode(run.testplan(), StandardCharsets.UTF_8)
            + "&from="
            + run.startTime().toEpochMilli()
            + "&to="
            + (end.toEpochMilli() + 1000));
  }
}
