package com.mk.fx.qa.load.reporter.events;

import com.mk.fx.qa.load.reporter.buffer.SwapBuffer;
import com.mk.fx.qa.load.reporter.context.ExecutionContext;
import com.mk.fx.qa.load.reporter.metrics.ReporterStats;
import com.mk.fx.qa.load.reporter.model.Sample;
import com.mk.fx.qa.load.reporter.model.TestRun;
import java.time.Clock;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns request notifications into {@link Sample}s and appends them to the shared buffer.
 *
 * <p>Handlers run on the load engine's request threads: they never block and never touch storage.
 * A failure while building a sample is logged and counted; it is not propagated back into the
 * load engine. The quitting notification is forwarded to the configured callback.
 */
@Slf4j
public class SampleRecorder implements LoadEventListener {

  private final SwapBuffer<Sample> buffer;
  private final TestRun run;
  private final String origin;
  private final ExecutionContext executionContext;
  private final Clock clock;
  private final ReporterStats stats;
  private final Runnable onQuitting;

  public SampleRecorder(
      SwapBuffer<Sample> buffer,
      TestRun run,
      String origin,
      ExecutionContext executionContext,
      Clock clock,
      ReporterStats stats,
      Runnable onQuitting) {
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    this.run = Objects.requireNonNull(run, "run");
    this.origin = Objects.requireNonNull(origin, "origin");
    this.executionContext = Objects.requireNonNull(executionContext, "executionContext");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.onQuitting = Objects.requireNonNull(onQuitting, "onQuitting");
  }

  /** Registers this recorder for request and quitting notifications. */
  public void subscribe(LoadEventBus bus) {
    bus.register(this);
  }

  @Override
  public void onRequestSuccess(
      String kind, String name, double responseTimeMs, long responseLength) {
    try {
      record(
          Sample.success(
              clock.instant(),
              run.runId(),
              executionContext.currentId(),
              origin,
              run.testplan(),
              kind,
              name,
              responseTimeMs,
              responseLength));
    } catch (RuntimeException e) {
      handlerFailed(kind, name, e);
    }
  }

  @Override
  public void onRequestFailure(
      String kind, String name, double responseTimeMs, Throwable exception) {
    try {
      record(
          Sample.failure(
              clock.instant(),
              run.runId(),
              executionContext.currentId(),
              origin,
              run.testplan(),
              kind,
              name,
              responseTimeMs,
              describe(exception)));
    } catch (RuntimeException e) {
      handlerFailed(kind, name, e);
    }
  }

  @Override
  public void onQuitting() {
    onQuitting.run();
  }

  private void record(Sample sample) {
    buffer.append(sample);
    stats.recordSample();
  }

  private void handlerFailed(String kind, String name, RuntimeException e) {
    stats.recordHandlerFailure();
    log.warn("Dropped sample for {} {}: {}", kind, name, e.getMessage());
  }

  static String describe(Throwable exception) {
    return exception != null ? exception.toString() : "UnknownError";
  }
}
