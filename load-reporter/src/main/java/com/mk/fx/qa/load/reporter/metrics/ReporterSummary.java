package com.mk.fx.qa.load.reporter.metrics;

import com.mk.fx.qa.load.reporter.model.ReporterRole;
import com.mk.fx.qa.load.reporter.model.TestRun;
import java.time.Instant;

/** End-of-run digest logged by the reporter when it shuts down. */
public record ReporterSummary(
    Instant runId,
    String testplan,
    ReporterRole role,
    String origin,
    Instant finishedAt,
    long samplesRecorded,
    long samplesWritten,
    long samplesDropped,
    long batchesWritten,
    long batchesFailed,
    long handlerFailures,
    String dashboardUrl) {

  public static ReporterSummary of(
      TestRun run,
      ReporterRole role,
      String origin,
      Instant finishedAt,
      ReporterStats stats,
      String dashboardUrl) {
    return new ReporterSummary(
        run.runId(),
        run.testplan(),
        role,
        origin,
        finishedAt,
        stats.samplesRecorded(),
        stats.samplesWritten(),
        stats.samplesDropped(),
        stats.batchesWritten(),
        stats.batchesFailed(),
        stats.handlerFailures(),
        dashboardUrl);
  }
}
