package com.mk.fx.qa.load.reporter.metrics;

import java.util.concurrent.atomic.AtomicLong;

/** Counters describing what the reporter recorded and persisted during a run. */
public class ReporterStats {

  private final AtomicLong samplesRecorded = new AtomicLong();
  private final AtomicLong samplesWritten = new AtomicLong();
  private final AtomicLong samplesDropped = new AtomicLong();
  private final AtomicLong batchesWritten = new AtomicLong();
  private final AtomicLong batchesFailed = new AtomicLong();
  private final AtomicLong handlerFailures = new AtomicLong();

  public void recordSample() {
    samplesRecorded.incrementAndGet();
  }

  public void recordBatchWritten(int size) {
    batchesWritten.incrementAndGet();
    samplesWritten.addAndGet(size);
  }

  public void recordBatchFailed(int size) {
    batchesFailed.incrementAndGet();
    samplesDropped.addAndGet(size);
  }

  public void recordHandlerFailure() {
    handlerFailures.incrementAndGet();
  }

  public long samplesRecorded() {
    return samplesRecorded.get();
  }

  public long samplesWritten() {
    return samplesWritten.get();
  }

  public long samplesDropped() {
    return samplesDropped.get();
  }

  public long batchesWritten() {
    return batchesWritten.get();
  }

  public long batchesFailed() {
    return batchesFailed.get();
  }

  public long handlerFailures() {
    return handlerFailures.get();
  }
}
