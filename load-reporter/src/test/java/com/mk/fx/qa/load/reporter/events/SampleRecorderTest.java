package com.mk.fx.qa.load.reporter.events;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.reporter.buffer.SwapBuffer;
import com.mk.fx.qa.load.reporter.context.ExecutionContext;
import com.mk.fx.qa.load.reporter.context.ThreadLocalExecutionContext;
import com.mk.fx.qa.load.reporter.metrics.ReporterStats;
import com.mk.fx.qa.load.reporter.model.Sample;
import com.mk.fx.qa.load.reporter.model.TestRun;
import java.net.ConnectException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SampleRecorderTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");
  private static final TestRun RUN =
      new TestRun(Instant.parse("2024-05-01T10:00:00Z"), "checkout", "smoke", 2, "10", "");

  private SwapBuffer<Sample> buffer;
  private ThreadLocalExecutionContext context;
  private ReporterStats stats;
  private AtomicInteger quitCalls;
  private SampleRecorder recorder;

  @BeforeEach
  void setUp() {
    buffer = new SwapBuffer<>();
    context = new ThreadLocalExecutionContext();
    stats = new ReporterStats();
    quitCalls = new AtomicInteger();
    recorder =
        new SampleRecorder(
            buffer,
            RUN,
            "gen-1",
            context,
            Clock.fixed(NOW, ZoneOffset.UTC),
            stats,
            quitCalls::incrementAndGet);
  }

  @Test
  void success_appendsSuccessfulSample() {
    recorder.onRequestSuccess("GET", "/items", 12.5, 150);

    List<Sample> batch = buffer.drainAll();
    assertEquals(1, batch.size());
    Sample sample = batch.get(0);
    assertTrue(sample.success());
    assertNull(sample.exception());
    assertEquals(150, sample.responseLength());
    assertEquals(NOW, sample.time());
    assertEquals(RUN.runId(), sample.runId());
    assertEquals("gen-1", sample.origin());
    assertEquals("checkout", sample.testplan());
    assertEquals("GET", sample.kind());
    assertEquals("/items", sample.name());
    assertEquals(12.5, sample.responseTimeMs());
    assertEquals(1, stats.samplesRecorded());
  }

  @Test
  void failure_appendsFailedSampleWithExceptionDescription() {
    var error = new ConnectException("Connection refused");

    recorder.onRequestFailure("POST", "/pay", 40.0, error);

    Sample sample = buffer.drainAll().get(0);
    assertFalse(sample.success());
    assertNull(sample.responseLength());
    assertEquals("java.net.ConnectException: Connection refused", sample.exception());
  }

  @Test
  void failure_withoutException_isStillRecorded() {
    recorder.onRequestFailure("GET", "/", 1.0, null);

    Sample sample = buffer.drainAll().get(0);
    assertFalse(sample.success());
    assertEquals("UnknownError", sample.exception());
  }

  @Test
  void unboundThread_usesSentinelExecutionContext() {
    recorder.onRequestSuccess("GET", "/", 1.0, 0);

    assertEquals(ExecutionContext.UNAVAILABLE, buffer.drainAll().get(0).executionContextId());
  }

  @Test
  void boundThread_recordsExecutionContextId() {
    try (var ignored = context.bind(7)) {
      recorder.onRequestSuccess("GET", "/", 1.0, 0);
    }

    assertEquals(7, buffer.drainAll().get(0).executionContextId());
  }

  @Test
  void invalidNotification_isIsolatedAndCounted() {
    assertDoesNotThrow(() -> recorder.onRequestSuccess("GET", "/", 1.0, -5));

    assertTrue(buffer.isEmpty());
    assertEquals(1, stats.handlerFailures());
    assertEquals(0, stats.samplesRecorded());
  }

  @Test
  void quitting_invokesShutdownCallback() {
    recorder.onQuitting();

    assertEquals(1, quitCalls.get());
  }

  @Test
  void subscribe_receivesNotificationsFromBus() {
    var bus = new LoadEventBus();
    recorder.subscribe(bus);

    bus.fireRequestSuccess("GET", "/a", 1.0, 10);
    bus.fireRequestFailure("GET", "/b", 2.0, new IllegalStateException("x"));
    bus.fireQuitting();

    assertEquals(2, buffer.drainAll().size());
    assertEquals(1, quitCalls.get());
  }
}
