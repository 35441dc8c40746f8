package com.mk.fx.qa.load.reporter.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.reporter.model.ReporterRole;
import com.mk.fx.qa.load.reporter.model.TestRun;
import com.mk.fx.qa.load.reporter.support.RecordingStorageSink;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RunLifecycleTrackerTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final Instant T1 = Instant.parse("2024-05-01T10:30:00Z");
  private static final String DASHBOARD = "https://grafana.example.com/d/abc?orgId=1";
  private static final TestRun RUN = new TestRun(T0, "checkout", "smoke", 10, "50", "nightly");

  private final RecordingStorageSink sink = new RecordingStorageSink();
  private final Clock endClock = Clock.fixed(T1, ZoneOffset.UTC);

  @Test
  void coordinator_writesStartAndEndExactlyOnce() {
    var tracker = new RunLifecycleTracker(RUN, ReporterRole.COORDINATOR, sink, endClock, DASHBOARD);

    tracker.start();
    tracker.finish();
    tracker.finish();

    assertEquals(1, sink.runStarts().size());
    assertEquals(RUN, sink.runStarts().get(0));
    assertEquals(1, sink.runEnds().size());
    assertEquals(T1, sink.runEnds().get(0));
    assertEquals(RunLifecycleTracker.State.CLOSED, tracker.state());
    assertEquals(Optional.of(T1), tracker.endTime());
  }

  @Test
  void participant_neverWritesRunRecords() {
    var tracker = new RunLifecycleTracker(RUN, ReporterRole.PARTICIPANT, sink, endClock, DASHBOARD);

    tracker.start();
    Optional<String> link = tracker.finish();

    assertTrue(sink.runStarts().isEmpty());
    assertTrue(sink.runEnds().isEmpty());
    assertTrue(link.isEmpty());
    assertEquals(RunLifecycleTracker.State.CLOSED, tracker.state());
  }

  @Test
  void finish_returnsDashboardLinkCoveringRun() {
    var tracker = new RunLifecycleTracker(RUN, ReporterRole.COORDINATOR, sink, endClock, DASHBOARD);
    tracker.start();

    String link = tracker.finish().orElseThrow();

    assertEquals(
        DASHBOARD
            + "&var-testplan=checkout&from="
            + T0.getEpochSecond() * 1000
            + "&to="
            + (T1.getEpochSecond() + 1) * 1000,
        link);
  }

  @Test
  void dashboardUrl_encodesTestplan() {
    var run = new TestRun(T0, "checkout & pay", "", 1, "0", "");
    var tracker = new RunLifecycleTracker(run, ReporterRole.COORDINATOR, sink, endClock, DASHBOARD);

    assertThat(tracker.dashboardUrl(T1).orElseThrow()).contains("var-testplan=checkout+%26+pay");
  }

  @Test
  void dashboardUrl_emptyWithoutBaseUrl() {
    var tracker = new RunLifecycleTracker(RUN, ReporterRole.COORDINATOR, sink, endClock, " ");
    tracker.start();

    assertTrue(tracker.finish().isEmpty());
    assertEquals(1, sink.runEnds().size());
  }

  @Test
  void start_twice_isRejected() {
    var tracker = new RunLifecycleTracker(RUN, ReporterRole.COORDINATOR, sink, endClock, DASHBOARD);
    tracker.start();

    assertThrows(IllegalStateException.class, tracker::start);
    assertEquals(1, sink.runStarts().size());
  }

  @Test
  void finish_beforeStart_writesNothing() {
    var tracker = new RunLifecycleTracker(RUN, ReporterRole.COORDINATOR, sink, endClock, DASHBOARD);

    assertTrue(tracker.finish().isEmpty());
    assertTrue(sink.runEnds().isEmpty());
    assertEquals(RunLifecycleTracker.State.CLOSED, tracker.state());
  }
}
