package com.mk.fx.qa.load.reporter.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.reporter.ReporterInitializationException;
import com.mk.fx.qa.load.reporter.model.TestRun;
import com.mk.fx.qa.load.reporter.support.Samples;
import com.mk.fx.qa.load.reporter.support.TestDatabase;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

class JdbcStorageSinkTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-01T10:00:01Z"), ZoneOffset.UTC);
  private static final TestRun RUN =
      new TestRun(Samples.RUN_ID, "checkout", "smoke", 10, "50", "nightly");

  private TestDatabase database;
  private JdbcStorageSink sink;

  @BeforeEach
  void setUp() {
    database = TestDatabase.create();
    sink = JdbcStorageSink.connect(database.reporterDataSource(), "h2", CLOCK);
  }

  @Test
  void writeSamples_insertsWholeBatch() {
    assertTrue(sink.writeSamples(List.of(Samples.ok(1), Samples.ok(2), Samples.failed(3))));

    assertEquals(3, database.count("request"));
    Map<String, Object> failed =
        database.verifier().queryForMap("SELECT * FROM request WHERE response_time = 3");
    assertEquals(false, failed.get("success"));
    assertNull(failed.get("response_length"));
    assertEquals("boom", failed.get("exception"));
    assertEquals(-1, ((Number) failed.get("execution_context_id")).intValue());

    Map<String, Object> ok =
        database.verifier().queryForMap("SELECT * FROM request WHERE response_time = 2");
    assertEquals(true, ok.get("success"));
    assertEquals(100, ((Number) ok.get("response_length")).intValue());
    assertNull(ok.get("exception"));
    assertEquals("gen-1", ok.get("origin"));
    assertEquals("GET", ok.get("kind"));
    assertEquals("/r/2", ok.get("name"));
    assertEquals("checkout", ok.get("testplan"));
  }

  @Test
  void writeSamples_emptyBatch_isNoOp() {
    assertTrue(sink.writeSamples(List.of()));
    assertEquals(0, database.count("request"));
  }

  @Test
  void writeSamples_failure_isReportedNotThrown() {
    database.verifier().execute("DROP TABLE request");

    assertFalse(sink.writeSamples(List.of(Samples.ok(1))));
  }

  @Test
  void runStartAndEnd_areRecordedWithEvents() {
    Instant end = Instant.parse("2024-05-01T10:30:00Z");

    assertTrue(sink.writeRunStart(RUN));
    assertTrue(sink.writeRunEnd(RUN, end));

    Map<String, Object> row = database.verifier().queryForMap("SELECT * FROM testrun");
    assertEquals("checkout", row.get("testplan"));
    assertEquals("smoke", row.get("profile_name"));
    assertEquals(10, ((Number) row.get("num_clients")).intValue());
    assertEquals("50", row.get("rps"));
    assertEquals("nightly", row.get("description"));
    assertNotNull(row.get("end_time"));
    assertThat(
            database
                .verifier()
                .queryForList("SELECT \"text\" FROM events ORDER BY \"time\"", String.class))
        .containsExactly("checkout started", "checkout finished");
  }

  @Test
  void runEndFailure_isReportedNotThrown() {
    database.verifier().execute("DROP TABLE testrun");

    assertFalse(sink.writeRunEnd(RUN, Instant.now()));
  }

  @Test
  void close_isIdempotent_andStopsFurtherWrites() {
    sink.close();
    assertDoesNotThrow(sink::close);

    assertTrue(sink.isClosed());
    assertFalse(sink.writeSamples(List.of(Samples.ok(1))));
    assertFalse(sink.writeRunStart(RUN));
    assertEquals(0, database.count("request"));
  }

  @Test
  void connect_unreachableDatabase_isFatal() {
    var unreachable =
        new SingleConnectionDataSource("jdbc:h2:tcp://127.0.0.1:1/nowhere", "sa", "", true);

    assertThatThrownBy(() -> JdbcStorageSink.connect(unreachable, "nowhere", CLOCK))
        .isInstanceOf(ReporterInitializationException.class)
        .hasMessageContaining("PGHOST");
  }
}
