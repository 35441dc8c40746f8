package com.mk.fx.qa.load.reporter.storage;

import com.mk.fx.qa.load.reporter.ReporterInitializationException;
import com.mk.fx.qa.load.reporter.model.Sample;
import com.mk.fx.qa.load.reporter.model.TestRun;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link StorageSink} writing to a PostgreSQL/TimescaleDB schema through a single shared
 * connection.
 *
 * <p>The flusher thread and the lifecycle code share the connection, so every operation is
 * serialized on this sink. Storage errors are logged and reported through the return value.
 */
@Slf4j
public class JdbcStorageSink implements StorageSink {

  static final String INSERT_SAMPLE =
      "INSERT INTO request (\"time\", run_id, execution_context_id, origin, name, kind,"
          + " response_time, success, testplan, response_length, exception)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
  static final String INSERT_RUN =
      "INSERT INTO testrun (run_id, testplan, profile_name, num_clients, rps, description)"
          + " VALUES (?, ?, ?, ?, ?, ?)";
  static final String UPDATE_RUN_END = "UPDATE testrun SET end_time = ? WHERE run_id = ?";
  static final String INSERT_EVENT = "INSERT INTO events (\"time\", \"text\") VALUES (?, ?)";

  private static final String CONNECTION_HELP =
      "Use the standard PostgreSQL environment variables (PGHOST, PGPORT, PGDATABASE, PGUSER,"
          + " PGPASSWORD) to specify where to report load test samples";

  private final DataSource dataSource;
  private final JdbcTemplate jdbc;
  private final Clock clock;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  JdbcStorageSink(DataSource dataSource, Clock clock) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.jdbc = new JdbcTemplate(dataSource);
  }

  /**
   * Creates a sink and checks that the database is reachable.
   *
   * @param dataSource source of the shared connection
   * @param target human readable description of the database, used in error messages
   * @param clock clock stamping the run start event
   * @throws ReporterInitializationException if no valid connection can be obtained
   */
  public static JdbcStorageSink connect(DataSource dataSource, String target, Clock clock) {
    var sink = new JdbcStorageSink(dataSource, clock);
    boolean valid;
    try {
      valid =
          Boolean.TRUE.equals(
              sink.jdbc.execute((ConnectionCallback<Boolean>) connection -> connection.isValid(5)));
    } catch (DataAccessException e) {
      log.error("Cannot connect to {}. {}", target, CONNECTION_HELP);
      throw new ReporterInitializationException(
          "Cannot connect to " + target + ". " + CONNECTION_HELP, e);
    }
    if (!valid) {
      log.error("Connection to {} is not valid. {}", target, CONNECTION_HELP);
      throw new ReporterInitializationException(
          "Connection to " + target + " is not valid. " + CONNECTION_HELP);
    }
    log.info("Reporting samples to {}", target);
    return sink;
  }

  @Override
  public synchronized boolean writeSamples(List<Sample> batch) {
    if (batch.isEmpty()) {
      return true;
    }
    if (closed.get()) {
      log.error("Dropping {} samples: storage connection is closed", batch.size());
      return false;
    }
    try {
      jdbc.batchUpdate(INSERT_SAMPLE, batch, batch.size(), JdbcStorageSink::bindSample);
      log.debug("Wrote {} samples", batch.size());
      return true;
    } catch (DataAccessException e) {
      log.error("Failed to write {} samples to the database: {}", batch.size(), e.toString());
      return false;
    }
  }

  @Override
  public synchronized boolean writeRunStart(TestRun run) {
    if (closed.get()) {
      log.error("Cannot record start of run {}: storage connection is closed", run.runId());
      return false;
    }
    try {
      jdbc.update(
          INSERT_RUN,
          timestamp(run.runId()),
          run.testplan(),
          run.profileName(),
          run.numClients(),
          run.targetRps(),
          run.description());
      jdbc.update(INSERT_EVENT, timestamp(clock.instant()), run.testplan() + " started");
      return true;
    } catch (DataAccessException e) {
      log.error("Failed to write testrun start record for {}: {}", run.runId(), e.toString());
      return false;
    }
  }

  @Override
  public synchronized boolean writeRunEnd(TestRun run, Instant endTime) {
    if (closed.get()) {
      log.error("Cannot record end of run {}: storage connection is closed", run.runId());
      return false;
    }
    try {
      jdbc.update(UPDATE_RUN_END, timestamp(endTime), timestamp(run.runId()));
      jdbc.update(INSERT_EVENT, timestamp(endTime), run.testplan() + " finished");
      return true;
    } catch (DataAccessException e) {
      log.error(
          "Failed to update testrun record (or events) with end time for {}: {}",
          run.runId(),
          e.toString());
      return false;
    }
  }

  @Override
  public synchronized void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      if (dataSource instanceof DisposableBean disposable) {
        disposable.destroy();
      } else if (dataSource instanceof AutoCloseable closeable) {
        closeable.close();
      }
      log.info("Storage connection closed");
    } catch (Exception e) {
      log.warn("Failed to close storage connection: {}", e.getMessage());
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  private static void bindSample(PreparedStatement ps, Sample sample) throws SQLException {
    ps.setObject(1, timestamp(sample.time()));
    ps.setObject(2, timestamp(sample.runId()));
    ps.setInt(3, sample.executionContextId());
    ps.setString(4, sample.origin());
    ps.setString(5, sample.name());
    ps.setString(6, sample.kind());
    ps.setDouble(7, sample.responseTimeMs());
    ps.setBoolean(8, sample.success());
    ps.setString(9, sample.testplan());
    if (sample.responseLength() != null) {
      ps.setInt(10, sample.responseLength());
    } else {
      ps.setNull(10, Types.INTEGER);
    }
    ps.setString(11, sample.exception());
  }

  private static OffsetDateTime timestamp(Instant instant) {
    return instant.atOffset(ZoneOffset.UTC);
  }
}
