package com.mk.fx.qa.load.reporter.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One completed request outcome, as persisted to the {@code request} table.
 *
 * <p>A successful sample always carries a response length and never an exception; a failed sample
 * carries an exception description and never a response length. Use {@link #success} and {@link
 * #failure} to build the two legal shapes.
 *
 * @param time when the outcome was observed
 * @param runId identifier of the run the sample belongs to
 * @param executionContextId id of the virtual user that issued the request, or {@code -1}
 * @param origin host name of the load generator
 * @param name request name, usually the path or a logical label
 * @param kind request category, for example the HTTP method
 * @param responseTimeMs response time in milliseconds
 * @param success whether the request succeeded
 * @param testplan name of the test plan being executed
 * @param responseLength response body length, {@code null} for failures
 * @param exception description of the failure, {@code null} for successes
 */
public record Sample(
    Instant time,
    Instant runId,
    int executionContextId,
    String origin,
    String name,
    String kind,
    double responseTimeMs,
    boolean success,
    String testplan,
    Integer responseLength,
    String exception) {

  public Sample {
    Objects.requireNonNull(time, "time");
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(testplan, "testplan");
    if (success && (responseLength == null || exception != null)) {
      throw new IllegalArgumentException(
          "Successful sample requires a response length and no exception");
    }
    if (!success && (responseLength != null || exception == null)) {
      throw new IllegalArgumentException(
          "Failed sample requires an exception and no response length");
    }
  }

  public static Sample success(
      Instant time,
      Instant runId,
      int executionContextId,
      String origin,
      String testplan,
      String kind,
      String name,
      double responseTimeMs,
      long responseLength) {
    if (responseLength < 0) {
      throw new IllegalArgumentException(
          "Response length must not be negative for a successful request: " + responseLength);
    }
    return new Sample(
        time,
        runId,
        executionContextId,
        origin,
        name,
        kind,
        responseTimeMs,
        true,
        testplan,
        Math.toIntExact(responseLength),
        null);
  }

  public static Sample failure(
      Instant time,
      Instant runId,
      int executionContextId,
      String origin,
      String testplan,
      String kind,
      String name,
      double responseTimeMs,
      String exception) {
    return new Sample(
        time,
        runId,
        executionContextId,
        origin,
        name,
        kind,
        responseTimeMs,
        false,
        testplan,
        null,
        exception);
  }
}
