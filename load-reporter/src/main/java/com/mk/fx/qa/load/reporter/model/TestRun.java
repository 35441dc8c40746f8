package com.mk.fx.qa.load.reporter.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Descriptor of one logical load test run, as persisted to the {@code testrun} table. The run id
 * doubles as the run's start time.
 */
public record TestRun(
    Instant runId,
    String testplan,
    String profileName,
    int numClients,
    String targetRps,
    String description) {

  public TestRun {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(testplan, "testplan");
    profileName = profileName != null ? profileName : "";
    targetRps = targetRps != null ? targetRps : "0";
    description = description != null ? description : "";
  }

  public Instant startTime() {
    return runId;
  }
}
