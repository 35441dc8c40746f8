package com.mk.fx.qa.load.reporter.model;

/** Part a reporter plays in a (possibly distributed) run. */
public enum ReporterRole {
  /** Standalone run or distributed leader; owns the run id and the run lifecycle records. */
  COORDINATOR,
  /** Distributed follower; reuses the coordinator's run id and writes samples only. */
  PARTICIPANT
}
