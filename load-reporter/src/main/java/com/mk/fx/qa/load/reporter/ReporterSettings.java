package com.mk.fx.qa.load.reporter;

import java.time.Duration;
import java.util.List;
import lombok.Builder;

/**
 * Everything a {@link LoadReporter} needs to know about the run it reports.
 *
 * @param testplan name of the test plan, required
 * @param profileName load profile name, informational
 * @param description free text description of the run
 * @param targetRps requested rate, informational
 * @param dashboardUrl dashboard base URL the run link is built from; no link when blank
 * @param runId run id supplied by the coordinator in a distributed run
 * @param origin host name recorded on each sample; the local host name when blank
 * @param args the load engine's command line, inspected for role and client count
 * @param flushInterval pause between buffer drains
 * @param drainTimeout upper bound on the wait for the final drain at shutdown
 */
@Builder
public record ReporterSettings(
    String testplan,
    String profileName,
    String description,
    String targetRps,
    String dashboardUrl,
    String runId,
    String origin,
    List<String> args,
    Duration flushInterval,
    Duration drainTimeout) {

  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(500);
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

  public ReporterSettings {
    if (testplan == null || testplan.isBlank()) {
      throw new IllegalArgumentException("testplan must not be blank");
    }
    profileName = profileName != null ? profileName : "";
    description = description != null ? description : "";
    targetRps = targetRps != null && !targetRps.isBlank() ? targetRps : "0";
    args = args != null ? List.copyOf(args) : List.of();
    flushInterval = flushInterval != null ? flushInterval : DEFAULT_FLUSH_INTERVAL;
    drainTimeout = drainTimeout != null ? drainTimeout : DEFAULT_DRAIN_TIMEOUT;
  }
}
