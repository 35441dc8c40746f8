package com.mk.fx.qa.load.reporter.lifecycle;

import com.mk.fx.qa.load.reporter.model.ReporterRole;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Reads the reporter-relevant flags from the load engine's command line. */
@Slf4j
public final class InvocationArguments {

  public static final String LEADER_FLAG = "--master";
  public static final String FOLLOWER_FLAG = "--worker";
  public static final String LEGACY_FOLLOWER_FLAG = "--slave";
  public static final List<String> CLIENT_COUNT_FLAGS = List.of("-c", "--clients");

  private InvocationArguments() {
    // Utility class, no instantiation
  }

  public static boolean isLeader(List<String> args) {
    return args.contains(LEADER_FLAG);
  }

  public static boolean isFollower(List<String> args) {
    return args.contains(FOLLOWER_FLAG) || args.contains(LEGACY_FOLLOWER_FLAG);
  }

  public static boolean isDistributed(List<String> args) {
    return isLeader(args) || isFollower(args);
  }

  /** Followers participate; leaders and standalone runs coordinate. */
  public static ReporterRole role(List<String> args) {
    return isFollower(args) ? ReporterRole.PARTICIPANT : ReporterRole.COORDINATOR;
  }

  /**
   * Returns the number following the last client-count flag, or {@code 1} when the flag is absent
   * or not followed by a positive number.
   */
  public static int clientCount(List<String> args) {
    int count = 1;
    for (int i = 0; i < args.size(); i++) {
      if (!CLIENT_COUNT_FLAGS.contains(args.get(i))) {
        continue;
      }
      if (i + 1 >= args.size()) {
        log.warn("Flag {} has no value, assuming 1 client", args.get(i));
        continue;
      }
      String value = args.get(i + 1);
      try {
        int parsed = Integer.parseInt(value.trim());
        if (parsed > 0) {
          count = parsed;
        } else {
          log.warn("Ignoring non-positive client count '{}'", value);
        }
      } catch (NumberFormatException e) {
        log.warn("Ignoring non-numeric client count '{}'", value);
      }
    }
    return count;
  }
}
