package com.mk.fx.qa.load.reporter.utils;

import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** Works out the origin tag stamped on every sample: the generator's host name. */
@Slf4j
public final class OriginResolver {

  static final String UNKNOWN = "unknown";
  private static final List<String> HOST_VARIABLES = List.of("HOSTNAME", "COMPUTERNAME");

  private OriginResolver() {
    // Utility class, no instantiation
  }

  /**
   * Returns {@code configured} when it is set, otherwise the host name from the environment or
   * the local address, falling back to {@code "unknown"}.
   */
  public static String resolve(String configured) {
    return resolve(configured, System.getenv(), OriginResolver::localHostName);
  }

  @VisibleForTesting
  static String resolve(String configured, Map<String, String> env, HostNameLookup lookup) {
    if (isSet(configured)) {
      return configured.trim();
    }
    for (String variable : HOST_VARIABLES) {
      String value = env.get(variable);
      if (isSet(value)) {
        return value.trim();
      }
    }
    try {
      String host = lookup.hostName();
      return isSet(host) ? host : UNKNOWN;
    } catch (UnknownHostException e) {
      log.warn("Cannot determine local host name, samples will be tagged '{}'", UNKNOWN);
      return UNKNOWN;
    }
  }

  private static String localHostName() throws UnknownHostException {
    return InetAddress.getLocalHost().getHostName();
  }

  private static boolean isSet(String value) {
    return value != null && !value.isBlank();
  }

  /** Source of the local host name. */
  @FunctionalInterface
  interface HostNameLookup {
    String hostName() throws UnknownHostException;
  }
}
