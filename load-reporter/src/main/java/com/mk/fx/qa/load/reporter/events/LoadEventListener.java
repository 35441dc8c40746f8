package com.mk.fx.qa.load.reporter.events;

/**
 * Callbacks the load engine invokes for request outcomes and lifecycle transitions. Methods are
 * called on the thread that issued the request, so implementations must return quickly.
 */
public interface LoadEventListener {

  /**
   * A request completed successfully.
   *
   * @param kind request category, e.g. the HTTP method
   * @param name request name
   * @param responseTimeMs response time in milliseconds
   * @param responseLength response body length, never negative
   */
  default void onRequestSuccess(
      String kind, String name, double responseTimeMs, long responseLength) {}

  /**
   * A request failed.
   *
   * @param kind request category, e.g. the HTTP method
   * @param name request name
   * @param responseTimeMs response time in milliseconds
   * @param exception cause of the failure
   */
  default void onRequestFailure(
      String kind, String name, double responseTimeMs, Throwable exception) {}

  /** The load test is terminating. */
  default void onQuitting() {}
}
