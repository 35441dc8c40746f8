package com.mk.fx.qa.load.reporter.context;

/**
 * Source of the id of the execution unit (virtual user) issuing the current request. Used only to
 * correlate samples while diagnosing a run.
 */
@FunctionalInterface
public interface ExecutionContext {

  /** Returned when the calling thread is not bound to a virtual user. */
  int UNAVAILABLE = -1;

  /** Returns the current execution unit's id, or {@link #UNAVAILABLE}. */
  int currentId();
}
