package com.mk.fx.qa.load.reporter.context;

/**
 * {@link ExecutionContext} backed by a thread local. The load engine binds each virtual user's
 * thread to its id for the duration of the user's work:
 *
 * <pre>{@code
 * try (var ignored = context.bind(userIndex)) {
 *   runIterations();
 * }
 * }</pre>
 */
public class ThreadLocalExecutionContext implements ExecutionContext {

  private final ThreadLocal<Integer> current = new ThreadLocal<>();

  @Override
  public int currentId() {
    Integer id = current.get();
    return id != null ? id : UNAVAILABLE;
  }

  /**
   * Binds the calling thread to the given id until the returned scope is closed. The previous
   * binding, if any, is restored on close.
   */
  public Scope bind(int id) {
    if (id < 0) {
      throw new IllegalArgumentException("Execution context id must not be negative: " + id);
    }
    Integer previous = current.get();
    current.set(id);
    return () -> {
      if (previous == null) {
        current.remove();
      } else {
        current.set(previous);
      }
    };
  }

  /** Binding of a thread to an execution context id. */
  @FunctionalInterface
  public interface Scope extends AutoCloseable {
    @Override
    void close();
  }
}
