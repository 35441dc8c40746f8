package com.mk.fx.qa.load.reporter.shutdown;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Owned list of hooks to run when the process exits.
 *
 * <p>Hooks run at most once: {@link #runAll()} takes the registered hooks and empties the list
 * before running them, and {@link #clear()} drops them without running. Inside a Spring context
 * the registry is closed with the context; standalone callers attach it to the JVM with {@link
 * #installRuntimeHook()}.
 */
@Slf4j
public class ShutdownHookRegistry implements AutoCloseable {

  private final List<Hook> hooks = new ArrayList<>();
  private Thread runtimeHook;

  public synchronized void register(String name, Runnable action) {
    hooks.add(new Hook(Objects.requireNonNull(name, "name"), Objects.requireNonNull(action)));
  }

  /** Drops all registered hooks without running them. */
  public synchronized void clear() {
    if (!hooks.isEmpty()) {
      log.debug("Clearing {} shutdown hook(s)", hooks.size());
      hooks.clear();
    }
  }

  public synchronized int size() {
    return hooks.size();
  }

  /** Runs every registered hook once, in registration order. A failing hook does not stop others. */
  public void runAll() {
    List<Hook> pending;
    synchronized (this) {
      pending = List.copyOf(hooks);
      hooks.clear();
    }
    for (Hook hook : pending) {
      try {
        log.debug("Running shutdown hook {}", hook.name());
        hook.action().run();
      } catch (RuntimeException e) {
        log.error("Shutdown hook {} failed", hook.name(), e);
      }
    }
  }

  /** Attaches {@link #runAll()} to JVM shutdown. Installing twice has no further effect. */
  public synchronized void installRuntimeHook() {
    if (runtimeHook != null) {
      return;
    }
    runtimeHook = new Thread(this::runAll, "load-reporter-exit");
    Runtime.getRuntime().addShutdownHook(runtimeHook);
  }

  @Override
  public void close() {
    runAll();
  }

  private record Hook(String name, Runnable action) {}
}
