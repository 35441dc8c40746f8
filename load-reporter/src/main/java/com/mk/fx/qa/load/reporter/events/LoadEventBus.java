package com.mk.fx.qa.load.reporter.events;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * Registry of {@link LoadEventListener}s that the load engine fires notifications into. Listeners
 * are invoked synchronously, in registration order, on the firing thread.
 */
@Slf4j
public class LoadEventBus {

  private final List<LoadEventListener> listeners = new CopyOnWriteArrayList<>();

  public void register(LoadEventListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public boolean unregister(LoadEventListener listener) {
    return listeners.remove(listener);
  }

  public int listenerCount() {
    return listeners.size();
  }

  public void fireRequestSuccess(
      String kind, String name, double responseTimeMs, long responseLength) {
    for (LoadEventListener listener : listeners) {
      listener.onRequestSuccess(kind, name, responseTimeMs, responseLength);
    }
  }

  public void fireRequestFailure(
      String kind, String name, double responseTimeMs, Throwable exception) {
    for (LoadEventListener listener : listeners) {
      listener.onRequestFailure(kind, name, responseTimeMs, exception);
    }
  }

  public void fireQuitting() {
    log.info("Quitting notification fired to {} listener(s)", listeners.size());
    for (LoadEventListener listener : listeners) {
      listener.onQuitting();
    }
  }
}
