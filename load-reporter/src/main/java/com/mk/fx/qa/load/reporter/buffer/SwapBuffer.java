package com.mk.fx.qa.load.reporter.buffer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only accumulator with an atomic take-and-reset.
 *
 * <p>Items appended since the last {@link #drainAll()} form the current epoch. A drain hands the
 * whole epoch to the caller and starts a new, empty one in a single step under the buffer's lock,
 * so an item is observed by exactly one drain. Items appended by one thread keep their order
 * within an epoch.
 *
 * @param <T> element type
 */
public final class SwapBuffer<T> {

  private final Object lock = new Object();
  private List<T> epoch = new ArrayList<>();

  public void append(T item) {
    Objects.requireNonNull(item, "item");
    synchronized (lock) {
      epoch.add(item);
    }
  }

  /**
   * Takes the current epoch and replaces it with an empty one.
   *
   * @return the drained items, empty when nothing was appended since the last drain
   */
  public List<T> drainAll() {
    List<T> taken;
    synchronized (lock) {
      if (epoch.isEmpty()) {
        return List.of();
      }
      taken = epoch;
      epoch = new ArrayList<>();
    }
    return Collections.unmodifiableList(taken);
  }

  public int size() {
    synchronized (lock) {
      return epoch.size();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }
}
