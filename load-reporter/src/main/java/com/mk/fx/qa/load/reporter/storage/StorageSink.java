package com.mk.fx.qa.load.reporter.storage;

import com.mk.fx.qa.load.reporter.model.Sample;
import com.mk.fx.qa.load.reporter.model.TestRun;
import java.time.Instant;
import java.util.List;

/**
 * Destination for samples and run lifecycle records. Implementations report failures through
 * their return values and logs; none of the write methods throws on a storage error.
 */
public interface StorageSink extends AutoCloseable {

  /**
   * Persists one batch of samples as a unit.
   *
   * @return {@code true} if the batch was written, {@code false} if it was dropped
   */
  boolean writeSamples(List<Sample> batch);

  /** Records the start of a run. */
  boolean writeRunStart(TestRun run);

  /** Records the end of a run. */
  boolean writeRunEnd(TestRun run, Instant endTime);

  /** Releases the underlying connection. Calling it again has no effect. */
  @Override
  void close();
}
