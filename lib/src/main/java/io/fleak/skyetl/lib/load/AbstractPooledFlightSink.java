/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fleak.skyetl.lib.load;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.fleak.skyetl.api.model.Batch;
import io.fleak.skyetl.api.sink.FlightSink;
import io.fleak.skyetl.api.sink.SinkConnection;
import io.fleak.skyetl.api.sink.SinkWriteException;
import io.fleak.skyetl.api.sink.TransientWriteException;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.NonNull;

/**
 * Caps the number of batches written at the same time. A connection holds one permit from {@link
 * #acquire()} until it is closed.
 */
public abstract class AbstractPooledFlightSink implements FlightSink {

  private final Semaphore permits;
  private final Duration acquireTimeout;

  protected AbstractPooledFlightSink(int maxConcurrentWrites, @NonNull Duration acquireTimeout) {
    Preconditions.checkArgument(
        maxConcurrentWrites > 0, "maxConcurrentWrites must be positive: %s", maxConcurrentWrites);
    this.permits = new Semaphore(maxConcurrentWrites, true);
    this.acquireTimeout = acquireTimeout;
  }

  /** Writes the batch while the caller holds a permit. */
  protected abstract void writeBatch(Batch batch) throws SinkWriteException;

  @Override
  public SinkConnection acquire() throws SinkWriteException {
    boolean acquired;
    try {
      acquired = permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientWriteException("interrupted while waiting for a write slot", e);
    }
    if (!acquired) {
      throw new TransientWriteException(
          "no write slot became available within " + acquireTimeout.toMillis() + "ms");
    }
    return new PooledConnection();
  }

  @VisibleForTesting
  public int availablePermits() {
    return permits.availablePermits();
  }

  private class PooledConnection implements SinkConnection {
    private final AtomicBoolean released = new AtomicBoolean();

    @Override
    public void write(Batch batch) throws SinkWriteException {
      Preconditions.checkState(!released.get(), "connection already released");
      writeBatch(batch);
    }

    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        permits.release();
      }
    }
  }
}
