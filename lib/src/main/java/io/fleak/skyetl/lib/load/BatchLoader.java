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

import io.fleak.skyetl.api.model.Batch;
import io.fleak.skyetl.api.model.NormalizedFlightRecord;
import io.fleak.skyetl.api.run.PipelineRun;
import io.fleak.skyetl.api.sink.FlightSink;
import io.fleak.skyetl.api.sink.PermanentWriteException;
import io.fleak.skyetl.api.sink.SinkConnection;
import io.fleak.skyetl.api.sink.SinkWriteException;
import io.fleak.skyetl.api.sink.TransientWriteException;
import io.fleak.skyetl.lib.dlq.DlqWriter;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Delivers batches to a {@link FlightSink}, retrying transient failures with backoff.
 *
 * <p>Every delivery ends in exactly one terminal state and updates the run counters once: loaded
 * rows and batches on success, failed rows and batches otherwise. Failed batches go to the dead
 * letter writer with their last error. Because sink writes are idempotent upserts, a retry
 * rewrites the whole batch.
 */
@Slf4j
public class BatchLoader {

  static final String METADATA_OUTCOME = "outcome";
  static final String METADATA_ATTEMPTS = "attempts";

  private final FlightSink sink;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;
  private final PipelineRun run;
  private final DlqWriter dlqWriter;
  private final Clock clock;

  public BatchLoader(
      @NonNull FlightSink sink,
      @NonNull RetryPolicy retryPolicy,
      @NonNull Sleeper sleeper,
      @NonNull PipelineRun run,
      @NonNull DlqWriter dlqWriter,
      @NonNull Clock clock) {
    this.sink = sink;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
    this.run = run;
    this.dlqWriter = dlqWriter;
    this.clock = clock;
  }

  public DeliveryOutcome deliver(@NonNull Batch batch) {
    DeliveryState state = DeliveryState.ATTEMPTING;
    int attempt = 0;
    String lastError = null;

    while (!state.isTerminal()) {
      switch (state) {
        case ATTEMPTING -> {
          attempt++;
          try {
            write(batch);
            state = DeliveryState.SUCCEEDED;
          } catch (TransientWriteException e) {
            lastError = e.getMessage();
            if (attempt >= retryPolicy.maxAttempts()) {
              state = DeliveryState.EXHAUSTED;
            } else {
              log.warn(
                  "batch {} write failed (attempt {}/{}), will retry: {}",
                  batch.batchId(),
                  attempt,
                  retryPolicy.maxAttempts(),
                  e.getMessage());
              state = DeliveryState.BACKOFF_WAIT;
            }
          } catch (SinkWriteException e) {
            lastError = e.getMessage();
            state = DeliveryState.REJECTED;
          }
        }
        case BACKOFF_WAIT -> {
          Duration backoff = retryPolicy.backoff(attempt);
          try {
            sleeper.sleep(backoff);
            state = DeliveryState.ATTEMPTING;
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lastError = "interrupted during backoff after: " + lastError;
            state = DeliveryState.EXHAUSTED;
          }
        }
        default -> throw new IllegalStateException("unexpected delivery state " + state);
      }
    }

    DeliveryOutcome outcome = new DeliveryOutcome(batch, state, attempt, lastError);
    if (outcome.isSuccess()) {
      run.recordLoaded(batch.size());
      for (NormalizedFlightRecord record : batch.records()) {
        run.getDelayStatistics().record(record.delayMinutes());
      }
      log.debug(
          "batch {} loaded: {} rows in {} attempt(s)", batch.batchId(), batch.size(), attempt);
    } else {
      run.recordFailed(batch.size());
      log.error(
          "batch {} failed ({}) after {} attempt(s): {}",
          batch.batchId(),
          state,
          attempt,
          lastError);
      dlqWriter.writeFailedBatch(
          clock.millis(),
          batch,
          lastError,
          Map.of(METADATA_OUTCOME, state.name(), METADATA_ATTEMPTS, String.valueOf(attempt)));
    }
    return outcome;
  }

  private void write(Batch batch) throws SinkWriteException {
    try (SinkConnection connection = sink.acquire()) {
      connection.write(batch);
    } catch (SinkWriteException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new PermanentWriteException("unexpected sink failure: " + e, e);
    }
  }
}
