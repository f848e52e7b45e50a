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
package io.fleak.skyetl.runner;

import io.fleak.skyetl.api.model.Batch;
import io.fleak.skyetl.api.model.NormalizedFlightRecord;
import io.fleak.skyetl.api.model.RawFlightRecord;
import io.fleak.skyetl.api.run.PipelineRun;
import io.fleak.skyetl.api.source.ExtractedRecord;
import io.fleak.skyetl.api.source.FlightSource;
import io.fleak.skyetl.api.source.RecordCursor;
import io.fleak.skyetl.api.source.SourceUnavailableException;
import io.fleak.skyetl.lib.batch.FlightBatcher;
import io.fleak.skyetl.lib.batch.RecordSizeEstimator;
import io.fleak.skyetl.lib.dlq.DlqWriter;
import io.fleak.skyetl.lib.load.BatchLoader;
import io.fleak.skyetl.lib.load.DeliveryOutcome;
import io.fleak.skyetl.lib.transform.FlightRecordTransformer;
import io.fleak.skyetl.lib.transform.TransformResult;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs extract, transform, batch and load for one slice of the source. The lane owns its cursor,
 * transformer, batcher and loader; it shares only the run counters, the sink and the dead letter
 * writer with other lanes.
 *
 * <p>The cancellation token is checked before each record is pulled. Once it is set the lane
 * finishes the delivery in progress, leaves partial batches unsent and counts their records as
 * skipped. A lane that fails also sets the token so that its siblings stop.
 */
@Slf4j
public class WorkerLane implements Callable<LaneResult> {

  private final int laneIndex;
  private final int laneCount;
  private final FlightSource source;
  private final FlightRecordTransformer transformer;
  private final FlightBatcher batcher;
  private final BatchLoader loader;
  private final DlqWriter dlqWriter;
  private final PipelineRun run;
  private final CancellationToken cancellationToken;
  private final LaneCounters counters;
  private final String table;
  private final Clock clock;

  private long extracted;
  private long rejected;
  private long batchesDelivered;

  public WorkerLane(
      int laneIndex,
      int laneCount,
      @NonNull FlightSource source,
      @NonNull FlightRecordTransformer transformer,
      @NonNull FlightBatcher batcher,
      @NonNull BatchLoader loader,
      @NonNull DlqWriter dlqWriter,
      @NonNull PipelineRun run,
      @NonNull CancellationToken cancellationToken,
      @NonNull LaneCounters counters,
      @NonNull String table,
      @NonNull Clock clock) {
    this.laneIndex = laneIndex;
    this.laneCount = laneCount;
    this.source = source;
    this.transformer = transformer;
    this.batcher = batcher;
    this.loader = loader;
    this.dlqWriter = dlqWriter;
    this.run = run;
    this.cancellationToken = cancellationToken;
    this.counters = counters;
    this.table = table;
    this.clock = clock;
  }

  @Override
  public LaneResult call() {
    log.info("lane {}/{} started on source {}", laneIndex, laneCount, source.name());
    LaneResult result;
    try (RecordCursor cursor = source.open(laneIndex, laneCount)) {
      result = consume(cursor);
    } catch (SourceUnavailableException e) {
      log.error("lane {} lost source {}", laneIndex, source.name(), e);
      result =
          new LaneResult(laneIndex, LaneResult.Termination.SOURCE_UNAVAILABLE, e.getMessage());
    } catch (RuntimeException e) {
      log.error("lane {} failed unexpectedly", laneIndex, e);
      result = new LaneResult(laneIndex, LaneResult.Termination.FAULT, e.toString());
    }

    if (result.termination() != LaneResult.Termination.COMPLETED) {
      int pending = batcher.pendingCount();
      if (pending > 0) {
        run.recordSkipped(pending);
        log.warn("lane {} left {} unbatched record(s) unsent", laneIndex, pending);
      }
    }
    if (result.termination().isAbnormal() && cancellationToken.cancel()) {
      log.warn("lane {} requested cancellation of the run", laneIndex);
    }
    log.info(
        "lane {} finished ({}): extracted={}, rejected={}, batches={}",
        laneIndex,
        result.termination(),
        extracted,
        rejected,
        batchesDelivered);
    return result;
  }

  private LaneResult consume(RecordCursor cursor) {
    while (true) {
      if (cancellationToken.isCancelled()) {
        log.info("lane {} observed cancellation", laneIndex);
        return LaneResult.cancelled(laneIndex);
      }
      if (!cursor.hasNext()) {
        break;
      }
      process(cursor.next());
    }
    deliver(batcher.drain());
    return LaneResult.completed(laneIndex);
  }

  private void process(ExtractedRecord item) {
    extracted++;
    run.recordExtracted();
    counters.increaseExtracted(1);

    if (item instanceof ExtractedRecord.Malformed malformed) {
      reject();
      log.debug("malformed item at {}: {}", malformed.position(), malformed.reason());
      dlqWriter.writeMalformed(clock.millis(), malformed);
      return;
    }

    RawFlightRecord raw = ((ExtractedRecord.Parsed) item).record();
    TransformResult result = transformer.transform(raw);
    if (!result.isSuccess()) {
      reject();
      log.debug("rejected record at {}: {}", raw.position(), result.getRejection());
      dlqWriter.writeRejection(clock.millis(), raw, result.getRejection());
      return;
    }
    run.recordTransformed();

    NormalizedFlightRecord record = result.getNormalized();
    if (!batcher.accepts(record)) {
      String error =
          String.format(
              "record estimated at %d bytes exceeds the batch byte limit",
              RecordSizeEstimator.estimate(record));
      log.error("record {} at {} not loaded: {}", record.partitionKey(), raw.position(), error);
      run.recordFailed(1);
      counters.increaseFailed(1);
      dlqWriter.writeFailedRecord(clock.millis(), table, record, error);
      return;
    }
    deliver(batcher.add(record));
  }

  private void reject() {
    rejected++;
    run.recordRejected();
    counters.increaseRejected(1);
  }

  private void deliver(List<Batch> batches) {
    for (Batch batch : batches) {
      counters.startBatchWrite();
      DeliveryOutcome outcome = loader.deliver(batch);
      counters.stopBatchWrite(batch.table());
      batchesDelivered++;
      if (outcome.isSuccess()) {
        counters.increaseLoaded(batch.size());
      } else {
        counters.increaseFailed(batch.size());
      }
    }
  }
}
