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
import io.fleak.skyetl.api.model.PartitionKey;
import io.fleak.skyetl.api.sink.SinkWriteException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Keyed in-memory table with the same conflict rule as the Cassandra adapter: for one partition
 * key the row with the later {@code sourceIngestedAt} wins, and on a tie the last write wins.
 *
 * <p>Failures can be scheduled with {@link #failNextWrites} to exercise the retry path.
 */
@Slf4j
public class InMemoryFlightSink extends AbstractPooledFlightSink {

  private final String table;
  private final Map<PartitionKey, NormalizedFlightRecord> rows = new ConcurrentHashMap<>();
  private final ConcurrentLinkedQueue<SinkWriteException> scheduledFailures =
      new ConcurrentLinkedQueue<>();
  private final AtomicInteger writeAttempts = new AtomicInteger();

  public InMemoryFlightSink(@NonNull String table, int maxConcurrentWrites, Duration writeTimeout) {
    super(maxConcurrentWrites, writeTimeout);
    this.table = table;
  }

  public InMemoryFlightSink(String table) {
    this(table, 64, Duration.ofSeconds(5));
  }

  @Override
  public String table() {
    return table;
  }

  @Override
  protected void writeBatch(Batch batch) throws SinkWriteException {
    writeAttempts.incrementAndGet();
    SinkWriteException failure = scheduledFailures.poll();
    if (failure != null) {
      throw failure;
    }
    for (NormalizedFlightRecord record : batch.records()) {
      rows.merge(
          record.partitionKey(),
          record,
          (existing, incoming) ->
              incoming.sourceIngestedAt().isBefore(existing.sourceIngestedAt())
                  ? existing
                  : incoming);
    }
    log.debug("stored batch {} ({} rows)", batch.batchId(), batch.size());
  }

  /** The next writes fail with these exceptions, one per write, in order. */
  public void failNextWrites(SinkWriteException... failures) {
    scheduledFailures.addAll(List.of(failures));
  }

  public int writeAttempts() {
    return writeAttempts.get();
  }

  public NormalizedFlightRecord get(PartitionKey key) {
    return rows.get(key);
  }

  public Map<PartitionKey, NormalizedFlightRecord> snapshot() {
    return Map.copyOf(rows);
  }

  public int size() {
    return rows.size();
  }

  @Override
  public void close() {
    // nothing to release
  }
}
