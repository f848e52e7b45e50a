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
package io.fleak.skyetl.lib.batch;

import com.google.common.base.Preconditions;
import io.fleak.skyetl.api.model.Batch;
import io.fleak.skyetl.api.model.NormalizedFlightRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups normalized records into bounded batches. Records are grouped by departure date and
 * flight-id bucket, so one busy day spreads over several storage partitions instead of one.
 *
 * <p>No emitted batch holds more than {@code maxRows} rows or more than {@code maxBytes} estimated
 * bytes. A record larger than {@code maxBytes} on its own is never batched; callers check {@link
 * #accepts} first.
 *
 * <p>Owned by a single worker lane. Not thread safe.
 */
@Slf4j
public class FlightBatcher {

  private final String table;
  private final int maxRows;
  private final long maxBytes;
  private final int partitionBuckets;
  private final LongSupplier sequenceSupplier;

  private final Map<String, OpenBatch> openBatches = new LinkedHashMap<>();
  private int pendingCount;

  public FlightBatcher(
      @NonNull String table,
      int maxRows,
      long maxBytes,
      int partitionBuckets,
      @NonNull LongSupplier sequenceSupplier) {
    Preconditions.checkArgument(maxRows > 0, "maxRows must be positive: %s", maxRows);
    Preconditions.checkArgument(maxBytes > 0, "maxBytes must be positive: %s", maxBytes);
    Preconditions.checkArgument(
        partitionBuckets > 0, "partitionBuckets must be positive: %s", partitionBuckets);
    this.table = table;
    this.maxRows = maxRows;
    this.maxBytes = maxBytes;
    this.partitionBuckets = partitionBuckets;
    this.sequenceSupplier = sequenceSupplier;
  }

  /** Whether the record fits in a batch at all. */
  public boolean accepts(NormalizedFlightRecord record) {
    return RecordSizeEstimator.estimate(record) <= maxBytes;
  }

  /**
   * Adds a record to its group's open batch.
   *
   * @return the batches sealed by this call, in the order they were sealed; usually empty
   */
  public List<Batch> add(@NonNull NormalizedFlightRecord record) {
    long size = RecordSizeEstimator.estimate(record);
    Preconditions.checkArgument(
        size <= maxBytes,
        "record %s estimated at %s bytes exceeds maxBytes %s",
        record.partitionKey(),
        size,
        maxBytes);

    String groupKey = record.partitionKey().groupKey(partitionBuckets);
    List<Batch> sealed = new ArrayList<>(1);

    OpenBatch openBatch = openBatches.get(groupKey);
    if (openBatch != null && openBatch.bytes + size > maxBytes) {
      sealed.add(seal(groupKey));
      openBatch = null;
    }
    if (openBatch == null) {
      openBatch = new OpenBatch();
      openBatches.put(groupKey, openBatch);
    }
    openBatch.records.add(record);
    openBatch.bytes += size;
    pendingCount++;

    if (openBatch.records.size() >= maxRows || openBatch.bytes >= maxBytes) {
      sealed.add(seal(groupKey));
    }
    return sealed;
  }

  /** Seals every partial batch, oldest group first. */
  public List<Batch> drain() {
    List<Batch> sealed = new ArrayList<>(openBatches.size());
    for (String groupKey : new ArrayList<>(openBatches.keySet())) {
      sealed.add(seal(groupKey));
    }
    if (!sealed.isEmpty()) {
      log.debug("drained {} partial batch(es)", sealed.size());
    }
    return sealed;
  }

  /** Records added but not yet part of a sealed batch. */
  public int pendingCount() {
    return pendingCount;
  }

  private Batch seal(String groupKey) {
    OpenBatch openBatch = openBatches.remove(groupKey);
    pendingCount -= openBatch.records.size();
    Batch batch =
        new Batch(
            table, groupKey, sequenceSupplier.getAsLong(), openBatch.records, openBatch.bytes);
    log.debug(
        "sealed batch {} for group {}: {} rows, ~{} bytes",
        batch.batchId(),
        groupKey,
        batch.size(),
        batch.estimatedBytes());
    return batch;
  }

  private static class OpenBatch {
    private final List<NormalizedFlightRecord> records = new ArrayList<>();
    private long bytes;
  }
}
