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
package io.fleak.skyetl.api.model;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.NonNull;

/**
 * A bounded group of normalized records delivered to storage as one write unit. Records share the
 * same {@link PartitionKey#groupKey(int) group key} and keep insertion order.
 *
 * @param sequence run-wide, monotonically increasing batch number
 * @param estimatedBytes estimated wire size of all records
 */
public record Batch(
    @NonNull String table,
    @NonNull String groupKey,
    long sequence,
    @NonNull List<NormalizedFlightRecord> records,
    long estimatedBytes) {

  public Batch {
    Preconditions.checkArgument(!records.isEmpty(), "a batch must contain at least one record");
    records = List.copyOf(records);
  }

  public int size() {
    return records.size();
  }

  public String batchId() {
    return table + ":" + sequence;
  }
}
