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
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import lombok.NonNull;

/**
 * Storage partition key of a flight row. Matches the table's {@code PRIMARY KEY ((flight_id,
 * scheduled_departure_date))}.
 */
public record PartitionKey(@NonNull String flightId, @NonNull LocalDate scheduledDepartureDate) {

  /** Stable bucket in {@code [0, bucketCount)} derived from the flight id. */
  public int bucket(int bucketCount) {
    Preconditions.checkArgument(bucketCount > 0, "bucketCount must be positive: %s", bucketCount);
    int hash = Hashing.murmur3_32_fixed().hashString(flightId, StandardCharsets.UTF_8).asInt();
    return Math.floorMod(hash, bucketCount);
  }

  /**
   * Batch grouping prefix: records sharing a departure date and a flight-id bucket are written
   * together, which spreads one busy day over {@code bucketCount} groups.
   */
  public String groupKey(int bucketCount) {
    return scheduledDepartureDate + "/" + bucket(bucketCount);
  }

  @Override
  public String toString() {
    return flightId + "@" + scheduledDepartureDate;
  }
}
