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

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import lombok.Builder;
import lombok.NonNull;

/**
 * The canonical analytic row. Key fields are non-null by construction, so a partially populated
 * record cannot exist. Timestamps are held in UTC.
 *
 * @param delayMinutes departure delay in whole minutes, negative when early, null until the actual
 *     departure is observed
 * @param sourceIngestedAt when the record was transformed; newer values win on key conflicts
 */
@Builder(toBuilder = true)
public record NormalizedFlightRecord(
    @NonNull String flightId,
    @NonNull String origin,
    @NonNull String destination,
    @NonNull OffsetDateTime scheduledDeparture,
    OffsetDateTime actualDeparture,
    OffsetDateTime scheduledArrival,
    OffsetDateTime actualArrival,
    @NonNull FlightStatus status,
    Integer delayMinutes,
    @NonNull Instant sourceIngestedAt) {

  public NormalizedFlightRecord {
    if (flightId.isBlank()) {
      throw new IllegalArgumentException("flightId must not be blank");
    }
    scheduledDeparture = toUtc(scheduledDeparture);
    actualDeparture = toUtc(actualDeparture);
    scheduledArrival = toUtc(scheduledArrival);
    actualArrival = toUtc(actualArrival);
  }

  public LocalDate scheduledDepartureDate() {
    return scheduledDeparture.toLocalDate();
  }

  public PartitionKey partitionKey() {
    return new PartitionKey(flightId, scheduledDepartureDate());
  }

  private static OffsetDateTime toUtc(OffsetDateTime dateTime) {
    return dateTime == null ? null : dateTime.withOffsetSameInstant(ZoneOffset.UTC);
  }
}
