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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class NormalizedFlightRecordTest {

  private static NormalizedFlightRecord.NormalizedFlightRecordBuilder base() {
    return NormalizedFlightRecord.builder()
        .flightId("QF1")
        .origin("SYD")
        .destination("LHR")
        .scheduledDeparture(OffsetDateTime.of(2024, 1, 1, 23, 30, 0, 0, ZoneOffset.ofHours(-5)))
        .status(FlightStatus.SCHEDULED)
        .sourceIngestedAt(Instant.parse("2024-01-02T00:00:00Z"));
  }

  @Test
  void testTimestampsConvertedToUtc() {
    NormalizedFlightRecord record = base().build();
    assertEquals(ZoneOffset.UTC, record.scheduledDeparture().getOffset());
    assertEquals(4, record.scheduledDeparture().getHour());
    assertEquals(LocalDate.of(2024, 1, 2), record.scheduledDepartureDate());
  }

  @Test
  void testPartitionKey() {
    PartitionKey key = base().build().partitionKey();
    assertEquals(new PartitionKey("QF1", LocalDate.of(2024, 1, 2)), key);
    assertEquals("QF1@2024-01-02", key.toString());
  }

  @Test
  void testRequiredFields() {
    assertThrows(NullPointerException.class, () -> base().origin(null).build());
    assertThrows(NullPointerException.class, () -> base().scheduledDeparture(null).build());
    assertThrows(IllegalArgumentException.class, () -> base().flightId(" ").build());
  }

  @Test
  void testOptionalFieldsMayBeNull() {
    NormalizedFlightRecord record = base().build();
    assertNull(record.actualDeparture());
    assertNull(record.delayMinutes());
  }
}
