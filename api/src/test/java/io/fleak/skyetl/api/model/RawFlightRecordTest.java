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

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RawFlightRecordTest {

  private static final SourcePosition POSITION = new SourcePosition("flights.csv", 3);

  @Test
  void testFromFields_normalizesFieldNames() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("FlightId", "BA117");
    fields.put("origin", "LHR");
    fields.put("Destination", "JFK");
    fields.put("scheduledDeparture", "2024-03-01T10:00:00Z");
    fields.put("Actual Departure", "2024-03-01T10:12:00Z");
    fields.put("STATUS", "landed");
    fields.put("aircraft_type", "B777");

    RawFlightRecord record = RawFlightRecord.fromFields(POSITION, fields);

    assertEquals("BA117", record.flightId());
    assertEquals("LHR", record.origin());
    assertEquals("JFK", record.destination());
    assertEquals("2024-03-01T10:00:00Z", record.scheduledDeparture());
    assertEquals("2024-03-01T10:12:00Z", record.actualDeparture());
    assertEquals("landed", record.status());
    assertNull(record.scheduledArrival());
    assertEquals(Map.of("aircraft_type", "B777"), record.extras());
    assertEquals(POSITION, record.position());
  }

  @Test
  void testFromFields_independentOfDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    try {
      RawFlightRecord record =
          RawFlightRecord.fromFields(POSITION, Map.of("FLIGHT_ID", "TK1", "ORIGIN", "IST"));
      assertEquals("TK1", record.flightId());
      assertEquals("IST", record.origin());
      assertTrue(record.extras().isEmpty());
    } finally {
      Locale.setDefault(previous);
    }
  }

  @Test
  void testToFieldMap_knownFieldsFirst() {
    RawFlightRecord record =
        RawFlightRecord.builder()
            .position(POSITION)
            .flightId("AF22")
            .origin("CDG")
            .extras(Map.of("tail", "F-GSPA"))
            .build();

    Map<String, String> fieldMap = record.toFieldMap();

    assertEquals(
        "[flight_id, origin, tail]", fieldMap.keySet().toString(), "unexpected field order");
  }

  @Test
  void testPositionRequired() {
    assertThrows(NullPointerException.class, () -> RawFlightRecord.builder().build());
  }
}
