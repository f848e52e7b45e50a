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

import com.google.common.base.CaseFormat;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import lombok.Builder;
import lombok.NonNull;

/**
 * A flight event exactly as read from a source. Every value is the unparsed source text and any of
 * them may be null or blank; validation happens in the transformer.
 */
@Builder(toBuilder = true)
public record RawFlightRecord(
    @NonNull SourcePosition position,
    String flightId,
    String origin,
    String destination,
    String scheduledDeparture,
    String actualDeparture,
    String scheduledArrival,
    String actualArrival,
    String status,
    Map<String, String> extras) {

  public static final String FIELD_FLIGHT_ID = "flight_id";
  public static final String FIELD_ORIGIN = "origin";
  public static final String FIELD_DESTINATION = "destination";
  public static final String FIELD_SCHEDULED_DEPARTURE = "scheduled_departure";
  public static final String FIELD_ACTUAL_DEPARTURE = "actual_departure";
  public static final String FIELD_SCHEDULED_ARRIVAL = "scheduled_arrival";
  public static final String FIELD_ACTUAL_ARRIVAL = "actual_arrival";
  public static final String FIELD_STATUS = "status";

  public RawFlightRecord {
    extras = extras == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(extras));
  }

  /**
   * Builds a raw record from a source row. Field names are matched after normalization, so {@code
   * flight_id}, {@code flightId}, {@code FlightId} and {@code "Flight Id"} all name the same
   * column. Unrecognized columns are kept in {@link #extras()}.
   */
  public static RawFlightRecord fromFields(SourcePosition position, Map<String, String> fields) {
    RawFlightRecordBuilder builder = RawFlightRecord.builder().position(position);
    Map<String, String> extras = new TreeMap<>();
    fields.forEach(
        (name, value) -> {
          if (name == null || value == null) {
            return;
          }
          String normalized = normalizeFieldName(name);
          switch (normalized) {
            case FIELD_FLIGHT_ID -> builder.flightId(value);
            case FIELD_ORIGIN -> builder.origin(value);
            case FIELD_DESTINATION -> builder.destination(value);
            case FIELD_SCHEDULED_DEPARTURE -> builder.scheduledDeparture(value);
            case FIELD_ACTUAL_DEPARTURE -> builder.actualDeparture(value);
            case FIELD_SCHEDULED_ARRIVAL -> builder.scheduledArrival(value);
            case FIELD_ACTUAL_ARRIVAL -> builder.actualArrival(value);
            case FIELD_STATUS -> builder.status(value);
            default -> extras.put(normalized, value);
          }
        });
    return builder.extras(extras).build();
  }

  /** All fields, known columns first, in a stable order. Null values are omitted. */
  public Map<String, String> toFieldMap() {
    Map<String, String> map = new LinkedHashMap<>();
    putIfNotNull(map, FIELD_FLIGHT_ID, flightId);
    putIfNotNull(map, FIELD_ORIGIN, origin);
    putIfNotNull(map, FIELD_DESTINATION, destination);
    putIfNotNull(map, FIELD_SCHEDULED_DEPARTURE, scheduledDeparture);
    putIfNotNull(map, FIELD_ACTUAL_DEPARTURE, actualDeparture);
    putIfNotNull(map, FIELD_SCHEDULED_ARRIVAL, scheduledArrival);
    putIfNotNull(map, FIELD_ACTUAL_ARRIVAL, actualArrival);
    putIfNotNull(map, FIELD_STATUS, status);
    map.putAll(extras);
    return map;
  }

  static String normalizeFieldName(String name) {
    String trimmed = name.trim().replaceAll("[\\s\\-.]+", "_");
    boolean hasUpper = !trimmed.equals(trimmed.toLowerCase(Locale.ROOT));
    boolean hasLower = !trimmed.equals(trimmed.toUpperCase(Locale.ROOT));
    if (hasUpper && hasLower && !trimmed.contains("_")) {
      CaseFormat format =
          Character.isUpperCase(trimmed.charAt(0))
              ? CaseFormat.UPPER_CAMEL
              : CaseFormat.LOWER_CAMEL;
      return format.to(CaseFormat.LOWER_UNDERSCORE, trimmed);
    }
    return trimmed.toLowerCase(Locale.ROOT);
  }

  private static void putIfNotNull(Map<String, String> map, String key, String value) {
    if (value != null) {
      map.put(key, value);
    }
  }
}
