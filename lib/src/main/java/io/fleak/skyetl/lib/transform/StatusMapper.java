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
package io.fleak.skyetl.lib.transform;

import io.fleak.skyetl.api.model.FlightStatus;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/** Maps free-text status values onto {@link FlightStatus}. Unrecognized values become UNKNOWN. */
public final class StatusMapper {

  private static final Map<String, FlightStatus> SYNONYMS =
      Map.ofEntries(
          Map.entry("EN ROUTE", FlightStatus.ACTIVE),
          Map.entry("ENROUTE", FlightStatus.ACTIVE),
          Map.entry("AIRBORNE", FlightStatus.ACTIVE),
          Map.entry("DEPARTED", FlightStatus.ACTIVE),
          Map.entry("IN AIR", FlightStatus.ACTIVE),
          Map.entry("ARRIVED", FlightStatus.LANDED),
          Map.entry("CANCELED", FlightStatus.CANCELLED),
          Map.entry("REDIRECTED", FlightStatus.DIVERTED),
          Map.entry("PLANNED", FlightStatus.SCHEDULED));

  private StatusMapper() {}

  public static FlightStatus map(String status) {
    if (StringUtils.isBlank(status)) {
      return FlightStatus.UNKNOWN;
    }
    String normalized = status.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s_\\-]+", " ");
    FlightStatus synonym = SYNONYMS.get(normalized);
    if (synonym != null) {
      return synonym;
    }
    for (FlightStatus value : FlightStatus.values()) {
      if (value.name().equals(normalized)) {
        return value;
      }
    }
    return FlightStatus.UNKNOWN;
  }
}
