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

import static io.fleak.skyetl.api.model.RawFlightRecord.*;

import io.fleak.skyetl.api.model.NormalizedFlightRecord;
import io.fleak.skyetl.api.model.RawFlightRecord;
import io.fleak.skyetl.api.model.RejectionReason;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Validates a raw record and reshapes it into the normalized schema. Checks run in a fixed order
 * and stop at the first failure: required fields, airport code format, timestamps, then status
 * mapping and delay derivation, which never fail.
 *
 * <p>Stateless apart from the injected clock, so one instance may be shared across threads.
 */
@Slf4j
public class FlightRecordTransformer {

  private static final Pattern AIRPORT_CODE = Pattern.compile("^[A-Z]{3}$");

  private final Clock clock;
  private final TimestampParser timestampParser = new TimestampParser();

  public FlightRecordTransformer(@NonNull Clock clock) {
    this.clock = clock;
  }

  public TransformResult transform(@NonNull RawFlightRecord raw) {
    String flightId = StringUtils.deleteWhitespace(StringUtils.upperCase(raw.flightId()));
    if (StringUtils.isEmpty(flightId)) {
      return reject(RejectionReason.missingField(FIELD_FLIGHT_ID), raw);
    }
    if (StringUtils.isBlank(raw.origin())) {
      return reject(RejectionReason.missingField(FIELD_ORIGIN), raw);
    }
    if (StringUtils.isBlank(raw.destination())) {
      return reject(RejectionReason.missingField(FIELD_DESTINATION), raw);
    }
    if (StringUtils.isBlank(raw.scheduledDeparture())) {
      return reject(RejectionReason.missingField(FIELD_SCHEDULED_DEPARTURE), raw);
    }

    String origin = normalizeAirportCode(raw.origin());
    if (!AIRPORT_CODE.matcher(origin).matches()) {
      return reject(RejectionReason.badFormat(FIELD_ORIGIN), raw);
    }
    String destination = normalizeAirportCode(raw.destination());
    if (!AIRPORT_CODE.matcher(destination).matches()) {
      return reject(RejectionReason.badFormat(FIELD_DESTINATION), raw);
    }

    Optional<OffsetDateTime> scheduledDeparture = timestampParser.parse(raw.scheduledDeparture());
    if (scheduledDeparture.isEmpty()) {
      return reject(RejectionReason.unparseableTimestamp(FIELD_SCHEDULED_DEPARTURE), raw);
    }
    OffsetDateTime actualDeparture;
    OffsetDateTime scheduledArrival;
    OffsetDateTime actualArrival;
    try {
      actualDeparture = parseOptional(FIELD_ACTUAL_DEPARTURE, raw.actualDeparture());
      scheduledArrival = parseOptional(FIELD_SCHEDULED_ARRIVAL, raw.scheduledArrival());
      actualArrival = parseOptional(FIELD_ACTUAL_ARRIVAL, raw.actualArrival());
    } catch (UnparseableTimestampException e) {
      return reject(RejectionReason.unparseableTimestamp(e.fieldName), raw);
    }

    Integer delayMinutes = null;
    if (actualDeparture != null) {
      long minutes = ChronoUnit.MINUTES.between(scheduledDeparture.get(), actualDeparture);
      if (minutes < Integer.MIN_VALUE || minutes > Integer.MAX_VALUE) {
        return reject(RejectionReason.badFormat(FIELD_ACTUAL_DEPARTURE), raw);
      }
      delayMinutes = (int) minutes;
    }

    NormalizedFlightRecord normalized =
        NormalizedFlightRecord.builder()
            .flightId(flightId)
            .origin(origin)
            .destination(destination)
            .scheduledDeparture(scheduledDeparture.get())
            .actualDeparture(actualDeparture)
            .scheduledArrival(scheduledArrival)
            .actualArrival(actualArrival)
            .status(StatusMapper.map(raw.status()))
            .delayMinutes(delayMinutes)
            .sourceIngestedAt(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS))
            .build();
    return TransformResult.success(normalized, raw);
  }

  private OffsetDateTime parseOptional(String fieldName, String value)
      throws UnparseableTimestampException {
    if (StringUtils.isBlank(value)) {
      return null;
    }
    return timestampParser
        .parse(value)
        .orElseThrow(() -> new UnparseableTimestampException(fieldName));
  }

  private static String normalizeAirportCode(String code) {
    return code.trim().toUpperCase(Locale.ROOT);
  }

  private static TransformResult reject(RejectionReason reason, RawFlightRecord raw) {
    log.debug("rejected {}: {}", raw.position(), reason);
    return TransformResult.rejected(reason, raw);
  }

  private static class UnparseableTimestampException extends Exception {
    private final String fieldName;

    UnparseableTimestampException(String fieldName) {
      super(fieldName, null, false, false);
      this.fieldName = fieldName;
    }
  }
}
