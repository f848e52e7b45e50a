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

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses the timestamp spellings found in flight feeds. Values without an offset are taken as UTC.
 *
 * <ul>
 *   <li>ISO-8601 date-time with or without offset: {@code 2024-01-01T08:00:00Z}, {@code
 *       2024-01-01T10:00:00+02:00}, {@code 2024-01-01T08:00:00}
 *   <li>{@code yyyy-MM-dd HH:mm:ss[.fraction][offset]}
 *   <li>{@code yyyy/MM/dd HH:mm[:ss]}
 *   <li>epoch seconds
 * </ul>
 */
public class TimestampParser {

  private static final Pattern EPOCH_SECONDS = Pattern.compile("^\\d{1,11}$");

  private static final DateTimeFormatter SPACE_SEPARATED =
      new DateTimeFormatterBuilder()
          .appendPattern("uuuu-MM-dd HH:mm:ss")
          .optionalStart()
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .optionalEnd()
          .optionalStart()
          .appendOffset("+HH:MM", "Z")
          .optionalEnd()
          .toFormatter();

  private static final DateTimeFormatter SLASH_SEPARATED =
      DateTimeFormatter.ofPattern("uuuu/MM/dd HH:mm[:ss]");

  private static final List<DateTimeFormatter> FORMATTERS =
      List.of(DateTimeFormatter.ISO_DATE_TIME, SPACE_SEPARATED, SLASH_SEPARATED);

  public Optional<OffsetDateTime> parse(String text) {
    String value = StringUtils.trimToNull(text);
    if (value == null) {
      return Optional.empty();
    }
    if (EPOCH_SECONDS.matcher(value).matches()) {
      try {
        return Optional.of(
            OffsetDateTime.ofInstant(
                Instant.ofEpochSecond(Long.parseLong(value)), ZoneOffset.UTC));
      } catch (DateTimeException e) {
        return Optional.empty();
      }
    }
    for (DateTimeFormatter formatter : FORMATTERS) {
      try {
        TemporalAccessor parsed =
            formatter.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
          return Optional.of(offsetDateTime.withOffsetSameInstant(ZoneOffset.UTC));
        }
        return Optional.of(((LocalDateTime) parsed).atOffset(ZoneOffset.UTC));
      } catch (DateTimeException e) {
        // unparseable, or outside the supported range after moving to UTC
      }
    }
    return Optional.empty();
  }
}
