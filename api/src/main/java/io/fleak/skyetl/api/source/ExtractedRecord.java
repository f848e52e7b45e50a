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
package io.fleak.skyetl.api.source;

import io.fleak.skyetl.api.model.RawFlightRecord;
import io.fleak.skyetl.api.model.SourcePosition;
import lombok.NonNull;

/**
 * One item pulled from a source: either a parsed raw record or a malformed item that could not be
 * turned into one. Malformed items are counted as extracted and immediately rejected.
 */
public sealed interface ExtractedRecord {

  SourcePosition position();

  static ExtractedRecord of(RawFlightRecord record) {
    return new Parsed(record);
  }

  static ExtractedRecord malformed(SourcePosition position, String reason, String rawText) {
    return new Malformed(position, reason, rawText);
  }

  record Parsed(@NonNull RawFlightRecord record) implements ExtractedRecord {
    @Override
    public SourcePosition position() {
      return record.position();
    }
  }

  /**
   * @param rawText the offending source text, may be null when it could not be recovered
   */
  record Malformed(@NonNull SourcePosition position, @NonNull String reason, String rawText)
      implements ExtractedRecord {}
}
