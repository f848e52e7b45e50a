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

import lombok.Getter;
import lombok.NonNull;

/** Why a raw record could not be turned into a {@link NormalizedFlightRecord}. */
public record RejectionReason(@NonNull Code code, @NonNull String subject) {

  @Getter
  public enum Code {
    MISSING_FIELD("MissingField"),
    BAD_FORMAT("BadFormat"),
    UNPARSEABLE_TIMESTAMP("UnparseableTimestamp"),
    MALFORMED("Malformed");

    private final String displayName;

    Code(String displayName) {
      this.displayName = displayName;
    }
  }

  public static RejectionReason missingField(String fieldName) {
    return new RejectionReason(Code.MISSING_FIELD, fieldName);
  }

  public static RejectionReason badFormat(String fieldName) {
    return new RejectionReason(Code.BAD_FORMAT, fieldName);
  }

  public static RejectionReason unparseableTimestamp(String fieldName) {
    return new RejectionReason(Code.UNPARSEABLE_TIMESTAMP, fieldName);
  }

  public static RejectionReason malformed(String detail) {
    return new RejectionReason(Code.MALFORMED, detail);
  }

  @Override
  public String toString() {
    return String.format("%s(\"%s\")", code.getDisplayName(), subject);
  }
}
