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

import io.fleak.skyetl.api.model.NormalizedFlightRecord;
import io.fleak.skyetl.api.model.RawFlightRecord;
import io.fleak.skyetl.api.model.RejectionReason;
import lombok.Getter;
import lombok.NonNull;

/** Outcome of transforming one raw record: exactly one of normalized record or rejection. */
@Getter
public class TransformResult {
  private final NormalizedFlightRecord normalized;
  private final RejectionReason rejection;
  @NonNull private final RawFlightRecord sourceRecord;

  private TransformResult(
      NormalizedFlightRecord normalized,
      RejectionReason rejection,
      @NonNull RawFlightRecord sourceRecord) {
    this.normalized = normalized;
    this.rejection = rejection;
    this.sourceRecord = sourceRecord;
  }

  public static TransformResult success(
      @NonNull NormalizedFlightRecord normalized, @NonNull RawFlightRecord sourceRecord) {
    return new TransformResult(normalized, null, sourceRecord);
  }

  public static TransformResult rejected(
      @NonNull RejectionReason rejection, @NonNull RawFlightRecord sourceRecord) {
    return new TransformResult(null, rejection, sourceRecord);
  }

  public boolean isSuccess() {
    return normalized != null;
  }
}
