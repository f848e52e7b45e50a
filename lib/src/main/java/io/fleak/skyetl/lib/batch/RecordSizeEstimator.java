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
package io.fleak.skyetl.lib.batch;

import com.google.common.base.Utf8;
import io.fleak.skyetl.api.model.NormalizedFlightRecord;

/**
 * Approximates the serialized size of a row on the storage wire: UTF-8 text lengths plus fixed
 * widths for dates, timestamps and integers, plus a per-row overhead.
 */
public final class RecordSizeEstimator {

  static final int ROW_OVERHEAD_BYTES = 32;
  static final int TIMESTAMP_BYTES = 8;
  static final int DATE_BYTES = 4;
  static final int INT_BYTES = 4;

  private RecordSizeEstimator() {}

  public static long estimate(NormalizedFlightRecord record) {
    long size = ROW_OVERHEAD_BYTES;
    size += Utf8.encodedLength(record.flightId());
    size += Utf8.encodedLength(record.origin());
    size += Utf8.encodedLength(record.destination());
    size += Utf8.encodedLength(record.status().name());
    size += DATE_BYTES;
    // scheduled departure and ingestion time are always present
    size += 2L * TIMESTAMP_BYTES;
    if (record.actualDeparture() != null) {
      size += TIMESTAMP_BYTES;
    }
    if (record.scheduledArrival() != null) {
      size += TIMESTAMP_BYTES;
    }
    if (record.actualArrival() != null) {
      size += TIMESTAMP_BYTES;
    }
    if (record.delayMinutes() != null) {
      size += INT_BYTES;
    }
    return size;
  }
}
