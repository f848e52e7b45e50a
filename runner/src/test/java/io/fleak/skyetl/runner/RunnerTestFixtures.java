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
package io.fleak.skyetl.runner;

import io.fleak.skyetl.api.model.RawFlightRecord;
import io.fleak.skyetl.api.model.SourcePosition;
import io.fleak.skyetl.api.source.ExtractedRecord;
import io.fleak.skyetl.api.source.FlightSource;
import io.fleak.skyetl.api.source.RecordCursor;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

final class RunnerTestFixtures {

  static final String SOURCE = "mem";

  private RunnerTestFixtures() {}

  static RawFlightRecord raw(int ordinal, String flightId) {
    return RawFlightRecord.builder()
        .position(new SourcePosition(SOURCE, ordinal))
        .flightId(flightId)
        .origin("JFK")
        .destination("LAX")
        .scheduledDeparture("2024-01-01T08:00:00Z")
        .actualDeparture("2024-01-01T08:10:00Z")
        .status("LANDED")
        .build();
  }

  static List<RawFlightRecord> validRecords(int count) {
    List<RawFlightRecord> records = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      records.add(raw(i, "AA" + i));
    }
    return records;
  }

  /**
   * A single-slice source that calls {@code onPull} with the 1-based ordinal of each item as it is
   * pulled, and can fail at a given ordinal.
   */
  static FlightSource observedSource(
      List<RawFlightRecord> records, IntConsumer onPull, RuntimeException failure, int failAt) {
    return new FlightSource() {
      @Override
      public String name() {
        return SOURCE;
      }

      @Override
      public void probe() {}

      @Override
      public RecordCursor open(int sliceIndex, int sliceCount) {
        RecordCursor delegate =
            RecordCursor.of(records.stream().map(ExtractedRecord::of).toList());
        return new RecordCursor() {
          private int pulled;

          @Override
          public boolean hasNext() {
            return delegate.hasNext();
          }

          @Override
          public ExtractedRecord next() {
            pulled++;
            if (failure != null && pulled == failAt) {
              throw failure;
            }
            onPull.accept(pulled);
            return delegate.next();
          }

          @Override
          public void close() {
            delegate.close();
          }
        };
      }
    };
  }
}
