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
package io.fleak.skyetl.lib.load;

import static io.fleak.skyetl.lib.load.LoadTestFixtures.record;
import static org.junit.jupiter.api.Assertions.*;

import io.fleak.skyetl.api.model.Batch;
import io.fleak.skyetl.api.model.NormalizedFlightRecord;
import io.fleak.skyetl.api.sink.SinkConnection;
import io.fleak.skyetl.api.sink.SinkWriteException;
import io.fleak.skyetl.api.sink.TransientWriteException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryFlightSinkTest {

  private static Batch batchOf(long sequence, NormalizedFlightRecord... records) {
    return new Batch("flights", "g", sequence, List.of(records), 100);
  }

  private static void write(InMemoryFlightSink sink, Batch batch) throws SinkWriteException {
    try (SinkConnection connection = sink.acquire()) {
      connection.write(batch);
    }
  }

  @Test
  void testReplayIsIdempotent() throws SinkWriteException {
    InMemoryFlightSink sink = new InMemoryFlightSink("flights");
    Batch batch = LoadTestFixtures.batch(1, 5);

    write(sink, batch);
    var afterFirst = sink.snapshot();
    write(sink, batch);

    assertEquals(afterFirst, sink.snapshot());
    assertEquals(5, sink.size());
  }

  @Test
  void testLaterIngestedRowWins() throws SinkWriteException {
    InMemoryFlightSink sink = new InMemoryFlightSink("flights");
    NormalizedFlightRecord older = record("AA1", Instant.parse("2024-01-01T00:00:00Z"), 5);
    NormalizedFlightRecord newer = record("AA1", Instant.parse("2024-01-01T01:00:00Z"), 15);

    write(sink, batchOf(1, newer));
    write(sink, batchOf(2, older));

    assertEquals(1, sink.size());
    assertEquals(15, sink.get(newer.partitionKey()).delayMinutes());
  }

  @Test
  void testAcquireTimesOutWhenAllSlotsAreBusy() throws SinkWriteException {
    InMemoryFlightSink sink = new InMemoryFlightSink("flights", 1, Duration.ofMillis(20));
    SinkConnection held = sink.acquire();
    try {
      assertThrows(TransientWriteException.class, sink::acquire);
    } finally {
      held.close();
    }
    held.close();
    assertEquals(1, sink.availablePermits());
    sink.acquire().close();
  }

  @Test
  void testReleasedConnectionCannotWrite() throws SinkWriteException {
    InMemoryFlightSink sink = new InMemoryFlightSink("flights");
    SinkConnection connection = sink.acquire();
    connection.close();
    Batch batch = LoadTestFixtures.batch(1, 1);
    assertThrows(IllegalStateException.class, () -> connection.write(batch));
  }
}
