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
package io.fleak.skyetl.lib.load.cassandra;

import static org.junit.jupiter.api.Assertions.*;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.Row;
import io.fleak.skyetl.api.model.Batch;
import io.fleak.skyetl.api.model.FlightStatus;
import io.fleak.skyetl.api.model.NormalizedFlightRecord;
import io.fleak.skyetl.api.sink.SinkConnection;
import io.fleak.skyetl.api.sink.SinkWriteException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers(disabledWithoutDocker = true)
class CassandraFlightSinkIntegrationTest {

  private static final int CQL_PORT = 9042;

  @Container
  private static final GenericContainer<?> CASSANDRA =
      new GenericContainer<>(DockerImageName.parse("cassandra:4.1"))
          .withExposedPorts(CQL_PORT)
          .withEnv("MAX_HEAP_SIZE", "512M")
          .withEnv("HEAP_NEWSIZE", "128M")
          .waitingFor(
              Wait.forLogMessage(".*Starting listening for CQL clients.*\\n", 1)
                  .withStartupTimeout(Duration.ofMinutes(4)));

  private static CassandraSinkDto.Config config;
  private static CassandraFlightSink sink;
  private static CqlSession session;

  @BeforeAll
  static void setUp() throws SinkWriteException {
    config =
        CassandraSinkDto.Config.builder()
            .contactPoints(List.of(CASSANDRA.getHost() + ":" + CASSANDRA.getMappedPort(CQL_PORT)))
            .keyspace("aviation_it")
            .consistencyLevel("ONE")
            .writeTimeoutMillis(10_000)
            .build();
    sink = CassandraFlightSink.create(config);
    sink.ensureSchema();
    // second call must be a no-op on an existing schema
    sink.ensureSchema();
    session = CassandraSessionFactory.createSession(config);
  }

  @AfterAll
  static void tearDown() {
    if (sink != null) {
      sink.close();
    }
    if (session != null) {
      session.close();
    }
  }

  private static NormalizedFlightRecord record(String flightId, Instant ingestedAt, int delay) {
    OffsetDateTime scheduled = OffsetDateTime.parse("2024-03-10T22:30:00Z");
    return NormalizedFlightRecord.builder()
        .flightId(flightId)
        .origin("JFK")
        .destination("LHR")
        .scheduledDeparture(scheduled)
        .actualDeparture(scheduled.plusMinutes(delay))
        .status(FlightStatus.ACTIVE)
        .delayMinutes(delay)
        .sourceIngestedAt(ingestedAt)
        .build();
  }

  private static void write(NormalizedFlightRecord... records) throws SinkWriteException {
    try (SinkConnection connection = sink.acquire()) {
      connection.write(new Batch(config.getTable(), "g", 1, List.of(records), 0));
    }
  }

  private static List<Row> select(String flightId) {
    return session
        .execute(
            "SELECT * FROM aviation_it.flights"
                + " WHERE flight_id = ? AND scheduled_departure_date = ?",
            flightId,
            LocalDate.of(2024, 3, 10))
        .all();
  }

  @Test
  void testReplayLeavesOneRow() throws SinkWriteException {
    NormalizedFlightRecord record = record("BA178", Instant.parse("2024-03-11T00:00:00Z"), 12);
    write(record);
    write(record);

    List<Row> rows = select("BA178");
    assertEquals(1, rows.size());
    assertEquals(12, rows.get(0).getInt("delay_minutes"));
    assertEquals("ACTIVE", rows.get(0).getString("status"));
    assertEquals(
        record.scheduledDeparture().toInstant(), rows.get(0).getInstant("scheduled_departure"));
  }

  @Test
  void testLaterIngestedRowWinsRegardlessOfWriteOrder() throws SinkWriteException {
    NormalizedFlightRecord newer = record("VS4", Instant.parse("2024-03-11T02:00:00Z"), 40);
    NormalizedFlightRecord older = record("VS4", Instant.parse("2024-03-11T01:00:00Z"), 5);
    write(newer);
    write(older);

    List<Row> rows = select("VS4");
    assertEquals(1, rows.size());
    assertEquals(40, rows.get(0).getInt("delay_minutes"));
  }
}
