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
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Statement;
import com.datastax.oss.driver.api.core.servererrors.InvalidQueryException;
import com.datastax.oss.driver.api.core.servererrors.WriteTimeoutException;
import io.fleak.skyetl.api.model.Batch;
import io.fleak.skyetl.api.model.FlightStatus;
import io.fleak.skyetl.api.model.NormalizedFlightRecord;
import io.fleak.skyetl.api.sink.PermanentWriteException;
import io.fleak.skyetl.api.sink.SinkConnection;
import io.fleak.skyetl.api.sink.SinkWriteException;
import io.fleak.skyetl.api.sink.TransientWriteException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CassandraFlightSinkTest {

  private static final Instant INGESTED_AT = Instant.parse("2024-01-02T03:04:05.678Z");

  private CqlSession session;
  private PreparedStatement prepared;
  private BoundStatement bound;
  private final List<Object[]> bindCalls = new ArrayList<>();

  @BeforeEach
  void setUp() {
    session = mock(CqlSession.class);
    bound = mock(BoundStatement.class, RETURNS_SELF);
    prepared =
        mock(
            PreparedStatement.class,
            invocation -> {
              if (!invocation.getMethod().getName().equals("bind")) {
                return null;
              }
              Object[] args = invocation.getArguments();
              bindCalls.add(
                  args.length == 1 && args[0] instanceof Object[] values ? values : args);
              return bound;
            });
    when(session.prepare(anyString())).thenReturn(prepared);
  }

  private CassandraFlightSink sink(long writeTimeoutMillis) {
    return CassandraFlightSink.withSession(
        session,
        CassandraSinkDto.Config.builder()
            .keyspace("aviation")
            .table("flights")
            .writeTimeoutMillis(writeTimeoutMillis)
            .maxConcurrentWrites(4)
            .build());
  }

  private static NormalizedFlightRecord record(String flightId) {
    return NormalizedFlightRecord.builder()
        .flightId(flightId)
        .origin("JFK")
        .destination("LAX")
        .scheduledDeparture(OffsetDateTime.parse("2024-01-01T08:00:00Z"))
        .actualDeparture(OffsetDateTime.parse("2024-01-01T08:10:00Z"))
        .status(FlightStatus.LANDED)
        .delayMinutes(10)
        .sourceIngestedAt(INGESTED_AT)
        .build();
  }

  private static Batch batch(NormalizedFlightRecord... records) {
    return new Batch("flights", "2024-01-01/0", 1, List.of(records), 200);
  }

  private static void write(CassandraFlightSink sink, Batch batch) throws SinkWriteException {
    try (SinkConnection connection = sink.acquire()) {
      connection.write(batch);
    }
  }

  private void stubExecute(CompletableFuture<AsyncResultSet> result) {
    when(session.executeAsync(any(Statement.class))).thenReturn(result);
  }

  @Test
  void testWritesEveryRowWithWriteTimestamp() throws SinkWriteException {
    stubExecute(CompletableFuture.completedFuture(mock(AsyncResultSet.class)));
    CassandraFlightSink sink = sink(1000);

    write(sink, batch(record("AA1"), record("AA2")));

    verify(session).prepare(contains("INSERT INTO aviation.flights"));
    verify(session).prepare(contains("USING TIMESTAMP ?"));
    verify(session, times(2)).executeAsync(any(Statement.class));
    assertEquals(2, bindCalls.size());

    Object[] values = bindCalls.get(0);
    assertEquals(12, values.length);
    assertEquals("AA1", values[0]);
    assertEquals(LocalDate.of(2024, 1, 1), values[1]);
    assertEquals(Instant.parse("2024-01-01T08:00:00Z"), values[4]);
    assertNull(values[6]);
    assertEquals("LANDED", values[8]);
    assertEquals(10, values[9]);
    assertEquals(INGESTED_AT, values[10]);
    assertEquals(INGESTED_AT.toEpochMilli() * 1000, values[11]);

    verify(bound, times(2)).setConsistencyLevel(DefaultConsistencyLevel.LOCAL_QUORUM);
    verify(bound, times(2)).setIdempotent(true);
    verify(bound, times(2)).setTimeout(Duration.ofMillis(1000));
  }

  @Test
  void testStatementPreparedOnce() throws SinkWriteException {
    stubExecute(CompletableFuture.completedFuture(mock(AsyncResultSet.class)));
    CassandraFlightSink sink = sink(1000);

    write(sink, batch(record("AA1")));
    write(sink, batch(record("AA2")));

    verify(session, times(1)).prepare(anyString());
  }

  @Test
  void testWriteTimeoutIsTransient() {
    stubExecute(CompletableFuture.failedFuture(mock(WriteTimeoutException.class)));
    CassandraFlightSink sink = sink(1000);

    assertThrows(TransientWriteException.class, () -> write(sink, batch(record("AA1"))));
    assertEquals(4, sink.availablePermits());
  }

  @Test
  void testInvalidQueryIsPermanent() {
    stubExecute(CompletableFuture.failedFuture(mock(InvalidQueryException.class)));
    CassandraFlightSink sink = sink(1000);

    assertThrows(PermanentWriteException.class, () -> write(sink, batch(record("AA1"))));
  }

  @Test
  void testPrepareFailureIsClassified() {
    when(session.prepare(anyString())).thenThrow(mock(InvalidQueryException.class));
    CassandraFlightSink sink = sink(1000);

    assertThrows(PermanentWriteException.class, () -> write(sink, batch(record("AA1"))));
  }

  @Test
  void testUnacknowledgedBatchTimesOut() {
    CompletableFuture<AsyncResultSet> pending = new CompletableFuture<>();
    stubExecute(pending);
    CassandraFlightSink sink = sink(50);

    TransientWriteException e =
        assertThrows(TransientWriteException.class, () -> write(sink, batch(record("AA1"))));
    assertTrue(e.getMessage().contains("not acknowledged"), e.getMessage());
    assertTrue(pending.isCancelled());
  }

  @Test
  void testEnsureSchemaHonoursCreateSchemaFlag() throws SinkWriteException {
    CassandraFlightSink disabled =
        CassandraFlightSink.withSession(
            session, CassandraSinkDto.Config.builder().createSchema(false).build());
    disabled.ensureSchema();
    verify(session, never()).execute(anyString());

    CassandraFlightSink.withSession(session, CassandraSinkDto.Config.builder().build())
        .ensureSchema();
    verify(session, times(2)).execute(anyString());
  }

  @Test
  void testInvalidSchemaSettingsArePermanent() {
    CassandraFlightSink invalid =
        CassandraFlightSink.withSession(
            session, CassandraSinkDto.Config.builder().replicationFactor(0).build());

    PermanentWriteException e = assertThrows(PermanentWriteException.class, invalid::ensureSchema);
    assertTrue(e.getMessage().contains("replicationFactor"), e.getMessage());
    verify(session, never()).execute(anyString());
  }

  @Test
  void testCallerOwnedSessionIsNotClosed() {
    sink(1000).close();
    verify(session, never()).close();
  }
}
