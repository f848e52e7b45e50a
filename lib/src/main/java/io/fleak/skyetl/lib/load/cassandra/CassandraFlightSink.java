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

import com.datastax.oss.driver.api.core.ConsistencyLevel;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.google.common.annotations.VisibleForTesting;
import io.fleak.skyetl.api.model.Batch;
import io.fleak.skyetl.api.model.NormalizedFlightRecord;
import io.fleak.skyetl.api.sink.PermanentWriteException;
import io.fleak.skyetl.api.sink.SinkWriteException;
import io.fleak.skyetl.api.sink.TransientWriteException;
import io.fleak.skyetl.lib.load.AbstractPooledFlightSink;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes batches to a Cassandra table with one prepared {@code INSERT ... USING TIMESTAMP ?} per
 * row. Inserts are upserts on {@code (flight_id, scheduled_departure_date)} and the write timestamp
 * is the record's {@code sourceIngestedAt} in microseconds, so:
 *
 * <ul>
 *   <li>replaying a batch rewrites identical cells and leaves the table unchanged;
 *   <li>when two batches carry the same key, the later-ingested row wins no matter which write
 *       lands first.
 * </ul>
 *
 * The rows of a batch are sent concurrently and awaited under the write timeout. A batch whose
 * rows did not all succeed is reported failed as a whole and may be retried in full.
 */
@Slf4j
public class CassandraFlightSink extends AbstractPooledFlightSink {

  static final String INSERT_TEMPLATE =
      "INSERT INTO %s (flight_id, scheduled_departure_date, origin, destination,"
          + " scheduled_departure, actual_departure, scheduled_arrival, actual_arrival, status,"
          + " delay_minutes, source_ingested_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)"
          + " USING TIMESTAMP ?";

  private final CqlSession session;
  private final boolean ownsSession;
  private final CassandraSinkDto.Config config;
  private final ConsistencyLevel consistencyLevel;
  private final Duration writeTimeout;
  private volatile PreparedStatement insertStatement;

  @VisibleForTesting
  CassandraFlightSink(
      @NonNull CqlSession session, boolean ownsSession, @NonNull CassandraSinkDto.Config config) {
    super(config.getMaxConcurrentWrites(), Duration.ofMillis(config.getWriteTimeoutMillis()));
    this.session = session;
    this.ownsSession = ownsSession;
    this.config = config;
    this.consistencyLevel =
        DefaultConsistencyLevel.valueOf(
            config.getConsistencyLevel().trim().toUpperCase(Locale.ROOT));
    this.writeTimeout = Duration.ofMillis(config.getWriteTimeoutMillis());
  }

  /** Opens a session owned by the sink and closed with it. */
  public static CassandraFlightSink create(CassandraSinkDto.Config config) {
    return new CassandraFlightSink(CassandraSessionFactory.createSession(config), true, config);
  }

  /** Writes through a session owned by the caller. */
  public static CassandraFlightSink withSession(
      CqlSession session, CassandraSinkDto.Config config) {
    return new CassandraFlightSink(session, false, config);
  }

  @Override
  public String table() {
    return config.getTable();
  }

  @Override
  public void ensureSchema() throws SinkWriteException {
    if (!config.isCreateSchema()) {
      log.info("schema creation disabled, expecting {} to exist", qualifiedTable());
      return;
    }
    try {
      new CassandraSchemaManager(session, config).ensureSchema();
    } catch (IllegalArgumentException e) {
      throw new PermanentWriteException("invalid schema settings: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      throw CassandraErrorClassifier.classify(e);
    }
  }

  @Override
  protected void writeBatch(Batch batch) throws SinkWriteException {
    List<CompletableFuture<AsyncResultSet>> futures = new ArrayList<>(batch.size());
    try {
      PreparedStatement prepared = insertStatement();
      for (NormalizedFlightRecord record : batch.records()) {
        futures.add(session.executeAsync(bind(prepared, record)).toCompletableFuture());
      }
    } catch (RuntimeException e) {
      cancelAll(futures);
      throw CassandraErrorClassifier.classify(e);
    }

    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
          .get(writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      cancelAll(futures);
      throw new TransientWriteException(
          String.format(
              "batch %s not acknowledged within %dms", batch.batchId(), writeTimeout.toMillis()),
          e);
    } catch (ExecutionException e) {
      throw CassandraErrorClassifier.classify(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelAll(futures);
      throw new TransientWriteException("interrupted while writing batch " + batch.batchId(), e);
    }
    log.debug("wrote batch {} ({} rows) to {}", batch.batchId(), batch.size(), qualifiedTable());
  }

  @VisibleForTesting
  BoundStatement bind(PreparedStatement prepared, NormalizedFlightRecord record) {
    return prepared
        .bind(
            record.flightId(),
            record.scheduledDepartureDate(),
            record.origin(),
            record.destination(),
            toInstant(record.scheduledDeparture()),
            toInstant(record.actualDeparture()),
            toInstant(record.scheduledArrival()),
            toInstant(record.actualArrival()),
            record.status().name(),
            record.delayMinutes(),
            record.sourceIngestedAt(),
            writeTimestampMicros(record.sourceIngestedAt()))
        .setConsistencyLevel(consistencyLevel)
        .setTimeout(writeTimeout)
        .setIdempotent(true);
  }

  static long writeTimestampMicros(Instant sourceIngestedAt) {
    return ChronoUnit.MICROS.between(Instant.EPOCH, sourceIngestedAt);
  }

  private PreparedStatement insertStatement() {
    PreparedStatement prepared = insertStatement;
    if (prepared == null) {
      synchronized (this) {
        prepared = insertStatement;
        if (prepared == null) {
          prepared = session.prepare(String.format(INSERT_TEMPLATE, qualifiedTable()));
          insertStatement = prepared;
        }
      }
    }
    return prepared;
  }

  private String qualifiedTable() {
    return CassandraSchemaManager.qualifiedTable(config);
  }

  private static Instant toInstant(OffsetDateTime dateTime) {
    return dateTime == null ? null : dateTime.toInstant();
  }

  private static void cancelAll(List<CompletableFuture<AsyncResultSet>> futures) {
    futures.forEach(f -> f.cancel(true));
  }

  @Override
  public void close() {
    if (ownsSession) {
      session.close();
    }
  }
}
