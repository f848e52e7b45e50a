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

import com.datastax.oss.driver.api.core.CqlIdentifier;
import com.datastax.oss.driver.api.core.CqlSession;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the keyspace and the flights table when they do not exist. Existing objects are left
 * untouched; there is no drop and no alter.
 */
@Slf4j
public class CassandraSchemaManager {

  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z][A-Za-z0-9_]{0,47}$");

  private final CqlSession session;
  private final CassandraSinkDto.Config config;

  public CassandraSchemaManager(
      @NonNull CqlSession session, @NonNull CassandraSinkDto.Config config) {
    this.session = session;
    this.config = config;
  }

  public void ensureSchema() {
    String keyspaceCql = createKeyspaceCql(config);
    log.info("ensuring keyspace: {}", keyspaceCql);
    session.execute(keyspaceCql);
    String tableCql = createTableCql(config);
    log.info("ensuring table: {}", tableCql);
    session.execute(tableCql);
  }

  @VisibleForTesting
  static String createKeyspaceCql(CassandraSinkDto.Config config) {
    Preconditions.checkArgument(
        config.getReplicationFactor() > 0,
        "replicationFactor must be positive: %s",
        config.getReplicationFactor());
    String replication =
        switch (config.getReplicationStrategy()) {
          case SimpleStrategy -> String.format(
              "{'class': 'SimpleStrategy', 'replication_factor': %d}",
              config.getReplicationFactor());
          case NetworkTopologyStrategy -> String.format(
              "{'class': 'NetworkTopologyStrategy', '%s': %d}",
              config.getLocalDatacenter().replace("'", "''"),
              config.getReplicationFactor());
        };
    return String.format(
        "CREATE KEYSPACE IF NOT EXISTS %s WITH replication = %s",
        quote(config.getKeyspace()), replication);
  }

  @VisibleForTesting
  static String createTableCql(CassandraSinkDto.Config config) {
    return String.format(
        "CREATE TABLE IF NOT EXISTS %s (%n"
            + "  flight_id text,%n"
            + "  scheduled_departure_date date,%n"
            + "  origin text,%n"
            + "  destination text,%n"
            + "  scheduled_departure timestamp,%n"
            + "  actual_departure timestamp,%n"
            + "  scheduled_arrival timestamp,%n"
            + "  actual_arrival timestamp,%n"
            + "  status text,%n"
            + "  delay_minutes int,%n"
            + "  source_ingested_at timestamp,%n"
            + "  PRIMARY KEY ((flight_id, scheduled_departure_date))%n"
            + ")",
        qualifiedTable(config));
  }

  static String qualifiedTable(CassandraSinkDto.Config config) {
    return quote(config.getKeyspace()) + "." + quote(config.getTable());
  }

  public static String quote(String identifier) {
    Preconditions.checkArgument(
        identifier != null && IDENTIFIER.matcher(identifier).matches(),
        "invalid CQL identifier: %s",
        identifier);
    return CqlIdentifier.fromInternal(identifier).asCql(true);
  }
}
