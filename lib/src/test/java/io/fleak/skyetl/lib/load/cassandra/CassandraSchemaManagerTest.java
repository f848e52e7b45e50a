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
import static org.mockito.Mockito.*;

import com.datastax.oss.driver.api.core.CqlSession;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class CassandraSchemaManagerTest {

  @Test
  void testSimpleStrategyKeyspace() {
    CassandraSinkDto.Config config = CassandraSinkDto.Config.builder().build();
    assertEquals(
        "CREATE KEYSPACE IF NOT EXISTS aviation WITH replication ="
            + " {'class': 'SimpleStrategy', 'replication_factor': 1}",
        CassandraSchemaManager.createKeyspaceCql(config));
  }

  @Test
  void testNetworkTopologyKeyspace() {
    CassandraSinkDto.Config config =
        CassandraSinkDto.Config.builder()
            .replicationStrategy(CassandraSinkDto.ReplicationStrategy.NetworkTopologyStrategy)
            .localDatacenter("eu-west")
            .replicationFactor(3)
            .build();
    assertTrue(
        CassandraSchemaManager.createKeyspaceCql(config)
            .endsWith("{'class': 'NetworkTopologyStrategy', 'eu-west': 3}"));
  }

  @Test
  void testTableDefinition() {
    String cql =
        CassandraSchemaManager.createTableCql(
            CassandraSinkDto.Config.builder().keyspace("Aviation").table("flights").build());
    assertTrue(cql.startsWith("CREATE TABLE IF NOT EXISTS \"Aviation\".flights ("), cql);
    assertTrue(cql.contains("PRIMARY KEY ((flight_id, scheduled_departure_date))"), cql);
    assertTrue(cql.contains("delay_minutes int"), cql);
    assertFalse(cql.toUpperCase().contains("DROP"));
  }

  @Test
  void testInvalidIdentifiersRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            CassandraSchemaManager.createTableCql(
                CassandraSinkDto.Config.builder().table("flights; DROP TABLE x").build()));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            CassandraSchemaManager.createKeyspaceCql(
                CassandraSinkDto.Config.builder().replicationFactor(0).build()));
  }

  @Test
  void testEnsureSchemaExecutesKeyspaceThenTable() {
    CqlSession session = mock(CqlSession.class);
    new CassandraSchemaManager(session, CassandraSinkDto.Config.builder().build()).ensureSchema();

    ArgumentCaptor<String> statements = ArgumentCaptor.forClass(String.class);
    verify(session, times(2)).execute(statements.capture());
    assertTrue(statements.getAllValues().get(0).startsWith("CREATE KEYSPACE"));
    assertTrue(statements.getAllValues().get(1).startsWith("CREATE TABLE"));
  }
}
