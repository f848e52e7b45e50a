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

import java.util.ArrayList;
import java.util.List;
import lombok.*;

public interface CassandraSinkDto {

  int DEFAULT_PORT = 9042;

  enum ReplicationStrategy {
    SimpleStrategy,
    NetworkTopologyStrategy
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  class Config {
    @Builder.Default
    private List<String> contactPoints = new ArrayList<>(List.of("127.0.0.1:9042"));

    @Builder.Default private String localDatacenter = "datacenter1";
    @Builder.Default private String keyspace = "aviation";
    @Builder.Default private String table = "flights";

    @Builder.Default
    private ReplicationStrategy replicationStrategy = ReplicationStrategy.SimpleStrategy;

    @Builder.Default private int replicationFactor = 1;
    @Builder.Default private boolean createSchema = true;
    @Builder.Default private String consistencyLevel = "LOCAL_QUORUM";
    @Builder.Default private long writeTimeoutMillis = 5000;
    @Builder.Default private int maxConcurrentWrites = 64;
    private String username;
    @ToString.Exclude private String password;
  }
}
