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

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public final class CassandraSessionFactory {

  private CassandraSessionFactory() {}

  public static CqlSession createSession(CassandraSinkDto.Config config) {
    Preconditions.checkArgument(
        CollectionUtils.isNotEmpty(config.getContactPoints()), "no contact points configured");
    List<InetSocketAddress> contactPoints = parseContactPoints(config.getContactPoints());
    CqlSessionBuilder builder =
        CqlSession.builder()
            .addContactPoints(contactPoints)
            .withLocalDatacenter(config.getLocalDatacenter());
    if (StringUtils.isNotBlank(config.getUsername())) {
      builder.withAuthCredentials(
          config.getUsername(), StringUtils.defaultString(config.getPassword()));
    }
    log.info(
        "connecting to cassandra {} (datacenter {})", contactPoints, config.getLocalDatacenter());
    return builder.build();
  }

  static List<InetSocketAddress> parseContactPoints(List<String> contactPoints) {
    return contactPoints.stream()
        .map(String::trim)
        .map(HostAndPort::fromString)
        .map(hp -> hp.withDefaultPort(CassandraSinkDto.DEFAULT_PORT))
        .map(hp -> new InetSocketAddress(hp.getHost(), hp.getPort()))
        .collect(Collectors.toList());
  }
}
