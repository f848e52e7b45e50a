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
package io.fleak.skyetl.runner.config;

import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.google.common.base.Preconditions;
import io.fleak.skyetl.lib.extract.FileSourceDto;
import io.fleak.skyetl.lib.load.cassandra.CassandraSchemaManager;
import io.fleak.skyetl.lib.load.cassandra.CassandraSinkDto;
import java.util.Arrays;
import java.util.Locale;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Checks a {@link PipelineConfig} before any component is built. Problems are reported as {@link
 * IllegalArgumentException} or {@link NullPointerException}. Whether the source exists is checked
 * later by the source probe.
 */
public class PipelineConfigValidator {

  public void validate(PipelineConfig config) {
    Preconditions.checkNotNull(config, "pipeline config is missing");
    validateSource(config.getSource());

    if (config.getWorkerCount() != null) {
      Preconditions.checkArgument(
          config.getWorkerCount() > 0, "workerCount must be positive: %s", config.getWorkerCount());
    }

    PipelineConfig.BatchConfig batch = config.getBatch();
    Preconditions.checkNotNull(batch, "batch config is missing");
    Preconditions.checkArgument(
        batch.getMaxRows() > 0, "batch.maxRows must be positive: %s", batch.getMaxRows());
    Preconditions.checkArgument(
        batch.getMaxBytes() > 0, "batch.maxBytes must be positive: %s", batch.getMaxBytes());
    Preconditions.checkArgument(
        batch.getPartitionBuckets() > 0,
        "batch.partitionBuckets must be positive: %s",
        batch.getPartitionBuckets());

    PipelineConfig.RetryConfig retry = config.getRetry();
    Preconditions.checkNotNull(retry, "retry config is missing");
    Preconditions.checkArgument(
        retry.getMaxAttempts() >= 1,
        "retry.maxAttempts must be at least 1: %s",
        retry.getMaxAttempts());
    Preconditions.checkArgument(
        retry.getBackoffBaseMillis() >= 0, "retry.backoffBaseMillis must not be negative");
    Preconditions.checkArgument(
        retry.getBackoffCapMillis() >= retry.getBackoffBaseMillis(),
        "retry.backoffCapMillis must not be below retry.backoffBaseMillis");

    validateSink(config.getSink());

    PipelineConfig.DlqConfig dlq = config.getDlq();
    Preconditions.checkNotNull(dlq, "dlq config is missing");
    Preconditions.checkNotNull(dlq.getType(), "dlq.type is missing");
    if (dlq.getType() == PipelineConfig.DlqType.FILE) {
      Preconditions.checkArgument(
          StringUtils.isNotBlank(dlq.getDirectory()), "dlq.directory is required for file dlq");
    }
  }

  private void validateSource(FileSourceDto.Config source) {
    Preconditions.checkNotNull(source, "source config is missing");
    Preconditions.checkNotNull(source.getType(), "source.type is missing");
    Preconditions.checkArgument(
        StringUtils.isNotBlank(source.getLocator()), "source.locator is missing");
    if (source.getType() == FileSourceDto.Format.CSV) {
      Preconditions.checkArgument(
          StringUtils.length(source.getDelimiter()) == 1,
          "source.delimiter must be a single character: '%s'",
          source.getDelimiter());
    }
  }

  private void validateSink(PipelineConfig.SinkConfig sink) {
    Preconditions.checkNotNull(sink, "sink config is missing");
    Preconditions.checkNotNull(sink.getType(), "sink.type is missing");
    CassandraSinkDto.Config cassandra = sink.getCassandra();
    Preconditions.checkNotNull(cassandra, "sink.cassandra config is missing");
    // the table name is used by the in-memory sink too
    CassandraSchemaManager.quote(cassandra.getTable());
    if (sink.getType() != PipelineConfig.SinkType.CASSANDRA) {
      return;
    }
    Preconditions.checkArgument(
        CollectionUtils.isNotEmpty(cassandra.getContactPoints()),
        "sink.cassandra.contactPoints is empty");
    Preconditions.checkArgument(
        StringUtils.isNotBlank(cassandra.getLocalDatacenter()),
        "sink.cassandra.localDatacenter is missing");
    CassandraSchemaManager.quote(cassandra.getKeyspace());
    Preconditions.checkNotNull(
        cassandra.getReplicationStrategy(), "sink.cassandra.replicationStrategy is missing");
    Preconditions.checkArgument(
        cassandra.getReplicationFactor() > 0,
        "sink.cassandra.replicationFactor must be positive: %s",
        cassandra.getReplicationFactor());
    Preconditions.checkArgument(
        isConsistencyLevel(cassandra.getConsistencyLevel()),
        "sink.cassandra.consistencyLevel must be one of %s: %s",
        Arrays.toString(DefaultConsistencyLevel.values()),
        cassandra.getConsistencyLevel());
    Preconditions.checkArgument(
        cassandra.getWriteTimeoutMillis() > 0,
        "sink.cassandra.writeTimeoutMillis must be positive");
    Preconditions.checkArgument(
        cassandra.getMaxConcurrentWrites() > 0,
        "sink.cassandra.maxConcurrentWrites must be positive");
    Preconditions.checkArgument(
        cassandra.getPassword() == null || cassandra.getUsername() != null,
        "sink.cassandra.password is set without a username");
  }

  private static boolean isConsistencyLevel(String value) {
    if (StringUtils.isBlank(value)) {
      return false;
    }
    String name = value.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(DefaultConsistencyLevel.values()).anyMatch(l -> l.name().equals(name));
  }
}
