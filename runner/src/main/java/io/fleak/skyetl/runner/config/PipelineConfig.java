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

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fleak.skyetl.lib.extract.FileSourceDto;
import io.fleak.skyetl.lib.load.RetryPolicy;
import io.fleak.skyetl.lib.load.cassandra.CassandraSinkDto;
import io.fleak.skyetl.runner.Constants;
import java.time.Duration;
import lombok.*;

/** Everything needed to run one pipeline, bound from YAML. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineConfig {
  /** Generated when absent. */
  private String runId;

  private String logLevel;
  @Builder.Default private FileSourceDto.Config source = new FileSourceDto.Config();

  /** Defaults to the number of available processors. */
  private Integer workerCount;

  @Builder.Default private BatchConfig batch = new BatchConfig();
  @Builder.Default private RetryConfig retry = new RetryConfig();
  @Builder.Default private SinkConfig sink = new SinkConfig();
  @Builder.Default private DlqConfig dlq = new DlqConfig();

  /** When set, the run report is also written here as JSON. */
  private String reportFile;

  @JsonIgnore
  public int effectiveWorkerCount() {
    return workerCount == null ? Runtime.getRuntime().availableProcessors() : workerCount;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class BatchConfig {
    @Builder.Default private int maxRows = Constants.DEFAULT_MAX_ROWS;
    @Builder.Default private long maxBytes = Constants.DEFAULT_MAX_BYTES;
    @Builder.Default private int partitionBuckets = Constants.DEFAULT_PARTITION_BUCKETS;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class RetryConfig {
    @Builder.Default private int maxAttempts = RetryPolicy.DEFAULT.maxAttempts();

    @Builder.Default
    private long backoffBaseMillis = RetryPolicy.DEFAULT.backoffBase().toMillis();

    @Builder.Default private long backoffCapMillis = RetryPolicy.DEFAULT.backoffCap().toMillis();

    public RetryPolicy toRetryPolicy() {
      return new RetryPolicy(
          maxAttempts, Duration.ofMillis(backoffBaseMillis), Duration.ofMillis(backoffCapMillis));
    }
  }

  public enum SinkType {
    CASSANDRA,
    MEMORY
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class SinkConfig {
    @Builder.Default private SinkType type = SinkType.CASSANDRA;
    @Builder.Default private CassandraSinkDto.Config cassandra = new CassandraSinkDto.Config();
  }

  public enum DlqType {
    LOGGING,
    FILE
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class DlqConfig {
    @Builder.Default private DlqType type = DlqType.LOGGING;

    /** Directory for dead letter files, required for {@link DlqType#FILE}. */
    private String directory;
  }
}
