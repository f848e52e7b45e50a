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
package io.fleak.skyetl.runner;

import io.fleak.skyetl.api.metric.MetricClientProvider;
import io.fleak.skyetl.api.sink.FlightSink;
import io.fleak.skyetl.api.source.FlightSource;
import io.fleak.skyetl.lib.dlq.DlqWriter;
import io.fleak.skyetl.lib.utils.JsonUtils;
import io.fleak.skyetl.lib.utils.MiscUtils;
import io.fleak.skyetl.runner.config.PipelineConfig;
import io.fleak.skyetl.runner.config.PipelineConfigValidator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * A configured pipeline with the resources it owns. Closing the job closes the sink and the dead
 * letter writer.
 */
@Slf4j
public class EtlJob implements AutoCloseable {

  @Getter private final PipelineConfig config;
  private final FlightSink sink;
  private final DlqWriter dlqWriter;
  @Getter private final PipelineCoordinator coordinator;

  EtlJob(
      PipelineConfig config,
      FlightSink sink,
      DlqWriter dlqWriter,
      PipelineCoordinator coordinator) {
    this.config = config;
    this.sink = sink;
    this.dlqWriter = dlqWriter;
    this.coordinator = coordinator;
  }

  public static EtlJob create(
      @NonNull PipelineConfig config, @NonNull MetricClientProvider metricClientProvider) {
    return create(config, metricClientProvider, new PipelineComponentFactory());
  }

  static EtlJob create(
      PipelineConfig config,
      MetricClientProvider metricClientProvider,
      PipelineComponentFactory factory) {
    new PipelineConfigValidator().validate(config);
    PipelineCoordinator.applyLogLevel(config);
    String runId =
        StringUtils.isBlank(config.getRunId()) ? MiscUtils.generateRandomHash() : config.getRunId();

    FlightSource source = factory.createSource(config.getSource());
    DlqWriter dlqWriter = factory.createDlqWriter(config.getDlq(), runId);
    FlightSink sink;
    try {
      sink = factory.createSink(config.getSink());
    } catch (RuntimeException e) {
      try {
        dlqWriter.close();
      } catch (IOException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
    PipelineCoordinator coordinator =
        PipelineCoordinator.builder()
            .runId(runId)
            .source(source)
            .sink(sink)
            .dlqWriter(dlqWriter)
            .workerCount(config.effectiveWorkerCount())
            .maxRows(config.getBatch().getMaxRows())
            .maxBytes(config.getBatch().getMaxBytes())
            .partitionBuckets(config.getBatch().getPartitionBuckets())
            .retryPolicy(config.getRetry().toRetryPolicy())
            .metricClientProvider(metricClientProvider)
            .build();
    return new EtlJob(config, sink, dlqWriter, coordinator);
  }

  public RunReport run() {
    RunReport report = coordinator.run();
    if (StringUtils.isNotBlank(config.getReportFile())) {
      writeReport(report, Paths.get(config.getReportFile()));
    }
    return report;
  }

  public void cancel() {
    coordinator.cancel();
  }

  private static void writeReport(RunReport report, Path file) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(file, JsonUtils.toPrettyJsonString(report), StandardCharsets.UTF_8);
      log.info("run report written to {}", file);
    } catch (IOException e) {
      log.error("failed to write run report to {}", file, e);
    }
  }

  @Override
  public void close() {
    sink.close();
    try {
      dlqWriter.close();
    } catch (IOException e) {
      log.error("failed to close dead letter writer", e);
    }
  }
}
