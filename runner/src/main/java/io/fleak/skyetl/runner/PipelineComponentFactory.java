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

import io.fleak.skyetl.api.sink.FlightSink;
import io.fleak.skyetl.api.source.FlightSource;
import io.fleak.skyetl.lib.dlq.AvroFileDlqWriter;
import io.fleak.skyetl.lib.dlq.DlqWriter;
import io.fleak.skyetl.lib.dlq.LoggingDlqWriter;
import io.fleak.skyetl.lib.extract.DelimitedFileSource;
import io.fleak.skyetl.lib.extract.FileSourceDto;
import io.fleak.skyetl.lib.extract.JsonLinesFileSource;
import io.fleak.skyetl.lib.load.InMemoryFlightSink;
import io.fleak.skyetl.lib.load.cassandra.CassandraFlightSink;
import io.fleak.skyetl.lib.load.cassandra.CassandraSinkDto;
import io.fleak.skyetl.runner.config.PipelineConfig;
import java.nio.file.Paths;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/** Builds the pluggable parts of a pipeline from a validated {@link PipelineConfig}. */
@Slf4j
public class PipelineComponentFactory {

  public FlightSource createSource(FileSourceDto.Config config) {
    return switch (config.getType()) {
      case CSV -> DelimitedFileSource.create(config);
      case JSONL -> JsonLinesFileSource.create(config);
    };
  }

  public FlightSink createSink(PipelineConfig.SinkConfig config) {
    CassandraSinkDto.Config cassandra = config.getCassandra();
    return switch (config.getType()) {
      case CASSANDRA -> {
        log.info(
            "connecting to cassandra at {} (dc {})",
            cassandra.getContactPoints(),
            cassandra.getLocalDatacenter());
        yield CassandraFlightSink.create(cassandra);
      }
      case MEMORY -> {
        log.info("using in-memory sink, nothing will be persisted");
        yield new InMemoryFlightSink(
            cassandra.getTable(),
            cassandra.getMaxConcurrentWrites(),
            Duration.ofMillis(cassandra.getWriteTimeoutMillis()));
      }
    };
  }

  public DlqWriter createDlqWriter(PipelineConfig.DlqConfig config, String runId) {
    DlqWriter writer =
        switch (config.getType()) {
          case LOGGING -> new LoggingDlqWriter();
          case FILE -> new AvroFileDlqWriter(Paths.get(config.getDirectory()), runId);
        };
    writer.setRunId(runId);
    writer.open();
    return writer;
  }
}
