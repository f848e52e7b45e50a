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
package io.fleak.skyetl.clistarter;

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.skyetl.runner.config.PipelineConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EtlCliParserTest {

  private static final String YAML =
      """
      runId: from-yaml
      workerCount: 2
      source:
        type: jsonl
        locator: /data/in.jsonl
      sink:
        type: cassandra
      """;

  @TempDir Path tempDir;

  private Path writeConfig() throws IOException {
    Path file = tempDir.resolve("pipeline.yaml");
    Files.writeString(file, YAML);
    return file;
  }

  @Test
  void parseArgs_yamlOnly() throws Exception {
    PipelineConfig config = EtlCliParser.parseArgs(new String[] {"-c", writeConfig().toString()});

    assertEquals("from-yaml", config.getRunId());
    assertEquals(2, config.getWorkerCount());
    assertEquals("/data/in.jsonl", config.getSource().getLocator());
    assertEquals(PipelineConfig.SinkType.CASSANDRA, config.getSink().getType());
    assertNull(config.getReportFile());
  }

  @Test
  void parseArgs_overridesYaml() throws Exception {
    String[] args =
        String.format(
                "--config %s -id nightly -s /other/dir -w 8 --dry-run -r /tmp/report.json -l debug",
                writeConfig())
            .split("\\s+");

    PipelineConfig config = EtlCliParser.parseArgs(args);

    assertEquals("nightly", config.getRunId());
    assertEquals("/other/dir", config.getSource().getLocator());
    assertEquals(8, config.getWorkerCount());
    assertEquals(PipelineConfig.SinkType.MEMORY, config.getSink().getType());
    assertEquals("/tmp/report.json", config.getReportFile());
    assertEquals("debug", config.getLogLevel());
  }

  @Test
  void parseArgs_missingConfigOption() {
    assertThrows(ParseException.class, () -> EtlCliParser.parseArgs(new String[] {"-w", "2"}));
  }

  @Test
  void parseArgs_badWorkerCount() throws Exception {
    String[] args = {"-c", writeConfig().toString(), "-w", "many"};
    assertThrows(IllegalArgumentException.class, () -> EtlCliParser.parseArgs(args));
  }

  @Test
  void parseArgs_missingConfigFile() {
    String[] args = {"-c", tempDir.resolve("absent.yaml").toString()};
    assertThrows(RuntimeException.class, () -> EtlCliParser.parseArgs(args));
  }
}
