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

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.skyetl.lib.extract.FileSourceDto;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;

class PipelineConfigValidatorTest {

  private final PipelineConfigValidator validator = new PipelineConfigValidator();

  private static PipelineConfig valid() {
    return PipelineConfig.builder()
        .source(FileSourceDto.Config.builder().locator("/data/flights.csv").build())
        .build();
  }

  private void assertInvalid(Consumer<PipelineConfig> mutation, String expectedMessagePart) {
    PipelineConfig config = valid();
    mutation.accept(config);
    Exception e = assertThrows(RuntimeException.class, () -> validator.validate(config));
    assertTrue(
        e.getMessage().contains(expectedMessagePart),
        () -> "expected '" + expectedMessagePart + "' in: " + e.getMessage());
  }

  @Test
  void testDefaultsAreValid() {
    assertDoesNotThrow(() -> validator.validate(valid()));
  }

  @Test
  void testSourceChecks() {
    assertInvalid(c -> c.getSource().setLocator(" "), "source.locator");
    assertInvalid(c -> c.getSource().setDelimiter("||"), "source.delimiter");
    assertInvalid(c -> c.setSource(null), "source config");
  }

  @Test
  void testJsonLinesIgnoresDelimiter() {
    PipelineConfig config = valid();
    config.getSource().setType(FileSourceDto.Format.JSONL);
    config.getSource().setDelimiter("||");
    assertDoesNotThrow(() -> validator.validate(config));
  }

  @Test
  void testBoundsChecks() {
    assertInvalid(c -> c.setWorkerCount(0), "workerCount");
    assertInvalid(c -> c.getBatch().setMaxBytes(0), "batch.maxBytes");
    assertInvalid(c -> c.getBatch().setPartitionBuckets(-1), "batch.partitionBuckets");
    assertInvalid(c -> c.getRetry().setMaxAttempts(0), "retry.maxAttempts");
    assertInvalid(c -> c.getRetry().setBackoffCapMillis(10), "retry.backoffCapMillis");
  }

  @Test
  void testCassandraChecks() {
    assertInvalid(c -> c.getSink().getCassandra().setContactPoints(List.of()), "contactPoints");
    assertInvalid(c -> c.getSink().getCassandra().setConsistencyLevel("MOST"), "consistencyLevel");
    assertInvalid(
        c -> c.getSink().getCassandra().setKeyspace("air-line"), "invalid CQL identifier");
    assertInvalid(c -> c.getSink().getCassandra().setReplicationFactor(0), "replicationFactor");
    assertInvalid(c -> c.getSink().getCassandra().setPassword("secret"), "without a username");
  }

  @Test
  void testMemorySinkSkipsConnectionChecks() {
    PipelineConfig config = valid();
    config.getSink().setType(PipelineConfig.SinkType.MEMORY);
    config.getSink().getCassandra().setContactPoints(List.of());
    assertDoesNotThrow(() -> validator.validate(config));
  }

  @Test
  void testFileDlqNeedsDirectory() {
    assertInvalid(c -> c.getDlq().setType(PipelineConfig.DlqType.FILE), "dlq.directory");
  }
}
