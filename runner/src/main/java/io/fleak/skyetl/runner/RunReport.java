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

import io.fleak.skyetl.api.run.DelayStatistics;
import io.fleak.skyetl.api.run.PipelineRun;
import io.fleak.skyetl.api.run.RunStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Final counters and status of one pipeline run, serialized as JSON. */
public record RunReport(
    String runId,
    RunStatus status,
    Instant startedAt,
    Instant finishedAt,
    long durationMillis,
    long extracted,
    long transformed,
    long rejected,
    long loaded,
    long failed,
    long loadedBatches,
    long failedBatches,
    long skipped,
    DelayStatistics.Summary delayStatistics,
    List<String> errors) {

  public RunReport {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static RunReport of(PipelineRun run, Instant finishedAt, List<String> errors) {
    return new RunReport(
        run.getRunId(),
        run.status(),
        run.getStartedAt(),
        finishedAt,
        Duration.between(run.getStartedAt(), finishedAt).toMillis(),
        run.extracted(),
        run.transformed(),
        run.rejected(),
        run.loaded(),
        run.failed(),
        run.loadedBatches(),
        run.failedBatches(),
        run.skipped(),
        run.getDelayStatistics().summary(),
        errors);
  }
}
