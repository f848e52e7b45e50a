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

import static io.fleak.skyetl.runner.Constants.*;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.fleak.skyetl.api.metric.MetricClientProvider;
import io.fleak.skyetl.api.run.PipelineRun;
import io.fleak.skyetl.api.run.RunStatus;
import io.fleak.skyetl.api.sink.FlightSink;
import io.fleak.skyetl.api.sink.SinkWriteException;
import io.fleak.skyetl.api.source.FlightSource;
import io.fleak.skyetl.api.source.SourceUnavailableException;
import io.fleak.skyetl.lib.batch.FlightBatcher;
import io.fleak.skyetl.lib.dlq.DlqWriter;
import io.fleak.skyetl.lib.dlq.LoggingDlqWriter;
import io.fleak.skyetl.lib.load.BatchLoader;
import io.fleak.skyetl.lib.load.RetryPolicy;
import io.fleak.skyetl.lib.load.Sleeper;
import io.fleak.skyetl.lib.transform.FlightRecordTransformer;
import io.fleak.skyetl.lib.utils.JsonUtils;
import io.fleak.skyetl.lib.utils.MiscUtils;
import io.fleak.skyetl.runner.config.PipelineConfig;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

/**
 * Runs one pipeline: probes the source, prepares the sink schema, starts {@code workerCount}
 * lanes on a fixed pool and waits for all of them before deciding the run status.
 *
 * <ul>
 *   <li>ABORTED when the source or schema is unavailable, a lane fails, or {@link #cancel()} was
 *       called;
 *   <li>PARTIAL when at least one batch failed;
 *   <li>SUCCESS otherwise.
 * </ul>
 *
 * A coordinator runs once. The sink, dead letter writer and metric provider are owned by the
 * caller.
 */
@Slf4j
@Builder
public class PipelineCoordinator {

  @NonNull private final FlightSource source;
  @NonNull private final FlightSink sink;
  @Builder.Default private final DlqWriter dlqWriter = new LoggingDlqWriter();
  @Getter @Builder.Default private final String runId = MiscUtils.generateRandomHash();
  @Builder.Default private final int workerCount = Runtime.getRuntime().availableProcessors();
  @Builder.Default private final int maxRows = DEFAULT_MAX_ROWS;
  @Builder.Default private final long maxBytes = DEFAULT_MAX_BYTES;
  @Builder.Default private final int partitionBuckets = DEFAULT_PARTITION_BUCKETS;
  @Builder.Default private final RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
  @Builder.Default private final Sleeper sleeper = Sleeper.THREAD_SLEEPER;
  @Builder.Default private final Clock clock = Clock.systemUTC();

  @Builder.Default
  private final MetricClientProvider metricClientProvider =
      new MetricClientProvider.NoopMetricClientProvider();

  private final CancellationToken cancellationToken = new CancellationToken();
  private final AtomicBoolean started = new AtomicBoolean();

  /** Requests cooperative cancellation. Safe to call from any thread, before or during a run. */
  public void cancel() {
    if (cancellationToken.cancel()) {
      log.warn("cancellation requested for run {}", runId);
    }
  }

  public RunReport run() {
    Preconditions.checkState(started.compareAndSet(false, true), "run %s already started", runId);
    Preconditions.checkArgument(workerCount > 0, "workerCount must be positive: %s", workerCount);

    PipelineRun run = new PipelineRun(runId, clock.instant());
    dlqWriter.setRunId(runId);
    log.info(
        "starting run {}: source={}, table={}, lanes={}",
        runId,
        source.name(),
        sink.table(),
        workerCount);

    List<String> errors = new ArrayList<>();
    try {
      source.probe();
      sink.ensureSchema();
    } catch (SourceUnavailableException e) {
      log.error("source {} is unavailable, aborting run {}", source.name(), runId, e);
      errors.add(e.getMessage());
      return finish(run, RunStatus.ABORTED, errors);
    } catch (SinkWriteException e) {
      log.error("table {} could not be prepared, aborting run {}", sink.table(), runId, e);
      errors.add(e.getMessage());
      return finish(run, RunStatus.ABORTED, errors);
    }

    List<LaneResult> results = runLanes(run, errors);
    boolean abnormal = results.stream().anyMatch(r -> r.termination().isAbnormal());
    RunStatus status;
    if (abnormal || results.size() < workerCount || cancellationToken.isCancelled()) {
      status = RunStatus.ABORTED;
    } else if (run.failedBatches() > 0) {
      status = RunStatus.PARTIAL;
    } else {
      status = RunStatus.SUCCESS;
    }
    return finish(run, status, errors);
  }

  private List<LaneResult> runLanes(PipelineRun run, List<String> errors) {
    ExecutorService executor =
        Executors.newFixedThreadPool(
            workerCount, new ThreadFactoryBuilder().setNameFormat(LANE_THREAD_NAME_FORMAT).build());
    List<LaneResult> results = new ArrayList<>(workerCount);
    try {
      List<Future<LaneResult>> futures = new ArrayList<>(workerCount);
      for (int i = 0; i < workerCount; i++) {
        futures.add(executor.submit(createLane(i, run)));
      }
      for (Future<LaneResult> future : futures) {
        try {
          LaneResult result = future.get();
          results.add(result);
          if (result.detail() != null) {
            errors.add(String.format("lane %d: %s", result.laneIndex(), result.detail()));
          }
        } catch (ExecutionException e) {
          log.error("lane of run {} died", runId, e.getCause());
          errors.add(String.valueOf(e.getCause()));
          cancellationToken.cancel();
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("interrupted while waiting for the lanes of run {}", runId, e);
      errors.add("coordinator interrupted");
      cancellationToken.cancel();
    } finally {
      executor.shutdown();
    }
    return results;
  }

  private WorkerLane createLane(int laneIndex, PipelineRun run) {
    return new WorkerLane(
        laneIndex,
        workerCount,
        source,
        new FlightRecordTransformer(clock),
        new FlightBatcher(
            sink.table(), maxRows, maxBytes, partitionBuckets, run::nextBatchSequence),
        new BatchLoader(sink, retryPolicy, sleeper, run, dlqWriter, clock),
        dlqWriter,
        run,
        cancellationToken,
        LaneCounters.createLaneCounters(metricClientProvider, runId, laneIndex),
        sink.table(),
        clock);
  }

  private RunReport finish(PipelineRun run, RunStatus status, List<String> errors) {
    run.finish(status);
    RunReport report = RunReport.of(run, clock.instant(), errors);
    log.info("run {} finished with status {}", runId, report.status());
    log.info("run report: {}", JsonUtils.toJsonString(report));
    return report;
  }

  /** Sets the level of the pipeline's loggers. Blank or unknown levels leave it unchanged. */
  public static void applyLogLevel(PipelineConfig config) {
    if (config == null || StringUtils.isBlank(config.getLogLevel())) {
      return;
    }
    Level level = Level.getLevel(config.getLogLevel().trim().toUpperCase(Locale.ROOT));
    if (level == null) {
      log.warn("ignoring unknown log level '{}'", config.getLogLevel());
      return;
    }
    Configurator.setLevel(LOGGER_ROOT, level);
    log.info("log level for {} set to {}", LOGGER_ROOT, level);
  }
}
