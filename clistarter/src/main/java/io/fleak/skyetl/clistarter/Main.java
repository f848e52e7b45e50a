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

import com.google.common.annotations.VisibleForTesting;
import io.fleak.skyetl.api.metric.MetricClientProvider;
import io.fleak.skyetl.runner.EtlJob;
import io.fleak.skyetl.runner.RunReport;
import io.fleak.skyetl.runner.config.PipelineConfig;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.ParseException;

/**
 * Command-line entry point. Exits with 0 when every record was accounted for and every batch
 * loaded, 2 when some batches failed, and 1 when the run was aborted or could not start.
 */
@Slf4j
public class Main {

  static final int EXIT_SUCCESS = 0;
  static final int EXIT_ABORTED = 1;
  static final int EXIT_PARTIAL = 2;

  private static final long SHUTDOWN_GRACE_SECONDS = 30;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  @VisibleForTesting
  static int run(String[] args) {
    PipelineConfig config;
    try {
      config = EtlCliParser.parseArgs(args);
    } catch (ParseException cliParseException) {
      System.err.println(cliParseException.getMessage());
      EtlCliParser.printUsage("skyetl");
      return EXIT_ABORTED;
    } catch (RuntimeException e) {
      log.error("failed to read pipeline configuration", e);
      return EXIT_ABORTED;
    }

    try (MetricClientProvider metricClientProvider =
            new MetricClientProvider.NoopMetricClientProvider();
        EtlJob job = EtlJob.create(config, metricClientProvider)) {
      CountDownLatch finished = new CountDownLatch(1);
      Thread shutdownHook = new Thread(() -> cancelAndWait(job, finished), "etl-shutdown");
      Runtime.getRuntime().addShutdownHook(shutdownHook);
      RunReport report;
      try {
        report = job.run();
      } finally {
        finished.countDown();
        removeShutdownHook(shutdownHook);
      }
      return exitCode(report);
    } catch (RuntimeException e) {
      log.error("pipeline failed to start", e);
      return EXIT_ABORTED;
    }
  }

  static int exitCode(RunReport report) {
    return switch (report.status()) {
      case SUCCESS -> EXIT_SUCCESS;
      case PARTIAL -> EXIT_PARTIAL;
      case ABORTED, RUNNING -> EXIT_ABORTED;
    };
  }

  private static void cancelAndWait(EtlJob job, CountDownLatch finished) {
    log.warn("shutdown requested, cancelling the run");
    job.cancel();
    try {
      if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
        log.error("run did not stop within {}s of shutdown", SHUTDOWN_GRACE_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("interrupted while waiting for the run to stop", e);
    }
  }

  private static void removeShutdownHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException e) {
      // the JVM is already shutting down and the hook is running
      log.debug("shutdown in progress, hook stays registered", e);
    }
  }
}
