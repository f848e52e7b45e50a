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

import static io.fleak.skyetl.lib.utils.MiscUtils.*;

import com.google.common.annotations.VisibleForTesting;
import io.fleak.skyetl.api.metric.EtlCounter;
import io.fleak.skyetl.api.metric.EtlStopWatch;
import io.fleak.skyetl.api.metric.MetricClientProvider;
import java.util.Map;

/** Metric handles for one worker lane, tagged with the run id and lane index. */
public record LaneCounters(
    EtlCounter extractedCounter,
    EtlCounter rejectedCounter,
    EtlCounter loadedCounter,
    EtlCounter failedCounter,
    EtlStopWatch batchWriteStopWatch,
    Map<String, String> tags) {

  public void increaseExtracted(long n) {
    extractedCounter.increase(n, tags);
  }

  public void increaseRejected(long n) {
    rejectedCounter.increase(n, tags);
  }

  public void increaseLoaded(long n) {
    loadedCounter.increase(n, tags);
  }

  public void increaseFailed(long n) {
    failedCounter.increase(n, tags);
  }

  public void startBatchWrite() {
    batchWriteStopWatch.start();
  }

  public void stopBatchWrite(String table) {
    batchWriteStopWatch.stop(Map.of(METRIC_TAG_TABLE, table));
  }

  @VisibleForTesting
  public static LaneCounters createLaneCounters(
      MetricClientProvider metricClientProvider, String runId, int laneIndex) {
    Map<String, String> tags = laneMetricTags(runId, laneIndex);
    return new LaneCounters(
        metricClientProvider.counter(METRIC_NAME_EXTRACTED, tags),
        metricClientProvider.counter(METRIC_NAME_REJECTED, tags),
        metricClientProvider.counter(METRIC_NAME_LOADED, tags),
        metricClientProvider.counter(METRIC_NAME_FAILED, tags),
        metricClientProvider.stopWatch(METRIC_NAME_BATCH_WRITE_TIME, tags),
        Map.copyOf(tags));
  }
}
