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
package io.fleak.skyetl.api.run;

import com.google.common.base.Preconditions;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;
import lombok.NonNull;

/**
 * Shared, lock-free progress counters for one pipeline invocation. Every worker lane updates the
 * same instance.
 */
public class PipelineRun {

  @Getter private final String runId;
  @Getter private final Instant startedAt;

  private final AtomicLong extracted = new AtomicLong();
  private final AtomicLong transformed = new AtomicLong();
  private final AtomicLong rejected = new AtomicLong();
  private final AtomicLong loaded = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong loadedBatches = new AtomicLong();
  private final AtomicLong failedBatches = new AtomicLong();
  private final AtomicLong skipped = new AtomicLong();
  private final AtomicLong batchSequence = new AtomicLong();
  private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.RUNNING);
  @Getter private final DelayStatistics delayStatistics = new DelayStatistics();

  public PipelineRun(@NonNull String runId, @NonNull Instant startedAt) {
    this.runId = runId;
    this.startedAt = startedAt;
  }

  public void recordExtracted() {
    extracted.incrementAndGet();
  }

  public void recordTransformed() {
    transformed.incrementAndGet();
  }

  public void recordRejected() {
    rejected.incrementAndGet();
  }

  public void recordLoaded(int records) {
    loaded.addAndGet(records);
    loadedBatches.incrementAndGet();
  }

  public void recordFailed(int records) {
    failed.addAndGet(records);
    failedBatches.incrementAndGet();
  }

  public void recordSkipped(int records) {
    skipped.addAndGet(records);
  }

  /** Next run-wide batch sequence number, starting at 1. */
  public long nextBatchSequence() {
    return batchSequence.incrementAndGet();
  }

  public long extracted() {
    return extracted.get();
  }

  public long transformed() {
    return transformed.get();
  }

  public long rejected() {
    return rejected.get();
  }

  public long loaded() {
    return loaded.get();
  }

  public long failed() {
    return failed.get();
  }

  public long loadedBatches() {
    return loadedBatches.get();
  }

  public long failedBatches() {
    return failedBatches.get();
  }

  public long skipped() {
    return skipped.get();
  }

  public RunStatus status() {
    return status.get();
  }

  /**
   * Moves the run to its terminal status. Only the first call takes effect.
   *
   * @return the status the run ended with
   */
  public RunStatus finish(@NonNull RunStatus finalStatus) {
    Preconditions.checkArgument(finalStatus.isTerminal(), "not a terminal status: %s", finalStatus);
    status.compareAndSet(RunStatus.RUNNING, finalStatus);
    return status.get();
  }
}
