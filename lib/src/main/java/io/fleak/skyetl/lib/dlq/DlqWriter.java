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
package io.fleak.skyetl.lib.dlq;

import io.fleak.skyetl.api.model.Batch;
import io.fleak.skyetl.api.model.NormalizedFlightRecord;
import io.fleak.skyetl.api.model.RawFlightRecord;
import io.fleak.skyetl.api.model.RejectionReason;
import io.fleak.skyetl.api.source.ExtractedRecord;
import io.fleak.skyetl.lib.deadletter.DeadLetter;
import io.fleak.skyetl.lib.utils.JsonUtils;
import java.io.Closeable;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Destination for everything the pipeline could not load: rejected records and failed batches.
 * Implementations must be safe to call from several worker lanes at once.
 */
public abstract class DlqWriter implements Closeable {
  public static final String KIND_REJECTED_RECORD = "REJECTED_RECORD";
  public static final String KIND_FAILED_BATCH = "FAILED_BATCH";

  public static final String METADATA_SOURCE = "source";
  public static final String METADATA_ORDINAL = "ordinal";
  public static final String METADATA_REASON_CODE = "reason_code";
  public static final String METADATA_TABLE = "table";
  public static final String METADATA_GROUP_KEY = "group_key";
  public static final String METADATA_SEQUENCE = "sequence";
  public static final String METADATA_ROWS = "rows";

  private String runId;

  /** Tags every subsequent dead letter with the run it belongs to. */
  public void setRunId(String runId) {
    this.runId = runId;
  }

  public void writeRejection(long processingTs, RawFlightRecord record, RejectionReason reason) {
    Map<String, String> metadata =
        positionMetadata(record.position().sourceName(), record.position().ordinal());
    metadata.put(METADATA_REASON_CODE, reason.code().name());
    writeToDlq(
        processingTs,
        KIND_REJECTED_RECORD,
        toBytes(record.position().toString()),
        JsonUtils.toJsonBytes(record.toFieldMap()),
        reason.toString(),
        metadata);
  }

  public void writeMalformed(long processingTs, ExtractedRecord.Malformed malformed) {
    Map<String, String> metadata =
        positionMetadata(malformed.position().sourceName(), malformed.position().ordinal());
    metadata.put(METADATA_REASON_CODE, RejectionReason.Code.MALFORMED.name());
    writeToDlq(
        processingTs,
        KIND_REJECTED_RECORD,
        toBytes(malformed.position().toString()),
        toBytes(malformed.rawText()),
        RejectionReason.malformed(malformed.reason()).toString(),
        metadata);
  }

  public void writeFailedBatch(
      long processingTs, Batch batch, String errorMsg, Map<String, String> extraMetadata) {
    Map<String, String> metadata = new HashMap<>(extraMetadata);
    metadata.put(METADATA_TABLE, batch.table());
    metadata.put(METADATA_GROUP_KEY, batch.groupKey());
    metadata.put(METADATA_SEQUENCE, String.valueOf(batch.sequence()));
    metadata.put(METADATA_ROWS, String.valueOf(batch.size()));
    writeToDlq(
        processingTs,
        KIND_FAILED_BATCH,
        toBytes(batch.batchId()),
        JsonUtils.toJsonBytes(batch.records()),
        errorMsg,
        metadata);
  }

  /** A single record that was never batched, for example because it exceeds the batch size. */
  public void writeFailedRecord(
      long processingTs, String table, NormalizedFlightRecord record, String errorMsg) {
    Map<String, String> metadata = new HashMap<>();
    metadata.put(METADATA_TABLE, table);
    metadata.put(METADATA_ROWS, "1");
    writeToDlq(
        processingTs,
        KIND_FAILED_BATCH,
        toBytes(record.partitionKey().toString()),
        JsonUtils.toJsonBytes(record),
        errorMsg,
        metadata);
  }

  protected void writeToDlq(
      long processingTs,
      String kind,
      byte[] key,
      byte[] value,
      String errorMsg,
      Map<String, String> metadata) {
    DeadLetter.Builder builder =
        DeadLetter.newBuilder()
            .setProcessingTimestamp(processingTs)
            .setRunId(runId)
            .setKind(kind)
            .setErrorMessage(errorMsg)
            .setMetadata(metadata);
    Optional.ofNullable(key).ifPresent(k -> builder.setKey(ByteBuffer.wrap(k)));
    Optional.ofNullable(value).ifPresent(v -> builder.setValue(ByteBuffer.wrap(v)));
    doWrite(builder.build());
  }

  protected abstract void doWrite(DeadLetter deadLetter);

  public abstract void open();

  private static Map<String, String> positionMetadata(String sourceName, long ordinal) {
    Map<String, String> metadata = new HashMap<>();
    metadata.put(METADATA_SOURCE, sourceName);
    metadata.put(METADATA_ORDINAL, String.valueOf(ordinal));
    return metadata;
  }

  private static byte[] toBytes(String text) {
    return text == null ? null : text.getBytes(StandardCharsets.UTF_8);
  }
}
