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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.fleak.skyetl.lib.deadletter.DeadLetter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.file.DataFileWriter;
import org.apache.avro.specific.SpecificDatumWriter;

/**
 * Appends dead letters to a local Avro container file {@code
 * <directory>/dead-letters-<runId>-<epochMillis>.avro}. Each append is flushed so the file is
 * readable up to the last dead letter even if the process dies.
 */
@Slf4j
public class AvroFileDlqWriter extends DlqWriter {

  private final Path directory;
  private final String fileTag;
  private DataFileWriter<DeadLetter> dataFileWriter;
  private Path file;

  public AvroFileDlqWriter(@NonNull Path directory, @NonNull String fileTag) {
    this.directory = directory;
    this.fileTag = fileTag;
  }

  @Override
  public synchronized void open() {
    Preconditions.checkState(dataFileWriter == null, "dlq writer already opened");
    try {
      Files.createDirectories(directory);
      file =
          directory.resolve(
              String.format("dead-letters-%s-%d.avro", fileTag, System.currentTimeMillis()));
      SpecificDatumWriter<DeadLetter> datumWriter = new SpecificDatumWriter<>(DeadLetter.class);
      DataFileWriter<DeadLetter> writer = new DataFileWriter<>(datumWriter);
      writer.create(DeadLetter.getClassSchema(), file.toFile());
      dataFileWriter = writer;
    } catch (IOException e) {
      throw new UncheckedIOException("failed to open dead letter file in " + directory, e);
    }
    log.info("writing dead letters to {}", file);
  }

  @Override
  protected synchronized void doWrite(DeadLetter deadLetter) {
    Preconditions.checkState(dataFileWriter != null, "dlq writer is not open");
    try {
      dataFileWriter.append(deadLetter);
      dataFileWriter.flush();
    } catch (IOException e) {
      log.error("failed to write dead letter to {}: {}", file, deadLetter, e);
    }
  }

  @VisibleForTesting
  public synchronized Path getFile() {
    return file;
  }

  @Override
  public synchronized void close() throws IOException {
    if (dataFileWriter != null) {
      dataFileWriter.close();
      dataFileWriter = null;
    }
  }
}
