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
package io.fleak.skyetl.lib.extract;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.fleak.skyetl.api.source.ExtractedRecord;
import io.fleak.skyetl.api.source.FlightSource;
import io.fleak.skyetl.api.source.RecordCursor;
import io.fleak.skyetl.api.source.SourceUnavailableException;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Base for sources backed by local files. The locator is either one file or a directory whose
 * regular files are read in name order.
 *
 * <p>Slicing: when there are at least as many files as slices, slice {@code i} reads files {@code
 * i, i + n, ...}. Otherwise every slice reads all files and keeps the items whose global ordinal
 * modulo the slice count equals its index.
 */
@Slf4j
public abstract class AbstractFileSource implements FlightSource {

  protected final Path locator;
  private final String fileExtension;

  protected AbstractFileSource(@NonNull Path locator, String fileExtension) {
    this.locator = locator;
    this.fileExtension = StringUtils.removeStart(StringUtils.trimToNull(fileExtension), ".");
  }

  @Override
  public String name() {
    Path fileName = locator.getFileName();
    return fileName == null ? locator.toString() : fileName.toString();
  }

  @Override
  public void probe() {
    List<Path> files = listFiles();
    for (Path file : files) {
      if (!Files.isReadable(file)) {
        throw new SourceUnavailableException("file is not readable: " + file);
      }
    }
    log.info("source {} resolved to {} file(s)", locator, files.size());
  }

  @Override
  public RecordCursor open(int sliceIndex, int sliceCount) {
    Preconditions.checkArgument(sliceCount > 0, "sliceCount must be positive: %s", sliceCount);
    Preconditions.checkArgument(
        sliceIndex >= 0 && sliceIndex < sliceCount,
        "sliceIndex %s out of range [0, %s)",
        sliceIndex,
        sliceCount);
    List<Path> files = listFiles();
    if (files.size() >= sliceCount) {
      List<Path> assigned = new ArrayList<>();
      for (int i = sliceIndex; i < files.size(); i += sliceCount) {
        assigned.add(files.get(i));
      }
      log.debug("slice {}/{} reads files {}", sliceIndex, sliceCount, assigned);
      return new FileCursor(assigned, 0, 1);
    }
    return new FileCursor(files, sliceIndex, sliceCount);
  }

  @VisibleForTesting
  List<Path> listFiles() {
    if (Files.isRegularFile(locator)) {
      return List.of(locator);
    }
    if (!Files.isDirectory(locator)) {
      throw new SourceUnavailableException("source location does not exist: " + locator);
    }
    try (Stream<Path> stream = Files.list(locator)) {
      return stream
          .filter(Files::isRegularFile)
          .filter(
              p ->
                  fileExtension == null
                      || fileExtension.equalsIgnoreCase(
                          FilenameUtils.getExtension(p.getFileName().toString())))
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .collect(Collectors.toList());
    } catch (IOException | UncheckedIOException e) {
      throw new SourceUnavailableException("failed to list source directory " + locator, e);
    }
  }

  /**
   * Opens one file for sequential reading.
   *
   * @throws IOException if the file cannot be opened
   */
  protected abstract FileReader openFile(Path file) throws IOException;

  /** Sequential reader over one file. Positions are 1-based within the file. */
  protected interface FileReader extends Closeable {
    /**
     * @return the next item, or null at end of file
     */
    ExtractedRecord next() throws IOException;
  }

  private class FileCursor implements RecordCursor {
    private final List<Path> files;
    private final int keepRemainder;
    private final int modulus;

    private int fileIndex = -1;
    private FileReader reader;
    private Path currentFile;
    private long globalOrdinal;
    private ExtractedRecord lookahead;
    private boolean closed;

    FileCursor(List<Path> files, int keepRemainder, int modulus) {
      this.files = files;
      this.keepRemainder = keepRemainder;
      this.modulus = modulus;
    }

    @Override
    public boolean hasNext() {
      if (lookahead == null && !closed) {
        lookahead = advance();
      }
      return lookahead != null;
    }

    @Override
    public ExtractedRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      ExtractedRecord item = lookahead;
      lookahead = null;
      return item;
    }

    private ExtractedRecord advance() {
      while (true) {
        if (reader == null && !openNextFile()) {
          return null;
        }
        ExtractedRecord item;
        try {
          item = reader.next();
        } catch (IOException e) {
          throw new SourceUnavailableException("failed to read " + currentFile, e);
        }
        if (item == null) {
          closeReader();
          continue;
        }
        long ordinal = globalOrdinal++;
        if (ordinal % modulus == keepRemainder) {
          return item;
        }
      }
    }

    private boolean openNextFile() {
      fileIndex++;
      if (fileIndex >= files.size()) {
        return false;
      }
      currentFile = files.get(fileIndex);
      try {
        reader = openFile(currentFile);
      } catch (IOException e) {
        throw new SourceUnavailableException("failed to open " + currentFile, e);
      }
      log.debug("reading {}", currentFile);
      return true;
    }

    private void closeReader() {
      if (reader == null) {
        return;
      }
      try {
        reader.close();
      } catch (IOException e) {
        log.warn("failed to close {}", currentFile, e);
      }
      reader = null;
    }

    @Override
    public void close() {
      closed = true;
      lookahead = null;
      closeReader();
    }
  }
}
