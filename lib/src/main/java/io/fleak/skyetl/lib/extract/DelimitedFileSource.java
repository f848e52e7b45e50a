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

import io.fleak.skyetl.api.model.RawFlightRecord;
import io.fleak.skyetl.api.model.SourcePosition;
import io.fleak.skyetl.api.source.ExtractedRecord;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Reads delimited text files with a header row. A record whose field count differs from the header
 * is yielded as malformed. A tokenizing error (for example an unterminated quote) yields one
 * malformed item and ends that file, since the parser cannot resynchronize. Invalid UTF-8 bytes are
 * decoded as U+FFFD and the record holding them is yielded as malformed.
 */
@Slf4j
public class DelimitedFileSource extends AbstractFileSource {

  private static final char REPLACEMENT_CHAR = '\uFFFD';

  private final CSVFormat csvFormat;
  private final char delimiter;

  public DelimitedFileSource(Path locator, char delimiter, String fileExtension) {
    super(locator, fileExtension);
    this.delimiter = delimiter;
    this.csvFormat =
        CSVFormat.DEFAULT
            .builder()
            .setDelimiter(delimiter)
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();
  }

  public static DelimitedFileSource create(FileSourceDto.Config config) {
    String delimiter = config.getDelimiter();
    char delimiterChar = delimiter == null || delimiter.isEmpty() ? ',' : delimiter.charAt(0);
    return new DelimitedFileSource(
        Path.of(config.getLocator()), delimiterChar, config.getFileExtension());
  }

  @Override
  protected FileReader openFile(Path file) throws IOException {
    Reader reader =
        new BufferedReader(
            new InputStreamReader(
                Files.newInputStream(file),
                StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)));
    try {
      return new CsvFileReader(file, csvFormat.parse(reader));
    } catch (IOException e) {
      reader.close();
      throw e;
    }
  }

  private class CsvFileReader implements FileReader {
    private final Path file;
    private final String sourceName;
    private final CSVParser parser;
    private final List<String> headerNames;
    private final Iterator<CSVRecord> iterator;
    private long ordinal;
    private boolean broken;

    CsvFileReader(Path file, CSVParser parser) {
      this.file = file;
      this.sourceName = file.getFileName().toString();
      this.parser = parser;
      this.headerNames = parser.getHeaderNames();
      this.iterator = parser.iterator();
    }

    @Override
    public ExtractedRecord next() throws IOException {
      if (broken) {
        return null;
      }
      CSVRecord record;
      try {
        if (!iterator.hasNext()) {
          return null;
        }
        record = iterator.next();
      } catch (UncheckedIOException e) {
        if (!Files.isReadable(file)) {
          throw e.getCause();
        }
        broken = true;
        SourcePosition position = new SourcePosition(sourceName, ++ordinal);
        log.warn("unparseable content in {} at {}: {}", file, position, e.getMessage());
        return ExtractedRecord.malformed(
            position, "unparseable delimited text: " + e.getMessage(), null);
      }

      SourcePosition position = new SourcePosition(sourceName, ++ordinal);
      if (!record.isConsistent()) {
        return ExtractedRecord.malformed(
            position,
            String.format("expected %d fields but found %d", headerNames.size(), record.size()),
            String.join(String.valueOf(delimiter), record.values()));
      }
      if (record.stream().anyMatch(value -> value.indexOf(REPLACEMENT_CHAR) >= 0)) {
        return ExtractedRecord.malformed(
            position,
            "invalid UTF-8 text",
            String.join(String.valueOf(delimiter), record.values()));
      }
      Map<String, String> fields = new LinkedHashMap<>(headerNames.size());
      for (String headerName : headerNames) {
        fields.put(headerName, record.get(headerName));
      }
      return ExtractedRecord.of(RawFlightRecord.fromFields(position, fields));
    }

    @Override
    public void close() throws IOException {
      parser.close();
    }
  }
}
