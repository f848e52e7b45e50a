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

import com.fasterxml.jackson.core.JsonProcessingException;
import io.fleak.skyetl.api.model.RawFlightRecord;
import io.fleak.skyetl.api.model.SourcePosition;
import io.fleak.skyetl.api.source.ExtractedRecord;
import io.fleak.skyetl.lib.utils.JsonUtils;
import io.fleak.skyetl.lib.utils.MiscUtils;
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads files holding one JSON object per line. Blank lines are skipped. Each line is decoded as
 * UTF-8 on its own, so a line with invalid bytes is yielded as malformed and the rest of the file
 * is still read.
 */
public class JsonLinesFileSource extends AbstractFileSource {

  private static final int MAX_RAW_TEXT_LENGTH = 1024;

  public JsonLinesFileSource(Path locator, String fileExtension) {
    super(locator, fileExtension);
  }

  public static JsonLinesFileSource create(FileSourceDto.Config config) {
    return new JsonLinesFileSource(Path.of(config.getLocator()), config.getFileExtension());
  }

  private static String abbreviate(String line) {
    return MiscUtils.abbreviate(line, MAX_RAW_TEXT_LENGTH);
  }

  @Override
  protected FileReader openFile(Path file) throws IOException {
    InputStream in = new BufferedInputStream(Files.newInputStream(file));
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    String sourceName = file.getFileName().toString();
    return new FileReader() {
      private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream();
      private long lineNumber;

      @Override
      public ExtractedRecord next() throws IOException {
        while (readLine()) {
          lineNumber++;
          byte[] bytes = lineBuffer.toByteArray();
          int length = bytes.length;
          if (length > 0 && bytes[length - 1] == '\r') {
            length--;
          }
          String line;
          try {
            line = decoder.decode(ByteBuffer.wrap(bytes, 0, length)).toString();
          } catch (CharacterCodingException e) {
            return ExtractedRecord.malformed(
                new SourcePosition(sourceName, lineNumber),
                "invalid UTF-8 text",
                abbreviate(new String(bytes, 0, length, StandardCharsets.UTF_8)));
          }
          if (StringUtils.isBlank(line)) {
            continue;
          }
          return parseLine(new SourcePosition(sourceName, lineNumber), line);
        }
        return null;
      }

      /** Fills the buffer with the next line without its terminator; false at end of file. */
      private boolean readLine() throws IOException {
        lineBuffer.reset();
        int b = in.read();
        if (b == -1) {
          return false;
        }
        while (b != -1 && b != '\n') {
          lineBuffer.write(b);
          b = in.read();
        }
        return true;
      }

      @Override
      public void close() throws IOException {
        in.close();
      }
    };
  }

  private static ExtractedRecord parseLine(SourcePosition position, String line) {
    try {
      Map<String, String> fields = JsonUtils.toTextFields(JsonUtils.parseObject(line));
      return ExtractedRecord.of(RawFlightRecord.fromFields(position, fields));
    } catch (JsonProcessingException e) {
      return ExtractedRecord.malformed(
          position, "invalid JSON: " + e.getOriginalMessage(), abbreviate(line));
    } catch (IllegalArgumentException e) {
      return ExtractedRecord.malformed(position, e.getMessage(), abbreviate(line));
    }
  }
}
