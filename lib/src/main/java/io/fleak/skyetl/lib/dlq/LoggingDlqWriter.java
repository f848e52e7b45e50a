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

import io.fleak.skyetl.lib.deadletter.DeadLetter;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingDlqWriter extends DlqWriter {

  @Override
  public void open() {}

  @Override
  protected void doWrite(DeadLetter deadLetter) {
    log.error(
        "dead letter [{}] key={} error={} metadata={}",
        deadLetter.getKind(),
        decode(deadLetter.getKey()),
        deadLetter.getErrorMessage(),
        deadLetter.getMetadata());
    log.debug("dead letter payload: {}", decode(deadLetter.getValue()));
  }

  @Override
  public void close() {}

  private static String decode(ByteBuffer buffer) {
    if (buffer == null) {
      return null;
    }
    ByteBuffer copy = buffer.duplicate();
    byte[] bytes = new byte[copy.remaining()];
    copy.get(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }
}
