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
package io.fleak.skyetl.lib.utils;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonUtilsTest {

  @Test
  void testToTextFields() throws JsonProcessingException {
    Map<String, String> fields =
        JsonUtils.toTextFields(
            JsonUtils.parseObject(
                "{\"a\": \"x\", \"b\": 12, \"c\": null, \"d\": {\"e\": true}, \"f\": false}"));
    assertEquals(Map.of("a", "x", "b", "12", "d", "{\"e\":true}", "f", "false"), fields);
  }

  @Test
  void testParseObject_rejectsNonObjects() {
    assertThrows(IllegalArgumentException.class, () -> JsonUtils.parseObject("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> JsonUtils.parseObject("\"text\""));
    assertThrows(JsonProcessingException.class, () -> JsonUtils.parseObject("{\"a\": "));
    assertThrows(JsonProcessingException.class, () -> JsonUtils.parseObject("{} {}"));
  }

  @Test
  void testInstantsWrittenAsIsoText() {
    assertEquals(
        "{\"at\":\"2024-01-01T00:00:00Z\"}",
        JsonUtils.toJsonString(Map.of("at", Instant.parse("2024-01-01T00:00:00Z"))));
  }
}
