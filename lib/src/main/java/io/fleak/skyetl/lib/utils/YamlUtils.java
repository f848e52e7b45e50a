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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public interface YamlUtils {
  ObjectMapper OBJECT_MAPPER =
      YAMLMapper.builder()
          .addModule(new JavaTimeModule())
          .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
          .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .build();

  static <T> T fromYamlResource(String resourcePath, Class<T> clz) throws IOException {
    try (InputStream in = YamlUtils.class.getResourceAsStream(resourcePath)) {
      if (in == null) {
        throw new IOException("resource not found: " + resourcePath);
      }
      return OBJECT_MAPPER.readValue(in, clz);
    }
  }

  static <T> T fromYamlFile(Path path, Class<T> clz) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return OBJECT_MAPPER.readValue(in, clz);
    }
  }

  static <T> T fromYamlString(String str, Class<T> clz) {
    try {
      return OBJECT_MAPPER.readValue(str, clz);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
