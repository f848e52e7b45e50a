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

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

public interface MiscUtils {
  String METRIC_TAG_RUN_ID = "run_id";
  String METRIC_TAG_LANE = "lane";
  String METRIC_TAG_TABLE = "table";

  String METRIC_NAME_EXTRACTED = "extracted_count";
  String METRIC_NAME_REJECTED = "rejected_count";
  String METRIC_NAME_LOADED = "loaded_count";
  String METRIC_NAME_FAILED = "failed_count";
  String METRIC_NAME_BATCH_WRITE_TIME = "batch_write_time";

  static String generateRandomHash() {
    return new BigInteger(128, new SecureRandom()).toString(32).substring(0, 16);
  }

  static Map<String, String> laneMetricTags(String runId, int laneIndex) {
    Map<String, String> tags = new HashMap<>();
    tags.put(METRIC_TAG_RUN_ID, runId);
    tags.put(METRIC_TAG_LANE, String.valueOf(laneIndex));
    return tags;
  }

  /** Shortens long free text, such as raw source lines, for log and dead-letter messages. */
  static String abbreviate(String text, int maxLength) {
    return StringUtils.abbreviate(StringUtils.defaultString(text), maxLength);
  }
}
