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
package io.fleak.skyetl.api.metric;

import java.util.Map;

/** Measures wall-clock duration between {@link #start()} and {@link #stop(Map)}. */
public abstract class EtlStopWatch {
  private long startTime;

  public void start() {
    startTime = System.currentTimeMillis();
  }

  public void stop(Map<String, String> additionalTags) {
    reportDuration(System.currentTimeMillis() - startTime, additionalTags);
  }

  protected abstract void reportDuration(long durationMillis, Map<String, String> additionalTags);
}
