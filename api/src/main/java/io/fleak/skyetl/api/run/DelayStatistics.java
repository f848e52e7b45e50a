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
package io.fleak.skyetl.api.run;

import java.util.HashMap;
import java.util.Map;

/**
 * Running summary of {@code delayMinutes} over loaded records. Records without a delay are not
 * counted. Thread safe.
 */
public class DelayStatistics {

  private long count;
  private long sum;
  private int min = Integer.MAX_VALUE;
  private int max = Integer.MIN_VALUE;
  private final Map<Integer, Long> frequencies = new HashMap<>();

  public synchronized void record(Integer delayMinutes) {
    if (delayMinutes == null) {
      return;
    }
    count++;
    sum += delayMinutes;
    min = Math.min(min, delayMinutes);
    max = Math.max(max, delayMinutes);
    frequencies.merge(delayMinutes, 1L, Long::sum);
  }

  public synchronized Summary summary() {
    if (count == 0) {
      return Summary.EMPTY;
    }
    Integer mode = null;
    long modeFrequency = 0;
    for (Map.Entry<Integer, Long> entry : frequencies.entrySet()) {
      // ties go to the smaller delay so the result is deterministic
      if (entry.getValue() > modeFrequency
          || (entry.getValue() == modeFrequency && entry.getKey() < mode)) {
        mode = entry.getKey();
        modeFrequency = entry.getValue();
      }
    }
    return new Summary(count, (double) sum / count, min, max, mode);
  }

  /** Null fields mean no delays were observed. */
  public record Summary(long count, Double mean, Integer min, Integer max, Integer mode) {
    public static final Summary EMPTY = new Summary(0, null, null, null, null);
  }
}
