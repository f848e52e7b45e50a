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
package io.fleak.skyetl.runner;

/** How a worker lane ended. {@code detail} carries the error message for abnormal endings. */
public record LaneResult(int laneIndex, Termination termination, String detail) {

  public enum Termination {
    COMPLETED,
    CANCELLED,
    SOURCE_UNAVAILABLE,
    FAULT;

    public boolean isAbnormal() {
      return this == SOURCE_UNAVAILABLE || this == FAULT;
    }
  }

  static LaneResult completed(int laneIndex) {
    return new LaneResult(laneIndex, Termination.COMPLETED, null);
  }

  static LaneResult cancelled(int laneIndex) {
    return new LaneResult(laneIndex, Termination.CANCELLED, null);
  }
}
