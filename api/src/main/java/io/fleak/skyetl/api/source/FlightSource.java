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
package io.fleak.skyetl.api.source;

/**
 * A readable origin of raw flight events. A source is split into {@code sliceCount} disjoint
 * slices so that each worker lane reads its own share; together the slices cover every record
 * exactly once.
 */
public interface FlightSource {

  /** Short name used in source positions and logs. */
  String name();

  /**
   * Checks that the source can be read before any lane starts.
   *
   * @throws SourceUnavailableException if it cannot
   */
  void probe();

  /**
   * Opens the slice {@code sliceIndex} of {@code sliceCount}.
   *
   * @throws SourceUnavailableException if the slice cannot be opened
   */
  RecordCursor open(int sliceIndex, int sliceCount);
}
