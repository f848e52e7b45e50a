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
package io.fleak.skyetl.api.sink;

/**
 * Wide-column storage for normalized flight rows. Shared by all worker lanes; the number of
 * concurrently open connections is bounded by the implementation.
 */
public interface FlightSink extends AutoCloseable {

  /** Creates the target keyspace and table when missing. Never drops existing data. */
  default void ensureSchema() throws SinkWriteException {}

  /**
   * Borrows a connection, waiting at most the configured write timeout for a free slot.
   *
   * @throws TransientWriteException when no slot frees up in time
   */
  SinkConnection acquire() throws SinkWriteException;

  String table();

  @Override
  void close();
}
