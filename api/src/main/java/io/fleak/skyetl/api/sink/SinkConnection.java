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

import io.fleak.skyetl.api.model.Batch;

/**
 * A borrowed write slot on a {@link FlightSink}. Closing returns it to the pool; closing twice has
 * no further effect.
 */
public interface SinkConnection extends AutoCloseable {

  /**
   * Writes every record of the batch. Writes are upserts keyed by partition key, so writing the
   * same batch twice leaves storage in the same state as writing it once.
   */
  void write(Batch batch) throws SinkWriteException;

  @Override
  void close();
}
