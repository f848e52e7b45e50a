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

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;

/**
 * A lazy, single-pass stream of extracted records for one slice of a source. {@link #hasNext()} and
 * {@link #next()} throw {@link SourceUnavailableException} when the underlying source fails.
 */
public interface RecordCursor extends Iterator<ExtractedRecord>, Closeable {

  @Override
  void close();

  static RecordCursor of(List<ExtractedRecord> records) {
    Iterator<ExtractedRecord> delegate = records.iterator();
    return new RecordCursor() {
      @Override
      public boolean hasNext() {
        return delegate.hasNext();
      }

      @Override
      public ExtractedRecord next() {
        return delegate.next();
      }

      @Override
      public void close() {
        // nothing held
      }
    };
  }
}
