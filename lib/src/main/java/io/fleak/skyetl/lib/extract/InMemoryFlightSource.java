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
package io.fleak.skyetl.lib.extract;

import com.google.common.base.Preconditions;
import io.fleak.skyetl.api.model.RawFlightRecord;
import io.fleak.skyetl.api.source.ExtractedRecord;
import io.fleak.skyetl.api.source.FlightSource;
import io.fleak.skyetl.api.source.RecordCursor;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;

/** A fixed list of items, sliced by position modulo the slice count. */
public class InMemoryFlightSource implements FlightSource {

  private final String name;
  private final List<ExtractedRecord> items;

  public InMemoryFlightSource(@NonNull String name, @NonNull List<ExtractedRecord> items) {
    this.name = name;
    this.items = List.copyOf(items);
  }

  public static InMemoryFlightSource ofRecords(String name, List<RawFlightRecord> records) {
    return new InMemoryFlightSource(name, records.stream().map(ExtractedRecord::of).toList());
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void probe() {
    // always available
  }

  @Override
  public RecordCursor open(int sliceIndex, int sliceCount) {
    Preconditions.checkArgument(sliceIndex >= 0 && sliceIndex < sliceCount);
    List<ExtractedRecord> slice = new ArrayList<>();
    for (int i = sliceIndex; i < items.size(); i += sliceCount) {
      slice.add(items.get(i));
    }
    return RecordCursor.of(slice);
  }
}
