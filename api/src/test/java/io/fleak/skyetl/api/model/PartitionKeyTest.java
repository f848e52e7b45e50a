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
package io.fleak.skyetl.api.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class PartitionKeyTest {

  @Test
  void testBucketIsStableAndInRange() {
    PartitionKey key = new PartitionKey("UA90", LocalDate.of(2024, 5, 1));
    int bucket = key.bucket(16);
    assertTrue(bucket >= 0 && bucket < 16);
    assertEquals(bucket, new PartitionKey("UA90", LocalDate.of(2024, 5, 1)).bucket(16));
    assertEquals(0, key.bucket(1));
  }

  @Test
  void testGroupKeyCombinesDateAndBucket() {
    PartitionKey key = new PartitionKey("UA90", LocalDate.of(2024, 5, 1));
    assertEquals("2024-05-01/" + key.bucket(8), key.groupKey(8));
  }

  @Test
  void testRejectionReasonToString() {
    assertEquals(
        "MissingField(\"destination\")", RejectionReason.missingField("destination").toString());
    assertEquals(RejectionReason.Code.BAD_FORMAT, RejectionReason.badFormat("origin").code());
  }
}
