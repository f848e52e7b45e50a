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
package io.fleak.skyetl.clistarter;

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.skyetl.lib.utils.JsonUtils;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

  private static final String HEADER =
      "flight_id,origin,destination,scheduled_departure,actual_departure,status";

  @TempDir Path tempDir;

  private Path config(String extraYaml) throws Exception {
    Path file = tempDir.resolve("pipeline.yaml");
    Files.writeString(
        file,
        "source:\n"
            + "  type: csv\n"
            + "  locator: "
            + tempDir.resolve("flights.csv")
            + "\n"
            + "workerCount: 2\n"
            + extraYaml);
    return file;
  }

  private void writeFlights(String... rows) throws Exception {
    List<String> lines = new ArrayList<>();
    lines.add(HEADER);
    lines.addAll(List.of(rows));
    Files.write(tempDir.resolve("flights.csv"), lines, StandardCharsets.UTF_8);
  }

  @Test
  void testDryRunSucceeds() throws Exception {
    writeFlights(
        "AA123,JFK,LAX,2024-01-01T08:00:00Z,2024-01-01T08:10:00Z,LANDED",
        "DL45,ATL,,2024-01-01T09:00:00Z,,SCHEDULED",
        "UA9,SFO,ORD,2024-01-02 07:30:00,2024-01-02 07:25:00,departed");
    Path report = tempDir.resolve("report.json");

    int exitCode =
        Main.run(
            new String[] {
              "-c", config("").toString(), "--dry-run", "-id", "cli-run", "-r", report.toString()
            });

    assertEquals(Main.EXIT_SUCCESS, exitCode);
    Map<?, ?> written = JsonUtils.fromJsonString(Files.readString(report), Map.class);
    assertEquals("cli-run", written.get("runId"));
    assertEquals(3, written.get("extracted"));
    assertEquals(1, written.get("rejected"));
    assertEquals(2, written.get("loaded"));
  }

  @Test
  void testFailedBatchExitsPartial() throws Exception {
    writeFlights(
        "AA123,JFK,LAX,2024-01-01T08:00:00Z,,LANDED",
        "B" + "X".repeat(300) + ",JFK,LAX,2024-01-01T08:00:00Z,,LANDED");

    int exitCode =
        Main.run(
            new String[] {"-c", config("batch:\n  maxBytes: 200\n").toString(), "--dry-run"});

    assertEquals(Main.EXIT_PARTIAL, exitCode);
  }

  @Test
  void testMissingSourceExitsAborted() throws Exception {
    int exitCode = Main.run(new String[] {"-c", config("").toString(), "--dry-run"});
    assertEquals(Main.EXIT_ABORTED, exitCode);
  }

  @Test
  void testUsageErrorExitsAborted() {
    assertEquals(Main.EXIT_ABORTED, Main.run(new String[] {"--no-such-option"}));
  }

  @Test
  void testInvalidConfigExitsAborted() throws Exception {
    writeFlights("AA123,JFK,LAX,2024-01-01T08:00:00Z,,LANDED");
    int exitCode =
        Main.run(new String[] {"-c", config("batch:\n  maxRows: 0\n").toString(), "--dry-run"});
    assertEquals(Main.EXIT_ABORTED, exitCode);
  }
}
