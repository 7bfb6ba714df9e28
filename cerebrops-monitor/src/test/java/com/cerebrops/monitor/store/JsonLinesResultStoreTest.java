/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.store;

import com.cerebrops.monitor.cycle.CycleResult;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static com.cerebrops.monitor.CerebrOpsMonitorUnitTestUtils.START_TIME_MS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class JsonLinesResultStoreTest {
  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();

  @Test
  public void testAppendOneLinePerResult() throws IOException {
    Path path = _folder.getRoot().toPath().resolve("nested").resolve("monitoring_results.jsonl");
    JsonLinesResultStore store = new JsonLinesResultStore();
    store.configure(Collections.singletonMap(JsonLinesResultStore.RESULT_STORE_FILE_PATH_CONFIG, path.toString()));
    assertEquals(path, store.path());

    store.append(new CycleResult(START_TIME_MS));
    store.append(CycleResult.initializationFailure(START_TIME_MS + 1000L));

    List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    JsonObject first = JsonParser.parseString(lines.get(0)).getAsJsonObject();
    assertEquals("2023-11-14T22:13:20.000Z", first.get(CycleResult.TIMESTAMP).getAsString());
    assertTrue(first.get(CycleResult.HEALTH_CHECK).isJsonNull());
    assertTrue(first.get(CycleResult.ANOMALY_DETECTION).isJsonNull());
    assertEquals(0, first.getAsJsonArray(CycleResult.ALERTS_SENT).size());
    JsonObject second = JsonParser.parseString(lines.get(1)).getAsJsonObject();
    assertEquals(CycleResult.INITIALIZATION_FAILED_ERROR, second.get(CycleResult.ERROR).getAsString());
  }

  @Test
  public void testAppendKeepsExistingLines() throws IOException {
    Path path = _folder.newFile("results.jsonl").toPath();
    Files.write(path, "{\"previous\":true}\n".getBytes(StandardCharsets.UTF_8));
    new JsonLinesResultStore(path).append(new CycleResult(START_TIME_MS));
    assertEquals(2, Files.readAllLines(path, StandardCharsets.UTF_8).size());
  }
}
