/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.store;

import com.cerebrops.monitor.cycle.CycleResult;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Appends every cycle result as one JSON object per line to {@value #RESULT_STORE_FILE_PATH_CONFIG}, creating
 * the file and its parent directories on first use.
 */
public class JsonLinesResultStore implements ResultStore {
  private static final Logger LOG = LoggerFactory.getLogger(JsonLinesResultStore.class);
  public static final String RESULT_STORE_FILE_PATH_CONFIG = "result.store.file.path";
  public static final String DEFAULT_RESULT_STORE_FILE_PATH = "logs/monitoring_results.jsonl";
  private static final Gson GSON = new GsonBuilder().serializeNulls().serializeSpecialFloatingPointValues().create();
  private Path _path;

  public JsonLinesResultStore() {
    this(Paths.get(DEFAULT_RESULT_STORE_FILE_PATH));
  }

  public JsonLinesResultStore(Path path) {
    _path = path;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    Object path = configs.get(RESULT_STORE_FILE_PATH_CONFIG);
    if (path != null) {
      _path = Paths.get(path.toString());
    }
    LOG.info("Saving monitoring cycle results to {}.", _path.toAbsolutePath());
  }

  @Override
  public synchronized void append(CycleResult cycleResult) throws IOException {
    Path parent = _path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    String line = GSON.toJson(cycleResult.getJsonStructure()) + "\n";
    Files.write(_path, line.getBytes(StandardCharsets.UTF_8), StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  public Path path() {
    return _path;
  }
}
