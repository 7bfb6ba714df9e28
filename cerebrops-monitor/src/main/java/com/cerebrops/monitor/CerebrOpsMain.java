/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor;

import com.cerebrops.monitor.config.CerebrOpsConfig;
import com.cerebrops.monitor.cycle.CycleResult;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.cerebrops.monitor.CerebrOpsMonitorUtils.readConfig;


/**
 * The main class to run CerebrOps.
 */
public final class CerebrOpsMain {
  private static final Logger LOG = LoggerFactory.getLogger(CerebrOpsMain.class);
  static final String SINGLE_CHECK_FLAG = "--single-check";

  private CerebrOpsMain() { }

  /**
   * The main function to run CerebrOps. With {@value #SINGLE_CHECK_FLAG}, one cycle is run and its result printed
   * as JSON; otherwise monitoring runs until the process is stopped.
   * @param args Arguments passed while starting CerebrOps.
   */
  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      throw new IllegalArgumentException(
              String.format("USAGE: java %s cerebrops.properties [%s]", CerebrOpsMain.class.getSimpleName(),
                            SINGLE_CHECK_FLAG));
    }

    Thread.setDefaultUncaughtExceptionHandler((t, e) -> LOG.error("Uncaught exception on thread {}", t, e));

    CerebrOpsConfig config = readConfig(args[0]);
    CerebrOpsMonitorApp app = new CerebrOpsMonitorApp(config);
    if (isSingleCheck(args)) {
      try {
        CycleResult result = app.runSingleCheck();
        Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().serializeSpecialFloatingPointValues().create();
        System.out.println(gson.toJson(result.getJsonStructure()));
      } finally {
        app.stop();
      }
    } else {
      app.registerShutdownHook();
      app.start();
    }
  }

  static boolean isSingleCheck(String[] args) {
    for (int i = 1; i < args.length; i++) {
      if (SINGLE_CHECK_FLAG.equals(args[i])) {
        return true;
      }
    }
    return false;
  }
}
