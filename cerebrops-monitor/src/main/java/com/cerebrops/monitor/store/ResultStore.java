/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.store;

import com.cerebrops.monitor.config.CerebrOpsConfigurable;
import com.cerebrops.monitor.cycle.CycleResult;
import java.io.IOException;


/**
 * Append-only durable log of monitoring cycle results.
 */
public interface ResultStore extends CerebrOpsConfigurable {

  /**
   * @param cycleResult Result of a completed monitoring cycle.
   * @throws IOException If the result could not be persisted.
   */
  void append(CycleResult cycleResult) throws IOException;
}
