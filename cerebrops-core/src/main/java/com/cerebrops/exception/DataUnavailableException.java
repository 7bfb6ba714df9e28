/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.exception;

/**
 * Thrown when no samples could be obtained for training or detection.
 */
public class DataUnavailableException extends CerebrOpsException {

  public DataUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public DataUnavailableException(String message) {
    super(message);
  }
}
