/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.exception;

/**
 * Thrown when a metrics provider cannot reach or parse the monitored application.
 */
public class ProviderFailureException extends CerebrOpsException {

  public ProviderFailureException(String message, Throwable cause) {
    super(message, cause);
  }

  public ProviderFailureException(String message) {
    super(message);
  }
}
