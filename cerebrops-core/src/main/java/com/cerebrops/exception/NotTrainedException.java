/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.exception;

/**
 * Thrown when detection or scaling is requested before a model has been trained.
 */
public class NotTrainedException extends CerebrOpsException {

  public NotTrainedException(String message, Throwable cause) {
    super(message, cause);
  }

  public NotTrainedException(String message) {
    super(message);
  }
}
