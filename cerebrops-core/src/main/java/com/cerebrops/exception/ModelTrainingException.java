/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.exception;

/**
 * Thrown when fitting the scaler or the isolation forest fails unexpectedly.
 */
public class ModelTrainingException extends CerebrOpsException {

  public ModelTrainingException(String message, Throwable cause) {
    super(message, cause);
  }

  public ModelTrainingException(String message) {
    super(message);
  }
}
