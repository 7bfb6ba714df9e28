/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.exception;

/**
 * Thrown when there are fewer training samples than the minimum required to fit a model.
 */
public class InsufficientDataException extends CerebrOpsException {

  public InsufficientDataException(String message, Throwable cause) {
    super(message, cause);
  }

  public InsufficientDataException(String message) {
    super(message);
  }
}
