/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.exception;

public class CerebrOpsException extends Exception {

  public CerebrOpsException(String message, Throwable cause) {
    super(message, cause);
  }

  public CerebrOpsException(String message) {
    super(message);
  }

  public CerebrOpsException(Throwable cause) {
    super(cause);
  }
}
