/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops;

import java.time.temporal.ChronoUnit;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CerebrOpsUtilsTest {

  @Test
  public void testRoundIsHalfEvenOnTheBinaryValue() {
    assertEquals(0.12, CerebrOpsUtils.round(0.125, 2), 0.0);
    assertEquals(0.38, CerebrOpsUtils.round(0.375, 2), 0.0);
    // Stored as 2.67499999..., so not a tie.
    assertEquals(2.67, CerebrOpsUtils.round(2.675, 2), 0.0);
    // Stored as 0.13500000000000000888..., so not a tie either.
    assertEquals(0.14, CerebrOpsUtils.round(0.135, 2), 0.0);
    assertEquals(33.33, CerebrOpsUtils.round(100.0 / 3, 2), 0.0);
    assertTrue(Double.isNaN(CerebrOpsUtils.round(Double.NaN, 2)));
    assertEquals(Double.POSITIVE_INFINITY, CerebrOpsUtils.round(Double.POSITIVE_INFINITY, 2), 0.0);
  }

  @Test
  public void testUtcDateFor() {
    assertEquals("2023-11-14T22:13:20Z", CerebrOpsUtils.utcDateFor(1_700_000_000_123L));
    assertEquals("2023-11-14T22:13:20.123Z", CerebrOpsUtils.utcDateFor(1_700_000_000_123L, 3, ChronoUnit.MILLIS));
  }
}
