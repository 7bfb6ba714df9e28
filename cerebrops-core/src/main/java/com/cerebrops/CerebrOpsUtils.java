/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalUnit;


/**
 * Utils class for CerebrOps
 */
public final class CerebrOpsUtils {

  private CerebrOpsUtils() {

  }

  /**
   * Ensure the given object is not null.
   *
   * @param o Object to check.
   * @param message Message of the exception thrown if the object is null.
   * @param <T> Type of the object.
   * @return The given object.
   */
  public static <T> T validateNotNull(T o, String message) {
    if (o == null) {
      throw new IllegalArgumentException(message);
    }
    return o;
  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The date for the given time in ISO 8601 format with date, hour, minute, and seconds.
   */
  public static String utcDateFor(long timeMs) {
    return utcDateFor(timeMs, 0, ChronoUnit.SECONDS);
  }

  /**
   * @param timeMs Time in milliseconds.
   * @param precision requested time precision used in {@link DateTimeFormatterBuilder#appendInstant()}
   *        i.e: 0 for seconds precision, 3 for milliseconds, 6 for microseconds etc...
   * @param roundTo round the provided time to the provided {@link TemporalUnit}
   * @return The date for the given time in ISO 8601 format with provided precision (not truncated even if 0)
   */
  public static String utcDateFor(long timeMs, int precision, TemporalUnit roundTo) {
    DateTimeFormatter formatter = new DateTimeFormatterBuilder().appendInstant(precision).toFormatter();
    return formatter.format(Instant.ofEpochMilli(timeMs).truncatedTo(roundTo));
  }

  /**
   * Round the exact binary value of the given double half-even to the given number of decimal places, so that e.g.
   * {@code 2.675} (stored as 2.67499...) rounds to {@code 2.67}.
   *
   * @param value Value to round.
   * @param places Number of decimal places to keep.
   * @return The rounded value, or the value itself if it is not finite.
   */
  public static double round(double value, int places) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return value;
    }
    return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
  }
}
