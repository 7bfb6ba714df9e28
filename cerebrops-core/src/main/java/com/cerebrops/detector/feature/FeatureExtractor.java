/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector.feature;

import com.cerebrops.exception.ValidationException;
import com.cerebrops.sampling.MetricField;
import com.cerebrops.sampling.MetricSample;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Converts metric samples into numeric feature vectors.
 *
 * <p>Every vector starts with the {@link MetricField canonical fields} in their declared order. Missing or
 * non-numeric values become {@code 0.0}. When calendar features are requested, the hour of day (0-23) and the day
 * of week (0 = Monday, 6 = Sunday) of the sample timestamp are appended; a sample whose timestamp is absent or
 * unparsable gets {@link #DEFAULT_HOUR_OF_DAY} and {@link #DEFAULT_DAY_OF_WEEK}.</p>
 */
public class FeatureExtractor {
  private static final Logger LOG = LoggerFactory.getLogger(FeatureExtractor.class);
  public static final int NUM_CANONICAL_FEATURES = MetricField.cachedValues().size();
  public static final int NUM_CALENDAR_FEATURES = 2;
  public static final double DEFAULT_HOUR_OF_DAY = 12.0;
  public static final double DEFAULT_DAY_OF_WEEK = 1.0;

  /**
   * Extract features, including calendar features if and only if at least one sample carries a timestamp.
   *
   * @param samples Samples to extract features from.
   * @return The feature matrix, one row per sample.
   */
  public FeatureMatrix extract(List<MetricSample> samples) throws ValidationException {
    boolean includeCalendar = samples.stream().anyMatch(s -> s != null && s.hasTimestamp());
    return extract(samples, includeCalendar);
  }

  /**
   * @param samples Samples to extract features from.
   * @param includeCalendar True to append hour of day and day of week to every vector.
   * @return The feature matrix, one row per sample.
   */
  public FeatureMatrix extract(List<MetricSample> samples, boolean includeCalendar) throws ValidationException {
    int numFeatures = numFeatures(includeCalendar);
    double[][] rows = new double[samples.size()][];
    int numInvalidTimestamps = 0;
    for (int i = 0; i < samples.size(); i++) {
      MetricSample sample = samples.get(i);
      if (sample == null) {
        throw new ValidationException(String.format("Metric sample at index %d is null.", i));
      }
      double[] row = new double[numFeatures];
      int f = 0;
      for (MetricField field : MetricField.cachedValues()) {
        row[f++] = toDouble(sample.rawValue(field));
      }
      if (includeCalendar) {
        LocalDateTime time = parseTimestamp(sample.timestamp());
        if (time == null) {
          numInvalidTimestamps++;
          row[f++] = DEFAULT_HOUR_OF_DAY;
          row[f] = DEFAULT_DAY_OF_WEEK;
        } else {
          row[f++] = time.getHour();
          row[f] = time.getDayOfWeek().getValue() - DayOfWeek.MONDAY.getValue();
        }
      }
      rows[i] = row;
    }
    if (numInvalidTimestamps > 0) {
      LOG.debug("{} of {} samples had a missing or unparsable timestamp.", numInvalidTimestamps, samples.size());
    }
    return new FeatureMatrix(rows, numFeatures, includeCalendar);
  }

  /**
   * @param includeCalendar True if calendar features are included.
   * @return Width of the feature vectors.
   */
  public static int numFeatures(boolean includeCalendar) {
    return NUM_CANONICAL_FEATURES + (includeCalendar ? NUM_CALENDAR_FEATURES : 0);
  }

  /**
   * Coerce a raw field value to a double.
   *
   * @param raw Raw value.
   * @return The numeric value, 1 or 0 for a boolean, or {@code 0.0} if the value is absent, non-numeric or not finite.
   */
  public static double toDouble(Object raw) {
    double value;
    if (raw instanceof Number) {
      value = ((Number) raw).doubleValue();
    } else if (raw instanceof Boolean) {
      return (Boolean) raw ? 1.0 : 0.0;
    } else if (raw instanceof String) {
      try {
        value = Double.parseDouble(((String) raw).trim());
      } catch (NumberFormatException nfe) {
        return 0.0;
      }
    } else {
      return 0.0;
    }
    return Double.isFinite(value) ? value : 0.0;
  }

  /**
   * Parse a raw timestamp as a UTC wall-clock time. Epoch milliseconds and ISO-8601 strings with or without an
   * offset or zone are accepted; a space may separate date and time.
   *
   * @param raw Raw timestamp.
   * @return The parsed time, or null if the timestamp is absent, unparsable or out of range.
   */
  static LocalDateTime parseTimestamp(Object raw) {
    if (raw instanceof Number) {
      try {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Number) raw).longValue()), ZoneOffset.UTC);
      } catch (DateTimeException e) {
        LOG.trace("Epoch timestamp {} is out of range.", raw);
        return null;
      }
    }
    if (!(raw instanceof String)) {
      return null;
    }
    String text = ((String) raw).trim();
    if (text.length() > 10 && text.charAt(10) == ' ') {
      text = text.substring(0, 10) + 'T' + text.substring(11);
    }
    try {
      return LocalDateTime.parse(text);
    } catch (DateTimeException e) {
      LOG.trace("Timestamp {} is not a local date time.", text);
    }
    try {
      return ZonedDateTime.parse(text).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    } catch (DateTimeException e) {
      LOG.trace("Timestamp {} is not a zoned date time.", text);
    }
    try {
      return LocalDate.parse(text).atStartOfDay();
    } catch (DateTimeException e) {
      LOG.trace("Timestamp {} is not a date.", text);
      return null;
    }
  }
}
