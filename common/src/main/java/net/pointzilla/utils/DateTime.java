// This file is part of PointZilla.
// Copyright (C) 2026  The PointZilla Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pointzilla.utils;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Strings;

/**
 * Utility class that provides helpers for dealing with dates, timestamps and
 * durations given on the command line or in input files.
 *
 * @since 1.0
 */
public class DateTime {
  /** ID of the UTC timezone */
  public static final String UTC_ID = "UTC";

  /** {@code yyyy/MM/dd}, optionally followed by {@code -HH:mm[:ss]} or
   * {@code  HH:mm[:ss]}. */
  private static final DateTimeFormatter SLASH_FORMAT =
      new DateTimeFormatterBuilder()
        .appendPattern("uuuu/MM/dd[-HH:mm[:ss]][ HH:mm[:ss]]")
        .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
        .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
        .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
        .toFormatter();

  /** {@code [d.]hh:mm:ss[.fffffff]} */
  private static final Pattern TIMESPAN = Pattern.compile(
      "^(-)?(?:(\\d+)\\.)?(\\d{1,2}):(\\d{1,2})(?::(\\d{1,2})(?:\\.(\\d{1,9}))?)?$");

  /**
   * Attempts to parse an instant from a given string.
   * Formats accepted are:
   * <ul>
   * <li>{@code now} and relative: {@code 5m-ago}, {@code 1h-ago}, etc. See
   * {@link #parseDuration}</li>
   * <li>ISO-8601 with an offset or zone: {@code 2024-03-01T10:00:00Z},
   * {@code 2024-03-01T10:00:00-08:00}</li>
   * <li>ISO-8601 without an offset, interpreted in the given zone:
   * {@code 2024-03-01T10:00:00}, {@code 2024-03-01}</li>
   * <li>Absolute human readable dates: {@code yyyy/MM/dd-HH:mm:ss},
   * {@code yyyy/MM/dd HH:mm}, {@code yyyy/MM/dd}</li>
   * <li>Unix timestamps in seconds or milliseconds: {@code 1355961600},
   * {@code 1355961600000}, {@code 1355961600.000}, {@code 1355961600000ms}</li>
   * </ul>
   * @param datetime The string to parse a value for
   * @param zone The zone for timestamps without an offset. UTC when null.
   * @return The parsed instant.
   * @throws IllegalArgumentException if the string was null, empty or
   * malformed.
   */
  public static Instant parseInstant(final String datetime,
                                     final ZoneId zone) {
    if (Strings.isNullOrEmpty(datetime) || datetime.trim().isEmpty()) {
      throw new IllegalArgumentException("Date time cannot be null or empty.");
    }
    final String trimmed = datetime.trim();
    final ZoneId tz = zone == null ? ZoneOffset.UTC : zone;

    if (trimmed.equalsIgnoreCase("now")) {
      return Instant.ofEpochMilli(currentTimeMillis());
    }

    if (trimmed.toLowerCase().endsWith("-ago")) {
      final Duration interval = parseDuration(
          trimmed.substring(0, trimmed.length() - 4));
      return Instant.ofEpochMilli(currentTimeMillis()).minus(interval);
    }

    if (trimmed.matches("^[0-9]+ms$")) {
      return Instant.ofEpochMilli(Long.parseLong(
          trimmed.substring(0, trimmed.length() - 2)));
    }

    if (trimmed.matches("^[0-9]+(\\.[0-9]+)?$")) {
      return parseEpoch(trimmed);
    }

    if (trimmed.contains("/")) {
      try {
        return LocalDateTime.parse(trimmed, SLASH_FORMAT).atZone(tz).toInstant();
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("Invalid date: " + datetime
            + ". " + e.getMessage(), e);
      }
    }

    try {
      if (trimmed.indexOf('T') < 0 && trimmed.indexOf('t') < 0) {
        return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE)
            .atStartOfDay(tz)
            .toInstant();
      }
      final TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
          .parseBest(trimmed, ZonedDateTime::from, LocalDateTime::from);
      if (parsed instanceof ZonedDateTime) {
        return ((ZonedDateTime) parsed).toInstant();
      }
      return ((LocalDateTime) parsed).atZone(tz).toInstant();
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid date: " + datetime, e);
    }
  }

  /**
   * Parses a Unix epoch timestamp in seconds (up to 10 digits, optionally
   * with up to 3 fractional digits) or milliseconds.
   * @param datetime The digits.
   * @return The instant.
   */
  private static Instant parseEpoch(final String datetime) {
    // [0-9]{10} ten digits
    // \\. a dot
    // [0-9]{1,3} one to three digits
    if (datetime.contains(".")) {
      if (!datetime.matches("^[0-9]{10}\\.[0-9]{1,3}$")) {
        throw new IllegalArgumentException("Invalid time: " + datetime
            + ". Millisecond timestamps must be in the format "
            + "<seconds>.<ms> where the milliseconds are limited to 3 digits");
      }
      final int dot = datetime.indexOf('.');
      final String ms = Strings.padEnd(datetime.substring(dot + 1), 3, '0');
      return Instant.ofEpochMilli(
          Long.parseLong(datetime.substring(0, dot)) * 1000
          + Long.parseLong(ms));
    }
    try {
      final long time = Long.parseLong(datetime);
      // seconds until November 2286
      if (datetime.length() <= 10) {
        return Instant.ofEpochSecond(time);
      }
      return Instant.ofEpochMilli(time);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid time: " + datetime
          + ". " + e.getMessage(), e);
    }
  }

  /**
   * Parses a duration. Formats supported:
   * <ul>
   * <li>A human-readable duration, e.g. {@code 500ms}, {@code 30s},
   * {@code 10m}, {@code 3h}, {@code 14d}, {@code 2w}</li>
   * <li>A time span, {@code [-][d.]hh:mm[:ss[.fffffff]]}, e.g.
   * {@code 00:01:00} or {@code 1.12:00:00}</li>
   * <li>ISO-8601, e.g. {@code PT5M}</li>
   * </ul>
   * @param duration The duration to parse.
   * @return The parsed duration. May be zero but is never negative unless
   * given as a negative time span.
   * @throws IllegalArgumentException if the duration was malformed.
   */
  public static Duration parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration) || duration.trim().isEmpty()) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    final String trimmed = duration.trim();

    if (trimmed.startsWith("P") || trimmed.startsWith("p")
        || trimmed.startsWith("-P") || trimmed.startsWith("-p")) {
      try {
        return Duration.parse(trimmed);
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("Invalid duration: " + duration, e);
      }
    }

    final Matcher span = TIMESPAN.matcher(trimmed);
    if (span.matches()) {
      Duration parsed = Duration.ofDays(
          span.group(2) == null ? 0 : Long.parseLong(span.group(2)))
          .plusHours(Long.parseLong(span.group(3)))
          .plusMinutes(Long.parseLong(span.group(4)));
      if (span.group(5) != null) {
        parsed = parsed.plusSeconds(Long.parseLong(span.group(5)));
      }
      if (span.group(6) != null) {
        parsed = parsed.plusNanos(
            Long.parseLong(Strings.padEnd(span.group(6), 9, '0')));
      }
      return span.group(1) != null ? parsed.negated() : parsed;
    }

    int unit = 0;
    while (unit < trimmed.length() && Character.isDigit(trimmed.charAt(unit))) {
      unit++;
    }
    if (unit == 0 || unit >= trimmed.length()) {
      throw new IllegalArgumentException("Invalid duration, must have an "
          + "integer and unit: " + duration);
    }
    final long interval;
    try {
      interval = Long.parseLong(trimmed.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): "
          + duration, e);
    }
    final ChronoUnit units = unitsToChronoUnit(trimmed.substring(unit));
    try {
      if (units == ChronoUnit.WEEKS) {
        return Duration.ofDays(Math.multiplyExact(interval, 7L));
      }
      return Duration.of(interval, units);
    } catch (DateTimeException | ArithmeticException e) {
      throw new IllegalArgumentException("Invalid duration: " + duration, e);
    }
  }

  /**
   * Converts the given units to a {@link ChronoUnit} with an exact
   * duration.
   * @param units The units as a string.
   * @return A {@link ChronoUnit} if the units were recognized, an exception
   * if not.
   * @throws IllegalArgumentException if the units were not recognized.
   */
  public static ChronoUnit unitsToChronoUnit(final String units) {
    if (Strings.isNullOrEmpty(units)) {
      throw new IllegalArgumentException("Units cannot be null or empty");
    }

    final String lc = units.toLowerCase();
    if (lc.equals("ms")) {
      return ChronoUnit.MILLIS;
    } else if (lc.equals("s")) {
      return ChronoUnit.SECONDS;
    } else if (lc.equals("m")) {
      return ChronoUnit.MINUTES;
    } else if (lc.equals("h")) {
      return ChronoUnit.HOURS;
    } else if (lc.equals("d")) {
      return ChronoUnit.DAYS;
    } else if (lc.equals("w")) {
      return ChronoUnit.WEEKS;
    }
    throw new IllegalArgumentException("Unrecognized unit type: " + units);
  }

  /**
   * Parses a zone ID or offset.
   * @param zone The zone, e.g. {@code UTC}, {@code America/Vancouver} or
   * {@code -08:00}. Null or empty returns UTC.
   * @return The zone.
   * @throws IllegalArgumentException if the zone was not recognized.
   */
  public static ZoneId parseZone(final String zone) {
    if (Strings.isNullOrEmpty(zone)) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(zone.trim());
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("Invalid timezone: " + zone, e);
    }
  }

  /**
   * Pass through to {@link System#currentTimeMillis} for use in classes to
   * make unit testing easier.
   * @return The current epoch time in milliseconds
   */
  public static long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  /**
   * Pass through to {@link System#nanoTime} for use in classes to
   * make unit testing easier.
   * @return The current nanosecond clock reading
   */
  public static long nanoTime() {
    return System.nanoTime();
  }

  /**
   * Calculates the difference between two values and returns the time in
   * milliseconds as a double.
   * @param end The end timestamp
   * @param start The start timestamp
   * @return The value in milliseconds
   * @throws IllegalArgumentException if end is less than start
   */
  public static double msFromNanoDiff(final long end, final long start) {
    if (end < start) {
      throw new IllegalArgumentException("End (" + end + ") cannot be less "
          + "than start (" + start + ")");
    }
    return ((double) end - (double) start) / 1000000;
  }
}
