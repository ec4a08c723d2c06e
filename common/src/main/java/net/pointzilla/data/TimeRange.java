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
package net.pointzilla.data;

import java.time.Instant;

import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.pointzilla.utils.DateTime;

/**
 * A closed interval of time, {@code [start, end]}, used as the overwrite
 * range of an append request.
 *
 * @since 1.0
 */
public final class TimeRange {
  private final Instant start;
  private final Instant end;

  /**
   * Default ctor.
   * @param start A non-null start instant.
   * @param end A non-null end instant, equal to or after the start.
   * @throws IllegalArgumentException if either is null or the end is before
   * the start.
   */
  public TimeRange(final Instant start, final Instant end) {
    if (start == null || end == null) {
      throw new IllegalArgumentException("Time range bounds cannot be null.");
    }
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("Time range end " + end
          + " is before the start " + start);
    }
    this.start = start;
    this.end = end;
  }

  /** @return The start of the range, inclusive. */
  public Instant start() {
    return start;
  }

  /** @return The end of the range, inclusive. */
  public Instant end() {
    return end;
  }

  /**
   * @param time A non-null instant.
   * @return True if the instant is within the range, inclusive.
   */
  public boolean contains(final Instant time) {
    return !time.isBefore(start) && !time.isAfter(end);
  }

  /**
   * Parses an interval in the {@code start/end} form where each side is a
   * timestamp accepted by {@link DateTime#parseInstant(String, java.time.ZoneId)}.
   * Since a side may itself contain slashes, e.g. {@code 2024/01/01}, the
   * interval is split at the first slash that leaves two parseable sides.
   * @param interval The non-null and non-empty interval.
   * @return The parsed range.
   * @throws IllegalArgumentException if the interval could not be parsed.
   */
  public static TimeRange parse(final String interval) {
    if (Strings.isNullOrEmpty(interval)) {
      throw new IllegalArgumentException("Time range cannot be null or empty.");
    }
    IllegalArgumentException last = null;
    int idx = interval.indexOf('/');
    while (idx >= 0) {
      final String start = interval.substring(0, idx).trim();
      final String end = interval.substring(idx + 1).trim();
      if (!start.isEmpty() && !end.isEmpty()) {
        final Instant start_time;
        final Instant end_time;
        try {
          start_time = DateTime.parseInstant(start, null);
          end_time = DateTime.parseInstant(end, null);
        } catch (IllegalArgumentException e) {
          last = e;
          idx = interval.indexOf('/', idx + 1);
          continue;
        }
        return new TimeRange(start_time, end_time);
      }
      idx = interval.indexOf('/', idx + 1);
    }
    throw new IllegalArgumentException("Invalid time range '" + interval
        + "'. Expected <start>/<end>", last);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeRange other = (TimeRange) o;
    return Objects.equal(start, other.start)
        && Objects.equal(end, other.end);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(start, end);
  }

  @Override
  public String toString() {
    return start + "/" + end;
  }
}
