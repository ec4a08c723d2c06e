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
package net.pointzilla.transform;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.pointzilla.data.Point;

/**
 * Applies, in order: the ignore flags, grade mapping, qualifier mapping,
 * realignment and duplicate removal. Gaps pass the first three steps
 * untouched. Points are never reordered.
 *
 * @since 1.0
 */
public class PointTransformer {
  private static final Logger LOG = LoggerFactory.getLogger(
      PointTransformer.class);

  private final TransformOptions options;

  /**
   * Default ctor.
   * @param options The non-null options.
   */
  public PointTransformer(final TransformOptions options) {
    if (options == null) {
      throw new IllegalArgumentException("Options cannot be null.");
    }
    this.options = options;
  }

  /**
   * @param points The non-null points in source order.
   * @return A new list with the transformed points.
   */
  public List<Point> transform(final List<Point> points) {
    List<Point> result = Lists.newArrayListWithCapacity(points.size());
    for (final Point point : points) {
      result.add(annotate(point));
    }
    if (options.realignTo() != null) {
      result = realign(result, options.realignTo());
    }
    if (options.removeDuplicates()) {
      result = removeDuplicates(result);
    }
    return result;
  }

  /** Steps 1 to 3 for a single point. */
  Point annotate(final Point point) {
    if (point.isGap()) {
      return point;
    }
    final boolean grades = options.ignoreGrades()
        || options.gradeMapping().isEnabled();
    final boolean qualifiers = options.ignoreQualifiers()
        || options.qualifierMapping().isEnabled();
    if (!grades && !qualifiers) {
      return point;
    }

    final Point.Builder builder = Point.newBuilder(point);
    Integer grade_code = options.ignoreGrades() ? null : point.gradeCode();
    if (options.gradeMapping().isEnabled()) {
      grade_code = options.gradeMapping().map(grade_code);
    }
    builder.setGradeCode(grade_code);

    List<String> mapped = options.ignoreQualifiers() ?
        ImmutableList.<String>of() : point.qualifiers().asList();
    if (options.qualifierMapping().isEnabled()) {
      mapped = options.qualifierMapping().map(mapped).asList();
    }
    builder.setQualifiers(mapped);
    return builder.build();
  }

  /**
   * Shifts every point by the distance from the first point to the target,
   * keeping the spacing.
   * @param points The non-null points.
   * @param target Where the first point should land.
   * @return The shifted points.
   */
  static List<Point> realign(final List<Point> points, final Instant target) {
    if (points.isEmpty()) {
      return points;
    }
    final Duration shift = Duration.between(points.get(0).time(), target);
    if (shift.isZero()) {
      return points;
    }
    final List<Point> shifted = Lists.newArrayListWithCapacity(points.size());
    for (final Point point : points) {
      shifted.add(Point.newBuilder(point)
          .setTime(point.time().plus(shift))
          .build());
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Realigned " + points.size() + " points by " + shift);
    }
    return shifted;
  }

  /**
   * Drops a value point when its time equals the time of the previously kept
   * value point. Gaps are always kept.
   * @param points The non-null points.
   * @return The retained points.
   */
  static List<Point> removeDuplicates(final List<Point> points) {
    final List<Point> retained = Lists.newArrayListWithCapacity(points.size());
    Instant last_value_time = null;
    for (final Point point : points) {
      if (point.isGap()) {
        retained.add(point);
        continue;
      }
      if (point.time().equals(last_value_time)) {
        continue;
      }
      last_value_time = point.time();
      retained.add(point);
    }
    final int removed = points.size() - retained.size();
    if (removed > 0) {
      LOG.info("Removed " + removed + " duplicate points");
    }
    return retained;
  }
}
