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
package net.pointzilla.sources;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.OptionalDouble;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.pointzilla.data.Point;

/**
 * Points typed on the command line. Each literal is placed at a running
 * clock that starts at the configured start time and advances by the
 * interval after every literal, gaps included.
 *
 * @since 1.0
 */
public class ManualPointCollector implements PointSource {
  private final Instant start_time;
  private final Duration interval;

  /** A value or, when empty, a gap. */
  private final ImmutableList<OptionalDouble> literals;

  private final Integer grade_code;
  private final ImmutableList<String> qualifiers;

  /**
   * Default ctor.
   * @param start_time The non-null time of the first literal.
   * @param interval The non-null clock advance per literal.
   * @param literals The literals in argument order. An empty optional is a
   * gap.
   * @param grade_code An optional grade applied to every value.
   * @param qualifiers Optional qualifiers applied to every value.
   */
  public ManualPointCollector(final Instant start_time,
                              final Duration interval,
                              final List<OptionalDouble> literals,
                              final Integer grade_code,
                              final Collection<String> qualifiers) {
    if (start_time == null) {
      throw new IllegalArgumentException("Start time cannot be null.");
    }
    if (interval == null) {
      throw new IllegalArgumentException("Interval cannot be null.");
    }
    this.start_time = start_time;
    this.interval = interval;
    this.literals = literals == null ?
        ImmutableList.of() : ImmutableList.copyOf(literals);
    this.grade_code = grade_code;
    this.qualifiers = qualifiers == null ?
        ImmutableList.of() : ImmutableList.copyOf(qualifiers);
  }

  /** @return True if there are no literals. */
  public boolean isEmpty() {
    return literals.isEmpty();
  }

  @Override
  public String describe() {
    return literals.size() + " manual points";
  }

  @Override
  public List<Point> load() {
    final List<Point> points = Lists.newArrayListWithCapacity(literals.size());
    Instant clock = start_time;
    for (final OptionalDouble literal : literals) {
      if (literal.isPresent()) {
        points.add(Point.newBuilder()
            .setTime(clock)
            .setValue(literal.getAsDouble())
            .setGradeCode(grade_code)
            .setQualifiers(qualifiers)
            .build());
      } else {
        points.add(Point.gap(clock));
      }
      clock = clock.plus(interval);
    }
    return points;
  }
}
