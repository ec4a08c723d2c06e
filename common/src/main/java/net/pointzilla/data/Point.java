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
import java.util.Collection;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSet;

/**
 * A single immutable time-series observation. A {@link PointType#VALUE} point
 * always has a value and may carry a grade code and an ordered set of
 * qualifiers. A {@link PointType#GAP} point only has a time.
 * <p>
 * Use {@link #newBuilder()} or {@link #newBuilder(Point)} to construct.
 *
 * @since 1.0
 */
public final class Point {
  /** The time of the observation. */
  private final Instant time;

  /** Whether this is a value or gap. */
  private final PointType type;

  /** The value, NaN for gaps. */
  private final double value;

  /** An optional grade code. */
  private final Integer grade_code;

  /** Insertion ordered, de-duplicated qualifiers. */
  private final ImmutableSet<String> qualifiers;

  /**
   * Protected ctor.
   * @param builder A non-null builder.
   */
  private Point(final Builder builder) {
    if (builder.time == null) {
      throw new IllegalArgumentException("Point time cannot be null.");
    }
    time = builder.time;
    type = builder.type;
    if (type == PointType.GAP) {
      value = Double.NaN;
      grade_code = null;
      qualifiers = ImmutableSet.of();
    } else {
      if (builder.value == null) {
        throw new IllegalArgumentException("A value point must have a value.");
      }
      value = builder.value;
      grade_code = builder.grade_code;
      qualifiers = builder.qualifiers == null ?
          ImmutableSet.of() : builder.qualifiers.build();
    }
  }

  /** @return The non-null time of the point. */
  public Instant time() {
    return time;
  }

  /** @return The non-null type of the point. */
  public PointType type() {
    return type;
  }

  /** @return True if the point is a gap marker. */
  public boolean isGap() {
    return type == PointType.GAP;
  }

  /** @return The value of the point, NaN for gaps. */
  public double value() {
    return value;
  }

  /** @return The grade code if set, null if not. Always null for gaps. */
  public Integer gradeCode() {
    return grade_code;
  }

  /** @return The non-null, possibly empty, qualifiers. */
  public ImmutableSet<String> qualifiers() {
    return qualifiers;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Point other = (Point) o;
    return Objects.equal(time, other.time)
        && type == other.type
        && Double.compare(value, other.value) == 0
        && Objects.equal(grade_code, other.grade_code)
        && Objects.equal(qualifiers.asList(), other.qualifiers.asList());
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(time, type, value, grade_code, qualifiers);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append("time=")
        .append(time);
    if (type == PointType.GAP) {
      return buf.append(", type=GAP").toString();
    }
    buf.append(", value=")
       .append(value);
    if (grade_code != null) {
      buf.append(", grade=")
         .append(grade_code);
    }
    if (!qualifiers.isEmpty()) {
      buf.append(", qualifiers=")
         .append(Joiner.on(',').join(qualifiers));
    }
    return buf.toString();
  }

  /**
   * Shortcut for a gap point.
   * @param time A non-null time.
   * @return A gap point.
   */
  public static Point gap(final Instant time) {
    return newBuilder()
        .setTime(time)
        .setType(PointType.GAP)
        .build();
  }

  /**
   * Shortcut for a value point without grade or qualifiers.
   * @param time A non-null time.
   * @param value The value.
   * @return A value point.
   */
  public static Point value(final Instant time, final double value) {
    return newBuilder()
        .setTime(time)
        .setValue(value)
        .build();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-populated with the fields of the given point.
   * @param point A non-null point to clone.
   * @return A builder.
   */
  public static Builder newBuilder(final Point point) {
    final Builder builder = new Builder()
        .setTime(point.time)
        .setType(point.type)
        .setGradeCode(point.grade_code)
        .setQualifiers(point.qualifiers);
    if (point.type == PointType.VALUE) {
      builder.setValue(point.value);
    }
    return builder;
  }

  /** Builder for {@link Point}s. */
  public static final class Builder {
    private Instant time;
    private PointType type = PointType.VALUE;
    private Double value;
    private Integer grade_code;
    private ImmutableSet.Builder<String> qualifiers;

    private Builder() { }

    public Builder setTime(final Instant time) {
      this.time = time;
      return this;
    }

    public Builder setType(final PointType type) {
      this.type = type == null ? PointType.VALUE : type;
      return this;
    }

    /**
     * Sets the value. Does not change the type.
     * @param value The value.
     * @return The builder.
     */
    public Builder setValue(final double value) {
      this.value = value;
      return this;
    }

    public Builder setGradeCode(final Integer grade_code) {
      this.grade_code = grade_code;
      return this;
    }

    /**
     * Replaces any qualifiers with the given collection. Duplicates are
     * dropped and the first occurrence wins the ordering.
     * @param qualifiers A possibly null collection of qualifiers.
     * @return The builder.
     */
    public Builder setQualifiers(final Collection<String> qualifiers) {
      if (qualifiers == null || qualifiers.isEmpty()) {
        this.qualifiers = null;
        return this;
      }
      this.qualifiers = ImmutableSet.builder();
      this.qualifiers.addAll(qualifiers);
      return this;
    }

    public Builder addQualifier(final String qualifier) {
      if (qualifiers == null) {
        qualifiers = ImmutableSet.builder();
      }
      qualifiers.add(qualifier);
      return this;
    }

    public Point build() {
      return new Point(this);
    }
  }
}
