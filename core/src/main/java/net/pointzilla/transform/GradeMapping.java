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

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.pointzilla.exceptions.ConfigurationException;

/**
 * Sparse mapping of source grade codes to replacement grades, expanded from
 * {@code low,high:mapped} rules when the run is configured. A rule with an
 * empty source, {@code :mapped}, sets the grade for everything not listed.
 * An empty mapped value means "no grade".
 * <p>
 * Mapping is all or nothing: once a rule is registered every value point's
 * grade goes through {@link #map(Integer)}.
 *
 * @since 1.0
 */
public final class GradeMapping {
  private static final Splitter RULE = Splitter.on(':').limit(2).trimResults();
  private static final Splitter RANGE = Splitter.on(',').limit(2).trimResults();

  /** The most source grades a single range rule may cover. */
  public static final int MAX_RANGE_SIZE = 10000;

  private static final GradeMapping DISABLED = new GradeMapping(
      ImmutableMap.of(), Optional.empty(), false);

  /** Source grade to mapped grade, empty for no grade. */
  private final ImmutableMap<Integer, Optional<Integer>> grades;

  /** The grade of unlisted source grades. */
  private final Optional<Integer> default_grade;

  private final boolean enabled;

  private GradeMapping(final Map<Integer, Optional<Integer>> grades,
                       final Optional<Integer> default_grade,
                       final boolean enabled) {
    this.grades = ImmutableMap.copyOf(grades);
    this.default_grade = default_grade;
    this.enabled = enabled;
  }

  /** @return A mapping that leaves grades alone. */
  public static GradeMapping disabled() {
    return DISABLED;
  }

  /** @return True if any rule was registered. */
  public boolean isEnabled() {
    return enabled;
  }

  /**
   * @param source The source grade, may be null.
   * @return The mapped grade, the default when the source is unlisted or
   * null, and null for "no grade".
   */
  public Integer map(final Integer source) {
    if (!enabled) {
      return source;
    }
    if (source != null) {
      final Optional<Integer> mapped = grades.get(source);
      if (mapped != null) {
        return mapped.orElse(null);
      }
    }
    return default_grade.orElse(null);
  }

  /** @return How many source grades have an explicit entry. */
  public int size() {
    return grades.size();
  }

  @Override
  public String toString() {
    return enabled ? "grades=" + grades + ", default=" + default_grade : "disabled";
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<Integer, Optional<Integer>> grades = Maps.newHashMap();
    private Optional<Integer> default_grade = Optional.empty();
    private boolean enabled;

    private Builder() { }

    /**
     * Adds a rule in {@code low[,high]:mapped} or {@code :mapped} syntax.
     * The bounds may be in either order. Later rules win.
     * @param rule The non-null rule.
     * @return The builder.
     * @throws ConfigurationException if the rule is malformed.
     */
    public Builder addRule(final String rule) {
      if (rule == null || rule.indexOf(':') < 0) {
        throw new ConfigurationException("'" + rule
            + "' is not in sourceValue:mappedValue syntax.");
      }
      final List<String> parts = RULE.splitToList(rule);
      final Integer mapped = parts.get(1).isEmpty() ? null : parse(parts.get(1), rule);
      if (parts.get(0).isEmpty()) {
        setDefault(mapped);
        return this;
      }
      final List<String> bounds = RANGE.splitToList(parts.get(0));
      final int first = parse(bounds.get(0), rule);
      final int second = bounds.size() > 1 ? parse(bounds.get(1), rule) : first;
      return addRange(Math.min(first, second), Math.max(first, second), mapped);
    }

    /**
     * Maps every grade from low to high inclusive.
     * @param low The low bound.
     * @param high The high bound, not less than the low bound.
     * @param mapped The mapped grade or null for no grade.
     * @return The builder.
     * @throws ConfigurationException if the range is reversed or wider than
     * {@link #MAX_RANGE_SIZE}.
     */
    public Builder addRange(final int low, final int high, final Integer mapped) {
      if (high < low) {
        throw new ConfigurationException("Grade range " + low + "," + high
            + " is reversed.");
      }
      if ((long) high - low + 1 > MAX_RANGE_SIZE) {
        throw new ConfigurationException("Grade range " + low + "," + high
            + " covers more than " + MAX_RANGE_SIZE + " grades.");
      }
      for (long grade = low; grade <= high; grade++) {
        grades.put((int) grade, Optional.ofNullable(mapped));
      }
      enabled = true;
      return this;
    }

    /**
     * @param mapped The grade for unlisted source grades or null for no grade.
     * @return The builder.
     */
    public Builder setDefault(final Integer mapped) {
      default_grade = Optional.ofNullable(mapped);
      enabled = true;
      return this;
    }

    public GradeMapping build() {
      if (!enabled) {
        return DISABLED;
      }
      return new GradeMapping(grades, default_grade, true);
    }

    private static int parse(final String text, final String rule) {
      try {
        return Integer.parseInt(text);
      } catch (NumberFormatException e) {
        throw new ConfigurationException("'" + rule
            + "' is not in sourceValue:mappedValue syntax.", e);
      }
    }
  }
}
