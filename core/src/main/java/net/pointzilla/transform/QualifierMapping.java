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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import net.pointzilla.exceptions.ConfigurationException;

/**
 * Sparse mapping of qualifiers from {@code source:mapped} rules. An empty
 * mapped value removes the source qualifier. A rule with an empty source,
 * {@code :A,B}, sets the qualifiers given to points that have none; an
 * empty list there means "no default".
 * <p>
 * Qualifiers without a rule are kept. As with grades, registering any rule
 * enables the mapping for the whole run.
 *
 * @since 1.0
 */
public final class QualifierMapping {
  private static final Splitter RULE = Splitter.on(':').limit(2).trimResults();
  private static final Splitter LIST = Splitter.on(',')
      .trimResults()
      .omitEmptyStrings();

  private static final QualifierMapping DISABLED = new QualifierMapping(
      ImmutableMap.of(), ImmutableList.of(), false);

  private final ImmutableMap<String, Optional<String>> qualifiers;
  private final ImmutableList<String> default_qualifiers;
  private final boolean enabled;

  private QualifierMapping(final Map<String, Optional<String>> qualifiers,
                           final List<String> default_qualifiers,
                           final boolean enabled) {
    this.qualifiers = ImmutableMap.copyOf(qualifiers);
    this.default_qualifiers = ImmutableList.copyOf(default_qualifiers);
    this.enabled = enabled;
  }

  /** @return A mapping that leaves qualifiers alone. */
  public static QualifierMapping disabled() {
    return DISABLED;
  }

  /** @return True if any rule was registered. */
  public boolean isEnabled() {
    return enabled;
  }

  /** @return The qualifiers for points without any. */
  public ImmutableList<String> defaultQualifiers() {
    return default_qualifiers;
  }

  /**
   * Maps each qualifier independently, keeping the order.
   * @param source The non-null source qualifiers.
   * @return The mapped qualifiers, or the defaults when the source is empty.
   */
  public ImmutableSet<String> map(final Collection<String> source) {
    if (!enabled) {
      return ImmutableSet.copyOf(source);
    }
    if (source.isEmpty()) {
      return ImmutableSet.copyOf(default_qualifiers);
    }
    final ImmutableSet.Builder<String> mapped = ImmutableSet.builder();
    for (final String qualifier : source) {
      final Optional<String> rule = qualifiers.get(qualifier);
      if (rule == null) {
        mapped.add(qualifier);
      } else {
        rule.ifPresent(mapped::add);
      }
    }
    return mapped.build();
  }

  @Override
  public String toString() {
    return enabled ? "qualifiers=" + qualifiers + ", default=" + default_qualifiers
        : "disabled";
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, Optional<String>> qualifiers = Maps.newHashMap();
    private List<String> default_qualifiers = ImmutableList.of();
    private boolean enabled;

    private Builder() { }

    /**
     * Adds a rule in {@code source:mapped} or {@code :default[,default]}
     * syntax. Later rules win.
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
      if (parts.get(0).isEmpty()) {
        return setDefault(LIST.splitToList(parts.get(1)));
      }
      return put(parts.get(0), parts.get(1).isEmpty() ? null : parts.get(1));
    }

    /**
     * @param source The non-empty source qualifier.
     * @param mapped The replacement or null to remove it.
     * @return The builder.
     */
    public Builder put(final String source, final String mapped) {
      if (source == null || source.isEmpty()) {
        throw new ConfigurationException("Source qualifier cannot be empty.");
      }
      qualifiers.put(source, Optional.ofNullable(mapped));
      enabled = true;
      return this;
    }

    /**
     * @param default_qualifiers The qualifiers for points without any.
     * @return The builder.
     */
    public Builder setDefault(final List<String> default_qualifiers) {
      this.default_qualifiers = default_qualifiers == null ?
          ImmutableList.of() : ImmutableList.copyOf(default_qualifiers);
      enabled = true;
      return this;
    }

    public QualifierMapping build() {
      if (!enabled) {
        return DISABLED;
      }
      return new QualifierMapping(qualifiers, default_qualifiers, true);
    }
  }
}
