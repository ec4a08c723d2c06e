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

import java.time.Instant;

/**
 * The per-run settings of {@link PointTransformer}.
 *
 * @since 1.0
 */
public final class TransformOptions {
  private static final TransformOptions NONE = newBuilder().build();

  private final boolean ignore_grades;
  private final boolean ignore_qualifiers;
  private final GradeMapping grade_mapping;
  private final QualifierMapping qualifier_mapping;
  private final Instant realign_to;
  private final boolean remove_duplicates;

  private TransformOptions(final Builder builder) {
    ignore_grades = builder.ignore_grades;
    ignore_qualifiers = builder.ignore_qualifiers;
    grade_mapping = builder.grade_mapping == null ?
        GradeMapping.disabled() : builder.grade_mapping;
    qualifier_mapping = builder.qualifier_mapping == null ?
        QualifierMapping.disabled() : builder.qualifier_mapping;
    realign_to = builder.realign_to;
    remove_duplicates = builder.remove_duplicates;
  }

  /** @return Options that pass points through untouched. */
  public static TransformOptions none() {
    return NONE;
  }

  public boolean ignoreGrades() {
    return ignore_grades;
  }

  public boolean ignoreQualifiers() {
    return ignore_qualifiers;
  }

  public GradeMapping gradeMapping() {
    return grade_mapping;
  }

  public QualifierMapping qualifierMapping() {
    return qualifier_mapping;
  }

  /** @return Where the first point is moved to, null to keep times. */
  public Instant realignTo() {
    return realign_to;
  }

  public boolean removeDuplicates() {
    return remove_duplicates;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("ignoreGrades=").append(ignore_grades)
        .append(", ignoreQualifiers=").append(ignore_qualifiers)
        .append(", gradeMapping=").append(grade_mapping)
        .append(", qualifierMapping=").append(qualifier_mapping)
        .append(", realignTo=").append(realign_to)
        .append(", removeDuplicates=").append(remove_duplicates)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private boolean ignore_grades;
    private boolean ignore_qualifiers;
    private GradeMapping grade_mapping;
    private QualifierMapping qualifier_mapping;
    private Instant realign_to;
    private boolean remove_duplicates;

    private Builder() { }

    public Builder setIgnoreGrades(final boolean ignore_grades) {
      this.ignore_grades = ignore_grades;
      return this;
    }

    public Builder setIgnoreQualifiers(final boolean ignore_qualifiers) {
      this.ignore_qualifiers = ignore_qualifiers;
      return this;
    }

    public Builder setGradeMapping(final GradeMapping grade_mapping) {
      this.grade_mapping = grade_mapping;
      return this;
    }

    public Builder setQualifierMapping(final QualifierMapping qualifier_mapping) {
      this.qualifier_mapping = qualifier_mapping;
      return this;
    }

    public Builder setRealignTo(final Instant realign_to) {
      this.realign_to = realign_to;
      return this;
    }

    public Builder setRemoveDuplicates(final boolean remove_duplicates) {
      this.remove_duplicates = remove_duplicates;
      return this;
    }

    public TransformOptions build() {
      return new TransformOptions(this);
    }
  }
}
