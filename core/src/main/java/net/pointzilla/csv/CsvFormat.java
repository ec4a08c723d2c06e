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
package net.pointzilla.csv;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import com.google.common.base.Strings;

import net.pointzilla.exceptions.ConfigurationException;

/**
 * How the columns of a delimited text file map onto points. Column indices
 * are 1-based and 0 means the column is not used.
 * <p>
 * The timestamp comes either from one combined date and time column or from
 * a date-only column plus an optional time-only column. Exactly one of the
 * two must be configured.
 *
 * @since 1.0
 */
public final class CsvFormat {

  /** Well known file layouts. */
  public static enum Preset {
    /** Export from the newer web apps: ISO time, value, grade, qualifiers
     * in columns 1, 3, 5 and 6. */
    NG("NG"),

    /** The 3.x export: US style local times with two header rows. */
    THREE_X("3X"),

    /** What {@link CsvPointWriter} produces. */
    POINTZILLA("PointZilla");

    private final String label;

    private Preset(final String label) {
      this.label = label;
    }

    /** @return The name users type for this preset. */
    public String label() {
      return label;
    }

    /**
     * Case insensitive lookup by label or enum name.
     * @param name The non-null name.
     * @return The preset.
     * @throws ConfigurationException if the name is not a known preset.
     */
    public static Preset fromName(final String name) {
      if (!Strings.isNullOrEmpty(name)) {
        for (final Preset preset : values()) {
          if (preset.label.equalsIgnoreCase(name.trim())
              || preset.name().equalsIgnoreCase(name.trim())) {
            return preset;
          }
        }
      }
      throw new ConfigurationException("'" + name + "' is an unknown CSV "
          + "format. Must be one of NG, 3X or PointZilla");
    }
  }

  private final int date_time_field;
  private final String date_time_format;
  private final int date_only_field;
  private final String date_only_format;
  private final int time_only_field;
  private final String time_only_format;
  private final LocalTime default_time_of_day;
  private final int value_field;
  private final int grade_field;
  private final int qualifiers_field;
  private final String comment;
  private final int skip_rows;
  private final String delimiter;
  private final String qualifier_delimiter;
  private final String nan_value;
  private final boolean ignore_invalid_rows;
  private final ZoneId zone;

  /**
   * Protected ctor.
   * @param builder A non-null builder.
   */
  private CsvFormat(final Builder builder) {
    date_time_field = builder.date_time_field;
    date_time_format = Strings.emptyToNull(builder.date_time_format);
    date_only_field = builder.date_only_field;
    date_only_format = Strings.emptyToNull(builder.date_only_format);
    time_only_field = builder.time_only_field;
    time_only_format = Strings.emptyToNull(builder.time_only_format);
    default_time_of_day = builder.default_time_of_day == null ?
        LocalTime.MIDNIGHT : builder.default_time_of_day;
    value_field = builder.value_field;
    grade_field = builder.grade_field;
    qualifiers_field = builder.qualifiers_field;
    comment = Strings.emptyToNull(builder.comment);
    skip_rows = builder.skip_rows;
    delimiter = builder.delimiter;
    qualifier_delimiter = builder.qualifier_delimiter;
    nan_value = Strings.emptyToNull(builder.nan_value);
    ignore_invalid_rows = builder.ignore_invalid_rows;
    zone = builder.zone == null ? ZoneOffset.UTC : builder.zone;
    validate();
  }

  private void validate() {
    if (date_time_field < 0 || date_only_field < 0 || time_only_field < 0
        || value_field < 0 || grade_field < 0 || qualifiers_field < 0) {
      throw new ConfigurationException("CSV column indices must be 1 or "
          + "greater, or 0 to ignore the column.");
    }
    if (date_time_field > 0 && date_only_field > 0) {
      throw new ConfigurationException("Use either a combined date time "
          + "column or a date-only column, not both.");
    }
    if (date_time_field == 0 && date_only_field == 0) {
      throw new ConfigurationException("Either a combined date time column "
          + "or a date-only column is required.");
    }
    if (time_only_field > 0 && date_only_field == 0) {
      throw new ConfigurationException("A time-only column requires a "
          + "date-only column.");
    }
    if (value_field == 0) {
      throw new ConfigurationException("A value column is required.");
    }
    if (skip_rows < 0) {
      throw new ConfigurationException("Rows to skip cannot be negative: "
          + skip_rows);
    }
    if (Strings.isNullOrEmpty(delimiter)) {
      throw new ConfigurationException("CSV delimiter cannot be empty.");
    }
    if (Strings.isNullOrEmpty(qualifier_delimiter)) {
      throw new ConfigurationException("Qualifier delimiter cannot be empty.");
    }
  }

  /** @return The 1-based combined date time column or 0. */
  public int dateTimeField() {
    return date_time_field;
  }

  /** @return The pattern of the combined column or null for ISO-8601. */
  public String dateTimeFormat() {
    return date_time_format;
  }

  /** @return The 1-based date-only column or 0. */
  public int dateOnlyField() {
    return date_only_field;
  }

  /** @return The pattern of the date-only column or null for ISO-8601. */
  public String dateOnlyFormat() {
    return date_only_format;
  }

  /** @return The 1-based time-only column or 0. */
  public int timeOnlyField() {
    return time_only_field;
  }

  /** @return The pattern of the time-only column or null for ISO-8601. */
  public String timeOnlyFormat() {
    return time_only_format;
  }

  /** @return The time used when a date has no time column or it's empty. */
  public LocalTime defaultTimeOfDay() {
    return default_time_of_day;
  }

  /** @return The 1-based value column. */
  public int valueField() {
    return value_field;
  }

  /** @return The 1-based grade column or 0. */
  public int gradeField() {
    return grade_field;
  }

  /** @return The 1-based qualifiers column or 0. */
  public int qualifiersField() {
    return qualifiers_field;
  }

  /** @return The prefix of comment lines or null. */
  public String comment() {
    return comment;
  }

  /** @return How many leading lines to skip. */
  public int skipRows() {
    return skip_rows;
  }

  /** @return The field delimiter. */
  public String delimiter() {
    return delimiter;
  }

  /** @return The delimiter between qualifiers within their column. */
  public String qualifierDelimiter() {
    return qualifier_delimiter;
  }

  /** @return The token that marks a gap in the value column or null. */
  public String nanValue() {
    return nan_value;
  }

  /** @return Whether bad rows are skipped instead of failing the file. */
  public boolean ignoreInvalidRows() {
    return ignore_invalid_rows;
  }

  /** @return The zone for timestamps that have no offset. */
  public ZoneId zone() {
    return zone;
  }

  /** @return A builder with the {@link Preset#NG} layout. */
  public static Builder newBuilder() {
    return newBuilder(Preset.NG);
  }

  /**
   * @param preset The non-null preset to start from.
   * @return A builder with the preset's layout.
   */
  public static Builder newBuilder(final Preset preset) {
    return new Builder().applyPreset(preset);
  }

  public static final class Builder {
    private int date_time_field;
    private String date_time_format;
    private int date_only_field;
    private String date_only_format;
    private int time_only_field;
    private String time_only_format;
    private LocalTime default_time_of_day;
    private int value_field;
    private int grade_field;
    private int qualifiers_field;
    private String comment;
    private int skip_rows;
    private String delimiter = ",";
    private String qualifier_delimiter = ",";
    private String nan_value;
    private boolean ignore_invalid_rows;
    private ZoneId zone;

    private Builder() { }

    /**
     * Resets the column layout to the given preset. The delimiter, zone and
     * default time of day are left alone.
     * @param preset The non-null preset.
     * @return The builder.
     */
    public Builder applyPreset(final Preset preset) {
      date_only_field = 0;
      date_only_format = null;
      time_only_field = 0;
      time_only_format = null;
      switch (preset) {
      case NG:
        // ISO 8601 UTC, Timestamp, Value, Approval Level, Grade, Qualifiers
        date_time_field = 1;
        date_time_format = null;
        value_field = 3;
        grade_field = 5;
        qualifiers_field = 6;
        comment = "#";
        skip_rows = 0;
        nan_value = null;
        ignore_invalid_rows = true;
        break;
      case THREE_X:
        date_time_field = 1;
        date_time_format = "MM/dd/yyyy HH:mm:ss";
        value_field = 2;
        grade_field = 3;
        qualifiers_field = 0;
        comment = null;
        skip_rows = 2;
        nan_value = null;
        ignore_invalid_rows = true;
        break;
      case POINTZILLA:
        date_time_field = 1;
        date_time_format = null;
        value_field = 2;
        grade_field = 3;
        qualifiers_field = 4;
        comment = "#";
        skip_rows = 0;
        nan_value = CsvPointWriter.GAP_TOKEN;
        ignore_invalid_rows = true;
        break;
      default:
        throw new IllegalArgumentException("Unhandled preset: " + preset);
      }
      return this;
    }

    public Builder setDateTimeField(final int date_time_field) {
      this.date_time_field = date_time_field;
      return this;
    }

    public Builder setDateTimeFormat(final String date_time_format) {
      this.date_time_format = date_time_format;
      return this;
    }

    public Builder setDateOnlyField(final int date_only_field) {
      this.date_only_field = date_only_field;
      return this;
    }

    public Builder setDateOnlyFormat(final String date_only_format) {
      this.date_only_format = date_only_format;
      return this;
    }

    public Builder setTimeOnlyField(final int time_only_field) {
      this.time_only_field = time_only_field;
      return this;
    }

    public Builder setTimeOnlyFormat(final String time_only_format) {
      this.time_only_format = time_only_format;
      return this;
    }

    public Builder setDefaultTimeOfDay(final LocalTime default_time_of_day) {
      this.default_time_of_day = default_time_of_day;
      return this;
    }

    public Builder setValueField(final int value_field) {
      this.value_field = value_field;
      return this;
    }

    public Builder setGradeField(final int grade_field) {
      this.grade_field = grade_field;
      return this;
    }

    public Builder setQualifiersField(final int qualifiers_field) {
      this.qualifiers_field = qualifiers_field;
      return this;
    }

    public Builder setComment(final String comment) {
      this.comment = comment;
      return this;
    }

    public Builder setSkipRows(final int skip_rows) {
      this.skip_rows = skip_rows;
      return this;
    }

    public Builder setDelimiter(final String delimiter) {
      this.delimiter = delimiter;
      return this;
    }

    public Builder setQualifierDelimiter(final String qualifier_delimiter) {
      this.qualifier_delimiter = qualifier_delimiter;
      return this;
    }

    public Builder setNanValue(final String nan_value) {
      this.nan_value = nan_value;
      return this;
    }

    public Builder setIgnoreInvalidRows(final boolean ignore_invalid_rows) {
      this.ignore_invalid_rows = ignore_invalid_rows;
      return this;
    }

    public Builder setZone(final ZoneId zone) {
      this.zone = zone;
      return this;
    }

    public CsvFormat build() {
      return new CsvFormat(this);
    }
  }
}
