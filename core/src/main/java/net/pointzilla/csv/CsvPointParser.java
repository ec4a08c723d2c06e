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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

import net.pointzilla.data.Point;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.exceptions.IllegalDataException;

/**
 * Parses delimited text into points according to a {@link CsvFormat}. Rows
 * are returned in file order with their line numbers, each either a point or
 * the reason it was rejected. The failure policy is left to the caller.
 *
 * @since 1.0
 */
public class CsvPointParser {

  /** ISO date and time separated by a space, with an optional offset. */
  private static final DateTimeFormatter SPACE_DATE_TIME =
      new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendLiteral(' ')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .toFormatter(Locale.ROOT);

  private final CsvFormat format;
  private final DateTimeFormatter date_time_formatter;
  private final DateTimeFormatter date_only_formatter;
  private final DateTimeFormatter time_only_formatter;
  private final Splitter qualifier_splitter;

  /**
   * Default ctor.
   * @param format The non-null format.
   * @throws ConfigurationException if one of the patterns is invalid.
   */
  public CsvPointParser(final CsvFormat format) {
    if (format == null) {
      throw new IllegalArgumentException("Format cannot be null.");
    }
    this.format = format;
    date_time_formatter = pattern(format.dateTimeFormat());
    date_only_formatter = pattern(format.dateOnlyFormat());
    time_only_formatter = pattern(format.timeOnlyFormat());
    qualifier_splitter = Splitter.on(format.qualifierDelimiter())
        .trimResults()
        .omitEmptyStrings();
  }

  /** @return The format this parser applies. */
  public CsvFormat format() {
    return format;
  }

  /**
   * Reads all rows from the reader. Does not close it.
   * @param reader A non-null reader.
   * @return The non-comment, non-blank rows in file order.
   * @throws IOException if reading failed.
   */
  public List<ParsedRow> parse(final Reader reader) throws IOException {
    final BufferedReader in = reader instanceof BufferedReader ?
        (BufferedReader) reader : new BufferedReader(reader);
    final List<ParsedRow> rows = Lists.newArrayList();
    int line_number = 0;
    String line;
    while ((line = in.readLine()) != null) {
      line_number++;
      if (line_number <= format.skipRows()) {
        continue;
      }
      if (line_number == 1 && line.startsWith("\uFEFF")) {
        line = line.substring(1);
      }
      final String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      if (format.comment() != null && trimmed.startsWith(format.comment())) {
        continue;
      }
      try {
        rows.add(ParsedRow.valid(line_number, parseRow(splitLine(line))));
      } catch (IllegalDataException e) {
        rows.add(ParsedRow.invalid(line_number, e.getMessage()));
      }
    }
    return rows;
  }

  /**
   * Converts the fields of one row.
   * @param fields The non-null fields.
   * @return The point.
   * @throws IllegalDataException if the row could not be converted.
   */
  public Point parseRow(final List<String> fields) {
    final Instant time = parseTime(fields);

    final String value_text = field(fields, format.valueField());
    if (value_text == null || value_text.isEmpty()) {
      throw new IllegalDataException("Missing value in column "
          + format.valueField());
    }
    if (format.nanValue() != null && value_text.equals(format.nanValue())) {
      return Point.gap(time);
    }
    final double value;
    try {
      value = Double.parseDouble(value_text);
    } catch (NumberFormatException e) {
      throw new IllegalDataException("Invalid value '" + value_text + "'", e);
    }
    if (Double.isNaN(value)) {
      return Point.gap(time);
    }
    if (Double.isInfinite(value)) {
      throw new IllegalDataException("Invalid value '" + value_text + "'");
    }

    final Point.Builder builder = Point.newBuilder()
        .setTime(time)
        .setValue(value);

    final String grade_text = field(fields, format.gradeField());
    if (grade_text != null && !grade_text.isEmpty()) {
      try {
        builder.setGradeCode(Integer.parseInt(grade_text));
      } catch (NumberFormatException e) {
        throw new IllegalDataException("Invalid grade '" + grade_text + "'", e);
      }
    }

    final String qualifiers_text = field(fields, format.qualifiersField());
    if (qualifiers_text != null && !qualifiers_text.isEmpty()) {
      builder.setQualifiers(qualifier_splitter.splitToList(qualifiers_text));
    }
    return builder.build();
  }

  /**
   * Splits a line on the delimiter, honoring double quoted fields with
   * doubled quotes as escapes. Fields are trimmed.
   * @param line The non-null line.
   * @return The fields.
   */
  public List<String> splitLine(final String line) {
    final String delimiter = format.delimiter();
    final List<String> fields = Lists.newArrayList();
    final StringBuilder current = new StringBuilder();
    boolean in_quotes = false;
    int i = 0;
    while (i < line.length()) {
      final char c = line.charAt(i);
      if (c == '"') {
        if (in_quotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
          current.append('"');
          i += 2;
          continue;
        }
        in_quotes = !in_quotes;
        i++;
      } else if (!in_quotes && line.startsWith(delimiter, i)) {
        fields.add(current.toString().trim());
        current.setLength(0);
        i += delimiter.length();
      } else {
        current.append(c);
        i++;
      }
    }
    fields.add(current.toString().trim());
    return fields;
  }

  private Instant parseTime(final List<String> fields) {
    if (format.dateTimeField() > 0) {
      final String text = required(fields, format.dateTimeField(), "timestamp");
      try {
        if (date_time_formatter != null) {
          return toInstant(date_time_formatter.parseBest(text,
              ZonedDateTime::from, LocalDateTime::from, LocalDate::from));
        }
        return parseDefaultDateTime(text);
      } catch (DateTimeException e) {
        throw new IllegalDataException("Invalid timestamp '" + text + "'", e);
      }
    }

    final String date_text = required(fields, format.dateOnlyField(), "date");
    final String time_text = field(fields, format.timeOnlyField());
    try {
      final LocalDate date = date_only_formatter == null ?
          LocalDate.parse(date_text) : LocalDate.parse(date_text, date_only_formatter);
      final LocalTime time;
      if (time_text == null || time_text.isEmpty()) {
        time = format.defaultTimeOfDay();
      } else {
        time = time_only_formatter == null ?
            LocalTime.parse(time_text) : LocalTime.parse(time_text, time_only_formatter);
      }
      return ZonedDateTime.of(date, time, format.zone()).toInstant();
    } catch (DateTimeException e) {
      throw new IllegalDataException("Invalid date '" + date_text + "' or time '"
          + time_text + "'", e);
    }
  }

  /**
   * The default is any unambiguous ISO-8601 form. Without an offset the
   * format's zone is used.
   */
  private Instant parseDefaultDateTime(final String text) {
    if (text.indexOf('T') > 0 || text.indexOf('t') > 0) {
      return toInstant(DateTimeFormatter.ISO_DATE_TIME.parseBest(text,
          ZonedDateTime::from, LocalDateTime::from));
    }
    if (text.indexOf(' ') > 0) {
      return toInstant(SPACE_DATE_TIME.parseBest(text,
          ZonedDateTime::from, LocalDateTime::from));
    }
    return toInstant(DateTimeFormatter.ISO_LOCAL_DATE.parse(text, LocalDate::from));
  }

  private Instant toInstant(final TemporalAccessor parsed) {
    if (parsed instanceof ZonedDateTime) {
      return ((ZonedDateTime) parsed).toInstant();
    }
    if (parsed instanceof LocalDateTime) {
      return ((LocalDateTime) parsed).atZone(format.zone()).toInstant();
    }
    return ((LocalDate) parsed).atStartOfDay(format.zone()).toInstant();
  }

  /** @return The field at the 1-based index, null if unused or missing. */
  private static String field(final List<String> fields, final int index) {
    if (index <= 0 || index > fields.size()) {
      return null;
    }
    return fields.get(index - 1);
  }

  private static String required(final List<String> fields,
                                 final int index,
                                 final String name) {
    final String text = field(fields, index);
    if (text == null || text.isEmpty()) {
      throw new IllegalDataException("Missing " + name + " in column " + index);
    }
    return text;
  }

  private static DateTimeFormatter pattern(final String pattern) {
    if (pattern == null) {
      return null;
    }
    try {
      return DateTimeFormatter.ofPattern(pattern, Locale.ROOT);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid date/time pattern '"
          + pattern + "': " + e.getMessage(), e);
    }
  }
}
