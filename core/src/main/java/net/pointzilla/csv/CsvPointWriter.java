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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;

import net.pointzilla.data.Point;
import net.pointzilla.exceptions.IllegalDataException;
import net.pointzilla.utils.DateTime;

/**
 * Writes points as delimited text that {@link CsvFormat.Preset#POINTZILLA}
 * reads back: a preamble of {@code #} comments followed by one
 * {@code time,value,grade,qualifiers} row per point. Gaps have
 * {@link #GAP_TOKEN} as their value.
 *
 * @since 1.0
 */
public class CsvPointWriter {
  private static final Logger LOG = LoggerFactory.getLogger(
      CsvPointWriter.class);

  /** The value written for gap points. */
  public static final String GAP_TOKEN = "Gap";

  /** The file name prefix when there is no target series. */
  public static final String DEFAULT_NAME = "PointZilla";

  private static final String DELIMITER = ",";

  private static final DateTimeFormatter FILE_TIME =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'")
        .withZone(ZoneOffset.UTC);

  private static final Joiner QUALIFIER_JOINER = Joiner.on(',');

  /** Who wrote the file, for the preamble. */
  private final String generator;

  /**
   * Default ctor.
   * @param generator A description of the program, e.g. name and version.
   */
  public CsvPointWriter(final String generator) {
    this.generator = Strings.isNullOrEmpty(generator) ? DEFAULT_NAME : generator;
  }

  /**
   * Writes the points to a file. When the sink is an existing directory a
   * file name is derived from the series and the first point.
   * @param sink A non-null file or directory path.
   * @param series_identifier The target series, may be null.
   * @param points The non-null points.
   * @return The path of the written file.
   * @throws IOException if the file could not be written.
   */
  public Path write(final Path sink,
                    final String series_identifier,
                    final List<Point> points) throws IOException {
    final Path path = Files.isDirectory(sink) ?
        sink.resolve(fileName(series_identifier, points)) : sink;
    if (path.getParent() != null) {
      Files.createDirectories(path.getParent());
    }
    try (final BufferedWriter writer = Files.newBufferedWriter(
        path, StandardCharsets.UTF_8)) {
      write(writer, path.getFileName().toString(), series_identifier, points);
    }
    LOG.info("Saved " + points.size() + " points to " + path);
    return path;
  }

  /**
   * Writes the preamble and rows. Does not close the writer.
   * @param writer A non-null writer.
   * @param file_name The name for the preamble.
   * @param series_identifier The target series, may be null.
   * @param points The non-null points.
   * @throws IOException if writing failed.
   */
  public void write(final Writer writer,
                    final String file_name,
                    final String series_identifier,
                    final List<Point> points) throws IOException {
    writer.write("# " + file_name + " generated at "
        + Instant.ofEpochMilli(DateTime.currentTimeMillis())
        + " by " + generator + "\n");
    writer.write("#\n");
    if (!Strings.isNullOrEmpty(series_identifier)) {
      writer.write("# Time series identifier: " + series_identifier + "\n");
    }
    writer.write("# Points: " + points.size() + "\n");
    writer.write("#\n");
    writer.write("# ISO 8601 UTC, Value, Grade, Qualifiers\n");
    for (final Point point : points) {
      writer.write(formatRow(point));
      writer.write('\n');
    }
    writer.flush();
  }

  /**
   * @param point A non-null point.
   * @return The row for the point without a line terminator.
   * @throws IllegalDataException if the value is infinite.
   */
  public static String formatRow(final Point point) {
    final StringBuilder buf = new StringBuilder()
        .append(point.time().toString())
        .append(DELIMITER);
    if (point.isGap()) {
      return buf.append(GAP_TOKEN)
          .append(DELIMITER)
          .append(DELIMITER)
          .toString();
    }
    if (!Double.isFinite(point.value())) {
      throw new IllegalDataException("Cannot write the non-finite value "
          + point.value() + " at " + point.time());
    }
    buf.append(formatValue(point.value()))
       .append(DELIMITER);
    if (point.gradeCode() != null) {
      buf.append(point.gradeCode());
    }
    buf.append(DELIMITER)
       .append(quote(QUALIFIER_JOINER.join(point.qualifiers())));
    return buf.toString();
  }

  /**
   * Derives a file name from the series and the time of the first point.
   * @param series_identifier The series, may be null.
   * @param points The points.
   * @return A file name safe for common file systems.
   */
  public static String fileName(final String series_identifier,
                                final List<Point> points) {
    final String base = Strings.isNullOrEmpty(series_identifier) ?
        DEFAULT_NAME : series_identifier.replaceAll("[\\\\/:*?\"<>|\\s]", "_");
    if (points.isEmpty()) {
      return base + ".csv";
    }
    return base + "." + FILE_TIME.format(points.get(0).time()) + ".csv";
  }

  /** Plain decimal without trailing zeros. */
  static String formatValue(final double value) {
    final BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
    if (decimal.scale() < 0) {
      return decimal.setScale(0).toPlainString();
    }
    return decimal.toPlainString();
  }

  static String quote(final String field) {
    if (field.contains(DELIMITER) || field.contains("\"")) {
      return "\"" + field.replace("\"", "\"\"") + "\"";
    }
    return field;
  }
}
