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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;

import net.pointzilla.data.Point;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.exceptions.IllegalDataException;
import net.pointzilla.sources.PointSource;

/**
 * Loads the points of one delimited text file, optionally gzipped. Invalid
 * rows either fail the whole file or, with
 * {@link CsvFormat#ignoreInvalidRows()}, are logged, counted and skipped.
 *
 * @since 1.0
 */
public class CsvPointSource implements PointSource {
  private static final Logger LOG = LoggerFactory.getLogger(
      CsvPointSource.class);

  private final Path path;
  private final CsvPointParser parser;

  /** How many rows the last load skipped. */
  private int invalid_rows;

  /**
   * Default ctor.
   * @param path The non-null file path. Files ending in {@code .gz} are
   * decompressed.
   * @param format The non-null format.
   */
  public CsvPointSource(final Path path, final CsvFormat format) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    this.path = path;
    this.parser = new CsvPointParser(format);
  }

  @Override
  public String describe() {
    return "CSV file " + path;
  }

  /** @return How many invalid rows were skipped by the last load. */
  public int invalidRows() {
    return invalid_rows;
  }

  @Override
  public List<Point> load() {
    final Stopwatch timer = Stopwatch.createStarted();
    final List<ParsedRow> rows;
    try (final BufferedReader reader = open(path)) {
      rows = parser.parse(reader);
    } catch (NoSuchFileException e) {
      throw new ConfigurationException("CSV file '" + path
          + "' does not exist.", e);
    } catch (IOException e) {
      throw new IllegalDataException("Unable to read CSV file '" + path
          + "': " + e.getMessage(), e);
    }

    invalid_rows = 0;
    final List<Point> points = Lists.newArrayListWithCapacity(rows.size());
    for (final ParsedRow row : rows) {
      if (row.isValid()) {
        points.add(row.point());
        continue;
      }
      if (!parser.format().ignoreInvalidRows()) {
        throw new IllegalDataException(path + ":" + row.rowNumber() + ": "
            + row.error());
      }
      invalid_rows++;
      if (LOG.isDebugEnabled()) {
        LOG.debug("Skipping invalid row " + path + ":" + row.rowNumber()
            + ": " + row.error());
      }
    }

    if (invalid_rows > 0) {
      LOG.warn("Skipped " + invalid_rows + " invalid rows in " + path);
    }
    LOG.info("Processed " + path + " in " + timer.elapsed().toMillis()
        + " ms, " + points.size() + " points");
    return points;
  }

  /**
   * Opens a file for reading, decompressing it when its name ends in
   * {@code .gz}.
   * @param path The path.
   * @return A reader.
   * @throws IOException if the file could not be opened.
   */
  static BufferedReader open(final Path path) throws IOException {
    InputStream is = Files.newInputStream(path);
    if (path.getFileName().toString().endsWith(".gz")) {
      try {
        is = new GZIPInputStream(is);
      } catch (IOException e) {
        is.close();
        throw e;
      }
    }
    return new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
  }
}
