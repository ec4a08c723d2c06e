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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.pointzilla.data.Point;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.exceptions.IllegalDataException;

public class TestCsvPointSource {
  private static final String CONTENT = "# ISO 8601 UTC, Timestamp, Value\n"
      + "2024-01-01T00:00:00Z,,1\n"
      + "2024-01-01T00:01:00Z,,oops\n"
      + "2024-01-01T00:02:00Z,,3\n";

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void skipsInvalidRows() throws Exception {
    final Path path = write("data.csv", CONTENT);
    final CsvPointSource source = new CsvPointSource(path,
        CsvFormat.newBuilder().setIgnoreInvalidRows(true).build());
    final List<Point> points = source.load();
    assertEquals(2, points.size());
    assertEquals(1, source.invalidRows());
    assertEquals(Instant.parse("2024-01-01T00:02:00Z"), points.get(1).time());
  }

  @Test
  public void failsOnInvalidRow() throws Exception {
    final Path path = write("data.csv", CONTENT);
    final CsvPointSource source = new CsvPointSource(path,
        CsvFormat.newBuilder().setIgnoreInvalidRows(false).build());
    try {
      source.load();
      fail("Expected IllegalDataException");
    } catch (IllegalDataException e) {
      assertTrue(e.getMessage().contains("data.csv:3"));
    }
  }

  @Test
  public void gzipped() throws Exception {
    final File file = folder.newFile("data.csv.gz");
    try (final Writer writer = new OutputStreamWriter(
        new GZIPOutputStream(Files.newOutputStream(file.toPath())),
        StandardCharsets.UTF_8)) {
      writer.write(CONTENT);
    }
    final CsvPointSource source = new CsvPointSource(file.toPath(),
        CsvFormat.newBuilder().build());
    assertEquals(2, source.load().size());
  }

  @Test
  public void missingFile() throws Exception {
    final CsvPointSource source = new CsvPointSource(
        folder.getRoot().toPath().resolve("nope.csv"),
        CsvFormat.newBuilder().build());
    try {
      source.load();
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  @Test
  public void describe() throws Exception {
    final Path path = write("data.csv", CONTENT);
    assertTrue(new CsvPointSource(path, CsvFormat.newBuilder().build())
        .describe().contains("data.csv"));
  }

  private Path write(final String name, final String content) throws Exception {
    final File file = folder.newFile(name);
    Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
    return file.toPath();
  }
}
