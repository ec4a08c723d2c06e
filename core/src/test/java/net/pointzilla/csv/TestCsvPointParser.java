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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.StringReader;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import net.pointzilla.data.Point;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.exceptions.IllegalDataException;

public class TestCsvPointParser {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  public void ngRow() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder().build());
    final Point point = parser.parseRow(parser.splitLine(
        "2024-01-01T00:00:00Z,2024-01-01 00:00:00,12.5,1200,5,\"A,B\""));
    assertEquals(T0, point.time());
    assertEquals(12.5, point.value(), 0.0);
    assertEquals(5, (int) point.gradeCode());
    assertEquals(ImmutableList.of("A", "B"), point.qualifiers().asList());
  }

  @Test
  public void optionalColumnsMissing() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder().build());
    final Point point = parser.parseRow(parser.splitLine(
        "2024-01-01T00:00:00Z,,42"));
    assertEquals(42, point.value(), 0.0);
    assertNull(point.gradeCode());
    assertTrue(point.qualifiers().isEmpty());
  }

  @Test
  public void defaultTimestampForms() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder()
        .setZone(ZoneId.of("UTC"))
        .build());
    assertEquals(T0, parseTime(parser, "2024-01-01T00:00:00"));
    assertEquals(T0, parseTime(parser, "2024-01-01T02:00:00+02:00"));
    assertEquals(T0.plusSeconds(3600), parseTime(parser, "2024-01-01 01:00:00"));
    assertEquals(T0, parseTime(parser, "2024-01-01"));
  }

  @Test
  public void zoneAppliesToLocalTimes() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder()
        .setZone(ZoneId.of("-08:00"))
        .build());
    assertEquals(T0.plusSeconds(8 * 3600),
        parseTime(parser, "2024-01-01T00:00:00"));
    assertEquals(T0, parseTime(parser, "2024-01-01T00:00:00Z"));
  }

  @Test
  public void threeXPreset() throws Exception {
    final CsvPointParser parser = new CsvPointParser(
        CsvFormat.newBuilder(CsvFormat.Preset.THREE_X).build());
    final Point point = parser.parseRow(parser.splitLine(
        "01/02/2024 13:45:00,5.5,3"));
    assertEquals(Instant.parse("2024-01-02T13:45:00Z"), point.time());
    assertEquals(5.5, point.value(), 0.0);
    assertEquals(3, (int) point.gradeCode());
  }

  @Test
  public void dateAndTimeColumns() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder()
        .setDateTimeField(0)
        .setDateOnlyField(1)
        .setDateOnlyFormat("dd.MM.yyyy")
        .setTimeOnlyField(2)
        .setValueField(3)
        .setGradeField(0)
        .setQualifiersField(0)
        .setDefaultTimeOfDay(LocalTime.NOON)
        .build());
    assertEquals(Instant.parse("2024-02-03T04:05:00Z"),
        parser.parseRow(parser.splitLine("03.02.2024,04:05,1")).time());
    assertEquals(Instant.parse("2024-02-03T12:00:00Z"),
        parser.parseRow(parser.splitLine("03.02.2024,,1")).time());
  }

  @Test
  public void gapsFromSentinelAndNaN() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder()
        .setNanValue("-9999")
        .build());
    assertTrue(parser.parseRow(parser.splitLine(
        "2024-01-01T00:00:00Z,,-9999,,5,A")).isGap());
    final Point nan = parser.parseRow(parser.splitLine(
        "2024-01-01T00:00:00Z,,NaN,,5,A"));
    assertTrue(nan.isGap());
    assertNull(nan.gradeCode());
  }

  @Test
  public void invalidFields() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder().build());
    assertInvalid(parser, "not-a-date,,1");
    assertInvalid(parser, "2024-01-01T00:00:00Z,,abc");
    assertInvalid(parser, "2024-01-01T00:00:00Z,,Infinity");
    assertInvalid(parser, "2024-01-01T00:00:00Z,,");
    assertInvalid(parser, "2024-01-01T00:00:00Z,,1,,good");
    assertInvalid(parser, ",,1");
  }

  @Test
  public void splitQuotes() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder()
        .setDelimiter(";")
        .build());
    assertEquals(ImmutableList.of("a", "b;c", "say \"hi\"", ""),
        parser.splitLine("a; \"b;c\" ;\"say \"\"hi\"\"\";"));
  }

  @Test
  public void multiCharacterDelimiter() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder()
        .setDelimiter("||")
        .build());
    assertEquals(ImmutableList.of("a", "b|c", "d"),
        parser.splitLine("a||b|c||d"));
  }

  @Test
  public void qualifierDelimiter() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder()
        .setQualifierDelimiter("|")
        .build());
    final Point point = parser.parseRow(parser.splitLine(
        "2024-01-01T00:00:00Z,,1,,,EST| ICE |"));
    assertEquals(ImmutableList.of("EST", "ICE"), point.qualifiers().asList());
  }

  @Test
  public void parseReader() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder()
        .setSkipRows(1)
        .build());
    final String text = "Header that is skipped\n"
        + "# comment\n"
        + "\n"
        + "2024-01-01T00:00:00Z,,1\n"
        + "  # indented comment\n"
        + "2024-01-01T00:01:00Z,,bad\n"
        + "2024-01-01T00:02:00Z,,3\n";
    final List<ParsedRow> rows = parser.parse(new StringReader(text));
    assertEquals(3, rows.size());
    assertTrue(rows.get(0).isValid());
    assertEquals(4, rows.get(0).rowNumber());
    assertFalse(rows.get(1).isValid());
    assertEquals(6, rows.get(1).rowNumber());
    assertTrue(rows.get(1).error().contains("bad"));
    assertEquals(T0.plusSeconds(120), rows.get(2).point().time());
  }

  @Test
  public void byteOrderMark() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder().build());
    final List<ParsedRow> rows = parser.parse(new StringReader(
        "\uFEFF2024-01-01T00:00:00Z,,1\n"));
    assertEquals(1, rows.size());
    assertTrue(rows.get(0).isValid());
  }

  @Test
  public void rowsKeepFileOrder() throws Exception {
    final CsvPointParser parser = new CsvPointParser(CsvFormat.newBuilder().build());
    final List<ParsedRow> rows = parser.parse(new StringReader(
        "2024-01-01T00:05:00Z,,1\n2024-01-01T00:00:00Z,,2\n"));
    assertEquals(T0.plusSeconds(300), rows.get(0).point().time());
    assertEquals(T0, rows.get(1).point().time());
  }

  @Test
  public void invalidPattern() throws Exception {
    try {
      new CsvPointParser(CsvFormat.newBuilder()
          .setDateTimeFormat("yyyy-MM-dd{{")
          .build());
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  private static Instant parseTime(final CsvPointParser parser,
                                   final String timestamp) {
    return parser.parseRow(ImmutableList.of(timestamp, "", "1")).time();
  }

  private static void assertInvalid(final CsvPointParser parser,
                                    final String line) {
    try {
      parser.parseRow(parser.splitLine(line));
      fail("Expected IllegalDataException for " + line);
    } catch (IllegalDataException e) { }
  }
}
