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
package net.pointzilla.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.Test;

public final class TestDateTime {

  // 30 minute offset
  final static ZoneId AFZ = ZoneId.of("Asia/Kabul");

  @Test
  public void parseInstantIsoUtc() {
    assertEquals(Instant.parse("2024-03-01T10:00:00Z"),
        DateTime.parseInstant("2024-03-01T10:00:00Z", null));
  }

  @Test
  public void parseInstantIsoOffset() {
    assertEquals(Instant.parse("2024-03-01T18:00:00Z"),
        DateTime.parseInstant("2024-03-01T10:00:00-08:00", AFZ));
  }

  @Test
  public void parseInstantIsoFractional() {
    assertEquals(Instant.parse("2024-03-01T10:00:00.123Z"),
        DateTime.parseInstant("2024-03-01T10:00:00.123Z", null));
  }

  @Test
  public void parseInstantIsoLocalUsesZone() {
    assertEquals(Instant.parse("2024-03-01T05:30:00Z"),
        DateTime.parseInstant("2024-03-01T10:00:00", AFZ));
    assertEquals(Instant.parse("2024-03-01T10:00:00Z"),
        DateTime.parseInstant("2024-03-01T10:00:00", null));
  }

  @Test
  public void parseInstantIsoDateOnly() {
    assertEquals(Instant.parse("2024-03-01T00:00:00Z"),
        DateTime.parseInstant("2024-03-01", ZoneOffset.UTC));
  }

  @Test
  public void parseInstantSlashFormats() {
    assertEquals(Instant.parse("2013-01-04T00:00:00Z"),
        DateTime.parseInstant("2013/01/04", null));
    assertEquals(Instant.parse("2013-01-04T12:30:00Z"),
        DateTime.parseInstant("2013/01/04-12:30", null));
    assertEquals(Instant.parse("2013-01-04T12:30:15Z"),
        DateTime.parseInstant("2013/01/04 12:30:15", null));
  }

  @Test
  public void parseInstantEpoch() {
    assertEquals(Instant.ofEpochSecond(1355961600L),
        DateTime.parseInstant("1355961600", null));
    assertEquals(Instant.ofEpochMilli(1355961600123L),
        DateTime.parseInstant("1355961600123", null));
    assertEquals(Instant.ofEpochMilli(1355961600120L),
        DateTime.parseInstant("1355961600.12", null));
    assertEquals(Instant.ofEpochMilli(42L),
        DateTime.parseInstant("42ms", null));
  }

  @Test
  public void parseInstantRelative() {
    final long before = System.currentTimeMillis();
    final Instant parsed = DateTime.parseInstant("1h-ago", null);
    final long after = System.currentTimeMillis();
    assertTrue(parsed.toEpochMilli() >= before - 3600000L);
    assertTrue(parsed.toEpochMilli() <= after - 3600000L);
  }

  @Test
  public void parseInstantInvalid() {
    try {
      DateTime.parseInstant("not a date", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DateTime.parseInstant("1355961600.1234", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DateTime.parseInstant("", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void parseDurationUnits() {
    assertEquals(Duration.ofMillis(500), DateTime.parseDuration("500ms"));
    assertEquals(Duration.ofSeconds(30), DateTime.parseDuration("30s"));
    assertEquals(Duration.ofMinutes(1), DateTime.parseDuration("1m"));
    assertEquals(Duration.ofHours(6), DateTime.parseDuration("6h"));
    assertEquals(Duration.ofDays(14), DateTime.parseDuration("14d"));
    assertEquals(Duration.ofDays(14), DateTime.parseDuration("2w"));
    assertEquals(Duration.ZERO, DateTime.parseDuration("0s"));
  }

  @Test
  public void parseDurationTimeSpan() {
    assertEquals(Duration.ofMinutes(1), DateTime.parseDuration("00:01:00"));
    assertEquals(Duration.ofMinutes(90), DateTime.parseDuration("01:30"));
    assertEquals(Duration.ofHours(36), DateTime.parseDuration("1.12:00:00"));
    assertEquals(Duration.ofMillis(1500), DateTime.parseDuration("00:00:01.5"));
    assertEquals(Duration.ofMinutes(-5), DateTime.parseDuration("-00:05:00"));
  }

  @Test
  public void parseDurationIso() {
    assertEquals(Duration.ofMinutes(5), DateTime.parseDuration("PT5M"));
  }

  @Test
  public void parseDurationInvalid() {
    try {
      DateTime.parseDuration("5");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DateTime.parseDuration("5y");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DateTime.parseDuration("PT");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DateTime.parseDuration(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void parseZone() {
    assertEquals(ZoneOffset.UTC, DateTime.parseZone(null));
    assertEquals(AFZ, DateTime.parseZone("Asia/Kabul"));
    assertEquals(ZoneOffset.ofHours(-8), DateTime.parseZone("-08:00"));
    try {
      DateTime.parseZone("Nothere/Nowhere");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void msFromNanoDiff() {
    assertEquals(1.5, DateTime.msFromNanoDiff(2500000L, 1000000L), 0.0001);
    try {
      DateTime.msFromNanoDiff(1L, 2L);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
