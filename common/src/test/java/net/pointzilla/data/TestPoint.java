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
package net.pointzilla.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class TestPoint {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  public void builder() {
    final Point point = Point.newBuilder()
        .setTime(T0)
        .setValue(42.5)
        .setGradeCode(5)
        .setQualifiers(ImmutableList.of("B", "A", "B"))
        .build();
    assertEquals(T0, point.time());
    assertEquals(PointType.VALUE, point.type());
    assertFalse(point.isGap());
    assertEquals(42.5, point.value(), 0.0);
    assertEquals(5, (int) point.gradeCode());
    assertEquals(ImmutableList.of("B", "A"), point.qualifiers().asList());
  }

  @Test
  public void gapDropsMetadata() {
    final Point point = Point.newBuilder()
        .setTime(T0)
        .setType(PointType.GAP)
        .setValue(1)
        .setGradeCode(5)
        .addQualifier("A")
        .build();
    assertTrue(point.isGap());
    assertTrue(Double.isNaN(point.value()));
    assertNull(point.gradeCode());
    assertTrue(point.qualifiers().isEmpty());
    assertEquals(Point.gap(T0), point);
  }

  @Test
  public void copyBuilder() {
    final Point original = Point.newBuilder()
        .setTime(T0)
        .setValue(1)
        .setGradeCode(3)
        .addQualifier("X")
        .build();
    final Point copy = Point.newBuilder(original)
        .setTime(T0.plusSeconds(60))
        .build();
    assertEquals(T0.plusSeconds(60), copy.time());
    assertEquals(1, copy.value(), 0.0);
    assertEquals(3, (int) copy.gradeCode());
    assertEquals(ImmutableList.of("X"), copy.qualifiers().asList());
    assertEquals(original, Point.newBuilder(original).build());
  }

  @Test
  public void qualifierOrderMatters() {
    final Point a = Point.newBuilder().setTime(T0).setValue(1)
        .addQualifier("A").addQualifier("B").build();
    final Point b = Point.newBuilder().setTime(T0).setValue(1)
        .addQualifier("B").addQualifier("A").build();
    assertNotEquals(a, b);
  }

  @Test
  public void invalid() {
    try {
      Point.newBuilder().setValue(1).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Point.newBuilder().setTime(T0).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
