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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.pointzilla.exceptions.ConfigurationException;

public class TestGradeMapping {

  @Test
  public void range() {
    final GradeMapping mapping = GradeMapping.newBuilder()
        .addRule("200,299:5")
        .build();
    assertTrue(mapping.isEnabled());
    assertEquals(100, mapping.size());
    assertEquals(5, (int) mapping.map(250));
    assertEquals(5, (int) mapping.map(200));
    assertEquals(5, (int) mapping.map(299));
    assertNull(mapping.map(100));
    assertNull(mapping.map(null));
  }

  @Test
  public void reversedBounds() {
    final GradeMapping mapping = GradeMapping.newBuilder()
        .addRule("20,10:1")
        .build();
    assertEquals(1, (int) mapping.map(15));
  }

  @Test
  public void singleGradeAndDefault() {
    final GradeMapping mapping = GradeMapping.newBuilder()
        .addRule("-1:")
        .addRule(":7")
        .build();
    assertNull(mapping.map(-1));
    assertEquals(7, (int) mapping.map(3));
    assertEquals(7, (int) mapping.map(null));
  }

  @Test
  public void laterRulesWin() {
    final GradeMapping mapping = GradeMapping.newBuilder()
        .addRule("1,10:1")
        .addRule("5:2")
        .build();
    assertEquals(1, (int) mapping.map(4));
    assertEquals(2, (int) mapping.map(5));
  }

  @Test
  public void defaultOnlyEnables() {
    final GradeMapping mapping = GradeMapping.newBuilder()
        .addRule(":")
        .build();
    assertTrue(mapping.isEnabled());
    assertNull(mapping.map(5));
  }

  @Test
  public void disabled() {
    final GradeMapping mapping = GradeMapping.newBuilder().build();
    assertFalse(mapping.isEnabled());
    assertEquals(5, (int) mapping.map(5));
  }

  @Test
  public void malformed() {
    assertMalformed("5");
    assertMalformed("a:5");
    assertMalformed("1,b:5");
    assertMalformed("1:x");
    assertMalformed(null);
  }

  @Test
  public void rangeTooWide() {
    assertMalformed("-2147483648,2147483647:1");
    assertMalformed("0," + GradeMapping.MAX_RANGE_SIZE + ":1");

    final GradeMapping mapping = GradeMapping.newBuilder()
        .addRule("1," + GradeMapping.MAX_RANGE_SIZE + ":7")
        .build();
    assertEquals(7, (int) mapping.map(GradeMapping.MAX_RANGE_SIZE));
  }

  private static void assertMalformed(final String rule) {
    try {
      GradeMapping.newBuilder().addRule(rule);
      fail("Expected ConfigurationException for " + rule);
    } catch (ConfigurationException e) { }
  }
}
