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
package net.pointzilla.sources;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.pointzilla.exceptions.ConfigurationException;

/**
 * Turns text into a single pen path using a small stroke font. Each glyph
 * lives on a grid 4 units wide and 6 units high with the origin at the
 * bottom left, and characters advance by {@link #ADVANCE} units. Strokes
 * are joined in order, so the pen travels straight from the end of one
 * stroke to the start of the next.
 * <p>
 * Supported: {@code A-Z}, {@code 0-9}, space, {@code -}, {@code .} and
 * {@code _}. Lower case is folded to upper case.
 *
 * @since 1.0
 */
public final class TextVectorizer {
  /** Horizontal distance between the origins of two glyphs. */
  public static final int ADVANCE = 6;

  private static final Splitter STROKES = Splitter.on('|').omitEmptyStrings();
  private static final Splitter VERTICES = Splitter.on(' ').omitEmptyStrings();

  /** Each vertex is two digits, x then y. Strokes are separated by pipes. */
  private static final Map<Character, String> FONT =
      ImmutableMap.<Character, String>builder()
        .put('A', "00 04 26 44 40|03 43")
        .put('B', "00 06 36 45 44 33 03|33 42 41 30 00")
        .put('C', "41 30 10 01 05 16 36 45")
        .put('D', "00 06 36 45 41 30 00")
        .put('E', "40 00 06 46|03 33")
        .put('F', "00 06 46|03 33")
        .put('G', "45 36 16 05 01 10 30 41 43 23")
        .put('H', "00 06|40 46|03 43")
        .put('I', "10 30|20 26|16 36")
        .put('J', "01 10 30 41 46")
        .put('K', "00 06|46 03 40")
        .put('L', "06 00 40")
        .put('M', "00 06 23 46 40")
        .put('N', "00 06 40 46")
        .put('O', "10 01 05 16 36 45 41 30 10")
        .put('P', "00 06 36 45 44 33 03")
        .put('Q', "10 01 05 16 36 45 41 30 10|22 40")
        .put('R', "00 06 36 45 44 33 03|23 40")
        .put('S', "01 10 30 41 42 33 13 04 05 16 36 45")
        .put('T', "06 46|20 26")
        .put('U', "06 01 10 30 41 46")
        .put('V', "06 20 46")
        .put('W', "06 10 23 30 46")
        .put('X', "00 46|06 40")
        .put('Y', "06 23 46|23 20")
        .put('Z', "06 46 00 40")
        .put('0', "10 01 05 16 36 45 41 30 10|05 41")
        .put('1', "15 26 20|10 30")
        .put('2', "05 16 36 45 44 00 40")
        .put('3', "05 16 36 45 44 33 23|33 42 41 30 10 01")
        .put('4', "30 36 02 42")
        .put('5', "46 06 04 34 43 41 30 10 01")
        .put('6', "45 36 16 05 01 10 30 41 42 33 03")
        .put('7', "06 46 20")
        .put('8', "10 01 02 13 33 42 41 30 10|13 04 05 16 36 45 44 33")
        .put('9', "01 10 30 41 45 36 16 05 04 13 43")
        .put('-', "13 33")
        .put('.', "20 21")
        .put('_', "00 40")
        .put(' ', "")
        .build();

  private TextVectorizer() { }

  /** One point on the pen path. */
  public static final class Vertex {
    private final double x;
    private final double y;

    public Vertex(final double x, final double y) {
      this.x = x;
      this.y = y;
    }

    public double x() {
      return x;
    }

    public double y() {
      return y;
    }

    @Override
    public boolean equals(final Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Vertex)) {
        return false;
      }
      final Vertex other = (Vertex) o;
      return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(x) * 31 + Double.hashCode(y);
    }

    @Override
    public String toString() {
      return "(" + x + "," + y + ")";
    }
  }

  /**
   * Builds the pen path for the given text.
   * @param text The non-null text.
   * @return The vertices in drawing order. Empty when the text only has
   * spaces.
   * @throws ConfigurationException if the text contains a character the
   * font does not have.
   */
  public static List<Vertex> vectorize(final String text) {
    if (text == null) {
      throw new ConfigurationException("Text to vectorize cannot be null.");
    }
    final String upper = text.toUpperCase(Locale.ROOT);
    final ImmutableList.Builder<Vertex> path = ImmutableList.builder();
    for (int i = 0; i < upper.length(); i++) {
      final char c = upper.charAt(i);
      final String glyph = FONT.get(c);
      if (glyph == null) {
        throw new ConfigurationException("Unable to vectorize character '"
            + text.charAt(i) + "' at index " + i + " of '" + text + "'");
      }
      final int origin = i * ADVANCE;
      for (final String stroke : STROKES.split(glyph)) {
        for (final String vertex : VERTICES.split(stroke)) {
          path.add(new Vertex(
              origin + Character.digit(vertex.charAt(0), 10),
              Character.digit(vertex.charAt(1), 10)));
        }
      }
    }
    return path.build();
  }

  /**
   * @param c A character.
   * @return True if the font can draw it.
   */
  public static boolean isSupported(final char c) {
    return FONT.containsKey(Character.toUpperCase(c));
  }
}
