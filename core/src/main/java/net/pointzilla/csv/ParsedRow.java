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

import net.pointzilla.data.Point;

/**
 * The outcome of parsing one row of a tabular file: either a point or the
 * reason the row was rejected.
 *
 * @since 1.0
 */
public final class ParsedRow {
  private final int row_number;
  private final Point point;
  private final String error;

  private ParsedRow(final int row_number, final Point point, final String error) {
    this.row_number = row_number;
    this.point = point;
    this.error = error;
  }

  /**
   * @param row_number The 1-based line number.
   * @param point The non-null point.
   * @return A valid row.
   */
  public static ParsedRow valid(final int row_number, final Point point) {
    if (point == null) {
      throw new IllegalArgumentException("Point cannot be null.");
    }
    return new ParsedRow(row_number, point, null);
  }

  /**
   * @param row_number The 1-based line number.
   * @param error A non-null description of the problem.
   * @return An invalid row.
   */
  public static ParsedRow invalid(final int row_number, final String error) {
    return new ParsedRow(row_number, null, error == null ? "invalid row" : error);
  }

  /** @return The 1-based line number in the file. */
  public int rowNumber() {
    return row_number;
  }

  /** @return True if the row produced a point. */
  public boolean isValid() {
    return point != null;
  }

  /** @return The point or null if the row was invalid. */
  public Point point() {
    return point;
  }

  /** @return The problem or null if the row was valid. */
  public String error() {
    return error;
  }

  @Override
  public String toString() {
    return "row " + row_number + ": " + (point != null ? point : error);
  }
}
