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
package net.pointzilla.exceptions;

/**
 * Some illegal or malformed data has been found in an input, e.g. a tabular
 * row that could not be turned into a point.
 *
 * @since 1.0
 */
public final class IllegalDataException extends IllegalStateException {
  private static final long serialVersionUID = -2816475304721995237L;

  /**
   * Constructor.
   *
   * @param msg Message describing the problem.
   */
  public IllegalDataException(final String msg) {
    super(msg);
  }

  /**
   * Constructor.
   *
   * @param msg Message describing the problem.
   * @param cause The source exception.
   */
  public IllegalDataException(final String msg, final Throwable cause) {
    super(msg, cause);
  }

}
