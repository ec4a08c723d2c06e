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
 * Thrown when an append batch was rejected or its append request failed.
 * Batches after the failing one are never sent and batches before it are
 * not rolled back.
 *
 * @since 1.0
 */
public class AppendException extends RuntimeException {
  private static final long serialVersionUID = -5350437096712248840L;

  /** How many points earlier batches delivered. */
  private final int points_accepted;

  /**
   * Ctor setting the message and accepted count.
   * @param msg A non-null message.
   * @param points_accepted The number of points delivered before the failure.
   */
  public AppendException(final String msg, final int points_accepted) {
    super(msg);
    this.points_accepted = points_accepted;
  }

  /**
   * Ctor setting the message, accepted count and cause.
   * @param msg A non-null message.
   * @param points_accepted The number of points delivered before the failure.
   * @param cause The underlying exception.
   */
  public AppendException(final String msg,
                         final int points_accepted,
                         final Throwable cause) {
    super(msg, cause);
    this.points_accepted = points_accepted;
  }

  /** @return The number of points delivered before the failure. */
  public int pointsAccepted() {
    return points_accepted;
  }
}
