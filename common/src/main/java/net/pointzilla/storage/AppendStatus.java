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
package net.pointzilla.storage;

/**
 * The state of a previously submitted append request as reported by the
 * store, including the number of points appended and an optional message.
 *
 * @since 1.0
 */
public interface AppendStatus {

  /**
   * An enum used by callers to determine whether or not the append request
   * has finished.
   */
  public static enum AppendState {
    /** The request was accepted but has not been applied yet. */
    PENDING,

    /** The request was applied. */
    COMPLETED,

    /** The store gave up on the request. */
    FAILED
  }

  /** @return The non-null state of the request. */
  public AppendState state();

  /** @return The number of points the store reported as appended. */
  public int pointsAppended();

  /** @return An optional message, usually set on failure. */
  public String message();

  /** @return A pending status. */
  public static AppendStatus pending() {
    return of(AppendState.PENDING, 0, null);
  }

  /**
   * Returns a completed status.
   * @param points_appended How many points were appended.
   * @return The completed status.
   */
  public static AppendStatus completed(final int points_appended) {
    return of(AppendState.COMPLETED, points_appended, null);
  }

  /**
   * Returns a failed status with the given message.
   * @param message An optional error message.
   * @return The failed status.
   */
  public static AppendStatus failed(final String message) {
    return of(AppendState.FAILED, 0, message);
  }

  /**
   * Returns a status with the given fields.
   * @param state A non-null state.
   * @param points_appended How many points were appended.
   * @param message An optional message.
   * @return The status.
   */
  public static AppendStatus of(final AppendState state,
                                final int points_appended,
                                final String message) {
    if (state == null) {
      throw new IllegalArgumentException("State cannot be null.");
    }
    return new AppendStatus() {

      @Override
      public AppendState state() {
        return state;
      }

      @Override
      public int pointsAppended() {
        return points_appended;
      }

      @Override
      public String message() {
        return message;
      }

      @Override
      public String toString() {
        return state + (message == null ? "" : ": " + message);
      }

    };
  }
}
