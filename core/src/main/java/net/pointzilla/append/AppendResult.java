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
package net.pointzilla.append;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The outcome of a run: what was sent and, when waiting, how it finished.
 *
 * @since 1.0
 */
public final class AppendResult {

  /** How far delivery got. */
  public static enum Status {
    /** Nothing was sent, either no points or only a CSV was saved. */
    NOT_SENT,

    /** All batches were accepted and the run did not wait for them. */
    SUBMITTED,

    /** All append requests completed. */
    COMPLETED,

    /** The wait deadline elapsed first. Nothing is rolled back. */
    TIMED_OUT
  }

  private static final AppendResult NOT_SENT = new AppendResult(
      Status.NOT_SENT, 0, 0, ImmutableList.of());

  private final Status status;
  private final int points_delivered;
  private final int points_appended;
  private final ImmutableList<String> append_ids;

  /**
   * Default ctor.
   * @param status The non-null status.
   * @param points_delivered Points accepted in append requests.
   * @param points_appended Points the store reported as appended, 0 when
   * the run did not wait.
   * @param append_ids The IDs of the append requests in batch order.
   */
  public AppendResult(final Status status,
                      final int points_delivered,
                      final int points_appended,
                      final List<String> append_ids) {
    if (status == null) {
      throw new IllegalArgumentException("Status cannot be null.");
    }
    this.status = status;
    this.points_delivered = points_delivered;
    this.points_appended = points_appended;
    this.append_ids = ImmutableList.copyOf(append_ids);
  }

  /** @return A result for a run that sent nothing. */
  public static AppendResult notSent() {
    return NOT_SENT;
  }

  public Status status() {
    return status;
  }

  /** @return Points accepted in append requests. */
  public int pointsDelivered() {
    return points_delivered;
  }

  /** @return Points reported as appended by completed requests. */
  public int pointsAppended() {
    return points_appended;
  }

  /** @return The number of batches sent. */
  public int batches() {
    return append_ids.size();
  }

  public ImmutableList<String> appendIds() {
    return append_ids;
  }

  @Override
  public String toString() {
    return status + ": " + points_delivered + " points in " + append_ids.size()
        + " batches" + (status == Status.COMPLETED ?
            ", " + points_appended + " appended" : "");
  }
}
