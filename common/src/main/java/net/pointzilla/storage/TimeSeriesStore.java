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

import java.time.Instant;
import java.util.List;

import com.stumbleupon.async.Deferred;

import net.pointzilla.data.Point;
import net.pointzilla.data.TimeRange;

/**
 * A client for one remote time-series store. All calls are asynchronous and
 * report failures by calling back the deferred with an exception, usually a
 * {@link net.pointzilla.exceptions.RemoteStoreException}.
 *
 * @since 1.0
 */
public interface TimeSeriesStore {

  /**
   * Resolves a time series name or unique ID to the store's unique ID.
   * @param identifier A non-null name or unique ID.
   * @return A deferred resolving to the unique ID. Calls back with a
   * {@link net.pointzilla.exceptions.RemoteStoreException} with a 404 status
   * when the series does not exist.
   */
  public Deferred<String> resolveSeriesIdentifier(final String identifier);

  /**
   * Submits one batch of points for appending.
   * @param series_id The non-null unique ID of the series.
   * @param points The non-null batch.
   * @param overwrite_range An optional range of existing points to replace.
   * When null the points are appended without deleting anything.
   * @return A deferred resolving to the append request ID.
   */
  public Deferred<String> appendPoints(final String series_id,
                                       final List<Point> points,
                                       final TimeRange overwrite_range);

  /**
   * Fetches the state of an append request.
   * @param append_id The non-null ID returned from
   * {@link #appendPoints(String, List, TimeRange)}.
   * @return A deferred resolving to the status.
   */
  public Deferred<AppendStatus> getAppendStatus(final String append_id);

  /**
   * Fetches the points of a series.
   * @param series_id The non-null unique ID of the series.
   * @param from An optional inclusive start, null for the first point.
   * @param to An optional inclusive end, null for the last point.
   * @return A deferred resolving to the points in time order.
   */
  public Deferred<List<Point>> getSeriesPoints(final String series_id,
                                               final Instant from,
                                               final Instant to);

  /**
   * Releases the connection.
   * @return A deferred resolving to null when finished.
   */
  public Deferred<Object> shutdown();

}
