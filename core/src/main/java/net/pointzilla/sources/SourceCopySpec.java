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

import java.time.Instant;

import net.pointzilla.data.TimeSeriesIdentifier;
import net.pointzilla.exceptions.ConfigurationException;

/**
 * Which existing series to copy and the optional bounds of the copy. Absent
 * bounds mean the start or end of the series' record.
 *
 * @since 1.0
 */
public final class SourceCopySpec {
  private final TimeSeriesIdentifier source;
  private final Instant query_from;
  private final Instant query_to;

  /**
   * Default ctor.
   * @param source The non-null source series, optionally on another server.
   * @param query_from An optional inclusive start.
   * @param query_to An optional inclusive end.
   * @throws ConfigurationException if the source is null or the bounds are
   * reversed.
   */
  public SourceCopySpec(final TimeSeriesIdentifier source,
                        final Instant query_from,
                        final Instant query_to) {
    if (source == null) {
      throw new ConfigurationException("Source time series cannot be null.");
    }
    if (query_from != null && query_to != null && query_to.isBefore(query_from)) {
      throw new ConfigurationException("Source query end " + query_to
          + " is before the start " + query_from);
    }
    this.source = source;
    this.query_from = query_from;
    this.query_to = query_to;
  }

  /** @return The source series. */
  public TimeSeriesIdentifier source() {
    return source;
  }

  /** @return The inclusive start or null for the beginning of the record. */
  public Instant queryFrom() {
    return query_from;
  }

  /** @return The inclusive end or null for the end of the record. */
  public Instant queryTo() {
    return query_to;
  }

  @Override
  public String toString() {
    return source + " from " + (query_from == null ? "start of record" : query_from)
        + " to " + (query_to == null ? "end of record" : query_to);
  }
}
