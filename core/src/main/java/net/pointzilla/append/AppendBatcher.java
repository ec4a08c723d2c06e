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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ticker;
import com.google.common.collect.Lists;

import net.pointzilla.data.Point;
import net.pointzilla.data.TimeRange;
import net.pointzilla.exceptions.AppendException;
import net.pointzilla.exceptions.RemoteStoreException;
import net.pointzilla.storage.AppendStatus;
import net.pointzilla.storage.TimeSeriesStore;
import net.pointzilla.utils.Deferreds;

/**
 * Delivers points to a series in sequential batches and optionally waits
 * for the append requests to complete.
 * <p>
 * With {@link CommandType#OVERWRITE} every batch carries a range: the first
 * starts at the overall start, the last ends at the overall end, and the
 * others end where the next batch's first point is. The overall range is the
 * explicit one when given, otherwise the span of the points. With
 * {@link CommandType#APPEND} only an explicit range is sent.
 * <p>
 * A failed batch stops delivery. Earlier batches are not rolled back.
 *
 * @since 1.0
 */
public class AppendBatcher {
  private static final Logger LOG = LoggerFactory.getLogger(
      AppendBatcher.class);

  /** Pauses between status polls. */
  public static interface Sleeper {
    public void sleep(final Duration duration) throws InterruptedException;
  }

  private static final Sleeper THREAD_SLEEPER = new Sleeper() {
    @Override
    public void sleep(final Duration duration) throws InterruptedException {
      Thread.sleep(duration.toMillis());
    }
  };

  private final TimeSeriesStore store;
  private final AppendBatchPolicy policy;
  private final CommandType command;
  private final Ticker ticker;
  private final Sleeper sleeper;

  /**
   * Ctor using the system clock.
   * @param store The non-null store.
   * @param policy The non-null policy.
   * @param command The non-null command.
   */
  public AppendBatcher(final TimeSeriesStore store,
                       final AppendBatchPolicy policy,
                       final CommandType command) {
    this(store, policy, command, Ticker.systemTicker(), THREAD_SLEEPER);
  }

  /**
   * Ctor with an injected clock.
   * @param store The non-null store.
   * @param policy The non-null policy.
   * @param command The non-null command.
   * @param ticker The non-null clock for the wait deadline.
   * @param sleeper The non-null pause between polls.
   */
  public AppendBatcher(final TimeSeriesStore store,
                       final AppendBatchPolicy policy,
                       final CommandType command,
                       final Ticker ticker,
                       final Sleeper sleeper) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (policy == null) {
      throw new IllegalArgumentException("Policy cannot be null.");
    }
    if (command == null) {
      throw new IllegalArgumentException("Command cannot be null.");
    }
    if (ticker == null || sleeper == null) {
      throw new IllegalArgumentException("Ticker and sleeper cannot be null.");
    }
    this.store = store;
    this.policy = policy;
    this.command = command;
    this.ticker = ticker;
    this.sleeper = sleeper;
  }

  /**
   * Sends the points.
   * @param series_id The non-null unique ID of the target series.
   * @param points The non-null points in delivery order.
   * @param explicit_range An optional overall range.
   * @return The result, {@link AppendResult.Status#NOT_SENT} without points.
   * @throws AppendException if a batch or append request failed.
   * @throws RemoteStoreException if polling the status failed.
   */
  public AppendResult append(final String series_id,
                             final List<Point> points,
                             final TimeRange explicit_range) {
    if (points.isEmpty()) {
      LOG.info("No points to append to " + series_id);
      return AppendResult.notSent();
    }

    final List<List<Point>> batches = Lists.partition(points, policy.batchSize());
    final List<TimeRange> ranges = overwriteRanges(batches, explicit_range);
    final List<String> append_ids = Lists.newArrayListWithCapacity(batches.size());
    int delivered = 0;
    for (int i = 0; i < batches.size(); i++) {
      final List<Point> batch = batches.get(i);
      final TimeRange range = ranges.get(i);
      LOG.info((command == CommandType.OVERWRITE ? "Overwriting" : "Appending")
          + " batch " + (i + 1) + " of " + batches.size() + " with "
          + batch.size() + " points to " + series_id
          + (range == null ? "" : " within " + range));
      final String append_id;
      try {
        append_id = Deferreds.join(store.appendPoints(series_id, batch, range),
            policy.requestTimeout(), "append to " + series_id);
      } catch (RuntimeException e) {
        throw new AppendException("Batch " + (i + 1) + " of " + batches.size()
            + " failed after " + delivered + " points were accepted: "
            + e.getMessage(), delivered, e);
      }
      append_ids.add(append_id);
      delivered += batch.size();
    }

    if (!policy.waitForCompletion()) {
      return new AppendResult(AppendResult.Status.SUBMITTED, delivered, 0,
          append_ids);
    }
    return waitForCompletion(delivered, append_ids);
  }

  /**
   * Computes the range sent with each batch, null entries for none.
   * @param batches The non-empty batches.
   * @param explicit_range An optional overall range.
   * @return One range per batch.
   */
  List<TimeRange> overwriteRanges(final List<List<Point>> batches,
                                  final TimeRange explicit_range) {
    final List<TimeRange> ranges = Lists.newArrayListWithCapacity(batches.size());
    if (command == CommandType.APPEND) {
      for (int i = 0; i < batches.size(); i++) {
        ranges.add(explicit_range);
      }
      return ranges;
    }

    final TimeRange overall = explicit_range != null ?
        explicit_range : span(batches);
    for (int i = 0; i < batches.size(); i++) {
      final Instant start = i == 0 ?
          overall.start() : batches.get(i).get(0).time();
      final Instant end = i == batches.size() - 1 ?
          overall.end() : batches.get(i + 1).get(0).time();
      ranges.add(new TimeRange(start, end.isBefore(start) ? start : end));
    }
    return ranges;
  }

  /** @return The earliest and latest point time over all batches. */
  private static TimeRange span(final List<List<Point>> batches) {
    Instant min = null;
    Instant max = null;
    for (final List<Point> batch : batches) {
      for (final Point point : batch) {
        if (min == null || point.time().isBefore(min)) {
          min = point.time();
        }
        if (max == null || point.time().isAfter(max)) {
          max = point.time();
        }
      }
    }
    return new TimeRange(min, max);
  }

  private AppendResult waitForCompletion(final int delivered,
                                         final List<String> append_ids) {
    final long deadline = ticker.read() + policy.waitTimeout().toNanos();
    int appended = 0;
    for (final String append_id : append_ids) {
      while (true) {
        final long remaining = deadline - ticker.read();
        final AppendStatus status = Deferreds.join(
            store.getAppendStatus(append_id),
            remaining > 0 ? min(policy.requestTimeout(), remaining)
                : policy.requestTimeout(),
            "append status " + append_id);
        if (status.state() == AppendStatus.AppendState.COMPLETED) {
          appended += status.pointsAppended();
          if (LOG.isDebugEnabled()) {
            LOG.debug("Append request " + append_id + " completed with "
                + status.pointsAppended() + " points");
          }
          break;
        }
        if (status.state() == AppendStatus.AppendState.FAILED) {
          throw new AppendException("Append request " + append_id
              + " failed: " + status.message(), appended);
        }
        final long left = deadline - ticker.read();
        if (left <= 0) {
          LOG.warn("Timed out after " + policy.waitTimeout()
              + " waiting for append request " + append_id);
          return new AppendResult(AppendResult.Status.TIMED_OUT, delivered,
              appended, append_ids);
        }
        pause(min(policy.pollInterval(), left));
      }
    }
    LOG.info("Appended " + appended + " points in " + append_ids.size()
        + " requests");
    return new AppendResult(AppendResult.Status.COMPLETED, delivered,
        appended, append_ids);
  }

  private void pause(final Duration duration) {
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RemoteStoreException("Interrupted while waiting for append "
          + "requests to complete", "append status", 0, e);
    }
  }

  private static Duration min(final Duration duration, final long nanos) {
    final Duration other = Duration.ofNanos(nanos);
    return duration.compareTo(other) <= 0 ? duration : other;
  }
}
