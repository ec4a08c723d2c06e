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
package net.pointzilla.core;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.Lists;

import net.pointzilla.append.AppendBatcher;
import net.pointzilla.append.AppendResult;
import net.pointzilla.csv.CsvPointSource;
import net.pointzilla.csv.CsvPointWriter;
import net.pointzilla.data.Point;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.exceptions.IllegalDataException;
import net.pointzilla.exceptions.RemoteStoreException;
import net.pointzilla.sources.ManualPointCollector;
import net.pointzilla.sources.PointSource;
import net.pointzilla.sources.SourceCopyPointSource;
import net.pointzilla.sources.WaveformGenerator;
import net.pointzilla.storage.TimeSeriesStore;
import net.pointzilla.storage.TimeSeriesStoreFactory;
import net.pointzilla.transform.PointTransformer;
import net.pointzilla.utils.Deferreds;

/**
 * Runs one {@link AppendContext}: loads the configured sources, transforms
 * the points, optionally saves them to a CSV and delivers them to the
 * target series.
 *
 * @since 1.0
 */
public class PointsAppender {
  private static final Logger LOG = LoggerFactory.getLogger(
      PointsAppender.class);

  private final TimeSeriesStoreFactory factory;
  private final Ticker ticker;
  private final AppendBatcher.Sleeper sleeper;

  /**
   * Default ctor.
   * @param factory The non-null factory for store connections.
   */
  public PointsAppender(final TimeSeriesStoreFactory factory) {
    this(factory, Ticker.systemTicker(), null);
  }

  /**
   * Ctor with an injected clock for the completion wait.
   * @param factory The non-null factory for store connections.
   * @param ticker The non-null clock.
   * @param sleeper The pause between polls, null for the thread sleeper.
   */
  public PointsAppender(final TimeSeriesStoreFactory factory,
                        final Ticker ticker,
                        final AppendBatcher.Sleeper sleeper) {
    if (factory == null) {
      throw new IllegalArgumentException("Factory cannot be null.");
    }
    this.factory = factory;
    this.ticker = ticker;
    this.sleeper = sleeper;
  }

  /**
   * Runs the context.
   * @param context The non-null context.
   * @return The result of the delivery.
   * @throws ConfigurationException if a source or the target is unusable.
   * @throws IllegalDataException if an input or output file is invalid.
   * @throws RemoteStoreException if a store call failed.
   * @throws net.pointzilla.exceptions.AppendException if a batch failed.
   */
  public AppendResult run(final AppendContext context) {
    final Stopwatch timer = Stopwatch.createStarted();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Running " + context);
    }

    TimeSeriesStore store = null;
    try {
      if (context.needsPrimaryStore()) {
        store = connect(context);
      }

      final List<Point> loaded = Lists.newArrayList();
      for (final PointSource source : sources(context, store)) {
        final List<Point> points = source.load();
        LOG.info("Loaded " + points.size() + " points from "
            + source.describe());
        loaded.addAll(points);
      }
      final List<Point> points = new PointTransformer(context.transform())
          .transform(loaded);

      if (context.saveCsvPath() != null) {
        save(context, points);
      }
      if (context.stopAfterSavingCsv()) {
        LOG.info("Stopping after saving " + points.size() + " points");
        return AppendResult.notSent();
      }
      if (points.isEmpty()) {
        LOG.warn("No points to append to " + context.targetSeries());
        return AppendResult.notSent();
      }

      final String series_id = resolve(store, context);
      final AppendResult result = newBatcher(store, context)
          .append(series_id, points, context.timeRange());
      LOG.info("Finished " + context.targetSeries() + " in "
          + timer.elapsed().toMillis() + " ms: " + result);
      return result;
    } finally {
      if (store != null) {
        shutdown(store, context);
      }
    }
  }

  /**
   * @param context The non-null context.
   * @param store The primary store, may be null.
   * @return The sources in the order manual, waveform, CSV files, copy.
   */
  List<PointSource> sources(final AppendContext context,
                            final TimeSeriesStore store) {
    final List<PointSource> sources = Lists.newArrayList();
    if (!context.manualPoints().isEmpty()) {
      sources.add(new ManualPointCollector(context.startTime(),
          context.pointInterval(), context.manualPoints(),
          context.defaultGrade(), context.defaultQualifiers()));
    }
    if (context.waveform() != null) {
      sources.add(new WaveformGenerator(context.waveform(),
          context.defaultGrade(), context.defaultQualifiers()));
    }
    for (final Path path : context.csvFiles()) {
      sources.add(new CsvPointSource(path, context.csvFormat()));
    }
    if (context.sourceCopy() != null) {
      sources.add(new SourceCopyPointSource(context.sourceCopy(), store,
          context.server(), factory,
          context.batchPolicy().requestTimeout()));
    }
    return sources;
  }

  private TimeSeriesStore connect(final AppendContext context) {
    try {
      final TimeSeriesStore store = factory.connect(context.server());
      LOG.info("Connected to " + context.server());
      return store;
    } catch (ConfigurationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigurationException("Unable to connect to "
          + context.server() + ": " + e.getMessage(), e);
    }
  }

  private String resolve(final TimeSeriesStore store,
                         final AppendContext context) {
    try {
      return Deferreds.join(
          store.resolveSeriesIdentifier(context.targetSeries()),
          context.batchPolicy().requestTimeout(),
          context.server().server());
    } catch (RemoteStoreException e) {
      if (e.statusCode() == 404) {
        throw new ConfigurationException("Target time series '"
            + context.targetSeries() + "' does not exist on "
            + context.server().server(), e);
      }
      throw e;
    }
  }

  private void save(final AppendContext context, final List<Point> points) {
    try {
      new CsvPointWriter(context.generator())
          .write(context.saveCsvPath(), context.targetSeries(), points);
    } catch (IOException e) {
      throw new IllegalDataException("Unable to save points to '"
          + context.saveCsvPath() + "': " + e.getMessage(), e);
    }
  }

  private AppendBatcher newBatcher(final TimeSeriesStore store,
                                   final AppendContext context) {
    if (sleeper == null) {
      return new AppendBatcher(store, context.batchPolicy(), context.command());
    }
    return new AppendBatcher(store, context.batchPolicy(), context.command(),
        ticker, sleeper);
  }

  private void shutdown(final TimeSeriesStore store,
                        final AppendContext context) {
    try {
      Deferreds.join(store.shutdown(), context.batchPolicy().requestTimeout(),
          context.server().server());
    } catch (RuntimeException e) {
      LOG.warn("Failed to shut down the connection to " + context.server(), e);
    }
  }
}
