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

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.pointzilla.data.Point;
import net.pointzilla.data.ServerConnection;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.exceptions.RemoteStoreException;
import net.pointzilla.storage.TimeSeriesStore;
import net.pointzilla.storage.TimeSeriesStoreFactory;
import net.pointzilla.utils.Deferreds;

/**
 * Copies the points of an existing series, either from the primary store or,
 * when the source names another server, from a connection opened just for
 * the copy and closed afterwards.
 *
 * @since 1.0
 */
public class SourceCopyPointSource implements PointSource {
  private static final Logger LOG = LoggerFactory.getLogger(
      SourceCopyPointSource.class);

  private final SourceCopySpec spec;

  /** The store of the run, may be null when only saving a CSV. */
  private final TimeSeriesStore primary_store;

  /** The connection of the primary store, may be null. */
  private final ServerConnection primary_connection;

  private final TimeSeriesStoreFactory factory;

  private final Duration timeout;

  /**
   * Default ctor.
   * @param spec The non-null copy spec.
   * @param primary_store The primary store, may be null.
   * @param primary_connection The primary server, may be null.
   * @param factory A non-null factory for other servers.
   * @param timeout The non-null timeout for each remote call.
   */
  public SourceCopyPointSource(final SourceCopySpec spec,
                               final TimeSeriesStore primary_store,
                               final ServerConnection primary_connection,
                               final TimeSeriesStoreFactory factory,
                               final Duration timeout) {
    if (spec == null) {
      throw new IllegalArgumentException("Spec cannot be null.");
    }
    if (factory == null) {
      throw new IllegalArgumentException("Factory cannot be null.");
    }
    if (timeout == null) {
      throw new IllegalArgumentException("Timeout cannot be null.");
    }
    this.spec = spec;
    this.primary_store = primary_store;
    this.primary_connection = primary_connection;
    this.factory = factory;
    this.timeout = timeout;
  }

  @Override
  public String describe() {
    return "copy of " + spec;
  }

  @Override
  public List<Point> load() {
    final ServerConnection source_server = spec.source().server();
    final boolean use_primary = source_server == null
        || source_server.sameServer(primary_connection);

    final TimeSeriesStore store;
    final String server_name;
    if (use_primary) {
      if (primary_store == null) {
        throw new ConfigurationException("A server is required to load the "
            + "source time series " + spec.source());
      }
      store = primary_store;
      server_name = primary_connection == null ?
          "the primary server" : primary_connection.server();
    } else {
      final ServerConnection connection = primary_connection == null ?
          source_server : primary_connection.inheritCredentials(source_server);
      server_name = connection.server();
      try {
        store = factory.connect(connection);
      } catch (ConfigurationException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new ConfigurationException("Unable to connect to " + connection
            + ": " + e.getMessage(), e);
      }
      LOG.info("Connected to " + connection + " to copy " + spec.source());
    }

    try {
      final String unique_id;
      try {
        unique_id = Deferreds.join(
            store.resolveSeriesIdentifier(spec.source().identifier()),
            timeout, server_name);
      } catch (RemoteStoreException e) {
        throw new ConfigurationException("Unable to resolve source time "
            + "series '" + spec.source().identifier() + "' on " + server_name
            + ": " + e.getMessage(), e);
      }

      final List<Point> points = Deferreds.join(
          store.getSeriesPoints(unique_id, spec.queryFrom(), spec.queryTo()),
          timeout, server_name);
      LOG.info("Loaded " + points.size() + " points from " + describe());
      return points;
    } finally {
      if (!use_primary) {
        shutdown(store, server_name);
      }
    }
  }

  private void shutdown(final TimeSeriesStore store, final String server_name) {
    try {
      Deferreds.join(store.shutdown(), timeout, server_name);
    } catch (RuntimeException e) {
      LOG.warn("Failed to shut down the connection to " + server_name, e);
    }
  }
}
