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
package net.pointzilla.storage.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.stumbleupon.async.Deferred;

import net.pointzilla.data.ServerConnection;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.storage.TimeSeriesStore;
import net.pointzilla.storage.TimeSeriesStoreFactory;

/**
 * Opens {@link HttpTimeSeriesStore}s that share one lazily started
 * {@link SharedHttpClient}. Stores do not close the client; call
 * {@link #shutdown()} when the run is over.
 * <p>
 * A server given as a full URL, e.g. {@code https://host:8443/api}, is used
 * as the base URL as is. A bare host name becomes
 * {@code scheme://host/base_path}.
 *
 * @since 1.0
 */
public class HttpTimeSeriesStoreFactory implements TimeSeriesStoreFactory {
  private static final Logger LOG = LoggerFactory.getLogger(
      HttpTimeSeriesStoreFactory.class);

  public static final String DEFAULT_SCHEME = "https";
  public static final String DEFAULT_BASE_PATH = "api/v1";

  private final String scheme;
  private final String base_path;
  private final int io_threads;
  private final int connect_timeout_ms;
  private final int socket_timeout_ms;

  /** Created on the first connect. */
  private SharedHttpClient client;

  /**
   * Default ctor.
   * @param scheme The scheme for bare host names, e.g. {@code https}.
   * @param base_path The path of the API below the host, may be empty.
   * @param io_threads The number of HTTP reactor threads.
   * @param connect_timeout_ms The connect timeout in milliseconds.
   * @param socket_timeout_ms The read timeout in milliseconds.
   */
  public HttpTimeSeriesStoreFactory(final String scheme,
                                    final String base_path,
                                    final int io_threads,
                                    final int connect_timeout_ms,
                                    final int socket_timeout_ms) {
    if (Strings.isNullOrEmpty(scheme)) {
      throw new ConfigurationException("HTTP scheme cannot be null or empty.");
    }
    if (io_threads < 1) {
      throw new ConfigurationException("HTTP IO threads must be at least 1: "
          + io_threads);
    }
    this.scheme = scheme;
    this.base_path = Strings.nullToEmpty(base_path);
    this.io_threads = io_threads;
    this.connect_timeout_ms = connect_timeout_ms;
    this.socket_timeout_ms = socket_timeout_ms;
  }

  /**
   * Ctor for an already started client.
   * @param client The non-null client.
   * @param scheme The scheme for bare host names.
   * @param base_path The path of the API below the host.
   */
  HttpTimeSeriesStoreFactory(final SharedHttpClient client,
                             final String scheme,
                             final String base_path) {
    this(scheme, base_path, SharedHttpClient.DEFAULT_IO_THREADS, 0, 0);
    this.client = client;
  }

  @Override
  public synchronized TimeSeriesStore connect(final ServerConnection server) {
    if (server == null) {
      throw new ConfigurationException("A server is required.");
    }
    if (client == null) {
      client = new SharedHttpClient(io_threads, connect_timeout_ms,
          socket_timeout_ms);
    }
    final String base_url = baseUrl(server.server());
    LOG.info("Connecting to " + base_url
        + (server.hasCredentials() ? " as " + server.username() : ""));
    return new HttpTimeSeriesStore(client, base_url, server, false);
  }

  /**
   * @param server The non-null server name or URL.
   * @return The base URL of the API on that server.
   */
  public String baseUrl(final String server) {
    if (server.contains("://")) {
      return server;
    }
    final String path = base_path.startsWith("/") ?
        base_path.substring(1) : base_path;
    return scheme + "://" + server + (path.isEmpty() ? "" : "/" + path);
  }

  @Override
  public synchronized Deferred<Object> shutdown() {
    if (client == null) {
      return Deferred.fromResult(null);
    }
    final SharedHttpClient closing = client;
    client = null;
    return closing.shutdown();
  }
}
