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

import java.io.IOException;
import java.util.Locale;

import org.apache.http.HttpResponse;
import org.apache.http.ParseException;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.entity.DeflateDecompressingEntity;
import org.apache.http.client.entity.GzipDecompressingEntity;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.impl.nio.client.HttpAsyncClients;
import org.apache.http.impl.nio.reactor.IOReactorConfig;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.stumbleupon.async.Deferred;

import net.pointzilla.exceptions.RemoteStoreException;
import net.pointzilla.utils.JSON;

/**
 * A started asynchronous HTTP client shared by the store connections of a
 * run, plus the response handling they have in common.
 *
 * @since 1.0
 */
public class SharedHttpClient {
  private static final Logger LOG = LoggerFactory.getLogger(
      SharedHttpClient.class);

  public static final int DEFAULT_IO_THREADS = 8;
  public static final int DEFAULT_MAX_CONNECTIONS = 200;
  public static final int DEFAULT_MAX_CONNECTIONS_PER_ROUTE = 25;

  /** The client. */
  protected final CloseableHttpAsyncClient client;

  /**
   * Builds and starts a client.
   * @param io_threads The number of reactor threads.
   * @param connect_timeout_ms The connect timeout in milliseconds.
   * @param socket_timeout_ms The socket read timeout in milliseconds.
   */
  public SharedHttpClient(final int io_threads,
                          final int connect_timeout_ms,
                          final int socket_timeout_ms) {
    this(HttpAsyncClients.custom()
        .setDefaultIOReactorConfig(IOReactorConfig.custom()
            .setIoThreadCount(io_threads).build())
        .setDefaultRequestConfig(RequestConfig.custom()
            .setConnectTimeout(connect_timeout_ms)
            .setSocketTimeout(socket_timeout_ms)
            .build())
        .setMaxConnTotal(DEFAULT_MAX_CONNECTIONS)
        .setMaxConnPerRoute(DEFAULT_MAX_CONNECTIONS_PER_ROUTE)
        .build());
    client.start();
    LOG.info("Initialized shared HTTP client with " + io_threads
        + " IO threads.");
  }

  /**
   * Wraps an existing client. The caller starts it.
   * @param client The non-null client.
   */
  SharedHttpClient(final CloseableHttpAsyncClient client) {
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    this.client = client;
  }

  /**
   * NOTE: Do not close it.
   * @return The non-null client.
   */
  public CloseableHttpAsyncClient getClient() {
    return client;
  }

  /** @return A deferred resolving to null once the client is closed. */
  public Deferred<Object> shutdown() {
    try {
      client.close();
    } catch (IOException e) {
      LOG.error("Failed to close HTTP client", e);
    }
    return Deferred.fromResult(null);
  }

  /**
   * Decompresses the entity and reads it as a string. Statuses outside the
   * 2xx range become a {@link RemoteStoreException}, with the message of a
   * {@code {"error":{"message":...}}} body when the server sends one.
   * @param response The non-null response to parse.
   * @param remote_endpoint A description of the call.
   * @return The body, possibly empty.
   * @throws RemoteStoreException on error statuses or unreadable bodies.
   */
  public static String parseResponse(final HttpResponse response,
                                     final String remote_endpoint) {
    final int status = response.getStatusLine().getStatusCode();
    final String content;
    if (response.getEntity() == null) {
      if (status >= 200 && status < 300) {
        return "";
      }
      throw new RemoteStoreException("Empty response with status " + status
          + " from " + remote_endpoint, remote_endpoint, status);
    }

    try {
      final String encoding = (response.getEntity().getContentEncoding() != null &&
          response.getEntity().getContentEncoding().getValue() != null ?
              response.getEntity().getContentEncoding().getValue()
                .toLowerCase(Locale.ROOT) : "");
      if (encoding.equals("gzip") || encoding.equals("x-gzip")) {
        content = EntityUtils.toString(
            new GzipDecompressingEntity(response.getEntity()), "UTF-8");
      } else if (encoding.equals("deflate")) {
        content = EntityUtils.toString(
            new DeflateDecompressingEntity(response.getEntity()), "UTF-8");
      } else if (encoding.isEmpty() || encoding.equals("identity")) {
        content = EntityUtils.toString(response.getEntity(), "UTF-8");
      } else {
        throw new RemoteStoreException("Unhandled content encoding ["
            + encoding + "] from " + remote_endpoint, remote_endpoint, status);
      }
    } catch (ParseException | IOException e) {
      LOG.error("Failed to read content from HTTP response: " + response, e);
      throw new RemoteStoreException("Content parsing failure from "
          + remote_endpoint, remote_endpoint, status, e);
    }

    if (status >= 200 && status < 300) {
      return content;
    }

    if (content.startsWith("{")) {
      try {
        final JsonNode root = JSON.getMapper().readTree(content);
        final JsonNode node = root.get("error");
        if (node != null && !node.isNull()) {
          final JsonNode message = node.get("message");
          if (message != null && !message.isNull()) {
            throw new RemoteStoreException(message.asText(), remote_endpoint,
                status);
          }
        }
      } catch (IOException e) {
        LOG.warn("Failed to parse the JSON error: " + content, e);
      }
    }
    throw new RemoteStoreException(content.isEmpty() ?
        "Status " + status + " from " + remote_endpoint : content,
        remote_endpoint, status);
  }
}
