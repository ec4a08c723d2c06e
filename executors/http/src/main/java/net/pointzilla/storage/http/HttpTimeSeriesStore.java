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

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.List;

import org.apache.http.HttpHeaders;
import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.concurrent.FutureCallback;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Function;
import com.google.common.base.Strings;
import com.google.common.net.UrlEscapers;
import com.stumbleupon.async.Deferred;

import net.pointzilla.data.Point;
import net.pointzilla.data.ServerConnection;
import net.pointzilla.data.TimeRange;
import net.pointzilla.exceptions.RemoteStoreException;
import net.pointzilla.storage.AppendStatus;
import net.pointzilla.storage.TimeSeriesStore;
import net.pointzilla.utils.DateTime;
import net.pointzilla.utils.JSON;

/**
 * A {@link TimeSeriesStore} speaking JSON over HTTP. Every call is a single
 * request whose response completes the returned deferred on the client's
 * IO threads.
 *
 * @since 1.0
 */
public class HttpTimeSeriesStore implements TimeSeriesStore {
  private static final Logger LOG = LoggerFactory.getLogger(
      HttpTimeSeriesStore.class);

  private final SharedHttpClient client;

  /** Base URL without a trailing slash. */
  private final String base_url;

  private final ServerConnection connection;

  /** The Basic authorization header value or null. */
  private final String authorization;

  /** Whether {@link #shutdown()} closes the client. */
  private final boolean owns_client;

  /**
   * Default ctor.
   * @param client The non-null started client.
   * @param base_url The non-null base URL of the store API.
   * @param connection The non-null server and credentials.
   * @param owns_client Whether shutting down closes the client.
   */
  public HttpTimeSeriesStore(final SharedHttpClient client,
                             final String base_url,
                             final ServerConnection connection,
                             final boolean owns_client) {
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    if (Strings.isNullOrEmpty(base_url)) {
      throw new IllegalArgumentException("Base URL cannot be null or empty.");
    }
    if (connection == null) {
      throw new IllegalArgumentException("Connection cannot be null.");
    }
    this.client = client;
    this.base_url = base_url.endsWith("/") ?
        base_url.substring(0, base_url.length() - 1) : base_url;
    this.connection = connection;
    this.owns_client = owns_client;
    if (connection.hasCredentials()) {
      final String pair = connection.username() + ":"
          + Strings.nullToEmpty(connection.password());
      authorization = "Basic " + Base64.getEncoder().encodeToString(
          pair.getBytes(StandardCharsets.UTF_8));
    } else {
      authorization = null;
    }
  }

  /** @return The base URL of the API. */
  public String baseUrl() {
    return base_url;
  }

  @Override
  public Deferred<String> resolveSeriesIdentifier(final String identifier) {
    final HttpGet get = new HttpGet(base_url + "/timeseries/resolve?identifier="
        + UrlEscapers.urlFormParameterEscaper().escape(identifier));
    return execute(get, "resolve " + identifier, new Function<String, String>() {
      @Override
      public String apply(final String body) {
        final StoreJson.ResolveResponse response =
            JSON.parseToObject(body, StoreJson.ResolveResponse.class);
        if (Strings.isNullOrEmpty(response.unique_id)) {
          throw new IllegalArgumentException("Missing UniqueId");
        }
        return response.unique_id;
      }
    });
  }

  @Override
  public Deferred<String> appendPoints(final String series_id,
                                       final List<Point> points,
                                       final TimeRange overwrite_range) {
    final HttpPost post = new HttpPost(seriesUrl(series_id) + "/append");
    post.setEntity(new StringEntity(JSON.serializeToString(
        StoreJson.AppendRequest.of(points, overwrite_range)),
        ContentType.APPLICATION_JSON));
    return execute(post, "append " + points.size() + " points to " + series_id,
        new Function<String, String>() {
      @Override
      public String apply(final String body) {
        final StoreJson.AppendResponse response =
            JSON.parseToObject(body, StoreJson.AppendResponse.class);
        if (Strings.isNullOrEmpty(response.append_request_identifier)) {
          throw new IllegalArgumentException("Missing AppendRequestIdentifier");
        }
        return response.append_request_identifier;
      }
    });
  }

  @Override
  public Deferred<AppendStatus> getAppendStatus(final String append_id) {
    final HttpGet get = new HttpGet(base_url + "/timeseries/appendstatus/"
        + UrlEscapers.urlPathSegmentEscaper().escape(append_id));
    return execute(get, "append status " + append_id,
        new Function<String, AppendStatus>() {
      @Override
      public AppendStatus apply(final String body) {
        return JSON.parseToObject(body, StoreJson.StatusResponse.class)
            .toStatus();
      }
    });
  }

  @Override
  public Deferred<List<Point>> getSeriesPoints(final String series_id,
                                               final Instant from,
                                               final Instant to) {
    final StringBuilder url = new StringBuilder(seriesUrl(series_id))
        .append("/points");
    char separator = '?';
    if (from != null) {
      url.append(separator).append("queryFrom=")
         .append(UrlEscapers.urlFormParameterEscaper().escape(from.toString()));
      separator = '&';
    }
    if (to != null) {
      url.append(separator).append("queryTo=")
         .append(UrlEscapers.urlFormParameterEscaper().escape(to.toString()));
    }
    return execute(new HttpGet(url.toString()), "points of " + series_id,
        new Function<String, List<Point>>() {
      @Override
      public List<Point> apply(final String body) {
        return JSON.parseToObject(body, StoreJson.PointsResponse.class)
            .toPoints();
      }
    });
  }

  @Override
  public Deferred<Object> shutdown() {
    if (owns_client) {
      return client.shutdown();
    }
    return Deferred.fromResult(null);
  }

  @Override
  public String toString() {
    return "HttpTimeSeriesStore(" + base_url + ", " + connection + ")";
  }

  private String seriesUrl(final String series_id) {
    return base_url + "/timeseries/"
        + UrlEscapers.urlPathSegmentEscaper().escape(series_id);
  }

  /**
   * Sends the request and parses a successful body with the parser.
   * @param request The non-null request.
   * @param description What the call does, for errors and logs.
   * @param parser Converts the body. Its exceptions fail the deferred.
   * @return The deferred result.
   */
  private <T> Deferred<T> execute(final HttpRequestBase request,
                                  final String description,
                                  final Function<String, T> parser) {
    final long start = DateTime.nanoTime();
    final String endpoint = request.getMethod() + " " + request.getURI();
    final Deferred<T> deferred = new Deferred<T>();
    request.addHeader(HttpHeaders.ACCEPT, "application/json");
    request.addHeader(HttpHeaders.ACCEPT_ENCODING, "gzip, deflate");
    if (authorization != null) {
      request.addHeader(HttpHeaders.AUTHORIZATION, authorization);
    }

    class ResponseCallback implements FutureCallback<HttpResponse> {

      @Override
      public void completed(final HttpResponse response) {
        final T result;
        try {
          final String body = SharedHttpClient.parseResponse(response, endpoint);
          result = parser.apply(body);
        } catch (RemoteStoreException e) {
          deferred.callback(e);
          return;
        } catch (RuntimeException e) {
          deferred.callback(new RemoteStoreException("Unexpected response to "
              + description + ": " + e.getMessage(), endpoint,
              response.getStatusLine().getStatusCode(), e));
          return;
        }
        if (LOG.isDebugEnabled()) {
          LOG.debug("Successful response to [" + description + "] after "
              + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
        }
        deferred.callback(result);
      }

      @Override
      public void failed(final Exception ex) {
        deferred.callback(new RemoteStoreException("Failed to " + description
            + ": " + ex.getMessage(), endpoint, 0, ex));
      }

      @Override
      public void cancelled() {
        if (LOG.isDebugEnabled()) {
          LOG.debug("HTTP request was cancelled: " + endpoint);
        }
        deferred.callback(new RemoteStoreException("Request was cancelled: "
            + description, endpoint, 0));
      }
    }

    if (LOG.isDebugEnabled()) {
      LOG.debug("Sending " + endpoint);
    }
    client.getClient().execute(request, new ResponseCallback());
    return deferred;
  }
}
