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
package net.pointzilla.data;

import java.util.List;

import com.google.common.base.Objects;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

/**
 * A reference to a time series by name or unique ID, optionally prefixed
 * with the server that holds it:
 * <ul>
 * <li>{@code Stage.Working@Location}</li>
 * <li>{@code [otherserver]Stage.Working@Location}</li>
 * <li>{@code [otherserver:user:password]Stage.Working@Location}</li>
 * </ul>
 *
 * @since 1.0
 */
public final class TimeSeriesIdentifier {
  private static final Splitter SERVER_SPLITTER = Splitter.on(':').limit(3);

  /** The name or unique ID. */
  private final String identifier;

  /** The optional server, null means the primary server. */
  private final ServerConnection server;

  /**
   * Default ctor.
   * @param identifier A non-null and non-empty identifier.
   * @param server An optional server.
   */
  public TimeSeriesIdentifier(final String identifier,
                              final ServerConnection server) {
    if (Strings.isNullOrEmpty(identifier) || identifier.trim().isEmpty()) {
      throw new IllegalArgumentException(
          "Time series identifier cannot be null or empty.");
    }
    this.identifier = identifier.trim();
    this.server = server;
  }

  /** @return The name or unique ID of the series. */
  public String identifier() {
    return identifier;
  }

  /** @return The server holding the series or null if it lives on the
   * primary server. */
  public ServerConnection server() {
    return server;
  }

  /**
   * Parses a reference with an optional bracketed server prefix.
   * @param text The non-null and non-empty text to parse.
   * @return The parsed identifier.
   * @throws IllegalArgumentException if the text was malformed.
   */
  public static TimeSeriesIdentifier parse(final String text) {
    if (Strings.isNullOrEmpty(text)) {
      throw new IllegalArgumentException(
          "Time series identifier cannot be null or empty.");
    }
    final String trimmed = text.trim();
    if (!trimmed.startsWith("[")) {
      return new TimeSeriesIdentifier(trimmed, null);
    }
    final int close = trimmed.indexOf(']');
    if (close < 0) {
      throw new IllegalArgumentException("Missing ']' in time series "
          + "identifier: " + text);
    }
    final List<String> parts = SERVER_SPLITTER.splitToList(
        trimmed.substring(1, close));
    if (parts.size() == 2) {
      throw new IllegalArgumentException("Server prefix must be [server] or "
          + "[server:username:password] in: " + text);
    }
    final ServerConnection server = new ServerConnection(
        parts.get(0),
        parts.size() > 1 ? parts.get(1) : null,
        parts.size() > 2 ? parts.get(2) : null);
    return new TimeSeriesIdentifier(trimmed.substring(close + 1), server);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeSeriesIdentifier other = (TimeSeriesIdentifier) o;
    return Objects.equal(identifier, other.identifier)
        && Objects.equal(server, other.server);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(identifier, server);
  }

  @Override
  public String toString() {
    return server == null ? identifier : "[" + server.server() + "]" + identifier;
  }
}
