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

import com.google.common.base.Objects;
import com.google.common.base.Strings;

/**
 * The address and optional credentials of a remote time-series store.
 *
 * @since 1.0
 */
public final class ServerConnection {
  private final String server;
  private final String username;
  private final String password;

  /**
   * Default ctor.
   * @param server A non-null and non-empty server name or URL.
   * @param username An optional user name.
   * @param password An optional password.
   * @throws IllegalArgumentException if the server was null or empty.
   */
  public ServerConnection(final String server,
                          final String username,
                          final String password) {
    if (Strings.isNullOrEmpty(server) || server.trim().isEmpty()) {
      throw new IllegalArgumentException("Server cannot be null or empty.");
    }
    this.server = server.trim();
    this.username = Strings.emptyToNull(username);
    this.password = Strings.emptyToNull(password);
  }

  /** @return The server name or URL. */
  public String server() {
    return server;
  }

  /** @return The user name, may be null. */
  public String username() {
    return username;
  }

  /** @return The password, may be null. */
  public String password() {
    return password;
  }

  /** @return True if a user name was supplied. */
  public boolean hasCredentials() {
    return username != null;
  }

  /**
   * Returns a connection to a different server that borrows this
   * connection's credentials when the other one has none.
   * @param other A non-null connection.
   * @return The other connection, possibly with credentials filled in.
   */
  public ServerConnection inheritCredentials(final ServerConnection other) {
    if (other.hasCredentials()) {
      return other;
    }
    return new ServerConnection(other.server, username, password);
  }

  /**
   * @param other A connection, may be null.
   * @return True if the other connection points at the same server.
   */
  public boolean sameServer(final ServerConnection other) {
    return other != null && server.equalsIgnoreCase(other.server);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ServerConnection other = (ServerConnection) o;
    return Objects.equal(server, other.server)
        && Objects.equal(username, other.username)
        && Objects.equal(password, other.password);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(server, username, password);
  }

  /** Never prints the password. */
  @Override
  public String toString() {
    return username == null ? server : username + "@" + server;
  }
}
