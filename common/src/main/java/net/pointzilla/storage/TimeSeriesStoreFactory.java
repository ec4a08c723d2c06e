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

import com.stumbleupon.async.Deferred;

import net.pointzilla.data.ServerConnection;

/**
 * Opens {@link TimeSeriesStore} clients.
 *
 * @since 1.0
 */
public interface TimeSeriesStoreFactory {

  /**
   * Opens a client for the given server.
   * @param connection A non-null connection.
   * @return A non-null store client.
   * @throws net.pointzilla.exceptions.ConfigurationException if the
   * connection could not be used.
   */
  public TimeSeriesStore connect(final ServerConnection connection);

  /**
   * Releases what the factory shares between its stores. Stores opened
   * earlier must not be used afterwards.
   * @return A deferred resolving to null once released.
   */
  public Deferred<Object> shutdown();
}
