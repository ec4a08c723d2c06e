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
package net.pointzilla.utils;

import java.time.Duration;

import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.TimeoutException;

import net.pointzilla.exceptions.RemoteStoreException;

/**
 * Helpers for blocking on {@link Deferred} results from the store clients in
 * the single threaded pipeline.
 *
 * @since 1.0
 */
public final class Deferreds {

  private Deferreds() { }

  /**
   * Waits for the deferred to call back. Runtime exceptions the deferred
   * was called back with are re-thrown as is; anything else, including a
   * timeout, is wrapped in a {@link RemoteStoreException}.
   * @param deferred A non-null deferred.
   * @param timeout The maximum amount of time to wait, must be positive.
   * @param endpoint A description of the remote call for error messages.
   * @return The result of the deferred.
   * @throws RemoteStoreException if the call failed or timed out.
   */
  public static <T> T join(final Deferred<T> deferred,
                           final Duration timeout,
                           final String endpoint) {
    try {
      return deferred.join(Math.max(1, timeout.toMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RemoteStoreException("Interrupted while waiting on "
          + endpoint, endpoint, 0, e);
    } catch (TimeoutException e) {
      throw new RemoteStoreException("Timed out after " + timeout
          + " waiting on " + endpoint, endpoint, 0, e);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new RemoteStoreException("Call to " + endpoint + " failed: "
          + e.getMessage(), endpoint, 0, e);
    }
  }
}
