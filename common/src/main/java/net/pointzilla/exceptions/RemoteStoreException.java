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
package net.pointzilla.exceptions;

/**
 * An exception that occurred when calling a remote time-series store.
 *
 * @since 1.0
 */
public class RemoteStoreException extends RuntimeException {
  private static final long serialVersionUID = 6935006413187713625L;

  /** A description of the remote service that threw the exception. */
  private final String remote_endpoint;

  /** An optional status code, 0 if the call never got a response. */
  private final int status_code;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this exception.
   * @param status_code An optional status code reflecting the error state.
   */
  public RemoteStoreException(final String msg,
                              final String remote_endpoint,
                              final int status_code) {
    super(msg);
    this.remote_endpoint = remote_endpoint;
    this.status_code = status_code;
  }

  /**
   * Ctor that takes a descriptive message, status code and the cause.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this exception.
   * @param status_code An optional status code reflecting the error state.
   * @param e The original exception that caused this to be thrown.
   */
  public RemoteStoreException(final String msg,
                              final String remote_endpoint,
                              final int status_code,
                              final Throwable e) {
    super(msg, e);
    this.remote_endpoint = remote_endpoint;
    this.status_code = status_code;
  }

  /** @return The remote endpoint that threw this exception. */
  public String remoteEndpoint() {
    return remote_endpoint;
  }

  /** @return The status code, 0 if unknown. */
  public int statusCode() {
    return status_code;
  }
}
