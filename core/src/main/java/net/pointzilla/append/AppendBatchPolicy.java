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
package net.pointzilla.append;

import java.time.Duration;

import net.pointzilla.exceptions.ConfigurationException;

/**
 * How points are split into append requests and how long to wait for them.
 *
 * @since 1.0
 */
public final class AppendBatchPolicy {
  public static final int DEFAULT_BATCH_SIZE = 500_000;
  public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofMinutes(5);
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMinutes(5);

  private final int batch_size;
  private final boolean wait;
  private final Duration wait_timeout;
  private final Duration poll_interval;
  private final Duration request_timeout;

  private AppendBatchPolicy(final Builder builder) {
    if (builder.batch_size <= 0) {
      throw new ConfigurationException("Batch size must be positive: "
          + builder.batch_size);
    }
    if (builder.wait_timeout == null || builder.wait_timeout.isNegative()) {
      throw new ConfigurationException("Wait timeout cannot be negative.");
    }
    if (builder.poll_interval == null || builder.poll_interval.isNegative()
        || builder.poll_interval.isZero()) {
      throw new ConfigurationException("Poll interval must be positive.");
    }
    if (builder.request_timeout == null || builder.request_timeout.isNegative()
        || builder.request_timeout.isZero()) {
      throw new ConfigurationException("Request timeout must be positive.");
    }
    batch_size = builder.batch_size;
    wait = builder.wait;
    wait_timeout = builder.wait_timeout;
    poll_interval = builder.poll_interval;
    request_timeout = builder.request_timeout;
  }

  /** @return The maximum number of points per append request. */
  public int batchSize() {
    return batch_size;
  }

  /** @return Whether to poll until the requests complete. */
  public boolean waitForCompletion() {
    return wait;
  }

  /** @return The deadline shared by all completion polls. */
  public Duration waitTimeout() {
    return wait_timeout;
  }

  /** @return The pause between status polls. */
  public Duration pollInterval() {
    return poll_interval;
  }

  /** @return How long a single store call may take. */
  public Duration requestTimeout() {
    return request_timeout;
  }

  @Override
  public String toString() {
    return "batchSize=" + batch_size + ", wait=" + wait + ", waitTimeout="
        + wait_timeout + ", pollInterval=" + poll_interval
        + ", requestTimeout=" + request_timeout;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private int batch_size = DEFAULT_BATCH_SIZE;
    private boolean wait = true;
    private Duration wait_timeout = DEFAULT_WAIT_TIMEOUT;
    private Duration poll_interval = DEFAULT_POLL_INTERVAL;
    private Duration request_timeout = DEFAULT_REQUEST_TIMEOUT;

    private Builder() { }

    public Builder setBatchSize(final int batch_size) {
      this.batch_size = batch_size;
      return this;
    }

    public Builder setWait(final boolean wait) {
      this.wait = wait;
      return this;
    }

    public Builder setWaitTimeout(final Duration wait_timeout) {
      this.wait_timeout = wait_timeout;
      return this;
    }

    public Builder setPollInterval(final Duration poll_interval) {
      this.poll_interval = poll_interval;
      return this;
    }

    public Builder setRequestTimeout(final Duration request_timeout) {
      this.request_timeout = request_timeout;
      return this;
    }

    /**
     * @return The policy.
     * @throws ConfigurationException if a value is out of range.
     */
    public AppendBatchPolicy build() {
      return new AppendBatchPolicy(this);
    }
  }
}
