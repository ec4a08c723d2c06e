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
import java.time.Instant;

import com.google.common.base.Strings;

import net.pointzilla.exceptions.ConfigurationException;

/**
 * Immutable parameters of a synthetic waveform. See {@link WaveformGenerator}
 * for how they combine.
 *
 * @since 1.0
 */
public final class WaveformSpec {
  /** Which coordinate of vectorized text to emit. */
  public static enum TextChannel {
    X,
    Y
  }

  private final WaveformType type;
  private final Instant start_time;
  private final Duration interval;
  private final int number_of_points;
  private final double number_of_periods;
  private final double samples_per_period;
  private final double scalar;
  private final double offset;
  private final double phase;
  private final String text;
  private final TextChannel text_channel;

  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  private WaveformSpec(final Builder builder) {
    if (builder.start_time == null) {
      throw new ConfigurationException("Waveform start time cannot be null.");
    }
    if (builder.interval == null || builder.interval.isNegative()) {
      throw new ConfigurationException("Waveform interval must be zero or "
          + "positive.");
    }
    if (builder.number_of_points < 0) {
      throw new ConfigurationException("Number of points cannot be negative: "
          + builder.number_of_points);
    }
    if (builder.number_of_periods < 0 || Double.isNaN(builder.number_of_periods)) {
      throw new ConfigurationException("Number of periods cannot be negative: "
          + builder.number_of_periods);
    }
    if (builder.type == WaveformType.TEXT) {
      if (Strings.isNullOrEmpty(builder.text)) {
        throw new ConfigurationException("Text waveforms require the text "
            + "to vectorize.");
      }
      // fail early on unsupported characters.
      TextVectorizer.vectorize(builder.text);
    } else if (!(builder.samples_per_period > 0)) {
      throw new ConfigurationException("Waveform period must be positive: "
          + builder.samples_per_period);
    }
    type = builder.type;
    start_time = builder.start_time;
    interval = builder.interval;
    number_of_points = builder.number_of_points;
    number_of_periods = builder.number_of_periods;
    samples_per_period = builder.samples_per_period;
    scalar = builder.scalar;
    offset = builder.offset;
    phase = builder.phase;
    text = builder.text;
    text_channel = builder.text_channel;
  }

  /** @return The shape. */
  public WaveformType type() {
    return type;
  }

  /** @return The time of the first sample. */
  public Instant startTime() {
    return start_time;
  }

  /** @return The time between samples. */
  public Duration interval() {
    return interval;
  }

  /** @return The explicit number of samples, 0 to derive from periods. */
  public int numberOfPoints() {
    return number_of_points;
  }

  /** @return The number of periods used when no explicit count is set. */
  public double numberOfPeriods() {
    return number_of_periods;
  }

  /** @return The samples in one period for the mathematical shapes. */
  public double samplesPerPeriod() {
    return samples_per_period;
  }

  /** @return The amplitude multiplier. */
  public double scalar() {
    return scalar;
  }

  /** @return The vertical offset. */
  public double offset() {
    return offset;
  }

  /** @return The phase offset as a fraction of one period. */
  public double phase() {
    return phase;
  }

  /** @return The text for {@link WaveformType#TEXT}, null otherwise. */
  public String text() {
    return text;
  }

  /** @return The channel for {@link WaveformType#TEXT}. */
  public TextChannel textChannel() {
    return text_channel;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("type=")
        .append(type)
        .append(", start=")
        .append(start_time)
        .append(", interval=")
        .append(interval)
        .append(", numberOfPoints=")
        .append(number_of_points)
        .append(", numberOfPeriods=")
        .append(number_of_periods)
        .append(", period=")
        .append(samples_per_period)
        .append(", scalar=")
        .append(scalar)
        .append(", offset=")
        .append(offset)
        .append(", phase=")
        .append(phase)
        .append(type == WaveformType.TEXT ? ", text" + text_channel + "=" + text : "")
        .toString();
  }

  /** @return A new builder with the defaults of a one period sine wave. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private WaveformType type = WaveformType.SINE_WAVE;
    private Instant start_time;
    private Duration interval = Duration.ofMinutes(1);
    private int number_of_points;
    private double number_of_periods = 1;
    private double samples_per_period = 1440;
    private double scalar = 1;
    private double offset;
    private double phase;
    private String text;
    private TextChannel text_channel = TextChannel.Y;

    private Builder() { }

    public Builder setType(final WaveformType type) {
      this.type = type;
      return this;
    }

    public Builder setStartTime(final Instant start_time) {
      this.start_time = start_time;
      return this;
    }

    public Builder setInterval(final Duration interval) {
      this.interval = interval;
      return this;
    }

    public Builder setNumberOfPoints(final int number_of_points) {
      this.number_of_points = number_of_points;
      return this;
    }

    public Builder setNumberOfPeriods(final double number_of_periods) {
      this.number_of_periods = number_of_periods;
      return this;
    }

    public Builder setSamplesPerPeriod(final double samples_per_period) {
      this.samples_per_period = samples_per_period;
      return this;
    }

    public Builder setScalar(final double scalar) {
      this.scalar = scalar;
      return this;
    }

    public Builder setOffset(final double offset) {
      this.offset = offset;
      return this;
    }

    public Builder setPhase(final double phase) {
      this.phase = phase;
      return this;
    }

    /**
     * Selects {@link WaveformType#TEXT} with the given text and channel.
     * @param text The non-empty text to vectorize.
     * @param text_channel The coordinate to emit.
     * @return The builder.
     */
    public Builder setText(final String text, final TextChannel text_channel) {
      this.text = text;
      this.text_channel = text_channel == null ? TextChannel.Y : text_channel;
      this.type = WaveformType.TEXT;
      return this;
    }

    public WaveformSpec build() {
      if (type == null) {
        type = WaveformType.SINE_WAVE;
      }
      return new WaveformSpec(this);
    }
  }
}
