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

import com.google.common.base.Strings;

import net.pointzilla.exceptions.ConfigurationException;

/**
 * The shapes a {@link WaveformGenerator} can synthesize.
 *
 * @since 1.0
 */
public enum WaveformType {
  /** {@code sin(angle)} */
  SINE_WAVE,

  /** +1 for the first half of each period, -1 for the second. */
  SQUARE_WAVE,

  /** A linear ramp from -1 to +1 over each period. */
  SAW_TOOTH,

  /** One coordinate channel of vectorized text. */
  TEXT;

  /**
   * Case insensitive lookup that also ignores underscores, so
   * {@code SineWave} and {@code sine_wave} both work.
   * @param name The non-null name.
   * @return The matching type.
   * @throws ConfigurationException if the name was not recognized.
   */
  public static WaveformType fromName(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new ConfigurationException("Waveform type cannot be null or empty.");
    }
    final String normalized = name.trim().replace("_", "");
    for (final WaveformType type : values()) {
      if (type.name().replace("_", "").equalsIgnoreCase(normalized)) {
        return type;
      }
    }
    throw new ConfigurationException("Unknown waveform type '" + name
        + "'. Must be one of SineWave, SquareWave, SawTooth or Text");
  }
}
