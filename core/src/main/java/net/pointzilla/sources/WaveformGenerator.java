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

import java.time.Instant;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import net.pointzilla.data.Point;
import net.pointzilla.sources.TextVectorizer.Vertex;
import net.pointzilla.sources.WaveformSpec.TextChannel;

/**
 * Deterministic, finite and restartable sequence of synthetic value points.
 * <p>
 * Sample {@code i} is at {@code start + i * interval}. The mathematical
 * shapes use the angle {@code 2 * PI * (i / samplesPerPeriod + phase)} and
 * emit {@code offset + scalar * f(angle)}. The text shape walks the pen path
 * of the text, one pass per period, so the period is the length of the path
 * and the phase shifts the starting vertex.
 * <p>
 * The count is {@link WaveformSpec#numberOfPoints()} when set, otherwise the
 * number of periods times the period, truncated. A zero interval or count
 * produces nothing.
 *
 * @since 1.0
 */
public class WaveformGenerator implements PointSource, Iterable<Point> {
  private static final Logger LOG = LoggerFactory.getLogger(
      WaveformGenerator.class);

  private static final double TWO_PI = 2 * Math.PI;

  private final WaveformSpec spec;

  /** The pen path for text, null for the other shapes. */
  private final List<Vertex> path;

  private final double samples_per_period;

  private final int count;

  /** Applied to each sample, may be null. */
  private final Integer grade_code;

  /** Applied to each sample, may be empty. */
  private final ImmutableList<String> qualifiers;

  /**
   * Ctor for samples without a grade or qualifiers.
   * @param spec The non-null spec.
   */
  public WaveformGenerator(final WaveformSpec spec) {
    this(spec, null, null);
  }

  /**
   * Default ctor.
   * @param spec The non-null spec.
   * @param grade_code An optional grade for every sample.
   * @param qualifiers Optional qualifiers for every sample.
   */
  public WaveformGenerator(final WaveformSpec spec,
                           final Integer grade_code,
                           final Collection<String> qualifiers) {
    if (spec == null) {
      throw new IllegalArgumentException("Spec cannot be null.");
    }
    this.spec = spec;
    this.grade_code = grade_code;
    this.qualifiers = qualifiers == null ?
        ImmutableList.of() : ImmutableList.copyOf(qualifiers);
    if (spec.type() == WaveformType.TEXT) {
      path = TextVectorizer.vectorize(spec.text());
      samples_per_period = path.size();
    } else {
      path = null;
      samples_per_period = spec.samplesPerPeriod();
    }

    if (spec.interval().isZero() || samples_per_period <= 0) {
      count = 0;
    } else if (spec.numberOfPoints() > 0) {
      count = spec.numberOfPoints();
    } else {
      count = (int) (spec.numberOfPeriods() * samples_per_period);
    }
  }

  /** @return The number of samples this generator emits. */
  public int size() {
    return count;
  }

  /** @return The samples in one period. For text, the path length. */
  public double samplesPerPeriod() {
    return samples_per_period;
  }

  /**
   * @param index A sample index.
   * @return The time of that sample.
   */
  public Instant timeAt(final int index) {
    return spec.startTime().plus(spec.interval().multipliedBy(index));
  }

  /**
   * @param index A sample index.
   * @return The value of that sample including scalar and offset.
   */
  public double valueAt(final int index) {
    final double cycles = index / samples_per_period + spec.phase();
    final double f;
    switch (spec.type()) {
    case SINE_WAVE:
      f = Math.sin(TWO_PI * cycles);
      break;
    case SQUARE_WAVE:
      f = Math.sin(TWO_PI * cycles) >= 0 ? 1 : -1;
      break;
    case SAW_TOOTH:
      f = 2 * (cycles - Math.floor(cycles)) - 1;
      break;
    case TEXT:
      final long length = path.size();
      final Vertex vertex = path.get((int) Math.floorMod(
          index + Math.round(spec.phase() * length), length));
      f = spec.textChannel() == TextChannel.X ? vertex.x() : vertex.y();
      break;
    default:
      throw new IllegalStateException("Unhandled waveform type: "
          + spec.type());
    }
    return spec.offset() + spec.scalar() * f;
  }

  @Override
  public Iterator<Point> iterator() {
    return new Iterator<Point>() {
      private int next;

      @Override
      public boolean hasNext() {
        return next < count;
      }

      @Override
      public Point next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        final int index = next++;
        return Point.newBuilder()
            .setTime(timeAt(index))
            .setValue(valueAt(index))
            .setGradeCode(grade_code)
            .setQualifiers(qualifiers)
            .build();
      }
    };
  }

  @Override
  public String describe() {
    return "waveform [" + spec + "]";
  }

  @Override
  public List<Point> load() {
    final List<Point> points = ImmutableList.copyOf(this);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Generated " + points.size() + " points from " + describe());
    }
    return points;
  }
}
