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

import java.util.List;

import net.pointzilla.data.Point;

/**
 * Anything that produces an ordered sequence of points for a run: manual
 * literals, a synthetic waveform, a tabular file or another time series.
 *
 * @since 1.0
 */
public interface PointSource {

  /** @return A short description of the source for logging. */
  public String describe();

  /**
   * Produces the points of this source in emission order.
   * @return A non-null, possibly empty list of points.
   * @throws net.pointzilla.exceptions.ConfigurationException if the source
   * could not be opened.
   * @throws net.pointzilla.exceptions.IllegalDataException if the source
   * contained invalid data that could not be skipped.
   */
  public List<Point> load();

}
