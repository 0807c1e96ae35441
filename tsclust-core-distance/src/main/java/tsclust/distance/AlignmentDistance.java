/*
 * This file is part of ELKI:
 * Environment for Developing KDD-Applications Supported by Index-Structures
 * 
 * Copyright (C) 2020
 * ELKI Development Team
 * 
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Affero General Public License for more details.
 * 
 * You should have received a copy of the GNU Affero General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package tsclust.distance;

import tsclust.data.TimeSeries;

/**
 * A distance obtained from an optimal alignment of two series, which can also
 * report the alignment itself.
 *
 * @since 0.1.0
 */
public interface AlignmentDistance extends TimeSeriesDistance {
  /**
   * Compute the distance together with the minimum-cost warping path.
   *
   * @param a First series
   * @param b Second series
   * @return Distance and path
   */
  Alignment align(TimeSeries a, TimeSeries b);
}
