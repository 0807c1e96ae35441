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
import tsclust.utilities.exceptions.DimensionMismatchException;

/**
 * A distance function on time series.
 * <p>
 * Implementations are stateless and safe for concurrent use.
 *
 * @since 0.1.0
 */
public interface TimeSeriesDistance {
  /**
   * Compute the distance of two series.
   *
   * @param a First series
   * @param b Second series
   * @return Non-negative distance
   * @throws DimensionMismatchException if the series are incompatible
   */
  double distance(TimeSeries a, TimeSeries b);

  /**
   * Whether the returned value already is on a squared scale (such as the sum
   * of squared deviations accumulated by dynamic time warping).
   *
   * @return {@code true} for squared distances
   */
  default boolean isSquared() {
    return false;
  }

  /**
   * Whether {@code distance(a, b) == distance(b, a)} holds.
   *
   * @return {@code true} for symmetric measures
   */
  default boolean isSymmetric() {
    return true;
  }

  /**
   * Whether both series must have the same length.
   *
   * @return {@code true} when unequal lengths are rejected
   */
  default boolean requiresEqualLength() {
    return false;
  }

  /**
   * Distance on the squared scale used for inertia and seeding weights.
   *
   * @param a First series
   * @param b Second series
   * @return {@code distance(a, b)} if already squared, its square otherwise
   */
  default double squaredDistance(TimeSeries a, TimeSeries b) {
    final double d = distance(a, b);
    return isSquared() ? d : d * d;
  }

  /**
   * Verify that two series have the same number of channels.
   *
   * @param a First series
   * @param b Second series
   */
  static void checkDimensionality(TimeSeries a, TimeSeries b) {
    if(a.getDimensionality() != b.getDimensionality()) {
      throw new DimensionMismatchException("Series have " + a.getDimensionality() + " and " + b.getDimensionality() + " channels.");
    }
  }
}
