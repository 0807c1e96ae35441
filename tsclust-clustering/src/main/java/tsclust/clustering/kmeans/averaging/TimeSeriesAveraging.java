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
package tsclust.clustering.kmeans.averaging;

import java.util.List;

import tsclust.data.TimeSeries;
import tsclust.distance.TimeSeriesDistance;

/**
 * Computes a representative center for the members of a cluster.
 *
 * @since 0.1.0
 */
public interface TimeSeriesAveraging {
  /**
   * Compute the new center of a cluster.
   *
   * @param members Cluster members, non-empty, in data set order
   * @param current Current center, or {@code null} if there is none yet
   * @param distance Distance function in use
   * @return New center
   */
  TimeSeries average(List<TimeSeries> members, TimeSeries current, TimeSeriesDistance distance);

  /**
   * Whether all members must have the same length.
   *
   * @return {@code true} when unequal lengths are rejected
   */
  default boolean requiresEqualLength() {
    return false;
  }
}
