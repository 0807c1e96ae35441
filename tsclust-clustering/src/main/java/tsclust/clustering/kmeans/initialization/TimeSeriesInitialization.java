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
package tsclust.clustering.kmeans.initialization;

import tsclust.clustering.kmeans.averaging.TimeSeriesAveraging;
import tsclust.data.Dataset;
import tsclust.data.TimeSeries;
import tsclust.distance.TimeSeriesDistance;

/**
 * Chooses the initial cluster centers for k-means style clustering.
 * <p>
 * Implementations draw their randomness from an explicitly configured source,
 * so that a seeded source makes the choice reproducible.
 *
 * @since 0.1.0
 */
public interface TimeSeriesInitialization {
  /**
   * Choose initial centers.
   *
   * @param data Data set, with at least {@code k} series
   * @param k Number of centers
   * @param distance Distance function in use
   * @param averaging Averaging procedure in use
   * @return {@code k} centers
   */
  TimeSeries[] chooseInitialCenters(Dataset data, int k, TimeSeriesDistance distance, TimeSeriesAveraging averaging);
}
