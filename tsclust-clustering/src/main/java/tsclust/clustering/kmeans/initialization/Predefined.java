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
import tsclust.utilities.exceptions.DimensionMismatchException;
import tsclust.utilities.exceptions.InvalidParameterException;

/**
 * Use user-supplied initial centers.
 *
 * @since 0.1.0
 */
public class Predefined implements TimeSeriesInitialization {
  /**
   * Initial centers.
   */
  protected final TimeSeries[] centers;

  /**
   * Constructor.
   *
   * @param centers Initial centers
   */
  public Predefined(TimeSeries... centers) {
    if(centers.length == 0) {
      throw new InvalidParameterException("At least one initial center is required.");
    }
    this.centers = centers.clone();
  }

  @Override
  public TimeSeries[] chooseInitialCenters(Dataset data, int k, TimeSeriesDistance distance, TimeSeriesAveraging averaging) {
    if(k != centers.length) {
      throw new InvalidParameterException("Predefined initialization has " + centers.length + " centers, but k=" + k + ".");
    }
    for(TimeSeries c : centers) {
      if(c.getDimensionality() != data.getDimensionality()) {
        throw new DimensionMismatchException("Initial center has " + c.getDimensionality() + " channels, data has " + data.getDimensionality() + ".");
      }
    }
    return centers.clone();
  }
}
