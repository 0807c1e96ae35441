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
package tsclust.distance.timeseries;

import tsclust.data.TimeSeries;
import tsclust.math.SeriesMath;

/**
 * Weighted dynamic time warping on the first-derivative estimates of both
 * series.
 *
 * @since 0.1.0
 */
public class WeightedDerivativeDTWDistance extends WeightedDTWDistance {
  /**
   * Constructor.
   *
   * @param bandSize Band size in [0, 1]
   * @param g Steepness, non-negative
   */
  public WeightedDerivativeDTWDistance(double bandSize, double g) {
    super(bandSize, g);
  }

  @Override
  protected ElasticCost costs(TimeSeries a, TimeSeries b) {
    return super.costs(SeriesMath.derivative(a), SeriesMath.derivative(b));
  }

  /**
   * Parameterization class.
   */
  public static class Par extends WeightedDTWDistance.Par {
    @Override
    public WeightedDerivativeDTWDistance make() {
      return new WeightedDerivativeDTWDistance(bandSize, g);
    }
  }
}
