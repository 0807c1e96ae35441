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

import elki.utilities.documentation.Reference;

/**
 * Derivative dynamic time warping: time warping on the first-derivative
 * estimates of both series.
 * <p>
 * The derivative transform preserves the length, so alignment paths index the
 * original observations.
 *
 * @since 0.1.0
 */
@Reference(authors = "E. J. Keogh, M. J. Pazzani", //
    title = "Derivative Dynamic Time Warping", //
    booktitle = "Proc. 2001 SIAM Int. Conf. on Data Mining", //
    url = "https://doi.org/10.1137/1.9781611972719.1", //
    bibkey = "DBLP:conf/sdm/KeoghP01")
public class DerivativeDTWDistance extends DTWDistance {
  /**
   * Constructor.
   *
   * @param bandSize Band size in [0, 1]
   */
  public DerivativeDTWDistance(double bandSize) {
    super(bandSize);
  }

  /**
   * Constructor, unconstrained.
   */
  public DerivativeDTWDistance() {
    this(1.);
  }

  @Override
  protected ElasticCost costs(TimeSeries a, TimeSeries b) {
    return super.costs(SeriesMath.derivative(a), SeriesMath.derivative(b));
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractElasticDistance.Par {
    @Override
    public DerivativeDTWDistance make() {
      return new DerivativeDTWDistance(bandSize);
    }
  }
}
