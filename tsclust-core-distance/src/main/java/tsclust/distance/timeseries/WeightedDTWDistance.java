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
import tsclust.utilities.exceptions.InvalidParameterException;

import elki.utilities.documentation.Reference;
import elki.utilities.optionhandling.OptionID;
import elki.utilities.optionhandling.constraints.CommonConstraints;
import elki.utilities.optionhandling.parameterization.Parameterization;
import elki.utilities.optionhandling.parameters.DoubleParameter;

/**
 * Weighted dynamic time warping. The local cost of cell {@code (i, j)} is
 * multiplied by a logistic weight of the phase difference {@code |i - j|},
 * penalizing alignments far off the diagonal.
 *
 * @since 0.1.0
 */
@Reference(authors = "Y.-S. Jeong, M. K. Jeong, O. A. Omitaomu", //
    title = "Weighted dynamic time warping for time series classification", //
    booktitle = "Pattern Recognition 44(9)", //
    url = "https://doi.org/10.1016/j.patcog.2010.09.022", //
    bibkey = "DBLP:journals/pr/JeongJO11")
public class WeightedDTWDistance extends DTWDistance {
  /**
   * Steepness of the weight function.
   */
  protected final double g;

  /**
   * Constructor.
   *
   * @param bandSize Band size in [0, 1]
   * @param g Steepness, non-negative
   */
  public WeightedDTWDistance(double bandSize, double g) {
    super(bandSize);
    if(!(g >= 0.) || Double.isInfinite(g)) {
      throw new InvalidParameterException("Weight steepness g must be non-negative, got " + g + ".");
    }
    this.g = g;
  }

  @Override
  protected ElasticCost costs(TimeSeries a, TimeSeries b) {
    final double[] weights = SeriesMath.logisticWeights(Math.max(a.length(), b.length()), g);
    return new Warping(a, b) {
      @Override
      public double match(int i, int j) {
        return weights[Math.abs(i - j)] * super.match(i, j);
      }
    };
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(bandSize=" + bandSize + ", g=" + g + ")";
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractElasticDistance.Par {
    /**
     * Steepness of the weight function.
     */
    public static final OptionID G_ID = OptionID.getOrCreateOptionID("wdtw.g", "Steepness of the logistic weight function.");

    /**
     * Steepness.
     */
    protected double g;

    @Override
    public void configure(Parameterization config) {
      super.configure(config);
      new DoubleParameter(G_ID, 0.05) //
          .addConstraint(CommonConstraints.GREATER_EQUAL_ZERO_DOUBLE) //
          .grab(config, x -> g = x);
    }

    @Override
    public WeightedDTWDistance make() {
      return new WeightedDTWDistance(bandSize, g);
    }
  }
}
