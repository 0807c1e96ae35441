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
 * Longest common subsequence distance.
 * <p>
 * Two observations match if their Euclidean distance is at most
 * {@code epsilon}. The distance is
 * {@code 1 - lcss(a, b) / min(len(a), len(b))}, in [0, 1].
 * <p>
 * The subsequence length is computed as a minimum-cost alignment: a matching
 * diagonal move costs -1, any other move is free, and the boundary is open.
 * The band restricts which observations may be matched.
 *
 * @since 0.1.0
 */
@Reference(authors = "M. Vlachos, D. Gunopulos, G. Kollios", //
    title = "Discovering similar multidimensional trajectories", //
    booktitle = "Proc. 18th Int. Conf. on Data Engineering (ICDE 2002)", //
    url = "https://doi.org/10.1109/ICDE.2002.994784", //
    bibkey = "DBLP:conf/icde/VlachosGK02")
public class LCSSDistance extends AbstractElasticDistance {
  /**
   * Matching threshold.
   */
  protected final double epsilon;

  /**
   * Constructor.
   *
   * @param bandSize Band size in [0, 1]
   * @param epsilon Matching threshold, non-negative
   */
  public LCSSDistance(double bandSize, double epsilon) {
    super(bandSize);
    if(!(epsilon >= 0.) || Double.isInfinite(epsilon)) {
      throw new InvalidParameterException("LCSS epsilon must be non-negative, got " + epsilon + ".");
    }
    this.epsilon = epsilon;
  }

  @Override
  protected ElasticCost costs(TimeSeries a, TimeSeries b) {
    final double eps2 = epsilon * epsilon;
    return new ElasticCost() {
      @Override
      public double match(int i, int j) {
        return SeriesMath.squaredDistance(a, i, b, j) <= eps2 ? -1. : 0.;
      }

      @Override
      public double up(int i, int j) {
        return 0.;
      }

      @Override
      public double left(int i, int j) {
        return 0.;
      }
    };
  }

  @Override
  protected boolean isOpenBoundary() {
    return true;
  }

  @Override
  protected double finish(double acc, int n, int m) {
    // acc is the negated subsequence length
    return Math.max(0., 1. + acc / Math.min(n, m));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(bandSize=" + bandSize + ", epsilon=" + epsilon + ")";
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractElasticDistance.Par {
    /**
     * Matching threshold.
     */
    public static final OptionID EPSILON_ID = OptionID.getOrCreateOptionID("lcss.epsilon", "Maximum distance of two observations considered a match.");

    /**
     * Matching threshold.
     */
    protected double epsilon;

    @Override
    public void configure(Parameterization config) {
      super.configure(config);
      new DoubleParameter(EPSILON_ID, 1.) //
          .addConstraint(CommonConstraints.GREATER_EQUAL_ZERO_DOUBLE) //
          .grab(config, x -> epsilon = x);
    }

    @Override
    public LCSSDistance make() {
      return new LCSSDistance(bandSize, epsilon);
    }
  }
}
