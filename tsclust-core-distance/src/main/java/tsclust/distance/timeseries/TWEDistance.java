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
 * Time warp edit distance.
 * <p>
 * Both series are preceded by a virtual zero observation and time stamps are
 * the indexes. A match costs the distances of the current and the previous
 * observations plus {@code nu} times the time stamp differences; deleting an
 * observation costs its distance to its predecessor plus
 * {@code nu + lambda}.
 *
 * @since 0.1.0
 */
@Reference(authors = "P.-F. Marteau", //
    title = "Time Warp Edit Distance with Stiffness Adjustment for Time Series Matching", //
    booktitle = "IEEE Trans. Pattern Analysis and Machine Intelligence 31(2)", //
    url = "https://doi.org/10.1109/TPAMI.2008.76", //
    bibkey = "DBLP:journals/pami/Marteau09")
public class TWEDistance extends AbstractElasticDistance {
  /**
   * Stiffness.
   */
  protected final double nu;

  /**
   * Deletion penalty.
   */
  protected final double lambda;

  /**
   * Constructor.
   *
   * @param bandSize Band size in [0, 1]
   * @param nu Stiffness, non-negative
   * @param lambda Deletion penalty, non-negative
   */
  public TWEDistance(double bandSize, double nu, double lambda) {
    super(bandSize);
    if(!(nu >= 0.) || Double.isInfinite(nu)) {
      throw new InvalidParameterException("TWE stiffness nu must be non-negative, got " + nu + ".");
    }
    if(!(lambda >= 0.) || Double.isInfinite(lambda)) {
      throw new InvalidParameterException("TWE penalty lambda must be non-negative, got " + lambda + ".");
    }
    this.nu = nu;
    this.lambda = lambda;
  }

  @Override
  protected ElasticCost costs(TimeSeries a, TimeSeries b) {
    final double delete = nu + lambda;
    return new ElasticCost() {
      @Override
      public double match(int i, int j) {
        final double prev = i == 0 ? (j == 0 ? 0. : SeriesMath.distanceTo(b, j - 1, 0.)) //
            : j == 0 ? SeriesMath.distanceTo(a, i - 1, 0.) : SeriesMath.distance(a, i - 1, b, j - 1);
        return SeriesMath.distance(a, i, b, j) + prev + 2 * nu * Math.abs(i - j);
      }

      @Override
      public double up(int i, int j) {
        return (i == 0 ? SeriesMath.distanceTo(a, 0, 0.) : SeriesMath.distance(a, i, a, i - 1)) + delete;
      }

      @Override
      public double left(int i, int j) {
        return (j == 0 ? SeriesMath.distanceTo(b, 0, 0.) : SeriesMath.distance(b, j, b, j - 1)) + delete;
      }
    };
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(bandSize=" + bandSize + ", nu=" + nu + ", lambda=" + lambda + ")";
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractElasticDistance.Par {
    /**
     * Stiffness.
     */
    public static final OptionID NU_ID = OptionID.getOrCreateOptionID("twe.nu", "Stiffness, penalizing time stamp differences.");

    /**
     * Deletion penalty.
     */
    public static final OptionID LAMBDA_ID = OptionID.getOrCreateOptionID("twe.lambda", "Constant penalty of a deletion.");

    /**
     * Stiffness.
     */
    protected double nu;

    /**
     * Deletion penalty.
     */
    protected double lambda;

    @Override
    public void configure(Parameterization config) {
      super.configure(config);
      new DoubleParameter(NU_ID, 0.001) //
          .addConstraint(CommonConstraints.GREATER_EQUAL_ZERO_DOUBLE) //
          .grab(config, x -> nu = x);
      new DoubleParameter(LAMBDA_ID, 1.) //
          .addConstraint(CommonConstraints.GREATER_EQUAL_ZERO_DOUBLE) //
          .grab(config, x -> lambda = x);
    }

    @Override
    public TWEDistance make() {
      return new TWEDistance(bandSize, nu, lambda);
    }
  }
}
