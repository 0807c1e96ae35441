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
import tsclust.utilities.exceptions.InvalidParameterException;

import elki.utilities.documentation.Reference;
import elki.utilities.optionhandling.OptionID;
import elki.utilities.optionhandling.constraints.CommonConstraints;
import elki.utilities.optionhandling.parameterization.Parameterization;
import elki.utilities.optionhandling.parameters.DoubleParameter;

/**
 * Move-split-merge distance.
 * <p>
 * A diagonal move changes one value into another at cost {@code |a_i - b_j|}.
 * Split and merge operations (up and left moves) cost {@code c} if the new
 * value lies between its predecessor and the value it is aligned to, and
 * {@code c} plus the distance to the closer of the two otherwise. For
 * multivariate series, costs are summed over the channels.
 *
 * @since 0.1.0
 */
@Reference(authors = "A. Stefan, V. Athitsos, G. Das", //
    title = "The Move-Split-Merge Metric for Time Series", //
    booktitle = "IEEE Trans. Knowledge and Data Engineering 25(6)", //
    url = "https://doi.org/10.1109/TKDE.2012.88", //
    bibkey = "DBLP:journals/tkde/StefanAD13")
public class MSMDistance extends AbstractElasticDistance {
  /**
   * Split and merge penalty.
   */
  protected final double c;

  /**
   * Constructor.
   *
   * @param bandSize Band size in [0, 1]
   * @param c Split and merge penalty, non-negative
   */
  public MSMDistance(double bandSize, double c) {
    super(bandSize);
    if(!(c >= 0.) || Double.isInfinite(c)) {
      throw new InvalidParameterException("MSM penalty c must be non-negative, got " + c + ".");
    }
    this.c = c;
  }

  @Override
  protected ElasticCost costs(TimeSeries a, TimeSeries b) {
    final int dim = a.getDimensionality();
    return new ElasticCost() {
      @Override
      public double match(int i, int j) {
        double agg = 0.;
        for(int d = 0; d < dim; d++) {
          agg += Math.abs(a.value(i, d) - b.value(j, d));
        }
        return agg;
      }

      @Override
      public double up(int i, int j) {
        if(i == 0) {
          return Double.POSITIVE_INFINITY;
        }
        double agg = 0.;
        for(int d = 0; d < dim; d++) {
          agg += splitMerge(a.value(i, d), a.value(i - 1, d), b.value(j, d));
        }
        return agg;
      }

      @Override
      public double left(int i, int j) {
        if(j == 0) {
          return Double.POSITIVE_INFINITY;
        }
        double agg = 0.;
        for(int d = 0; d < dim; d++) {
          agg += splitMerge(b.value(j, d), b.value(j - 1, d), a.value(i, d));
        }
        return agg;
      }
    };
  }

  /**
   * Cost of a split or merge.
   *
   * @param x New value
   * @param prev Its predecessor in the same series
   * @param other Value in the other series
   * @return Cost
   */
  protected double splitMerge(double x, double prev, double other) {
    if((prev <= x && x <= other) || (prev >= x && x >= other)) {
      return c;
    }
    return c + Math.min(Math.abs(x - prev), Math.abs(x - other));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(bandSize=" + bandSize + ", c=" + c + ")";
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractElasticDistance.Par {
    /**
     * Split and merge penalty.
     */
    public static final OptionID C_ID = OptionID.getOrCreateOptionID("msm.c", "Cost of split and merge operations.");

    /**
     * Penalty.
     */
    protected double c;

    @Override
    public void configure(Parameterization config) {
      super.configure(config);
      new DoubleParameter(C_ID, 1.) //
          .addConstraint(CommonConstraints.GREATER_EQUAL_ZERO_DOUBLE) //
          .grab(config, x -> c = x);
    }

    @Override
    public MSMDistance make() {
      return new MSMDistance(bandSize, c);
    }
  }
}
