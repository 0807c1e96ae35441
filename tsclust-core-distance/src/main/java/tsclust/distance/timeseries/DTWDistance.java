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
 * Dynamic time warping distance.
 * <p>
 * The local cost of aligning two observations is their squared Euclidean
 * distance, and every move (diagonal, up, left) pays the local cost of the
 * cell it enters. The result is the accumulated cost without taking a square
 * root, so with a band size of 0 and equal lengths it equals the squared
 * Euclidean distance.
 *
 * @since 0.1.0
 */
@Reference(authors = "D. Berndt, J. Clifford", //
    title = "Using dynamic time warping to find patterns in time series", //
    booktitle = "AAAI-94 Workshop on Knowledge Discovery in Databases", //
    url = "https://aaai.org/papers/00359-using-dynamic-time-warping-to-find-patterns-in-time-series/", //
    bibkey = "conf/kdd/BerndtC94")
public class DTWDistance extends AbstractElasticDistance {
  /**
   * Constructor.
   *
   * @param bandSize Band size in [0, 1]
   */
  public DTWDistance(double bandSize) {
    super(bandSize);
  }

  /**
   * Constructor, unconstrained.
   */
  public DTWDistance() {
    this(1.);
  }

  @Override
  protected ElasticCost costs(TimeSeries a, TimeSeries b) {
    return new Warping(a, b);
  }

  @Override
  public boolean isSquared() {
    return true;
  }

  /**
   * Squared Euclidean local cost, charged for every move.
   */
  protected static class Warping implements ElasticCost {
    /**
     * Series to align.
     */
    final TimeSeries a, b;

    /**
     * Constructor.
     *
     * @param a First series
     * @param b Second series
     */
    Warping(TimeSeries a, TimeSeries b) {
      this.a = a;
      this.b = b;
    }

    @Override
    public double match(int i, int j) {
      return SeriesMath.squaredDistance(a, i, b, j);
    }

    @Override
    public double up(int i, int j) {
      return match(i, j);
    }

    @Override
    public double left(int i, int j) {
      return match(i, j);
    }

    @Override
    public boolean isUniform() {
      return true;
    }
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractElasticDistance.Par {
    @Override
    public DTWDistance make() {
      return new DTWDistance(bandSize);
    }
  }
}
