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
package tsclust.distance;

import tsclust.data.TimeSeries;
import tsclust.math.SeriesMath;
import tsclust.utilities.exceptions.DimensionMismatchException;

import elki.utilities.optionhandling.Parameterizer;

import net.jafama.FastMath;

/**
 * Lock-step Euclidean distance of two series of equal length: the square root
 * of the summed squared differences of corresponding observations (vector
 * differences for multivariate series).
 *
 * @since 0.1.0
 */
public class EuclideanDistance implements TimeSeriesDistance {
  /**
   * Static instance. Use this!
   */
  public static final EuclideanDistance STATIC = new EuclideanDistance();

  /**
   * Constructor - use {@link #STATIC} instead.
   *
   * @deprecated Use static instance!
   */
  @Deprecated
  public EuclideanDistance() {
    super();
  }

  @Override
  public double distance(TimeSeries a, TimeSeries b) {
    TimeSeriesDistance.checkDimensionality(a, b);
    final int n = a.length();
    if(n != b.length()) {
      throw new DimensionMismatchException("Euclidean distance needs equal lengths, got " + n + " and " + b.length() + ".");
    }
    double agg = 0.;
    for(int t = 0; t < n; t++) {
      agg += SeriesMath.squaredDistance(a, t, b, t);
    }
    return FastMath.sqrt(agg);
  }

  @Override
  public boolean requiresEqualLength() {
    return true;
  }

  @Override
  public String toString() {
    return "EuclideanDistance";
  }

  /**
   * Parameterization class.
   */
  public static class Par implements Parameterizer {
    @Override
    public EuclideanDistance make() {
      return STATIC;
    }
  }
}
