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
package tsclust.clustering.kmeans.averaging;

import static elki.math.linearalgebra.VMath.timesEquals;

import java.util.List;

import tsclust.data.TimeSeries;
import tsclust.distance.TimeSeriesDistance;
import tsclust.utilities.exceptions.DimensionMismatchException;

import elki.utilities.optionhandling.Parameterizer;

/**
 * Pointwise arithmetic mean of equal-length series, the center used by
 * classic k-means with Euclidean distance.
 *
 * @since 0.1.0
 */
public class MeanAveraging implements TimeSeriesAveraging {
  /**
   * Static instance. Use this!
   */
  public static final MeanAveraging STATIC = new MeanAveraging();

  /**
   * Constructor - use {@link #STATIC} instead.
   *
   * @deprecated Use static instance!
   */
  @Deprecated
  public MeanAveraging() {
    super();
  }

  @Override
  public TimeSeries average(List<TimeSeries> members, TimeSeries current, TimeSeriesDistance distance) {
    final TimeSeries first = members.get(0);
    final int len = first.length(), dim = first.getDimensionality();
    double[][] sum = new double[len][dim];
    for(TimeSeries s : members) {
      if(s.length() != len) {
        throw new DimensionMismatchException("Mean averaging needs equal lengths, got " + len + " and " + s.length() + ".");
      }
      for(int t = 0; t < len; t++) {
        final double[] row = sum[t];
        for(int d = 0; d < dim; d++) {
          row[d] += s.value(t, d);
        }
      }
    }
    final double f = 1. / members.size();
    for(int t = 0; t < len; t++) {
      timesEquals(sum[t], f);
    }
    return TimeSeries.wrap(sum);
  }

  @Override
  public boolean requiresEqualLength() {
    return true;
  }

  @Override
  public String toString() {
    return "MeanAveraging";
  }

  /**
   * Parameterization class.
   */
  public static class Par implements Parameterizer {
    @Override
    public MeanAveraging make() {
      return STATIC;
    }
  }
}
