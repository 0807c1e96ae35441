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

import java.util.List;

import tsclust.data.TimeSeries;
import tsclust.distance.TimeSeriesDistance;

import elki.utilities.optionhandling.Parameterizer;

/**
 * Selects the medoid: the member with the smallest sum of squared-scale
 * distances from all other members, the same cost the clustering inertia uses. Ties go to the member listed first. The result is always one
 * of the given members, never a synthesized series.
 *
 * @since 0.1.0
 */
public class MedoidAveraging implements TimeSeriesAveraging {
  /**
   * Static instance. Use this!
   */
  public static final MedoidAveraging STATIC = new MedoidAveraging();

  /**
   * Constructor - use {@link #STATIC} instead.
   *
   * @deprecated Use static instance!
   */
  @Deprecated
  public MedoidAveraging() {
    super();
  }

  @Override
  public TimeSeries average(List<TimeSeries> members, TimeSeries current, TimeSeriesDistance distance) {
    final int size = members.size();
    if(size == 1 || (size == 2 && distance.isSymmetric())) {
      return members.get(0);
    }
    return members.get(medoid(members, distance));
  }

  /**
   * Position of the medoid within the list.
   *
   * @param members Members
   * @param distance Distance function
   * @return Position of the member with the smallest squared distance sum
   */
  public static int medoid(List<TimeSeries> members, TimeSeriesDistance distance) {
    final int size = members.size();
    final boolean symmetric = distance.isSymmetric();
    double[] sums = new double[size];
    for(int i = 0; i < size; i++) {
      final TimeSeries a = members.get(i);
      for(int j = symmetric ? i + 1 : 0; j < size; j++) {
        if(i == j) {
          continue;
        }
        final double d = distance.squaredDistance(members.get(j), a);
        sums[i] += d;
        if(symmetric) {
          sums[j] += d;
        }
      }
    }
    int best = 0;
    for(int i = 1; i < size; i++) {
      if(sums[i] < sums[best]) {
        best = i;
      }
    }
    return best;
  }

  @Override
  public String toString() {
    return "MedoidAveraging";
  }

  /**
   * Parameterization class.
   */
  public static class Par implements Parameterizer {
    @Override
    public MedoidAveraging make() {
      return STATIC;
    }
  }
}
