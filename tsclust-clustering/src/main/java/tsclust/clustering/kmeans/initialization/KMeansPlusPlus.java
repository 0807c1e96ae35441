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
package tsclust.clustering.kmeans.initialization;

import java.util.Random;

import tsclust.clustering.kmeans.averaging.TimeSeriesAveraging;
import tsclust.data.Dataset;
import tsclust.data.TimeSeries;
import tsclust.distance.TimeSeriesDistance;
import tsclust.utilities.exceptions.InvalidParameterException;

import elki.utilities.documentation.Reference;
import elki.utilities.random.RandomFactory;

/**
 * K-Means++ initialization: the first center is chosen uniformly, each further
 * center with probability proportional to the squared distance of a series to
 * its nearest center chosen so far.
 * <p>
 * Weights use {@link TimeSeriesDistance#squaredDistance}, so measures that are
 * already squared are not squared again.
 *
 * @since 0.1.0
 */
@Reference(authors = "D. Arthur, S. Vassilvitskii", //
    title = "k-means++: the advantages of careful seeding", //
    booktitle = "Proc. 18th Annual ACM-SIAM Symposium on Discrete Algorithms (SODA 2007)", //
    url = "http://dl.acm.org/citation.cfm?id=1283383.1283494", //
    bibkey = "DBLP:conf/soda/ArthurV07")
public class KMeansPlusPlus extends AbstractTimeSeriesInitialization {
  /**
   * Constructor.
   *
   * @param rnd Random generator.
   */
  public KMeansPlusPlus(RandomFactory rnd) {
    super(rnd);
  }

  @Override
  public TimeSeries[] chooseInitialCenters(Dataset data, int k, TimeSeriesDistance distance, TimeSeriesAveraging averaging) {
    checkSize(data, k);
    if(!distance.isSymmetric()) {
      throw new InvalidParameterException("k-means++ needs a symmetric distance, " + distance + " is not.");
    }
    final int n = data.size();
    final Random random = rnd.getSingleThreadedRandom();
    TimeSeries[] centers = new TimeSeries[k];
    boolean[] chosen = new boolean[n];
    int first = random.nextInt(n);
    centers[0] = data.get(first);
    chosen[first] = true;
    double[] weights = new double[n];
    double weightsum = updateWeights(data, weights, chosen, centers[0], distance, true);
    for(int c = 1; c < k; c++) {
      final int next = weightsum > 0. ? sampleWeighted(weights, random.nextDouble() * weightsum) //
          : sampleUniform(chosen, random.nextInt(n - c));
      centers[c] = data.get(next);
      chosen[next] = true;
      weights[next] = 0.;
      weightsum = updateWeights(data, weights, chosen, centers[c], distance, false);
    }
    return centers;
  }

  /**
   * Update the weights with a new center.
   *
   * @param data Data set
   * @param weights Weights, squared distance to the nearest center
   * @param chosen Series already chosen
   * @param center New center
   * @param distance Distance function
   * @param first First center, weights are not yet initialized
   * @return Sum of weights
   */
  protected static double updateWeights(Dataset data, double[] weights, boolean[] chosen, TimeSeries center, TimeSeriesDistance distance, boolean first) {
    double weightsum = 0.;
    for(int i = 0; i < weights.length; i++) {
      if(chosen[i]) {
        continue;
      }
      final double d = distance.squaredDistance(data.get(i), center);
      if(first || d < weights[i]) {
        weights[i] = d;
      }
      weightsum += weights[i];
    }
    return weightsum;
  }

  /**
   * Choose the series at which the cumulative weight exceeds r.
   *
   * @param weights Weights
   * @param r Random value in [0, weightsum)
   * @return Chosen index
   */
  protected static int sampleWeighted(double[] weights, double r) {
    int last = -1;
    for(int i = 0; i < weights.length; i++) {
      if(weights[i] <= 0.) {
        continue;
      }
      last = i;
      r -= weights[i];
      if(r < 0.) {
        return i;
      }
    }
    // Rounding: use the last series with positive weight.
    return last;
  }

  /**
   * Choose the r-th series not yet chosen; used when all remaining series
   * coincide with chosen centers.
   *
   * @param chosen Series already chosen
   * @param r Rank among the series not yet chosen
   * @return Chosen index
   */
  protected static int sampleUniform(boolean[] chosen, int r) {
    for(int i = 0; i < chosen.length; i++) {
      if(!chosen[i] && r-- == 0) {
        return i;
      }
    }
    throw new IllegalStateException("Fewer unchosen series than expected.");
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractTimeSeriesInitialization.Par {
    @Override
    public KMeansPlusPlus make() {
      return new KMeansPlusPlus(rnd);
    }
  }
}
