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

import elki.utilities.random.RandomFactory;

/**
 * Forgy initialization: k distinct series sampled uniformly without
 * replacement become the initial centers, in the order drawn.
 * <p>
 * Reference:
 * <p>
 * E. W. Forgy<br>
 * Cluster analysis of multivariate data: efficiency versus interpretability
 * of classifications<br>
 * Biometrics 21
 *
 * @since 0.1.0
 */
public class RandomlyChosen extends AbstractTimeSeriesInitialization {
  /**
   * Constructor.
   *
   * @param rnd Random generator.
   */
  public RandomlyChosen(RandomFactory rnd) {
    super(rnd);
  }

  @Override
  public TimeSeries[] chooseInitialCenters(Dataset data, int k, TimeSeriesDistance distance, TimeSeriesAveraging averaging) {
    checkSize(data, k);
    final int n = data.size();
    final Random random = rnd.getSingleThreadedRandom();
    int[] perm = new int[n];
    for(int i = 0; i < n; i++) {
      perm[i] = i;
    }
    TimeSeries[] centers = new TimeSeries[k];
    // Partial Fisher-Yates shuffle
    for(int i = 0; i < k; i++) {
      final int j = i + random.nextInt(n - i);
      final int tmp = perm[i];
      perm[i] = perm[j];
      perm[j] = tmp;
      centers[i] = data.get(perm[i]);
    }
    return centers;
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractTimeSeriesInitialization.Par {
    @Override
    public RandomlyChosen make() {
      return new RandomlyChosen(rnd);
    }
  }
}
