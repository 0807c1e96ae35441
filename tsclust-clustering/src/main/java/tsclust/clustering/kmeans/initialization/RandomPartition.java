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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import tsclust.clustering.kmeans.EmptyClusters;
import tsclust.clustering.kmeans.averaging.TimeSeriesAveraging;
import tsclust.data.Dataset;
import tsclust.data.TimeSeries;
import tsclust.distance.TimeSeriesDistance;

import elki.logging.Logging;
import elki.utilities.random.RandomFactory;

/**
 * Random partition initialization: every series gets a uniformly random label,
 * and the initial centers are the averages of the resulting groups.
 * <p>
 * A group that ends up empty is seeded with the series farthest from its own
 * group center, as in {@link EmptyClusters}.
 *
 * @since 0.1.0
 */
public class RandomPartition extends AbstractTimeSeriesInitialization {
  /**
   * Class logger.
   */
  private static final Logging LOG = Logging.getLogger(RandomPartition.class);

  /**
   * Constructor.
   *
   * @param rnd Random generator.
   */
  public RandomPartition(RandomFactory rnd) {
    super(rnd);
  }

  @Override
  public TimeSeries[] chooseInitialCenters(Dataset data, int k, TimeSeriesDistance distance, TimeSeriesAveraging averaging) {
    checkSize(data, k);
    final Random random = rnd.getSingleThreadedRandom();
    int[] labels = new int[data.size()];
    for(int i = 0; i < labels.length; i++) {
      labels[i] = random.nextInt(k);
    }
    return centersFromLabels(data, k, labels, distance, averaging);
  }

  /**
   * Compute centers from a given partition.
   *
   * @param data Data set
   * @param k Number of clusters
   * @param labels Cluster label of each series
   * @param distance Distance function
   * @param averaging Averaging procedure
   * @return Centers
   */
  public static TimeSeries[] centersFromLabels(Dataset data, int k, int[] labels, TimeSeriesDistance distance, TimeSeriesAveraging averaging) {
    List<List<TimeSeries>> groups = new ArrayList<>(k);
    for(int c = 0; c < k; c++) {
      groups.add(new ArrayList<>());
    }
    for(int i = 0; i < labels.length; i++) {
      groups.get(labels[i]).add(data.get(i));
    }
    TimeSeries[] centers = new TimeSeries[k];
    boolean hasEmpty = false;
    for(int c = 0; c < k; c++) {
      if(groups.get(c).isEmpty()) {
        hasEmpty = true;
        continue;
      }
      centers[c] = averaging.average(groups.get(c), null, distance);
    }
    if(!hasEmpty) {
      return centers;
    }
    double[] dist = new double[labels.length];
    for(int i = 0; i < labels.length; i++) {
      dist[i] = centers[labels[i]] == null ? 0. : distance.distance(data.get(i), centers[labels[i]]);
    }
    boolean[] taken = new boolean[labels.length];
    for(int c = 0; c < k; c++) {
      if(centers[c] == null) {
        final int i = EmptyClusters.farthest(dist, taken);
        centers[c] = data.get(i);
        if(LOG.isVerbose()) {
          LOG.verbose("Random partition left cluster " + c + " empty, seeding it with series " + i + ".");
        }
      }
    }
    return centers;
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractTimeSeriesInitialization.Par {
    @Override
    public RandomPartition make() {
      return new RandomPartition(rnd);
    }
  }
}
