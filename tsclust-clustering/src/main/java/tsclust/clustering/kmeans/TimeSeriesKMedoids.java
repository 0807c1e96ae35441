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
package tsclust.clustering.kmeans;

import tsclust.clustering.kmeans.averaging.MedoidAveraging;
import tsclust.clustering.kmeans.averaging.TimeSeriesAveraging;
import tsclust.clustering.kmeans.initialization.TimeSeriesInitialization;
import tsclust.distance.TimeSeriesDistance;

import elki.logging.Logging;

/**
 * Lloyd-style k-medoids (alternating, not PAM): every center is the member
 * with the lowest summed distance to the rest of its cluster. Centers are
 * always actual series, so any distance can be used, including ones that
 * cannot be averaged.
 *
 * @since 0.1.0
 */
public class TimeSeriesKMedoids extends AbstractTimeSeriesKMeans {
  private static final Logging LOG = Logging.getLogger(TimeSeriesKMedoids.class);

  public TimeSeriesKMedoids(TimeSeriesDistance distance, int k, int maxiter, double tol, int ninit, TimeSeriesInitialization initializer) {
    super(distance, k, maxiter, tol, ninit, initializer);
  }

  @Override
  public TimeSeriesAveraging getAveraging() {
    return MedoidAveraging.STATIC;
  }

  @Override
  protected Logging getLogger() {
    return LOG;
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractTimeSeriesKMeans.Par {
    @Override
    public TimeSeriesKMedoids make() {
      TimeSeriesKMedoids kmedoids = new TimeSeriesKMedoids(distance, k, maxiter, tol, ninit, initializer);
      kmedoids.setParallel(parallel).setVerbose(verbose);
      return kmedoids;
    }
  }
}
