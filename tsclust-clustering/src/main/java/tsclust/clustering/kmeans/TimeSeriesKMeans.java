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

import tsclust.clustering.kmeans.averaging.MeanAveraging;
import tsclust.clustering.kmeans.averaging.TimeSeriesAveraging;
import tsclust.clustering.kmeans.initialization.TimeSeriesInitialization;
import tsclust.distance.TimeSeriesDistance;
import tsclust.utilities.exceptions.InvalidParameterException;

import elki.logging.Logging;
import elki.utilities.optionhandling.OptionID;
import elki.utilities.optionhandling.parameterization.Parameterization;
import elki.utilities.optionhandling.parameters.ObjectParameter;

/**
 * Lloyd-style k-means for time series, with a configurable distance and
 * center averaging. Euclidean distance with {@link MeanAveraging} is classic
 * k-means, DTW with DBA gives DTW k-means.
 *
 * @since 0.1.0
 */
public class TimeSeriesKMeans extends AbstractTimeSeriesKMeans {
  private static final Logging LOG = Logging.getLogger(TimeSeriesKMeans.class);

  /**
   * Center averaging.
   */
  protected final TimeSeriesAveraging averaging;

  public TimeSeriesKMeans(TimeSeriesDistance distance, int k, int maxiter, double tol, int ninit, TimeSeriesInitialization initializer, TimeSeriesAveraging averaging) {
    super(distance, k, maxiter, tol, ninit, initializer);
    if(averaging == null) {
      throw new InvalidParameterException("Averaging must be given.");
    }
    this.averaging = averaging;
  }

  public TimeSeriesKMeans(TimeSeriesDistance distance, int k, int maxiter, TimeSeriesInitialization initializer, TimeSeriesAveraging averaging) {
    this(distance, k, maxiter, 1e-6, 1, initializer, averaging);
  }

  @Override
  public TimeSeriesAveraging getAveraging() {
    return averaging;
  }

  @Override
  protected Logging getLogger() {
    return LOG;
  }

  @Override
  public String toString() {
    return "TimeSeriesKMeans(k=" + k + ", distance=" + distance + ", averaging=" + averaging + ")";
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractTimeSeriesKMeans.Par {
    /**
     * Averaging procedure.
     */
    public static final OptionID AVERAGING_ID = OptionID.getOrCreateOptionID("kmeans.averaging", "Method to compute a cluster center from its members.");

    /**
     * Averaging procedure.
     */
    protected TimeSeriesAveraging averaging;

    @Override
    public void configure(Parameterization config) {
      super.configure(config);
      new ObjectParameter<TimeSeriesAveraging>(AVERAGING_ID, TimeSeriesAveraging.class, MeanAveraging.class) //
          .grab(config, x -> averaging = x);
    }

    @Override
    public TimeSeriesKMeans make() {
      TimeSeriesKMeans kmeans = new TimeSeriesKMeans(distance, k, maxiter, tol, ninit, initializer, averaging);
      kmeans.setParallel(parallel).setVerbose(verbose);
      return kmeans;
    }
  }
}
