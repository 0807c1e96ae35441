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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import tsclust.clustering.kmeans.averaging.DBAAveraging;
import tsclust.clustering.kmeans.averaging.MeanAveraging;
import tsclust.clustering.kmeans.averaging.MedoidAveraging;
import tsclust.clustering.kmeans.initialization.AbstractTimeSeriesInitialization;
import tsclust.clustering.kmeans.initialization.RandomlyChosen;
import tsclust.data.Dataset;
import tsclust.distance.timeseries.AbstractElasticDistance;
import tsclust.distance.timeseries.DTWDistance;
import tsclust.distance.timeseries.ERPDistance;

import elki.utilities.optionhandling.parameterization.ListParameterization;

/**
 * Test configuring the algorithms through option parameters.
 */
public class TimeSeriesKMeansParameterizationTest {
  @Test
  public void testDefaults() {
    ListParameterization config = new ListParameterization();
    config.addParameter(AbstractTimeSeriesKMeans.Par.K_ID, 3);
    TimeSeriesKMeans.Par par = new TimeSeriesKMeans.Par();
    par.configure(config);
    TimeSeriesKMeans kmeans = par.make();
    assertEquals(3, kmeans.getK());
    assertTrue(kmeans.getDistance() instanceof DTWDistance);
    assertSame(MeanAveraging.STATIC, kmeans.getAveraging());
    assertEquals(300, kmeans.maxiter);
    assertEquals(1e-6, kmeans.tol, 0.);
    assertEquals(1, kmeans.ninit);
  }

  @Test
  public void testDTWBarycenter() {
    ListParameterization config = new ListParameterization();
    config.addParameter(AbstractTimeSeriesKMeans.Par.K_ID, 2);
    config.addParameter(AbstractTimeSeriesKMeans.Par.MAXITER_ID, 50);
    config.addParameter(AbstractTimeSeriesKMeans.Par.NINIT_ID, 2);
    config.addParameter(AbstractTimeSeriesKMeans.Par.DISTANCE_ID, DTWDistance.class);
    config.addParameter(AbstractElasticDistance.Par.BANDSIZE_ID, .1);
    config.addParameter(AbstractTimeSeriesKMeans.Par.INIT_ID, RandomlyChosen.class);
    config.addParameter(AbstractTimeSeriesInitialization.Par.SEED_ID, 0L);
    config.addParameter(TimeSeriesKMeans.Par.AVERAGING_ID, DBAAveraging.class);
    config.addParameter(DBAAveraging.Par.ITERATIONS_ID, 4);
    TimeSeriesKMeans.Par par = new TimeSeriesKMeans.Par();
    par.configure(config);
    TimeSeriesKMeans kmeans = par.make();
    assertEquals(.1, ((DTWDistance) kmeans.getDistance()).getBandSize(), 0.);
    assertTrue(kmeans.initializer instanceof RandomlyChosen);
    assertEquals(4, ((DBAAveraging) kmeans.getAveraging()).getIterations());
    assertEquals(50, kmeans.maxiter);
    assertEquals(2, kmeans.ninit);
    Dataset data = Dataset.univariate(new double[] { 0., 0., 1. }, new double[] { 0., 1., 1. }, new double[] { 9., 9., 8. });
    assertEquals(3, kmeans.fitPredict(data).length);
  }

  @Test
  public void testKMedoids() {
    ListParameterization config = new ListParameterization();
    config.addParameter(AbstractTimeSeriesKMeans.Par.K_ID, 2);
    config.addParameter(AbstractTimeSeriesKMeans.Par.DISTANCE_ID, ERPDistance.class);
    config.addParameter(ERPDistance.Par.G_ID, 1.);
    config.addFlag(AbstractTimeSeriesKMeans.Par.PARALLEL_ID);
    TimeSeriesKMedoids.Par par = new TimeSeriesKMedoids.Par();
    par.configure(config);
    TimeSeriesKMedoids kmedoids = par.make();
    assertTrue(kmedoids.getDistance() instanceof ERPDistance);
    assertSame(MedoidAveraging.STATIC, kmedoids.getAveraging());
    assertTrue(kmedoids.parallel);
  }
}
