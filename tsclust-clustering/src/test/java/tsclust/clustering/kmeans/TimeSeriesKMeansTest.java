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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.Test;

import tsclust.clustering.kmeans.averaging.DBAAveraging;
import tsclust.clustering.kmeans.averaging.MeanAveraging;
import tsclust.clustering.kmeans.initialization.KMeansPlusPlus;
import tsclust.clustering.kmeans.initialization.Predefined;
import tsclust.clustering.kmeans.initialization.RandomPartition;
import tsclust.clustering.kmeans.initialization.RandomlyChosen;
import tsclust.data.Dataset;
import tsclust.data.TimeSeries;
import tsclust.distance.EuclideanDistance;
import tsclust.distance.timeseries.DTWDistance;
import tsclust.utilities.exceptions.DimensionMismatchException;
import tsclust.utilities.exceptions.InsufficientDataException;
import tsclust.utilities.exceptions.InvalidParameterException;

import elki.logging.Logging;
import elki.utilities.random.RandomFactory;

/**
 * Regression test for Lloyd-style time series k-means.
 */
public class TimeSeriesKMeansTest {
  private static final Logging LOG = Logging.getLogger(TimeSeriesKMeansTest.class);

  private static final Dataset FOUR = Dataset.univariate(new double[] { 0., 0., 0. }, new double[] { 0., 0., 1. }, //
      new double[] { 5., 5., 5. }, new double[] { 5., 5., 6. });

  @Test
  public void testTwoGroups() {
    TimeSeriesKMeans kmeans = new TimeSeriesKMeans(EuclideanDistance.STATIC, 2, 100, new Predefined(FOUR.get(0), FOUR.get(2)), MeanAveraging.STATIC);
    TimeSeriesKMeansModel model = kmeans.fit(FOUR);
    assertTwoGroups(model);
  }

  @Test
  public void testTwoGroupsForgy() {
    boolean found = false;
    for(long seed = 0; seed < 200 && !found; seed++) {
      TimeSeries[] init = new RandomlyChosen(new RandomFactory(seed)).chooseInitialCenters(FOUR, 2, EuclideanDistance.STATIC, MeanAveraging.STATIC);
      if(init[0] != FOUR.get(0) || init[1] != FOUR.get(2)) {
        continue;
      }
      found = true;
      TimeSeriesKMeans kmeans = new TimeSeriesKMeans(EuclideanDistance.STATIC, 2, 100, new RandomlyChosen(new RandomFactory(seed)), MeanAveraging.STATIC);
      assertTwoGroups(kmeans.fit(FOUR));
    }
    assertTrue("No seed picks series 0 and 2.", found);
  }

  private static void assertTwoGroups(TimeSeriesKMeansModel model) {
    assertArrayEquals(new int[] { 0, 0, 1, 1 }, model.getLabels());
    assertArrayEquals(new double[] { 0., 0., .5 }, model.getCenter(0).channel(0), 1e-12);
    assertArrayEquals(new double[] { 5., 5., 5.5 }, model.getCenter(1).channel(0), 1e-12);
    assertThat(model.getIterations(), lessThanOrEqualTo(2));
    assertTrue(model.isConverged());
    assertEquals(1., model.getInertia(), 1e-12);
    assertArrayEquals(new double[] { 2., 1. }, model.getInertiaHistory(), 1e-12);
    assertArrayEquals(new int[] { 2, 2 }, model.getClusterSizes());
  }

  @Test
  public void testEmptyClusterIsReseeded() {
    // Identical initial centers: everything joins cluster 0 first.
    TimeSeriesKMeans kmeans = new TimeSeriesKMeans(EuclideanDistance.STATIC, 2, 100, new Predefined(FOUR.get(0), FOUR.get(0)), MeanAveraging.STATIC);
    TimeSeriesKMeansModel model = kmeans.fit(FOUR);
    assertArrayEquals(new int[] { 0, 0, 1, 1 }, model.getLabels());
    assertArrayEquals(new int[] { 2, 2 }, model.getClusterSizes());
    assertTrue(model.isConverged());
  }

  @Test
  public void testEmptyClusterInstance() {
    AbstractTimeSeriesKMeans.Instance instance = new AbstractTimeSeriesKMeans.Instance(FOUR, EuclideanDistance.STATIC, MeanAveraging.STATIC, //
        new TimeSeries[] { FOUR.get(0), FOUR.get(0) }, false, false, LOG, "test");
    assertEquals(AbstractTimeSeriesKMeans.Phase.INITIALIZED, instance.getPhase());
    assertEquals(4, instance.assignToNearestCluster());
    TimeSeries[] centers = instance.updateCenters();
    // Series 3 is farthest from the only center.
    assertSame(FOUR.get(3), centers[1]);
    assertEquals(1, instance.reseeded);
  }

  @Test
  public void testDuplicateSeriesConverge() {
    // Series 0 and 1 coincide, so cluster 1 is reseeded with a duplicate every round.
    Dataset data = Dataset.univariate(new double[] { 1., 1. }, new double[] { 1., 1. }, new double[] { 4., 4. });
    TimeSeriesKMeans kmeans = new TimeSeriesKMeans(EuclideanDistance.STATIC, 3, 50, 0., 1, new Predefined(data.get(0), data.get(1), data.get(2)), MeanAveraging.STATIC);
    TimeSeriesKMeansModel model = kmeans.fit(data);
    assertTrue(model.isConverged());
    assertThat(model.getIterations(), lessThanOrEqualTo(2));
    assertArrayEquals(new int[] { 0, 0, 2 }, model.getLabels());
    assertEquals(0., model.getInertia(), 0.);
  }

  @Test
  public void testRandomPartitionWithEmptyGroup() {
    Dataset data = Dataset.univariate(new double[] { 0., 0. }, new double[] { 0., 1. }, new double[] { 5., 5. }, //
        new double[] { 5., 6. }, new double[] { 10., 10. }, new double[] { 10., 11. });
    final int k = 3;
    boolean found = false;
    for(long seed = 0; seed < 200 && !found; seed++) {
      // Same draws as the initializer makes.
      Random r = new RandomFactory(seed).getSingleThreadedRandom();
      int[] sizes = new int[k];
      for(int i = 0; i < data.size(); i++) {
        ++sizes[r.nextInt(k)];
      }
      int empty = -1;
      for(int c = 0; c < k && empty < 0; c++) {
        empty = sizes[c] == 0 ? c : -1;
      }
      if(empty < 0) {
        continue;
      }
      found = true;
      TimeSeries[] init = new RandomPartition(new RandomFactory(seed)).chooseInitialCenters(data, k, EuclideanDistance.STATIC, MeanAveraging.STATIC);
      boolean member = false;
      for(TimeSeries s : data) {
        member |= s == init[empty];
      }
      assertTrue("Empty group " + empty + " not seeded with a series.", member);

      TimeSeriesKMeans kmeans = new TimeSeriesKMeans(EuclideanDistance.STATIC, k, 100, 0., 1, new RandomPartition(new RandomFactory(seed)), MeanAveraging.STATIC);
      TimeSeriesKMeansModel model = kmeans.fit(data);
      assertTrue(model.isConverged());
      assertMonotone(model.getInertiaHistory());
      int total = 0;
      for(int size : model.getClusterSizes()) {
        assertThat(size, greaterThan(0));
        total += size;
      }
      assertEquals(data.size(), total);
    }
    assertTrue("No seed leaves a group empty.", found);
  }

  @Test(expected = IllegalStateException.class)
  public void testNoResultBeforeRun() {
    new AbstractTimeSeriesKMeans.Instance(FOUR, EuclideanDistance.STATIC, MeanAveraging.STATIC, //
        new TimeSeries[] { FOUR.get(0), FOUR.get(2) }, false, false, LOG, "test").buildResult();
  }

  @Test
  public void testIterationLimit() {
    TimeSeriesKMeans kmeans = new TimeSeriesKMeans(EuclideanDistance.STATIC, 2, 1, 0., 1, new Predefined(FOUR.get(0), FOUR.get(2)), MeanAveraging.STATIC);
    TimeSeriesKMeansModel model = kmeans.fit(FOUR);
    assertEquals(1, model.getIterations());
    assertFalse(model.isConverged());
    assertArrayEquals(new int[] { 0, 0, 1, 1 }, model.getLabels());
    assertEquals(2., model.getInertia(), 1e-12);
  }

  @Test
  public void testMonotoneInertiaEuclidean() {
    Dataset data = groups(new Random(0L), 3, 10, 24, 0);
    for(long seed = 0; seed < 5; seed++) {
      TimeSeriesKMeans kmeans = new TimeSeriesKMeans(EuclideanDistance.STATIC, 4, 100, 0., 1, new RandomPartition(new RandomFactory(seed)), MeanAveraging.STATIC);
      assertMonotone(kmeans.fit(data).getInertiaHistory());
    }
  }

  @Test
  public void testMonotoneInertiaDTW() {
    Dataset data = groups(new Random(1L), 3, 8, 20, 4);
    for(long seed = 0; seed < 3; seed++) {
      TimeSeriesKMeans kmeans = new TimeSeriesKMeans(new DTWDistance(), 3, 30, 0., 1, new KMeansPlusPlus(new RandomFactory(seed)), new DBAAveraging(2));
      TimeSeriesKMeansModel model = kmeans.fit(data);
      assertMonotone(model.getInertiaHistory());
      for(int l : model.getLabels()) {
        assertTrue(l >= 0 && l < 3);
      }
    }
  }

  private static void assertMonotone(double[] history) {
    for(int i = 1; i < history.length; i++) {
      assertThat("Inertia increased in iteration " + (i + 1), history[i], lessThanOrEqualTo(history[i - 1] + 1e-9));
    }
  }

  @Test
  public void testUnequalLengthsWithDBA() {
    Dataset data = groups(new Random(2L), 2, 6, 16, 5);
    assertFalse(data.hasEqualLengths());
    TimeSeriesKMeans kmeans = new TimeSeriesKMeans(new DTWDistance(.5), 2, 20, 1e-6, 2, new KMeansPlusPlus(new RandomFactory(7L)), new DBAAveraging(3));
    TimeSeriesKMeansModel model = kmeans.fit(data);
    assertEquals(2, model.getK());
    assertEquals(data.size(), model.getLabels().length);
    for(int l : model.predict(data)) {
      assertTrue(l == 0 || l == 1);
    }
  }

  @Test
  public void testParallelMatchesSequential() {
    Dataset data = groups(new Random(3L), 3, 10, 18, 3);
    TimeSeriesKMeans seq = new TimeSeriesKMeans(new DTWDistance(), 3, 20, 0., 1, new KMeansPlusPlus(new RandomFactory(5L)), new DBAAveraging(2, false));
    TimeSeriesKMeans par = new TimeSeriesKMeans(new DTWDistance(), 3, 20, 0., 1, new KMeansPlusPlus(new RandomFactory(5L)), new DBAAveraging(2, true));
    par.setParallel(true);
    TimeSeriesKMeansModel a = seq.fit(data), b = par.fit(data);
    assertArrayEquals(a.getLabels(), b.getLabels());
    assertEquals(a.getInertia(), b.getInertia(), 0.);
    assertArrayEquals(a.getCenters(), b.getCenters());
  }

  @Test
  public void testRestartsKeepBest() {
    Dataset data = groups(new Random(4L), 4, 5, 12, 0);
    TimeSeriesKMeansModel single = new TimeSeriesKMeans(EuclideanDistance.STATIC, 4, 50, 0., 1, new RandomlyChosen(new RandomFactory(9L)), MeanAveraging.STATIC).fit(data);
    TimeSeriesKMeansModel multi = new TimeSeriesKMeans(EuclideanDistance.STATIC, 4, 50, 0., 6, new RandomlyChosen(new RandomFactory(9L)), MeanAveraging.STATIC).fit(data);
    assertThat(multi.getInertia(), lessThanOrEqualTo(single.getInertia()));
  }

  @Test
  public void testPredict() {
    TimeSeriesKMeans kmeans = new TimeSeriesKMeans(EuclideanDistance.STATIC, 2, 100, new Predefined(FOUR.get(0), FOUR.get(2)), MeanAveraging.STATIC);
    TimeSeriesKMeansModel model = kmeans.fit(FOUR);
    assertEquals(0, model.predict(TimeSeries.of(0., 0., .2)));
    assertEquals(1, model.predict(TimeSeries.of(6., 6., 6.)));
    assertArrayEquals(model.getLabels(), model.predict(FOUR));
    assertArrayEquals(model.getLabels(), kmeans.fitPredict(FOUR));
    double[][] dist = model.transform(FOUR);
    assertEquals(4, dist.length);
    assertEquals(.5, dist[0][0], 1e-12);
    assertNotEquals(dist[0][0], dist[0][1], 1e-12);
  }

  @Test
  public void testPredictTieGoesToFirst() {
    TimeSeriesKMeans kmeans = new TimeSeriesKMeans(EuclideanDistance.STATIC, 2, 100, new Predefined(FOUR.get(0), FOUR.get(2)), MeanAveraging.STATIC);
    TimeSeriesKMeansModel model = kmeans.fit(FOUR);
    // Equidistant from [0, 0, .5] and [5, 5, 5.5].
    assertEquals(0, model.predict(TimeSeries.of(2.5, 2.5, 3.)));
  }

  @Test(expected = DimensionMismatchException.class)
  public void testPredictWrongChannels() {
    TimeSeriesKMeans kmeans = new TimeSeriesKMeans(EuclideanDistance.STATIC, 2, 100, new Predefined(FOUR.get(0), FOUR.get(2)), MeanAveraging.STATIC);
    kmeans.fit(FOUR).predict(TimeSeries.multivariate(new double[] { 0., 0. }, new double[] { 0., 0. }, new double[] { 0., 0. }));
  }

  @Test(expected = InvalidParameterException.class)
  public void testZeroClusters() {
    new TimeSeriesKMeans(EuclideanDistance.STATIC, 0, 100, new Predefined(FOUR.get(0)), MeanAveraging.STATIC);
  }

  @Test(expected = InvalidParameterException.class)
  public void testNegativeTolerance() {
    new TimeSeriesKMeans(EuclideanDistance.STATIC, 2, 100, -1., 1, new KMeansPlusPlus(new RandomFactory(0L)), MeanAveraging.STATIC);
  }

  @Test(expected = InsufficientDataException.class)
  public void testTooFewSeries() {
    new TimeSeriesKMeans(EuclideanDistance.STATIC, 5, 100, new KMeansPlusPlus(new RandomFactory(0L)), MeanAveraging.STATIC).fit(FOUR);
  }

  @Test(expected = DimensionMismatchException.class)
  public void testEuclideanNeedsEqualLengths() {
    Dataset data = Dataset.univariate(new double[] { 0., 0. }, new double[] { 0., 0., 0. });
    new TimeSeriesKMeans(EuclideanDistance.STATIC, 1, 100, new KMeansPlusPlus(new RandomFactory(0L)), MeanAveraging.STATIC).fit(data);
  }

  @Test(expected = DimensionMismatchException.class)
  public void testMeanNeedsEqualLengths() {
    Dataset data = Dataset.univariate(new double[] { 0., 0. }, new double[] { 0., 0., 0. });
    new TimeSeriesKMeans(new DTWDistance(), 1, 100, new KMeansPlusPlus(new RandomFactory(0L)), MeanAveraging.STATIC).fit(data);
  }

  /**
   * Noisy shifted sine waves, one frequency per group.
   *
   * @param r Random generator
   * @param k Number of groups
   * @param size Series per group
   * @param len Base length
   * @param spread Maximum extra length
   * @return Data set
   */
  static Dataset groups(Random r, int k, int size, int len, int spread) {
    List<TimeSeries> list = new ArrayList<>();
    for(int i = 0; i < size; i++) {
      for(int c = 0; c < k; c++) {
        double[] v = new double[len + (spread > 0 ? r.nextInt(spread + 1) : 0)];
        final double shift = r.nextDouble() * 2.;
        for(int t = 0; t < v.length; t++) {
          v[t] = 2. * c + Math.sin((t + shift) * (c + 1) * .3) + r.nextGaussian() * .1;
        }
        list.add(TimeSeries.of(v));
      }
    }
    return new Dataset(list);
  }
}
