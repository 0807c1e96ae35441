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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;

import org.junit.Test;

import tsclust.clustering.kmeans.averaging.MeanAveraging;
import tsclust.data.Dataset;
import tsclust.data.TimeSeries;
import tsclust.distance.EuclideanDistance;
import tsclust.utilities.exceptions.DimensionMismatchException;
import tsclust.utilities.exceptions.InsufficientDataException;
import tsclust.utilities.exceptions.InvalidParameterException;

import elki.utilities.random.RandomFactory;

/**
 * Unit test for Forgy and predefined initialization.
 */
public class RandomlyChosenTest {
  private static final Dataset DATA = Dataset.univariate(new double[] { 0. }, new double[] { 1. }, new double[] { 2. }, new double[] { 3. }, new double[] { 4. });

  @Test
  public void testDistinctMembers() {
    for(long seed = 0; seed < 20; seed++) {
      TimeSeries[] centers = new RandomlyChosen(new RandomFactory(seed)).chooseInitialCenters(DATA, 5, EuclideanDistance.STATIC, MeanAveraging.STATIC);
      boolean[] seen = new boolean[5];
      for(TimeSeries c : centers) {
        final int i = (int) c.value(0);
        assertSame(DATA.get(i), c);
        assertFalse(seen[i]);
        seen[i] = true;
      }
    }
  }

  @Test
  public void testReproducible() {
    TimeSeries[] a = new RandomlyChosen(new RandomFactory(42L)).chooseInitialCenters(DATA, 3, EuclideanDistance.STATIC, MeanAveraging.STATIC);
    TimeSeries[] b = new RandomlyChosen(new RandomFactory(42L)).chooseInitialCenters(DATA, 3, EuclideanDistance.STATIC, MeanAveraging.STATIC);
    assertArrayEquals(a, b);
  }

  @Test(expected = InsufficientDataException.class)
  public void testTooFewSeries() {
    new RandomlyChosen(new RandomFactory(0L)).chooseInitialCenters(DATA, 6, EuclideanDistance.STATIC, MeanAveraging.STATIC);
  }

  @Test
  public void testPredefined() {
    TimeSeries c0 = TimeSeries.of(0.5), c1 = TimeSeries.of(3.5);
    Predefined init = new Predefined(c0, c1);
    TimeSeries[] centers = init.chooseInitialCenters(DATA, 2, EuclideanDistance.STATIC, MeanAveraging.STATIC);
    assertSame(c0, centers[0]);
    assertSame(c1, centers[1]);
    assertNotSame(centers, init.chooseInitialCenters(DATA, 2, EuclideanDistance.STATIC, MeanAveraging.STATIC));
  }

  @Test(expected = InvalidParameterException.class)
  public void testPredefinedWrongCount() {
    new Predefined(TimeSeries.of(0.)).chooseInitialCenters(DATA, 2, EuclideanDistance.STATIC, MeanAveraging.STATIC);
  }

  @Test(expected = DimensionMismatchException.class)
  public void testPredefinedWrongChannels() {
    new Predefined(TimeSeries.multivariate(new double[] { 0., 0. })).chooseInitialCenters(DATA, 1, EuclideanDistance.STATIC, MeanAveraging.STATIC);
  }
}
