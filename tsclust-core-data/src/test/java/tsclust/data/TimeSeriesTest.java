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
package tsclust.data;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import org.junit.Test;

import tsclust.utilities.exceptions.DimensionMismatchException;
import tsclust.utilities.exceptions.InvalidParameterException;

/**
 * Unit test for the time series container.
 */
public class TimeSeriesTest {
  @Test
  public void testUnivariate() {
    TimeSeries s = TimeSeries.of(1., 2., 3.);
    assertEquals(3, s.length());
    assertEquals(1, s.getDimensionality());
    assertEquals(2., s.value(1), 0.);
    assertEquals(3., s.value(2, 0), 0.);
    assertArrayEquals(new double[] { 1., 2., 3. }, s.channel(0), 0.);
  }

  @Test
  public void testMultivariate() {
    TimeSeries s = TimeSeries.multivariate(new double[] { 1., 10. }, new double[] { 2., 20. });
    assertEquals(2, s.length());
    assertEquals(2, s.getDimensionality());
    assertEquals(20., s.value(1, 1), 0.);
    assertArrayEquals(new double[] { 10., 20. }, s.channel(1), 0.);
  }

  @Test
  public void testDefensiveCopies() {
    double[] p = { 1., 2. };
    TimeSeries s = TimeSeries.multivariate(p);
    p[0] = 99.;
    assertEquals(1., s.value(0, 0), 0.);
    s.point(0)[1] = 99.;
    s.toArray()[0][1] = 99.;
    assertEquals(2., s.value(0, 1), 0.);
  }

  @Test
  public void testEquality() {
    assertEquals(TimeSeries.of(1., 2.), TimeSeries.of(1., 2.));
    assertEquals(TimeSeries.of(1., 2.).hashCode(), TimeSeries.of(1., 2.).hashCode());
    assertNotEquals(TimeSeries.of(1., 2.), TimeSeries.of(1., 2., 3.));
    assertEquals("[1.0, 2.0]", TimeSeries.of(1., 2.).toString());
  }

  @Test(expected = InvalidParameterException.class)
  public void testEmpty() {
    TimeSeries.of();
  }

  @Test(expected = InvalidParameterException.class)
  public void testNaN() {
    TimeSeries.of(1., Double.NaN);
  }

  @Test(expected = InvalidParameterException.class)
  public void testInfinite() {
    TimeSeries.wrap(new double[][] { { Double.POSITIVE_INFINITY } });
  }

  @Test(expected = DimensionMismatchException.class)
  public void testRagged() {
    TimeSeries.multivariate(new double[] { 1., 2. }, new double[] { 1. });
  }

  @Test(expected = DimensionMismatchException.class)
  public void testRaggedWrap() {
    TimeSeries.wrap(new double[][] { { 1., 2. }, { 1. } });
  }
}
