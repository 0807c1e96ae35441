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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import tsclust.utilities.exceptions.DimensionMismatchException;
import tsclust.utilities.exceptions.InvalidParameterException;

/**
 * Unit test for the data set container.
 */
public class DatasetTest {
  @Test
  public void testBasics() {
    Dataset data = Dataset.univariate(new double[] { 0., 0., 0. }, new double[] { 5., 5. });
    assertEquals(2, data.size());
    assertEquals(1, data.getDimensionality());
    assertFalse(data.hasEqualLengths());
    assertEquals(TimeSeries.of(5., 5.), data.get(1));
    int count = 0;
    for(TimeSeries s : data) {
      assertSame(data.get(count++), s);
    }
    assertEquals(2, count);
  }

  @Test
  public void testEqualLengths() {
    assertTrue(Dataset.univariate(new double[] { 0., 1. }, new double[] { 2., 3. }).hasEqualLengths());
  }

  @Test
  public void testInputListIsCopied() {
    List<TimeSeries> list = new ArrayList<>();
    list.add(TimeSeries.of(1.));
    Dataset data = new Dataset(list);
    list.add(TimeSeries.of(2.));
    assertEquals(1, data.size());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testUnmodifiable() {
    Dataset.univariate(new double[] { 1. }).asList().add(TimeSeries.of(2.));
  }

  @Test(expected = InvalidParameterException.class)
  public void testEmpty() {
    new Dataset(Collections.emptyList());
  }

  @Test(expected = DimensionMismatchException.class)
  public void testMixedChannels() {
    new Dataset(TimeSeries.of(1., 2.), TimeSeries.multivariate(new double[] { 1., 2. }));
  }
}
