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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import tsclust.utilities.exceptions.DimensionMismatchException;
import tsclust.utilities.exceptions.InvalidParameterException;

/**
 * An ordered collection of time series sharing the same dimensionality.
 * <p>
 * Lengths may differ; whether that is acceptable is decided by the distance
 * measure and averaging procedure in use. The channel count is validated
 * once, on construction.
 *
 * @since 0.1.0
 */
public class Dataset implements Iterable<TimeSeries> {
  /**
   * Series, in input order.
   */
  private final List<TimeSeries> series;

  /**
   * Shared channel count.
   */
  private final int dim;

  /**
   * Constructor.
   *
   * @param series Series to store
   */
  public Dataset(List<TimeSeries> series) {
    if(series == null || series.isEmpty()) {
      throw new InvalidParameterException("A data set needs at least one time series.");
    }
    this.dim = series.get(0).getDimensionality();
    for(int i = 1; i < series.size(); i++) {
      final int d = series.get(i).getDimensionality();
      if(d != dim) {
        throw new DimensionMismatchException("Series " + i + " has " + d + " channels, but series 0 has " + dim + ".");
      }
    }
    this.series = Collections.unmodifiableList(new ArrayList<>(series));
  }

  /**
   * Constructor.
   *
   * @param series Series to store
   */
  public Dataset(TimeSeries... series) {
    this(Arrays.asList(series));
  }

  /**
   * Build a univariate data set from raw arrays.
   *
   * @param rows One array per series
   * @return Data set
   */
  public static Dataset univariate(double[]... rows) {
    List<TimeSeries> list = new ArrayList<>(rows.length);
    for(double[] row : rows) {
      list.add(TimeSeries.of(row));
    }
    return new Dataset(list);
  }

  /**
   * Number of series.
   *
   * @return Size
   */
  public int size() {
    return series.size();
  }

  /**
   * Get a series by position.
   *
   * @param i Position
   * @return Series
   */
  public TimeSeries get(int i) {
    return series.get(i);
  }

  /**
   * Shared number of channels.
   *
   * @return Dimensionality
   */
  public int getDimensionality() {
    return dim;
  }

  /**
   * Test whether all series have the same length.
   *
   * @return {@code true} when all lengths agree
   */
  public boolean hasEqualLengths() {
    final int len = series.get(0).length();
    for(TimeSeries s : series) {
      if(s.length() != len) {
        return false;
      }
    }
    return true;
  }

  /**
   * Unmodifiable list view.
   *
   * @return Series
   */
  public List<TimeSeries> asList() {
    return series;
  }

  @Override
  public Iterator<TimeSeries> iterator() {
    return series.iterator();
  }
}
