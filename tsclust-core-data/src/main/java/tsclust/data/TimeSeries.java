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

import java.util.Arrays;

import tsclust.utilities.exceptions.DimensionMismatchException;
import tsclust.utilities.exceptions.InvalidParameterException;

/**
 * An immutable, possibly multivariate, time series.
 * <p>
 * Observations are stored as {@code length x dimensionality} values; a
 * univariate series has dimensionality 1. All values are finite.
 *
 * @since 0.1.0
 */
public final class TimeSeries {
  /**
   * Observations, indexed by time, then by channel.
   */
  private final double[][] data;

  /**
   * Constructor, without copying.
   *
   * @param data Data, not modified afterwards
   */
  private TimeSeries(double[][] data) {
    this.data = data;
  }

  /**
   * Create a univariate time series.
   *
   * @param values Observations
   * @return Time series
   */
  public static TimeSeries of(double... values) {
    if(values == null || values.length == 0) {
      throw new InvalidParameterException("A time series needs at least one observation.");
    }
    double[][] data = new double[values.length][1];
    for(int t = 0; t < values.length; t++) {
      data[t][0] = checkFinite(values[t], t);
    }
    return new TimeSeries(data);
  }

  /**
   * Create a multivariate time series.
   *
   * @param points Observations, one vector per time step
   * @return Time series
   */
  public static TimeSeries multivariate(double[]... points) {
    if(points == null || points.length == 0) {
      throw new InvalidParameterException("A time series needs at least one observation.");
    }
    final int dim = points[0].length;
    if(dim == 0) {
      throw new InvalidParameterException("A time series needs at least one channel.");
    }
    double[][] data = new double[points.length][];
    for(int t = 0; t < points.length; t++) {
      if(points[t].length != dim) {
        throw new DimensionMismatchException("Observation " + t + " has " + points[t].length + " channels, expected " + dim + ".");
      }
      data[t] = points[t].clone();
      for(int d = 0; d < dim; d++) {
        checkFinite(data[t][d], t);
      }
    }
    return new TimeSeries(data);
  }

  /**
   * Wrap an array that the caller hands over and no longer modifies.
   * <p>
   * Used by averaging procedures that produce fresh arrays.
   *
   * @param data Observations, ownership is transferred
   * @return Time series
   */
  public static TimeSeries wrap(double[][] data) {
    if(data.length == 0 || data[0].length == 0) {
      throw new InvalidParameterException("A time series needs at least one observation and channel.");
    }
    final int dim = data[0].length;
    for(int t = 0; t < data.length; t++) {
      if(data[t].length != dim) {
        throw new DimensionMismatchException("Observation " + t + " has " + data[t].length + " channels, expected " + dim + ".");
      }
      for(int d = 0; d < dim; d++) {
        checkFinite(data[t][d], t);
      }
    }
    return new TimeSeries(data);
  }

  private static double checkFinite(double v, int t) {
    if(Double.isNaN(v) || Double.isInfinite(v)) {
      throw new InvalidParameterException("Non-finite value at time step " + t + ".");
    }
    return v;
  }

  /**
   * Number of observations.
   *
   * @return Length
   */
  public int length() {
    return data.length;
  }

  /**
   * Number of channels.
   *
   * @return Dimensionality
   */
  public int getDimensionality() {
    return data[0].length;
  }

  /**
   * Value at a given time step and channel.
   *
   * @param t Time step
   * @param d Channel
   * @return Value
   */
  public double value(int t, int d) {
    return data[t][d];
  }

  /**
   * Value of a univariate series, or of the first channel.
   *
   * @param t Time step
   * @return Value
   */
  public double value(int t) {
    return data[t][0];
  }

  /**
   * Copy of the observation vector at a time step.
   *
   * @param t Time step
   * @return Vector copy
   */
  public double[] point(int t) {
    return data[t].clone();
  }

  /**
   * Deep copy of all observations.
   *
   * @return Array copy, {@code length x dimensionality}
   */
  public double[][] toArray() {
    double[][] copy = new double[data.length][];
    for(int t = 0; t < data.length; t++) {
      copy[t] = data[t].clone();
    }
    return copy;
  }

  /**
   * Copy of a single channel.
   *
   * @param d Channel
   * @return Values of that channel
   */
  public double[] channel(int d) {
    double[] out = new double[data.length];
    for(int t = 0; t < data.length; t++) {
      out[t] = data[t][d];
    }
    return out;
  }

  @Override
  public boolean equals(Object obj) {
    if(this == obj) {
      return true;
    }
    if(!(obj instanceof TimeSeries)) {
      return false;
    }
    return Arrays.deepEquals(data, ((TimeSeries) obj).data);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(data);
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder(data.length * 8).append('[');
    for(int t = 0; t < data.length; t++) {
      if(t > 0) {
        buf.append(", ");
      }
      if(data[t].length == 1) {
        buf.append(data[t][0]);
      }
      else {
        buf.append(Arrays.toString(data[t]));
      }
    }
    return buf.append(']').toString();
  }
}
