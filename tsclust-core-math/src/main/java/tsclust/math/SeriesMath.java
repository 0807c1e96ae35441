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
package tsclust.math;

import tsclust.data.TimeSeries;

import net.jafama.FastMath;

/**
 * Point kernels and transforms shared by the elastic distance measures.
 *
 * @since 0.1.0
 */
public final class SeriesMath {
  /**
   * Fake constructor, static utility class.
   */
  private SeriesMath() {
    // Do not instantiate.
  }

  /**
   * Squared Euclidean distance of two observations.
   *
   * @param a First series
   * @param i Time step in the first series
   * @param b Second series
   * @param j Time step in the second series
   * @return Squared distance
   */
  public static double squaredDistance(TimeSeries a, int i, TimeSeries b, int j) {
    final int dim = a.getDimensionality();
    double agg = 0.;
    for(int d = 0; d < dim; d++) {
      final double delta = a.value(i, d) - b.value(j, d);
      agg += delta * delta;
    }
    return agg;
  }

  /**
   * Euclidean distance of two observations (absolute difference if univariate).
   *
   * @param a First series
   * @param i Time step in the first series
   * @param b Second series
   * @param j Time step in the second series
   * @return Distance
   */
  public static double distance(TimeSeries a, int i, TimeSeries b, int j) {
    if(a.getDimensionality() == 1) {
      return Math.abs(a.value(i, 0) - b.value(j, 0));
    }
    return FastMath.sqrt(squaredDistance(a, i, b, j));
  }

  /**
   * Euclidean distance of an observation to a constant reference value in
   * every channel.
   *
   * @param a Series
   * @param i Time step
   * @param g Reference value
   * @return Distance
   */
  public static double distanceTo(TimeSeries a, int i, double g) {
    final int dim = a.getDimensionality();
    if(dim == 1) {
      return Math.abs(a.value(i, 0) - g);
    }
    double agg = 0.;
    for(int d = 0; d < dim; d++) {
      final double delta = a.value(i, d) - g;
      agg += delta * delta;
    }
    return FastMath.sqrt(agg);
  }

  /**
   * First-derivative estimate of a series, per channel.
   * <p>
   * Interior points use the average of the left slope and the slope between
   * both neighbors; the end points copy their neighbor, so the result has the
   * same length as the input.
   *
   * @param s Input series
   * @return Derivative series
   */
  public static TimeSeries derivative(TimeSeries s) {
    final int n = s.length(), dim = s.getDimensionality();
    double[][] out = new double[n][dim];
    if(n == 1) {
      return TimeSeries.wrap(out);
    }
    if(n == 2) {
      for(int d = 0; d < dim; d++) {
        out[0][d] = out[1][d] = s.value(1, d) - s.value(0, d);
      }
      return TimeSeries.wrap(out);
    }
    for(int t = 1; t < n - 1; t++) {
      for(int d = 0; d < dim; d++) {
        final double prev = s.value(t - 1, d);
        out[t][d] = ((s.value(t, d) - prev) + (s.value(t + 1, d) - prev) * .5) * .5;
      }
    }
    System.arraycopy(out[1], 0, out[0], 0, dim);
    System.arraycopy(out[n - 2], 0, out[n - 1], 0, dim);
    return TimeSeries.wrap(out);
  }

  /**
   * Logistic weights by index offset, for weighted dynamic time warping.
   * <p>
   * {@code w[k] = 1 / (1 + exp(-g * (k - len / 2)))}.
   *
   * @param len Maximum offset plus one, usually the longer series length
   * @param g Steepness, 0 gives constant weight 0.5
   * @return Weights indexed by {@code |i - j|}
   */
  public static double[] logisticWeights(int len, double g) {
    final double half = len * .5;
    double[] w = new double[len];
    for(int k = 0; k < len; k++) {
      w[k] = 1. / (1. + FastMath.exp(-g * (k - half)));
    }
    return w;
  }
}
