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
package tsclust.distance.timeseries;

import java.util.Arrays;

import tsclust.distance.Alignment;

/**
 * Banded dynamic-programming alignment shared by all elastic distances.
 * <p>
 * The accumulated cost matrix has {@code (n+1) x (m+1)} cells, cell
 * {@code (i, j)} covering the prefixes {@code a[0..i)} and {@code b[0..j)}.
 * Cell {@code (0, 0)} is 0. Each other cell takes the cheapest of the three
 * predecessor moves (diagonal, up = advance in {@code a}, left = advance in
 * {@code b}) plus the move cost. Only cells with {@code |i - j| <= radius} are
 * evaluated, all others are infinite. Boundary cells {@code (i, 0)} and
 * {@code (0, j)} are infinite unless the measure declares an open boundary.
 * <p>
 * Ties are broken in a fixed order: diagonal, then up, then left. The
 * warping path is recovered by following the recorded moves back from
 * {@code (n, m)} to {@code (0, 0)}.
 *
 * @since 0.1.0
 */
public final class ElasticAlignment {
  /**
   * Recorded moves.
   */
  private static final byte DIAGONAL = 0, UP = 1, LEFT = 2;

  /**
   * Fake constructor, static utility class.
   */
  private ElasticAlignment() {
    // Do not instantiate.
  }

  /**
   * Accumulated cost of the optimal alignment, in linear memory.
   *
   * @param cost Move costs
   * @param n Length of the first series
   * @param m Length of the second series
   * @param radius Band radius, at least {@code |n - m|}
   * @param open Open boundary
   * @return Accumulated cost at {@code (n, m)}
   */
  public static double accumulate(ElasticCost cost, int n, int m, int radius, boolean open) {
    assert radius >= Math.abs(n - m);
    final boolean uniform = cost.isUniform();
    double[] prev = new double[m + 1], cur = new double[m + 1];
    Arrays.fill(prev, Double.POSITIVE_INFINITY);
    Arrays.fill(cur, Double.POSITIVE_INFINITY);
    prev[0] = 0.;
    if(open) {
      for(int j = 1, end = Math.min(m, radius); j <= end; j++) {
        prev[j] = prev[j - 1] + cost.left(-1, j - 1);
      }
    }
    for(int i = 1; i <= n; i++) {
      final int lo = Math.max(1, i - radius), hi = Math.min(m, i + radius);
      cur[0] = open && i <= radius ? prev[0] + cost.up(i - 1, -1) : Double.POSITIVE_INFINITY;
      if(lo > 1) {
        cur[lo - 1] = Double.POSITIVE_INFINITY;
      }
      for(int j = lo; j <= hi; j++) {
        final double diag = prev[j - 1], top = prev[j], side = cur[j - 1];
        if(uniform) {
          cur[j] = Math.min(diag, Math.min(top, side)) + cost.match(i - 1, j - 1);
          continue;
        }
        double best = diag + cost.match(i - 1, j - 1);
        double v = top + cost.up(i - 1, j - 1);
        best = v < best ? v : best;
        v = side + cost.left(i - 1, j - 1);
        cur[j] = v < best ? v : best;
      }
      if(hi < m) {
        cur[hi + 1] = Double.POSITIVE_INFINITY;
      }
      double[] tmp = prev;
      prev = cur;
      cur = tmp;
    }
    return prev[m];
  }

  /**
   * Optimal alignment with its warping path, using the full matrix.
   * <p>
   * The path contains one pair per visited cell with {@code i > 0} and
   * {@code j > 0}.
   *
   * @param cost Move costs
   * @param n Length of the first series
   * @param m Length of the second series
   * @param radius Band radius, at least {@code |n - m|}
   * @param open Open boundary
   * @return Alignment, carrying the accumulated cost at {@code (n, m)}
   */
  public static Alignment align(ElasticCost cost, int n, int m, int radius, boolean open) {
    assert radius >= Math.abs(n - m);
    final boolean uniform = cost.isUniform();
    double[][] acc = new double[n + 1][m + 1];
    byte[][] move = new byte[n + 1][m + 1];
    for(double[] row : acc) {
      Arrays.fill(row, Double.POSITIVE_INFINITY);
    }
    acc[0][0] = 0.;
    if(open) {
      for(int j = 1, end = Math.min(m, radius); j <= end; j++) {
        acc[0][j] = acc[0][j - 1] + cost.left(-1, j - 1);
        move[0][j] = LEFT;
      }
      for(int i = 1, end = Math.min(n, radius); i <= end; i++) {
        acc[i][0] = acc[i - 1][0] + cost.up(i - 1, -1);
        move[i][0] = UP;
      }
    }
    for(int i = 1; i <= n; i++) {
      final double[] prow = acc[i - 1], crow = acc[i];
      final int lo = Math.max(1, i - radius), hi = Math.min(m, i + radius);
      for(int j = lo; j <= hi; j++) {
        double best, v;
        byte mv = DIAGONAL;
        if(uniform) {
          best = prow[j - 1];
          if(prow[j] < best) {
            best = prow[j];
            mv = UP;
          }
          if(crow[j - 1] < best) {
            best = crow[j - 1];
            mv = LEFT;
          }
          best += cost.match(i - 1, j - 1);
        }
        else {
          best = prow[j - 1] + cost.match(i - 1, j - 1);
          v = prow[j] + cost.up(i - 1, j - 1);
          if(v < best) {
            best = v;
            mv = UP;
          }
          v = crow[j - 1] + cost.left(i - 1, j - 1);
          if(v < best) {
            best = v;
            mv = LEFT;
          }
        }
        crow[j] = best;
        move[i][j] = mv;
      }
    }
    // Backtrack from the end cell.
    int[] pi = new int[n + m], pj = new int[n + m];
    int len = 0;
    for(int i = n, j = m; i > 0 || j > 0;) {
      if(i > 0 && j > 0) {
        pi[len] = i - 1;
        pj[len] = j - 1;
        ++len;
      }
      switch(i == 0 ? LEFT : j == 0 ? UP : move[i][j]){
      case DIAGONAL:
        --i;
        --j;
        break;
      case UP:
        --i;
        break;
      default:
        --j;
      }
    }
    int[] first = new int[len], second = new int[len];
    for(int k = 0; k < len; k++) {
      first[k] = pi[len - 1 - k];
      second[k] = pj[len - 1 - k];
    }
    return new Alignment(acc[n][m], first, second);
  }
}
