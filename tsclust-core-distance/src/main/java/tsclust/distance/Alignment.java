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
package tsclust.distance;

/**
 * Result of an alignment: the distance and the warping path as pairs of
 * (0-based) indexes into both series, in temporal order.
 *
 * @since 0.1.0
 */
public class Alignment {
  /**
   * Distance value.
   */
  private final double distance;

  /**
   * Indexes into the first series.
   */
  private final int[] first;

  /**
   * Indexes into the second series.
   */
  private final int[] second;

  /**
   * Constructor.
   *
   * @param distance Distance
   * @param first Indexes into the first series
   * @param second Indexes into the second series, same length
   */
  public Alignment(double distance, int[] first, int[] second) {
    assert first.length == second.length;
    this.distance = distance;
    this.first = first;
    this.second = second;
  }

  /**
   * @return the distance
   */
  public double getDistance() {
    return distance;
  }

  /**
   * Same path with a different distance value, e.g. after normalization.
   *
   * @param distance New distance
   * @return Alignment sharing this path
   */
  public Alignment withDistance(double distance) {
    return new Alignment(distance, first, second);
  }

  /**
   * Number of index pairs on the path.
   *
   * @return Path length
   */
  public int size() {
    return first.length;
  }

  /**
   * Index into the first series of the k-th pair.
   *
   * @param k Pair number
   * @return Index
   */
  public int getFirst(int k) {
    return first[k];
  }

  /**
   * Index into the second series of the k-th pair.
   *
   * @param k Pair number
   * @return Index
   */
  public int getSecond(int k) {
    return second[k];
  }

  /**
   * Path as an array of pairs.
   *
   * @return {@code size() x 2} array
   */
  public int[][] toPairs() {
    int[][] pairs = new int[first.length][];
    for(int k = 0; k < first.length; k++) {
      pairs[k] = new int[] { first[k], second[k] };
    }
    return pairs;
  }
}
