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

/**
 * Deterministic reseeding of empty clusters: an empty cluster receives the
 * series that is farthest from its own assigned center. Ties go to the lowest
 * index, and a series is used for at most one empty cluster per pass.
 *
 * @since 0.1.0
 */
public final class EmptyClusters {
  /**
   * Fake constructor, static utility class.
   */
  private EmptyClusters() {
    // Do not instantiate.
  }

  /**
   * Find the series farthest from its own center.
   *
   * @param dist Distance of each series to its assigned center
   * @param taken Series already used for reseeding, updated
   * @return Index of the chosen series, or -1 if all are taken
   */
  public static int farthest(double[] dist, boolean[] taken) {
    int best = -1;
    for(int i = 0; i < dist.length; i++) {
      if(!taken[i] && (best < 0 || dist[i] > dist[best])) {
        best = i;
      }
    }
    if(best >= 0) {
      taken[best] = true;
    }
    return best;
  }
}
