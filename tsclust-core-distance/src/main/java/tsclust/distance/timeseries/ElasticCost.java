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

/**
 * Transition costs of an elastic alignment of two series {@code a} and
 * {@code b}, evaluated by {@link ElasticAlignment}.
 * <p>
 * Indexes are 0-based time steps of the observations being consumed by the
 * move. On an open boundary, the index of the series that is not advanced is
 * {@code -1}.
 *
 * @since 0.1.0
 */
public interface ElasticCost {
  /**
   * Cost of advancing in both series, consuming {@code a[i]} and {@code b[j]}.
   *
   * @param i Index into the first series
   * @param j Index into the second series
   * @return Cost
   */
  double match(int i, int j);

  /**
   * Cost of advancing in the first series only, to {@code a[i]}, while the
   * second series stays at {@code b[j]}.
   *
   * @param i Index into the first series
   * @param j Index into the second series
   * @return Cost
   */
  double up(int i, int j);

  /**
   * Cost of advancing in the second series only, to {@code b[j]}, while the
   * first series stays at {@code a[i]}.
   *
   * @param i Index into the first series
   * @param j Index into the second series
   * @return Cost
   */
  double left(int i, int j);

  /**
   * Whether all three moves always cost the same, as in time warping. The
   * local cost is then evaluated once per cell, via {@link #match}.
   *
   * @return {@code true} if uniform
   */
  default boolean isUniform() {
    return false;
  }
}
