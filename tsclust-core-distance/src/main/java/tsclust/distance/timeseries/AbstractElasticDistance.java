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

import tsclust.data.TimeSeries;
import tsclust.distance.Alignment;
import tsclust.distance.AlignmentDistance;
import tsclust.distance.TimeSeriesDistance;
import tsclust.utilities.exceptions.InvalidParameterException;

import elki.utilities.optionhandling.OptionID;
import elki.utilities.optionhandling.Parameterizer;
import elki.utilities.optionhandling.constraints.CommonConstraints;
import elki.utilities.optionhandling.parameterization.Parameterization;
import elki.utilities.optionhandling.parameters.DoubleParameter;

/**
 * Base class for distances computed by an elastic alignment, with an optional
 * Sakoe-Chiba band.
 * <p>
 * The band size is relative to the longer series: a cell {@code (i, j)} is
 * evaluated if {@code |i - j| <= ceil(bandSize * max(n, m))}. The radius is
 * never smaller than {@code |n - m|}, so that the end cell stays reachable.
 * A band size of 0 forces the diagonal alignment on equal lengths.
 *
 * @since 0.1.0
 */
public abstract class AbstractElasticDistance implements AlignmentDistance {
  /**
   * Relative width of the warping band, 1 for unconstrained.
   */
  protected final double bandSize;

  /**
   * Constructor.
   *
   * @param bandSize Band size in [0, 1]
   */
  protected AbstractElasticDistance(double bandSize) {
    if(!(bandSize >= 0. && bandSize <= 1.)) {
      throw new InvalidParameterException("Band size must be in [0, 1], got " + bandSize + ".");
    }
    this.bandSize = bandSize;
  }

  @Override
  public double distance(TimeSeries a, TimeSeries b) {
    TimeSeriesDistance.checkDimensionality(a, b);
    final int n = a.length(), m = b.length();
    return finish(ElasticAlignment.accumulate(costs(a, b), n, m, radius(n, m), isOpenBoundary()), n, m);
  }

  @Override
  public Alignment align(TimeSeries a, TimeSeries b) {
    TimeSeriesDistance.checkDimensionality(a, b);
    final int n = a.length(), m = b.length();
    Alignment raw = ElasticAlignment.align(costs(a, b), n, m, radius(n, m), isOpenBoundary());
    return raw.withDistance(finish(raw.getDistance(), n, m));
  }

  /**
   * Band radius for the given lengths.
   *
   * @param n Length of the first series
   * @param m Length of the second series
   * @return Radius
   */
  protected int radius(int n, int m) {
    final int r = bandSize >= 1. ? Math.max(n, m) : (int) Math.ceil(bandSize * Math.max(n, m));
    return Math.max(r, Math.abs(n - m));
  }

  /**
   * Move costs for a pair of series.
   *
   * @param a First series
   * @param b Second series
   * @return Costs
   */
  protected abstract ElasticCost costs(TimeSeries a, TimeSeries b);

  /**
   * Whether the boundary row and column are reachable by gap moves.
   *
   * @return {@code false} by default
   */
  protected boolean isOpenBoundary() {
    return false;
  }

  /**
   * Turn the accumulated cost into the distance value.
   *
   * @param acc Accumulated cost
   * @param n Length of the first series
   * @param m Length of the second series
   * @return Distance
   */
  protected double finish(double acc, int n, int m) {
    return acc;
  }

  /**
   * @return the relative band size
   */
  public double getBandSize() {
    return bandSize;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(bandSize=" + bandSize + ")";
  }

  /**
   * Parameterization class.
   */
  public abstract static class Par implements Parameterizer {
    /**
     * Band size parameter.
     */
    public static final OptionID BANDSIZE_ID = OptionID.getOrCreateOptionID("edit.bandSize", "The relative width of the warping band (0 <= bandSize <= 1).");

    /**
     * Band size.
     */
    protected double bandSize = 1.;

    @Override
    public void configure(Parameterization config) {
      new DoubleParameter(BANDSIZE_ID, 1.) //
          .addConstraint(CommonConstraints.GREATER_EQUAL_ZERO_DOUBLE) //
          .addConstraint(CommonConstraints.LESS_EQUAL_ONE_DOUBLE) //
          .grab(config, x -> bandSize = x);
    }
  }
}
