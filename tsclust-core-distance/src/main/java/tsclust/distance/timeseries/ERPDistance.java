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
import tsclust.math.SeriesMath;
import tsclust.utilities.exceptions.InvalidParameterException;

import elki.utilities.documentation.Reference;
import elki.utilities.optionhandling.OptionID;
import elki.utilities.optionhandling.parameterization.Parameterization;
import elki.utilities.optionhandling.parameters.DoubleParameter;

/**
 * Edit distance with real penalty.
 * <p>
 * Matching two observations costs their Euclidean distance. An observation
 * left unmatched is compared to the constant gap value {@code g} instead,
 * which makes the measure a metric.
 *
 * @since 0.1.0
 */
@Reference(authors = "L. Chen, R. Ng", //
    title = "On the marriage of Lp-norms and edit distance", //
    booktitle = "Proc. 30th Int. Conf. on Very Large Data Bases (VLDB 2004)", //
    url = "https://doi.org/10.1016/B978-012088469-8.50070-X", //
    bibkey = "DBLP:conf/vldb/ChenN04")
public class ERPDistance extends AbstractElasticDistance {
  /**
   * Gap value.
   */
  protected final double g;

  /**
   * Constructor.
   *
   * @param bandSize Band size in [0, 1]
   * @param g Gap value
   */
  public ERPDistance(double bandSize, double g) {
    super(bandSize);
    if(Double.isNaN(g) || Double.isInfinite(g)) {
      throw new InvalidParameterException("ERP gap value must be finite, got " + g + ".");
    }
    this.g = g;
  }

  @Override
  protected ElasticCost costs(TimeSeries a, TimeSeries b) {
    return new ElasticCost() {
      @Override
      public double match(int i, int j) {
        return SeriesMath.distance(a, i, b, j);
      }

      @Override
      public double up(int i, int j) {
        return SeriesMath.distanceTo(a, i, g);
      }

      @Override
      public double left(int i, int j) {
        return SeriesMath.distanceTo(b, j, g);
      }
    };
  }

  @Override
  protected boolean isOpenBoundary() {
    return true;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(bandSize=" + bandSize + ", g=" + g + ")";
  }

  /**
   * Parameterization class.
   */
  public static class Par extends AbstractElasticDistance.Par {
    /**
     * Gap value.
     */
    public static final OptionID G_ID = OptionID.getOrCreateOptionID("erp.g", "The value unmatched observations are compared to.");

    /**
     * Gap value.
     */
    protected double g;

    @Override
    public void configure(Parameterization config) {
      super.configure(config);
      new DoubleParameter(G_ID, 0.) //
          .grab(config, x -> g = x);
    }

    @Override
    public ERPDistance make() {
      return new ERPDistance(bandSize, g);
    }
  }
}
