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
package tsclust.clustering.kmeans.initialization;

import tsclust.data.Dataset;
import tsclust.utilities.exceptions.InsufficientDataException;

import elki.utilities.optionhandling.OptionID;
import elki.utilities.optionhandling.Parameterizer;
import elki.utilities.optionhandling.parameterization.Parameterization;
import elki.utilities.optionhandling.parameters.RandomParameter;
import elki.utilities.random.RandomFactory;

/**
 * Abstract base class for randomized initializations.
 *
 * @since 0.1.0
 */
public abstract class AbstractTimeSeriesInitialization implements TimeSeriesInitialization {
  /**
   * Random number generator.
   */
  protected final RandomFactory rnd;

  /**
   * Constructor.
   *
   * @param rnd Random number generator.
   */
  public AbstractTimeSeriesInitialization(RandomFactory rnd) {
    this.rnd = rnd;
  }

  /**
   * Fail if the data set has fewer than k series.
   *
   * @param data Data set
   * @param k Number of centers
   */
  protected static void checkSize(Dataset data, int k) {
    if(data.size() < k) {
      throw new InsufficientDataException("Cannot choose " + k + " initial centers from " + data.size() + " series.");
    }
  }

  /**
   * Parameterization class.
   */
  public abstract static class Par implements Parameterizer {
    /**
     * Parameter to specify the random generator seed.
     */
    public static final OptionID SEED_ID = OptionID.getOrCreateOptionID("kmeans.seed", "The random number generator seed.");

    /**
     * Random generator
     */
    protected RandomFactory rnd;

    @Override
    public void configure(Parameterization config) {
      new RandomParameter(SEED_ID).grab(config, x -> rnd = x);
    }
  }
}
