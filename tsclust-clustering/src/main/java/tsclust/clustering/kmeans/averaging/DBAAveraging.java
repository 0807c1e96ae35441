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
package tsclust.clustering.kmeans.averaging;

import java.util.List;
import java.util.stream.IntStream;

import tsclust.data.TimeSeries;
import tsclust.distance.Alignment;
import tsclust.distance.AlignmentDistance;
import tsclust.distance.TimeSeriesDistance;
import tsclust.distance.timeseries.DTWDistance;
import tsclust.utilities.exceptions.InsufficientDataException;
import tsclust.utilities.exceptions.InvalidParameterException;

import elki.logging.Logging;
import elki.utilities.documentation.Reference;
import elki.utilities.optionhandling.OptionID;
import elki.utilities.optionhandling.Parameterizer;
import elki.utilities.optionhandling.constraints.CommonConstraints;
import elki.utilities.optionhandling.parameterization.Parameterization;
import elki.utilities.optionhandling.parameters.Flag;
import elki.utilities.optionhandling.parameters.IntParameter;

/**
 * DTW barycenter averaging.
 * <p>
 * Starting from the current center (or the first member, if there is none),
 * each round aligns every member to the reference and replaces each reference
 * observation by the mean of all member observations aligned to it. The
 * alignments must be recomputed every round, as the reference changes.
 * <p>
 * Alignments come from the clustering distance if it is an
 * {@link AlignmentDistance}, and from unconstrained {@link DTWDistance}
 * otherwise. With DTW, no round increases the summed distance of the members
 * to the reference.
 * <p>
 * Member alignments are independent and may be computed in parallel; the
 * per-member sums are merged in member order, so the result does not depend
 * on the parallelism.
 *
 * @since 0.1.0
 */
@Reference(authors = "F. Petitjean, A. Ketterlin, P. Gançarski", //
    title = "A global averaging method for dynamic time warping, with applications to clustering", //
    booktitle = "Pattern Recognition 44(3)", //
    url = "https://doi.org/10.1016/j.patcog.2010.09.013", //
    bibkey = "DBLP:journals/pr/PetitjeanKG11")
public class DBAAveraging implements TimeSeriesAveraging {
  /**
   * The logger for this class.
   */
  private static final Logging LOG = Logging.getLogger(DBAAveraging.class);

  /**
   * Alignment used when the clustering distance cannot align.
   */
  private static final AlignmentDistance DEFAULT_ALIGNMENT = new DTWDistance();

  /**
   * Number of refinement rounds.
   */
  protected final int iterations;

  /**
   * Align members in parallel.
   */
  protected final boolean parallel;

  /**
   * Constructor.
   *
   * @param iterations Number of refinement rounds
   * @param parallel Align members in parallel
   */
  public DBAAveraging(int iterations, boolean parallel) {
    if(iterations < 1) {
      throw new InvalidParameterException("DBA needs at least one refinement round, got " + iterations + ".");
    }
    this.iterations = iterations;
    this.parallel = parallel;
  }

  /**
   * Constructor, sequential.
   *
   * @param iterations Number of refinement rounds
   */
  public DBAAveraging(int iterations) {
    this(iterations, false);
  }

  @Override
  public TimeSeries average(List<TimeSeries> members, TimeSeries current, TimeSeriesDistance distance) {
    if(members.isEmpty()) {
      throw new InsufficientDataException("Cannot average an empty cluster.");
    }
    if(members.size() == 1) {
      return members.get(0);
    }
    final AlignmentDistance aligner = distance instanceof AlignmentDistance ? (AlignmentDistance) distance : DEFAULT_ALIGNMENT;
    TimeSeries ref = current != null ? current : members.get(0);
    for(int round = 1; round <= iterations; round++) {
      ref = refine(ref, members, aligner, round);
    }
    return ref;
  }

  /**
   * One round of barycenter refinement.
   *
   * @param ref Current reference
   * @param members Members
   * @param aligner Alignment function
   * @param round Round number, for logging
   * @return Refined reference
   */
  protected TimeSeries refine(TimeSeries ref, List<TimeSeries> members, AlignmentDistance aligner, int round) {
    final int size = members.size();
    Partial[] partials = new Partial[size];
    IntStream ids = IntStream.range(0, size);
    (parallel ? ids.parallel() : ids).forEach(i -> partials[i] = new Partial(ref, members.get(i), aligner));
    // Merge in member order.
    final int len = ref.length(), dim = ref.getDimensionality();
    double[][] sums = new double[len][dim];
    int[] counts = new int[len];
    double cost = 0.;
    for(Partial p : partials) {
      cost += p.cost;
      for(int t = 0; t < len; t++) {
        counts[t] += p.counts[t];
        final double[] row = sums[t], prow = p.sums[t];
        for(int d = 0; d < dim; d++) {
          row[d] += prow[d];
        }
      }
    }
    if(LOG.isDebugging()) {
      LOG.debug("DBA round " + round + ": summed distance to reference " + cost);
    }
    for(int t = 0; t < len; t++) {
      if(counts[t] == 0) {
        // Not covered by any path, keep the old value.
        for(int d = 0; d < dim; d++) {
          sums[t][d] = ref.value(t, d);
        }
        continue;
      }
      final double f = 1. / counts[t];
      for(int d = 0; d < dim; d++) {
        sums[t][d] *= f;
      }
    }
    return TimeSeries.wrap(sums);
  }

  /**
   * @return the number of refinement rounds
   */
  public int getIterations() {
    return iterations;
  }

  @Override
  public String toString() {
    return "DBAAveraging(iterations=" + iterations + ")";
  }

  /**
   * Contribution of a single member: the sums and counts of its observations
   * aligned to each reference position.
   */
  private static class Partial {
    /**
     * Sums by reference position.
     */
    final double[][] sums;

    /**
     * Counts by reference position.
     */
    final int[] counts;

    /**
     * Distance of the member to the reference.
     */
    final double cost;

    /**
     * Align a member and collect its contribution.
     *
     * @param ref Reference
     * @param member Member
     * @param aligner Alignment function
     */
    Partial(TimeSeries ref, TimeSeries member, AlignmentDistance aligner) {
      final int dim = ref.getDimensionality();
      sums = new double[ref.length()][dim];
      counts = new int[ref.length()];
      Alignment alignment = aligner.align(ref, member);
      cost = alignment.getDistance();
      for(int k = 0, size = alignment.size(); k < size; k++) {
        final int r = alignment.getFirst(k), s = alignment.getSecond(k);
        final double[] row = sums[r];
        for(int d = 0; d < dim; d++) {
          row[d] += member.value(s, d);
        }
        counts[r]++;
      }
    }
  }

  /**
   * Parameterization class.
   */
  public static class Par implements Parameterizer {
    /**
     * Number of refinement rounds.
     */
    public static final OptionID ITERATIONS_ID = OptionID.getOrCreateOptionID("dba.iterations", "Number of barycenter refinement rounds per update.");

    /**
     * Parallel alignment flag.
     */
    public static final OptionID PARALLEL_ID = OptionID.getOrCreateOptionID("dba.parallel", "Align cluster members in parallel.");

    /**
     * Number of refinement rounds.
     */
    protected int iterations;

    /**
     * Parallel alignment.
     */
    protected boolean parallel;

    @Override
    public void configure(Parameterization config) {
      new IntParameter(ITERATIONS_ID, 10) //
          .addConstraint(CommonConstraints.GREATER_EQUAL_ONE_INT) //
          .grab(config, x -> iterations = x);
      new Flag(PARALLEL_ID).grab(config, x -> parallel = x);
    }

    @Override
    public DBAAveraging make() {
      return new DBAAveraging(iterations, parallel);
    }
  }
}
