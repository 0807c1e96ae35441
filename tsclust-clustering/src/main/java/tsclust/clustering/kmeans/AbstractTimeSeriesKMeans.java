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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

import tsclust.clustering.kmeans.averaging.TimeSeriesAveraging;
import tsclust.clustering.kmeans.initialization.KMeansPlusPlus;
import tsclust.clustering.kmeans.initialization.TimeSeriesInitialization;
import tsclust.data.Dataset;
import tsclust.data.TimeSeries;
import tsclust.distance.TimeSeriesDistance;
import tsclust.distance.timeseries.DTWDistance;
import tsclust.utilities.exceptions.DimensionMismatchException;
import tsclust.utilities.exceptions.InsufficientDataException;
import tsclust.utilities.exceptions.InvalidParameterException;

import elki.logging.Logging;
import elki.logging.statistics.DoubleStatistic;
import elki.logging.statistics.Duration;
import elki.logging.statistics.LongStatistic;
import elki.logging.statistics.StringStatistic;
import elki.utilities.optionhandling.OptionID;
import elki.utilities.optionhandling.Parameterizer;
import elki.utilities.optionhandling.constraints.CommonConstraints;
import elki.utilities.optionhandling.parameterization.Parameterization;
import elki.utilities.optionhandling.parameters.DoubleParameter;
import elki.utilities.optionhandling.parameters.Flag;
import elki.utilities.optionhandling.parameters.IntParameter;
import elki.utilities.optionhandling.parameters.ObjectParameter;

/**
 * Abstract base class for Lloyd-style partitioning of time series: initialize,
 * then alternate assignment to the nearest center and recomputation of the
 * centers until the labels or centers stabilize, or the iteration limit is
 * reached.
 * <p>
 * The phases run strictly in sequence. Within a phase, series (assignment) and
 * clusters (update) can be processed in parallel; results go to disjoint slots
 * and are reduced in a fixed order, so parallel runs reproduce sequential ones.
 *
 * @since 0.1.0
 */
public abstract class AbstractTimeSeriesKMeans {
  /**
   * Distance function.
   */
  protected final TimeSeriesDistance distance;

  /**
   * Number of clusters.
   */
  protected final int k;

  /**
   * Maximum number of iterations.
   */
  protected final int maxiter;

  /**
   * Convergence threshold on the largest center movement.
   */
  protected final double tol;

  /**
   * Number of restarts.
   */
  protected final int ninit;

  /**
   * Initialization method.
   */
  protected final TimeSeriesInitialization initializer;

  /**
   * Process series and clusters in parallel.
   */
  protected boolean parallel = false;

  /**
   * Report progress at info level.
   */
  protected boolean verbose = false;

  /**
   * Constructor.
   *
   * @param distance Distance function
   * @param k Number of clusters
   * @param maxiter Maximum number of iterations
   * @param tol Convergence threshold
   * @param ninit Number of restarts
   * @param initializer Initialization method
   */
  public AbstractTimeSeriesKMeans(TimeSeriesDistance distance, int k, int maxiter, double tol, int ninit, TimeSeriesInitialization initializer) {
    if(distance == null || initializer == null) {
      throw new InvalidParameterException("Distance function and initialization must be given.");
    }
    if(k <= 0) {
      throw new InvalidParameterException("Number of clusters must be positive, got " + k + ".");
    }
    if(maxiter <= 0) {
      throw new InvalidParameterException("Iteration limit must be positive, got " + maxiter + ".");
    }
    if(!(tol >= 0.)) {
      throw new InvalidParameterException("Tolerance must be non-negative, got " + tol + ".");
    }
    if(ninit <= 0) {
      throw new InvalidParameterException("Number of restarts must be positive, got " + ninit + ".");
    }
    this.distance = distance;
    this.k = k;
    this.maxiter = maxiter;
    this.tol = tol;
    this.ninit = ninit;
    this.initializer = initializer;
  }

  /**
   * Enable or disable parallel processing within each phase.
   *
   * @param parallel Parallel flag
   * @return this
   */
  public AbstractTimeSeriesKMeans setParallel(boolean parallel) {
    this.parallel = parallel;
    return this;
  }

  /**
   * Enable or disable progress output at info level.
   *
   * @param verbose Verbose flag
   * @return this
   */
  public AbstractTimeSeriesKMeans setVerbose(boolean verbose) {
    this.verbose = verbose;
    return this;
  }

  /**
   * Averaging procedure used to update the centers.
   *
   * @return Averaging
   */
  public abstract TimeSeriesAveraging getAveraging();

  /**
   * Cluster a data set.
   *
   * @param data Data set
   * @return Fitted model
   */
  public TimeSeriesKMeansModel fit(Dataset data) {
    final TimeSeriesAveraging averaging = getAveraging();
    validate(data, averaging);
    TimeSeriesKMeansModel best = null;
    for(int run = 0; run < ninit; run++) {
      Instance instance = new Instance(data, distance, averaging, initialCenters(data, averaging), parallel, verbose, getLogger(), getClass().getName());
      instance.run(maxiter, tol);
      TimeSeriesKMeansModel model = instance.buildResult();
      if(ninit > 1 && getLogger().isVerbose()) {
        getLogger().verbose("Run " + (run + 1) + " of " + ninit + ": inertia " + model.getInertia());
      }
      if(best == null || model.getInertia() < best.getInertia()) {
        best = model;
      }
    }
    return best;
  }

  /**
   * Cluster a data set and return the labels.
   *
   * @param data Data set
   * @return Cluster label of each series
   */
  public int[] fitPredict(Dataset data) {
    return fit(data).getLabels();
  }

  /**
   * Validate the input before the first iteration.
   *
   * @param data Data set
   * @param averaging Averaging procedure
   */
  protected void validate(Dataset data, TimeSeriesAveraging averaging) {
    if(data.size() < k) {
      throw new InsufficientDataException("Cannot form " + k + " clusters from " + data.size() + " series.");
    }
    if((distance.requiresEqualLength() || averaging.requiresEqualLength()) && !data.hasEqualLengths()) {
      throw new DimensionMismatchException("The configured distance or averaging requires series of equal length.");
    }
  }

  /**
   * Choose the initial centers.
   *
   * @param data Data set
   * @param averaging Averaging procedure
   * @return Initial centers
   */
  protected TimeSeries[] initialCenters(Dataset data, TimeSeriesAveraging averaging) {
    final Logging log = getLogger();
    Duration inittime = log.newDuration(getClass().getName() + ".initialization-time").begin();
    TimeSeries[] centers = initializer.chooseInitialCenters(data, k, distance, averaging);
    log.statistics(inittime.end());
    if(centers.length != k) {
      throw new InvalidParameterException("Initialization returned " + centers.length + " centers, expected " + k + ".");
    }
    for(TimeSeries c : centers) {
      if(c.getDimensionality() != data.getDimensionality()) {
        throw new DimensionMismatchException("Initial center has " + c.getDimensionality() + " channels, data has " + data.getDimensionality() + ".");
      }
      if(distance.requiresEqualLength() && c.length() != data.get(0).length()) {
        throw new DimensionMismatchException("Initial center has length " + c.length() + ", data has length " + data.get(0).length() + ".");
      }
    }
    return centers;
  }

  /**
   * @return the distance function
   */
  public TimeSeriesDistance getDistance() {
    return distance;
  }

  /**
   * @return the number of clusters
   */
  public int getK() {
    return k;
  }

  /**
   * Get the (STATIC) logger for this class.
   *
   * @return the static logger
   */
  protected abstract Logging getLogger();

  /**
   * Phases of a single run.
   */
  public enum Phase {
    UNINITIALIZED, INITIALIZED, ASSIGNING, UPDATING, CONVERGED, ITERATION_LIMIT_REACHED
  }

  /**
   * Inner instance, storing state for a single run on a data set.
   */
  protected static class Instance {
    /**
     * Data set.
     */
    protected final Dataset data;

    /**
     * Distance function.
     */
    protected final TimeSeriesDistance distance;

    /**
     * Averaging procedure.
     */
    protected final TimeSeriesAveraging averaging;

    /**
     * Parallel processing within phases.
     */
    protected final boolean parallel;

    /**
     * Report progress at info level.
     */
    protected final boolean verbose;

    /**
     * Logger of the algorithm.
     */
    protected final Logging log;

    /**
     * Statistics key.
     */
    protected final String key;

    /**
     * Number of clusters.
     */
    protected final int k;

    /**
     * Current centers.
     */
    protected TimeSeries[] centers;

    /**
     * Cluster assignment, -1 before the first assignment.
     */
    protected final int[] assignment;

    /**
     * Distance of each series to its assigned center.
     */
    protected final double[] nearest;

    /**
     * Inertia after each assignment.
     */
    protected double[] inertia;

    /**
     * Number of completed iterations.
     */
    protected int iterations = 0;

    /**
     * Current phase.
     */
    protected Phase phase = Phase.UNINITIALIZED;

    /**
     * Number of distance computations.
     */
    protected long diststat = 0;

    /**
     * Number of clusters reseeded in the last update.
     */
    protected int reseeded = 0;

    /**
     * Constructor.
     *
     * @param data Data set
     * @param distance Distance function
     * @param averaging Averaging procedure
     * @param centers Initial centers
     * @param parallel Parallel processing
     * @param verbose Verbose progress
     * @param log Logger
     * @param key Statistics key
     */
    public Instance(Dataset data, TimeSeriesDistance distance, TimeSeriesAveraging averaging, TimeSeries[] centers, boolean parallel, boolean verbose, Logging log, String key) {
      this.data = data;
      this.distance = distance;
      this.averaging = averaging;
      this.centers = centers.clone();
      this.parallel = parallel;
      this.verbose = verbose;
      this.log = log;
      this.key = key;
      this.k = centers.length;
      this.assignment = new int[data.size()];
      Arrays.fill(assignment, -1);
      this.nearest = new double[data.size()];
      this.inertia = new double[0];
      this.phase = Phase.INITIALIZED;
    }

    /**
     * Run the clustering.
     *
     * @param maxiter Maximum number of iterations
     * @param tol Convergence threshold on the center movement
     */
    public void run(int maxiter, double tol) {
      assert phase == Phase.INITIALIZED;
      inertia = new double[maxiter];
      for(int iteration = 1; iteration <= maxiter; iteration++) {
        phase = Phase.ASSIGNING;
        final int changed = assignToNearestCluster();
        inertia[iteration - 1] = computeInertia();
        phase = Phase.UPDATING;
        final TimeSeries[] previous = centers;
        centers = updateCenters();
        iterations = iteration;
        final double shift = maxShift(previous, centers);
        if(log.isStatistics()) {
          log.statistics(new LongStatistic(key + ".iteration-" + iteration + ".reassigned", changed));
          log.statistics(new DoubleStatistic(key + ".iteration-" + iteration + ".inertia", inertia[iteration - 1]));
        }
        progress("Iteration " + iteration + ": " + changed + " reassigned, inertia " + inertia[iteration - 1] + ", center shift " + shift);
        if(changed == 0 || shift < tol) {
          phase = Phase.CONVERGED;
          break;
        }
      }
      if(phase != Phase.CONVERGED) {
        phase = Phase.ITERATION_LIMIT_REACHED;
        log.warning("Did not converge within " + maxiter + " iterations.");
      }
      inertia = Arrays.copyOf(inertia, iterations);
      if(log.isStatistics()) {
        log.statistics(new LongStatistic(key + ".iterations", iterations));
        log.statistics(new LongStatistic(key + ".distance-computations", diststat));
        log.statistics(new StringStatistic(key + ".converged", Boolean.toString(phase == Phase.CONVERGED)));
      }
    }

    /**
     * Assign each series to the nearest center, lowest index on ties.
     *
     * @return Number of series whose label changed
     */
    protected int assignToNearestCluster() {
      final int n = data.size();
      final TimeSeries[] cs = centers;
      final int[] labels = new int[n];
      final double[] dists = new double[n];
      IntStream ids = IntStream.range(0, n);
      (parallel ? ids.parallel() : ids).forEach(i -> {
        final TimeSeries s = data.get(i);
        double min = distance.distance(s, cs[0]);
        int minIndex = 0;
        for(int c = 1; c < k; c++) {
          final double d = distance.distance(s, cs[c]);
          if(d < min) {
            min = d;
            minIndex = c;
          }
        }
        labels[i] = minIndex;
        dists[i] = min;
      });
      diststat += (long) n * k;
      int changed = 0;
      for(int i = 0; i < n; i++) {
        if(assignment[i] != labels[i]) {
          assignment[i] = labels[i];
          ++changed;
        }
        nearest[i] = dists[i];
      }
      return changed;
    }

    /**
     * Inertia of the current assignment: the sum of squared-scale distances
     * of each series to its center.
     *
     * @return Inertia
     */
    protected double computeInertia() {
      final boolean squared = distance.isSquared();
      double sum = 0.;
      for(double d : nearest) {
        sum += squared ? d : d * d;
      }
      return sum;
    }

    /**
     * Recompute all centers from the current assignment. Empty clusters are
     * reseeded with the series farthest from its own center.
     *
     * @return New centers
     */
    protected TimeSeries[] updateCenters() {
      List<List<TimeSeries>> members = new ArrayList<>(k);
      for(int c = 0; c < k; c++) {
        members.add(new ArrayList<>());
      }
      for(int i = 0; i < assignment.length; i++) {
        members.get(assignment[i]).add(data.get(i));
      }
      final TimeSeries[] cs = centers;
      final TimeSeries[] next = new TimeSeries[k];
      IntStream ids = IntStream.range(0, k);
      (parallel ? ids.parallel() : ids).forEach(c -> {
        if(!members.get(c).isEmpty()) {
          next[c] = averaging.average(members.get(c), cs[c], distance);
        }
      });
      boolean[] taken = null;
      reseeded = 0;
      for(int c = 0; c < k; c++) {
        if(next[c] != null) {
          continue;
        }
        taken = taken != null ? taken : new boolean[assignment.length];
        final int i = EmptyClusters.farthest(nearest, taken);
        next[c] = data.get(i);
        ++reseeded;
        progress("Cluster " + c + " is empty, reseeding with series " + i + " at distance " + nearest[i]);
      }
      return next;
    }

    /**
     * Largest distance between a center and its previous version.
     *
     * @param previous Previous centers
     * @param current Current centers
     * @return Maximum shift
     */
    protected double maxShift(TimeSeries[] previous, TimeSeries[] current) {
      double max = 0.;
      for(int c = 0; c < k; c++) {
        if(previous[c] == current[c]) {
          continue;
        }
        if(distance.requiresEqualLength() && previous[c].length() != current[c].length()) {
          return Double.POSITIVE_INFINITY;
        }
        final double d = distance.distance(previous[c], current[c]);
        ++diststat;
        max = d > max ? d : max;
      }
      return max;
    }

    /**
     * Report progress.
     *
     * @param message Message
     */
    protected void progress(String message) {
      if(verbose) {
        log.info(message);
      }
      else if(log.isVerbose()) {
        log.verbose(message);
      }
    }

    /**
     * Build the model of a completed run.
     *
     * @return Model
     */
    public TimeSeriesKMeansModel buildResult() {
      if(phase != Phase.CONVERGED && phase != Phase.ITERATION_LIMIT_REACHED) {
        throw new IllegalStateException("Run has not completed, phase " + phase);
      }
      return new TimeSeriesKMeansModel(centers, assignment.clone(), inertia[iterations - 1], iterations, phase == Phase.CONVERGED, inertia.clone(), distance);
    }

    /**
     * @return the current phase
     */
    public Phase getPhase() {
      return phase;
    }
  }

  /**
   * Parameterization class.
   */
  public abstract static class Par implements Parameterizer {
    /**
     * Number of clusters.
     */
    public static final OptionID K_ID = OptionID.getOrCreateOptionID("kmeans.k", "The number of clusters to find.");

    /**
     * Maximum number of iterations.
     */
    public static final OptionID MAXITER_ID = OptionID.getOrCreateOptionID("kmeans.maxiter", "The maximum number of iterations to do.");

    /**
     * Convergence threshold.
     */
    public static final OptionID TOL_ID = OptionID.getOrCreateOptionID("kmeans.tol", "Stop when no center moves farther than this.");

    /**
     * Number of restarts.
     */
    public static final OptionID NINIT_ID = OptionID.getOrCreateOptionID("kmeans.ninit", "Number of runs with different initial centers; the run with the lowest inertia is kept.");

    /**
     * Initialization method.
     */
    public static final OptionID INIT_ID = OptionID.getOrCreateOptionID("kmeans.initialization", "Method to choose the initial cluster centers.");

    /**
     * Distance function.
     */
    public static final OptionID DISTANCE_ID = OptionID.getOrCreateOptionID("algorithm.distancefunction", "Distance function to determine the distance between time series.");

    /**
     * Parallel processing.
     */
    public static final OptionID PARALLEL_ID = OptionID.getOrCreateOptionID("kmeans.parallel", "Process series and clusters in parallel within each phase.");

    /**
     * Verbose progress.
     */
    public static final OptionID VERBOSE_ID = OptionID.getOrCreateOptionID("kmeans.verbose", "Report the progress of each iteration.");

    /**
     * Distance function.
     */
    protected TimeSeriesDistance distance;

    /**
     * Number of clusters.
     */
    protected int k;

    /**
     * Maximum number of iterations.
     */
    protected int maxiter;

    /**
     * Convergence threshold.
     */
    protected double tol;

    /**
     * Number of restarts.
     */
    protected int ninit;

    /**
     * Initialization method.
     */
    protected TimeSeriesInitialization initializer;

    /**
     * Parallel processing.
     */
    protected boolean parallel;

    /**
     * Verbose progress.
     */
    protected boolean verbose;

    @Override
    public void configure(Parameterization config) {
      getParameterDistance(config);
      new IntParameter(K_ID) //
          .addConstraint(CommonConstraints.GREATER_EQUAL_ONE_INT) //
          .grab(config, x -> k = x);
      new ObjectParameter<TimeSeriesInitialization>(INIT_ID, TimeSeriesInitialization.class, KMeansPlusPlus.class) //
          .grab(config, x -> initializer = x);
      new IntParameter(MAXITER_ID, 300) //
          .addConstraint(CommonConstraints.GREATER_EQUAL_ONE_INT) //
          .grab(config, x -> maxiter = x);
      new DoubleParameter(TOL_ID, 1e-6) //
          .addConstraint(CommonConstraints.GREATER_EQUAL_ZERO_DOUBLE) //
          .grab(config, x -> tol = x);
      new IntParameter(NINIT_ID, 1) //
          .addConstraint(CommonConstraints.GREATER_EQUAL_ONE_INT) //
          .grab(config, x -> ninit = x);
      new Flag(PARALLEL_ID).grab(config, x -> parallel = x);
      new Flag(VERBOSE_ID).grab(config, x -> verbose = x);
    }

    /**
     * Get the distance function parameter.
     *
     * @param config Parameterization
     */
    protected void getParameterDistance(Parameterization config) {
      new ObjectParameter<TimeSeriesDistance>(DISTANCE_ID, TimeSeriesDistance.class, DTWDistance.class) //
          .grab(config, x -> distance = x);
    }

    @Override
    public abstract AbstractTimeSeriesKMeans make();
  }
}
