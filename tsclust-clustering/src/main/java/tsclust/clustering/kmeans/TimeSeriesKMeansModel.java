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

import tsclust.data.Dataset;
import tsclust.data.TimeSeries;
import tsclust.distance.TimeSeriesDistance;
import tsclust.utilities.exceptions.DimensionMismatchException;

/**
 * Result of a completed clustering run: centers, labels, inertia and the
 * number of iterations. Immutable; the accessors return copies.
 * <p>
 * New series are labeled by a single assignment pass against the fitted
 * centers, with the same distance and tie-breaking as the fit.
 *
 * @since 0.1.0
 */
public class TimeSeriesKMeansModel {
  /**
   * Cluster centers.
   */
  private final TimeSeries[] centers;

  /**
   * Label of each training series.
   */
  private final int[] labels;

  /**
   * Sum of squared-scale distances to the assigned centers.
   */
  private final double inertia;

  /**
   * Number of completed iterations.
   */
  private final int iterations;

  /**
   * Convergence flag.
   */
  private final boolean converged;

  /**
   * Inertia after each assignment.
   */
  private final double[] inertiaHistory;

  /**
   * Distance used for fitting.
   */
  private final TimeSeriesDistance distance;

  /**
   * Constructor.
   *
   * @param centers Cluster centers
   * @param labels Labels
   * @param inertia Inertia
   * @param iterations Number of iterations
   * @param converged Whether the run converged
   * @param inertiaHistory Inertia per iteration
   * @param distance Distance function
   */
  public TimeSeriesKMeansModel(TimeSeries[] centers, int[] labels, double inertia, int iterations, boolean converged, double[] inertiaHistory, TimeSeriesDistance distance) {
    this.centers = centers.clone();
    this.labels = labels;
    this.inertia = inertia;
    this.iterations = iterations;
    this.converged = converged;
    this.inertiaHistory = inertiaHistory;
    this.distance = distance;
  }

  /**
   * @return a copy of the cluster centers
   */
  public TimeSeries[] getCenters() {
    return centers.clone();
  }

  /**
   * @param c Cluster index
   * @return the center of cluster c
   */
  public TimeSeries getCenter(int c) {
    return centers[c];
  }

  /**
   * @return the number of clusters
   */
  public int getK() {
    return centers.length;
  }

  /**
   * @return a copy of the training labels
   */
  public int[] getLabels() {
    return labels.clone();
  }

  /**
   * @return the inertia of the final assignment
   */
  public double getInertia() {
    return inertia;
  }

  /**
   * @return the number of iterations run
   */
  public int getIterations() {
    return iterations;
  }

  /**
   * @return {@code false} if the iteration limit was reached first
   */
  public boolean isConverged() {
    return converged;
  }

  /**
   * @return the inertia after each assignment, in order
   */
  public double[] getInertiaHistory() {
    return inertiaHistory.clone();
  }

  /**
   * @return the distance function
   */
  public TimeSeriesDistance getDistance() {
    return distance;
  }

  /**
   * Number of training series per cluster.
   *
   * @return Cluster sizes
   */
  public int[] getClusterSizes() {
    int[] sizes = new int[centers.length];
    for(int l : labels) {
      sizes[l]++;
    }
    return sizes;
  }

  /**
   * Label a single series.
   *
   * @param series Series
   * @return Index of the nearest center, lowest index on ties
   */
  public int predict(TimeSeries series) {
    checkDimensionality(series);
    double min = distance.distance(series, centers[0]);
    int minIndex = 0;
    for(int c = 1; c < centers.length; c++) {
      final double d = distance.distance(series, centers[c]);
      if(d < min) {
        min = d;
        minIndex = c;
      }
    }
    return minIndex;
  }

  /**
   * Label every series of a data set.
   *
   * @param data Data set
   * @return Labels
   */
  public int[] predict(Dataset data) {
    int[] result = new int[data.size()];
    for(int i = 0; i < result.length; i++) {
      result[i] = predict(data.get(i));
    }
    return result;
  }

  /**
   * Distances of every series to every center.
   *
   * @param data Data set
   * @return {@code size x k} distance matrix
   */
  public double[][] transform(Dataset data) {
    double[][] result = new double[data.size()][centers.length];
    for(int i = 0; i < result.length; i++) {
      final TimeSeries s = data.get(i);
      checkDimensionality(s);
      for(int c = 0; c < centers.length; c++) {
        result[i][c] = distance.distance(s, centers[c]);
      }
    }
    return result;
  }

  private void checkDimensionality(TimeSeries series) {
    if(series.getDimensionality() != centers[0].getDimensionality()) {
      throw new DimensionMismatchException("Series has " + series.getDimensionality() + " channels, model has " + centers[0].getDimensionality() + ".");
    }
  }
}
