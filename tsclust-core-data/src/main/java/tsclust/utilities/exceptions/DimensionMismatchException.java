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
package tsclust.utilities.exceptions;

import elki.utilities.exceptions.AbortException;

/**
 * Thrown when series disagree in their channel count, or in their length where
 * a distance measure or averaging procedure requires equal lengths.
 *
 * @since 0.1.0
 */
public class DimensionMismatchException extends AbortException {
  /**
   * Serialization version.
   */
  private static final long serialVersionUID = 1L;

  /**
   * Constructor.
   *
   * @param message Error message
   */
  public DimensionMismatchException(String message) {
    super(message);
  }

  /**
   * Constructor.
   *
   * @param message Error message
   * @param cause Cause
   */
  public DimensionMismatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
