/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.intalgebra.commons.math;

/**
 * Standard matrix interface for exact long elements. Unlike the floating point
 * matrices, every implementation mutates itself in place and returns itself,
 * so operations can be chained:
 * 
 * <pre>
 * m.add(other).multiply(3).transpose();
 * </pre>
 * 
 * Rows handed out by a matrix are always copies. Implementations are not
 * thread-safe.
 */
public interface IntMatrix extends Iterable<long[]> {

  /**
   * Get a specific value of the matrix.
   */
  long get(int row, int col);

  /**
   * Get a copy of a single row of the matrix.
   */
  long[] getRow(int row);

  /**
   * Get a copy of a single column of the matrix.
   */
  long[] getColumn(int col);

  /**
   * Returns the number of rows in this matrix. Always a constant time
   * operation.
   */
  int getRowCount();

  /**
   * Returns the number of columns in the matrix, 0 for a matrix without rows.
   * Always a constant time operation.
   */
  int getColumnCount();

  /**
   * Returns the shape as a pair {rows, columns}.
   */
  int[] shape();

  /**
   * @return true if the matrix has as many rows as columns.
   */
  boolean isSquare();

  /**
   * Sets the value at the given row and column index.
   */
  IntMatrix set(int row, int col, long value);

  /**
   * Appends a copy of the given row.
   * 
   * @throws ShapeMismatchException if the row length differs from the number
   *           of columns of a non-empty matrix.
   */
  IntMatrix insertRow(long[] row);

  /**
   * Inserts a copy of the given row before the row at position. Position may
   * be the row count, which appends.
   * 
   * @throws ShapeMismatchException if the row length differs from the number
   *           of columns of a non-empty matrix.
   */
  IntMatrix insertRow(long[] row, int position);

  /**
   * Removes the row at the given index, later rows move up.
   */
  IntMatrix deleteRow(int row);

  /**
   * Removes the column at the given index, later columns move left.
   */
  IntMatrix deleteColumn(int col);

  /**
   * Replaces every cell by the result of the function, visiting cells in row
   * major order.
   */
  IntMatrix transform(CellFunction fun);

  /**
   * Adds the other matrix cell by cell.
   * 
   * @throws ShapeMismatchException if the shapes differ.
   */
  IntMatrix add(IntMatrix other);

  /**
   * Multiplies every cell with the given scalar.
   */
  IntMatrix multiply(long scalar);

  /**
   * Replaces this matrix by the matrix product this * other.
   * 
   * @throws DimensionMismatchException if the column count of this matrix
   *           differs from the row count of the other.
   */
  IntMatrix multiply(IntMatrix other);

  /**
   * Replaces this matrix by its transpose.
   */
  IntMatrix transpose();

  /**
   * Computes the determinant by cofactor expansion along the first row. The
   * running time grows with the factorial of the dimension.
   * 
   * @throws NotSquareException if the matrix is not square.
   */
  long determinant();

  /**
   * Returns a new matrix without the given row and column.
   */
  IntMatrix minor(int row, int col);

  /**
   * Returns the adjugate, the transposed matrix of cofactors, as a new matrix.
   * 
   * @throws NotSquareException if the matrix is not square.
   */
  IntMatrix adjugate();

  /**
   * Replaces this matrix by its inverse.
   * 
   * @throws NotSquareException if the matrix is not square.
   * @throws NotInvertibleException if the matrix has no inverse.
   */
  IntMatrix inverse();

  /**
   * Deep copies this matrix. Changes to the copy never show in this matrix.
   */
  IntMatrix copy();

  /**
   * Get the matrix as a freshly allocated 2-dimensional array (first dimension
   * is the row, second the column).
   */
  long[][] toArray();

}
