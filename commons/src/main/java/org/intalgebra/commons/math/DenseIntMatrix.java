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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.primitives.Longs;

/**
 * Dense matrix of longs backed by a 2-dimensional array. Every operation that
 * produces values has a second form taking a modulus, which stores the
 * canonical representative (see {@link Modular#canonicalize(long, long)}) of
 * each resulting cell instead of the plain value.
 * <p>
 * The matrix owns its backing array. Grids passed in are copied and rows
 * handed out are copies.
 */
public class DenseIntMatrix implements IntMatrix {

  private static final Log LOG = LogFactory.getLog(DenseIntMatrix.class);

  /** Internal marker for operations running without a modulus. */
  private static final long NO_MODULUS = 0L;

  private long[][] matrix;
  private int numRows;
  private int numColumns;

  /**
   * Creates a new matrix of the given size filled with zeros.
   * 
   * @param rows the num of rows.
   * @param columns the num of columns.
   */
  public DenseIntMatrix(int rows, int columns) {
    this(rows, columns, 0L);
  }

  /**
   * Creates a new matrix of the given size filled with the given default
   * value.
   * 
   * @param rows the num of rows.
   * @param columns the num of columns.
   * @param defaultValue the default value.
   */
  public DenseIntMatrix(int rows, int columns, long defaultValue) {
    Preconditions.checkArgument(rows >= 0 && columns >= 0,
        "Matrix size must not be negative, but was %sx%s.", rows, columns);
    long[][] values = new long[rows][columns];
    for (int i = 0; i < rows; i++) {
      Arrays.fill(values[i], defaultValue);
    }
    replace(values, rows == 0 ? 0 : columns);
  }

  /**
   * Creates a matrix holding a copy of the given grid.
   * 
   * @param grid the rows of the matrix, all of the same length.
   * @throws ShapeMismatchException if the rows differ in length.
   */
  public DenseIntMatrix(long[][] grid) {
    checkRectangular(grid);
    long[][] values = deepCopy(grid);
    replace(values, values.length == 0 ? 0 : values[0].length);
  }

  /**
   * Creates a matrix holding the canonical representatives of the given grid
   * under the modulus.
   * 
   * @param grid the rows of the matrix, all of the same length.
   * @param modulus a positive modulus.
   * @throws InvalidModulusException if the modulus is not positive.
   * @throws ShapeMismatchException if the rows differ in length.
   */
  public DenseIntMatrix(long[][] grid, long modulus) {
    this(grid);
    Modular.checkModulus(modulus);
    reduceAll(modulus);
  }

  /**
   * Adopts the given array without copying it.
   */
  private DenseIntMatrix(int columns, long[][] values) {
    replace(values, columns);
  }

  /**
   * Gets the identity matrix (ones on the main diagonal) with a given
   * dimension.
   */
  public static DenseIntMatrix identity(int dimension) {
    DenseIntMatrix m = new DenseIntMatrix(dimension, dimension);
    for (int i = 0; i < dimension; i++) {
      m.matrix[i][i] = 1L;
    }
    return m;
  }

  /**
   * Gets a square matrix of ones.
   */
  public static DenseIntMatrix ones(int dimension) {
    return ones(dimension, dimension);
  }

  /**
   * Gets a matrix of ones with the given number of rows and columns.
   */
  public static DenseIntMatrix ones(int rows, int columns) {
    return new DenseIntMatrix(rows, columns, 1L);
  }

  /**
   * Checks whether all rows of the grid have the same length. An empty grid is
   * rectangular.
   */
  public static boolean isRectangular(long[][] grid) {
    Preconditions.checkNotNull(grid, "grid");
    if (grid.length == 0) {
      return true;
    }
    final int length = grid[0].length;
    for (long[] row : grid) {
      if (row.length != length) {
        return false;
      }
    }
    return true;
  }

  @Override
  public final long get(int row, int col) {
    return matrix[row][col];
  }

  @Override
  public final long[] getRow(int row) {
    return matrix[row].clone();
  }

  @Override
  public final long[] getColumn(int col) {
    Preconditions.checkElementIndex(col, numColumns, "column");
    final long[] column = new long[numRows];
    for (int r = 0; r < numRows; r++) {
      column[r] = matrix[r][col];
    }
    return column;
  }

  @Override
  public final int getRowCount() {
    return numRows;
  }

  @Override
  public final int getColumnCount() {
    return numColumns;
  }

  @Override
  public int[] shape() {
    return new int[] { numRows, numColumns };
  }

  @Override
  public boolean isSquare() {
    return numRows == numColumns;
  }

  /**
   * Returns the size of the matrix as string (ROWSxCOLUMNS).
   */
  public String sizeToString() {
    return numRows + "x" + numColumns;
  }

  @Override
  public DenseIntMatrix set(int row, int col, long value) {
    matrix[row][col] = value;
    return this;
  }

  /**
   * Sets the canonical representative of value under the modulus at the given
   * row and column index.
   */
  public DenseIntMatrix set(int row, int col, long value, long modulus) {
    long reduced = Modular.canonicalize(value, modulus);
    matrix[row][col] = reduced;
    return this;
  }

  @Override
  public DenseIntMatrix insertRow(long[] row) {
    return insertRow(row, numRows);
  }

  @Override
  public DenseIntMatrix insertRow(long[] row, int position) {
    return insert(row, position, NO_MODULUS);
  }

  /**
   * Inserts the canonical representatives of the given row under the modulus
   * before the row at position.
   * 
   * @throws InvalidModulusException if the modulus is not positive.
   * @throws ShapeMismatchException if the row length differs from the number
   *           of columns of a non-empty matrix.
   */
  public DenseIntMatrix insertRow(long[] row, int position, long modulus) {
    return insert(row, position, Modular.checkModulus(modulus));
  }

  private DenseIntMatrix insert(long[] row, int position, long modulus) {
    Preconditions.checkNotNull(row, "row");
    if (numRows > 0 && row.length != numColumns) {
      throw new ShapeMismatchException(String.format(
          "Row of length %d does not fit a %s matrix.", row.length,
          sizeToString()));
    }
    Preconditions.checkPositionIndex(position, numRows, "position");

    long[] copy = new long[row.length];
    for (int j = 0; j < row.length; j++) {
      copy[j] = reduce(row[j], modulus);
    }
    long[][] values = new long[numRows + 1][];
    System.arraycopy(matrix, 0, values, 0, position);
    values[position] = copy;
    System.arraycopy(matrix, position, values, position + 1, numRows
        - position);
    replace(values, copy.length);
    return this;
  }

  @Override
  public DenseIntMatrix deleteRow(int row) {
    Preconditions.checkElementIndex(row, numRows, "row");
    long[][] values = new long[numRows - 1][];
    System.arraycopy(matrix, 0, values, 0, row);
    System.arraycopy(matrix, row + 1, values, row, numRows - row - 1);
    replace(values, values.length == 0 ? 0 : numColumns);
    return this;
  }

  @Override
  public DenseIntMatrix deleteColumn(int col) {
    Preconditions.checkElementIndex(col, numColumns, "column");
    long[][] values = new long[numRows][numColumns - 1];
    for (int i = 0; i < numRows; i++) {
      System.arraycopy(matrix[i], 0, values[i], 0, col);
      System.arraycopy(matrix[i], col + 1, values[i], col, numColumns - col
          - 1);
    }
    replace(values, numColumns - 1);
    return this;
  }

  @Override
  public DenseIntMatrix transform(CellFunction fun) {
    Preconditions.checkNotNull(fun, "fun");
    for (int r = 0; r < numRows; r++) {
      for (int c = 0; c < numColumns; c++) {
        matrix[r][c] = fun.apply(matrix[r][c], r, c);
      }
    }
    return this;
  }

  @Override
  public DenseIntMatrix add(IntMatrix other) {
    return sum(other, NO_MODULUS);
  }

  /**
   * Adds the other matrix cell by cell, keeping the canonical representatives
   * of the sums under the modulus.
   * 
   * @throws InvalidModulusException if the modulus is not positive.
   * @throws ShapeMismatchException if the shapes differ.
   */
  public DenseIntMatrix add(IntMatrix other, long modulus) {
    return sum(other, Modular.checkModulus(modulus));
  }

  private DenseIntMatrix sum(final IntMatrix other, final long modulus) {
    if (numRows != other.getRowCount()
        || numColumns != other.getColumnCount()) {
      throw new ShapeMismatchException(String.format(
          "Cannot add a %dx%d matrix to a %s matrix.", other.getRowCount(),
          other.getColumnCount(), sizeToString()));
    }
    return transform(new CellFunction() {
      @Override
      public long apply(long value, int row, int col) {
        return reduce(value + other.get(row, col), modulus);
      }
    });
  }

  @Override
  public DenseIntMatrix multiply(long scalar) {
    return scale(scalar, NO_MODULUS);
  }

  /**
   * Multiplies every cell with the given scalar, keeping the canonical
   * representatives of the products under the modulus.
   * 
   * @throws InvalidModulusException if the modulus is not positive.
   */
  public DenseIntMatrix multiply(long scalar, long modulus) {
    return scale(scalar, Modular.checkModulus(modulus));
  }

  private DenseIntMatrix scale(final long scalar, final long modulus) {
    return transform(new CellFunction() {
      @Override
      public long apply(long value, int row, int col) {
        return reduce(value * scalar, modulus);
      }
    });
  }

  @Override
  public DenseIntMatrix multiply(IntMatrix other) {
    return product(other, NO_MODULUS);
  }

  /**
   * Replaces this matrix by the matrix product this * other. Each cell of the
   * product is reduced once, after its dot product is summed up.
   * 
   * @throws InvalidModulusException if the modulus is not positive.
   * @throws DimensionMismatchException if the column count of this matrix
   *           differs from the row count of the other.
   */
  public DenseIntMatrix multiply(IntMatrix other, long modulus) {
    return product(other, Modular.checkModulus(modulus));
  }

  private DenseIntMatrix product(IntMatrix other, long modulus) {
    if (numColumns != other.getRowCount()) {
      throw new DimensionMismatchException(numRows, numColumns,
          other.getRowCount(), other.getColumnCount());
    }

    final int m = numRows;
    final int n = numColumns;
    final int p = other.getColumnCount();
    long[][] result = new long[m][p];
    for (int i = 0; i < m; i++) {
      for (int j = 0; j < p; j++) {
        long s = 0;
        for (int k = 0; k < n; k++) {
          s += matrix[i][k] * other.get(k, j);
        }
        result[i][j] = reduce(s, modulus);
      }
    }
    replace(result, m == 0 ? 0 : p);
    return this;
  }

  @Override
  public DenseIntMatrix transpose() {
    long[][] transposed = new long[numColumns][numRows];
    for (int i = 0; i < numRows; i++) {
      for (int j = 0; j < numColumns; j++) {
        transposed[j][i] = matrix[i][j];
      }
    }
    replace(transposed, numColumns == 0 ? 0 : numRows);
    return this;
  }

  @Override
  public long determinant() {
    return expandDeterminant(NO_MODULUS);
  }

  /**
   * Computes the determinant and returns its canonical representative under
   * the modulus. Reduction happens once on the final sum, not per term.
   * 
   * @throws InvalidModulusException if the modulus is not positive.
   * @throws NotSquareException if the matrix is not square.
   */
  public long determinant(long modulus) {
    return expandDeterminant(Modular.checkModulus(modulus));
  }

  private long expandDeterminant(long modulus) {
    checkSquare("determinant");
    Preconditions.checkState(numRows > 0,
        "Cannot compute the determinant of an empty matrix.");
    if (LOG.isDebugEnabled()) {
      LOG.debug("Expanding determinant of " + sizeToString()
          + " matrix along the first row.");
    }
    long det = cofactorExpansion(0, new boolean[numColumns], numColumns);
    return reduce(det, modulus);
  }

  /**
   * Expands the determinant of the sub matrix made of the rows from the given
   * row on and the columns not flagged as removed.
   * 
   * @param row the first row of the sub matrix.
   * @param removed the columns that are not part of the sub matrix.
   * @param size the dimension of the sub matrix.
   */
  private long cofactorExpansion(int row, boolean[] removed, int size) {
    if (size == 1) {
      return matrix[row][nextColumn(removed, 0)];
    }
    if (size == 2) {
      int c0 = nextColumn(removed, 0);
      int c1 = nextColumn(removed, c0 + 1);
      return matrix[row][c0] * matrix[row + 1][c1] - matrix[row][c1]
          * matrix[row + 1][c0];
    }

    long det = 0;
    int position = 0;
    for (int col = 0; col < removed.length; col++) {
      if (removed[col]) {
        continue;
      }
      removed[col] = true;
      long minor = cofactorExpansion(row + 1, removed, size - 1);
      removed[col] = false;
      det += matrix[row][col] * minor * (position % 2 == 0 ? 1 : -1);
      position++;
    }
    return det;
  }

  private static int nextColumn(boolean[] removed, int from) {
    int col = from;
    while (removed[col]) {
      col++;
    }
    return col;
  }

  @Override
  public DenseIntMatrix minor(int row, int col) {
    Preconditions.checkElementIndex(row, numRows, "row");
    Preconditions.checkElementIndex(col, numColumns, "column");
    long[][] values = new long[numRows - 1][numColumns - 1];
    for (int i = 0, target = 0; i < numRows; i++) {
      if (i == row) {
        continue;
      }
      System.arraycopy(matrix[i], 0, values[target], 0, col);
      System.arraycopy(matrix[i], col + 1, values[target], col, numColumns
          - col - 1);
      target++;
    }
    return new DenseIntMatrix(values.length == 0 ? 0 : numColumns - 1, values);
  }

  @Override
  public DenseIntMatrix adjugate() {
    return cofactors(NO_MODULUS);
  }

  /**
   * Returns the adjugate with every cell reduced under the modulus.
   * 
   * @throws InvalidModulusException if the modulus is not positive.
   * @throws NotSquareException if the matrix is not square.
   */
  public DenseIntMatrix adjugate(long modulus) {
    return cofactors(Modular.checkModulus(modulus));
  }

  private DenseIntMatrix cofactors(long modulus) {
    checkSquare("adjugate");
    Preconditions.checkState(numRows > 0,
        "Cannot compute the adjugate of an empty matrix.");

    final int n = numRows;
    long[][] adj = new long[n][n];
    if (n == 1) {
      adj[0][0] = reduce(1L, modulus);
      return new DenseIntMatrix(n, adj);
    }
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        long cofactor = minor(i, j).determinant();
        if ((i + j) % 2 != 0) {
          cofactor = -cofactor;
        }
        // cofactor (i, j) lands at (j, i)
        adj[j][i] = reduce(cofactor, modulus);
      }
    }
    return new DenseIntMatrix(n, adj);
  }

  /**
   * Replaces this matrix by its inverse over the integers. Such an inverse
   * exists exactly when the determinant is 1 or -1, it then equals the
   * adjugate multiplied with the determinant.
   * 
   * @throws NotSquareException if the matrix is not square.
   * @throws NotInvertibleException if the determinant is neither 1 nor -1.
   */
  @Override
  public DenseIntMatrix inverse() {
    checkSquare("inverse");
    long det = determinant();
    if (det != 1L && det != -1L) {
      throw new NotInvertibleException(String.format(
          "Matrix with determinant %d has no integer inverse.", det));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Inverting unimodular " + sizeToString() + " matrix.");
    }
    DenseIntMatrix adj = adjugate().multiply(det);
    replace(adj.matrix, adj.numColumns);
    return this;
  }

  /**
   * Replaces this matrix by its inverse modulo the given modulus: the adjugate
   * multiplied with the modular inverse of the determinant.
   * 
   * @throws InvalidModulusException if the modulus is not positive.
   * @throws NotSquareException if the matrix is not square.
   * @throws NotInvertibleException if the determinant is not coprime to the
   *           modulus.
   */
  public DenseIntMatrix inverse(long modulus) {
    Modular.checkModulus(modulus);
    checkSquare("inverse");
    long det = determinant(modulus);
    if (Modular.gcd(det, modulus) != 1L) {
      throw new NotInvertibleException(String.format(
          "Matrix with determinant %d is not invertible modulo %d.", det,
          modulus));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Inverting " + sizeToString() + " matrix modulo " + modulus
          + ".");
    }
    DenseIntMatrix adj = adjugate(modulus).multiply(
        Modular.inverse(det, modulus), modulus);
    replace(adj.matrix, adj.numColumns);
    return this;
  }

  @Override
  public DenseIntMatrix copy() {
    return new DenseIntMatrix(numColumns, deepCopy(matrix));
  }

  @Override
  public long[][] toArray() {
    return deepCopy(matrix);
  }

  /**
   * Iterates over copies of the rows, top to bottom. Rows are read when the
   * iterator reaches them.
   */
  @Override
  public Iterator<long[]> iterator() {
    return new AbstractIterator<long[]>() {
      private int row = 0;

      @Override
      protected long[] computeNext() {
        if (row >= numRows) {
          return endOfData();
        }
        return getRow(row++);
      }
    };
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + Arrays.deepHashCode(matrix);
    result = prime * result + numColumns;
    result = prime * result + numRows;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    DenseIntMatrix other = (DenseIntMatrix) obj;
    if (numColumns != other.numColumns)
      return false;
    if (numRows != other.numRows)
      return false;
    return Arrays.deepEquals(matrix, other.matrix);
  }

  /**
   * Renders the cells separated by spaces and the rows by newlines, without a
   * trailing newline.
   */
  @Override
  public String toString() {
    List<String> lines = new ArrayList<String>(numRows);
    for (long[] row : matrix) {
      lines.add(Longs.join(" ", row));
    }
    return Joiner.on('\n').join(lines);
  }

  private void checkSquare(String operation) {
    if (!isSquare()) {
      throw new NotSquareException(operation, numRows, numColumns);
    }
  }

  private void reduceAll(long modulus) {
    for (long[] row : matrix) {
      for (int j = 0; j < row.length; j++) {
        row[j] = Modular.canonicalize(row[j], modulus);
      }
    }
  }

  private void replace(long[][] values, int columns) {
    this.matrix = values;
    this.numRows = values.length;
    this.numColumns = columns;
  }

  private static long reduce(long value, long modulus) {
    return modulus == NO_MODULUS ? value : Modular.canonicalize(value, modulus);
  }

  private static void checkRectangular(long[][] grid) {
    if (!isRectangular(grid)) {
      throw new ShapeMismatchException(
          "All rows of a matrix must have the same length.");
    }
  }

  private static long[][] deepCopy(long[][] src) {
    final long[][] dest = new long[src.length][];
    for (int i = 0; i < dest.length; i++) {
      dest[i] = src[i].clone();
    }
    return dest;
  }

}
