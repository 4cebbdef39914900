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

import java.util.Iterator;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.google.common.base.Preconditions;

/**
 * Matrix over the integers modulo a fixed modulus. Every cell holds a value in
 * [0, modulus) after each public operation, including transforms supplied by
 * the caller. The modulus is chosen at construction and never changes.
 * <p>
 * All operations forward to a {@link DenseIntMatrix} and pass it the modulus.
 */
public class ModularIntMatrix implements IntMatrix {

  private static final Log LOG = LogFactory.getLog(ModularIntMatrix.class);

  private final DenseIntMatrix delegate;
  private final long modulus;

  /**
   * Creates a matrix holding the canonical representatives of the given grid.
   * 
   * @param grid the rows of the matrix, all of the same length.
   * @param modulus a positive modulus.
   * @throws InvalidModulusException if the modulus is not positive.
   * @throws ShapeMismatchException if the rows differ in length.
   */
  public ModularIntMatrix(long[][] grid, long modulus) {
    this(new DenseIntMatrix(grid, Modular.checkModulus(modulus)), modulus);
  }

  /**
   * Adopts an already reduced matrix.
   */
  private ModularIntMatrix(DenseIntMatrix delegate, long modulus) {
    this.delegate = delegate;
    this.modulus = modulus;
    if (LOG.isDebugEnabled()) {
      LOG.debug("Created " + delegate.sizeToString() + " matrix modulo "
          + modulus + ".");
    }
  }

  /**
   * Gets the identity matrix with a given dimension modulo the modulus.
   */
  public static ModularIntMatrix identity(int dimension, long modulus) {
    return new ModularIntMatrix(DenseIntMatrix.identity(dimension).toArray(),
        modulus);
  }

  /**
   * Gets a matrix of ones with the given number of rows and columns modulo
   * the modulus.
   */
  public static ModularIntMatrix ones(int rows, int columns, long modulus) {
    return new ModularIntMatrix(DenseIntMatrix.ones(rows, columns).toArray(),
        modulus);
  }

  /**
   * @return the modulus all cells are reduced by.
   */
  public long getModulus() {
    return modulus;
  }

  @Override
  public long get(int row, int col) {
    return delegate.get(row, col);
  }

  @Override
  public long[] getRow(int row) {
    return delegate.getRow(row);
  }

  @Override
  public long[] getColumn(int col) {
    return delegate.getColumn(col);
  }

  @Override
  public int getRowCount() {
    return delegate.getRowCount();
  }

  @Override
  public int getColumnCount() {
    return delegate.getColumnCount();
  }

  @Override
  public int[] shape() {
    return delegate.shape();
  }

  @Override
  public boolean isSquare() {
    return delegate.isSquare();
  }

  @Override
  public ModularIntMatrix set(int row, int col, long value) {
    delegate.set(row, col, value, modulus);
    return this;
  }

  @Override
  public ModularIntMatrix insertRow(long[] row) {
    return insertRow(row, delegate.getRowCount());
  }

  @Override
  public ModularIntMatrix insertRow(long[] row, int position) {
    delegate.insertRow(row, position, modulus);
    return this;
  }

  @Override
  public ModularIntMatrix deleteRow(int row) {
    delegate.deleteRow(row);
    return this;
  }

  @Override
  public ModularIntMatrix deleteColumn(int col) {
    delegate.deleteColumn(col);
    return this;
  }

  /**
   * Applies the function to every cell and keeps the canonical representative
   * of each result.
   */
  @Override
  public ModularIntMatrix transform(final CellFunction fun) {
    Preconditions.checkNotNull(fun, "fun");
    delegate.transform(new CellFunction() {
      @Override
      public long apply(long value, int row, int col) {
        return Modular.canonicalize(fun.apply(value, row, col), modulus);
      }
    });
    return this;
  }

  /**
   * {@inheritDoc}
   * 
   * @throws IllegalArgumentException if the other matrix is a modular matrix
   *           with a different modulus.
   */
  @Override
  public ModularIntMatrix add(IntMatrix other) {
    checkCompatible(other);
    delegate.add(other, modulus);
    return this;
  }

  @Override
  public ModularIntMatrix multiply(long scalar) {
    delegate.multiply(scalar, modulus);
    return this;
  }

  /**
   * {@inheritDoc}
   * 
   * @throws IllegalArgumentException if the other matrix is a modular matrix
   *           with a different modulus.
   */
  @Override
  public ModularIntMatrix multiply(IntMatrix other) {
    checkCompatible(other);
    delegate.multiply(other, modulus);
    return this;
  }

  @Override
  public ModularIntMatrix transpose() {
    delegate.transpose();
    return this;
  }

  /**
   * Computes the canonical representative of the determinant.
   */
  @Override
  public long determinant() {
    return delegate.determinant(modulus);
  }

  @Override
  public ModularIntMatrix minor(int row, int col) {
    return new ModularIntMatrix(delegate.minor(row, col), modulus);
  }

  @Override
  public ModularIntMatrix adjugate() {
    return new ModularIntMatrix(delegate.adjugate(modulus), modulus);
  }

  /**
   * Replaces this matrix by its inverse modulo the modulus.
   * 
   * @throws NotSquareException if the matrix is not square.
   * @throws NotInvertibleException if the determinant is not coprime to the
   *           modulus.
   */
  @Override
  public ModularIntMatrix inverse() {
    delegate.inverse(modulus);
    return this;
  }

  @Override
  public ModularIntMatrix copy() {
    return new ModularIntMatrix(delegate.copy(), modulus);
  }

  @Override
  public long[][] toArray() {
    return delegate.toArray();
  }

  @Override
  public Iterator<long[]> iterator() {
    return delegate.iterator();
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + delegate.hashCode();
    result = prime * result + (int) (modulus ^ (modulus >>> 32));
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
    ModularIntMatrix other = (ModularIntMatrix) obj;
    if (modulus != other.modulus)
      return false;
    return delegate.equals(other.delegate);
  }

  @Override
  public String toString() {
    return delegate.toString();
  }

  private void checkCompatible(IntMatrix other) {
    if (other instanceof ModularIntMatrix) {
      long otherModulus = ((ModularIntMatrix) other).modulus;
      Preconditions.checkArgument(otherModulus == modulus,
          "Cannot combine matrices modulo %s and %s.", modulus, otherModulus);
    }
  }

}
