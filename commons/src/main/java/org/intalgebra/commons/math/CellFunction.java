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
 * A function applied to every cell of an {@link IntMatrix} by
 * {@link IntMatrix#transform(CellFunction)}. It receives the current value and
 * the position of the cell and returns the replacement value.
 */
public interface CellFunction {

  /**
   * Apply the function to a cell.
   * 
   * @param value the current value of the cell.
   * @param row the row index of the cell.
   * @param col the column index of the cell.
   * @return the new value of the cell.
   */
  long apply(long value, int row, int col);

}
