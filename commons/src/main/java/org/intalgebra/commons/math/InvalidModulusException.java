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
 * Thrown when a modulus is not a positive integer.
 */
public class InvalidModulusException extends IllegalArgumentException {

  private static final long serialVersionUID = -4021633245101318264L;

  private final long modulus;

  public InvalidModulusException(long modulus) {
    super(String.format(
        "Modulus must be a positive integer, but was %d.", modulus));
    this.modulus = modulus;
  }

  /**
   * @return the rejected modulus.
   */
  public long getModulus() {
    return modulus;
  }

}
