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
 * Modular arithmetic on longs. All results are canonical representatives, that
 * is values in [0, modulus).
 */
public final class Modular {

  private Modular() {
  }

  /**
   * Validates a modulus.
   * 
   * @param modulus the modulus to check.
   * @return the given modulus.
   * @throws InvalidModulusException if the modulus is not positive.
   */
  public static long checkModulus(long modulus) {
    if (modulus < 1) {
      throw new InvalidModulusException(modulus);
    }
    return modulus;
  }

  /**
   * Returns the value unchanged. This is the counterpart of
   * {@link #canonicalize(long, long)} for callers that work without a modulus.
   */
  public static long canonicalize(long value) {
    return value;
  }

  /**
   * Gets the canonical representative of value modulo the given modulus.
   * Negative values wrap around, so canonicalize(-1, 5) is 4.
   * 
   * @param value any value.
   * @param modulus a positive modulus.
   * @return the value in [0, modulus) congruent to the given value.
   * @throws InvalidModulusException if the modulus is not positive.
   */
  public static long canonicalize(long value, long modulus) {
    checkModulus(modulus);
    if (value < 0) {
      return (modulus + value % modulus) % modulus;
    }
    return value % modulus;
  }

  /**
   * Greatest common divisor by Euclid's algorithm. The result is never
   * negative and gcd(0, 0) is 0.
   */
  public static long gcd(long a, long b) {
    while (b != 0) {
      long temp = b;
      b = a % b;
      a = temp;
    }
    return Math.abs(a);
  }

  /**
   * Computes the multiplicative inverse of value modulo the given modulus with
   * the extended Euclidean algorithm.
   * 
   * @param value the value to invert, need not be canonical.
   * @param modulus a positive modulus.
   * @return x in [0, modulus) with value * x congruent to 1.
   * @throws InvalidModulusException if the modulus is not positive.
   * @throws NotInvertibleException if value and modulus are not coprime.
   */
  public static long inverse(long value, long modulus) {
    long a = canonicalize(value, modulus);
    if (gcd(a, modulus) != 1) {
      throw new NotInvertibleException(String.format(
          "%d has no inverse modulo %d.", value, modulus));
    }

    long t = 0;
    long newT = 1;
    long r = modulus;
    long newR = a;
    while (newR != 0) {
      long quotient = r / newR;

      long tempT = t;
      t = newT;
      newT = tempT - quotient * newT;

      long tempR = r;
      r = newR;
      newR = tempR - quotient * newR;
    }
    return canonicalize(t, modulus);
  }

}
