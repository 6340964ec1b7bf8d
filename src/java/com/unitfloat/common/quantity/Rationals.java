// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.unitfloat.common.quantity;

import java.math.BigInteger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Static arithmetic over {@link Rational}s that tolerates absent operands where a value may simply
 * not have been entered.
 */
public final class Rationals {

  private Rationals() {
    // utility
  }

  /**
   * Reduces {@code numerator / denominator} to lowest terms with a positive denominator.
   *
   * @throws IllegalArgumentException if {@code denominator} is zero.
   */
  public static Rational normalize(BigInteger numerator, BigInteger denominator) {
    return Rational.of(numerator, denominator);
  }

  /**
   * Re-normalizes an existing rational.  Since rationals are always kept normalized this returns
   * an equal instance; it exists so callers can state the invariant explicitly.
   */
  public static Rational normalize(Rational value) {
    Preconditions.checkNotNull(value);
    return Rational.of(value.getNumerator(), value.getDenominator());
  }

  /**
   * Adds two possibly absent rationals.  An absent operand acts as the identity, so
   * {@code add(a, null)} is {@code a}; the sum of two absent operands is absent.
   */
  @Nullable
  public static Rational add(@Nullable Rational a, @Nullable Rational b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return a.add(b);
  }

  /**
   * Subtracts {@code b} from {@code a}, treating an absent operand as zero; absent if both are.
   */
  @Nullable
  public static Rational subtract(@Nullable Rational a, @Nullable Rational b) {
    return add(a, b == null ? null : b.negate());
  }

  /**
   * Multiplies two rationals, short-circuiting to zero when either numerator is zero.
   */
  public static Rational multiply(Rational a, Rational b) {
    return Preconditions.checkNotNull(a).multiply(Preconditions.checkNotNull(b));
  }

  /**
   * Divides {@code a} by {@code b}.
   *
   * @throws Rational.DivisionByZeroException if {@code b} is zero and {@code a} is not.
   */
  public static Rational divide(Rational a, Rational b) {
    return Preconditions.checkNotNull(a).divide(Preconditions.checkNotNull(b));
  }

  public static boolean isZero(@Nullable Rational value) {
    return value != null && value.isZero();
  }
}
