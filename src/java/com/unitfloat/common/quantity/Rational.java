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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * An exact fraction of two arbitrary-precision integers.  Instances are always held in lowest
 * terms with a strictly positive denominator, so the sign lives entirely in the numerator and zero
 * is always {@code 0/1}.  Every operation returns a new instance; no operation approximates.
 *
 * <p>Instances are obtained from {@link RationalParser}, from the {@code of(...)} factories or as
 * the result of arithmetic on other instances.
 */
public final class Rational extends Number implements Comparable<Rational> {

  /**
   * Thrown when a rational is divided by zero.
   */
  public static class DivisionByZeroException extends ArithmeticException {
    public DivisionByZeroException(String message) {
      super(message);
    }
  }

  public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
  public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

  private static final long serialVersionUID = 1L;

  private final BigInteger numerator;
  private final BigInteger denominator;

  // Callers guarantee the arguments are already normalized.
  private Rational(BigInteger numerator, BigInteger denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  /**
   * Creates a rational from a numerator and denominator, reducing it to lowest terms.
   *
   * @param numerator the numerator, may be negative.
   * @param denominator the denominator, may be negative but not zero.
   * @return the normalized rational {@code numerator / denominator}.
   * @throws IllegalArgumentException if {@code denominator} is zero.
   */
  public static Rational of(BigInteger numerator, BigInteger denominator) {
    Preconditions.checkNotNull(numerator);
    Preconditions.checkNotNull(denominator);
    Preconditions.checkArgument(denominator.signum() != 0,
        "Invalid rational %s/%s: denominator must not be zero", numerator, denominator);

    if (numerator.signum() == 0) {
      return ZERO;
    }
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    BigInteger gcd = numerator.abs().gcd(denominator);
    if (!gcd.equals(BigInteger.ONE)) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    return new Rational(numerator, denominator);
  }

  public static Rational of(BigInteger integer) {
    return of(integer, BigInteger.ONE);
  }

  public static Rational of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  public static Rational of(long integer) {
    return of(BigInteger.valueOf(integer), BigInteger.ONE);
  }

  public BigInteger getNumerator() {
    return numerator;
  }

  public BigInteger getDenominator() {
    return denominator;
  }

  public boolean isZero() {
    return numerator.signum() == 0;
  }

  public boolean isInteger() {
    return denominator.equals(BigInteger.ONE);
  }

  public int signum() {
    return numerator.signum();
  }

  public Rational negate() {
    return isZero() ? this : new Rational(numerator.negate(), denominator);
  }

  public Rational abs() {
    return signum() < 0 ? negate() : this;
  }

  public Rational add(Rational other) {
    Preconditions.checkNotNull(other);
    if (other.isZero()) {
      return this;
    }
    if (isZero()) {
      return other;
    }
    if (denominator.equals(other.denominator)) {
      return of(numerator.add(other.numerator), denominator);
    }
    return of(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
        denominator.multiply(other.denominator));
  }

  public Rational subtract(Rational other) {
    Preconditions.checkNotNull(other);
    return add(other.negate());
  }

  public Rational multiply(Rational other) {
    Preconditions.checkNotNull(other);
    if (isZero() || other.isZero()) {
      return ZERO;
    }
    return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
  }

  /**
   * Divides this rational by {@code divisor}.  A zero dividend yields {@link #ZERO} without the
   * divisor being inspected.
   *
   * @param divisor the rational to divide by.
   * @return {@code this / divisor}.
   * @throws DivisionByZeroException if {@code divisor} is zero and this rational is not.
   */
  public Rational divide(Rational divisor) {
    Preconditions.checkNotNull(divisor);
    if (isZero()) {
      return ZERO;
    }
    if (divisor.isZero()) {
      throw new DivisionByZeroException("Cannot divide " + toFractionString() + " by zero");
    }
    return of(numerator.multiply(divisor.denominator), denominator.multiply(divisor.numerator));
  }

  /**
   * Returns the reciprocal of this rational.
   *
   * @throws DivisionByZeroException if this rational is zero.
   */
  public Rational reciprocal() {
    if (isZero()) {
      throw new DivisionByZeroException("Zero has no reciprocal");
    }
    return of(denominator, numerator);
  }

  @Override
  public int compareTo(Rational other) {
    return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
  }

  /**
   * Returns a {@code BigDecimal} approximation rounded to the given precision.  Lossy.
   */
  public BigDecimal toBigDecimal(MathContext mathContext) {
    return new BigDecimal(numerator).divide(new BigDecimal(denominator), mathContext);
  }

  /**
   * Returns the nearest {@code double} to this rational.  This is a lossy approximation meant for
   * non-authoritative display such as seeding a numeric input control; the canonical text form of
   * a rational is {@link #toString()}.
   */
  @Override
  public double doubleValue() {
    return toBigDecimal(MathContext.DECIMAL128).doubleValue();
  }

  @Override
  public float floatValue() {
    return (float) doubleValue();
  }

  /**
   * Returns the integer part of this rational, truncated toward zero.
   */
  @Override
  public long longValue() {
    return numerator.divide(denominator).longValue();
  }

  @Override
  public int intValue() {
    return (int) longValue();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Rational)) {
      return false;
    }
    Rational other = (Rational) obj;
    return numerator.equals(other.numerator) && denominator.equals(other.denominator);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(numerator, denominator);
  }

  /**
   * Returns the fraction form {@code numerator/denominator}, or just the numerator for integers.
   * Unlike {@link #toString()} this form is exact for every rational.
   */
  public String toFractionString() {
    return isInteger() ? numerator.toString() : numerator + "/" + denominator;
  }

  /**
   * Returns the canonical decimal form as produced by {@link RationalFormatter#DEFAULT}.
   */
  @Override
  public String toString() {
    return RationalFormatter.DEFAULT.toDecimalString(this);
  }
}
