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

import com.google.common.base.Function;
import com.google.common.base.Preconditions;

/**
 * Renders {@link Rational}s in their canonical decimal form: the minimal, trailing-zero-trimmed
 * decimal string, rounded half up after a fixed number of fractional digits.  Every value shown to
 * a user or written to a display state field should go through a formatter rather than through a
 * floating point {@code toString}.
 *
 * <p>Examples with the default 24 digit cap: {@code 3/2} renders as {@code 1.5}, {@code 1/3} as
 * {@code 0.333333333333333333333333} and {@code 2/3} as {@code 0.666666666666666666666667}.
 */
public final class RationalFormatter {

  public static final int DEFAULT_MAX_FRACTION_DIGITS = 24;

  public static final RationalFormatter DEFAULT =
      new RationalFormatter(DEFAULT_MAX_FRACTION_DIGITS);

  private final int maxFractionDigits;

  /**
   * Creates a formatter that generates at most {@code maxFractionDigits} fractional digits.  The
   * cap guarantees termination for repeating fractions.
   *
   * @param maxFractionDigits the fractional digit cap, must not be negative.
   */
  public RationalFormatter(int maxFractionDigits) {
    Preconditions.checkArgument(maxFractionDigits >= 0,
        "maxFractionDigits must not be negative: %s", maxFractionDigits);
    this.maxFractionDigits = maxFractionDigits;
  }

  public int getMaxFractionDigits() {
    return maxFractionDigits;
  }

  /**
   * Formats a value.
   *
   * @param value the value to format, may be {@code null}.
   * @return the canonical decimal text of {@code value}, or the empty string if it is absent.
   */
  public String toDecimalString(@Nullable Rational value) {
    if (value == null) {
      return "";
    }
    if (value.isZero()) {
      return "0";
    }

    BigInteger denominator = value.getDenominator();
    BigInteger[] quotientAndRemainder = value.getNumerator().abs().divideAndRemainder(denominator);
    BigInteger integerPart = quotientAndRemainder[0];
    BigInteger remainder = quotientAndRemainder[1];

    int[] digits = new int[maxFractionDigits];
    int digitCount = 0;
    while (remainder.signum() != 0 && digitCount < maxFractionDigits) {
      BigInteger[] step = remainder.multiply(BigInteger.TEN).divideAndRemainder(denominator);
      digits[digitCount++] = step[0].intValue();
      remainder = step[1];
    }

    if (remainder.signum() != 0) {
      int nextDigit = remainder.multiply(BigInteger.TEN).divide(denominator).intValue();
      if (nextDigit >= 5) {
        int i = digitCount - 1;
        while (i >= 0 && digits[i] == 9) {
          digits[i] = 0;
          i--;
        }
        if (i >= 0) {
          digits[i]++;
        } else {
          integerPart = integerPart.add(BigInteger.ONE);
        }
      }
    }

    while (digitCount > 0 && digits[digitCount - 1] == 0) {
      digitCount--;
    }

    StringBuilder text = new StringBuilder();
    text.append(integerPart);
    if (digitCount > 0) {
      text.append('.');
      for (int i = 0; i < digitCount; i++) {
        text.append((char) ('0' + digits[i]));
      }
    }

    String magnitude = text.toString();
    if (value.signum() < 0 && !"0".equals(magnitude)) {
      return "-" + magnitude;
    }
    return magnitude;
  }

  /**
   * Returns a function view of {@link #toDecimalString(Rational)}.
   */
  public Function<Rational, String> asFunction() {
    return new Function<Rational, String>() {
      @Override public String apply(@Nullable Rational value) {
        return toDecimalString(value);
      }
    };
  }

  @Override
  public String toString() {
    return "RationalFormatter(maxFractionDigits=" + maxFractionDigits + ")";
  }
}
