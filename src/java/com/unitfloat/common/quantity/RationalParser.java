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

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * Parses numeric literals into exact {@link Rational}s.
 *
 * <p>Accepted text forms are an optional sign, an integer part, an optional fractional part after
 * a {@code .} and an optional exponent introduced by {@code e} or {@code E}, for example
 * {@code -12.5e-3}.  A {@code numerator/denominator} form is also accepted where each side is
 * itself any accepted literal, for example {@code 5/9} or {@code 1.8e0/3}.
 *
 * <p>Parsing never throws for input that merely fails to parse: malformed, empty and absent input
 * all yield {@code null}, which callers must keep distinct from zero.  A fraction whose denominator
 * parses to zero also yields {@code null}.
 */
public final class RationalParser {

  /**
   * Largest power of ten magnitude a literal may scale by.  Literals that would need more are
   * rejected rather than materialized.
   */
  public static final int MAX_SCALE = 100000;

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');
  private static final CharMatcher NON_ZERO_DIGITS = CharMatcher.inRange('1', '9');

  private RationalParser() {
    // utility
  }

  /**
   * Parses a numeric literal.
   *
   * @param input the text to parse, may be {@code null}.
   * @return the exact value of {@code input}, or {@code null} if it is absent, empty, malformed,
   *     a fraction with more than one {@code /} or a fraction with a zero denominator.
   */
  @Nullable
  public static Rational parse(@Nullable String input) {
    if (input == null) {
      return null;
    }
    String text = input.trim();
    if (text.isEmpty()) {
      return null;
    }

    int slash = text.indexOf('/');
    if (slash >= 0) {
      if (text.indexOf('/', slash + 1) >= 0) {
        return null;
      }
      Rational numerator = parse(text.substring(0, slash));
      Rational denominator = parse(text.substring(slash + 1));
      if (numerator == null || denominator == null || denominator.isZero()) {
        return null;
      }
      return numerator.divide(denominator);
    }
    return parseDecimal(text);
  }

  /**
   * Parses a native floating point number.  Non-finite values yield {@code null} and zero (of
   * either sign) yields exact zero.  Any other value is parsed from its {@link Double#toString}
   * text, so whatever rounding the binary representation already introduced is kept rather than
   * guessed away.
   */
  @Nullable
  public static Rational parse(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return null;
    }
    if (value == 0) {
      return Rational.ZERO;
    }
    return parse(Double.toString(value));
  }

  /**
   * Parses a boxed number.  Integral types and {@link BigInteger}s convert exactly, a
   * {@link BigDecimal} parses from its exact text and floating point types follow
   * {@link #parse(double)}.
   */
  @Nullable
  public static Rational parse(@Nullable Number value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Rational) {
      return (Rational) value;
    }
    if (value instanceof BigInteger) {
      return Rational.of((BigInteger) value);
    }
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return Rational.of(value.longValue());
    }
    if (value instanceof BigDecimal) {
      return parse(value.toString());
    }
    if (value instanceof Float) {
      float f = value.floatValue();
      if (Float.isNaN(f) || Float.isInfinite(f)) {
        return null;
      }
      return f == 0 ? Rational.ZERO : parse(Float.toString(f));
    }
    return parse(value.doubleValue());
  }

  /**
   * Resolves any form of {@link Numeric} to an exact value.
   */
  @Nullable
  public static Rational parse(Numeric value) {
    return Preconditions.checkNotNull(value).map(PARSING_TRANSFORMER);
  }

  private static final Numeric.Transformer<Rational> PARSING_TRANSFORMER =
      new Numeric.Transformer<Rational>() {
        @Override public Rational mapRational(Rational value) {
          return value;
        }

        @Override public Rational mapText(@Nullable String text) {
          return parse(text);
        }

        @Override public Rational mapDouble(double value) {
          return parse(value);
        }
      };

  /**
   * Computes {@code 10^exponent} exactly by repeated squaring.
   *
   * @param exponent a non-negative exponent.
   * @return ten raised to {@code exponent}.
   */
  public static BigInteger powerOfTen(int exponent) {
    Preconditions.checkArgument(exponent >= 0, "Exponent must be non-negative: %s", exponent);
    BigInteger result = BigInteger.ONE;
    BigInteger base = BigInteger.TEN;
    int remaining = exponent;
    while (remaining > 0) {
      if ((remaining & 1) == 1) {
        result = result.multiply(base);
      }
      remaining >>= 1;
      if (remaining > 0) {
        base = base.multiply(base);
      }
    }
    return result;
  }

  @Nullable
  private static Rational parseDecimal(String text) {
    int pos = 0;
    boolean negative = false;
    char first = text.charAt(0);
    if (first == '+' || first == '-') {
      negative = first == '-';
      pos++;
    }

    String mantissa;
    long exponent = 0;
    int exponentMarker = indexOfExponentMarker(text, pos);
    if (exponentMarker >= 0) {
      mantissa = text.substring(pos, exponentMarker);
      Long parsedExponent = parseExponent(text.substring(exponentMarker + 1));
      if (parsedExponent == null) {
        return null;
      }
      exponent = parsedExponent;
    } else {
      mantissa = text.substring(pos);
    }

    String integerPart;
    String fractionPart;
    int point = mantissa.indexOf('.');
    if (point >= 0) {
      integerPart = mantissa.substring(0, point);
      fractionPart = mantissa.substring(point + 1);
    } else {
      integerPart = mantissa;
      fractionPart = "";
    }
    if (integerPart.isEmpty() && fractionPart.isEmpty()) {
      return null;
    }
    if (!DIGITS.matchesAllOf(integerPart) || !DIGITS.matchesAllOf(fractionPart)) {
      return null;
    }

    String digits = integerPart + fractionPart;
    if (NON_ZERO_DIGITS.matchesNoneOf(digits)) {
      return Rational.ZERO;
    }

    long scale = exponent - fractionPart.length();
    if (Math.abs(scale) > MAX_SCALE) {
      return null;
    }

    BigInteger numerator = new BigInteger(digits);
    if (negative) {
      numerator = numerator.negate();
    }
    if (scale >= 0) {
      return Rational.of(numerator.multiply(powerOfTen((int) scale)));
    }
    return Rational.of(numerator, powerOfTen((int) -scale));
  }

  private static int indexOfExponentMarker(String text, int from) {
    for (int i = from; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == 'e' || c == 'E') {
        return i;
      }
    }
    return -1;
  }

  @Nullable
  private static Long parseExponent(String text) {
    if (text.isEmpty()) {
      return null;
    }
    int pos = 0;
    boolean negative = false;
    char first = text.charAt(0);
    if (first == '+' || first == '-') {
      negative = first == '-';
      pos++;
    }
    String digits = text.substring(pos);
    if (digits.isEmpty() || !DIGITS.matchesAllOf(digits)) {
      return null;
    }
    // Saturate; anything this large is rejected by the scale check unless the mantissa is zero.
    String significant = CharMatcher.is('0').trimLeadingFrom(digits);
    long magnitude = significant.length() > 12 ? Long.MAX_VALUE / 2 : Long.parseLong(digits);
    return negative ? -magnitude : magnitude;
  }
}
