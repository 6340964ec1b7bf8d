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

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import com.unitfloat.common.base.Either;
import com.unitfloat.common.quantity.ConversionFailure.Kind;

/**
 * The affine conversion protocol between a unit's display values and the unit-independent
 * reference quantity of its family:
 * <pre>
 *   reference = value * multiplier + offset
 *   value     = (reference - offset) / multiplier
 * </pre>
 * All arithmetic is exact, so a value carried to the reference unit and back comes out unchanged.
 *
 * <p>Every operation returns either the converted {@link Rational} on the right or a
 * {@link ConversionFailure} on the left; nothing here throws for bad input or bad units.
 */
public final class UnitConversions {

  private UnitConversions() {
    // utility
  }

  /**
   * Carries a display value in {@code unit} to the reference unit.
   *
   * @param value the display value.
   * @param unit the unit {@code value} is expressed in.
   * @return the reference value, or an {@link Kind#INVALID_NUMBER} failure if {@code value} does
   *     not parse, or an {@link Kind#UNSUPPORTED_UNIT_KIND} failure for a logarithmic unit.
   */
  public static Either<ConversionFailure, Rational> toReference(Numeric value, Unit unit) {
    Preconditions.checkNotNull(value);
    Preconditions.checkNotNull(unit);

    Optional<ConversionFailure> unsupported = checkSupported(unit);
    if (unsupported.isPresent()) {
      return Either.left(unsupported.get());
    }
    Rational parsed = RationalParser.parse(value);
    if (parsed == null) {
      return invalidNumber(value);
    }
    return Either.right(parsed.multiply(unit.getMultiplier()).add(unit.getOffset()));
  }

  public static Either<ConversionFailure, Rational> toReference(@Nullable String value, Unit unit) {
    return toReference(Numeric.text(value), unit);
  }

  public static Either<ConversionFailure, Rational> toReference(Rational value, Unit unit) {
    return toReference(Numeric.of(value), unit);
  }

  /**
   * Carries a reference value back to a display value in {@code unit}.
   *
   * @param referenceValue the value in the reference unit.
   * @param unit the unit to express the value in.
   * @return the display value, or an {@link Kind#INVALID_NUMBER} failure if
   *     {@code referenceValue} does not parse, an {@link Kind#UNSUPPORTED_UNIT_KIND} failure for a
   *     logarithmic unit or a {@link Kind#DIVISION_BY_ZERO} failure if the unit's multiplier is
   *     zero.
   */
  public static Either<ConversionFailure, Rational> fromReference(Numeric referenceValue,
      Unit unit) {
    Preconditions.checkNotNull(referenceValue);
    Preconditions.checkNotNull(unit);

    Optional<ConversionFailure> unsupported = checkSupported(unit);
    if (unsupported.isPresent()) {
      return Either.left(unsupported.get());
    }
    Rational parsed = RationalParser.parse(referenceValue);
    if (parsed == null) {
      return invalidNumber(referenceValue);
    }
    if (unit.getMultiplier().isZero()) {
      return Either.left(ConversionFailure.of(Kind.DIVISION_BY_ZERO,
          "Unit %s has a zero multiplier", unit.getIdentifier()));
    }
    return Either.right(parsed.subtract(unit.getOffset()).divide(unit.getMultiplier()));
  }

  public static Either<ConversionFailure, Rational> fromReference(@Nullable String referenceValue,
      Unit unit) {
    return fromReference(Numeric.text(referenceValue), unit);
  }

  public static Either<ConversionFailure, Rational> fromReference(Rational referenceValue,
      Unit unit) {
    return fromReference(Numeric.of(referenceValue), unit);
  }

  /**
   * Converts a display value in {@code from} to a display value in {@code to} by way of their
   * shared reference unit.
   *
   * @return the converted value, or a failure if either unit is logarithmic, the units are not
   *     compatible, {@code value} does not parse or {@code to} has a zero multiplier.
   */
  public static Either<ConversionFailure, Rational> convert(Numeric value, Unit from,
      final Unit to) {
    Optional<ConversionFailure> notConvertible = checkConvertible(from, to);
    if (notConvertible.isPresent()) {
      return Either.left(notConvertible.get());
    }
    return toReference(value, from).flatMapRight(
        new Function<Rational, Either<ConversionFailure, Rational>>() {
          @Override public Either<ConversionFailure, Rational> apply(Rational reference) {
            return fromReference(reference, to);
          }
        });
  }

  public static Either<ConversionFailure, Rational> convert(@Nullable String value, Unit from,
      Unit to) {
    return convert(Numeric.text(value), from, to);
  }

  public static Either<ConversionFailure, Rational> convert(Rational value, Unit from, Unit to) {
    return convert(Numeric.of(value), from, to);
  }

  /**
   * Like {@link #convert(Numeric, Unit, Unit)} but throws instead of returning a failure.
   *
   * @throws ConversionException if the conversion fails.
   */
  public static Rational convertOrThrow(Numeric value, Unit from, Unit to)
      throws ConversionException {
    return getOrThrow(convert(value, from, to));
  }

  public static Either<ConversionFailure, String> toReferenceString(@Nullable String value,
      Unit unit) {
    return toReference(value, unit).mapRight(RationalFormatter.DEFAULT.asFunction());
  }

  public static Either<ConversionFailure, String> fromReferenceString(
      @Nullable String referenceValue, Unit unit) {
    return fromReference(referenceValue, unit).mapRight(RationalFormatter.DEFAULT.asFunction());
  }

  public static Either<ConversionFailure, String> convertToString(@Nullable String value,
      Unit from, Unit to) {
    return convert(value, from, to).mapRight(RationalFormatter.DEFAULT.asFunction());
  }

  /**
   * Checks that the affine transform describes {@code unit}.
   *
   * @return an {@link Kind#UNSUPPORTED_UNIT_KIND} failure for a logarithmic unit, absent otherwise.
   */
  public static Optional<ConversionFailure> checkSupported(Unit unit) {
    if (unit.isLogarithmic()) {
      return Optional.of(ConversionFailure.of(Kind.UNSUPPORTED_UNIT_KIND,
          "Logarithmic unit %s cannot be converted", unit.getIdentifier()));
    }
    return Optional.absent();
  }

  /**
   * Checks that values can be converted from {@code from} to {@code to}.
   *
   * @return the reason the units cannot be converted between, absent if they can.
   */
  public static Optional<ConversionFailure> checkConvertible(Unit from, Unit to) {
    Preconditions.checkNotNull(from);
    Preconditions.checkNotNull(to);

    Optional<ConversionFailure> unsupported = checkSupported(from);
    if (unsupported.isPresent()) {
      return unsupported;
    }
    unsupported = checkSupported(to);
    if (unsupported.isPresent()) {
      return unsupported;
    }
    if (!from.isCompatibleWith(to)) {
      return Optional.of(ConversionFailure.of(Kind.INCOMPATIBLE_UNITS,
          "Cannot convert between incompatible units %s and %s",
          from.getIdentifier(), to.getIdentifier()));
    }
    return Optional.absent();
  }

  /**
   * Returns the right value of a conversion result or throws its failure.
   *
   * @throws ConversionException if {@code result} is a failure.
   */
  public static <T> T getOrThrow(Either<ConversionFailure, T> result)
      throws ConversionException {
    if (result.isLeft()) {
      throw new ConversionException(result.getLeft());
    }
    return result.getRight();
  }

  private static Either<ConversionFailure, Rational> invalidNumber(Numeric value) {
    return Either.left(ConversionFailure.of(Kind.INVALID_NUMBER, "Not a valid number: %s", value));
  }
}
