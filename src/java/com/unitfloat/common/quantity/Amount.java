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

import com.google.common.base.Objects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import com.unitfloat.common.base.Either;

/**
 * An exact value expressed in a {@link Unit}.  Amounts in compatible units compare and test equal
 * by their reference values, so {@code 1 km} equals {@code 1000 m}.
 */
public final class Amount implements Comparable<Amount> {

  private final Rational value;
  private final Unit unit;

  private Amount(Rational value, Unit unit) {
    this.value = Preconditions.checkNotNull(value);
    this.unit = Preconditions.checkNotNull(unit);
  }

  public static Amount of(Rational value, Unit unit) {
    return new Amount(value, unit);
  }

  /**
   * Creates an amount from a numeric literal.
   *
   * @throws IllegalArgumentException if {@code value} does not parse.
   */
  public static Amount of(String value, Unit unit) {
    Rational parsed = RationalParser.parse(value);
    Preconditions.checkArgument(parsed != null, "Not a valid number: %s", value);
    return new Amount(parsed, unit);
  }

  public Rational getValue() {
    return value;
  }

  public Unit getUnit() {
    return unit;
  }

  /**
   * Returns this amount's value in the reference unit of its family.
   *
   * @throws ConversionException if the unit is not affine.
   */
  public Rational toReference() throws ConversionException {
    return UnitConversions.getOrThrow(UnitConversions.toReference(value, unit));
  }

  /**
   * Returns this amount's value expressed in {@code other}.
   *
   * @throws ConversionException if the units are not compatible or not affine.
   */
  public Rational as(Unit other) throws ConversionException {
    if (unit.equals(other)) {
      Optional<ConversionFailure> unsupported = UnitConversions.checkSupported(unit);
      if (unsupported.isPresent()) {
        throw new ConversionException(unsupported.get());
      }
      return value;
    }
    return UnitConversions.convertOrThrow(Numeric.of(value), unit, other);
  }

  /**
   * Returns an amount equal to this one expressed in {@code other}.
   *
   * @throws ConversionException if the units are not compatible or not affine.
   */
  public Amount to(Unit other) throws ConversionException {
    return new Amount(as(other), other);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Amount)) {
      return false;
    }
    Amount other = (Amount) obj;
    if (value.equals(other.value) && unit.equals(other.unit)) {
      return true;
    }
    if (UnitConversions.checkConvertible(unit, other.unit).isPresent()) {
      return false;
    }
    return referenceValue().equals(other.referenceValue());
  }

  @Override
  public int hashCode() {
    if (UnitConversions.checkSupported(unit).isPresent()) {
      return Objects.hashCode(value, unit);
    }
    return Objects.hashCode(referenceValue(), unit.getReferenceId(), unit.getQuantityKindId());
  }

  /**
   * Orders amounts of compatible units by their reference values.
   *
   * @throws IllegalArgumentException if the amounts' units cannot be converted between.
   */
  @Override
  public int compareTo(Amount other) {
    Preconditions.checkArgument(!UnitConversions.checkConvertible(unit, other.unit).isPresent(),
        "Cannot compare amounts in %s and %s", unit, other.unit);
    return referenceValue().compareTo(other.referenceValue());
  }

  private Rational referenceValue() {
    Either<ConversionFailure, Rational> reference = UnitConversions.toReference(value, unit);
    Preconditions.checkState(reference.isRight(), "No reference value for %s", this);
    return reference.getRight();
  }

  @Override
  public String toString() {
    return value + " " + unit;
  }
}
