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
import com.google.common.base.Preconditions;

import com.unitfloat.common.base.MorePreconditions;

/**
 * A unit of measure related to the reference unit of its family by the affine transform
 * {@code reference = value * multiplier + offset}.  Instances are resolved once from a unit catalog
 * and are immutable afterwards.
 *
 * <p>Two units are convertible into one another only if they share both the reference unit and
 * the quantity kind.  Logarithmic units carry a multiplier and offset like any other unit but the
 * affine transform does not describe them, so they are never converted.
 */
public final class Unit {

  private final String identifier;
  private final Rational multiplier;
  private final Rational offset;
  @Nullable private final String referenceId;
  @Nullable private final String quantityKindId;
  private final boolean logarithmic;
  private final String displayCode;
  private final String label;

  private Unit(Builder builder) {
    this.identifier = builder.identifier;
    this.multiplier = builder.multiplier;
    this.offset = builder.offset;
    this.referenceId = builder.referenceId;
    this.quantityKindId = builder.quantityKindId;
    this.logarithmic = builder.logarithmic;
    this.displayCode = builder.displayCode == null ? builder.identifier : builder.displayCode;
    this.label = builder.label == null ? this.displayCode : builder.label;
  }

  public static Builder builder(String identifier) {
    return new Builder(identifier);
  }

  public static class Builder {
    private final String identifier;
    private Rational multiplier = null;
    private Rational offset = Rational.ZERO;
    private String referenceId = null;
    private String quantityKindId = null;
    private boolean logarithmic = false;
    private String displayCode = null;
    private String label = null;

    private Builder(String identifier) {
      this.identifier = MorePreconditions.checkNotBlank(identifier);
    }

    public Builder multiplier(Rational multiplier) {
      this.multiplier = Preconditions.checkNotNull(multiplier);
      return this;
    }

    public Builder offset(Rational offset) {
      this.offset = Preconditions.checkNotNull(offset);
      return this;
    }

    public Builder referenceId(@Nullable String referenceId) {
      this.referenceId = referenceId;
      return this;
    }

    public Builder quantityKindId(@Nullable String quantityKindId) {
      this.quantityKindId = quantityKindId;
      return this;
    }

    public Builder logarithmic(boolean logarithmic) {
      this.logarithmic = logarithmic;
      return this;
    }

    public Builder displayCode(String displayCode) {
      this.displayCode = MorePreconditions.checkNotBlank(displayCode);
      return this;
    }

    public Builder label(@Nullable String label) {
      this.label = label;
      return this;
    }

    /**
     * Builds the unit.
     *
     * @throws IllegalStateException if no multiplier was supplied.
     */
    public Unit build() {
      Preconditions.checkState(multiplier != null, "Unit %s has no multiplier", identifier);
      return new Unit(this);
    }
  }

  public String getIdentifier() {
    return identifier;
  }

  public Rational getMultiplier() {
    return multiplier;
  }

  public Rational getOffset() {
    return offset;
  }

  @Nullable
  public String getReferenceId() {
    return referenceId;
  }

  @Nullable
  public String getQuantityKindId() {
    return quantityKindId;
  }

  public boolean isLogarithmic() {
    return logarithmic;
  }

  public String getDisplayCode() {
    return displayCode;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Returns {@code true} if this unit is the reference unit of its own family.
   */
  public boolean isReference() {
    return identifier.equals(referenceId);
  }

  /**
   * Returns {@code true} if values can be carried between this unit and {@code other} through their
   * shared reference unit.
   */
  public boolean isCompatibleWith(Unit other) {
    Preconditions.checkNotNull(other);
    return Objects.equal(referenceId, other.referenceId)
        && Objects.equal(quantityKindId, other.quantityKindId);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Unit)) {
      return false;
    }
    Unit other = (Unit) obj;
    return identifier.equals(other.identifier)
        && multiplier.equals(other.multiplier)
        && offset.equals(other.offset)
        && Objects.equal(referenceId, other.referenceId)
        && Objects.equal(quantityKindId, other.quantityKindId)
        && logarithmic == other.logarithmic
        && displayCode.equals(other.displayCode)
        && label.equals(other.label);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(identifier, multiplier, offset, referenceId, quantityKindId,
        logarithmic, displayCode, label);
  }

  @Override
  public String toString() {
    return displayCode;
  }
}
