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
 * Describes why a conversion produced no value.  Failures are ordinary outcomes of the conversion
 * protocol, returned as the left side of an {@link com.unitfloat.common.base.Either}; none of them
 * is fatal and every one can be recovered from by re-entering the value or re-selecting a unit.
 */
public final class ConversionFailure {

  /**
   * The kinds of failure the conversion protocol distinguishes.
   */
  public enum Kind {
    /** Text or a number could not be parsed into a rational, or a required value was absent. */
    INVALID_NUMBER,
    /** A fraction's denominator or a unit's multiplier was zero where it is divided by. */
    DIVISION_BY_ZERO,
    /** The units differ in reference unit or quantity kind. */
    INCOMPATIBLE_UNITS,
    /** The unit is logarithmic or otherwise not affine. */
    UNSUPPORTED_UNIT_KIND
  }

  private final Kind kind;
  private final String message;

  private ConversionFailure(Kind kind, String message) {
    this.kind = Preconditions.checkNotNull(kind);
    this.message = MorePreconditions.checkNotBlank(message);
  }

  public static ConversionFailure of(Kind kind, String message, Object... args) {
    return new ConversionFailure(kind, String.format(message, args));
  }

  public Kind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof ConversionFailure)) {
      return false;
    }
    ConversionFailure other = (ConversionFailure) obj;
    return kind == other.kind && message.equals(other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, message);
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
