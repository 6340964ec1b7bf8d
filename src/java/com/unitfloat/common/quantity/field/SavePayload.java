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

package com.unitfloat.common.quantity.field;

import javax.annotation.Nullable;

import com.google.common.base.Objects;

/**
 * What a {@link QuantityField} hands to its save listeners: the value in the reference unit,
 * which is what gets stored, along with the display value and unit it was entered as.  Values are
 * canonical decimal strings and are {@code null} when the field was empty.
 */
public final class SavePayload {

  @Nullable private final String referenceValue;
  @Nullable private final String referenceUnitId;
  @Nullable private final String quantityKindId;
  @Nullable private final String displayValue;
  private final String displayCode;
  private final String displayUnitId;

  SavePayload(@Nullable String referenceValue, @Nullable String referenceUnitId,
      @Nullable String quantityKindId, @Nullable String displayValue, String displayCode,
      String displayUnitId) {
    this.referenceValue = referenceValue;
    this.referenceUnitId = referenceUnitId;
    this.quantityKindId = quantityKindId;
    this.displayValue = displayValue;
    this.displayCode = displayCode;
    this.displayUnitId = displayUnitId;
  }

  @Nullable
  public String getReferenceValue() {
    return referenceValue;
  }

  @Nullable
  public String getReferenceUnitId() {
    return referenceUnitId;
  }

  @Nullable
  public String getQuantityKindId() {
    return quantityKindId;
  }

  @Nullable
  public String getDisplayValue() {
    return displayValue;
  }

  public String getDisplayCode() {
    return displayCode;
  }

  public String getDisplayUnitId() {
    return displayUnitId;
  }

  public boolean isEmpty() {
    return referenceValue == null;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof SavePayload)) {
      return false;
    }
    SavePayload other = (SavePayload) obj;
    return Objects.equal(referenceValue, other.referenceValue)
        && Objects.equal(referenceUnitId, other.referenceUnitId)
        && Objects.equal(quantityKindId, other.quantityKindId)
        && Objects.equal(displayValue, other.displayValue)
        && displayCode.equals(other.displayCode)
        && displayUnitId.equals(other.displayUnitId);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(referenceValue, referenceUnitId, quantityKindId, displayValue,
        displayCode, displayUnitId);
  }

  @Override
  public String toString() {
    return String.format("%s %s (= %s %s)", displayValue, displayCode, referenceValue,
        referenceUnitId);
  }
}
