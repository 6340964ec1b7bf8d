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

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import com.unitfloat.common.base.Closure;
import com.unitfloat.common.base.Either;
import com.unitfloat.common.quantity.ConversionFailure;
import com.unitfloat.common.quantity.ConversionFailure.Kind;
import com.unitfloat.common.quantity.Rational;
import com.unitfloat.common.quantity.RationalFormatter;
import com.unitfloat.common.quantity.RationalParser;
import com.unitfloat.common.quantity.Unit;
import com.unitfloat.common.quantity.UnitConversions;
import com.unitfloat.common.quantity.catalog.AliasResolver;
import com.unitfloat.common.quantity.catalog.UnitCatalog;

/**
 * The state behind a numeric input paired with a unit selector.  The field is bound to the unit
 * named in its label and offers every unit of the same family; values are entered in whichever
 * unit is selected and saved in the family's reference unit.  Switching units keeps the quantity
 * and rewrites the displayed value, exactly, in the new unit.
 *
 * <p>Rendering is left to the caller: the field exposes the display text, the available units and
 * the last error message for a presentation layer to show, and never touches any UI itself.
 *
 * <p>A field belongs to one UI session and is not thread-safe.
 */
public class QuantityField {

  private static final Logger LOG = Logger.getLogger(QuantityField.class.getName());

  private final Unit baseUnit;
  private final ImmutableMap<String, Unit> availableUnits;
  private final ImmutableMap<String, String> identifiersByCode;
  private final AliasResolver resolver;
  private final RationalFormatter formatter;
  private final List<Closure<SavePayload>> saveListeners = Lists.newArrayList();

  private Unit currentUnit;
  @Nullable private Rational displayValue;
  @Nullable private String savedReferenceText;
  @Nullable private String lastError;
  private boolean destroyed = false;

  private QuantityField(Unit baseUnit, List<Unit> units, AliasResolver resolver,
      RationalFormatter formatter) {
    this.baseUnit = baseUnit;
    this.currentUnit = baseUnit;
    this.resolver = resolver;
    this.formatter = formatter;

    Map<String, Unit> byIdentifier = Maps.newLinkedHashMap();
    Map<String, String> byCode = Maps.newLinkedHashMap();
    for (Unit unit : units) {
      byIdentifier.put(unit.getIdentifier(), unit);
      if (!byCode.containsKey(unit.getDisplayCode())) {
        byCode.put(unit.getDisplayCode(), unit.getIdentifier());
      }
    }
    this.availableUnits = ImmutableMap.copyOf(byIdentifier);
    this.identifiersByCode = ImmutableMap.copyOf(byCode);
  }

  /**
   * Creates a field showing a zero reference value in the unit named by {@code label}.
   *
   * @see #create(UnitCatalog, String, Rational, AliasResolver, RationalFormatter)
   */
  public static QuantityField create(UnitCatalog catalog, String label, AliasResolver resolver) {
    return create(catalog, label, Rational.ZERO, resolver, RationalFormatter.DEFAULT);
  }

  /**
   * Creates a field bound to the unit named by {@code label}.
   *
   * @param catalog the units to choose from.
   * @param label a field label naming its unit, such as {@code "Current (mA)"}.
   * @param initialReference the initial value in the reference unit, or {@code null} to start
   *     empty.
   * @param resolver resolves the label's unit token against the catalog.
   * @param formatter renders display values.
   * @return a new field with the label's unit selected.
   * @throws IllegalArgumentException if the label names no unit.
   * @throws IllegalStateException if the named unit is missing from the catalog or is logarithmic.
   */
  public static QuantityField create(UnitCatalog catalog, String label,
      @Nullable Rational initialReference, AliasResolver resolver, RationalFormatter formatter) {
    Preconditions.checkNotNull(catalog);
    Preconditions.checkNotNull(resolver);
    Preconditions.checkNotNull(formatter);

    String token = resolver.tokenFromLabel(label);
    Preconditions.checkArgument(token != null,
        "Unable to detect UCUM unit token from label: %s", label);

    String baseIdentifier = resolver.resolve(token, catalog.getAliases());
    Optional<Unit> base = baseIdentifier == null
        ? Optional.<Unit>absent()
        : catalog.getUnit(baseIdentifier);
    Preconditions.checkState(base.isPresent(),
        "Base unit \"%s\" is not available in the units map.", token);
    Preconditions.checkState(!base.get().isLogarithmic(),
        "Logarithmic units are not supported: %s", token);

    List<Unit> compatible = catalog.compatibleUnits(base.get());
    QuantityField field = new QuantityField(base.get(), compatible, resolver, formatter);
    if (initialReference != null) {
      Either<ConversionFailure, Rational> display =
          UnitConversions.fromReference(initialReference, base.get());
      if (display.isRight()) {
        field.displayValue = display.getRight();
        field.savedReferenceText = formatter.toDecimalString(initialReference);
      } else {
        field.fail(display.getLeft());
      }
    }
    return field;
  }

  public Unit getBaseUnit() {
    return baseUnit;
  }

  public Unit getDisplayUnit() {
    return currentUnit;
  }

  /**
   * Returns the units this field can display, the family's reference unit first.
   */
  public List<Unit> getAvailableUnits() {
    return ImmutableList.copyOf(availableUnits.values());
  }

  /**
   * Returns the text the numeric input should show; empty when there is no value.
   */
  public String getDisplayText() {
    return formatter.toDecimalString(getDisplayValue());
  }

  /**
   * Returns the exact value in the current display unit.  The display text may be rounded, this
   * value never is.
   */
  @Nullable
  public Rational getDisplayValue() {
    return destroyed ? null : displayValue;
  }

  /**
   * Replaces the displayed value.  Text that is not a number clears the field.
   *
   * @param text the new value in the current display unit, may be {@code null} or empty.
   */
  public void setDisplayValue(@Nullable String text) {
    ensureUsable();
    displayValue = RationalParser.parse(text);
  }

  public void setDisplayValue(Rational value) {
    ensureUsable();
    displayValue = Preconditions.checkNotNull(value);
  }

  /**
   * Switches the display unit, rewriting the displayed value so the quantity is unchanged.
   *
   * @param identifier the catalog identifier of the new unit.
   * @return the reason the switch failed, absent if it happened.  When the target is unavailable or
   *     not convertible the previous unit stays selected; when the value itself cannot be
   *     converted the target unit is selected and the value is cleared.
   */
  public Optional<ConversionFailure> changeUnit(String identifier) {
    ensureUsable();
    Unit target = availableUnits.get(identifier);
    if (target == null) {
      return fail(ConversionFailure.of(Kind.INCOMPATIBLE_UNITS,
          "Unsupported unit for this quantity kind: %s", identifier));
    }
    Optional<ConversionFailure> notConvertible =
        UnitConversions.checkConvertible(currentUnit, target);
    if (notConvertible.isPresent()) {
      return fail(notConvertible.get());
    }

    Unit previous = currentUnit;
    currentUnit = target;
    if (displayValue == null) {
      clearError();
      return Optional.absent();
    }
    Either<ConversionFailure, Rational> converted =
        UnitConversions.convert(displayValue, previous, target);
    if (converted.isLeft()) {
      displayValue = null;
      return fail(converted.getLeft());
    }
    displayValue = converted.getRight();
    clearError();
    return Optional.absent();
  }

  /**
   * Switches the display unit to the one with the given display code.
   *
   * @throws IllegalArgumentException if no available unit has that code.
   */
  public Optional<ConversionFailure> setDisplayUnit(String displayCode) {
    ensureUsable();
    String identifier = resolver.resolve(displayCode, identifiersByCode);
    Preconditions.checkArgument(identifier != null,
        "UCUM code not available for this field: %s", displayCode);
    return changeUnit(identifier);
  }

  /**
   * Returns the displayed value carried to the reference unit.
   *
   * @return the reference value, or {@code null} if the field is empty or destroyed.
   */
  @Nullable
  public Rational getReferenceValue() {
    Rational value = getDisplayValue();
    if (value == null) {
      return null;
    }
    Either<ConversionFailure, Rational> reference = UnitConversions.toReference(value, currentUnit);
    return reference.isRight() ? reference.getRight() : null;
  }

  /**
   * Returns the reference value stored by the last save, as a canonical decimal string.
   */
  @Nullable
  public String getSavedReferenceText() {
    return savedReferenceText;
  }

  /**
   * Registers a listener to receive every successful save.
   */
  public void addSaveListener(Closure<SavePayload> listener) {
    ensureUsable();
    saveListeners.add(Preconditions.checkNotNull(listener));
  }

  /**
   * Converts the displayed value to the reference unit, records it as saved and notifies the save
   * listeners.  An empty field saves an empty payload.
   *
   * @return the saved payload, or the reason the value could not be converted.
   */
  public Either<ConversionFailure, SavePayload> save() {
    ensureUsable();
    String referenceText = null;
    String displayText = null;
    if (displayValue != null) {
      Either<ConversionFailure, Rational> reference =
          UnitConversions.toReference(displayValue, currentUnit);
      if (reference.isLeft()) {
        fail(reference.getLeft());
        return Either.left(reference.getLeft());
      }
      referenceText = formatter.toDecimalString(reference.getRight());
      displayText = formatter.toDecimalString(displayValue);
    }

    savedReferenceText = referenceText;
    SavePayload payload = new SavePayload(referenceText, currentUnit.getReferenceId(),
        currentUnit.getQuantityKindId(), displayText, currentUnit.getDisplayCode(),
        currentUnit.getIdentifier());
    for (Closure<SavePayload> listener : ImmutableList.copyOf(saveListeners)) {
      listener.execute(payload);
    }
    clearError();
    return Either.right(payload);
  }

  /**
   * Returns the message of the last refused operation, absent once a later one succeeds.
   */
  public Optional<String> getLastError() {
    return Optional.fromNullable(lastError);
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  /**
   * Releases the listeners.  Any further mutation of the field throws.
   */
  public void destroy() {
    if (destroyed) {
      return;
    }
    destroyed = true;
    saveListeners.clear();
  }

  private void ensureUsable() {
    Preconditions.checkState(!destroyed, "Quantity field has been destroyed.");
  }

  private Optional<ConversionFailure> fail(ConversionFailure failure) {
    LOG.fine("Quantity field in " + currentUnit + " refused: " + failure);
    lastError = failure.getMessage();
    return Optional.of(failure);
  }

  private void clearError() {
    lastError = null;
  }
}
