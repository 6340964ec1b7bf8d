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

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.Before;
import org.junit.Test;

import com.unitfloat.common.base.Closure;
import com.unitfloat.common.base.Either;
import com.unitfloat.common.quantity.ConversionFailure;
import com.unitfloat.common.quantity.ConversionFailure.Kind;
import com.unitfloat.common.quantity.Rational;
import com.unitfloat.common.quantity.RationalFormatter;
import com.unitfloat.common.quantity.RationalParser;
import com.unitfloat.common.quantity.Unit;
import com.unitfloat.common.quantity.catalog.UcumAliasResolver;
import com.unitfloat.common.quantity.catalog.UnitCatalog;
import com.unitfloat.common.quantity.catalog.UnitCatalogCache;
import com.unitfloat.common.quantity.catalog.UnitCatalogParser;
import com.unitfloat.common.quantity.catalog.UnitCatalogSources;
import com.unitfloat.common.testing.easymock.EasyMockTest;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class QuantityFieldTest extends EasyMockTest {

  private static final String CATALOG = "com/unitfloat/common/quantity/catalog/units.ucum.json";

  private UnitCatalog catalog;
  private UcumAliasResolver resolver;

  @Before
  public void setUp() throws Exception {
    catalog = new UnitCatalogCache(UnitCatalogSources.classpath(),
        UnitCatalogParser.builder().build()).load(CATALOG);
    resolver = new UcumAliasResolver();
  }

  private QuantityField field(String label, String initialReference) {
    return QuantityField.create(catalog, label, RationalParser.parse(initialReference), resolver,
        RationalFormatter.DEFAULT);
  }

  private static List<String> codes(List<Unit> units) {
    List<String> codes = Lists.newArrayList();
    for (Unit unit : units) {
      codes.add(unit.getDisplayCode());
    }
    return codes;
  }

  @Test
  public void testCreate() {
    control.replay();

    QuantityField current = QuantityField.create(catalog, "Current (mA)", resolver);
    assertEquals("unit:MilliA", current.getBaseUnit().getIdentifier());
    assertEquals(current.getBaseUnit(), current.getDisplayUnit());
    assertEquals("0", current.getDisplayText());
    assertEquals(ImmutableList.of("A", "kA", "mA", "uA"), codes(current.getAvailableUnits()));
    assertFalse(current.getLastError().isPresent());
  }

  @Test
  public void testInitialReferenceIsShownInBaseUnit() {
    control.replay();

    QuantityField temperature = field("Temperature ([degF])", "273.15");
    assertEquals("32", temperature.getDisplayText());
    assertEquals(Rational.of(32), temperature.getDisplayValue());
    assertEquals("273.15", temperature.getSavedReferenceText());

    QuantityField empty = QuantityField.create(catalog, "Temperature ([degF])", null, resolver,
        RationalFormatter.DEFAULT);
    assertEquals("", empty.getDisplayText());
    assertNull(empty.getDisplayValue());
    assertNull(empty.getReferenceValue());
  }

  @Test
  public void testCreateFailures() {
    control.replay();

    try {
      QuantityField.create(catalog, "???", resolver);
      fail("Expected a label without a unit to be rejected");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      QuantityField.create(catalog, "Weight (lb)", resolver);
      fail("Expected a unit missing from the catalog to be rejected");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("\"lb\""));
    }
    try {
      QuantityField.create(catalog, "Level (dB)", resolver);
      fail("Expected a logarithmic unit to be rejected");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test
  public void testChangeUnitKeepsQuantity() {
    control.replay();

    QuantityField current = field("Current (mA)", "0");
    current.setDisplayValue("10");
    assertEquals(Rational.of(1, 100), current.getReferenceValue());

    assertFalse(current.changeUnit("unit:A").isPresent());
    assertEquals("0.01", current.getDisplayText());
    assertEquals("unit:A", current.getDisplayUnit().getIdentifier());

    assertFalse(current.changeUnit("unit:MicroA").isPresent());
    assertEquals("10000", current.getDisplayText());

    assertFalse(current.changeUnit("unit:MilliA").isPresent());
    assertEquals("10", current.getDisplayText());
  }

  @Test
  public void testAffineRoundTrip() {
    control.replay();

    QuantityField temperature = field("Temperature ([degF])", "273.15");
    assertFalse(temperature.changeUnit("unit:DEG_C").isPresent());
    assertEquals("0", temperature.getDisplayText());
    assertFalse(temperature.changeUnit("unit:K").isPresent());
    assertEquals("273.15", temperature.getDisplayText());

    temperature.setDisplayValue("1/3");
    assertFalse(temperature.changeUnit("unit:DEG_F").isPresent());
    assertFalse(temperature.changeUnit("unit:K").isPresent());
    assertEquals("0.333333333333333333333333", temperature.getDisplayText());
  }

  @Test
  public void testSetDisplayUnitByCode() {
    control.replay();

    QuantityField current = field("Current (mA)", "0.002");
    assertEquals("2", current.getDisplayText());
    assertFalse(current.setDisplayUnit(UcumAliasResolver.normalizeToken("\u03BCA")).isPresent());
    assertEquals("unit:MicroA", current.getDisplayUnit().getIdentifier());
    assertEquals("2000", current.getDisplayText());

    try {
      current.setDisplayUnit("kg");
      fail("Expected a code outside the field's family to be rejected");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testChangeToUnavailableUnit() {
    control.replay();

    QuantityField current = field("Current (mA)", "0.002");
    Optional<ConversionFailure> failure = current.changeUnit("unit:KiloGM");
    assertTrue(failure.isPresent());
    assertEquals(Kind.INCOMPATIBLE_UNITS, failure.get().getKind());
    assertEquals("unit:MilliA", current.getDisplayUnit().getIdentifier());
    assertEquals("2", current.getDisplayText());
    assertTrue(current.getLastError().isPresent());

    assertTrue(current.changeUnit("unit:Nonexistent").isPresent());

    assertFalse(current.changeUnit("unit:A").isPresent());
    assertFalse(current.getLastError().isPresent());
  }

  @Test
  public void testFailedValueConversionSelectsTargetAndClearsValue() {
    control.replay();

    Unit meter = Unit.builder("unit:M").multiplier(Rational.ONE).referenceId("unit:M")
        .quantityKindId("qk:Length").displayCode("m").build();
    Unit collapsed = Unit.builder("unit:Collapsed").multiplier(Rational.ZERO)
        .referenceId("unit:M").quantityKindId("qk:Length").displayCode("xx").build();
    UnitCatalog lengths = UnitCatalog.builder().add(meter).add(collapsed).build();

    QuantityField length = QuantityField.create(lengths, "Length (m)", Rational.of(3), resolver,
        RationalFormatter.DEFAULT);
    Optional<ConversionFailure> failure = length.changeUnit("unit:Collapsed");
    assertTrue(failure.isPresent());
    assertEquals(Kind.DIVISION_BY_ZERO, failure.get().getKind());
    assertEquals(collapsed, length.getDisplayUnit());
    assertNull(length.getDisplayValue());
    assertEquals("", length.getDisplayText());
    assertTrue(length.getLastError().isPresent());
  }

  @Test
  public void testEmptyValueOnlySwitchesUnit() {
    control.replay();

    QuantityField current = field("Current (mA)", "0");
    current.setDisplayValue("not a number");
    assertEquals("", current.getDisplayText());
    assertFalse(current.changeUnit("unit:KiloA").isPresent());
    assertEquals("", current.getDisplayText());
    assertEquals("unit:KiloA", current.getDisplayUnit().getIdentifier());
  }

  @Test
  public void testSaveNotifiesListeners() {
    Closure<SavePayload> listener = createMock(new Clazz<Closure<SavePayload>>() { });
    SavePayload expected =
        new SavePayload("0.01", "unit:A", "qk:ElectricCurrent", "10", "mA", "unit:MilliA");
    listener.execute(expected);
    control.replay();

    QuantityField current = field("Current (mA)", "0");
    current.addSaveListener(listener);
    current.setDisplayValue(Rational.of(10));

    Either<ConversionFailure, SavePayload> saved = current.save();
    assertTrue(saved.isRight());
    assertEquals(expected, saved.getRight());
    assertEquals("0.01", current.getSavedReferenceText());
  }

  @Test
  public void testSaveEmptyField() {
    control.replay();

    QuantityField current = field("Current (mA)", "5");
    current.setDisplayValue("");
    SavePayload payload = current.save().getRight();
    assertTrue(payload.isEmpty());
    assertNull(payload.getReferenceValue());
    assertNull(payload.getDisplayValue());
    assertEquals("mA", payload.getDisplayCode());
    assertNull(current.getSavedReferenceText());
  }

  @Test
  public void testSaveInNonBaseUnit() {
    control.replay();

    QuantityField temperature = field("Temperature ([degF])", "0");
    temperature.changeUnit("unit:DEG_C");
    temperature.setDisplayValue("-40");
    SavePayload payload = temperature.save().getRight();
    assertEquals("233.15", payload.getReferenceValue());
    assertEquals("unit:K", payload.getReferenceUnitId());
    assertEquals("Cel", payload.getDisplayCode());
    assertEquals("unit:DEG_C", payload.getDisplayUnitId());
  }

  @Test
  public void testDestroy() {
    control.replay();

    QuantityField current = field("Current (mA)", "1");
    current.destroy();
    current.destroy();
    assertTrue(current.isDestroyed());
    assertNull(current.getDisplayValue());
    try {
      current.changeUnit("unit:A");
      fail("Expected a destroyed field to reject changes");
    } catch (IllegalStateException e) {
      // expected
    }
    try {
      current.save();
      fail("Expected a destroyed field to reject saves");
    } catch (IllegalStateException e) {
      // expected
    }
  }
}
