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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.testing.EqualsTester;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RationalTest {

  @Test
  public void testNormalization() {
    Rational r = Rational.of(6, -8);
    assertEquals(BigInteger.valueOf(-3), r.getNumerator());
    assertEquals(BigInteger.valueOf(4), r.getDenominator());

    assertSame(Rational.ZERO, Rational.of(0, -7));
    assertEquals(BigInteger.ONE, Rational.of(0, 5).getDenominator());
    assertEquals(Rational.of(1, 2), Rational.of(BigInteger.valueOf(-50), BigInteger.valueOf(-100)));
  }

  @Test
  public void testNormalizationIdempotent() {
    Rational r = Rational.of(-84, 126);
    assertEquals(r, Rational.of(r.getNumerator(), r.getDenominator()));
    assertEquals(r, Rationals.normalize(r));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroDenominator() {
    Rational.of(1, 0);
  }

  @Test
  public void testEquals() {
    new EqualsTester()
        .addEqualityGroup(Rational.ZERO, Rational.of(0), Rational.of(0, 3))
        .addEqualityGroup(Rational.ONE, Rational.of(1), Rational.of(7, 7))
        .addEqualityGroup(Rational.of(1, 3), Rational.of(-2, -6))
        .addEqualityGroup(Rational.of(-1, 3), Rational.of(1, -3))
        .testEquals();
  }

  @Test
  public void testAdd() {
    assertEquals(Rational.of(5, 6), Rational.of(1, 2).add(Rational.of(1, 3)));
    assertEquals(Rational.ONE, Rational.of(1, 3).add(Rational.of(2, 3)));
    assertEquals(Rational.of(-1, 6), Rational.of(1, 3).add(Rational.of(-1, 2)));
    assertEquals(Rational.of(2, 7), Rational.ZERO.add(Rational.of(2, 7)));
  }

  @Test
  public void testSubtract() {
    assertEquals(Rational.of(1, 6), Rational.of(1, 2).subtract(Rational.of(1, 3)));
    assertEquals(Rational.ZERO, Rational.of(3, 4).subtract(Rational.of(6, 8)));
  }

  @Test
  public void testMultiply() {
    assertEquals(Rational.of(1, 3), Rational.of(2, 3).multiply(Rational.of(1, 2)));
    assertEquals(Rational.of(-5, 9), Rational.of(5, 3).multiply(Rational.of(-1, 3)));
    assertSame(Rational.ZERO, Rational.of(99, 7).multiply(Rational.ZERO));
  }

  @Test
  public void testDivide() {
    assertEquals(Rational.of(4, 3), Rational.of(2, 3).divide(Rational.of(1, 2)));
    assertEquals(Rational.of(-9, 5), Rational.of(3, 5).divide(Rational.of(-1, 3)));
    assertSame(Rational.ZERO, Rational.ZERO.divide(Rational.ZERO));
  }

  @Test
  public void testDivideByZero() {
    try {
      Rational.ONE.divide(Rational.ZERO);
      fail("Expected division by zero to fail");
    } catch (Rational.DivisionByZeroException e) {
      // expected
    }
    try {
      Rational.ZERO.reciprocal();
      fail("Expected zero to have no reciprocal");
    } catch (ArithmeticException e) {
      // expected
    }
  }

  @Test
  public void testInverseOperations() {
    Rational a = Rational.of(-17, 12);
    Rational b = Rational.of(5, 9);
    assertEquals(a, a.add(b).subtract(b));
    assertEquals(a, a.multiply(b).divide(b));
    assertEquals(a, a.reciprocal().reciprocal());
  }

  @Test
  public void testPredicates() {
    assertTrue(Rational.ZERO.isZero());
    assertTrue(Rational.of(8, 4).isInteger());
    assertFalse(Rational.of(8, 3).isInteger());
    assertEquals(-1, Rational.of(-1, 9).signum());
    assertEquals(Rational.of(1, 9), Rational.of(-1, 9).abs());
    assertEquals(Rational.of(1, 9), Rational.of(-1, 9).negate());
  }

  @Test
  public void testOrdering() {
    assertEquals(
        ImmutableList.of(Rational.of(-1), Rational.of(1, 3), Rational.of(1, 2), Rational.of(2)),
        Ordering.natural().sortedCopy(ImmutableList.of(
            Rational.of(1, 2), Rational.of(2), Rational.of(-1), Rational.of(1, 3))));
    assertEquals(0, Rational.of(2, 4).compareTo(Rational.of(1, 2)));
  }

  @Test
  public void testNumberViews() {
    assertEquals(0.5, Rational.of(1, 2).doubleValue(), 0);
    assertEquals(0.1 + 0.2, Rational.of(30000000000000004L, 100000000000000000L).doubleValue(), 0);
    assertEquals(-2L, Rational.of(-7, 3).longValue());
    assertEquals(3, Rational.of(10, 3).intValue());
    assertEquals(new BigDecimal("0.333"), Rational.of(1, 3).toBigDecimal(new MathContext(3)));
  }

  @Test
  public void testStringForms() {
    assertEquals("5/9", Rational.of(5, 9).toFractionString());
    assertEquals("-4", Rational.of(-8, 2).toFractionString());
    assertEquals("1.5", Rational.of(3, 2).toString());
    assertEquals("0", Rational.ZERO.toString());
  }

  @Test
  public void testNullTolerantHelpers() {
    assertEquals(Rational.of(1, 2), Rationals.add(null, Rational.of(1, 2)));
    assertEquals(Rational.of(1, 2), Rationals.add(Rational.of(1, 2), null));
    assertTrue(Rationals.isZero(Rational.ZERO));
    assertEquals(Rational.of(-3, 4),
        Rationals.normalize(BigInteger.valueOf(3), BigInteger.valueOf(-4)));
  }
}
