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

package com.unitfloat.common.base;

import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import org.junit.Test;

import com.unitfloat.common.base.Either.Transformer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EitherTest {

  private static final Function<CharSequence, Integer> LENGTH =
      new Function<CharSequence, Integer>() {
        @Override public Integer apply(CharSequence item) {
          return item.length();
        }
      };

  private static final Function<String, Either<String, Integer>> PARSE =
      new Function<String, Either<String, Integer>>() {
        @Override public Either<String, Integer> apply(String item) {
          try {
            return Either.right(Integer.valueOf(item));
          } catch (NumberFormatException e) {
            return Either.left("not a number: " + item);
          }
        }
      };

  @Test
  public void testLeft() {
    Either<String, Integer> left = Either.left("broken");
    assertTrue(left.isLeft());
    assertFalse(left.isRight());
    assertEquals("broken", left.getLeft());
    assertFalse(left.right().isPresent());
  }

  @Test
  public void testRight() {
    Either<String, Integer> right = Either.right(7);
    assertTrue(right.isRight());
    assertEquals(Integer.valueOf(7), right.getRight());
    assertFalse(right.left().isPresent());
  }

  @Test
  public void testGetWrongSide() {
    try {
      Either.<String, Integer>right(1).getLeft();
      fail("Expected a right to have no left");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test
  public void testMapRight() {
    assertEquals(Either.<String, Integer>right(4),
        Either.<String, String>right("jake").mapRight(LENGTH));

    Either<String, String> left = Either.left("broken");
    assertSame(left, left.mapRight(LENGTH));
  }

  @Test
  public void testFlatMapRight() {
    assertEquals(Either.<String, Integer>right(42),
        Either.<String, String>right("42").flatMapRight(PARSE));
    assertEquals(Either.<String, Integer>left("not a number: x"),
        Either.<String, String>right("x").flatMapRight(PARSE));
    assertEquals(Either.<String, Integer>left("first"),
        Either.<String, String>left("first").flatMapRight(PARSE));
  }

  @Test
  public void testTransformer() {
    ImmutableList<Either<String, String>> results = ImmutableList.of(
        Either.<String, String>left("jack"),
        Either.<String, String>right("jane"),
        Either.<String, String>left("jill"));
    assertEquals(ImmutableList.of("jackjack", "4", "jilljill"),
        ImmutableList.copyOf(Iterables.transform(results,
            new Transformer<String, String, String>() {
              @Override public String mapLeft(String left) {
                return left + left;
              }
              @Override public String mapRight(String right) {
                return String.valueOf(right.length());
              }
            })));
  }

  @Test
  public void testEqualsAndToString() {
    assertEquals(Either.left("a"), Either.left("a"));
    assertFalse(Either.left("a").equals(Either.right("a")));
    assertEquals(Either.right("a").hashCode(), Either.right("a").hashCode());
    assertEquals("Left(a)", Either.left("a").toString());
    assertEquals("Right(a)", Either.right("a").toString());
  }
}
