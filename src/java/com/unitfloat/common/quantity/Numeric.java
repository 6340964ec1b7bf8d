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

/**
 * A value as it arrives at the conversion boundary: an already exact {@link Rational}, raw text
 * typed by a user or read from a catalog, or a native floating point number.  All three forms are
 * resolved through {@link RationalParser#parse(Numeric)}.
 */
public abstract class Numeric {

  /**
   * Maps each form of numeric to a result.
   *
   * @param <T> The transformation result type.
   */
  public interface Transformer<T> {
    T mapRational(Rational value);

    T mapText(@Nullable String text);

    T mapDouble(double value);
  }

  private Numeric() {
    // sealed
  }

  public abstract <T> T map(Transformer<T> transformer);

  public static Numeric of(Rational value) {
    return new RationalNumeric(Preconditions.checkNotNull(value));
  }

  /**
   * Wraps raw text.  {@code null} is allowed and stands for a value that is not present.
   */
  public static Numeric text(@Nullable String text) {
    return new TextNumeric(text);
  }

  public static Numeric ofDouble(double value) {
    return new DoubleNumeric(value);
  }

  private static final class RationalNumeric extends Numeric {
    private final Rational value;

    RationalNumeric(Rational value) {
      this.value = value;
    }

    @Override public <T> T map(Transformer<T> transformer) {
      return transformer.mapRational(value);
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof RationalNumeric && value.equals(((RationalNumeric) o).value);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public String toString() {
      return "Rational(" + value.toFractionString() + ")";
    }
  }

  private static final class TextNumeric extends Numeric {
    @Nullable private final String text;

    TextNumeric(@Nullable String text) {
      this.text = text;
    }

    @Override public <T> T map(Transformer<T> transformer) {
      return transformer.mapText(text);
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof TextNumeric && Objects.equal(text, ((TextNumeric) o).text);
    }

    @Override public int hashCode() {
      return Objects.hashCode(text);
    }

    @Override public String toString() {
      return "Text(" + text + ")";
    }
  }

  private static final class DoubleNumeric extends Numeric {
    private final double value;

    DoubleNumeric(double value) {
      this.value = value;
    }

    @Override public <T> T map(Transformer<T> transformer) {
      return transformer.mapDouble(value);
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof DoubleNumeric
          && Double.compare(value, ((DoubleNumeric) o).value) == 0;
    }

    @Override public int hashCode() {
      return Double.valueOf(value).hashCode();
    }

    @Override public String toString() {
      return "Double(" + value + ")";
    }
  }
}
