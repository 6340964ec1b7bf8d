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

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Objects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

/**
 * A value of one of two possible types.
 *
 * <p>Conversions use Either in place of exception flow control: the left type represents the
 * failure and the right type the successful result.
 *
 * @param <L> The left (failure) type.
 * @param <R> The right (success) type.
 */
public final class Either<L, R> {
  private final Optional<L> left;
  private final Optional<R> right;

  private Either(Optional<L> left, Optional<R> right) {
    this.left = left;
    this.right = right;
  }

  public Optional<L> left() {
    return left;
  }

  public Optional<R> right() {
    return right;
  }

  public boolean isLeft() {
    return left.isPresent();
  }

  public boolean isRight() {
    return right.isPresent();
  }

  /**
   * Returns the underlying value if this is a left; otherwise, throws.
   *
   * @throws IllegalStateException if this is a right instance.
   */
  public L getLeft() {
    return left.get();
  }

  /**
   * Returns the underlying value if this is a right; otherwise, throws.
   *
   * @throws IllegalStateException if this is a left instance.
   */
  public R getRight() {
    return right.get();
  }

  /**
   * If this is a right, maps its value into a new right; otherwise just returns this left.
   *
   * @param transformer The transformation to apply to the right value.
   * @param <M> The type a right value will be mapped to.
   * @return The mapped right or else the left.
   */
  public <M> Either<L, M> mapRight(Function<? super R, M> transformer) {
    if (isRight()) {
      return right(transformer.apply(getRight()));
    } else {
      @SuppressWarnings("unchecked") // I am a left so my right is never accessible
      Either<L, M> self = (Either<L, M>) this;
      return self;
    }
  }

  /**
   * If this is a right, feeds its value to a step that may itself fail; otherwise just returns
   * this left.  Chains of such steps stop at the first failure.
   *
   * @param step The next step to run against the right value.
   * @param <M> The type of the next step's right value.
   * @return The result of {@code step} or else this left.
   */
  public <M> Either<L, M> flatMapRight(Function<? super R, Either<L, M>> step) {
    if (isRight()) {
      return Preconditions.checkNotNull(step.apply(getRight()));
    } else {
      @SuppressWarnings("unchecked") // I am a left so my right is never accessible
      Either<L, M> self = (Either<L, M>) this;
      return self;
    }
  }

  /**
   * Can transform either a left or a right into a result.
   *
   * @param <L> The left type.
   * @param <R> The right type.
   * @param <T> The transformation result type.
   */
  public abstract static class Transformer<L, R, T> implements Function<Either<L, R>, T> {

    public abstract T mapLeft(L left);

    public abstract T mapRight(R right);

    @Override
    public final T apply(Either<L, R> either) {
      return either.map(this);
    }
  }

  /**
   * Transforms this either instance to a value regardless of whether it is a left or a right.
   *
   * @param transformer The transformer to map this either instance.
   * @param <T> The type the transformer produces.
   * @return A value mapped by the transformer from this left or right instance.
   */
  public <T> T map(Transformer<? super L, ? super R, T> transformer) {
    if (isLeft()) {
      return transformer.mapLeft(getLeft());
    } else {
      return transformer.mapRight(getRight());
    }
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof Either)) {
      return false;
    }
    Either<?, ?> other = (Either<?, ?>) o;
    return Objects.equal(left, other.left)
        && Objects.equal(right, other.right);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(left, right);
  }

  @Override
  public String toString() {
    if (isLeft()) {
      return String.format("Left(%s)", getLeft());
    } else {
      return String.format("Right(%s)", getRight());
    }
  }

  /**
   * Creates a left either instance.
   *
   * @param value The left value to wrap - may not be null.
   */
  public static <L, R> Either<L, R> left(L value) {
    return new Either<L, R>(Optional.of(value), Optional.<R>absent());
  }

  /**
   * Creates a right either instance.
   *
   * @param value The right value to wrap - may not be null.
   */
  public static <L, R> Either<L, R> right(R value) {
    return new Either<L, R>(Optional.<L>absent(), Optional.of(value));
  }
}
