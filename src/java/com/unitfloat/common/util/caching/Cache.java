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

package com.unitfloat.common.util.caching;

import javax.annotation.Nullable;

/**
 * A store of values that are expensive to resolve, such as parsed unit catalogs.  Keys and values
 * are never {@code null}, and a value is only stored once it is completely built, so a reader
 * either finds nothing or finds a finished value.
 *
 * @param <K> The key type, typically the location a value was resolved from.
 * @param <V> The resolved value type.
 */
public interface Cache<K, V> {

  /**
   * Looks up a resolved value without resolving it.
   *
   * @return the value stored under {@code key}, or {@code null} if nothing is stored yet.
   */
  @Nullable
  V get(K key);

  /**
   * Stores a resolved value, replacing any value already stored under {@code key}.
   */
  void put(K key, V value);

  /**
   * Drops the value stored under {@code key} so the next lookup resolves it afresh.
   */
  void delete(K key);
}
