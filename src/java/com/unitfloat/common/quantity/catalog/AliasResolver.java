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

package com.unitfloat.common.quantity.catalog;

import java.util.Map;

import javax.annotation.Nullable;

/**
 * Maps the unit tokens users and labels carry to catalog unit identifiers.
 */
public interface AliasResolver {

  /**
   * Extracts a unit token from a free text field label such as {@code "Current (mA)"}.
   *
   * @param label the label, may be {@code null}.
   * @return the token, or {@code null} if the label names no unit.
   */
  @Nullable
  String tokenFromLabel(@Nullable String label);

  /**
   * Resolves a unit token against a table of display codes.
   *
   * @param token the token to resolve, may be {@code null}.
   * @param identifiersByCode unit identifiers keyed by display code.
   * @return the identifier of the matching unit, or {@code null} if none matches.
   */
  @Nullable
  String resolve(@Nullable String token, Map<String, String> identifiersByCode);
}
