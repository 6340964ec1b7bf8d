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

import com.google.common.base.Preconditions;

/**
 * Thrown by the exception flavored conversion entry points in place of returning a
 * {@link ConversionFailure}.
 */
public class ConversionException extends Exception {

  private final ConversionFailure failure;

  public ConversionException(ConversionFailure failure) {
    super(Preconditions.checkNotNull(failure).toString());
    this.failure = failure;
  }

  public ConversionFailure getFailure() {
    return failure;
  }

  public ConversionFailure.Kind getKind() {
    return failure.getKind();
  }
}
