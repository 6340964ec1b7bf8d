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

import java.io.IOException;
import java.io.Reader;

/**
 * Opens the raw JSON text of a unit catalog.  How a location is interpreted, a classpath resource,
 * a file or a URL, is up to the implementation.
 */
public interface UnitCatalogSource {

  /**
   * Opens the catalog stored at {@code location}.  The caller closes the returned reader.
   *
   * @param location where the catalog is stored.
   * @return a reader over the catalog's JSON text.
   * @throws IOException if the catalog cannot be opened.
   */
  Reader open(String location) throws IOException;
}
