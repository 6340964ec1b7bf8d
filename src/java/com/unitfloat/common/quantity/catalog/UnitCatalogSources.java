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

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import com.google.common.base.Preconditions;
import com.google.common.io.Files;
import com.google.common.io.Resources;

/**
 * Stock {@link UnitCatalogSource}s.  Catalog text is always read as UTF-8.
 */
public final class UnitCatalogSources {

  private UnitCatalogSources() {
    // utility
  }

  /**
   * Returns a source that reads catalogs from classpath resources, resolved against the context
   * class loader.
   */
  public static UnitCatalogSource classpath() {
    return new UnitCatalogSource() {
      @Override public Reader open(String location) throws IOException {
        String resource = location.startsWith("/") ? location.substring(1) : location;
        URL url = Thread.currentThread().getContextClassLoader().getResource(resource);
        if (url == null) {
          throw new FileNotFoundException("No catalog resource at " + location);
        }
        return Resources.asCharSource(url, StandardCharsets.UTF_8).openStream();
      }

      @Override public String toString() {
        return "classpath";
      }
    };
  }

  /**
   * Returns a source that treats locations as URLs.
   */
  public static UnitCatalogSource urls() {
    return new UnitCatalogSource() {
      @Override public Reader open(String location) throws IOException {
        return Resources.asCharSource(new URL(location), StandardCharsets.UTF_8).openStream();
      }

      @Override public String toString() {
        return "urls";
      }
    };
  }

  /**
   * Returns a source that treats locations as paths relative to {@code baseDir}, or absolute paths.
   */
  public static UnitCatalogSource files(final File baseDir) {
    Preconditions.checkNotNull(baseDir);
    return new UnitCatalogSource() {
      @Override public Reader open(String location) throws IOException {
        File file = new File(location);
        if (!file.isAbsolute()) {
          file = new File(baseDir, location);
        }
        return Files.asCharSource(file, StandardCharsets.UTF_8).openStream();
      }

      @Override public String toString() {
        return "files(" + baseDir + ")";
      }
    };
  }
}
