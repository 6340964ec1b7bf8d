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

package com.unitfloat.common.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import com.google.common.base.Preconditions;
import com.google.common.io.Closeables;

import org.apache.commons.lang.StringUtils;

import com.unitfloat.common.base.MorePreconditions;
import com.unitfloat.common.quantity.RationalFormatter;
import com.unitfloat.common.quantity.catalog.UnitCatalogCache;
import com.unitfloat.common.quantity.catalog.UnitCatalogParser;
import com.unitfloat.common.quantity.catalog.UnitCatalogSource;

/**
 * Settings for formatting and catalog loading, read from a properties resource on the classpath.
 * By default the resource is looked up at /unitfloat.properties; the path can be overridden with
 * the system property {@link #CONFIG_RESOURCE_PATH unitfloat.config.resource}.  A missing resource
 * leaves every setting at its default, and any setting can be overridden by a system property of
 * the same name.
 */
public final class UnitFloatConfig {

  public static final String CONFIG_RESOURCE_PATH = "unitfloat.config.resource";
  public static final String DEFAULT_RESOURCE = "/unitfloat.properties";

  public static final String MAX_FRACTION_DIGITS = "unitfloat.format.maxFractionDigits";
  public static final String CATALOG_LOCATION = "unitfloat.catalog.location";
  public static final String CATALOG_STRICT = "unitfloat.catalog.strict";

  public static final String DEFAULT_CATALOG_LOCATION = "units.ucum.json";

  private static final int MAX_FRACTION_DIGITS_LIMIT = 1000;

  private final int maxFractionDigits;
  private final String catalogLocation;
  private final boolean catalogStrict;

  private UnitFloatConfig(int maxFractionDigits, String catalogLocation, boolean catalogStrict) {
    this.maxFractionDigits = maxFractionDigits;
    this.catalogLocation = catalogLocation;
    this.catalogStrict = catalogStrict;
  }

  /**
   * Loads the configuration resource and applies system property overrides.
   *
   * @throws IOException if the resource exists but cannot be read.
   * @throws IllegalArgumentException if a setting holds an invalid value.
   */
  public static UnitFloatConfig load() throws IOException {
    String resourcePath = System.getProperty(CONFIG_RESOURCE_PATH, DEFAULT_RESOURCE);
    Properties properties = new Properties();
    InputStream config = UnitFloatConfig.class.getResourceAsStream(resourcePath);
    if (config != null) {
      try {
        properties.load(config);
      } finally {
        Closeables.closeQuietly(config);
      }
    }
    for (String key : new String[] {MAX_FRACTION_DIGITS, CATALOG_LOCATION, CATALOG_STRICT}) {
      String override = System.getProperty(key);
      if (override != null) {
        properties.setProperty(key, override);
      }
    }
    return fromProperties(properties);
  }

  /**
   * Reads the configuration from {@code properties} alone.
   *
   * @throws IllegalArgumentException if a setting holds an invalid value.
   */
  public static UnitFloatConfig fromProperties(Properties properties) {
    Preconditions.checkNotNull(properties);

    int maxFractionDigits = RationalFormatter.DEFAULT_MAX_FRACTION_DIGITS;
    String digits = StringUtils.trimToNull(properties.getProperty(MAX_FRACTION_DIGITS));
    if (digits != null) {
      try {
        maxFractionDigits = Integer.parseInt(digits);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Failed to parse " + MAX_FRACTION_DIGITS + ": " + digits, e);
      }
    }
    MorePreconditions.checkArgumentRange(maxFractionDigits, 0, MAX_FRACTION_DIGITS_LIMIT,
        MAX_FRACTION_DIGITS + " out of range: %s");

    String location = StringUtils.defaultIfBlank(
        properties.getProperty(CATALOG_LOCATION), DEFAULT_CATALOG_LOCATION).trim();

    String strict = StringUtils.trimToNull(properties.getProperty(CATALOG_STRICT));
    Preconditions.checkArgument(strict == null
        || "true".equalsIgnoreCase(strict) || "false".equalsIgnoreCase(strict),
        "%s must be true or false: %s", CATALOG_STRICT, strict);

    return new UnitFloatConfig(maxFractionDigits, location, Boolean.parseBoolean(strict));
  }

  public int getMaxFractionDigits() {
    return maxFractionDigits;
  }

  public String getCatalogLocation() {
    return catalogLocation;
  }

  public boolean isCatalogStrict() {
    return catalogStrict;
  }

  public RationalFormatter newFormatter() {
    return maxFractionDigits == RationalFormatter.DEFAULT_MAX_FRACTION_DIGITS
        ? RationalFormatter.DEFAULT
        : new RationalFormatter(maxFractionDigits);
  }

  public UnitCatalogParser newCatalogParser() {
    return UnitCatalogParser.builder().strict(catalogStrict).build();
  }

  public UnitCatalogCache newCatalogCache(UnitCatalogSource source) {
    return new UnitCatalogCache(source, newCatalogParser());
  }

  @Override
  public String toString() {
    return String.format("UnitFloatConfig(maxFractionDigits: %d, catalog: %s, strict: %s)",
        maxFractionDigits, catalogLocation, catalogStrict);
  }
}
