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

import java.io.Reader;
import java.io.StringReader;
import java.util.Map;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import org.apache.commons.lang.StringUtils;

import com.unitfloat.common.quantity.Rational;
import com.unitfloat.common.quantity.RationalParser;
import com.unitfloat.common.quantity.Unit;

/**
 * Reads a unit catalog from its JSON form: an object keyed by unit identifier whose values
 * describe each unit, for example:
 * <pre>
 * {
 *   "unit:DEG_F": {"qk": "qk:Temperature", "ref": "unit:K", "m": "5/9", "b": "45967/180",
 *                  "ucum": "[degF]", "label": "Degree Fahrenheit"},
 *   ...
 * }
 * </pre>
 * Keys starting with {@code _} carry metadata and are skipped, as are non-object entries and
 * entries without a display code.  The long field names {@code multiplier}, {@code offset},
 * {@code baseUnit}, {@code quantityKind} and {@code ucumCode} are accepted in place of
 * {@code m}, {@code b}, {@code ref}, {@code qk} and {@code ucum}.
 *
 * <p>Multipliers and offsets may be JSON numbers, whose literal text is parsed exactly, strings
 * holding any literal {@link RationalParser} accepts, {@code [numerator, denominator]} arrays or
 * {@code {"numerator": .., "denominator": ..}} objects.  A missing offset means zero.  A missing or
 * unparseable multiplier or an unparseable offset makes the record malformed: a strict parser
 * fails the whole catalog, a lenient one logs and skips the record.
 */
public class UnitCatalogParser {

  private static final Logger LOG = Logger.getLogger(UnitCatalogParser.class.getName());

  private final boolean strict;

  private UnitCatalogParser(boolean strict) {
    this.strict = strict;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private boolean strict = false;

    public Builder strict(boolean strict) {
      this.strict = strict;
      return this;
    }

    public UnitCatalogParser build() {
      return new UnitCatalogParser(strict);
    }
  }

  public boolean isStrict() {
    return strict;
  }

  /**
   * Parses a catalog.
   *
   * @param json the catalog's JSON text.
   * @return the resolved catalog.
   * @throws CatalogException if the text is not a JSON object or, for a strict parser, holds a
   *     malformed record.
   */
  public UnitCatalog parse(Reader json) throws CatalogException {
    Preconditions.checkNotNull(json);
    JsonElement root;
    try {
      root = JsonParser.parseReader(json);
    } catch (JsonParseException e) {
      throw new CatalogException("Unit catalog is not valid JSON", e);
    }
    if (root.isJsonNull()) {
      return UnitCatalog.builder().build();
    }
    if (!root.isJsonObject()) {
      throw new CatalogException("Unit catalog must be a JSON object");
    }

    UnitCatalog.Builder catalog = UnitCatalog.builder();
    int skipped = 0;
    for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject().entrySet()) {
      String identifier = entry.getKey();
      if (identifier.startsWith("_") || !entry.getValue().isJsonObject()) {
        continue;
      }
      Unit unit = parseUnit(identifier, entry.getValue().getAsJsonObject());
      if (unit == null) {
        skipped++;
      } else {
        catalog.add(unit);
      }
    }

    UnitCatalog result = catalog.build();
    if (skipped > 0) {
      LOG.warning(String.format(
          "Skipped %d unit records lacking a display code or valid values, kept %d",
          skipped, result.size()));
    }
    return result;
  }

  public UnitCatalog parse(String json) throws CatalogException {
    return parse(new StringReader(Preconditions.checkNotNull(json)));
  }

  @Nullable
  private Unit parseUnit(String identifier, JsonObject entry) throws CatalogException {
    String displayCode = StringUtils.trimToNull(getString(entry, "ucum", "ucumCode"));
    if (displayCode == null) {
      return null;
    }

    JsonElement rawMultiplier = get(entry, "m", "multiplier");
    Rational multiplier = rawMultiplier == null ? null : parseDecimal(rawMultiplier);
    if (multiplier == null) {
      return malformed(identifier, "missing or invalid multiplier " + rawMultiplier);
    }

    Rational offset = Rational.ZERO;
    JsonElement rawOffset = get(entry, "b", "offset");
    if (rawOffset != null) {
      offset = parseDecimal(rawOffset);
      if (offset == null) {
        return malformed(identifier, "invalid offset " + rawOffset);
      }
    }

    JsonElement log = entry.get("log");
    return Unit.builder(identifier)
        .multiplier(multiplier)
        .offset(offset)
        .referenceId(getString(entry, "ref", "baseUnit"))
        .quantityKindId(getQuantityKind(entry))
        .logarithmic(log != null && log.isJsonPrimitive() && log.getAsJsonPrimitive().isBoolean()
            && log.getAsBoolean())
        .displayCode(displayCode)
        .label(StringUtils.trimToNull(getString(entry, "label")))
        .build();
  }

  @Nullable
  private Unit malformed(String identifier, String problem) throws CatalogException {
    String message = String.format("Malformed unit record %s: %s", identifier, problem);
    if (strict) {
      throw new CatalogException(message);
    }
    LOG.warning(message);
    return null;
  }

  @Nullable
  private static Rational parseDecimal(JsonElement element) {
    if (element.isJsonPrimitive()) {
      JsonPrimitive primitive = element.getAsJsonPrimitive();
      if (primitive.isBoolean()) {
        return null;
      }
      // For numbers this is the literal text from the document, not a double rendering.
      return RationalParser.parse(primitive.getAsString());
    }
    JsonElement numerator = null;
    JsonElement denominator = null;
    if (element.isJsonArray()) {
      JsonArray pair = element.getAsJsonArray();
      if (pair.size() == 2) {
        numerator = pair.get(0);
        denominator = pair.get(1);
      }
    } else if (element.isJsonObject()) {
      numerator = element.getAsJsonObject().get("numerator");
      denominator = element.getAsJsonObject().get("denominator");
    }
    if (numerator == null || denominator == null
        || !numerator.isJsonPrimitive() || !denominator.isJsonPrimitive()) {
      return null;
    }
    Rational top = parseDecimal(numerator);
    Rational bottom = parseDecimal(denominator);
    if (top == null || bottom == null || bottom.isZero()) {
      return null;
    }
    return top.divide(bottom);
  }

  @Nullable
  private static String getQuantityKind(JsonObject entry) {
    JsonElement qk = get(entry, "qk", "quantityKind");
    if (qk != null && qk.isJsonArray()) {
      JsonArray kinds = qk.getAsJsonArray();
      qk = kinds.size() == 0 ? null : kinds.get(0);
    }
    return asString(qk);
  }

  @Nullable
  private static String getString(JsonObject entry, String... names) {
    return asString(get(entry, names));
  }

  @Nullable
  private static JsonElement get(JsonObject entry, String... names) {
    for (String name : names) {
      JsonElement element = entry.get(name);
      if (element != null && !element.isJsonNull()) {
        return element;
      }
    }
    return null;
  }

  @Nullable
  private static String asString(@Nullable JsonElement element) {
    if (element == null || !element.isJsonPrimitive()) {
      return null;
    }
    return element.getAsString();
  }
}
