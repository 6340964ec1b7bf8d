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

import java.util.Comparator;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;

import com.unitfloat.common.quantity.Unit;

/**
 * An immutable set of resolved {@link Unit}s keyed by identifier, plus an alias table from display
 * code to identifier.  When several units share a display code the first one added owns the alias.
 */
public final class UnitCatalog {

  private final ImmutableMap<String, Unit> units;
  private final ImmutableMap<String, String> aliases;

  private UnitCatalog(ImmutableMap<String, Unit> units, ImmutableMap<String, String> aliases) {
    this.units = units;
    this.aliases = aliases;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private final Map<String, Unit> units = Maps.newLinkedHashMap();
    private final Map<String, String> aliases = Maps.newLinkedHashMap();

    /**
     * Adds a unit, replacing any earlier unit with the same identifier.
     */
    public Builder add(Unit unit) {
      Preconditions.checkNotNull(unit);
      units.put(unit.getIdentifier(), unit);
      if (!aliases.containsKey(unit.getDisplayCode())) {
        aliases.put(unit.getDisplayCode(), unit.getIdentifier());
      }
      return this;
    }

    public Builder addAll(Iterable<Unit> toAdd) {
      for (Unit unit : toAdd) {
        add(unit);
      }
      return this;
    }

    public UnitCatalog build() {
      return new UnitCatalog(ImmutableMap.copyOf(units), ImmutableMap.copyOf(aliases));
    }
  }

  public Optional<Unit> getUnit(String identifier) {
    return Optional.fromNullable(units.get(identifier));
  }

  /**
   * Looks up the identifier of the unit that owns a display code.
   *
   * @return the identifier, or {@code null} if no unit uses {@code displayCode}.
   */
  @Nullable
  public String resolveAlias(String displayCode) {
    return aliases.get(displayCode);
  }

  public ImmutableMap<String, Unit> getUnits() {
    return units;
  }

  public ImmutableMap<String, String> getAliases() {
    return aliases;
  }

  public int size() {
    return units.size();
  }

  public boolean isEmpty() {
    return units.isEmpty();
  }

  /**
   * Lists the units a value in {@code base} may be displayed in: every non-logarithmic unit sharing
   * its reference unit and quantity kind.  The family's reference unit comes first, the rest follow
   * ordered by display code.
   *
   * @param base the unit to find companions for.
   * @return the compatible units, including {@code base} itself unless it is logarithmic.
   */
  public List<Unit> compatibleUnits(final Unit base) {
    Preconditions.checkNotNull(base);
    Iterable<Unit> compatible = Iterables.filter(units.values(),
        new Predicate<Unit>() {
          @Override public boolean apply(Unit unit) {
            return !unit.isLogarithmic() && unit.isCompatibleWith(base);
          }
        });
    return ImmutableList.copyOf(referenceFirst(base.getReferenceId()).sortedCopy(compatible));
  }

  private static Ordering<Unit> referenceFirst(@Nullable final String referenceId) {
    return Ordering.from(new Comparator<Unit>() {
      @Override public int compare(Unit a, Unit b) {
        boolean aIsReference = a.getIdentifier().equals(referenceId);
        boolean bIsReference = b.getIdentifier().equals(referenceId);
        if (aIsReference != bIsReference) {
          return aIsReference ? -1 : 1;
        }
        int byCode = String.CASE_INSENSITIVE_ORDER.compare(a.getDisplayCode(), b.getDisplayCode());
        return byCode != 0 ? byCode : a.getDisplayCode().compareTo(b.getDisplayCode());
      }
    });
  }

  @Override
  public String toString() {
    return String.format("UnitCatalog(units: %d, aliases: %d)", units.size(), aliases.size());
  }
}
