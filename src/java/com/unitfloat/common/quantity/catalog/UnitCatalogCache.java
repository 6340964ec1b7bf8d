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
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.io.Closeables;
import com.google.common.util.concurrent.Striped;

import com.unitfloat.common.base.MorePreconditions;
import com.unitfloat.common.util.caching.Cache;

/**
 * Loads unit catalogs on demand and memoizes them by location.
 *
 * <p>Only fully resolved catalogs are ever stored, so a concurrent caller observes a location as
 * either not loaded yet or completely loaded.  Loads of the same location are serialized and the
 * first successful one wins; a failed load stores nothing, so the next request retries it.
 *
 * <p>This class is thread-safe.
 */
public class UnitCatalogCache implements Cache<String, UnitCatalog> {

  private static final Logger LOG = Logger.getLogger(UnitCatalogCache.class.getName());

  private final UnitCatalogSource source;
  private final UnitCatalogParser parser;
  private final ConcurrentMap<String, UnitCatalog> catalogs = Maps.newConcurrentMap();
  private final Striped<Lock> loadLocks = Striped.lock(16);

  private final AtomicLong accesses = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  /**
   * Creates a cache that reads catalogs from {@code source} and resolves them with
   * {@code parser}.
   */
  public UnitCatalogCache(UnitCatalogSource source, UnitCatalogParser parser) {
    this.source = Preconditions.checkNotNull(source);
    this.parser = Preconditions.checkNotNull(parser);
  }

  /**
   * Returns the catalog stored at {@code location}, reading and resolving it if no earlier call
   * has.
   *
   * @param location where the catalog is stored, as understood by this cache's source.
   * @return the resolved catalog.
   * @throws CatalogException if the catalog cannot be read or resolved.  Nothing is cached in
   *     that case.
   */
  public UnitCatalog load(String location) throws CatalogException {
    MorePreconditions.checkNotBlank(location);
    accesses.incrementAndGet();

    UnitCatalog catalog = catalogs.get(location);
    if (catalog != null) {
      return catalog;
    }

    Lock lock = loadLocks.get(location);
    lock.lock();
    try {
      catalog = catalogs.get(location);
      if (catalog == null) {
        misses.incrementAndGet();
        catalog = read(location);
        catalogs.put(location, catalog);
        LOG.info(String.format("Loaded %s from %s", catalog, location));
      }
      return catalog;
    } finally {
      lock.unlock();
    }
  }

  private UnitCatalog read(String location) throws CatalogException {
    Reader reader = null;
    try {
      reader = source.open(location);
      return parser.parse(reader);
    } catch (IOException e) {
      LOG.log(Level.WARNING, "Failed to read unit catalog from " + location, e);
      throw new CatalogException("Failed to read unit catalog from " + location, e);
    } catch (CatalogException e) {
      LOG.log(Level.WARNING, "Failed to resolve unit catalog from " + location, e);
      throw e;
    } finally {
      Closeables.closeQuietly(reader);
    }
  }

  /**
   * Returns the catalog for {@code location} if it has been loaded.
   *
   * @return the catalog, or {@code null} if it is not available yet.
   */
  @Override
  @Nullable
  public UnitCatalog get(String location) {
    accesses.incrementAndGet();
    UnitCatalog catalog = catalogs.get(location);
    if (catalog == null) {
      misses.incrementAndGet();
    }
    return catalog;
  }

  /**
   * Stores an already resolved catalog, for example one built in code.
   */
  @Override
  public void put(String location, UnitCatalog catalog) {
    catalogs.put(MorePreconditions.checkNotBlank(location), Preconditions.checkNotNull(catalog));
  }

  /**
   * Forgets the catalog for {@code location}; the next {@link #load} reads it again.
   */
  @Override
  public void delete(String location) {
    catalogs.remove(location);
  }

  public boolean isLoaded(String location) {
    return catalogs.containsKey(location);
  }

  public int size() {
    return catalogs.size();
  }

  public long getAccesses() {
    return accesses.longValue();
  }

  public long getMisses() {
    return misses.longValue();
  }

  @Override
  public String toString() {
    return String.format("size: %d, accesses: %s, misses: %s", catalogs.size(), accesses, misses);
  }
}
