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
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import com.google.common.io.Files;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.unitfloat.common.testing.easymock.EasyMockTest;

import static org.easymock.EasyMock.expect;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class UnitCatalogCacheTest extends EasyMockTest {

  private static final String LOCATION = "/catalogs/units.json";
  private static final String CATALOG_JSON =
      "{\"unit:A\": {\"qk\": \"qk:ElectricCurrent\", \"ref\": \"unit:A\","
      + " \"m\": 1, \"ucum\": \"A\"}}";

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private UnitCatalogSource source;
  private UnitCatalogCache cache;

  @Before
  public void setUp() {
    source = createMock(UnitCatalogSource.class);
    cache = new UnitCatalogCache(source, UnitCatalogParser.builder().build());
  }

  @Test
  public void testLoadsOnce() throws Exception {
    expect(source.open(LOCATION)).andReturn(new StringReader(CATALOG_JSON));
    control.replay();

    assertNull(cache.get(LOCATION));
    assertFalse(cache.isLoaded(LOCATION));

    UnitCatalog catalog = cache.load(LOCATION);
    assertEquals(1, catalog.size());
    assertSame(catalog, cache.load(LOCATION));
    assertSame(catalog, cache.get(LOCATION));
    assertTrue(cache.isLoaded(LOCATION));
    assertEquals(1, cache.size());

    assertEquals(4, cache.getAccesses());
    assertEquals(2, cache.getMisses());
  }

  @Test
  public void testReadFailureIsNotCached() throws Exception {
    expect(source.open(LOCATION)).andThrow(new FileNotFoundException(LOCATION));
    expect(source.open(LOCATION)).andReturn(new StringReader(CATALOG_JSON));
    control.replay();

    try {
      cache.load(LOCATION);
      fail("Expected the failed read to surface");
    } catch (CatalogException e) {
      assertTrue(e.getCause() instanceof IOException);
    }
    assertFalse(cache.isLoaded(LOCATION));

    assertEquals(1, cache.load(LOCATION).size());
  }

  @Test
  public void testParseFailureIsNotCached() throws Exception {
    expect(source.open(LOCATION)).andReturn(new StringReader("{\"unit:A\": "));
    expect(source.open(LOCATION)).andReturn(new StringReader(CATALOG_JSON));
    control.replay();

    try {
      cache.load(LOCATION);
      fail("Expected the truncated catalog to be rejected");
    } catch (CatalogException e) {
      // expected
    }
    assertEquals(0, cache.size());
    assertEquals(1, cache.load(LOCATION).size());
  }

  @Test
  public void testDeleteForcesReload() throws Exception {
    expect(source.open(LOCATION)).andReturn(new StringReader(CATALOG_JSON));
    expect(source.open(LOCATION)).andReturn(new StringReader("{}"));
    control.replay();

    assertEquals(1, cache.load(LOCATION).size());
    cache.delete(LOCATION);
    assertTrue(cache.load(LOCATION).isEmpty());
  }

  @Test
  public void testPut() throws Exception {
    control.replay();

    UnitCatalog empty = UnitCatalog.builder().build();
    cache.put(LOCATION, empty);
    assertSame(empty, cache.load(LOCATION));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBlankLocation() throws Exception {
    control.replay();

    cache.load(" ");
  }

  @Test
  public void testClasspathSource() throws Exception {
    control.replay();

    UnitCatalogCache classpath =
        new UnitCatalogCache(UnitCatalogSources.classpath(), UnitCatalogParser.builder().build());
    UnitCatalog catalog =
        classpath.load("/com/unitfloat/common/quantity/catalog/" + UnitCatalogParserTest.FIXTURE);
    assertEquals(13, catalog.size());

    try {
      classpath.load("no/such/catalog.json");
      fail("Expected a missing resource to fail");
    } catch (CatalogException e) {
      assertTrue(e.getCause() instanceof FileNotFoundException);
    }
  }

  @Test
  public void testFileSource() throws Exception {
    control.replay();

    File catalogFile = tmp.newFile("units.json");
    Files.asCharSink(catalogFile, StandardCharsets.UTF_8).write(CATALOG_JSON);

    UnitCatalogCache files = new UnitCatalogCache(UnitCatalogSources.files(tmp.getRoot()),
        UnitCatalogParser.builder().build());
    assertEquals(1, files.load("units.json").size());
    assertEquals(1, files.load(catalogFile.getAbsolutePath()).size());
  }
}
