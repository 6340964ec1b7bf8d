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

package com.unitfloat.common.base;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class MorePreconditionsTest {

  @Test(expected = NullPointerException.class)
  public void testCheckNotBlankStringNull() {
    MorePreconditions.checkNotBlank((String) null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNotBlankStringEmpty() {
    MorePreconditions.checkNotBlank("");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNotBlankWhitespace() {
    MorePreconditions.checkNotBlank("\t\r\n ");
  }

  @Test
  public void testCheckNotBlankStringValid() {
    String argument = new String("units.ucum.json");
    assertSame(argument, MorePreconditions.checkNotBlank(argument));
  }

  @Test
  public void testCheckNotBlankStringExceptionFormatting() {
    try {
      MorePreconditions.checkNotBlank("", "catalog location %s", 42);
      fail("Expected a blank argument to be rejected");
    } catch (IllegalArgumentException e) {
      assertEquals("catalog location 42", e.getMessage());
    }
  }

  @Test
  public void testCheckArgumentRange() {
    assertEquals(0, MorePreconditions.checkArgumentRange(0, 0, 10, "out of range: %s"));
    assertEquals(10, MorePreconditions.checkArgumentRange(10, 0, 10, "out of range: %s"));
    try {
      MorePreconditions.checkArgumentRange(11, 0, 10, "out of range: %s");
      fail("Expected 11 to be out of range");
    } catch (IllegalArgumentException e) {
      assertEquals("out of range: 11", e.getMessage());
    }
  }
}
