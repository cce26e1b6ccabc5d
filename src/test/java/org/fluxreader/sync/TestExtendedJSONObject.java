/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.sync;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.fluxreader.sync.UnexpectedJSONException.BadRequiredFieldJSONException;
import org.json.simple.JSONArray;
import org.junit.Test;

public class TestExtendedJSONObject {
  private static final String ENTRY = "{\"id\":42,\"status\":\"unread\",\"starred\":false," +
      "\"feed\":{\"id\":7,\"title\":\"Feed\"},\"tags\":[\"a\",\"b\"],\"count\":\"12\"}";

  @Test
  public void testAccessors() throws Exception {
    final ExtendedJSONObject o = ExtendedJSONObject.parseJSONObject(ENTRY);
    assertEquals(Long.valueOf(42), o.getLong("id"));
    assertEquals("unread", o.getString("status"));
    assertEquals(Boolean.FALSE, o.getBoolean("starred"));
    assertEquals(Long.valueOf(7), o.getObject("feed").getLong("id"));
    assertEquals(2, o.getArray("tags").size());
    assertEquals("12", o.getString("count"));
    assertNull(o.getLong("missing"));
    assertNull(o.getObject("missing"));
    assertNull(o.getArray("missing"));
  }

  @Test
  public void testWrongShapes() throws Exception {
    final ExtendedJSONObject o = ExtendedJSONObject.parseJSONObject(ENTRY);
    try {
      o.getObject("tags");
      fail("Expected NonObjectJSONException.");
    } catch (NonObjectJSONException e) {
      // Expected.
    }
    try {
      o.getArray("feed");
      fail("Expected NonArrayJSONException.");
    } catch (NonArrayJSONException e) {
      // Expected.
    }
    try {
      o.getLong("status");
      fail("Expected ClassCastException.");
    } catch (ClassCastException e) {
      // Expected.
    }
  }

  @Test(expected = NonObjectJSONException.class)
  public void testArrayIsNotAnObject() throws Exception {
    ExtendedJSONObject.parseJSONObject("[1, 2]");
  }

  @Test
  public void testParseArray() throws Exception {
    final JSONArray array = ExtendedJSONObject.parseJSONArray("[1, {\"a\": 2}]");
    assertEquals(2, array.size());
    try {
      ExtendedJSONObject.parseJSONArray("{}");
      fail("Expected NonArrayJSONException.");
    } catch (NonArrayJSONException e) {
      // Expected.
    }
  }

  @Test
  public void testPutNestedAndRemove() throws Exception {
    final ExtendedJSONObject inner = new ExtendedJSONObject();
    inner.put("id", 3L);
    final ExtendedJSONObject outer = new ExtendedJSONObject();
    outer.put("inner", inner);
    outer.put("name", "x");

    final ExtendedJSONObject reparsed = new ExtendedJSONObject(outer.toJSONString());
    assertEquals(outer, reparsed);
    assertEquals(Long.valueOf(3), reparsed.getObject("inner").getLong("id"));

    assertTrue(reparsed.remove("name"));
    assertFalse(reparsed.remove("name"));
    assertFalse(reparsed.containsKey("name"));
    assertEquals(1, reparsed.size());
  }

  @Test
  public void testRequiredFields() throws Exception {
    final ExtendedJSONObject o = ExtendedJSONObject.parseJSONObject(ENTRY);
    o.throwIfFieldsMissingOrMisTyped(new String[] { "status" }, String.class);
    o.throwIfFieldsMissingOrMisTyped(new String[] { "id", "feed" }, null);
    try {
      o.throwIfFieldsMissingOrMisTyped(new String[] { "title" }, null);
      fail("Expected BadRequiredFieldJSONException.");
    } catch (BadRequiredFieldJSONException e) {
      // Expected.
    }
    try {
      o.throwIfFieldsMissingOrMisTyped(new String[] { "id" }, String.class);
      fail("Expected BadRequiredFieldJSONException.");
    } catch (BadRequiredFieldJSONException e) {
      // Expected.
    }
  }
}
