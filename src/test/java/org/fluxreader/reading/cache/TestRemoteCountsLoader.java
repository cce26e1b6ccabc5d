/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.Arrays;

import org.fluxreader.helpers.MockFluxServer;
import org.fluxreader.helpers.SettingsFixtures;
import org.junit.Before;
import org.junit.Test;

public class TestRemoteCountsLoader {
  private MockFluxServer server;
  private RemoteCountsLoader loader;

  @Before
  public void setUp() {
    server = new MockFluxServer();
    server.setBody(MockFluxServer.BODY_ENTRIES, "{\"total\": 17, \"entries\": [{\"id\": 1}]}");
    server.setBody(MockFluxServer.BODY_FEED_COUNTERS, "{\"reads\": {\"3\": 9}, \"unreads\": {\"3\": 4, \"5\": 13}}");
    server.setBody(MockFluxServer.BODY_CATEGORIES,
                   "[{\"id\": 20, \"title\": \"News\", \"total_unread\": 12}," +
                   " {\"id\": 21, \"title\": \"Blogs\"}," +
                   " \"junk\"]");
    loader = new RemoteCountsLoader(SettingsFixtures.create(), server.factory());
  }

  @Test
  public void testLoadCounts() throws Exception {
    final Counts counts = loader.loadCounts();
    assertEquals(17, counts.totalUnread);
    assertEquals(4, counts.getFeedUnread(3));
    assertEquals(13, counts.getFeedUnread(5));
    assertEquals(0, counts.getFeedUnread(6));
    assertEquals(12, counts.getCategoryUnread(20));
    assertEquals(0, counts.getCategoryUnread(21));
    assertEquals(2, counts.getUnreadByFeed().size());
    assertEquals(2, counts.getUnreadByCategory().size());

    assertEquals(Arrays.asList("getEntries unread 1", "getFeedCounters", "getCategories true"), server.calls());
  }

  @Test
  public void testFailureThrows() throws Exception {
    server.failReads = true;
    try {
      loader.loadCounts();
      fail("Expected exception.");
    } catch (IOException e) {
      // Expected.
    }
  }

  @Test
  public void testCachedCountsFromServer() throws Exception {
    final CountsCache cache = new CountsCache(loader);
    cache.getCounts();
    cache.getCounts();
    assertEquals(3, server.calls().size());
  }
}
