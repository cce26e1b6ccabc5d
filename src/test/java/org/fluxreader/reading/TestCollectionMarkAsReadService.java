/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.fluxreader.helpers.MockConnectivityMonitor;
import org.fluxreader.helpers.MockFluxServer;
import org.fluxreader.helpers.RecordingInvalidationListener;
import org.fluxreader.helpers.RecordingNotifier;
import org.fluxreader.helpers.SettingsFixtures;
import org.fluxreader.reading.cache.CacheInvalidationBus;
import org.fluxreader.reading.queue.CollectionOperation;
import org.fluxreader.reading.queue.CollectionQueueEntry;
import org.fluxreader.reading.queue.SyncQueues;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestCollectionMarkAsReadService {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private SyncQueues queues;
  private MockFluxServer server;
  private MockConnectivityMonitor connectivity;
  private RecordingInvalidationListener listener;
  private RecordingNotifier notifier;
  private CollectionMarkAsReadService service;

  @Before
  public void setUp() {
    queues = new SyncQueues(folder.getRoot());
    server = new MockFluxServer();
    connectivity = new MockConnectivityMonitor(true);
    final CacheInvalidationBus bus = new CacheInvalidationBus();
    listener = new RecordingInvalidationListener();
    bus.subscribe(listener);
    notifier = new RecordingNotifier();
    service = new CollectionMarkAsReadService(queues, SettingsFixtures.create(), server.factory(),
                                              connectivity, bus, notifier);
  }

  @Test
  public void testMarkFeedOnline() throws Exception {
    assertTrue(service.markFeedAsRead(10));
    assertEquals(Arrays.asList("markFeedAsRead 10"), server.calls());
    assertEquals(Arrays.asList("Feed marked as read"), notifier.successes);
    assertEquals(1, listener.count());
    assertTrue(listener.get(0).getFeedIds().contains(10L));
    assertTrue(listener.get(0).getCategoryIds().isEmpty());
  }

  @Test
  public void testMarkFeedOnlineClearsQueuedOperation() throws Exception {
    queues.feeds.enqueue(10, CollectionQueueEntry.markAllRead());
    assertTrue(service.markFeedAsRead(10));
    assertNull(queues.feeds.get(10));
  }

  @Test
  public void testMarkFeedOffline() throws Exception {
    connectivity.online = false;
    assertFalse(service.markFeedAsRead(10));
    assertEquals(CollectionOperation.MARK_ALL_READ, queues.feeds.get(10).operation);
    assertEquals(0, queues.categories.count());
    assertEquals(Arrays.asList("Feed marked as read (will sync when online)"), notifier.infos);
    assertEquals(0, listener.count());
    assertTrue(server.calls().isEmpty());
  }

  @Test
  public void testMarkCategoryOnline() throws Exception {
    assertTrue(service.markCategoryAsRead(20));
    assertEquals(Arrays.asList("markCategoryAsRead 20"), server.calls());
    assertEquals(Arrays.asList("Category marked as read"), notifier.successes);
    assertTrue(listener.get(0).getCategoryIds().contains(20L));
  }

  @Test
  public void testMarkCategoryServerFailure() throws Exception {
    server.failCategory(20);
    assertFalse(service.markCategoryAsRead(20));
    assertEquals(CollectionOperation.MARK_ALL_READ, queues.categories.get(20).operation);
    assertEquals(0, queues.feeds.count());
    assertEquals(Arrays.asList("Category marked as read (will sync when online)"), notifier.infos);
  }
}
