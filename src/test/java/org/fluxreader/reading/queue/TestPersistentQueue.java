/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.queue;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Map;

import org.fluxreader.reading.ReadingStatus;
import org.fluxreader.util.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestPersistentQueue {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private File file;
  private PersistentQueue<StatusQueueEntry> queue;

  @Before
  public void setUp() throws Exception {
    file = new File(folder.getRoot(), "queue.json");
    queue = new PersistentQueue<StatusQueueEntry>(file, "entry-status", QueueEntryCodec.STATUS);
  }

  private void writeFile(String contents) throws IOException {
    final FileOutputStream out = new FileOutputStream(file);
    try {
      out.write(contents.getBytes("UTF-8"));
    } finally {
      out.close();
    }
  }

  @Test
  public void testMissingFileIsEmpty() {
    assertFalse(queue.exists());
    assertTrue(queue.load().isEmpty());
    assertEquals(0, queue.count());
    assertNull(queue.get(1));
  }

  @Test
  public void testEnqueuePersistsAcrossInstances() throws Exception {
    queue.enqueue(42, new StatusQueueEntry(ReadingStatus.READ, ReadingStatus.UNREAD, 1000L));
    assertTrue(file.exists());

    final PersistentQueue<StatusQueueEntry> other =
        new PersistentQueue<StatusQueueEntry>(file, "entry-status", QueueEntryCodec.STATUS);
    final StatusQueueEntry entry = other.get(42);
    assertEquals(ReadingStatus.READ, entry.targetStatus);
    assertEquals(ReadingStatus.UNREAD, entry.originalStatus);
    assertEquals(1000L, entry.timestamp);
  }

  @Test
  public void testEnqueueReplacesPendingOperation() throws Exception {
    queue.enqueue(7, new StatusQueueEntry(ReadingStatus.READ, ReadingStatus.UNREAD));
    queue.enqueue(7, new StatusQueueEntry(ReadingStatus.UNREAD, ReadingStatus.READ));
    assertEquals(1, queue.count());
    assertEquals(ReadingStatus.UNREAD, queue.get(7).targetStatus);
  }

  @Test
  public void testRemovingLastEntryDeletesFile() throws Exception {
    queue.enqueue(1, new StatusQueueEntry(ReadingStatus.READ, ReadingStatus.UNREAD));
    queue.enqueue(2, new StatusQueueEntry(ReadingStatus.READ, ReadingStatus.UNREAD));

    assertTrue(queue.remove(1));
    assertTrue(file.exists());
    assertFalse(queue.remove(1));

    assertTrue(queue.remove(2));
    assertFalse(file.exists());
    assertFalse(queue.exists());
  }

  @Test
  public void testLoadIsOrderedById() throws Exception {
    queue.enqueue(30, new StatusQueueEntry(ReadingStatus.READ, ReadingStatus.UNREAD));
    queue.enqueue(4, new StatusQueueEntry(ReadingStatus.READ, ReadingStatus.UNREAD));
    queue.enqueue(100, new StatusQueueEntry(ReadingStatus.UNREAD, ReadingStatus.READ));
    assertEquals(Arrays.asList(4L, 30L, 100L), new java.util.ArrayList<Long>(queue.load().keySet()));
  }

  @Test
  public void testRemoveMatchingKeepsRejectedEntries() throws Exception {
    queue.enqueue(1, new StatusQueueEntry(ReadingStatus.READ, ReadingStatus.UNREAD));
    queue.enqueue(2, new StatusQueueEntry(ReadingStatus.UNREAD, ReadingStatus.READ));
    queue.enqueue(3, new StatusQueueEntry(ReadingStatus.READ, ReadingStatus.UNREAD));

    final int removed = queue.removeMatching(Arrays.asList(1L, 2L, 99L), new PersistentQueue.EntryFilter<StatusQueueEntry>() {
      @Override
      public boolean matches(long id, StatusQueueEntry entry) {
        return entry.targetStatus == ReadingStatus.READ;
      }
    });

    assertEquals(1, removed);
    final Map<Long, StatusQueueEntry> left = queue.load();
    assertEquals(2, left.size());
    assertTrue(left.containsKey(2L));
    assertTrue(left.containsKey(3L));
  }

  @Test
  public void testClear() throws Exception {
    queue.enqueue(1, new StatusQueueEntry(ReadingStatus.READ, ReadingStatus.UNREAD));
    queue.clear();
    assertFalse(file.exists());
    queue.clear();
    assertEquals(0, queue.count());
  }

  @Test
  public void testCorruptFileReadsAsEmpty() throws Exception {
    writeFile("{not json at all");
    assertTrue(queue.load().isEmpty());

    // And can be overwritten.
    queue.enqueue(5, new StatusQueueEntry(ReadingStatus.READ, ReadingStatus.UNREAD));
    assertEquals(1, queue.count());
  }

  @Test
  public void testUnsupportedVersionReadsAsEmpty() throws Exception {
    writeFile("{\"version\": 2, \"queue\": \"entry-status\", \"entries\": " +
              "{\"5\": {\"targetStatus\": \"read\", \"originalStatus\": \"unread\", \"timestamp\": 1}}}");
    assertTrue(queue.load().isEmpty());
  }

  @Test
  public void testForeignQueueReadsAsEmpty() throws Exception {
    writeFile("{\"version\": 1, \"queue\": \"feed\", \"entries\": " +
              "{\"5\": {\"operation\": \"mark_all_read\", \"timestamp\": 1}}}");
    assertTrue(queue.load().isEmpty());
  }

  @Test
  public void testMalformedEntriesAreSkipped() throws Exception {
    writeFile("{\"version\": 1, \"queue\": \"entry-status\", \"entries\": {" +
              "\"5\": {\"targetStatus\": \"read\", \"originalStatus\": \"unread\", \"timestamp\": 1}," +
              "\"6\": {\"targetStatus\": \"removed\", \"originalStatus\": \"unread\"}," +
              "\"7\": {\"targetStatus\": 12}," +
              "\"abc\": {\"targetStatus\": \"read\", \"originalStatus\": \"unread\"}," +
              "\"8\": {\"targetStatus\": \"unread\", \"originalStatus\": \"read\"}}}");
    final Map<Long, StatusQueueEntry> entries = queue.load();
    assertEquals(2, entries.size());
    assertEquals(ReadingStatus.READ, entries.get(5L).targetStatus);
    assertEquals(ReadingStatus.UNREAD, entries.get(8L).targetStatus);
  }

  @Test
  public void testPersistedFormat() throws Exception {
    queue.enqueue(9, new StatusQueueEntry(ReadingStatus.UNREAD, ReadingStatus.READ, 1234L));
    final String contents = FileUtils.getFileContents(file);
    assertTrue(contents.contains("\"version\":1"));
    assertTrue(contents.contains("\"queue\":\"entry-status\""));
    assertTrue(contents.contains("\"targetStatus\":\"unread\""));
    assertTrue(contents.contains("\"originalStatus\":\"read\""));
  }

  @Test
  public void testCollectionQueue() throws Exception {
    final PersistentQueue<CollectionQueueEntry> feeds =
        new PersistentQueue<CollectionQueueEntry>(new File(folder.getRoot(), "feeds.json"), "feed", QueueEntryCodec.COLLECTION);
    feeds.enqueue(10, CollectionQueueEntry.markAllRead());
    feeds.enqueue(10, CollectionQueueEntry.markAllRead());
    assertEquals(1, feeds.count());
    assertEquals(CollectionOperation.MARK_ALL_READ, feeds.get(10).operation);
  }
}
