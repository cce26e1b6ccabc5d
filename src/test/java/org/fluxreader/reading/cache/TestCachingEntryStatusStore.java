/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.fluxreader.helpers.EntryFixtures;
import org.fluxreader.reading.EntryStatusRecord;
import org.fluxreader.reading.EntryStatusStore;
import org.fluxreader.reading.EntryStatusStoreException;
import org.fluxreader.reading.LocalEntryStatusStore;
import org.fluxreader.reading.ReadingStatus;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestCachingEntryStatusStore {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private LocalEntryStatusStore backing;
  private CachingEntryStatusStore cache;

  /**
   * Fails writes on demand.
   */
  private static class FlakyStore implements EntryStatusStore {
    private final EntryStatusStore inner;
    public boolean failWrites = false;

    public FlakyStore(EntryStatusStore inner) {
      this.inner = inner;
    }

    @Override
    public EntryStatusRecord load(long entryId) throws EntryStatusStoreException {
      return inner.load(entryId);
    }

    @Override
    public EntryStatusRecord write(long entryId, ReadingStatus newStatus, boolean viaWorker) throws EntryStatusStoreException {
      if (failWrites) {
        throw new EntryStatusStoreException("Disk full.");
      }
      return inner.write(entryId, newStatus, viaWorker);
    }

    @Override
    public void save(EntryStatusRecord record) throws EntryStatusStoreException {
      inner.save(record);
    }

    @Override
    public boolean delete(long entryId) throws EntryStatusStoreException {
      return inner.delete(entryId);
    }

    @Override
    public List<Long> entryIds() throws EntryStatusStoreException {
      return inner.entryIds();
    }
  }

  @Before
  public void setUp() throws Exception {
    backing = new LocalEntryStatusStore(folder.getRoot());
    EntryFixtures.save(backing, 1, ReadingStatus.UNREAD, 10, 20);
    EntryFixtures.save(backing, 2, ReadingStatus.READ, 11, 20);
    EntryFixtures.save(backing, 3, ReadingStatus.UNREAD, 11, 21);
    cache = new CachingEntryStatusStore(backing);
  }

  @Test
  public void testPopulate() throws Exception {
    assertEquals(3, cache.populate());
    assertEquals(3, cache.size());
    assertTrue(cache.isCached(2));
  }

  @Test
  public void testLoadFillsLazily() throws Exception {
    assertFalse(cache.isCached(1));
    assertEquals(ReadingStatus.UNREAD, cache.load(1).status);
    assertTrue(cache.isCached(1));
    assertNull(cache.load(99));
    assertFalse(cache.isCached(99));
  }

  @Test
  public void testWriteThrough() throws Exception {
    cache.populate();
    cache.write(1, ReadingStatus.READ, false);
    assertEquals(ReadingStatus.READ, cache.load(1).status);
    assertEquals(ReadingStatus.READ, backing.load(1).status);
  }

  @Test
  public void testFailedWriteEvicts() throws Exception {
    final FlakyStore flaky = new FlakyStore(backing);
    final CachingEntryStatusStore flakyCache = new CachingEntryStatusStore(flaky);
    flakyCache.populate();

    flaky.failWrites = true;
    try {
      flakyCache.write(1, ReadingStatus.READ, false);
      fail("Expected exception.");
    } catch (EntryStatusStoreException e) {
      // Expected.
    }
    assertFalse(flakyCache.isCached(1));
    assertEquals(ReadingStatus.UNREAD, flakyCache.load(1).status);
  }

  @Test
  public void testDeleteEvicts() throws Exception {
    cache.populate();
    assertTrue(cache.delete(2));
    assertFalse(cache.isCached(2));
    assertNull(cache.load(2));
  }

  @Test
  public void testEntryInvalidationEvictsEntry() throws Exception {
    cache.populate();
    cache.onCacheInvalidated(CacheInvalidation.forEntry(1, ReadingStatus.READ));
    assertFalse(cache.isCached(1));
    assertTrue(cache.isCached(2));
    assertTrue(cache.isCached(3));
  }

  @Test
  public void testFeedInvalidationEvictsFeedEntries() throws Exception {
    cache.populate();
    cache.onCacheInvalidated(CacheInvalidation.forFeed(11));
    assertTrue(cache.isCached(1));
    assertFalse(cache.isCached(2));
    assertFalse(cache.isCached(3));
  }

  @Test
  public void testCategoryInvalidationEvictsCategoryEntries() throws Exception {
    cache.populate();
    cache.onCacheInvalidated(CacheInvalidation.forCategory(20));
    assertFalse(cache.isCached(1));
    assertFalse(cache.isCached(2));
    assertTrue(cache.isCached(3));
  }

  @Test
  public void testEvictedEntriesReloadFromDisk() throws Exception {
    cache.populate();
    // Changed behind the cache's back, e.g. by a drain in another process.
    backing.write(3, ReadingStatus.READ, false);
    assertEquals(ReadingStatus.UNREAD, cache.load(3).status);

    cache.onCacheInvalidated(CacheInvalidation.forEntry(3, ReadingStatus.READ));
    assertEquals(ReadingStatus.READ, cache.load(3).status);
  }

  @Test
  public void testEvict() throws Exception {
    cache.populate();
    cache.evict(1);
    assertFalse(cache.isCached(1));
    assertTrue(cache.isCached(2));

    cache.evictAll();
    assertEquals(0, cache.size());
    assertEquals(ReadingStatus.READ, cache.load(2).status);
    assertTrue(cache.isCached(2));
  }
}
