/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.cache;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.reading.EntryStatusRecord;
import org.fluxreader.reading.EntryStatusStore;
import org.fluxreader.reading.EntryStatusStoreException;
import org.fluxreader.reading.ReadingStatus;

/**
 * An in-memory view over another store, for fast lookups while browsing.
 * <p>
 * Writes go through to the backing store before the cache is updated, so a
 * failed write never shows up here. Entries named by an invalidation are
 * evicted and re-read on next use.
 */
public class CachingEntryStatusStore implements EntryStatusStore, CacheInvalidationListener {
  private static final String LOG_TAG = "CachingEntryStore";

  private final EntryStatusStore backing;
  private final Map<Long, EntryStatusRecord> records = new HashMap<Long, EntryStatusRecord>();

  public CachingEntryStatusStore(EntryStatusStore backing) {
    if (backing == null) {
      throw new IllegalArgumentException("backing must not be null.");
    }
    this.backing = backing;
  }

  /**
   * Fill the cache from the backing store. Records that can't be read are
   * skipped and loaded lazily later.
   *
   * @return the number of records cached.
   */
  public int populate() throws EntryStatusStoreException {
    final List<Long> ids = backing.entryIds();
    int loaded = 0;
    for (Long id : ids) {
      try {
        final EntryStatusRecord record = backing.load(id);
        if (record != null) {
          synchronized (this) {
            records.put(id, record);
          }
          loaded++;
        }
      } catch (EntryStatusStoreException e) {
        Logger.warn(LOG_TAG, "Couldn't cache entry " + id + ".", e);
      }
    }
    Logger.debug(LOG_TAG, "Cached " + loaded + " of " + ids.size() + " entries.");
    return loaded;
  }

  public synchronized int size() {
    return records.size();
  }

  public synchronized boolean isCached(long entryId) {
    return records.containsKey(entryId);
  }

  public synchronized void evict(long entryId) {
    records.remove(entryId);
  }

  public synchronized void evictAll() {
    records.clear();
  }

  @Override
  public synchronized EntryStatusRecord load(long entryId) throws EntryStatusStoreException {
    final EntryStatusRecord cached = records.get(entryId);
    if (cached != null) {
      return cached;
    }
    final EntryStatusRecord record = backing.load(entryId);
    if (record != null) {
      records.put(entryId, record);
    }
    return record;
  }

  @Override
  public synchronized EntryStatusRecord write(long entryId, ReadingStatus newStatus, boolean viaWorker) throws EntryStatusStoreException {
    final EntryStatusRecord written;
    try {
      written = backing.write(entryId, newStatus, viaWorker);
    } catch (EntryStatusStoreException e) {
      records.remove(entryId);
      throw e;
    }
    records.put(entryId, written);
    return written;
  }

  @Override
  public synchronized void save(EntryStatusRecord record) throws EntryStatusStoreException {
    backing.save(record);
    records.put(record.id, record);
  }

  @Override
  public synchronized boolean delete(long entryId) throws EntryStatusStoreException {
    records.remove(entryId);
    return backing.delete(entryId);
  }

  @Override
  public List<Long> entryIds() throws EntryStatusStoreException {
    return backing.entryIds();
  }

  @Override
  public synchronized void onCacheInvalidated(CacheInvalidation invalidation) {
    for (Long id : invalidation.getEntries().keySet()) {
      records.remove(id);
    }
    if (invalidation.getFeedIds().isEmpty() && invalidation.getCategoryIds().isEmpty()) {
      return;
    }
    final Iterator<EntryStatusRecord> it = records.values().iterator();
    while (it.hasNext()) {
      final EntryStatusRecord record = it.next();
      if ((record.feed != null && invalidation.getFeedIds().contains(record.feed.id)) ||
          (record.category != null && invalidation.getCategoryIds().contains(record.category.id))) {
        it.remove();
      }
    }
  }
}
