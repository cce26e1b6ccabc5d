/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.cache;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.fluxreader.reading.ReadingStatus;

/**
 * What the server has just confirmed: entries whose status changed, and
 * feeds and categories that were marked read as a whole.
 */
public class CacheInvalidation {
  private final Map<Long, ReadingStatus> entries;
  private final Set<Long> feedIds;
  private final Set<Long> categoryIds;

  private CacheInvalidation(Map<Long, ReadingStatus> entries, Set<Long> feedIds, Set<Long> categoryIds) {
    this.entries = Collections.unmodifiableMap(entries);
    this.feedIds = Collections.unmodifiableSet(feedIds);
    this.categoryIds = Collections.unmodifiableSet(categoryIds);
  }

  public static CacheInvalidation forEntry(long entryId, ReadingStatus status) {
    return new Builder().addEntry(entryId, status).build();
  }

  public static CacheInvalidation forFeed(long feedId) {
    return new Builder().addFeed(feedId).build();
  }

  public static CacheInvalidation forCategory(long categoryId) {
    return new Builder().addCategory(categoryId).build();
  }

  /**
   * Confirmed entry ids mapped to the status the server now holds.
   */
  public Map<Long, ReadingStatus> getEntries() {
    return entries;
  }

  public Set<Long> getFeedIds() {
    return feedIds;
  }

  public Set<Long> getCategoryIds() {
    return categoryIds;
  }

  public boolean isEmpty() {
    return entries.isEmpty() && feedIds.isEmpty() && categoryIds.isEmpty();
  }

  @Override
  public String toString() {
    return "CacheInvalidation[" + entries.size() + " entries, " +
           feedIds.size() + " feeds, " + categoryIds.size() + " categories]";
  }

  public static class Builder {
    private final Map<Long, ReadingStatus> entries = new HashMap<Long, ReadingStatus>();
    private final Set<Long> feedIds = new LinkedHashSet<Long>();
    private final Set<Long> categoryIds = new LinkedHashSet<Long>();

    public Builder addEntry(long entryId, ReadingStatus status) {
      entries.put(entryId, status);
      return this;
    }

    public Builder addEntries(Collection<Long> entryIds, ReadingStatus status) {
      for (Long id : entryIds) {
        entries.put(id, status);
      }
      return this;
    }

    public Builder addFeed(long feedId) {
      feedIds.add(feedId);
      return this;
    }

    public Builder addCategory(long categoryId) {
      categoryIds.add(categoryId);
      return this;
    }

    public boolean isEmpty() {
      return entries.isEmpty() && feedIds.isEmpty() && categoryIds.isEmpty();
    }

    public CacheInvalidation build() {
      return new CacheInvalidation(new HashMap<Long, ReadingStatus>(entries),
                                   new LinkedHashSet<Long>(feedIds),
                                   new LinkedHashSet<Long>(categoryIds));
    }
  }
}
