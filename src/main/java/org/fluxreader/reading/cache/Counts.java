/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.cache;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Unread counts: overall, and per feed and per category.
 */
public class Counts {
  public final long totalUnread;
  private final Map<Long, Long> unreadByFeed;
  private final Map<Long, Long> unreadByCategory;

  public Counts(long totalUnread, Map<Long, Long> unreadByFeed, Map<Long, Long> unreadByCategory) {
    this.totalUnread = totalUnread;
    this.unreadByFeed = Collections.unmodifiableMap(new HashMap<Long, Long>(unreadByFeed));
    this.unreadByCategory = Collections.unmodifiableMap(new HashMap<Long, Long>(unreadByCategory));
  }

  public long getFeedUnread(long feedId) {
    final Long count = unreadByFeed.get(feedId);
    return count == null ? 0L : count;
  }

  public long getCategoryUnread(long categoryId) {
    final Long count = unreadByCategory.get(categoryId);
    return count == null ? 0L : count;
  }

  public Map<Long, Long> getUnreadByFeed() {
    return unreadByFeed;
  }

  public Map<Long, Long> getUnreadByCategory() {
    return unreadByCategory;
  }

  @Override
  public String toString() {
    return "Counts[" + totalUnread + " unread]";
  }
}
