/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.queue;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.reading.ReadingConstants;

/**
 * Owns the three durable queues: entry status, feed mark-all-read, and
 * category mark-all-read.
 */
public class SyncQueues {
  private static final String LOG_TAG = "SyncQueues";

  public static final String STATUS_QUEUE_NAME = "entry-status";
  public static final String FEED_QUEUE_NAME = "feed";
  public static final String CATEGORY_QUEUE_NAME = "category";

  public final PersistentQueue<StatusQueueEntry> status;
  public final PersistentQueue<CollectionQueueEntry> feeds;
  public final PersistentQueue<CollectionQueueEntry> categories;

  public SyncQueues(File dataDir) {
    if (dataDir == null) {
      throw new IllegalArgumentException("dataDir must not be null.");
    }
    this.status = new PersistentQueue<StatusQueueEntry>(
        new File(dataDir, ReadingConstants.STATUS_QUEUE_FILENAME), STATUS_QUEUE_NAME, QueueEntryCodec.STATUS);
    this.feeds = new PersistentQueue<CollectionQueueEntry>(
        new File(dataDir, ReadingConstants.FEED_QUEUE_FILENAME), FEED_QUEUE_NAME, QueueEntryCodec.COLLECTION);
    this.categories = new PersistentQueue<CollectionQueueEntry>(
        new File(dataDir, ReadingConstants.CATEGORY_QUEUE_FILENAME), CATEGORY_QUEUE_NAME, QueueEntryCodec.COLLECTION);
  }

  public int totalCount() {
    return status.count() + feeds.count() + categories.count();
  }

  /**
   * Discard every pending operation in all three queues. Attempts every
   * queue even if one fails.
   *
   * @return the names of the queues that couldn't be cleared; empty on success.
   */
  public List<String> clearAll() {
    final List<String> failed = new ArrayList<String>();
    for (PersistentQueue<?> queue : new PersistentQueue<?>[] { status, feeds, categories }) {
      try {
        queue.clear();
      } catch (IOException e) {
        Logger.error(LOG_TAG, "Couldn't clear queue " + queue.getName() + ".", e);
        failed.add(queue.getName());
      }
    }
    if (failed.isEmpty()) {
      Logger.info(LOG_TAG, "Cleared all sync queues.");
    }
    return failed;
  }
}
