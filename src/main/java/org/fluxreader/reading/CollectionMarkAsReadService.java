/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import java.io.IOException;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.reading.BlockingRequestDelegate.Result;
import org.fluxreader.reading.cache.CacheInvalidation;
import org.fluxreader.reading.cache.CacheInvalidationBus;
import org.fluxreader.reading.queue.CollectionQueueEntry;
import org.fluxreader.reading.queue.PersistentQueue;
import org.fluxreader.reading.queue.SyncQueues;

/**
 * Marks whole feeds or categories read, queueing the request if the server
 * can't be reached.
 */
public class CollectionMarkAsReadService {
  private static final String LOG_TAG = "CollectionMarkAsRead";

  protected final SyncQueues queues;
  protected final ServerSettings settings;
  protected final FluxRemoteFactory remoteFactory;
  protected final ConnectivityMonitor connectivity;
  protected final CacheInvalidationBus bus;
  protected final SyncNotifier notifier;

  public CollectionMarkAsReadService(SyncQueues queues,
                                     ServerSettings settings,
                                     FluxRemoteFactory remoteFactory,
                                     ConnectivityMonitor connectivity,
                                     CacheInvalidationBus bus,
                                     SyncNotifier notifier) {
    this.queues = queues;
    this.settings = settings;
    this.remoteFactory = remoteFactory;
    this.connectivity = connectivity;
    this.bus = bus;
    this.notifier = notifier;
  }

  /**
   * @return true if the server confirmed it; false if it was queued.
   * @throws IOException if it couldn't be queued.
   */
  public boolean markFeedAsRead(long feedId) throws IOException {
    return mark(feedId, true);
  }

  /**
   * @return true if the server confirmed it; false if it was queued.
   * @throws IOException if it couldn't be queued.
   */
  public boolean markCategoryAsRead(long categoryId) throws IOException {
    return mark(categoryId, false);
  }

  private boolean mark(long id, boolean isFeed) throws IOException {
    final PersistentQueue<CollectionQueueEntry> queue = isFeed ? queues.feeds : queues.categories;
    final String noun = isFeed ? "Feed" : "Category";

    final Result result = markRemotely(id, isFeed);
    if (result.wasSuccessful()) {
      queue.remove(id);
      bus.publish(isFeed ? CacheInvalidation.forFeed(id) : CacheInvalidation.forCategory(id));
      notifier.success(noun + " marked as read");
      return true;
    }

    Logger.info(LOG_TAG, "Queueing mark-all-read for " + queue.getName() + " " + id + ": " + result.describeFailure());
    queue.enqueue(id, CollectionQueueEntry.markAllRead());
    notifier.info(noun + " marked as read (will sync when online)");
    return false;
  }

  private Result markRemotely(final long id, final boolean isFeed) {
    if (!connectivity.isOnline()) {
      return Result.failure(new IOException("Offline."));
    }
    final String description = "Marking " + (isFeed ? "feed " : "category ") + id + " as read";
    return BlockingRequestDelegate.execute(remoteFactory, settings.getCredentials(), description,
        new BlockingRequestDelegate.Call() {
      @Override
      public void start(FluxRemote remote, FluxRequestDelegate delegate) {
        if (isFeed) {
          remote.markFeedAsRead(id, delegate);
        } else {
          remote.markCategoryAsRead(id, delegate);
        }
      }
    });
  }
}
