/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.coordinator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.reading.BlockingRequestDelegate;
import org.fluxreader.reading.BlockingRequestDelegate.Result;
import org.fluxreader.reading.EntryNotFoundException;
import org.fluxreader.reading.EntryStatusStore;
import org.fluxreader.reading.EntryStatusStoreException;
import org.fluxreader.reading.FluxRemote;
import org.fluxreader.reading.FluxRemoteFactory;
import org.fluxreader.reading.FluxRequestDelegate;
import org.fluxreader.reading.ReadingStatus;
import org.fluxreader.reading.ServerCredentials;
import org.fluxreader.reading.ServerSettings;
import org.fluxreader.reading.SyncNotifier;
import org.fluxreader.reading.cache.CacheInvalidation;
import org.fluxreader.reading.cache.CacheInvalidationBus;
import org.fluxreader.reading.queue.CollectionOperation;
import org.fluxreader.reading.queue.CollectionQueueEntry;
import org.fluxreader.reading.queue.PersistentQueue;
import org.fluxreader.reading.queue.StatusQueueEntry;
import org.fluxreader.reading.queue.SyncQueues;
import org.fluxreader.sync.Utils;

/**
 * Drains the three queues against the server.
 * <p>
 * Queued entry status changes are grouped by target status, so any number of
 * them costs one request per status (more only if a batch size is set).
 * Feeds and categories are marked read one request each. A batch either
 * succeeds or fails as a whole: the server answers once per request.
 * <p>
 * Runs on the calling thread and blocks on the network; one drain at a time.
 */
public class QueueSyncCoordinator {
  private static final String LOG_TAG = "QueueSyncCoordinator";

  protected final SyncQueues queues;
  protected final EntryStatusStore store;
  protected final ServerSettings settings;
  protected final FluxRemoteFactory remoteFactory;
  protected final CacheInvalidationBus bus;
  protected final SyncNotifier notifier;
  protected final SyncConfirmationHandler confirmation;

  public QueueSyncCoordinator(SyncQueues queues,
                              EntryStatusStore store,
                              ServerSettings settings,
                              FluxRemoteFactory remoteFactory,
                              CacheInvalidationBus bus,
                              SyncNotifier notifier,
                              SyncConfirmationHandler confirmation) {
    if (queues == null || store == null || settings == null || remoteFactory == null ||
        bus == null || notifier == null || confirmation == null) {
      throw new IllegalArgumentException("Coordinator collaborators must not be null.");
    }
    this.queues = queues;
    this.store = store;
    this.settings = settings;
    this.remoteFactory = remoteFactory;
    this.bus = bus;
    this.notifier = notifier;
    this.confirmation = confirmation;
  }

  public QueueCounts getTotalQueueCount() {
    return new QueueCounts(queues.status.count(), queues.feeds.count(), queues.categories.count());
  }

  /**
   * Drain every queue, asking first if the trigger calls for it.
   */
  public synchronized SyncSummary processAll(SyncTrigger trigger) {
    final QueueCounts counts = getTotalQueueCount();
    if (counts.isEmpty()) {
      if (trigger == SyncTrigger.USER) {
        notifier.info("All changes are already synced");
      }
      return SyncSummary.of(SyncSummary.Result.NOTHING_TO_SYNC);
    }

    Logger.info(LOG_TAG, "Processing queues for " + trigger + ": " + counts + ".");

    if (!trigger.autoConfirms()) {
      final SyncDecision decision = confirmation.confirmSync(counts);
      Logger.debug(LOG_TAG, "User chose " + decision + ".");
      if (decision == null || decision == SyncDecision.LATER) {
        return SyncSummary.of(SyncSummary.Result.DEFERRED);
      }
      if (decision == SyncDecision.DELETE_QUEUE) {
        return clearAll(false);
      }
    }

    return drain();
  }

  /**
   * Convenience for the network coming back: drain without asking.
   */
  public SyncSummary onConnectivityRestored() {
    return processAll(SyncTrigger.CONNECTIVITY_RESTORED);
  }

  protected SyncSummary drain() {
    final ServerCredentials credentials = settings.getCredentials();
    final CacheInvalidation.Builder invalidation = new CacheInvalidation.Builder();

    final int[] status = drainStatusQueue(credentials, invalidation);
    final int[] feeds = drainCollectionQueue(queues.feeds, true, credentials, invalidation);
    final int[] categories = drainCollectionQueue(queues.categories, false, credentials, invalidation);

    if (!invalidation.isEmpty()) {
      bus.publish(invalidation.build());
    }

    final SyncSummary summary = new SyncSummary(SyncSummary.Result.SYNCED,
                                                status[0], status[1],
                                                feeds[0], feeds[1],
                                                categories[0], categories[1]);
    Logger.info(LOG_TAG, "Finished: " + summary + ".");

    final String message = summary.completionMessage();
    if (message != null) {
      if (summary.processed() > 0) {
        notifier.success(message);
      } else {
        notifier.error(message);
      }
    }
    return summary;
  }

  /**
   * @return processed and failed counts.
   */
  protected int[] drainStatusQueue(ServerCredentials credentials, CacheInvalidation.Builder invalidation) {
    final Map<Long, StatusQueueEntry> queued = queues.status.load();
    if (queued.isEmpty()) {
      return new int[] { 0, 0 };
    }

    final ReadingStatus first = settings.getFirstBatchStatus();
    final Map<ReadingStatus, List<Long>> byTarget = new LinkedHashMap<ReadingStatus, List<Long>>();
    byTarget.put(first, new ArrayList<Long>());
    byTarget.put(first.opposite(), new ArrayList<Long>());
    for (Entry<Long, StatusQueueEntry> e : queued.entrySet()) {
      final List<Long> ids = byTarget.get(e.getValue().targetStatus);
      if (ids == null) {
        Logger.warn(LOG_TAG, "Skipping entry " + e.getKey() + " queued for " + e.getValue().targetStatus + ".");
        continue;
      }
      ids.add(e.getKey());
    }

    int processed = 0;
    int failed = 0;
    final int batchSize = settings.getStatusBatchSize();
    for (Entry<ReadingStatus, List<Long>> group : byTarget.entrySet()) {
      final ReadingStatus target = group.getKey();
      for (final List<Long> batch : Utils.chunk(group.getValue(), batchSize)) {
        final Result result = BlockingRequestDelegate.execute(remoteFactory, credentials,
            "Marking " + batch.size() + " entries " + target, new BlockingRequestDelegate.Call() {
          @Override
          public void start(FluxRemote remote, FluxRequestDelegate delegate) {
            remote.updateEntries(batch, target, delegate);
          }
        });
        if (!result.wasSuccessful()) {
          Logger.warn(LOG_TAG, "Couldn't mark " + batch.size() + " entries " + target + ": " + result.describeFailure());
          failed += batch.size();
          continue;
        }
        processed += batch.size();
        confirmLocally(removeSynced(batch, target), target);
        invalidation.addEntries(batch, target);
      }
    }
    return new int[] { processed, failed };
  }

  private void confirmLocally(Collection<Long> ids, ReadingStatus target) {
    for (Long id : ids) {
      try {
        store.write(id, target, false);
      } catch (EntryNotFoundException e) {
        // Not downloaded, or purged since; the server is what matters.
        Logger.trace(LOG_TAG, "No local record for synced entry " + id + ".");
      } catch (EntryStatusStoreException e) {
        Logger.warn(LOG_TAG, "Couldn't record synced status of entry " + id + ".", e);
      }
    }
  }

  /**
   * Remove synced entries from the queue, keeping any re-queued with a
   * different target while we were talking to the server.
   *
   * @return the ids removed; only these still want <code>target</code> locally.
   */
  private List<Long> removeSynced(Collection<Long> ids, final ReadingStatus target) {
    final List<Long> removed = new ArrayList<Long>();
    try {
      queues.status.removeMatching(ids, new PersistentQueue.EntryFilter<StatusQueueEntry>() {
        @Override
        public boolean matches(long id, StatusQueueEntry entry) {
          if (entry.targetStatus != target) {
            return false;
          }
          removed.add(id);
          return true;
        }
      });
    } catch (IOException e) {
      Logger.error(LOG_TAG, "Couldn't remove synced entries from queue.", e);
    }
    return removed;
  }

  /**
   * @return processed and failed counts.
   */
  protected int[] drainCollectionQueue(PersistentQueue<CollectionQueueEntry> queue, final boolean isFeed,
                                       ServerCredentials credentials, CacheInvalidation.Builder invalidation) {
    final Map<Long, CollectionQueueEntry> queued = queue.load();
    int processed = 0;
    int failed = 0;
    for (Entry<Long, CollectionQueueEntry> e : queued.entrySet()) {
      final long id = e.getKey();
      if (e.getValue().operation != CollectionOperation.MARK_ALL_READ) {
        continue;
      }
      final Result result = BlockingRequestDelegate.execute(remoteFactory, credentials,
          "Marking " + queue.getName() + " " + id + " as read", new BlockingRequestDelegate.Call() {
        @Override
        public void start(FluxRemote remote, FluxRequestDelegate delegate) {
          if (isFeed) {
            remote.markFeedAsRead(id, delegate);
          } else {
            remote.markCategoryAsRead(id, delegate);
          }
        }
      });
      if (!result.wasSuccessful()) {
        Logger.warn(LOG_TAG, "Failed to mark " + queue.getName() + " " + id + " as read: " + result.describeFailure());
        failed++;
        continue;
      }
      processed++;
      try {
        queue.remove(id);
      } catch (IOException ex) {
        Logger.error(LOG_TAG, "Couldn't remove " + queue.getName() + " " + id + " from queue.", ex);
      }
      if (isFeed) {
        invalidation.addFeed(id);
      } else {
        invalidation.addCategory(id);
      }
    }
    return new int[] { processed, failed };
  }

  /**
   * Discard everything pending without syncing it.
   *
   * @param confirmed true if the user has already agreed; otherwise they're asked.
   */
  public synchronized SyncSummary clearAll(boolean confirmed) {
    if (!confirmed) {
      final QueueCounts counts = getTotalQueueCount();
      if (!confirmation.confirmClear(counts)) {
        Logger.debug(LOG_TAG, "Clearing declined.");
        return SyncSummary.of(SyncSummary.Result.CLEAR_DECLINED);
      }
    }

    final List<String> failed = queues.clearAll();
    if (failed.isEmpty()) {
      notifier.success("All sync queues cleared");
      return SyncSummary.of(SyncSummary.Result.QUEUES_CLEARED);
    }
    notifier.error("Failed to clear queues: " + Utils.toCommaSeparatedString(failed));
    return SyncSummary.of(SyncSummary.Result.CLEAR_FAILED);
  }
}
