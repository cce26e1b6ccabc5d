/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.reading.BlockingRequestDelegate.Result;
import org.fluxreader.reading.cache.CacheInvalidation;
import org.fluxreader.reading.cache.CacheInvalidationBus;
import org.fluxreader.reading.dispatch.DispatchResult;
import org.fluxreader.reading.dispatch.EntryStatusDispatcher;
import org.fluxreader.reading.queue.PersistentQueue;
import org.fluxreader.reading.queue.StatusQueueEntry;

/**
 * The operations a reader UI calls to change entry status.
 * <p>
 * Explicit changes talk to the server on the calling thread and fall back to
 * the queue if that fails; opening an entry hands off to the dispatcher and
 * returns at once.
 */
public class EntryStatusService {
  private static final String LOG_TAG = "EntryStatusService";

  protected final EntryStatusStore store;
  protected final PersistentQueue<StatusQueueEntry> queue;
  protected final EntryStatusDispatcher dispatcher;
  protected final ServerSettings settings;
  protected final FluxRemoteFactory remoteFactory;
  protected final ConnectivityMonitor connectivity;
  protected final CacheInvalidationBus bus;
  protected final SyncNotifier notifier;

  public EntryStatusService(EntryStatusStore store,
                            PersistentQueue<StatusQueueEntry> queue,
                            EntryStatusDispatcher dispatcher,
                            ServerSettings settings,
                            FluxRemoteFactory remoteFactory,
                            ConnectivityMonitor connectivity,
                            CacheInvalidationBus bus,
                            SyncNotifier notifier) {
    this.store = store;
    this.queue = queue;
    this.dispatcher = dispatcher;
    this.settings = settings;
    this.remoteFactory = remoteFactory;
    this.connectivity = connectivity;
    this.bus = bus;
    this.notifier = notifier;
  }

  private Result updateRemotely(final List<Long> ids, final ReadingStatus status) {
    if (!connectivity.isOnline()) {
      return Result.failure(new IOException("Offline."));
    }
    return BlockingRequestDelegate.execute(remoteFactory, settings.getCredentials(),
        "Marking " + ids.size() + " entries " + status, new BlockingRequestDelegate.Call() {
      @Override
      public void start(FluxRemote remote, FluxRequestDelegate delegate) {
        remote.updateEntries(ids, status, delegate);
      }
    });
  }

  /**
   * Write locally, tolerating entries that were never downloaded.
   */
  private void writeLocally(long entryId, ReadingStatus status) throws EntryStatusStoreException {
    try {
      store.write(entryId, status, false);
    } catch (EntryNotFoundException e) {
      Logger.trace(LOG_TAG, "Entry " + entryId + " isn't stored locally.");
    }
  }

  private static String offlineMessage(ReadingStatus status) {
    return status.isRead() ? "Marked as read (will sync when online)"
                           : "Marked as unread (will sync when online)";
  }

  /**
   * Explicitly set one entry's status, e.g., from a "mark as read" button.
   * Terminates any background update of the same entry first.
   *
   * @return true if the server confirmed the change; false if it was queued.
   * @throws EntryStatusStoreException if the local write failed.
   * @throws IOException if the change couldn't be queued.
   */
  public boolean changeEntryStatus(long entryId, ReadingStatus newStatus) throws EntryStatusStoreException, IOException {
    if (entryId <= 0) {
      notifier.error("Cannot change status: invalid entry ID");
      return false;
    }
    if (newStatus == null || !newStatus.isSettableLocally()) {
      throw new IllegalArgumentException("Can't set status " + newStatus + ".");
    }

    dispatcher.cancel(entryId);

    final Result result = updateRemotely(Collections.singletonList(entryId), newStatus);
    writeLocally(entryId, newStatus);

    if (result.wasSuccessful()) {
      queue.remove(entryId);
      bus.publish(CacheInvalidation.forEntry(entryId, newStatus));
      notifier.success("Entry marked as " + newStatus.getWireValue());
      return true;
    }

    Logger.info(LOG_TAG, "Queueing " + newStatus + " for entry " + entryId + ": " + result.describeFailure());
    // We don't know what the server has; assume the opposite.
    queue.enqueue(entryId, new StatusQueueEntry(newStatus, newStatus.opposite()));
    notifier.info(offlineMessage(newStatus));
    return false;
  }

  public boolean markEntriesAsRead(List<Long> entryIds) throws EntryStatusStoreException, IOException {
    return markEntries(entryIds, ReadingStatus.READ);
  }

  public boolean markEntriesAsUnread(List<Long> entryIds) throws EntryStatusStoreException, IOException {
    return markEntries(entryIds, ReadingStatus.UNREAD);
  }

  /**
   * Set the status of several entries in one request, queueing each of them
   * if that fails.
   *
   * @return true if the server confirmed the change; false if it was queued
   *         or there was nothing to do.
   */
  protected boolean markEntries(List<Long> entryIds, ReadingStatus status) throws EntryStatusStoreException, IOException {
    if (entryIds == null || entryIds.isEmpty()) {
      return false;
    }
    final List<Long> ids = new ArrayList<Long>(entryIds);
    for (Long id : ids) {
      dispatcher.cancel(id);
    }

    final Result result = updateRemotely(ids, status);
    for (Long id : ids) {
      writeLocally(id, status);
    }

    if (result.wasSuccessful()) {
      for (Long id : ids) {
        queue.remove(id);
      }
      bus.publish(new CacheInvalidation.Builder().addEntries(ids, status).build());
      notifier.success("Successfully marked " + ids.size() + " entries as " + status.getWireValue());
      return true;
    }

    Logger.info(LOG_TAG, "Queueing " + status + " for " + ids.size() + " entries: " + result.describeFailure());
    for (Long id : ids) {
      queue.enqueue(id, new StatusQueueEntry(status, status.opposite()));
    }
    notifier.info(offlineMessage(status));
    return false;
  }

  /**
   * Called when the reader opens an entry. Marks it read in the background
   * if the user wants that.
   *
   * @return what the dispatcher did, or null if auto-marking is off or the
   *         entry isn't stored locally.
   */
  public DispatchResult autoMarkAsRead(long entryId) throws EntryStatusStoreException, IOException {
    if (!settings.getMarkAsReadOnOpen()) {
      return null;
    }
    if (entryId <= 0) {
      return null;
    }
    try {
      final DispatchResult result = dispatcher.dispatch(entryId, ReadingStatus.READ);
      Logger.debug(LOG_TAG, "Auto-mark-as-read for entry " + entryId + ": " + result + ".");
      return result;
    } catch (EntryNotFoundException e) {
      Logger.debug(LOG_TAG, "Not auto-marking entry " + entryId + "; it isn't stored locally.");
      return null;
    }
  }

  /**
   * Purge a downloaded entry. Any background update of it is terminated
   * first so that it can't write to the purged entry.
   */
  public boolean deleteLocalEntry(long entryId) {
    dispatcher.cancel(entryId);
    try {
      if (store.delete(entryId)) {
        notifier.success("Local entry deleted successfully");
        return true;
      }
      notifier.error("Failed to delete local entry: not found");
      return false;
    } catch (EntryStatusStoreException e) {
      Logger.error(LOG_TAG, "Couldn't delete entry " + entryId + ".", e);
      notifier.error("Failed to delete local entry: " + e.getMessage());
      return false;
    }
  }
}
