/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.dispatch;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.reading.ConnectivityMonitor;
import org.fluxreader.reading.EntryNotFoundException;
import org.fluxreader.reading.EntryStatusRecord;
import org.fluxreader.reading.EntryStatusStore;
import org.fluxreader.reading.EntryStatusStoreException;
import org.fluxreader.reading.FluxRemoteFactory;
import org.fluxreader.reading.ReadingStatus;
import org.fluxreader.reading.ServerCredentials;
import org.fluxreader.reading.ServerSettings;
import org.fluxreader.reading.cache.CacheInvalidation;
import org.fluxreader.reading.cache.CacheInvalidationBus;
import org.fluxreader.reading.queue.PersistentQueue;
import org.fluxreader.reading.queue.StatusQueueEntry;

/**
 * Applies an entry status change locally right away, then updates the server
 * from a worker thread.
 * <p>
 * At most one worker per entry is live: a new dispatch terminates the old
 * worker first, and whatever the old worker reports afterwards is dropped.
 * Local state (store, queue, handles) is only touched while holding this
 * object's lock; network I/O happens only on workers, outside it.
 * <p>
 * When a worker finishes:
 * <ul>
 * <li>success: the entry's queued fallback, if any, is removed and caches are told;</li>
 * <li>failure: the local change is reverted (marked as a worker write) and the change is queued;</li>
 * <li>no network: the change is queued.</li>
 * </ul>
 * If there is no network at dispatch time, or no worker can be started, the
 * change is queued immediately instead.
 */
public class EntryStatusDispatcher {
  private static final String LOG_TAG = "EntryDispatcher";

  protected final EntryStatusStore store;
  protected final PersistentQueue<StatusQueueEntry> queue;
  protected final ServerSettings settings;
  protected final FluxRemoteFactory remoteFactory;
  protected final ConnectivityMonitor connectivity;
  protected final CacheInvalidationBus bus;

  protected final ExecutorService workers;
  protected final ScheduledExecutorService reaper;

  private final Map<Long, DispatchHandle> handles = new HashMap<Long, DispatchHandle>();
  private long nextGeneration = 1;
  private boolean shutdown = false;

  private final StatusUpdateTask.ResultReceiver receiver = new StatusUpdateTask.ResultReceiver() {
    @Override
    public void onOutcome(DispatchHandle handle, DispatchOutcome outcome) {
      complete(handle, outcome);
    }
  };

  private static ThreadFactory namedDaemonThreads(final String prefix) {
    return new ThreadFactory() {
      private final AtomicInteger count = new AtomicInteger(0);

      @Override
      public Thread newThread(Runnable r) {
        final Thread thread = new Thread(r, prefix + "-" + count.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }

  public EntryStatusDispatcher(EntryStatusStore store,
                               PersistentQueue<StatusQueueEntry> queue,
                               ServerSettings settings,
                               FluxRemoteFactory remoteFactory,
                               ConnectivityMonitor connectivity,
                               CacheInvalidationBus bus) {
    this(store, queue, settings, remoteFactory, connectivity, bus,
         Executors.newFixedThreadPool(settings.getDispatchWorkerCount(), namedDaemonThreads("FluxDispatch")));
  }

  public EntryStatusDispatcher(EntryStatusStore store,
                               PersistentQueue<StatusQueueEntry> queue,
                               ServerSettings settings,
                               FluxRemoteFactory remoteFactory,
                               ConnectivityMonitor connectivity,
                               CacheInvalidationBus bus,
                               ExecutorService workers) {
    if (store == null || queue == null || settings == null || remoteFactory == null ||
        connectivity == null || bus == null || workers == null) {
      throw new IllegalArgumentException("Dispatcher collaborators must not be null.");
    }
    this.store = store;
    this.queue = queue;
    this.settings = settings;
    this.remoteFactory = remoteFactory;
    this.connectivity = connectivity;
    this.bus = bus;
    this.workers = workers;
    this.reaper = Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("FluxDispatchReaper"));

    final long interval = settings.getReaperIntervalSeconds();
    this.reaper.scheduleWithFixedDelay(new Runnable() {
      @Override
      public void run() {
        try {
          reap();
        } catch (Exception e) {
          Logger.warn(LOG_TAG, "Reaper failed.", e);
        }
      }
    }, interval, interval, TimeUnit.SECONDS);
  }

  /**
   * Change an entry's status. Returns once the change is visible locally;
   * never waits for the network.
   *
   * @throws EntryNotFoundException if the entry isn't stored locally.
   * @throws EntryStatusStoreException if the local write failed; nothing changed.
   * @throws IOException if the change couldn't be queued for later. It has
   *         been applied locally.
   */
  public synchronized DispatchResult dispatch(long entryId, ReadingStatus newStatus) throws EntryStatusStoreException, IOException {
    if (newStatus == null || !newStatus.isSettableLocally()) {
      throw new IllegalArgumentException("Can't dispatch status " + newStatus + ".");
    }

    final EntryStatusRecord current = store.load(entryId);
    if (current == null) {
      throw new EntryNotFoundException(entryId);
    }

    if (current.status.sameClassificationAs(newStatus)) {
      Logger.debug(LOG_TAG, "Entry " + entryId + " is already " + current.status + "; nothing to do.");
      cancelLocked(entryId);
      return DispatchResult.NO_OP;
    }

    final ReadingStatus originalStatus = current.status;
    store.write(entryId, newStatus, false);

    cancelLocked(entryId);

    if (shutdown || !connectivity.isOnline()) {
      Logger.debug(LOG_TAG, "Offline; queueing " + newStatus + " for entry " + entryId + ".");
      enqueueFallback(entryId, newStatus, originalStatus);
      return DispatchResult.QUEUED;
    }

    replaceStaleQueuedChange(entryId, newStatus, originalStatus);

    final ServerCredentials credentials = settings.getCredentials();
    final DispatchHandle handle = new DispatchHandle(entryId, nextGeneration++, newStatus, originalStatus);
    final StatusUpdateTask task = new StatusUpdateTask(handle, credentials, remoteFactory.createRemote(credentials),
                                                       connectivity, receiver);
    handle.setTask(task);

    // Registered before submitting: an executor may run the task inline.
    handles.put(entryId, handle);
    final Future<?> future;
    try {
      future = workers.submit(task);
    } catch (RejectedExecutionException e) {
      handles.remove(entryId);
      Logger.warn(LOG_TAG, "Couldn't start worker for entry " + entryId + "; queueing.", e);
      enqueueFallback(entryId, newStatus, originalStatus);
      return DispatchResult.QUEUED;
    }
    handle.setFuture(future);
    Logger.debug(LOG_TAG, "Dispatched " + handle + ".");
    return DispatchResult.DISPATCHED;
  }

  /**
   * Apply a worker's outcome. Outcomes from terminated or replaced workers
   * are dropped.
   */
  protected synchronized void complete(DispatchHandle handle, DispatchOutcome outcome) {
    if (handle.isCancelled() || handles.get(handle.entryId) != handle) {
      Logger.debug(LOG_TAG, "Dropping " + outcome + " from superseded " + handle + ".");
      return;
    }
    handles.remove(handle.entryId);

    switch (outcome) {
    case SUCCESS:
      try {
        queue.remove(handle.entryId);
      } catch (IOException e) {
        Logger.error(LOG_TAG, "Couldn't clear queued change for entry " + handle.entryId + ".", e);
      }
      bus.publish(CacheInvalidation.forEntry(handle.entryId, handle.targetStatus));
      return;

    case FAILED:
      revert(handle);
      enqueueFallbackQuietly(handle);
      return;

    case OFFLINE:
      enqueueFallbackQuietly(handle);
      return;
    }
  }

  private void revert(DispatchHandle handle) {
    // REMOVED can't be written back; the closest readable state is unread.
    final ReadingStatus revertTo = handle.originalStatus.isSettableLocally() ? handle.originalStatus : ReadingStatus.UNREAD;
    try {
      store.write(handle.entryId, revertTo, true);
      Logger.info(LOG_TAG, "Reverted entry " + handle.entryId + " to " + revertTo + ".");
    } catch (EntryNotFoundException e) {
      Logger.info(LOG_TAG, "Entry " + handle.entryId + " was purged; nothing to revert.");
    } catch (EntryStatusStoreException e) {
      Logger.error(LOG_TAG, "Couldn't revert entry " + handle.entryId + ".", e);
    }
  }

  private void enqueueFallback(long entryId, ReadingStatus target, ReadingStatus original) throws IOException {
    queue.enqueue(entryId, new StatusQueueEntry(target, original));
  }

  /**
   * A queued change for the other status must not be drained while this
   * worker is live, or the drain would confirm the older intent locally.
   */
  private void replaceStaleQueuedChange(long entryId, ReadingStatus target, ReadingStatus original) {
    final StatusQueueEntry queued = queue.get(entryId);
    if (queued == null || queued.targetStatus == target) {
      return;
    }
    try {
      enqueueFallback(entryId, target, original);
      Logger.debug(LOG_TAG, "Replaced queued " + queued.targetStatus + " for entry " + entryId + " with " + target + ".");
    } catch (IOException e) {
      Logger.error(LOG_TAG, "Couldn't replace queued change for entry " + entryId + ".", e);
    }
  }

  private void enqueueFallbackQuietly(DispatchHandle handle) {
    try {
      enqueueFallback(handle.entryId, handle.targetStatus, handle.originalStatus);
    } catch (IOException e) {
      Logger.error(LOG_TAG, "Couldn't queue " + handle.targetStatus + " for entry " + handle.entryId + ".", e);
    }
  }

  private void cancelLocked(long entryId) {
    final DispatchHandle previous = handles.remove(entryId);
    if (previous == null) {
      return;
    }
    Logger.debug(LOG_TAG, "Terminating " + previous + ".");
    previous.cancel();
  }

  /**
   * Terminate the live worker for an entry, if any. Do this before purging
   * an entry so that a late worker can't write to it.
   *
   * @return true if there was a live worker.
   */
  public synchronized boolean cancel(long entryId) {
    final boolean live = handles.containsKey(entryId);
    cancelLocked(entryId);
    return live;
  }

  public synchronized boolean isDispatching(long entryId) {
    final DispatchHandle handle = handles.get(entryId);
    return handle != null && !handle.isDone();
  }

  public synchronized int liveWorkerCount() {
    int live = 0;
    for (DispatchHandle handle : handles.values()) {
      if (!handle.isDone()) {
        live++;
      }
    }
    return live;
  }

  /**
   * Forget handles whose workers have finished without reporting.
   *
   * @return the number of handles cleared.
   */
  public synchronized int reap() {
    int reaped = 0;
    final Iterator<DispatchHandle> it = handles.values().iterator();
    while (it.hasNext()) {
      if (it.next().isDone()) {
        it.remove();
        reaped++;
      }
    }
    if (reaped > 0) {
      Logger.debug(LOG_TAG, "Reaped " + reaped + " finished handles.");
    }
    return reaped;
  }

  /**
   * Terminate every worker and stop accepting new ones. Later dispatches
   * queue their changes.
   */
  public void shutdown() {
    final ArrayList<DispatchHandle> live;
    synchronized (this) {
      shutdown = true;
      live = new ArrayList<DispatchHandle>(handles.values());
      handles.clear();
    }
    for (DispatchHandle handle : live) {
      handle.cancel();
    }
    workers.shutdownNow();
    reaper.shutdownNow();
    Logger.debug(LOG_TAG, "Shut down; terminated " + live.size() + " workers.");
  }
}
