/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import java.io.File;

import org.fluxreader.background.common.PrefsBranch;
import org.fluxreader.background.common.PropertiesPrefs;
import org.fluxreader.background.common.log.Logger;
import org.fluxreader.reading.cache.CacheInvalidationBus;
import org.fluxreader.reading.cache.CachingEntryStatusStore;
import org.fluxreader.reading.cache.CountsCache;
import org.fluxreader.reading.cache.RemoteCountsLoader;
import org.fluxreader.reading.coordinator.QueueSyncCoordinator;
import org.fluxreader.reading.coordinator.SyncConfirmationHandler;
import org.fluxreader.reading.coordinator.SyncSummary;
import org.fluxreader.reading.coordinator.SyncTrigger;
import org.fluxreader.reading.dispatch.EntryStatusDispatcher;
import org.fluxreader.reading.queue.SyncQueues;
import org.fluxreader.sync.net.BaseResource;

/**
 * Wires the store, queues, dispatcher, coordinator and caches together for
 * one data directory.
 */
public class FluxSyncEngine {
  private static final String LOG_TAG = "FluxSyncEngine";

  public static final String PREFS_FILENAME = "fluxreader.properties";

  protected final ServerSettings settings;
  protected final ConnectivityMonitor connectivity;

  protected final CacheInvalidationBus bus;
  protected final CachingEntryStatusStore store;
  protected final SyncQueues queues;
  protected final EntryStatusDispatcher dispatcher;
  protected final QueueSyncCoordinator coordinator;
  protected final EntryStatusService entryStatusService;
  protected final CollectionMarkAsReadService collectionService;
  protected final CountsCache countsCache;

  private boolean started = false;

  public FluxSyncEngine(File dataDir,
                        ServerSettings settings,
                        FluxRemoteFactory remoteFactory,
                        ConnectivityMonitor connectivity,
                        SyncNotifier notifier,
                        SyncConfirmationHandler confirmation) {
    this.settings = settings;
    this.connectivity = connectivity;

    this.bus = new CacheInvalidationBus();
    this.store = new CachingEntryStatusStore(new LocalEntryStatusStore(dataDir));
    this.queues = new SyncQueues(dataDir);
    this.dispatcher = new EntryStatusDispatcher(store, queues.status, settings, remoteFactory, connectivity, bus);
    this.coordinator = new QueueSyncCoordinator(queues, store, settings, remoteFactory, bus, notifier, confirmation);
    this.entryStatusService = new EntryStatusService(store, queues.status, dispatcher, settings,
                                                     remoteFactory, connectivity, bus, notifier);
    this.collectionService = new CollectionMarkAsReadService(queues, settings, remoteFactory, connectivity, bus, notifier);
    this.countsCache = new CountsCache(new RemoteCountsLoader(settings, remoteFactory));
  }

  /**
   * An engine talking to a real server, with settings persisted in the data
   * directory and defaults from the classpath.
   */
  public static FluxSyncEngine create(File dataDir,
                                      ConnectivityMonitor connectivity,
                                      SyncNotifier notifier,
                                      SyncConfirmationHandler confirmation) {
    final PropertiesPrefs prefs = new PropertiesPrefs(new File(dataDir, PREFS_FILENAME),
                                                      PropertiesPrefs.loadDefaults(ReadingConstants.DEFAULTS_RESOURCE));
    final ServerSettings settings = new PrefsServerSettings(new PrefsBranch(prefs, ReadingConstants.PREFS_BRANCH));
    return new FluxSyncEngine(dataDir, settings, FluxClient.FACTORY, connectivity, notifier, confirmation);
  }

  /**
   * A headless engine: notices go to the log and queued changes sync
   * without asking.
   */
  public static FluxSyncEngine create(File dataDir, ConnectivityMonitor connectivity) {
    return create(dataDir, connectivity, new LoggingSyncNotifier(), SyncConfirmationHandler.SYNC_WITHOUT_ASKING);
  }

  /**
   * Populate caches and start listening for invalidations. If asked, and
   * the network is up, drain whatever was left queued last time.
   *
   * @return the startup drain's summary, or null if none ran.
   */
  public synchronized SyncSummary start(boolean syncOnStartup) {
    if (started) {
      throw new IllegalStateException("Already started.");
    }
    started = true;

    bus.subscribe(store);
    bus.subscribe(countsCache);
    try {
      store.populate();
    } catch (EntryStatusStoreException e) {
      Logger.warn(LOG_TAG, "Couldn't populate entry cache; entries will load lazily.", e);
    }

    if (!syncOnStartup || !connectivity.isOnline() || queues.totalCount() == 0) {
      return null;
    }
    return coordinator.processAll(SyncTrigger.STARTUP);
  }

  /**
   * Terminate workers and stop listening. Pending changes stay queued.
   */
  public synchronized void shutdown() {
    dispatcher.shutdown();
    if (started) {
      bus.unsubscribe(store);
      bus.unsubscribe(countsCache);
      started = false;
    }
    BaseResource.closeExpiredConnections();
    Logger.info(LOG_TAG, "Shut down.");
  }

  public ServerSettings getSettings() {
    return settings;
  }

  public CacheInvalidationBus getInvalidationBus() {
    return bus;
  }

  public EntryStatusStore getStore() {
    return store;
  }

  public SyncQueues getQueues() {
    return queues;
  }

  public EntryStatusDispatcher getDispatcher() {
    return dispatcher;
  }

  public QueueSyncCoordinator getCoordinator() {
    return coordinator;
  }

  public EntryStatusService getEntryStatusService() {
    return entryStatusService;
  }

  public CollectionMarkAsReadService getCollectionService() {
    return collectionService;
  }

  public CountsCache getCountsCache() {
    return countsCache;
  }
}
