/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.cache;

import java.util.concurrent.CopyOnWriteArrayList;

import org.fluxreader.background.common.log.Logger;

/**
 * Tells caches that the server has confirmed a change, so that they drop
 * stale aggregates. Publishers don't know who listens; listeners don't know
 * about queues or workers.
 */
public class CacheInvalidationBus {
  private static final String LOG_TAG = "InvalidationBus";

  // Copy-on-write so that listeners can (un)subscribe while we publish.
  private final CopyOnWriteArrayList<CacheInvalidationListener> listeners = new CopyOnWriteArrayList<CacheInvalidationListener>();

  public void subscribe(CacheInvalidationListener listener) {
    if (listener == null) {
      throw new IllegalArgumentException("listener must not be null.");
    }
    if (!listeners.addIfAbsent(listener)) {
      Logger.warn(LOG_TAG, "Listener " + listener + " already subscribed.");
    }
  }

  public void unsubscribe(CacheInvalidationListener listener) {
    if (!listeners.remove(listener)) {
      Logger.warn(LOG_TAG, "Tried to unsubscribe unknown listener " + listener + ".");
    }
  }

  public int listenerCount() {
    return listeners.size();
  }

  /**
   * Deliver to every listener. One listener throwing doesn't stop the others.
   */
  public void publish(CacheInvalidation invalidation) {
    if (invalidation == null || invalidation.isEmpty()) {
      Logger.debug(LOG_TAG, "Nothing to invalidate.");
      return;
    }
    Logger.debug(LOG_TAG, "Publishing " + invalidation + " to " + listeners.size() + " listeners.");
    for (CacheInvalidationListener listener : listeners) {
      try {
        listener.onCacheInvalidated(invalidation);
      } catch (Exception e) {
        Logger.error(LOG_TAG, "Listener " + listener + " threw handling " + invalidation + ".", e);
      }
    }
  }
}
