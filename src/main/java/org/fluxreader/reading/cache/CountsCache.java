/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.cache;

import org.fluxreader.background.common.log.Logger;

/**
 * Caches unread counts until the server confirms any change, then recomputes
 * on the next read.
 */
public class CountsCache implements CacheInvalidationListener {
  private static final String LOG_TAG = "CountsCache";

  private final CountsLoader loader;

  private Counts cached;
  private long generation = 0;

  public CountsCache(CountsLoader loader) {
    if (loader == null) {
      throw new IllegalArgumentException("loader must not be null.");
    }
    this.loader = loader;
  }

  /**
   * @return cached counts, loading them if needed.
   * @throws Exception if loading fails; nothing is cached in that case.
   */
  public Counts getCounts() throws Exception {
    final long loadingGeneration;
    synchronized (this) {
      if (cached != null) {
        return cached;
      }
      loadingGeneration = generation;
    }

    // Load outside the lock; don't cache if invalidated meanwhile.
    final Counts fresh = loader.loadCounts();
    synchronized (this) {
      if (generation == loadingGeneration) {
        cached = fresh;
      } else {
        Logger.debug(LOG_TAG, "Invalidated while loading; not caching.");
      }
    }
    return fresh;
  }

  /**
   * @return cached counts without loading, or null.
   */
  public synchronized Counts peek() {
    return cached;
  }

  public synchronized void invalidate() {
    generation++;
    if (cached != null) {
      Logger.debug(LOG_TAG, "Dropping cached counts.");
    }
    cached = null;
  }

  @Override
  public void onCacheInvalidated(CacheInvalidation invalidation) {
    invalidate();
  }
}
