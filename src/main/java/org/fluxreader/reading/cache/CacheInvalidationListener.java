/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.cache;

/**
 * Implemented by caches that hold aggregates derived from server state.
 * Called on the thread that published, after the server has confirmed a change.
 */
public interface CacheInvalidationListener {
  public void onCacheInvalidated(CacheInvalidation invalidation);
}
