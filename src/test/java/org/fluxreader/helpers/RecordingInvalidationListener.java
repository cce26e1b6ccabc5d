/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.helpers;

import java.util.ArrayList;
import java.util.List;

import org.fluxreader.reading.cache.CacheInvalidation;
import org.fluxreader.reading.cache.CacheInvalidationListener;

public class RecordingInvalidationListener implements CacheInvalidationListener {
  private final List<CacheInvalidation> received = new ArrayList<CacheInvalidation>();

  @Override
  public synchronized void onCacheInvalidated(CacheInvalidation invalidation) {
    received.add(invalidation);
  }

  public synchronized int count() {
    return received.size();
  }

  public synchronized CacheInvalidation get(int i) {
    return received.get(i);
  }

  public synchronized List<CacheInvalidation> all() {
    return new ArrayList<CacheInvalidation>(received);
  }

  public void waitForCount(final int expected) {
    WaitHelper.waitFor(expected + " invalidations", new WaitHelper.Condition() {
      @Override
      public boolean isSatisfied() {
        return count() >= expected;
      }
    });
  }
}
