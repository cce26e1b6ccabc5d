/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.coordinator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class TestSyncSummary {
  private static SyncSummary summary(int processed, int failed) {
    return new SyncSummary(SyncSummary.Result.SYNCED, processed, failed, 0, 0, 0, 0);
  }

  @Test
  public void testCompletionMessages() {
    assertEquals("1 change synced", summary(1, 0).completionMessage());
    assertEquals("4 changes synced", summary(4, 0).completionMessage());
    assertEquals("4 changes synced, 2 failed", summary(4, 2).completionMessage());
    assertEquals("1 change failed to sync", summary(0, 1).completionMessage());
    assertEquals("3 changes failed to sync", summary(0, 3).completionMessage());
    assertNull(summary(0, 0).completionMessage());
  }

  @Test
  public void testTotalsSpanQueues() {
    final SyncSummary s = new SyncSummary(SyncSummary.Result.SYNCED, 1, 2, 3, 4, 5, 6);
    assertEquals(9, s.processed());
    assertEquals(12, s.failed());
    assertEquals(0, SyncSummary.of(SyncSummary.Result.DEFERRED).processed());
  }
}
