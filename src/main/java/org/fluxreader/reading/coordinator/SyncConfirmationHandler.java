/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.coordinator;

/**
 * Asks the user before a drain, and before discarding unsynced changes.
 * Called on the thread that started the drain; implementations may block
 * waiting for an answer.
 */
public interface SyncConfirmationHandler {
  /**
   * "Sync N pending changes?"
   */
  public SyncDecision confirmSync(QueueCounts counts);

  /**
   * "You still have N entries that need to sync with the server. This
   * action cannot be undone."
   *
   * @return true to discard them.
   */
  public boolean confirmClear(QueueCounts counts);

  /**
   * Syncs without asking, and never discards anything.
   */
  public static final SyncConfirmationHandler SYNC_WITHOUT_ASKING = new SyncConfirmationHandler() {
    @Override
    public SyncDecision confirmSync(QueueCounts counts) {
      return SyncDecision.SYNC_NOW;
    }

    @Override
    public boolean confirmClear(QueueCounts counts) {
      return false;
    }
  };
}
