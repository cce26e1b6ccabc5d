/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.coordinator;

public enum SyncDecision {
  SYNC_NOW,
  LATER,
  // Throw away the pending changes. Still subject to confirmClear.
  DELETE_QUEUE
}
