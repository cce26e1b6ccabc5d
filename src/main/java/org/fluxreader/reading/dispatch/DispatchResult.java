/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.dispatch;

/**
 * What {@link EntryStatusDispatcher#dispatch(long, org.fluxreader.reading.ReadingStatus)}
 * did before returning.
 */
public enum DispatchResult {
  // The entry already had that status; nothing was written or sent.
  NO_OP,
  // Written locally; a worker is updating the server.
  DISPATCHED,
  // Written locally and queued for the next sync.
  QUEUED
}
