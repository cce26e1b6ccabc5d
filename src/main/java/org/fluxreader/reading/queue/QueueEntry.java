/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.queue;

/**
 * A pending operation on one entity. A queue holds at most one per entity id.
 */
public abstract class QueueEntry {
  // Milliseconds since the epoch.
  public final long timestamp;

  protected QueueEntry(long timestamp) {
    this.timestamp = timestamp;
  }
}
