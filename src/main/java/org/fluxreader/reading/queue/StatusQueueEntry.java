/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.queue;

import org.fluxreader.reading.ReadingStatus;

/**
 * A pending status change for one entry.
 */
public class StatusQueueEntry extends QueueEntry {
  public final ReadingStatus targetStatus;
  // What to roll back to if the change is abandoned.
  public final ReadingStatus originalStatus;

  public StatusQueueEntry(ReadingStatus targetStatus, ReadingStatus originalStatus, long timestamp) {
    super(timestamp);
    if (targetStatus == null || originalStatus == null) {
      throw new IllegalArgumentException("Statuses must not be null.");
    }
    this.targetStatus = targetStatus;
    this.originalStatus = originalStatus;
  }

  public StatusQueueEntry(ReadingStatus targetStatus, ReadingStatus originalStatus) {
    this(targetStatus, originalStatus, System.currentTimeMillis());
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof StatusQueueEntry)) {
      return false;
    }
    final StatusQueueEntry other = (StatusQueueEntry) o;
    return targetStatus == other.targetStatus &&
           originalStatus == other.originalStatus &&
           timestamp == other.timestamp;
  }

  @Override
  public int hashCode() {
    return (int) (31 * (31 * targetStatus.hashCode() + originalStatus.hashCode()) + timestamp);
  }

  @Override
  public String toString() {
    return "StatusQueueEntry[" + originalStatus + " -> " + targetStatus + " @ " + timestamp + "]";
  }
}
