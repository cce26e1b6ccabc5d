/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.queue;

/**
 * A pending operation on a feed or category.
 */
public class CollectionQueueEntry extends QueueEntry {
  public final CollectionOperation operation;

  public CollectionQueueEntry(CollectionOperation operation, long timestamp) {
    super(timestamp);
    if (operation == null) {
      throw new IllegalArgumentException("operation must not be null.");
    }
    this.operation = operation;
  }

  public CollectionQueueEntry(CollectionOperation operation) {
    this(operation, System.currentTimeMillis());
  }

  public static CollectionQueueEntry markAllRead() {
    return new CollectionQueueEntry(CollectionOperation.MARK_ALL_READ);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CollectionQueueEntry)) {
      return false;
    }
    final CollectionQueueEntry other = (CollectionQueueEntry) o;
    return operation == other.operation && timestamp == other.timestamp;
  }

  @Override
  public int hashCode() {
    return (int) (31 * operation.hashCode() + timestamp);
  }

  @Override
  public String toString() {
    return "CollectionQueueEntry[" + operation.getWireValue() + " @ " + timestamp + "]";
  }
}
