/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.queue;

import org.fluxreader.reading.ReadingStatus;
import org.fluxreader.sync.ExtendedJSONObject;
import org.fluxreader.sync.UnexpectedJSONException;
import org.fluxreader.sync.UnexpectedJSONException.BadRequiredFieldJSONException;

/**
 * Translates queue entries to and from their persisted JSON form.
 */
public interface QueueEntryCodec<T extends QueueEntry> {
  public ExtendedJSONObject encode(T entry);
  public T decode(ExtendedJSONObject o) throws UnexpectedJSONException;

  public static final QueueEntryCodec<StatusQueueEntry> STATUS = new QueueEntryCodec<StatusQueueEntry>() {
    @Override
    public ExtendedJSONObject encode(StatusQueueEntry entry) {
      final ExtendedJSONObject o = new ExtendedJSONObject();
      o.put("targetStatus", entry.targetStatus.getWireValue());
      o.put("originalStatus", entry.originalStatus.getWireValue());
      o.put("timestamp", entry.timestamp);
      return o;
    }

    @Override
    public StatusQueueEntry decode(ExtendedJSONObject o) throws UnexpectedJSONException {
      o.throwIfFieldsMissingOrMisTyped(new String[] { "targetStatus", "originalStatus" }, String.class);
      final ReadingStatus target = ReadingStatus.fromWireValue(o.getString("targetStatus"));
      final ReadingStatus original = ReadingStatus.fromWireValue(o.getString("originalStatus"));
      if (target == null || !target.isSettableLocally() || original == null) {
        throw new BadRequiredFieldJSONException("Bad statuses in queue entry: " + o.toJSONString());
      }
      return new StatusQueueEntry(target, original, QueueEntryTimestamps.timestampOf(o));
    }
  };

  public static final QueueEntryCodec<CollectionQueueEntry> COLLECTION = new QueueEntryCodec<CollectionQueueEntry>() {
    @Override
    public ExtendedJSONObject encode(CollectionQueueEntry entry) {
      final ExtendedJSONObject o = new ExtendedJSONObject();
      o.put("operation", entry.operation.getWireValue());
      o.put("timestamp", entry.timestamp);
      return o;
    }

    @Override
    public CollectionQueueEntry decode(ExtendedJSONObject o) throws UnexpectedJSONException {
      o.throwIfFieldsMissingOrMisTyped(new String[] { "operation" }, String.class);
      final CollectionOperation operation = CollectionOperation.fromWireValue(o.getString("operation"));
      if (operation == null) {
        throw new BadRequiredFieldJSONException("Unknown operation in queue entry: " + o.toJSONString());
      }
      return new CollectionQueueEntry(operation, QueueEntryTimestamps.timestampOf(o));
    }
  };
}
