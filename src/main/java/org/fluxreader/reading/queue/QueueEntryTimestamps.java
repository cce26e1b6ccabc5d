/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.queue;

import org.fluxreader.sync.ExtendedJSONObject;
import org.fluxreader.sync.UnexpectedJSONException.BadRequiredFieldJSONException;

class QueueEntryTimestamps {
  private QueueEntryTimestamps() {
  }

  // Entries written without a timestamp sort as oldest.
  static long timestampOf(ExtendedJSONObject o) throws BadRequiredFieldJSONException {
    try {
      final Long timestamp = o.getLong("timestamp");
      return timestamp == null ? 0L : timestamp.longValue();
    } catch (ClassCastException e) {
      throw new BadRequiredFieldJSONException("Bad timestamp in queue entry.");
    }
  }
}
