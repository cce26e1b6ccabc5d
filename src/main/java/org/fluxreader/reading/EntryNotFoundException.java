/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

public class EntryNotFoundException extends EntryStatusStoreException {
  private static final long serialVersionUID = -2471905233270785542L;

  public final long entryId;

  public EntryNotFoundException(long entryId) {
    super("No local record for entry " + entryId + ".");
    this.entryId = entryId;
  }
}
