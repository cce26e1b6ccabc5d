/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

/**
 * Local persistence of an entry's status failed. The write did not happen.
 */
public class EntryStatusStoreException extends Exception {
  private static final long serialVersionUID = 4187734652094116530L;

  public EntryStatusStoreException(String detailMessage) {
    super(detailMessage);
  }

  public EntryStatusStoreException(String detailMessage, Throwable cause) {
    super(detailMessage, cause);
  }
}
