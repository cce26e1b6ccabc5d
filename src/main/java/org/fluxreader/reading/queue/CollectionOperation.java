/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.queue;

/**
 * Operations that act on a whole feed or category.
 */
public enum CollectionOperation {
  MARK_ALL_READ("mark_all_read");

  private final String wireValue;

  private CollectionOperation(String wireValue) {
    this.wireValue = wireValue;
  }

  public String getWireValue() {
    return wireValue;
  }

  public static CollectionOperation fromWireValue(String value) {
    for (CollectionOperation op : values()) {
      if (op.wireValue.equals(value)) {
        return op;
      }
    }
    return null;
  }
}
