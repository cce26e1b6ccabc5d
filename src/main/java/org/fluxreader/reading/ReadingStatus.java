/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

/**
 * Status of an entry, as the server names it.
 * <p>
 * <code>REMOVED</code> is only ever reported by the server; it can't be
 * written locally. For read/unread purposes it counts as unread.
 */
public enum ReadingStatus {
  READ("read"),
  UNREAD("unread"),
  REMOVED("removed");

  private final String wireValue;

  private ReadingStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  public String getWireValue() {
    return wireValue;
  }

  public boolean isRead() {
    return this == READ;
  }

  /**
   * Whether the two statuses look the same to a reader.
   */
  public boolean sameClassificationAs(ReadingStatus other) {
    return other != null && this.isRead() == other.isRead();
  }

  public boolean isSettableLocally() {
    return this != REMOVED;
  }

  /**
   * The status a toggle would leave behind.
   */
  public ReadingStatus opposite() {
    return isRead() ? UNREAD : READ;
  }

  /**
   * @return the status with the given wire value, or null if unknown.
   */
  public static ReadingStatus fromWireValue(String value) {
    if (value == null) {
      return null;
    }
    for (ReadingStatus status : values()) {
      if (status.wireValue.equals(value)) {
        return status;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return wireValue;
  }
}
