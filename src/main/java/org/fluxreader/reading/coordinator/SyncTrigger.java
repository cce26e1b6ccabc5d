/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.coordinator;

/**
 * Why a drain was started. Only a user asking gets a confirmation prompt.
 */
public enum SyncTrigger {
  USER(false),
  CONNECTIVITY_RESTORED(true),
  STARTUP(true);

  private final boolean autoConfirms;

  private SyncTrigger(boolean autoConfirms) {
    this.autoConfirms = autoConfirms;
  }

  public boolean autoConfirms() {
    return autoConfirms;
  }
}
