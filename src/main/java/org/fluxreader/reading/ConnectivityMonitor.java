/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

/**
 * Answers whether the network is available right now.
 */
public interface ConnectivityMonitor {
  public boolean isOnline();

  public static final ConnectivityMonitor ALWAYS_ONLINE = new ConnectivityMonitor() {
    @Override
    public boolean isOnline() {
      return true;
    }
  };
}
