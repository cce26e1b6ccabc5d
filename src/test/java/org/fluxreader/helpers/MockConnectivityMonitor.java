/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.helpers;

import org.fluxreader.reading.ConnectivityMonitor;

public class MockConnectivityMonitor implements ConnectivityMonitor {
  public volatile boolean online;

  public MockConnectivityMonitor(boolean online) {
    this.online = online;
  }

  @Override
  public boolean isOnline() {
    return online;
  }
}
