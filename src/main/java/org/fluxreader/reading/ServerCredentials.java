/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

/**
 * An immutable snapshot of what a request needs to reach the server.
 */
public class ServerCredentials {
  public final String serverAddress;
  public final String apiToken;
  public final int connectTimeoutMillis;
  public final int socketTimeoutMillis;

  public ServerCredentials(String serverAddress, String apiToken, int connectTimeoutMillis, int socketTimeoutMillis) {
    this.serverAddress = serverAddress;
    this.apiToken = apiToken;
    this.connectTimeoutMillis = connectTimeoutMillis;
    this.socketTimeoutMillis = socketTimeoutMillis;
  }

  public boolean isConfigured() {
    return serverAddress != null && serverAddress.trim().length() > 0 &&
           apiToken != null && apiToken.trim().length() > 0;
  }

  @Override
  public String toString() {
    // No token here; it ends up in logs.
    return "ServerCredentials[" + serverAddress + "]";
  }
}
