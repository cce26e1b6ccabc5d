/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

/**
 * Makes a remote bound to one frozen set of credentials. Each dispatch worker
 * gets its own, so that terminating a worker aborts only its own requests.
 */
public interface FluxRemoteFactory {
  public FluxRemote createRemote(ServerCredentials credentials);
}
