/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import org.fluxreader.sync.net.FluxResponse;

/**
 * Response delegate for a single server request.
 * Only one of these methods will be called, and it will be called precisely once.
 * <p>
 * <code>onSuccess</code> means the server answered 200, 201 or 204;
 * <code>onFailure(FluxResponse)</code> means any other status;
 * <code>onFailure(Exception)</code> means the request didn't complete
 * (unreachable server, timeout, abort, bad configuration).
 */
public interface FluxRequestDelegate {
  void onSuccess(FluxResponse response);
  void onFailure(FluxResponse response);
  void onFailure(Exception e);
}
