/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.dispatch;

/**
 * How a dispatch worker's remote update ended.
 */
public enum DispatchOutcome {
  // The server accepted the change.
  SUCCESS,
  // The server rejected it, or the request failed or timed out.
  FAILED,
  // The worker found no network and didn't try.
  OFFLINE
}
