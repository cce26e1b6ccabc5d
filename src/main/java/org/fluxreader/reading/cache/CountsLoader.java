/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.cache;

/**
 * Computes fresh counts. May block on the network.
 */
public interface CountsLoader {
  public Counts loadCounts() throws Exception;
}
