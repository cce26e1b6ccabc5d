/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

/**
 * Where user-facing messages go: toasts, a status bar, a log.
 */
public interface SyncNotifier {
  public void info(String message);
  public void success(String message);
  public void error(String message);
}
