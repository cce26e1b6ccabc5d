/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import org.fluxreader.background.common.log.Logger;

/**
 * A notifier for headless use: messages go to the log.
 */
public class LoggingSyncNotifier implements SyncNotifier {
  private static final String LOG_TAG = "SyncNotifier";

  @Override
  public void info(String message) {
    Logger.info(LOG_TAG, message);
  }

  @Override
  public void success(String message) {
    Logger.info(LOG_TAG, message);
  }

  @Override
  public void error(String message) {
    Logger.warn(LOG_TAG, message);
  }
}
