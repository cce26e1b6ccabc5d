/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

/**
 * Settings the engine reads. The settings UI writes them.
 */
public interface ServerSettings {
  public String getServerAddress();
  public String getApiToken();

  /**
   * Whether opening an entry marks it read.
   */
  public boolean getMarkAsReadOnOpen();

  /**
   * Maximum number of entry ids per status update while draining the queue;
   * zero or less means no limit.
   */
  public int getStatusBatchSize();

  /**
   * Which status group is sent first while draining the queue.
   */
  public ReadingStatus getFirstBatchStatus();

  public int getConnectTimeoutSeconds();
  public int getTotalTimeoutSeconds();
  public int getReaperIntervalSeconds();
  public int getDispatchWorkerCount();

  /**
   * @return a snapshot of the current connection settings.
   */
  public ServerCredentials getCredentials();
}
