/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import org.fluxreader.background.common.Prefs;
import org.fluxreader.background.common.log.Logger;

/**
 * {@link ServerSettings} kept in a preferences branch.
 */
public class PrefsServerSettings implements ServerSettings {
  private static final String LOG_TAG = "PrefsServerSettings";

  public static final String PREF_SERVER_ADDRESS = "server.address";
  public static final String PREF_SERVER_TOKEN = "server.token";
  public static final String PREF_MARK_READ_ON_OPEN = "sync.mark_read_on_open";
  public static final String PREF_BATCH_SIZE = "sync.batch.size";
  public static final String PREF_BATCH_ORDER = "sync.batch.order";
  public static final String PREF_CONNECT_TIMEOUT = "net.timeout.connect.seconds";
  public static final String PREF_TOTAL_TIMEOUT = "net.timeout.total.seconds";
  public static final String PREF_REAPER_INTERVAL = "dispatch.reaper.interval.seconds";
  public static final String PREF_DISPATCH_WORKERS = "dispatch.workers";

  public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;
  public static final int DEFAULT_TOTAL_TIMEOUT_SECONDS = 30;
  public static final int DEFAULT_REAPER_INTERVAL_SECONDS = 30;
  public static final int DEFAULT_DISPATCH_WORKERS = 4;

  protected final Prefs prefs;

  public PrefsServerSettings(Prefs prefs) {
    if (prefs == null) {
      throw new IllegalArgumentException("prefs must not be null.");
    }
    this.prefs = prefs;
  }

  @Override
  public String getServerAddress() {
    return prefs.getString(PREF_SERVER_ADDRESS, "");
  }

  @Override
  public String getApiToken() {
    return prefs.getString(PREF_SERVER_TOKEN, "");
  }

  @Override
  public boolean getMarkAsReadOnOpen() {
    return prefs.getBoolean(PREF_MARK_READ_ON_OPEN, true);
  }

  @Override
  public int getStatusBatchSize() {
    return Math.max(0, prefs.getInt(PREF_BATCH_SIZE, 0));
  }

  @Override
  public ReadingStatus getFirstBatchStatus() {
    final String value = prefs.getString(PREF_BATCH_ORDER, ReadingStatus.READ.getWireValue());
    final ReadingStatus status = ReadingStatus.fromWireValue(value);
    if (status == null || !status.isSettableLocally()) {
      Logger.warn(LOG_TAG, "Ignoring unknown batch order " + value + ".");
      return ReadingStatus.READ;
    }
    return status;
  }

  private int positive(String key, int defValue) {
    final int value = prefs.getInt(key, defValue);
    if (value <= 0) {
      Logger.warn(LOG_TAG, "Ignoring non-positive " + key + ": " + value);
      return defValue;
    }
    return value;
  }

  @Override
  public int getConnectTimeoutSeconds() {
    return positive(PREF_CONNECT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT_SECONDS);
  }

  @Override
  public int getTotalTimeoutSeconds() {
    return positive(PREF_TOTAL_TIMEOUT, DEFAULT_TOTAL_TIMEOUT_SECONDS);
  }

  @Override
  public int getReaperIntervalSeconds() {
    return positive(PREF_REAPER_INTERVAL, DEFAULT_REAPER_INTERVAL_SECONDS);
  }

  @Override
  public int getDispatchWorkerCount() {
    return positive(PREF_DISPATCH_WORKERS, DEFAULT_DISPATCH_WORKERS);
  }

  @Override
  public ServerCredentials getCredentials() {
    return new ServerCredentials(getServerAddress(),
                                 getApiToken(),
                                 getConnectTimeoutSeconds() * 1000,
                                 getTotalTimeoutSeconds() * 1000);
  }

  public boolean setServer(String address, String token) {
    return prefs.edit()
                .putString(PREF_SERVER_ADDRESS, address)
                .putString(PREF_SERVER_TOKEN, token)
                .commit();
  }

  public boolean setMarkAsReadOnOpen(boolean enabled) {
    return prefs.edit().putBoolean(PREF_MARK_READ_ON_OPEN, enabled).commit();
  }

  public boolean setStatusBatching(int batchSize, ReadingStatus first) {
    return prefs.edit()
                .putInt(PREF_BATCH_SIZE, batchSize)
                .putString(PREF_BATCH_ORDER, first.getWireValue())
                .commit();
  }
}
