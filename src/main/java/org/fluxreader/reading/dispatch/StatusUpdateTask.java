/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.dispatch;

import java.util.Collection;
import java.util.Collections;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.reading.BlockingRequestDelegate;
import org.fluxreader.reading.BlockingRequestDelegate.Result;
import org.fluxreader.reading.ConnectivityMonitor;
import org.fluxreader.reading.FluxRemote;
import org.fluxreader.reading.FluxRequestDelegate;
import org.fluxreader.reading.ServerCredentials;

/**
 * Updates one entry's status on the server. Runs on a worker thread with its
 * own remote, built from a frozen copy of the credentials; it shares no
 * mutable state with the dispatcher and reports back through a
 * {@link ResultReceiver}.
 */
public class StatusUpdateTask implements Runnable {
  private static final String LOG_TAG = "StatusUpdateTask";

  /**
   * Receives exactly one outcome per task.
   */
  public interface ResultReceiver {
    public void onOutcome(DispatchHandle handle, DispatchOutcome outcome);
  }

  private final DispatchHandle handle;
  private final ServerCredentials credentials;
  private final FluxRemote remote;
  private final ConnectivityMonitor connectivity;
  private final ResultReceiver receiver;

  public StatusUpdateTask(DispatchHandle handle, ServerCredentials credentials, FluxRemote remote,
                          ConnectivityMonitor connectivity, ResultReceiver receiver) {
    this.handle = handle;
    this.credentials = credentials;
    this.remote = remote;
    this.connectivity = connectivity;
    this.receiver = receiver;
  }

  /**
   * Abort the request in flight, if any. Safe from any thread.
   */
  public void abort() {
    remote.abortAll();
  }

  @Override
  public void run() {
    receiver.onOutcome(handle, perform());
  }

  protected DispatchOutcome perform() {
    try {
      if (!connectivity.isOnline()) {
        Logger.debug(LOG_TAG, "Offline; not updating entry " + handle.entryId + ".");
        return DispatchOutcome.OFFLINE;
      }

      final Collection<Long> ids = Collections.singletonList(handle.entryId);
      final Result result = BlockingRequestDelegate.execute(remote, BlockingRequestDelegate.deadlineMillis(credentials),
          "Updating entry " + handle.entryId, new BlockingRequestDelegate.Call() {
        @Override
        public void start(FluxRemote remote, FluxRequestDelegate delegate) {
          remote.updateEntries(ids, handle.targetStatus, delegate);
        }
      });
      if (result.wasSuccessful()) {
        Logger.debug(LOG_TAG, "Entry " + handle.entryId + " is " + handle.targetStatus + " on the server.");
        return DispatchOutcome.SUCCESS;
      }
      Logger.info(LOG_TAG, "Updating entry " + handle.entryId + " failed: " + result.describeFailure());
      return DispatchOutcome.FAILED;
    } catch (Exception e) {
      Logger.warn(LOG_TAG, "Unexpected exception updating entry " + handle.entryId + ".", e);
      return DispatchOutcome.FAILED;
    }
  }
}
