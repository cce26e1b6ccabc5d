/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.dispatch;

import java.util.concurrent.Future;

import org.fluxreader.reading.ReadingStatus;

/**
 * Tracks the one worker that may be updating an entry on the server.
 */
public class DispatchHandle {
  public final long entryId;
  public final long generation;
  public final ReadingStatus targetStatus;
  public final ReadingStatus originalStatus;

  private StatusUpdateTask task;
  private volatile Future<?> future;
  private volatile boolean cancelled = false;

  DispatchHandle(long entryId, long generation, ReadingStatus targetStatus, ReadingStatus originalStatus) {
    this.entryId = entryId;
    this.generation = generation;
    this.targetStatus = targetStatus;
    this.originalStatus = originalStatus;
  }

  void setTask(StatusUpdateTask task) {
    this.task = task;
  }

  void setFuture(Future<?> future) {
    this.future = future;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * @return true once the worker has finished, been cancelled, or never started.
   */
  public boolean isDone() {
    final Future<?> f = future;
    return cancelled || f == null || f.isDone();
  }

  /**
   * Terminate the worker: abort its request and interrupt it. Anything it
   * reports afterwards is ignored.
   */
  void cancel() {
    cancelled = true;
    if (task != null) {
      task.abort();
    }
    final Future<?> f = future;
    if (f != null) {
      f.cancel(true);
    }
  }

  @Override
  public String toString() {
    return "DispatchHandle[" + entryId + "#" + generation + " " + originalStatus + " -> " + targetStatus +
           (cancelled ? ", cancelled" : "") + "]";
  }
}
