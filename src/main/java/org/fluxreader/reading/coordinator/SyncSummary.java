/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.coordinator;

/**
 * The result of a drain or a clear, across all three queues.
 */
public class SyncSummary {
  public enum Result {
    NOTHING_TO_SYNC,
    DEFERRED,
    SYNCED,
    QUEUES_CLEARED,
    CLEAR_DECLINED,
    CLEAR_FAILED
  }

  public final Result result;
  public final int statusProcessed;
  public final int statusFailed;
  public final int feedsProcessed;
  public final int feedsFailed;
  public final int categoriesProcessed;
  public final int categoriesFailed;

  public SyncSummary(Result result,
                     int statusProcessed, int statusFailed,
                     int feedsProcessed, int feedsFailed,
                     int categoriesProcessed, int categoriesFailed) {
    this.result = result;
    this.statusProcessed = statusProcessed;
    this.statusFailed = statusFailed;
    this.feedsProcessed = feedsProcessed;
    this.feedsFailed = feedsFailed;
    this.categoriesProcessed = categoriesProcessed;
    this.categoriesFailed = categoriesFailed;
  }

  public static SyncSummary of(Result result) {
    return new SyncSummary(result, 0, 0, 0, 0, 0, 0);
  }

  public int processed() {
    return statusProcessed + feedsProcessed + categoriesProcessed;
  }

  public int failed() {
    return statusFailed + feedsFailed + categoriesFailed;
  }

  /**
   * The message shown when a drain finishes, or null if there's nothing to say.
   */
  public String completionMessage() {
    final int processed = processed();
    final int failed = failed();
    if (processed > 0) {
      String message = processed == 1 ? "1 change synced" : processed + " changes synced";
      if (failed > 0) {
        message += ", " + failed + " failed";
      }
      return message;
    }
    if (failed > 0) {
      return failed == 1 ? "1 change failed to sync" : failed + " changes failed to sync";
    }
    return null;
  }

  @Override
  public String toString() {
    return "SyncSummary[" + result + ", " + processed() + " processed, " + failed() + " failed]";
  }
}
