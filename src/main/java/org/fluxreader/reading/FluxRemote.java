/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import java.util.Collection;

/**
 * The slice of the Miniflux API this engine uses.
 * <p>
 * Calls may block the calling thread until the delegate has been invoked.
 */
public interface FluxRemote {
  /**
   * <code>PUT /entries</code> with <code>{"entry_ids": [...], "status": ...}</code>.
   * One call updates every id; the server answers for the batch as a whole.
   */
  public void updateEntries(Collection<Long> entryIds, ReadingStatus status, FluxRequestDelegate delegate);

  /**
   * <code>PUT /feeds/{id}/mark-all-as-read</code>.
   */
  public void markFeedAsRead(long feedId, FluxRequestDelegate delegate);

  /**
   * <code>PUT /categories/{id}/mark-all-as-read</code>.
   */
  public void markCategoryAsRead(long categoryId, FluxRequestDelegate delegate);

  /**
   * <code>GET /entries?status=...&amp;limit=...</code>.
   *
   * @param status may be null for every status.
   * @param limit non-positive for the server default.
   */
  public void getEntries(ReadingStatus status, int limit, FluxRequestDelegate delegate);

  /**
   * <code>GET /feeds/counters</code>.
   */
  public void getFeedCounters(FluxRequestDelegate delegate);

  /**
   * <code>GET /categories</code>, optionally with unread counts.
   */
  public void getCategories(boolean withCounts, FluxRequestDelegate delegate);

  /**
   * <code>GET /me</code>; useful for testing a connection.
   */
  public void getMe(FluxRequestDelegate delegate);

  /**
   * Abort anything in flight, and fail later requests immediately.
   */
  public void abortAll();
}
