/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import java.util.List;

/**
 * Local persisted status of entries. No network access.
 * <p>
 * A failed call leaves the stored record as it was.
 */
public interface EntryStatusStore {
  /**
   * @return the record for <code>entryId</code>, or null if the entry is not
   *         stored locally.
   */
  public EntryStatusRecord load(long entryId) throws EntryStatusStoreException;

  /**
   * Atomically change the status of a stored entry, refreshing its
   * <code>lastUpdated</code> time.
   *
   * @param viaWorker
   *          true if a dispatch worker is reverting a rejected change; marks
   *          the record as pending from a worker. False clears that mark.
   * @return the record as written.
   * @throws EntryNotFoundException if the entry is not stored locally.
   * @throws IllegalArgumentException if <code>newStatus</code> can't be set locally.
   */
  public EntryStatusRecord write(long entryId, ReadingStatus newStatus, boolean viaWorker) throws EntryStatusStoreException;

  /**
   * Materialize or replace a whole record, e.g., when an entry is downloaded.
   */
  public void save(EntryStatusRecord record) throws EntryStatusStoreException;

  /**
   * Purge an entry.
   *
   * @return true if there was something to delete.
   */
  public boolean delete(long entryId) throws EntryStatusStoreException;

  /**
   * @return the ids of every entry stored locally, in ascending order.
   */
  public List<Long> entryIds() throws EntryStatusStoreException;
}
