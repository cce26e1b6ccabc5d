/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.sync.ExtendedJSONObject;
import org.fluxreader.sync.UnexpectedJSONException;
import org.fluxreader.util.FileUtils;

/**
 * Stores one JSON sidecar per entry, at <code>entries/&lt;id&gt;/metadata.json</code>
 * under a root directory. The entry directory may hold other files (downloaded
 * content); purging an entry removes the whole directory.
 * <p>
 * Writes replace the sidecar atomically, so a crash leaves either the old
 * record or the new one.
 */
public class LocalEntryStatusStore implements EntryStatusStore {
  private static final String LOG_TAG = "LocalEntryStore";

  private final File entriesDir;

  public LocalEntryStatusStore(File dataDir) {
    if (dataDir == null) {
      throw new IllegalArgumentException("dataDir must not be null.");
    }
    this.entriesDir = new File(dataDir, ReadingConstants.ENTRIES_DIRECTORY);
  }

  public File getEntryDirectory(long entryId) {
    return new File(entriesDir, Long.toString(entryId));
  }

  protected File getMetadataFile(long entryId) {
    return new File(getEntryDirectory(entryId), ReadingConstants.ENTRY_METADATA_FILENAME);
  }

  private static void throwIfInvalidId(long entryId) {
    if (entryId <= 0) {
      throw new IllegalArgumentException("Invalid entry id " + entryId + ".");
    }
  }

  @Override
  public synchronized EntryStatusRecord load(long entryId) throws EntryStatusStoreException {
    throwIfInvalidId(entryId);
    final File file = getMetadataFile(entryId);
    if (!file.exists()) {
      return null;
    }
    try {
      final ExtendedJSONObject o = ExtendedJSONObject.parseJSONObject(FileUtils.getFileContents(file));
      final EntryStatusRecord record = EntryStatusRecord.fromJSON(o);
      if (record.id != entryId) {
        throw new EntryStatusStoreException("Sidecar for entry " + entryId + " names entry " + record.id + ".");
      }
      return record;
    } catch (EntryStatusStoreException e) {
      throw e;
    } catch (IOException e) {
      throw new EntryStatusStoreException("Couldn't read record for entry " + entryId + ".", e);
    } catch (UnexpectedJSONException e) {
      throw new EntryStatusStoreException("Malformed record for entry " + entryId + ".", e);
    } catch (Exception e) {
      // ParseException, NonObjectJSONException, and friends.
      throw new EntryStatusStoreException("Unparseable record for entry " + entryId + ".", e);
    }
  }

  @Override
  public synchronized EntryStatusRecord write(long entryId, ReadingStatus newStatus, boolean viaWorker) throws EntryStatusStoreException {
    if (newStatus == null || !newStatus.isSettableLocally()) {
      throw new IllegalArgumentException("Can't set status " + newStatus + " locally.");
    }
    final EntryStatusRecord existing = load(entryId);
    if (existing == null) {
      throw new EntryNotFoundException(entryId);
    }
    final EntryStatusRecord updated = existing.withStatus(newStatus, System.currentTimeMillis(), viaWorker);
    persist(updated);
    Logger.debug(LOG_TAG, "Entry " + entryId + " now " + newStatus + (viaWorker ? " (worker revert)." : "."));
    return updated;
  }

  @Override
  public synchronized void save(EntryStatusRecord record) throws EntryStatusStoreException {
    if (record == null) {
      throw new IllegalArgumentException("record must not be null.");
    }
    throwIfInvalidId(record.id);
    persist(record);
    Logger.pii(LOG_TAG, "Saved entry " + record.id + ": " + record.title);
  }

  private void persist(EntryStatusRecord record) throws EntryStatusStoreException {
    try {
      FileUtils.writeFileAtomically(getMetadataFile(record.id), record.toJSON().toJSONString());
    } catch (IOException e) {
      throw new EntryStatusStoreException("Couldn't write record for entry " + record.id + ".", e);
    }
  }

  @Override
  public synchronized boolean delete(long entryId) throws EntryStatusStoreException {
    throwIfInvalidId(entryId);
    final File dir = getEntryDirectory(entryId);
    if (!dir.exists()) {
      return false;
    }
    if (!FileUtils.delete(dir, true)) {
      throw new EntryStatusStoreException("Couldn't delete " + dir.getPath() + ".");
    }
    Logger.debug(LOG_TAG, "Purged entry " + entryId + ".");
    return true;
  }

  @Override
  public synchronized List<Long> entryIds() throws EntryStatusStoreException {
    final List<Long> ids = new ArrayList<Long>();
    final File[] children = entriesDir.listFiles();
    if (children == null) {
      return ids;
    }
    for (File child : children) {
      if (!child.isDirectory()) {
        continue;
      }
      final long id;
      try {
        id = Long.parseLong(child.getName(), 10);
      } catch (NumberFormatException e) {
        Logger.debug(LOG_TAG, "Skipping non-entry directory " + child.getName() + ".");
        continue;
      }
      if (id > 0 && new File(child, ReadingConstants.ENTRY_METADATA_FILENAME).exists()) {
        ids.add(id);
      }
    }
    Collections.sort(ids);
    return ids;
  }
}
