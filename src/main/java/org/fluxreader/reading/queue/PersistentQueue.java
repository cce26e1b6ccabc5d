/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.queue;

import java.io.File;
import java.io.IOException;
import java.util.Collection;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedMap;
import java.util.TreeMap;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.sync.ExtendedJSONObject;
import org.fluxreader.sync.UnexpectedJSONException;
import org.fluxreader.util.FileUtils;

/**
 * A durable map from entity id to the one pending operation on that entity.
 * <p>
 * The whole map lives in a single versioned JSON file:
 *
 * <pre>
 * {"version": 1, "queue": "entry-status", "entries": {"42": {...}}}
 * </pre>
 *
 * Every mutation reads the file fresh, modifies the map, and writes it back
 * atomically; an empty map deletes the file instead, so "nothing pending" is
 * an existence check. A missing, unreadable, or foreign file reads as an
 * empty queue. Mutations are serialized per instance; hold exactly one
 * instance per file.
 *
 * @param <T> the kind of entry this queue holds.
 */
public class PersistentQueue<T extends QueueEntry> {
  private static final String LOG_TAG = "PersistentQueue";

  public static final int FORMAT_VERSION = 1;

  private static final String KEY_VERSION = "version";
  private static final String KEY_QUEUE = "queue";
  private static final String KEY_ENTRIES = "entries";

  /**
   * Selects queued entries, e.g., those still asking for what was just synced.
   */
  public interface EntryFilter<T> {
    public boolean matches(long id, T entry);
  }

  protected final File file;
  protected final String name;
  protected final QueueEntryCodec<T> codec;

  public PersistentQueue(File file, String name, QueueEntryCodec<T> codec) {
    if (file == null || name == null || codec == null) {
      throw new IllegalArgumentException("file, name, and codec must not be null.");
    }
    this.file = file;
    this.name = name;
    this.codec = codec;
  }

  public String getName() {
    return name;
  }

  public File getFile() {
    return file;
  }

  /**
   * @return true if anything is pending.
   */
  public synchronized boolean exists() {
    return file.exists();
  }

  /**
   * Read the queue. Never fails: problems with the backing file are logged
   * and produce an empty (or partial, if only some entries are malformed) map.
   *
   * @return a mutable map, ordered by id.
   */
  public synchronized SortedMap<Long, T> load() {
    final SortedMap<Long, T> entries = new TreeMap<Long, T>();
    if (!file.exists()) {
      return entries;
    }

    final ExtendedJSONObject root;
    try {
      root = ExtendedJSONObject.parseJSONObject(FileUtils.getFileContents(file));
    } catch (Exception e) {
      Logger.warn(LOG_TAG, "Queue " + name + " is unreadable; treating as empty.", e);
      return entries;
    }

    final ExtendedJSONObject queued;
    try {
      final Long version = root.getLong(KEY_VERSION);
      if (version == null || version.longValue() != FORMAT_VERSION) {
        Logger.warn(LOG_TAG, "Queue " + name + " has unsupported version " + version + "; treating as empty.");
        return entries;
      }
      final Object kind = root.get(KEY_QUEUE);
      if (!name.equals(kind)) {
        Logger.warn(LOG_TAG, "File for queue " + name + " holds queue " + kind + "; treating as empty.");
        return entries;
      }
      queued = root.getObject(KEY_ENTRIES);
    } catch (Exception e) {
      Logger.warn(LOG_TAG, "Queue " + name + " is malformed; treating as empty.", e);
      return entries;
    }

    if (queued == null) {
      return entries;
    }

    for (Entry<String, Object> e : queued.entrySet()) {
      final long id;
      try {
        id = Long.parseLong(e.getKey(), 10);
      } catch (NumberFormatException ex) {
        Logger.warn(LOG_TAG, "Skipping non-numeric id " + e.getKey() + " in queue " + name + ".");
        continue;
      }
      try {
        final ExtendedJSONObject value = queued.getObject(e.getKey());
        if (value == null) {
          throw new UnexpectedJSONException("null entry");
        }
        entries.put(id, codec.decode(value));
      } catch (UnexpectedJSONException ex) {
        Logger.warn(LOG_TAG, "Skipping malformed entry " + id + " in queue " + name + ": " + ex.getMessage());
      }
    }
    return entries;
  }

  /**
   * Replace the queue with <code>entries</code>. Saving an empty map deletes
   * the backing file.
   */
  public synchronized void save(Map<Long, T> entries) throws IOException {
    if (entries == null || entries.isEmpty()) {
      if (file.exists() && !file.delete()) {
        throw new IOException("Couldn't delete drained queue file " + file.getPath());
      }
      Logger.debug(LOG_TAG, "Queue " + name + " is empty.");
      return;
    }

    final ExtendedJSONObject queued = new ExtendedJSONObject();
    for (Entry<Long, T> e : entries.entrySet()) {
      queued.put(Long.toString(e.getKey()), codec.encode(e.getValue()));
    }
    final ExtendedJSONObject root = new ExtendedJSONObject();
    root.put(KEY_VERSION, FORMAT_VERSION);
    root.put(KEY_QUEUE, name);
    root.put(KEY_ENTRIES, queued);

    FileUtils.writeFileAtomically(file, root.toJSONString());
    Logger.trace(LOG_TAG, "Saved " + entries.size() + " entries to queue " + name + ".");
  }

  /**
   * Queue an operation, replacing any operation already pending for <code>id</code>.
   */
  public synchronized void enqueue(long id, T entry) throws IOException {
    if (entry == null) {
      throw new IllegalArgumentException("entry must not be null.");
    }
    final SortedMap<Long, T> entries = load();
    final T previous = entries.put(id, entry);
    save(entries);
    if (previous != null) {
      Logger.debug(LOG_TAG, "Replaced pending " + previous + " for " + id + " in queue " + name + ".");
    } else {
      Logger.debug(LOG_TAG, "Queued " + entry + " for " + id + " in queue " + name + ".");
    }
  }

  /**
   * Drop the operation pending for <code>id</code>. Removing an id that isn't
   * queued is a no-op.
   *
   * @return true if something was removed.
   */
  public synchronized boolean remove(long id) throws IOException {
    final SortedMap<Long, T> entries = load();
    if (entries.remove(id) == null) {
      return false;
    }
    save(entries);
    Logger.debug(LOG_TAG, "Removed " + id + " from queue " + name + ".");
    return true;
  }

  /**
   * Drop the operations pending for any of <code>ids</code> that the filter
   * accepts. A single read and write of the backing file.
   *
   * @return the number of entries removed.
   */
  public synchronized int removeMatching(Collection<Long> ids, EntryFilter<? super T> filter) throws IOException {
    final SortedMap<Long, T> entries = load();
    int removed = 0;
    for (Long id : ids) {
      final T entry = entries.get(id);
      if (entry == null) {
        continue;
      }
      if (filter != null && !filter.matches(id, entry)) {
        Logger.debug(LOG_TAG, "Keeping newer intent " + entry + " for " + id + " in queue " + name + ".");
        continue;
      }
      entries.remove(id);
      removed++;
    }
    if (removed > 0) {
      save(entries);
    }
    return removed;
  }

  /**
   * @return the operation pending for <code>id</code>, or null.
   */
  public synchronized T get(long id) {
    return load().get(id);
  }

  public synchronized int count() {
    return load().size();
  }

  /**
   * Discard everything pending.
   */
  public synchronized void clear() throws IOException {
    save(null);
  }
}
