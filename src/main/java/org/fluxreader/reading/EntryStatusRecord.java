/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import org.fluxreader.sync.ExtendedJSONObject;
import org.fluxreader.sync.NonObjectJSONException;
import org.fluxreader.sync.UnexpectedJSONException;
import org.fluxreader.sync.UnexpectedJSONException.BadRequiredFieldJSONException;

/**
 * The locally persisted state of one entry: what the user currently sees.
 * <p>
 * Instances are immutable; mutations produce a new record.
 */
public class EntryStatusRecord {
  public static final int FORMAT_VERSION = 1;

  /**
   * A reference to the feed or category an entry belongs to.
   */
  public static class CollectionRef {
    public final long id;
    public final String title;

    public CollectionRef(long id, String title) {
      this.id = id;
      this.title = title;
    }

    public ExtendedJSONObject toJSON() {
      final ExtendedJSONObject o = new ExtendedJSONObject();
      o.put("id", id);
      o.put("title", title);
      return o;
    }

    public static CollectionRef fromJSON(ExtendedJSONObject o) {
      if (o == null) {
        return null;
      }
      final Long id = o.getLong("id");
      if (id == null) {
        return null;
      }
      return new CollectionRef(id, o.getString("title"));
    }

    @Override
    public String toString() {
      return "CollectionRef[" + id + "]";
    }
  }

  public final long id;
  public final ReadingStatus status;
  public final long lastUpdated;

  // Set when the last write was a revert by a dispatch worker rather than a user action.
  public final boolean pendingFromWorker;
  public final long pendingFromWorkerTimestamp;

  public final String title;
  public final String url;
  public final String publishedAt;
  public final CollectionRef feed;
  public final CollectionRef category;

  public EntryStatusRecord(long id, ReadingStatus status, long lastUpdated,
                           boolean pendingFromWorker, long pendingFromWorkerTimestamp,
                           String title, String url, String publishedAt,
                           CollectionRef feed, CollectionRef category) {
    if (status == null) {
      throw new IllegalArgumentException("status must not be null.");
    }
    this.id = id;
    this.status = status;
    this.lastUpdated = lastUpdated;
    this.pendingFromWorker = pendingFromWorker;
    this.pendingFromWorkerTimestamp = pendingFromWorker ? pendingFromWorkerTimestamp : -1L;
    this.title = title;
    this.url = url;
    this.publishedAt = publishedAt;
    this.feed = feed;
    this.category = category;
  }

  /**
   * A freshly materialized record with no pending worker write.
   */
  public EntryStatusRecord(long id, ReadingStatus status, String title, String url, String publishedAt,
                           CollectionRef feed, CollectionRef category) {
    this(id, status, System.currentTimeMillis(), false, -1L, title, url, publishedAt, feed, category);
  }

  public EntryStatusRecord(long id, ReadingStatus status) {
    this(id, status, null, null, null, null, null);
  }

  public boolean isRead() {
    return status.isRead();
  }

  /**
   * Return a copy carrying a new status.
   *
   * @param viaWorker true if a dispatch worker made this change.
   */
  public EntryStatusRecord withStatus(ReadingStatus newStatus, long now, boolean viaWorker) {
    return new EntryStatusRecord(id, newStatus, now,
                                 viaWorker, viaWorker ? now : -1L,
                                 title, url, publishedAt, feed, category);
  }

  public ExtendedJSONObject toJSON() {
    final ExtendedJSONObject o = new ExtendedJSONObject();
    o.put("version", FORMAT_VERSION);
    o.put("id", id);
    o.put("status", status.getWireValue());
    o.put("lastUpdated", lastUpdated);
    o.put("pendingFromSubprocess", pendingFromWorker);
    if (pendingFromWorker) {
      o.put("pendingFromSubprocessTimestamp", pendingFromWorkerTimestamp);
    }
    if (title != null) {
      o.put("title", title);
    }
    if (url != null) {
      o.put("url", url);
    }
    if (publishedAt != null) {
      o.put("publishedAt", publishedAt);
    }
    if (feed != null) {
      o.put("feed", feed.toJSON());
    }
    if (category != null) {
      o.put("category", category.toJSON());
    }
    return o;
  }

  public static EntryStatusRecord fromJSON(ExtendedJSONObject o) throws UnexpectedJSONException {
    try {
      return parse(o);
    } catch (ClassCastException e) {
      throw new UnexpectedJSONException("Mistyped record field: " + e.getMessage());
    }
  }

  private static EntryStatusRecord parse(ExtendedJSONObject o) throws UnexpectedJSONException {
    o.throwIfFieldsMissingOrMisTyped(new String[] { "id", "status" }, null);

    final Long version = o.getLong("version");
    if (version != null && version.longValue() != FORMAT_VERSION) {
      throw new UnexpectedJSONException("Unsupported record version " + version + ".");
    }

    final ReadingStatus status = ReadingStatus.fromWireValue(o.getString("status"));
    if (status == null) {
      throw new BadRequiredFieldJSONException("Unknown status " + o.get("status") + ".");
    }

    final Long id = o.getLong("id");
    final Long lastUpdated = o.getLong("lastUpdated");
    final Boolean pending = o.getBoolean("pendingFromSubprocess");
    final Long pendingTimestamp = o.getLong("pendingFromSubprocessTimestamp");

    final CollectionRef feed;
    final CollectionRef category;
    try {
      feed = CollectionRef.fromJSON(o.getObject("feed"));
      category = CollectionRef.fromJSON(o.getObject("category"));
    } catch (NonObjectJSONException e) {
      throw new UnexpectedJSONException("Bad collection reference: " + e.getMessage());
    }

    return new EntryStatusRecord(id,
                                 status,
                                 lastUpdated == null ? 0L : lastUpdated,
                                 pending != null && pending.booleanValue(),
                                 pendingTimestamp == null ? -1L : pendingTimestamp,
                                 o.getString("title"),
                                 o.getString("url"),
                                 o.getString("publishedAt"),
                                 feed,
                                 category);
  }

  @Override
  public String toString() {
    return "EntryStatusRecord[" + id + ", " + status + (pendingFromWorker ? ", pending" : "") + "]";
  }
}
