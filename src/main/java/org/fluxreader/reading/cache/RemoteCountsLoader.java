/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.cache;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Map.Entry;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.reading.BlockingRequestDelegate;
import org.fluxreader.reading.BlockingRequestDelegate.Result;
import org.fluxreader.reading.FluxRemote;
import org.fluxreader.reading.FluxRemoteFactory;
import org.fluxreader.reading.FluxRequestDelegate;
import org.fluxreader.reading.ReadingStatus;
import org.fluxreader.reading.ServerCredentials;
import org.fluxreader.reading.ServerSettings;
import org.fluxreader.sync.ExtendedJSONObject;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Loads unread counts from the server: the overall total from
 * <code>/entries</code>, per-feed counts from <code>/feeds/counters</code>,
 * and per-category counts from <code>/categories?counts=true</code>.
 */
public class RemoteCountsLoader implements CountsLoader {
  private static final String LOG_TAG = "RemoteCountsLoader";

  private final ServerSettings settings;
  private final FluxRemoteFactory remoteFactory;

  public RemoteCountsLoader(ServerSettings settings, FluxRemoteFactory remoteFactory) {
    this.settings = settings;
    this.remoteFactory = remoteFactory;
  }

  private Result fetch(ServerCredentials credentials, String what, BlockingRequestDelegate.Call call) throws IOException {
    final Result result = BlockingRequestDelegate.execute(remoteFactory, credentials, "Fetching " + what, call);
    if (!result.wasSuccessful()) {
      throw new IOException("Couldn't fetch " + what + ": " + result.describeFailure());
    }
    return result;
  }

  @Override
  public Counts loadCounts() throws Exception {
    final ServerCredentials credentials = settings.getCredentials();

    final ExtendedJSONObject entries = fetch(credentials, "unread entries", new BlockingRequestDelegate.Call() {
      @Override
      public void start(FluxRemote remote, FluxRequestDelegate delegate) {
        remote.getEntries(ReadingStatus.UNREAD, 1, delegate);
      }
    }).response.jsonObjectBody();
    final Long total = entries.getLong("total");

    final ExtendedJSONObject feedCounters = fetch(credentials, "feed counters", new BlockingRequestDelegate.Call() {
      @Override
      public void start(FluxRemote remote, FluxRequestDelegate delegate) {
        remote.getFeedCounters(delegate);
      }
    }).response.jsonObjectBody();
    final Map<Long, Long> byFeed = new HashMap<Long, Long>();
    final ExtendedJSONObject unreads = feedCounters.getObject("unreads");
    if (unreads != null) {
      for (Entry<String, Object> e : unreads.entrySet()) {
        try {
          byFeed.put(Long.parseLong(e.getKey(), 10), ((Number) e.getValue()).longValue());
        } catch (RuntimeException ex) {
          Logger.warn(LOG_TAG, "Skipping bad feed counter " + e.getKey() + ".");
        }
      }
    }

    final JSONArray categoryList = fetch(credentials, "categories", new BlockingRequestDelegate.Call() {
      @Override
      public void start(FluxRemote remote, FluxRequestDelegate delegate) {
        remote.getCategories(true, delegate);
      }
    }).response.jsonArrayBody();
    final Map<Long, Long> byCategory = new HashMap<Long, Long>();
    if (categoryList != null) {
      for (Object o : categoryList) {
        if (!(o instanceof JSONObject)) {
          continue;
        }
        final ExtendedJSONObject category = new ExtendedJSONObject((JSONObject) o);
        try {
          final Long id = category.getLong("id");
          final Long count = category.getLong("total_unread");
          if (id != null) {
            byCategory.put(id, count == null ? 0L : count);
          }
        } catch (ClassCastException ex) {
          Logger.warn(LOG_TAG, "Skipping malformed category " + category + ".");
        }
      }
    }

    final Counts counts = new Counts(total == null ? 0L : total, byFeed, byCategory);
    Logger.debug(LOG_TAG, "Loaded " + counts + ".");
    return counts;
  }
}
