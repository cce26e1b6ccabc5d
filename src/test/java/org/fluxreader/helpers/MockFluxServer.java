/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.helpers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.http.HttpVersion;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.message.BasicHttpResponse;
import org.apache.http.message.BasicStatusLine;
import org.fluxreader.reading.FluxRemote;
import org.fluxreader.reading.FluxRemoteFactory;
import org.fluxreader.reading.FluxRequestDelegate;
import org.fluxreader.reading.ReadingStatus;
import org.fluxreader.reading.ServerCredentials;
import org.fluxreader.sync.net.FluxResponse;

/**
 * Stands in for a Miniflux server. Hands out remotes that answer
 * synchronously, record what they were asked, and can be told to fail or to
 * hang until released or aborted.
 */
public class MockFluxServer {
  public static class Update {
    public final List<Long> entryIds;
    public final ReadingStatus status;

    public Update(Collection<Long> entryIds, ReadingStatus status) {
      this.entryIds = new ArrayList<Long>(entryIds);
      this.status = status;
    }

    @Override
    public String toString() {
      return status + " " + entryIds;
    }
  }

  public static final String BODY_ENTRIES = "entries";
  public static final String BODY_FEED_COUNTERS = "counters";
  public static final String BODY_CATEGORIES = "categories";

  private final List<String> calls = new ArrayList<String>();
  private final List<Update> updates = new ArrayList<Update>();
  private final Set<ReadingStatus> failingStatuses = new HashSet<ReadingStatus>();
  private final Set<Long> failingFeeds = new HashSet<Long>();
  private final Set<Long> failingCategories = new HashSet<Long>();
  private final Map<String, String> bodies = new HashMap<String, String>();

  public volatile int failureCode = 500;
  public volatile Runnable duringUpdate;
  public volatile boolean failReads = false;

  private final Object gate = new Object();
  private boolean holding = false;
  private int entered = 0;
  private int completed = 0;
  private int aborts = 0;
  private int remotesCreated = 0;

  public static FluxResponse response(int code, String body) {
    final BasicHttpResponse r = new BasicHttpResponse(new BasicStatusLine(HttpVersion.HTTP_1_1, code, "Mock"));
    if (body != null) {
      r.setEntity(new StringEntity(body, ContentType.APPLICATION_JSON));
    }
    return new FluxResponse(r);
  }

  public FluxRemoteFactory factory() {
    return new FluxRemoteFactory() {
      @Override
      public FluxRemote createRemote(ServerCredentials credentials) {
        synchronized (gate) {
          remotesCreated++;
        }
        return new Remote();
      }
    };
  }

  public synchronized void failStatus(ReadingStatus status) {
    failingStatuses.add(status);
  }

  public synchronized void failFeed(long feedId) {
    failingFeeds.add(feedId);
  }

  public synchronized void failCategory(long categoryId) {
    failingCategories.add(categoryId);
  }

  public synchronized void failEverything() {
    failingStatuses.add(ReadingStatus.READ);
    failingStatuses.add(ReadingStatus.UNREAD);
    failingFeeds.add(-1L);
    failingCategories.add(-1L);
  }

  public synchronized void setBody(String key, String body) {
    bodies.put(key, body);
  }

  public synchronized List<String> calls() {
    return new ArrayList<String>(calls);
  }

  public synchronized List<Update> updates() {
    return new ArrayList<Update>(updates);
  }

  /**
   * Make every call hang until {@link #release()}, or until its remote is aborted.
   */
  public void hold() {
    synchronized (gate) {
      holding = true;
    }
  }

  public void release() {
    synchronized (gate) {
      holding = false;
      gate.notifyAll();
    }
  }

  public int enteredCount() {
    synchronized (gate) {
      return entered;
    }
  }

  public int completedCount() {
    synchronized (gate) {
      return completed;
    }
  }

  public int abortCount() {
    synchronized (gate) {
      return aborts;
    }
  }

  public int remotesCreated() {
    synchronized (gate) {
      return remotesCreated;
    }
  }

  public void waitForEntered(final int n) {
    WaitHelper.waitFor(n + " calls to reach the server", new WaitHelper.Condition() {
      @Override
      public boolean isSatisfied() {
        return enteredCount() >= n;
      }
    });
  }

  public void waitForCompleted(final int n) {
    WaitHelper.waitFor(n + " calls to complete", new WaitHelper.Condition() {
      @Override
      public boolean isSatisfied() {
        return completedCount() >= n;
      }
    });
  }

  private synchronized boolean shouldFail(Set<Long> failing, long id) {
    return failing.contains(id) || failing.contains(-1L);
  }

  private synchronized String bodyFor(String key) {
    return bodies.get(key);
  }

  private class Remote implements FluxRemote {
    // Guarded by gate.
    private boolean aborted = false;

    private boolean awaitRelease() {
      synchronized (gate) {
        entered++;
        gate.notifyAll();
        while (holding && !aborted) {
          try {
            gate.wait();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
          }
        }
        return !aborted;
      }
    }

    private void respond(String call, boolean fail, String body, FluxRequestDelegate delegate) {
      synchronized (MockFluxServer.this) {
        calls.add(call);
      }
      try {
        if (!awaitRelease()) {
          delegate.onFailure(new IOException("Aborted."));
          return;
        }
        if (fail) {
          delegate.onFailure(response(failureCode, "{\"error_message\":\"Mock failure\"}"));
          return;
        }
        delegate.onSuccess(response(body == null ? 204 : 200, body));
      } finally {
        synchronized (gate) {
          completed++;
          gate.notifyAll();
        }
      }
    }

    @Override
    public void updateEntries(Collection<Long> entryIds, ReadingStatus status, FluxRequestDelegate delegate) {
      final boolean fail;
      synchronized (MockFluxServer.this) {
        updates.add(new Update(entryIds, status));
        fail = failingStatuses.contains(status);
      }
      final Runnable hook = duringUpdate;
      if (hook != null) {
        hook.run();
      }
      respond("updateEntries " + status + " " + entryIds, fail, null, delegate);
    }

    @Override
    public void markFeedAsRead(long feedId, FluxRequestDelegate delegate) {
      respond("markFeedAsRead " + feedId, shouldFail(failingFeeds, feedId), null, delegate);
    }

    @Override
    public void markCategoryAsRead(long categoryId, FluxRequestDelegate delegate) {
      respond("markCategoryAsRead " + categoryId, shouldFail(failingCategories, categoryId), null, delegate);
    }

    @Override
    public void getEntries(ReadingStatus status, int limit, FluxRequestDelegate delegate) {
      respond("getEntries " + status + " " + limit, failReads, bodyFor(BODY_ENTRIES), delegate);
    }

    @Override
    public void getFeedCounters(FluxRequestDelegate delegate) {
      respond("getFeedCounters", failReads, bodyFor(BODY_FEED_COUNTERS), delegate);
    }

    @Override
    public void getCategories(boolean withCounts, FluxRequestDelegate delegate) {
      respond("getCategories " + withCounts, failReads, bodyFor(BODY_CATEGORIES), delegate);
    }

    @Override
    public void getMe(FluxRequestDelegate delegate) {
      respond("getMe", false, "{\"id\":1,\"username\":\"reader\"}", delegate);
    }

    @Override
    public void abortAll() {
      synchronized (gate) {
        aborted = true;
        aborts++;
        gate.notifyAll();
      }
    }
  }
}
