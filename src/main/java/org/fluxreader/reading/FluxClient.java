/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.fluxreader.background.common.log.Logger;
import org.fluxreader.sync.ExtendedJSONObject;
import org.fluxreader.sync.Utils;
import org.fluxreader.sync.net.BaseResource;
import org.fluxreader.sync.net.BaseResourceDelegate;
import org.fluxreader.sync.net.FluxResponse;
import org.fluxreader.sync.net.Resource;
import org.fluxreader.sync.net.TokenAuthHeaderProvider;
import org.json.simple.JSONArray;

/**
 * Talks to a Miniflux server at <code>&lt;address&gt;/v1</code>, authenticating
 * with an API token.
 * <p>
 * Requests run synchronously on the calling thread. {@link #abortAll()} may
 * be called from any thread.
 */
public class FluxClient implements FluxRemote {
  private static final String LOG_TAG = "FluxClient";

  public static final FluxRemoteFactory FACTORY = new FluxRemoteFactory() {
    @Override
    public FluxRemote createRemote(ServerCredentials credentials) {
      return new FluxClient(credentials);
    }
  };

  private final ServerCredentials credentials;
  private final String userAgent;
  private final TokenAuthHeaderProvider authHeaderProvider;

  private final Set<BaseResource> inFlight = new HashSet<BaseResource>();
  private boolean aborted = false;

  public FluxClient(ServerCredentials credentials, String userAgent) {
    if (credentials == null) {
      throw new IllegalArgumentException("credentials must not be null.");
    }
    this.credentials = credentials;
    this.userAgent = userAgent;
    this.authHeaderProvider = credentials.apiToken == null ? null : new TokenAuthHeaderProvider(credentials.apiToken);
  }

  public FluxClient(ServerCredentials credentials) {
    this(credentials, ReadingConstants.USER_AGENT);
  }

  public ServerCredentials getCredentials() {
    return credentials;
  }

  /**
   * Turns HTTP outcomes into delegate calls, and logs server complaints.
   */
  private class FluxResourceDelegate extends BaseResourceDelegate {
    private final String description;
    private final FluxRequestDelegate delegate;

    public FluxResourceDelegate(Resource resource, String description, FluxRequestDelegate delegate) {
      super(resource, FluxClient.this.authHeaderProvider, FluxClient.this.userAgent,
            FluxClient.this.credentials.connectTimeoutMillis, FluxClient.this.credentials.socketTimeoutMillis);
      this.description = description;
      this.delegate = delegate;
    }

    @Override
    public void handleHttpResponse(HttpResponse response) {
      final FluxResponse res = new FluxResponse(response);
      if (res.wasSuccessful()) {
        Logger.debug(LOG_TAG, description + " -> " + res.getStatusCode());
        delegate.onSuccess(res);
        return;
      }
      if (res.isInvalidAuthentication()) {
        Logger.error(LOG_TAG, description + " rejected; check the API token.");
      } else {
        Logger.warn(LOG_TAG, description + " -> " + res.getStatusCode() + ": " + res.getErrorMessage());
      }
      delegate.onFailure(res);
    }

    @Override
    public void handleError(Exception e) {
      Logger.warn(LOG_TAG, description + " failed: " + e);
      delegate.onFailure(e);
    }
  }

  protected URI uriFor(String path) throws URISyntaxException {
    return new URI(Utils.stripTrailingSlashes(credentials.serverAddress.trim()) + ReadingConstants.API_PATH + path);
  }

  private enum Method {
    GET,
    PUT,
  }

  private void execute(Method method, String path, ExtendedJSONObject body, FluxRequestDelegate delegate) {
    if (delegate == null) {
      throw new IllegalArgumentException("delegate must not be null.");
    }
    if (!credentials.isConfigured()) {
      delegate.onFailure(new IllegalStateException("Server address and API token must be configured"));
      return;
    }

    final BaseResource resource;
    try {
      resource = new BaseResource(uriFor(path));
    } catch (URISyntaxException e) {
      Logger.warn(LOG_TAG, "Bad server address " + credentials.serverAddress + ".");
      delegate.onFailure(e);
      return;
    }

    synchronized (this) {
      if (aborted) {
        delegate.onFailure(new IOException("Client aborted."));
        return;
      }
      inFlight.add(resource);
    }

    final String description = method + " " + path;
    resource.delegate = new FluxResourceDelegate(resource, description, delegate);
    try {
      switch (method) {
      case GET:
        resource.get();
        break;
      case PUT:
        if (body == null) {
          resource.put((HttpEntity) null);
        } else {
          resource.put(body);
        }
        break;
      }
    } finally {
      synchronized (this) {
        inFlight.remove(resource);
      }
    }
  }

  @Override
  public void updateEntries(Collection<Long> entryIds, ReadingStatus status, FluxRequestDelegate delegate) {
    if (status == null || !status.isSettableLocally()) {
      throw new IllegalArgumentException("Can't set status " + status + ".");
    }
    final JSONArray ids = new JSONArray();
    ids.addAll(new ArrayList<Long>(entryIds));
    final ExtendedJSONObject body = new ExtendedJSONObject();
    body.put("entry_ids", ids);
    body.put("status", status.getWireValue());
    execute(Method.PUT, "/entries", body, delegate);
  }

  @Override
  public void markFeedAsRead(long feedId, FluxRequestDelegate delegate) {
    execute(Method.PUT, "/feeds/" + feedId + "/mark-all-as-read", null, delegate);
  }

  @Override
  public void markCategoryAsRead(long categoryId, FluxRequestDelegate delegate) {
    execute(Method.PUT, "/categories/" + categoryId + "/mark-all-as-read", null, delegate);
  }

  @Override
  public void getEntries(ReadingStatus status, int limit, FluxRequestDelegate delegate) {
    final StringBuilder query = new StringBuilder();
    if (status != null) {
      query.append("status=").append(status.getWireValue());
    }
    if (limit > 0) {
      if (query.length() > 0) {
        query.append('&');
      }
      query.append("limit=").append(limit);
    }
    execute(Method.GET, query.length() == 0 ? "/entries" : "/entries?" + query, null, delegate);
  }

  @Override
  public void getFeedCounters(FluxRequestDelegate delegate) {
    execute(Method.GET, "/feeds/counters", null, delegate);
  }

  @Override
  public void getCategories(boolean withCounts, FluxRequestDelegate delegate) {
    execute(Method.GET, withCounts ? "/categories?counts=true" : "/categories", null, delegate);
  }

  @Override
  public void getMe(FluxRequestDelegate delegate) {
    execute(Method.GET, "/me", null, delegate);
  }

  @Override
  public void abortAll() {
    final ArrayList<BaseResource> toAbort;
    synchronized (this) {
      aborted = true;
      toAbort = new ArrayList<BaseResource>(inFlight);
    }
    for (BaseResource resource : toAbort) {
      resource.abort();
    }
  }
}
