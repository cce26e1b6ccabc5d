/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.sync.net;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.ClientProtocolException;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.protocol.BasicHttpContext;
import org.apache.http.protocol.HttpContext;
import org.apache.http.util.EntityUtils;
import org.fluxreader.background.common.log.Logger;
import org.fluxreader.sync.ExtendedJSONObject;

/**
 * Provide simple HTTP access to a Miniflux server or similar.
 * Adds authentication headers by asking its delegate for a provider.
 * Communicates with a ResourceDelegate to return responses and errors.
 * Exposes simple get/put methods.
 * <p>
 * Requests are made synchronously on the calling thread; the delegate has
 * been invoked by the time a verb method returns. A request can be aborted
 * from another thread with {@link #abort()}.
 */
public class BaseResource implements Resource {
  private static final int MAX_TOTAL_CONNECTIONS     = 20;
  private static final int MAX_CONNECTIONS_PER_ROUTE = 10;

  private static final String LOG_TAG = "BaseResource";

  private boolean retryOnFailedRequest = true;

  protected final URI uri;
  protected HttpContext context;
  protected CloseableHttpClient client;
  public    ResourceDelegate delegate;
  protected volatile HttpRequestBase request;
  protected volatile boolean aborted = false;

  public BaseResource(String uri) throws URISyntaxException {
    this(new URI(uri));
  }

  public BaseResource(URI uri) {
    if (uri == null) {
      throw new IllegalArgumentException("uri must not be null");
    }
    this.uri = uri;
  }

  @Override
  public URI getURI() {
    return this.uri;
  }

  /**
   * Invoke this after delegate and request have been set.
   */
  protected void prepareClient() throws GeneralSecurityException {
    context = new BasicHttpContext();

    AuthHeaderProvider authHeaderProvider = delegate.getAuthHeaderProvider();
    if (authHeaderProvider != null) {
      Header authHeader = authHeaderProvider.getAuthHeader(request, context);
      if (authHeader != null) {
        request.addHeader(authHeader);
        Logger.debug(LOG_TAG, "Added auth header.");
      }
    }

    final RequestConfig config = RequestConfig.custom()
        .setConnectTimeout(delegate.connectionTimeout())
        .setConnectionRequestTimeout(delegate.connectionTimeout())
        .setSocketTimeout(delegate.socketTimeout())
        .build();
    request.setConfig(config);

    // Clients are per request; connections come from the shared pool.
    final HttpClientBuilder builder = HttpClientBuilder.create()
        .setConnectionManager(getConnectionManager())
        .setConnectionManagerShared(true)
        .disableAutomaticRetries();
    final String userAgent = delegate.getUserAgent();
    if (userAgent != null) {
      builder.setUserAgent(userAgent);
    }
    client = builder.build();
    delegate.addHeaders(request);
  }

  private static final Object connManagerMonitor = new Object();
  private static PoolingHttpClientConnectionManager connManager;

  public static PoolingHttpClientConnectionManager getConnectionManager() {
    synchronized (connManagerMonitor) {
      if (connManager != null) {
        return connManager;
      }
      PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
      cm.setMaxTotal(MAX_TOTAL_CONNECTIONS);
      cm.setDefaultMaxPerRoute(MAX_CONNECTIONS_PER_ROUTE);
      connManager = cm;
      return cm;
    }
  }

  /**
   * Do some cleanup, so we don't need the stale connection check.
   */
  public static void closeExpiredConnections() {
    PoolingHttpClientConnectionManager connectionManager;
    synchronized (connManagerMonitor) {
      connectionManager = connManager;
    }
    if (connectionManager == null) {
      return;
    }
    Logger.trace(LOG_TAG, "Closing expired connections.");
    connectionManager.closeExpiredConnections();
  }

  private void execute() {
    HttpResponse response;
    try {
      response = client.execute(request, context);
      Logger.debug(LOG_TAG, "Response: " + response.getStatusLine().toString());
    } catch (ClientProtocolException e) {
      delegate.handleHttpProtocolException(e);
      return;
    } catch (IOException e) {
      Logger.debug(LOG_TAG, "I/O exception returned from execute.");
      if (aborted || !retryOnFailedRequest) {
        delegate.handleHttpIOException(e);
      } else {
        retryRequest();
      }
      return;
    } catch (Exception e) {
      // Don't let an exception fall through. Wrapping isn't optimal, but
      // often the exception is treated as an Exception anyway.
      if (aborted || !retryOnFailedRequest) {
        delegate.handleHttpIOException(new IOException(e));
      } else {
        retryRequest();
      }
      return;
    }

    try {
      delegate.handleHttpResponse(response);
    } finally {
      consumeEntity(response);
    }
  }

  private void retryRequest() {
    // Only retry once.
    retryOnFailedRequest = false;
    Logger.debug(LOG_TAG, "Retrying request...");
    this.execute();
  }

  private void go(HttpRequestBase request) {
    if (delegate == null) {
      throw new IllegalArgumentException("No delegate provided.");
    }
    this.request = request;
    if (aborted) {
      delegate.handleHttpIOException(new IOException("Request aborted before it was sent."));
      return;
    }
    try {
      this.prepareClient();
    } catch (GeneralSecurityException e) {
      Logger.error(LOG_TAG, "Couldn't prepare client.", e);
      delegate.handleTransportException(e);
      return;
    } catch (Exception e) {
      delegate.handleTransportException(new GeneralSecurityException(e));
      return;
    }
    try {
      this.execute();
    } finally {
      closeClient();
    }
  }

  private void closeClient() {
    final CloseableHttpClient c = client;
    client = null;
    if (c == null) {
      return;
    }
    try {
      c.close();
    } catch (IOException e) {
      Logger.debug(LOG_TAG, "Ignoring exception closing client.", e);
    }
  }

  /**
   * Abort the request in flight, if any. The delegate sees an I/O failure.
   * Safe to call from any thread, and before the request is sent.
   */
  @Override
  public void abort() {
    aborted = true;
    final HttpRequestBase r = request;
    if (r != null) {
      Logger.debug(LOG_TAG, "Aborting request to " + this.uri.toASCIIString());
      r.abort();
    }
  }

  @Override
  public void get() {
    Logger.debug(LOG_TAG, "HTTP GET " + this.uri.toASCIIString());
    this.go(new HttpGet(this.uri));
  }

  @Override
  public void put(HttpEntity body) {
    Logger.debug(LOG_TAG, "HTTP PUT " + this.uri.toASCIIString());
    HttpPut request = new HttpPut(this.uri);
    if (body != null) {
      request.setEntity(body);
    }
    this.go(request);
  }

  protected static StringEntity stringEntityWithContentTypeApplicationJSON(String s) {
    return new StringEntity(s, ContentType.APPLICATION_JSON);
  }

  /**
   * Helper for turning an extended JSON object into a payload.
   */
  protected static StringEntity jsonEntity(ExtendedJSONObject body) {
    return stringEntityWithContentTypeApplicationJSON(body.toJSONString());
  }

  /**
   * Best-effort attempt to ensure that the entity corresponding to the given
   * HTTP response has been fully consumed and that the underlying stream has
   * been closed.
   *
   * This releases the connection back to the connection pool.
   *
   * @param response
   *          The HttpResponse to be consumed.
   */
  public static void consumeEntity(HttpResponse response) {
    if (response == null) {
      return;
    }
    try {
      EntityUtils.consume(response.getEntity());
    } catch (IOException e) {
      Logger.trace(LOG_TAG, "Ignoring exception consuming entity: " + e);
    }
  }

  public void put(ExtendedJSONObject o) {
    put(jsonEntity(o));
  }
}
