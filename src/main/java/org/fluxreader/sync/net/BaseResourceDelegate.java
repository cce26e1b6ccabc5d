/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.sync.net;

import java.io.IOException;
import java.security.GeneralSecurityException;

import org.apache.http.client.ClientProtocolException;
import org.apache.http.client.methods.HttpRequestBase;

/**
 * Shared plumbing for resource delegates: timeouts, auth, user agent and the
 * JSON content headers every request to the server carries.
 * <p>
 * Subclasses handle the response; protocol, I/O and transport problems are
 * funnelled into {@link #handleError(Exception)}.
 */
public abstract class BaseResourceDelegate implements ResourceDelegate {
  public static final int DEFAULT_CONNECTION_TIMEOUT_IN_MILLISECONDS = 10 * 1000;
  public static final int DEFAULT_SOCKET_TIMEOUT_IN_MILLISECONDS = 30 * 1000;

  protected final Resource resource;
  protected final AuthHeaderProvider authHeaderProvider;
  protected final String userAgent;
  protected final int connectionTimeout;
  protected final int socketTimeout;

  public BaseResourceDelegate(Resource resource, AuthHeaderProvider authHeaderProvider, String userAgent,
                              int connectionTimeout, int socketTimeout) {
    this.resource = resource;
    this.authHeaderProvider = authHeaderProvider;
    this.userAgent = userAgent;
    this.connectionTimeout = connectionTimeout;
    this.socketTimeout = socketTimeout;
  }

  @Override
  public AuthHeaderProvider getAuthHeaderProvider() {
    return authHeaderProvider;
  }

  @Override
  public String getUserAgent() {
    return userAgent;
  }

  @Override
  public int connectionTimeout() {
    return connectionTimeout;
  }

  @Override
  public int socketTimeout() {
    return socketTimeout;
  }

  @Override
  public void addHeaders(HttpRequestBase request) {
    request.setHeader("Accept", "application/json");
  }

  public abstract void handleError(Exception e);

  @Override
  public void handleHttpProtocolException(ClientProtocolException e) {
    handleError(e);
  }

  @Override
  public void handleHttpIOException(IOException e) {
    handleError(e);
  }

  @Override
  public void handleTransportException(GeneralSecurityException e) {
    handleError(e);
  }
}
