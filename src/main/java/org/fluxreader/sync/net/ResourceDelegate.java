/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.sync.net;

import java.io.IOException;
import java.security.GeneralSecurityException;

import org.apache.http.HttpResponse;
import org.apache.http.client.ClientProtocolException;
import org.apache.http.client.methods.HttpRequestBase;

/**
 * Callbacks for a single {@link BaseResource} request.
 * <p>
 * Exactly one of the <code>handle*</code> methods is invoked per request, on
 * the thread that issued it. The response entity is consumed by the resource
 * once <code>handleHttpResponse</code> returns, so implementers must read
 * anything they need from it before returning.
 */
public interface ResourceDelegate {
  // Request augmentation.
  AuthHeaderProvider getAuthHeaderProvider();
  String getUserAgent();
  void addHeaders(HttpRequestBase request);

  // Response handling.
  void handleHttpResponse(HttpResponse response);
  void handleHttpProtocolException(ClientProtocolException e);
  void handleHttpIOException(IOException e);

  // During preparation.
  void handleTransportException(GeneralSecurityException e);

  // Connection parameters, in milliseconds.
  int connectionTimeout();
  int socketTimeout();
}
