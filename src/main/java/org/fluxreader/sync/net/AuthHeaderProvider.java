/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.sync.net;

import java.security.GeneralSecurityException;

import org.apache.http.Header;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.protocol.HttpContext;

/**
 * An <code>AuthHeaderProvider</code> generates HTTP authentication headers for
 * HTTP requests.
 */
public interface AuthHeaderProvider {
  /**
   * Generate an HTTP authentication header.
   *
   * @param request HTTP request.
   * @param context HTTP context.
   * @return HTTP header, or null to send the request unauthenticated.
   * @throws GeneralSecurityException usually wrapping a more specific exception.
   */
  Header getAuthHeader(HttpRequestBase request, HttpContext context)
    throws GeneralSecurityException;
}
