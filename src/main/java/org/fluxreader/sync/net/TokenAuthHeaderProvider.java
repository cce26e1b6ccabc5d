/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.sync.net;

import org.apache.http.Header;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.message.BasicHeader;
import org.apache.http.protocol.HttpContext;

/**
 * An <code>AuthHeaderProvider</code> that sends an API token verbatim in a
 * dedicated header, the way Miniflux expects it.
 */
public class TokenAuthHeaderProvider implements AuthHeaderProvider {
  public static final String HEADER_AUTH_TOKEN = "X-Auth-Token";

  protected final String token;

  public TokenAuthHeaderProvider(String token) {
    if (token == null) {
      throw new IllegalArgumentException("token must not be null.");
    }
    this.token = token;
  }

  @Override
  public Header getAuthHeader(HttpRequestBase request, HttpContext context) {
    return new BasicHeader(HEADER_AUTH_TOKEN, token);
  }
}
