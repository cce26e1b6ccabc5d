/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.sync.net;

import java.io.IOException;

import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.util.EntityUtils;
import org.fluxreader.background.common.log.Logger;
import org.fluxreader.sync.ExtendedJSONObject;
import org.fluxreader.sync.NonArrayJSONException;
import org.fluxreader.sync.NonObjectJSONException;
import org.json.simple.JSONArray;
import org.json.simple.parser.ParseException;

/**
 * A response from the server. The body is buffered when the response is
 * wrapped, because the resource releases the connection as soon as its
 * delegate returns.
 */
public class FluxResponse {
  private static final String LOG_TAG = "FluxResponse";

  protected final HttpResponse response;
  private final String body;

  public FluxResponse(HttpResponse res) {
    this.response = res;
    this.body = readBody(res);
  }

  private static String readBody(HttpResponse res) {
    final HttpEntity entity = res.getEntity();
    if (entity == null) {
      return null;
    }
    try {
      return EntityUtils.toString(entity, "UTF-8");
    } catch (IOException e) {
      Logger.warn(LOG_TAG, "Couldn't read response body.", e);
      return null;
    }
  }

  public int getStatusCode() {
    return this.response.getStatusLine().getStatusCode();
  }

  /**
   * The server answers 200, 201 or 204 depending on the endpoint; anything
   * else is a failure.
   */
  public boolean wasSuccessful() {
    final int code = this.getStatusCode();
    return code == 200 || code == 201 || code == 204;
  }

  public boolean isInvalidAuthentication() {
    return this.getStatusCode() == 401;
  }

  /**
   * @return the buffered body, or null if there was none.
   */
  public String body() {
    return body;
  }

  /**
   * Return the body as a <b>non-null</b> <code>ExtendedJSONObject</code>.
   */
  public ExtendedJSONObject jsonObjectBody() throws IOException, ParseException, NonObjectJSONException {
    if (body == null) {
      throw new IOException("no entity");
    }
    return ExtendedJSONObject.parseJSONObject(body);
  }

  public JSONArray jsonArrayBody() throws IOException, ParseException, NonArrayJSONException {
    if (body == null) {
      throw new IOException("no entity");
    }
    return ExtendedJSONObject.parseJSONArray(body);
  }

  /**
   * The server reports problems as <code>{"error_message": "..."}</code>.
   * Fall back to a description of the status code when it doesn't.
   */
  public String getErrorMessage() {
    String apiMessage = null;
    if (body != null && body.length() > 0) {
      try {
        apiMessage = jsonObjectBody().getString("error_message");
      } catch (Exception e) {
        Logger.debug(LOG_TAG, "Error body is not a JSON object.");
      }
    }
    if (apiMessage != null) {
      return apiMessage;
    }
    final int code = getStatusCode();
    switch (code) {
    case 400:
      return "Bad request";
    case 401:
      return "Unauthorized - please check your API token";
    case 403:
      return "Forbidden - access denied";
    case 500:
      return "Internal server error";
    default:
      return "HTTP error: " + code;
    }
  }

  @Override
  public String toString() {
    return "FluxResponse[" + getStatusCode() + "]";
  }
}
