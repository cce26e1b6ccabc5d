/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.fluxreader.reading.BlockingRequestDelegate.Result;
import org.fluxreader.sync.ExtendedJSONObject;
import org.fluxreader.sync.net.TokenAuthHeaderProvider;
import org.json.simple.JSONArray;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

public class TestFluxClient {
  private static final String TOKEN = "secret-token";

  private HttpServer httpServer;
  private String address;

  // Guarded by this.
  private final List<String> requests = new ArrayList<String>();
  private String lastBody;
  private String lastToken;
  private String lastUserAgent;
  private int responseCode = 204;
  private String responseBody;

  private synchronized void respondWith(int code, String body) {
    responseCode = code;
    responseBody = body;
  }

  private synchronized List<String> requests() {
    return new ArrayList<String>(requests);
  }

  private static String readAll(InputStream in) throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final byte[] buffer = new byte[4096];
    int read;
    while ((read = in.read(buffer)) != -1) {
      out.write(buffer, 0, read);
    }
    return out.toString("UTF-8");
  }

  @Before
  public void setUp() throws Exception {
    httpServer = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    httpServer.createContext("/", new HttpHandler() {
      @Override
      public void handle(HttpExchange exchange) throws IOException {
        final int code;
        final String body;
        synchronized (TestFluxClient.this) {
          requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().toString());
          lastBody = readAll(exchange.getRequestBody());
          lastToken = exchange.getRequestHeaders().getFirst(TokenAuthHeaderProvider.HEADER_AUTH_TOKEN);
          lastUserAgent = exchange.getRequestHeaders().getFirst("User-Agent");
          code = responseCode;
          body = responseBody;
        }
        if (body == null) {
          exchange.sendResponseHeaders(code, -1);
          exchange.close();
          return;
        }
        final byte[] bytes = body.getBytes("UTF-8");
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(code, bytes.length);
        final OutputStream out = exchange.getResponseBody();
        try {
          out.write(bytes);
        } finally {
          out.close();
        }
      }
    });
    httpServer.start();
    address = "http://127.0.0.1:" + httpServer.getAddress().getPort();
  }

  @After
  public void tearDown() {
    if (httpServer != null) {
      httpServer.stop(0);
    }
  }

  private FluxClient client(String serverAddress) {
    return new FluxClient(new ServerCredentials(serverAddress, TOKEN, 5000, 5000));
  }

  @Test
  public void testUpdateEntries() throws Exception {
    final BlockingRequestDelegate delegate = new BlockingRequestDelegate();
    client(address).updateEntries(Arrays.asList(3L, 4L), ReadingStatus.READ, delegate);
    final Result result = delegate.take();

    assertTrue(result.wasSuccessful());
    assertEquals(Arrays.asList("PUT /v1/entries"), requests());
    synchronized (this) {
      assertEquals(TOKEN, lastToken);
      assertEquals(ReadingConstants.USER_AGENT, lastUserAgent);
      final ExtendedJSONObject sent = new ExtendedJSONObject(lastBody);
      assertEquals("read", sent.getString("status"));
      final JSONArray ids = sent.getArray("entry_ids");
      assertEquals(2, ids.size());
      assertEquals(3L, ids.get(0));
      assertEquals(4L, ids.get(1));
    }
  }

  @Test
  public void testTrailingSlashesAreIgnored() throws Exception {
    final BlockingRequestDelegate feed = new BlockingRequestDelegate();
    client(address + "//").markFeedAsRead(12, feed);
    assertTrue(feed.take().wasSuccessful());

    final BlockingRequestDelegate category = new BlockingRequestDelegate();
    client(address + "/").markCategoryAsRead(7, category);
    assertTrue(category.take().wasSuccessful());

    assertEquals(Arrays.asList("PUT /v1/feeds/12/mark-all-as-read",
                               "PUT /v1/categories/7/mark-all-as-read"), requests());
  }

  @Test
  public void testQueries() throws Exception {
    respondWith(200, "{\"total\": 3, \"entries\": []}");
    final BlockingRequestDelegate entries = new BlockingRequestDelegate();
    client(address).getEntries(ReadingStatus.UNREAD, 1, entries);
    final Result result = entries.take();
    assertTrue(result.wasSuccessful());
    assertEquals(3L, result.response.jsonObjectBody().getLong("total").longValue());

    respondWith(200, "[]");
    client(address).getFeedCounters(new BlockingRequestDelegate());
    client(address).getCategories(true, new BlockingRequestDelegate());
    client(address).getCategories(false, new BlockingRequestDelegate());
    client(address).getMe(new BlockingRequestDelegate());

    assertEquals(Arrays.asList("GET /v1/entries?status=unread&limit=1",
                               "GET /v1/feeds/counters",
                               "GET /v1/categories?counts=true",
                               "GET /v1/categories",
                               "GET /v1/me"), requests());
  }

  @Test
  public void testServerErrorMessage() throws Exception {
    respondWith(401, "{\"error_message\": \"Access Unauthorized\"}");
    final BlockingRequestDelegate delegate = new BlockingRequestDelegate();
    client(address).getMe(delegate);
    final Result result = delegate.take();

    assertFalse(result.wasSuccessful());
    assertNull(result.exception);
    assertTrue(result.response.isInvalidAuthentication());
    assertEquals("Access Unauthorized", result.describeFailure());
  }

  @Test
  public void testFallbackErrorMessages() throws Exception {
    respondWith(500, null);
    final BlockingRequestDelegate delegate = new BlockingRequestDelegate();
    client(address).updateEntries(Collections.singletonList(1L), ReadingStatus.UNREAD, delegate);
    assertEquals("Internal server error", delegate.take().describeFailure());

    respondWith(403, "<html>nope</html>");
    final BlockingRequestDelegate forbidden = new BlockingRequestDelegate();
    client(address).getMe(forbidden);
    assertEquals("Forbidden - access denied", forbidden.take().describeFailure());

    respondWith(418, null);
    final BlockingRequestDelegate teapot = new BlockingRequestDelegate();
    client(address).getMe(teapot);
    assertEquals("HTTP error: 418", teapot.take().describeFailure());
  }

  @Test
  public void testUnconfigured() throws Exception {
    final BlockingRequestDelegate delegate = new BlockingRequestDelegate();
    new FluxClient(new ServerCredentials("", "", 5000, 5000)).getMe(delegate);
    final Result result = delegate.take();
    assertTrue(result.exception instanceof IllegalStateException);
    assertEquals("Server address and API token must be configured", result.describeFailure());
    assertTrue(requests().isEmpty());
  }

  @Test
  public void testUnreachableServer() throws Exception {
    final int port = httpServer.getAddress().getPort();
    httpServer.stop(0);
    httpServer = null;
    final BlockingRequestDelegate delegate = new BlockingRequestDelegate();
    client("http://127.0.0.1:" + port).getMe(delegate);
    final Result result = delegate.take();
    assertFalse(result.wasSuccessful());
    assertNotNull(result.exception);
  }

  @Test
  public void testAbortedClientFailsFast() throws Exception {
    final FluxClient client = client(address);
    client.abortAll();
    final BlockingRequestDelegate delegate = new BlockingRequestDelegate();
    client.getMe(delegate);
    final Result result = delegate.take();
    assertTrue(result.exception instanceof IOException);
    assertTrue(requests().isEmpty());
  }

  @Test
  public void testFactory() {
    final ServerCredentials credentials = new ServerCredentials(address, TOKEN, 1000, 2000);
    final FluxRemote remote = FluxClient.FACTORY.createRemote(credentials);
    assertTrue(remote instanceof FluxClient);
    assertEquals(credentials, ((FluxClient) remote).getCredentials());
  }
}
