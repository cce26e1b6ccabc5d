/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

public class ReadingConstants {
  public static final String VERSION = "1.0.0";
  public static final String USER_AGENT = "FluxReader-Sync/" + VERSION;
  public static final String API_PATH = "/v1";

  public static final String DEFAULTS_RESOURCE = "fluxreader-defaults.properties";
  public static final String PREFS_BRANCH = "fluxreader.";

  public static final String ENTRIES_DIRECTORY = "entries";
  public static final String ENTRY_METADATA_FILENAME = "metadata.json";

  public static final String STATUS_QUEUE_FILENAME = "status_queue.json";
  public static final String FEED_QUEUE_FILENAME = "feed_queue.json";
  public static final String CATEGORY_QUEUE_FILENAME = "category_queue.json";

}
