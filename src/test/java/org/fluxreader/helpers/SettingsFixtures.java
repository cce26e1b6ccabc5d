/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.helpers;

import org.fluxreader.background.common.PropertiesPrefs;
import org.fluxreader.reading.PrefsServerSettings;

/**
 * In-memory settings pointing at a server that only mocks talk to.
 */
public final class SettingsFixtures {
  public static final String TEST_SERVER = "http://flux.example.com/";
  public static final String TEST_TOKEN = "test-token";

  private SettingsFixtures() {
  }

  public static PrefsServerSettings create() {
    final PrefsServerSettings settings = new PrefsServerSettings(new PropertiesPrefs(null, null));
    settings.setServer(TEST_SERVER, TEST_TOKEN);
    return settings;
  }
}
