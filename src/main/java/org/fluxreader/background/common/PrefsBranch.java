/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.background.common;

/**
 * A view of a {@link Prefs} instance restricted to keys that share a prefix.
 */
public class PrefsBranch implements Prefs {
  private final Prefs prefs;
  private final String prefix;

  public PrefsBranch(final Prefs prefs, final String prefix) {
    if (!prefix.endsWith(".")) {
      throw new IllegalArgumentException("No trailing period in prefix.");
    }
    this.prefs = prefs;
    this.prefix = prefix;
  }

  public String getPrefix() {
    return prefix;
  }

  @Override
  public String getString(String key, String defValue) {
    return prefs.getString(prefix + key, defValue);
  }

  @Override
  public int getInt(String key, int defValue) {
    return prefs.getInt(prefix + key, defValue);
  }

  @Override
  public long getLong(String key, long defValue) {
    return prefs.getLong(prefix + key, defValue);
  }

  @Override
  public boolean getBoolean(String key, boolean defValue) {
    return prefs.getBoolean(prefix + key, defValue);
  }

  @Override
  public boolean contains(String key) {
    return prefs.contains(prefix + key);
  }

  @Override
  public Editor edit() {
    return new EditorBranch(prefs, prefix);
  }
}
