/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.background.common;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.util.FileUtils;

/**
 * {@link Prefs} persisted as a <code>java.util.Properties</code> file.
 * <p>
 * Defaults are consulted for keys that have never been written. A null
 * file keeps the prefs in memory only.
 */
public class PropertiesPrefs implements Prefs {
  private static final String LOG_TAG = "PropertiesPrefs";

  private final File file;
  private final Properties defaults;
  private final Properties values;

  public PropertiesPrefs(File file, Properties defaults) {
    this.file = file;
    this.defaults = defaults == null ? new Properties() : defaults;
    this.values = new Properties();
    if (file != null && file.exists()) {
      try {
        load(file, this.values);
      } catch (IOException e) {
        Logger.warn(LOG_TAG, "Couldn't read prefs from " + file + "; using defaults.", e);
        this.values.clear();
      }
    }
  }

  public PropertiesPrefs(Properties defaults) {
    this(null, defaults);
  }

  /**
   * Load defaults from a classpath resource. A missing resource yields no defaults.
   */
  public static Properties loadDefaults(String resourceName) {
    final Properties defaults = new Properties();
    final InputStream in = PropertiesPrefs.class.getClassLoader().getResourceAsStream(resourceName);
    if (in == null) {
      Logger.warn(LOG_TAG, "No defaults resource named " + resourceName + ".");
      return defaults;
    }
    try {
      try {
        defaults.load(in);
      } finally {
        in.close();
      }
    } catch (IOException e) {
      Logger.warn(LOG_TAG, "Couldn't read defaults resource " + resourceName + ".", e);
    }
    return defaults;
  }

  private static void load(File file, Properties into) throws IOException {
    final Reader in = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8);
    try {
      into.load(in);
    } finally {
      in.close();
    }
  }

  protected synchronized String raw(String key) {
    final String value = values.getProperty(key);
    if (value != null) {
      return value;
    }
    return defaults.getProperty(key);
  }

  @Override
  public String getString(String key, String defValue) {
    final String value = raw(key);
    return value == null ? defValue : value;
  }

  @Override
  public int getInt(String key, int defValue) {
    final String value = raw(key);
    if (value == null) {
      return defValue;
    }
    try {
      return Integer.parseInt(value.trim(), 10);
    } catch (NumberFormatException e) {
      Logger.warn(LOG_TAG, "Pref " + key + " is not an integer: " + value);
      return defValue;
    }
  }

  @Override
  public long getLong(String key, long defValue) {
    final String value = raw(key);
    if (value == null) {
      return defValue;
    }
    try {
      return Long.parseLong(value.trim(), 10);
    } catch (NumberFormatException e) {
      Logger.warn(LOG_TAG, "Pref " + key + " is not a long: " + value);
      return defValue;
    }
  }

  @Override
  public boolean getBoolean(String key, boolean defValue) {
    final String value = raw(key);
    if (value == null) {
      return defValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  @Override
  public synchronized boolean contains(String key) {
    return values.containsKey(key) || defaults.containsKey(key);
  }

  @Override
  public Editor edit() {
    return new PropertiesEditor();
  }

  protected synchronized boolean apply(Map<String, String> puts, Set<String> removes, boolean clear) {
    if (clear) {
      values.clear();
    }
    for (String key : removes) {
      values.remove(key);
    }
    values.putAll(puts);
    if (file == null) {
      return true;
    }
    try {
      persist();
      return true;
    } catch (IOException e) {
      Logger.error(LOG_TAG, "Couldn't persist prefs to " + file + ".", e);
      return false;
    }
  }

  private void persist() throws IOException {
    final StringWriter out = new StringWriter();
    values.store(out, null);
    FileUtils.writeFileAtomically(file, out.toString());
  }

  private class PropertiesEditor implements Editor {
    private final Map<String, String> puts = new HashMap<String, String>();
    private final Set<String> removes = new HashSet<String>();
    private boolean clear = false;

    private Editor put(String key, String value) {
      removes.remove(key);
      puts.put(key, value);
      return this;
    }

    @Override
    public Editor putString(String key, String value) {
      if (value == null) {
        return remove(key);
      }
      return put(key, value);
    }

    @Override
    public Editor putInt(String key, int value) {
      return put(key, Integer.toString(value));
    }

    @Override
    public Editor putLong(String key, long value) {
      return put(key, Long.toString(value));
    }

    @Override
    public Editor putBoolean(String key, boolean value) {
      return put(key, Boolean.toString(value));
    }

    @Override
    public Editor remove(String key) {
      puts.remove(key);
      removes.add(key);
      return this;
    }

    @Override
    public Editor clear() {
      clear = true;
      return this;
    }

    @Override
    public boolean commit() {
      return apply(puts, removes, clear);
    }
  }
}
