/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.background.common;

/**
 * A small key-value preferences store, shaped like the shared preferences
 * the rest of the code was written against.
 * <p>
 * Reads are always against committed state. Writes go through an
 * {@link Editor} and become visible on {@link Editor#commit()}.
 */
public interface Prefs {
  public String getString(String key, String defValue);
  public int getInt(String key, int defValue);
  public long getLong(String key, long defValue);
  public boolean getBoolean(String key, boolean defValue);
  public boolean contains(String key);
  public Editor edit();

  public interface Editor {
    public Editor putString(String key, String value);
    public Editor putInt(String key, int value);
    public Editor putLong(String key, long value);
    public Editor putBoolean(String key, boolean value);
    public Editor remove(String key);
    public Editor clear();

    /**
     * @return true if the changes were persisted.
     */
    public boolean commit();
  }
}
