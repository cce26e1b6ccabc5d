/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.background.common;

import org.fluxreader.background.common.Prefs.Editor;

public class EditorBranch implements Editor {

  private final String prefix;
  private Editor editor;

  public EditorBranch(final Prefs prefs, final String prefix) {
    if (!prefix.endsWith(".")) {
      throw new IllegalArgumentException("No trailing period in prefix.");
    }
    this.prefix = prefix;
    this.editor = prefs.edit();
  }

  @Override
  public boolean commit() {
    return this.editor.commit();
  }

  // Clears the whole underlying store, not just this branch.
  @Override
  public Editor clear() {
    this.editor = this.editor.clear();
    return this;
  }

  @Override
  public Editor putBoolean(String key, boolean value) {
    this.editor = this.editor.putBoolean(prefix + key, value);
    return this;
  }

  @Override
  public Editor putInt(String key, int value) {
    this.editor = this.editor.putInt(prefix + key, value);
    return this;
  }

  @Override
  public Editor putLong(String key, long value) {
    this.editor = this.editor.putLong(prefix + key, value);
    return this;
  }

  @Override
  public Editor putString(String key, String value) {
    this.editor = this.editor.putString(prefix + key, value);
    return this;
  }

  @Override
  public Editor remove(String key) {
    this.editor = this.editor.remove(prefix + key);
    return this;
  }
}
