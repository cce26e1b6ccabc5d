/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.sync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class Utils {

  private static final String LOG_TAG = "Utils";

  /**
   * Throw if any argument is null.
   */
  public static void throwIfNull(Object... objects) {
    for (Object object : objects) {
      if (object == null) {
        throw new IllegalArgumentException(LOG_TAG + ": argument must not be null.");
      }
    }
  }

  public static String toCommaSeparatedString(Collection<? extends Object> in) {
    final StringBuilder b = new StringBuilder();
    boolean first = true;
    for (Object s : in) {
      if (!first) {
        b.append(", ");
      }
      b.append(s);
      first = false;
    }
    return b.toString();
  }

  /**
   * Split a list into consecutive sublists of at most <code>size</code>
   * elements. A non-positive size means "don't split".
   */
  public static <T> List<List<T>> chunk(List<T> in, int size) {
    final List<List<T>> out = new ArrayList<List<T>>();
    if (in.isEmpty()) {
      return out;
    }
    if (size <= 0 || in.size() <= size) {
      out.add(in);
      return out;
    }
    for (int i = 0; i < in.size(); i += size) {
      out.add(in.subList(i, Math.min(in.size(), i + size)));
    }
    return out;
  }

  /**
   * Return the stripped trailing slashes of <code>s</code>.
   */
  public static String stripTrailingSlashes(String s) {
    int end = s.length();
    while (end > 0 && s.charAt(end - 1) == '/') {
      --end;
    }
    return s.substring(0, end);
  }
}
