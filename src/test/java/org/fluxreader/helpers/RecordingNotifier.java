/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.helpers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.fluxreader.reading.SyncNotifier;

public class RecordingNotifier implements SyncNotifier {
  public final List<String> infos = Collections.synchronizedList(new ArrayList<String>());
  public final List<String> successes = Collections.synchronizedList(new ArrayList<String>());
  public final List<String> errors = Collections.synchronizedList(new ArrayList<String>());

  @Override
  public void info(String message) {
    infos.add(message);
  }

  @Override
  public void success(String message) {
    successes.add(message);
  }

  @Override
  public void error(String message) {
    errors.add(message);
  }

  public int total() {
    return infos.size() + successes.size() + errors.size();
  }
}
