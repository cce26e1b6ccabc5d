/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading.coordinator;

/**
 * How many operations are pending in each queue.
 */
public class QueueCounts {
  public final int statusCount;
  public final int feedCount;
  public final int categoryCount;

  public QueueCounts(int statusCount, int feedCount, int categoryCount) {
    this.statusCount = statusCount;
    this.feedCount = feedCount;
    this.categoryCount = categoryCount;
  }

  public int total() {
    return statusCount + feedCount + categoryCount;
  }

  public boolean isEmpty() {
    return total() == 0;
  }

  @Override
  public String toString() {
    return "QueueCounts[" + statusCount + " entries, " + feedCount + " feeds, " + categoryCount + " categories]";
  }
}
