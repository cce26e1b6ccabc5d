/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.background.common.log.writers;

/**
 * Log to a single global tag, prefixing each message with its original tag,
 * so that one logger name collects everything the engine says.
 */
public class SingleTagLogWriter extends LogWriter {
  protected final String tag;
  protected final LogWriter inner;

  public SingleTagLogWriter(String tag, LogWriter inner) {
    if (tag == null) {
      throw new IllegalArgumentException("tag must not be null.");
    }
    if (inner == null) {
      throw new IllegalArgumentException("inner must not be null.");
    }
    this.tag = tag;
    this.inner = inner;
  }

  @Override
  public void error(String originalTag, String message, Throwable error) {
    inner.error(this.tag, originalTag + " :: " + message, error);
  }

  @Override
  public void warn(String originalTag, String message, Throwable error) {
    inner.warn(this.tag, originalTag + " :: " + message, error);
  }

  @Override
  public void info(String originalTag, String message, Throwable error) {
    inner.info(this.tag, originalTag + " :: " + message, error);
  }

  @Override
  public void debug(String originalTag, String message, Throwable error) {
    inner.debug(this.tag, originalTag + " :: " + message, error);
  }

  @Override
  public void trace(String originalTag, String message, Throwable error) {
    inner.trace(this.tag, originalTag + " :: " + message, error);
  }

  @Override
  public boolean shouldLogVerbose(String originalTag) {
    return inner.shouldLogVerbose(this.tag);
  }

  @Override
  public void close() {
    inner.close();
  }
}
