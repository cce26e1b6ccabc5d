/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.background.common.log.writers;

/**
 * A <code>LogWriter</code> that logs only if the message is at least the
 * given level.
 */
public class LevelFilteringLogWriter extends LogWriter {
  public enum Level {
    TRACE, DEBUG, INFO, WARN, ERROR
  }

  protected final LogWriter inner;
  protected final Level minimum;

  public LevelFilteringLogWriter(Level minimum, LogWriter inner) {
    this.minimum = minimum;
    this.inner = inner;
  }

  protected boolean shouldLog(Level level) {
    return level.ordinal() >= minimum.ordinal();
  }

  @Override
  public void close() {
    inner.close();
  }

  @Override
  public void error(String tag, String message, Throwable error) {
    if (shouldLog(Level.ERROR)) {
      inner.error(tag, message, error);
    }
  }

  @Override
  public void warn(String tag, String message, Throwable error) {
    if (shouldLog(Level.WARN)) {
      inner.warn(tag, message, error);
    }
  }

  @Override
  public void info(String tag, String message, Throwable error) {
    if (shouldLog(Level.INFO)) {
      inner.info(tag, message, error);
    }
  }

  @Override
  public void debug(String tag, String message, Throwable error) {
    if (shouldLog(Level.DEBUG)) {
      inner.debug(tag, message, error);
    }
  }

  @Override
  public void trace(String tag, String message, Throwable error) {
    if (shouldLog(Level.TRACE)) {
      inner.trace(tag, message, error);
    }
  }

  @Override
  public boolean shouldLogVerbose(String tag) {
    return shouldLog(Level.TRACE) && inner.shouldLogVerbose(tag);
  }
}
