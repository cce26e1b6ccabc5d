/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.background.common.log.writers;

import java.util.logging.Level;

/**
 * Log to the platform log of the JVM.
 * <p>
 * Each tag maps to a <code>java.util.logging.Logger</code> of the same name,
 * so the host application controls levels and handlers per tag.
 */
public class JavaUtilLogWriter extends LogWriter {
  protected static java.util.logging.Logger loggerFor(String tag) {
    return java.util.logging.Logger.getLogger(tag);
  }

  protected static void log(String tag, Level level, String message, Throwable error) {
    final java.util.logging.Logger logger = loggerFor(tag);
    if (!logger.isLoggable(level)) {
      return;
    }
    if (error == null) {
      logger.log(level, message);
    } else {
      logger.log(level, message, error);
    }
  }

  @Override
  public boolean shouldLogVerbose(String tag) {
    return loggerFor(tag).isLoggable(Level.FINEST);
  }

  @Override
  public void error(String tag, String message, Throwable error) {
    log(tag, Level.SEVERE, message, error);
  }

  @Override
  public void warn(String tag, String message, Throwable error) {
    log(tag, Level.WARNING, message, error);
  }

  @Override
  public void info(String tag, String message, Throwable error) {
    log(tag, Level.INFO, message, error);
  }

  @Override
  public void debug(String tag, String message, Throwable error) {
    log(tag, Level.FINE, message, error);
  }

  @Override
  public void trace(String tag, String message, Throwable error) {
    log(tag, Level.FINEST, message, error);
  }

  @Override
  public void close() {
  }
}
