/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.util;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Scanner;

import org.fluxreader.background.common.log.Logger;

public class FileUtils {
  private static final String LOG_TAG = "FileUtils";

  private static final String TEMP_SUFFIX = ".tmp";

  public static boolean delete(File file, boolean recurse) {
    if (file.isDirectory() && recurse) {
      final String[] files = file.list();
      if (files != null) {
        for (String temp : files) {
          final File fileDelete = new File(file, temp);
          if (!delete(fileDelete, true)) {
            Logger.info(LOG_TAG, "Error deleting " + fileDelete.getPath());
          }
        }
      }
    }

    // Even if this is a dir, it should now be empty and delete should work.
    return file.delete();
  }

  // Shortcut to slurp a file without messing around with streams.
  public static String getFileContents(File file) throws IOException {
    Scanner scanner = null;
    try {
      scanner = new Scanner(file, "UTF-8");
      if (!scanner.useDelimiter("\\A").hasNext()) {
        return "";
      }
      return scanner.next();
    } finally {
      if (scanner != null) {
        scanner.close();
      }
    }
  }

  /**
   * Replace the contents of <code>file</code> so that readers see either the
   * old contents or the new, never a partial write. The contents are written
   * to a sibling temp file which is then moved over the destination.
   */
  public static void writeFileAtomically(File file, String contents) throws IOException {
    final File parentDir = file.getAbsoluteFile().getParentFile();
    if (parentDir != null && !parentDir.isDirectory() && !parentDir.mkdirs()) {
      throw new IOException("Could not create directory " + parentDir);
    }

    final File tmpFile = new File(parentDir, file.getName() + TEMP_SUFFIX);
    boolean moved = false;
    try {
      final Writer writer = new OutputStreamWriter(new FileOutputStream(tmpFile), StandardCharsets.UTF_8);
      try {
        writer.write(contents);
        writer.flush();
      } finally {
        writer.close();
      }

      try {
        Files.move(tmpFile.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Logger.debug(LOG_TAG, "Atomic move not supported; replacing " + file.getName() + " directly.");
        Files.move(tmpFile.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
      }
      moved = true;
    } finally {
      if (!moved && tmpFile.exists() && !tmpFile.delete()) {
        Logger.warn(LOG_TAG, "Could not clean up temp file " + tmpFile.getPath());
      }
    }
  }
}
