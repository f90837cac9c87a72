/*
 * Copyright (C) 2026 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.android.tools.build.zipsession.scratch;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A freshly created, uniquely named directory that is deleted, with everything inside it, when
 * closed.
 */
public class TemporaryDirectory implements Closeable {

  /** Deletes the directory on close. */
  private final TemporaryFile temporaryFile;

  private TemporaryDirectory(Path directory) {
    temporaryFile = new TemporaryFile(directory);
  }

  /**
   * Creates a new directory in the system's temporary directory.
   *
   * @param prefix prefix of the directory name; a random suffix is appended
   * @return the new directory
   * @throws IOException failed to create the directory
   */
  public static TemporaryDirectory newSystemTemporaryDirectory(String prefix) throws IOException {
    return new TemporaryDirectory(Files.createTempDirectory(prefix));
  }

  /**
   * Creates a new directory inside {@code parent}. {@code parent} is created if needed.
   *
   * @param parent the directory in which to create the new directory
   * @param prefix prefix of the directory name; a random suffix is appended
   * @return the new directory
   * @throws IOException failed to create the directory
   */
  public static TemporaryDirectory newTemporaryDirectory(File parent, String prefix)
      throws IOException {
    Path parentPath = Files.createDirectories(parent.toPath());
    return new TemporaryDirectory(Files.createTempDirectory(parentPath, prefix));
  }

  /** Obtains the directory. */
  public File getDirectory() {
    return temporaryFile.getFile();
  }

  @Override
  public void close() throws IOException {
    temporaryFile.close();
  }
}
