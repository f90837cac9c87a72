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

import java.io.File;
import java.io.IOException;

/** Creates the scratch directories used to stage archive contents. */
public interface TemporaryDirectoryFactory {

  /**
   * Creates a new, empty and uniquely named directory.
   *
   * @param prefix prefix of the directory name
   * @return the directory, deleted when closed
   * @throws IOException failed to create the directory
   */
  TemporaryDirectory make(String prefix) throws IOException;

  /** Obtains a factory that creates directories in the system's temporary directory. */
  static TemporaryDirectoryFactory system() {
    return TemporaryDirectory::newSystemTemporaryDirectory;
  }

  /** Obtains a factory that creates directories inside {@code parent}. */
  static TemporaryDirectoryFactory under(File parent) {
    return prefix -> TemporaryDirectory.newTemporaryDirectory(parent, prefix);
  }
}
