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

package com.android.tools.build.zipsession.session;

import com.android.tools.build.zipsession.zip.ArchiveEntry;
import java.io.File;
import java.io.IOException;

/** Writes the content of an archive entry into a file. */
@FunctionalInterface
public interface EntryContentResolver {

  /**
   * Writes the content of {@code entry} into {@code destination}, creating parent directories if
   * needed.
   *
   * @param entry a file entry
   * @param destination the file to create or overwrite
   * @throws IOException the content is not available or could not be copied
   */
  void materialize(ArchiveEntry entry, File destination) throws IOException;
}
