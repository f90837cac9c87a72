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
import com.google.common.io.ByteSink;
import java.io.IOException;
import java.util.List;

/**
 * Produces a complete archive from a list of logical entries. This is how pending changes of an
 * {@link ArchiveSession} reach the disk.
 */
public interface ArchiveRepacker {

  /**
   * Writes a new archive containing exactly {@code entries}, in order.
   *
   * @param archiveName base name of the archive being written, used to name scratch resources
   * @param entries the entries of the new archive
   * @param resolver provides the content of file entries
   * @param destination receives the archive; its stream is opened at most once, and closed
   * @throws IOException failed to produce the archive; what {@code destination} contains is
   *     undefined
   */
  void repack(
      String archiveName,
      List<ArchiveEntry> entries,
      EntryContentResolver resolver,
      ByteSink destination)
      throws IOException;
}
