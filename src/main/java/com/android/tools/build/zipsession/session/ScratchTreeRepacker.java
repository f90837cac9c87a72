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

import com.android.tools.build.zipsession.scratch.TemporaryDirectory;
import com.android.tools.build.zipsession.scratch.TemporaryDirectoryFactory;
import com.android.tools.build.zipsession.zip.ArchiveEntry;
import com.android.tools.build.zipsession.zip.EntryMetadata;
import com.android.tools.build.zipsession.zip.EntryNames;
import com.android.tools.build.zipsession.zip.EntryVisitor;
import com.android.tools.build.zipsession.zip.TransferEngine;
import com.google.common.base.CharMatcher;
import com.google.common.io.ByteSink;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.zip.ZipOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ArchiveRepacker} that stages every entry in a scratch directory and then packs the staged
 * tree, in entry order, into the destination. The scratch directory is deleted when done, whether
 * repacking succeeded or not.
 */
public class ScratchTreeRepacker implements ArchiveRepacker {

  private static final Logger logger = LoggerFactory.getLogger(ScratchTreeRepacker.class);

  /** Characters that are not allowed in scratch directory prefixes. */
  private static final CharMatcher UNSAFE_PREFIX_CHARS = CharMatcher.anyOf("/\\:");

  private final TemporaryDirectoryFactory scratchDirectoryFactory;

  /** Visitor invoked for every staged entry as it is packed. */
  private final EntryVisitor packVisitor;

  public ScratchTreeRepacker(
      TemporaryDirectoryFactory scratchDirectoryFactory, EntryVisitor packVisitor) {
    this.scratchDirectoryFactory = scratchDirectoryFactory;
    this.packVisitor = packVisitor;
  }

  @Override
  public void repack(
      String archiveName,
      List<ArchiveEntry> entries,
      EntryContentResolver resolver,
      ByteSink destination)
      throws IOException {
    String prefix = "zipsession-" + UNSAFE_PREFIX_CHARS.replaceFrom(archiveName, '_') + "-";
    try (TemporaryDirectory scratch = scratchDirectoryFactory.make(prefix)) {
      File root = scratch.getDirectory();
      logger.debug("Staging {} entries of {} in {}", entries.size(), archiveName, root);

      stage(root, entries, resolver);

      try (ZipOutputStream zipOut = new ZipOutputStream(destination.openBufferedStream())) {
        for (ArchiveEntry entry : entries) {
          File staged = EntryNames.resolve(root, entry.getName());
          EntryMetadata metadata = EntryMetadata.of(staged);
          packVisitor.visit(EntryNames.normalize(staged.getPath()), metadata);
          TransferEngine.packFile(staged, entry.getName(), zipOut, metadata);
        }
      }
    }
  }

  /** Creates every directory and materializes every file of {@code entries} below {@code root}. */
  private static void stage(File root, List<ArchiveEntry> entries, EntryContentResolver resolver)
      throws IOException {
    for (ArchiveEntry entry : entries) {
      File staged = EntryNames.resolve(root, entry.getName());
      if (entry.isDirectory()) {
        Files.createDirectories(staged.toPath());
      } else {
        resolver.materialize(entry, staged);
      }
    }

    // Directory times change while their contents are created, so set them last.
    for (ArchiveEntry entry : entries) {
      if (entry.isDirectory() && entry.getLastModified() > 0) {
        EntryNames.resolve(root, entry.getName()).setLastModified(entry.getLastModified());
      }
    }
  }
}
