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

import com.android.tools.build.zipsession.zip.EntryVisitor;
import com.android.tools.build.zipsession.zip.EntryVisitors;
import com.android.tools.build.zipsession.zip.TransferEngine;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.MoreFiles;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Optional;
import java.util.zip.ZipFile;

/** Factory for {@link ArchiveSession}s, and one-shot packing of files and directories. */
public final class Archives {

  private Archives() {}

  /**
   * Opens an existing archive. Equivalent to {@link #open(File, ArchiveOptions)} with default
   * options.
   */
  public static ArchiveSession open(File file) throws IOException {
    return open(file, new ArchiveOptions());
  }

  /**
   * Opens an existing archive. The session's entries are the archive's members and the archive's
   * permissions are kept when it is rewritten.
   *
   * @param file the archive
   * @param options the options
   * @return a session without pending changes
   * @throws IOException the file does not exist or is not a valid zip file
   */
  public static ArchiveSession open(File file, ArchiveOptions options) throws IOException {
    ZipFile archive = ArchiveSession.openZipFile(file);
    Optional<ImmutableSet<PosixFilePermission>> permissions = Optional.empty();
    try {
      if (Files.getFileAttributeView(file.toPath(), PosixFileAttributeView.class) != null) {
        permissions = Optional.of(ImmutableSet.copyOf(Files.getPosixFilePermissions(file.toPath())));
      }
    } catch (IOException e) {
      try {
        archive.close();
      } catch (IOException closeFailure) {
        e.addSuppressed(closeFailure);
      }

      throw e;
    }

    return new ArchiveSession(
        ArchiveTarget.ofPath(PathTarget.create(file, permissions)), options, archive);
  }

  /**
   * Creates a new, empty archive. Equivalent to {@link #create(File, ArchiveOptions)} with default
   * options.
   */
  public static ArchiveSession create(File file) {
    return create(file, new ArchiveOptions());
  }

  /**
   * Creates a new, empty archive. Nothing is written until the session is flushed or closed; an
   * existing file is then replaced.
   *
   * @param file the archive file
   * @param options the options
   * @return a session with pending changes
   */
  public static ArchiveSession create(File file, ArchiveOptions options) {
    PathTarget target =
        PathTarget.create(file, Optional.of(options.getNewArchivePermissions()));
    return new ArchiveSession(ArchiveTarget.ofPath(target), options, null);
  }

  /**
   * Creates a new, empty archive written into a stream. Equivalent to {@link #create(OutputStream,
   * ArchiveOptions)} with default options.
   */
  public static ArchiveSession create(OutputStream stream) {
    return create(stream, new ArchiveOptions());
  }

  /**
   * Creates a new, empty archive written into a stream when the session is flushed or closed. The
   * stream is never closed by the session.
   *
   * <p>The archive is written once. Changes made after a successful flush cannot be written: the
   * next {@link ArchiveSession#flush()} or {@link ArchiveSession#close()} throws {@link
   * IllegalStateException}.
   *
   * @param stream the stream
   * @param options the options
   * @return a session with pending changes
   */
  public static ArchiveSession create(OutputStream stream, ArchiveOptions options) {
    return new ArchiveSession(ArchiveTarget.ofStream(stream), options, null);
  }

  /** Packs {@code source} into {@code destination}, without wrapping it in a root directory. */
  public static void packTo(File source, File destination) throws IOException {
    packTo(source, destination, false);
  }

  /**
   * Packs a file or directory into a new archive, reporting every entry to the default packing
   * visitor.
   *
   * @param source the file or directory
   * @param destination the archive to create or overwrite
   * @param includeRootDir if {@code source} is a directory, should entries be stored under its name?
   * @throws IOException failed to pack
   */
  public static void packTo(File source, File destination, boolean includeRootDir)
      throws IOException {
    ArchiveOptions options = new ArchiveOptions();
    packTo(source, destination, EntryVisitors.packing(options.isVerbose()), includeRootDir, options);
  }

  /**
   * Packs a file or directory into a new archive with default options.
   *
   * @see #packTo(File, File, EntryVisitor, boolean, ArchiveOptions)
   */
  public static void packTo(
      File source, File destination, EntryVisitor visitor, boolean includeRootDir)
      throws IOException {
    packTo(source, destination, visitor, includeRootDir, new ArchiveOptions());
  }

  /**
   * Packs a file or directory into a new archive. The archive is written directly into {@code
   * destination}: if packing fails, {@code destination} may be left incomplete.
   *
   * @param source the file or directory
   * @param destination the archive to create or overwrite
   * @param visitor invoked for every file and directory below {@code source} before it is packed;
   *     aborts packing by throwing
   * @param includeRootDir if {@code source} is a directory, should entries be stored under its name?
   * @param options provides the names to exclude
   * @throws IOException failed to pack, or {@code visitor} aborted packing
   */
  public static void packTo(
      File source,
      File destination,
      EntryVisitor visitor,
      boolean includeRootDir,
      ArchiveOptions options)
      throws IOException {
    try (OutputStream out = MoreFiles.asByteSink(destination.toPath()).openBufferedStream()) {
      TransferEngine.packTree(source, out, visitor, includeRootDir, options.getExcludePredicate());
    }
  }
}
