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

import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.android.tools.build.zipsession.scratch.TemporaryFile;
import com.android.tools.build.zipsession.utils.NonClosingOutputStream;
import com.android.tools.build.zipsession.zip.ArchiveEntry;
import com.android.tools.build.zipsession.zip.EntryNames;
import com.android.tools.build.zipsession.zip.EntryVisitor;
import com.android.tools.build.zipsession.zip.EntryVisitors;
import com.android.tools.build.zipsession.zip.TransferEngine;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.io.ByteSink;
import com.google.common.io.MoreFiles;
import java.io.Closeable;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A zip archive that can be extracted and modified. The session keeps an ordered, logical list of
 * entries. Modifying the list only marks the session as changed; {@link #flush()} (or {@link
 * #close()}) rebuilds the whole archive from the list.
 *
 * <p>A session either rewrites a file ({@link ArchiveTarget.Kind#PATH}), or writes into a stream
 * owned by the caller ({@link ArchiveTarget.Kind#STREAM}). File-backed sessions are never left
 * with a partially written archive: the new archive is written next to the old one and renamed over
 * it only once complete.
 *
 * <p>Sessions are not thread-safe. Sessions are obtained from {@link Archives}.
 */
public class ArchiveSession implements Closeable {

  private static final Logger logger = LoggerFactory.getLogger(ArchiveSession.class);

  /** Where the archive is written. */
  private final ArchiveTarget target;

  private final ArchiveOptions options;

  /** Rebuilds the archive when flushing. */
  private final ArchiveRepacker repacker;

  /** The archive as last read from disk, if any. */
  @Nullable private ZipFile archive;

  /** The logical entries, in archive order. */
  private final List<ArchiveEntry> entries;

  /** Do {@link #entries} differ from what is on disk? */
  private boolean changed;

  /** Has the session been closed? */
  private boolean closed;

  /** Has a complete archive already been written into the target stream? */
  private boolean streamWritten;

  /**
   * Was the archive file replaced without being read back? The file is valid but the entries no
   * longer match it, so the session can only be closed.
   */
  private boolean unreadable;

  /**
   * Creates a new session.
   *
   * @param target where the archive is written
   * @param options the options
   * @param archive the archive to read entries from, {@code null} for a new, empty archive
   */
  ArchiveSession(ArchiveTarget target, ArchiveOptions options, @Nullable ZipFile archive) {
    this.target = target;
    this.options = options;
    this.repacker = options.getRepacker();
    this.archive = archive;
    this.entries = Lists.newArrayList();
    this.closed = false;
    this.streamWritten = false;
    this.unreadable = false;

    if (archive == null) {
      changed = true;
    } else {
      entries.addAll(readEntries(archive));
      changed = false;
    }
  }

  /**
   * Opens a zip file for reading.
   *
   * @param file the zip file
   * @return the open file
   * @throws IOException the file does not exist or is not a valid zip file
   */
  static ZipFile openZipFile(File file) throws IOException {
    try {
      return new ZipFile(file);
    } catch (IOException e) {
      throw new IOException("Failed to read zip file '" + file.getAbsolutePath() + "'.", e);
    }
  }

  private static ImmutableList<ArchiveEntry> readEntries(ZipFile archive) {
    return Collections.list(archive.entries()).stream()
        .map(ArchiveEntry::fromArchive)
        .collect(ImmutableList.toImmutableList());
  }

  /** Obtains where this session writes the archive. */
  public ArchiveTarget getTarget() {
    return target;
  }

  /** Obtains the archive file, or {@code null} if this session writes into a stream. */
  @Nullable
  public File getFile() {
    return target.getKind() == ArchiveTarget.Kind.PATH ? target.path().getFile() : null;
  }

  /** Are there changes that have not been flushed? */
  public boolean isChanged() {
    return changed;
  }

  /** Obtains the current logical entries, in archive order. */
  public ImmutableList<ArchiveEntry> entries() {
    checkNotClosed();
    return ImmutableList.copyOf(entries);
  }

  /**
   * Obtains the names of all entries, in archive order.
   *
   * @param prefixes if not empty, only names starting with one of these are returned
   * @return the names
   */
  public ImmutableList<String> listNames(String... prefixes) {
    checkNotClosed();
    ImmutableList<String> normalized =
        Arrays.stream(prefixes).map(EntryNames::normalize).collect(ImmutableList.toImmutableList());
    return entries.stream()
        .map(ArchiveEntry::getName)
        .filter(name -> normalized.isEmpty() || normalized.stream().anyMatch(name::startsWith))
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Adds a directory entry and entries for all its ancestors that are not yet in the archive.
   *
   * @param path the directory's name, with or without trailing slash
   * @return was any entry added?
   */
  public boolean addEmptyDirectory(String path) {
    checkNotClosed();
    String name = EntryNames.asDirectory(EntryNames.checkRelative(path));

    boolean added = addAncestors(name);
    if (indexOf(name) < 0) {
      entries.add(ArchiveEntry.directory(name));
      added = true;
    }

    if (added) {
      changed = true;
    }

    return added;
  }

  /**
   * Adds a file entry whose content is read from {@code source} when the session is flushed. If an
   * entry with the same name exists, it is bound to {@code source} and keeps its position.
   * Directory entries are added for ancestors that are missing.
   *
   * @param name the entry's name
   * @param source the file with the content
   * @throws FileNotFoundException {@code source} is not a file
   */
  public void addFile(String name, File source) throws FileNotFoundException {
    checkNotClosed();
    String entryName = EntryNames.checkRelative(name);
    Preconditions.checkArgument(
        !EntryNames.isDirectory(entryName), "File name '%s' ends with a slash", name);
    if (!source.isFile()) {
      throw new FileNotFoundException("'" + source.getAbsolutePath() + "' is not a file.");
    }

    addAncestors(entryName);
    ArchiveEntry entry = ArchiveEntry.fromFile(entryName, source);
    int index = indexOf(entryName);
    if (index >= 0) {
      entries.set(index, entry);
    } else {
      entries.add(entry);
    }

    changed = true;
  }

  /**
   * Adds a directory entry and, recursively, everything inside {@code sourceDirectory}. Files and
   * directories whose names match {@link ArchiveOptions#getExcludePredicate()} are skipped.
   * Children are added sorted by name.
   *
   * @param path the name of the directory in the archive; empty to add the contents at the root
   * @param sourceDirectory the directory to add
   * @throws IOException {@code sourceDirectory} is not a directory, or could not be listed
   */
  public void addDirectory(String path, File sourceDirectory) throws IOException {
    checkNotClosed();
    if (!sourceDirectory.isDirectory()) {
      throw new FileNotFoundException(
          "'" + sourceDirectory.getAbsolutePath() + "' is not a directory.");
    }

    String prefix = "";
    if (!EntryNames.normalize(path).isEmpty()) {
      addEmptyDirectory(path);
      prefix = EntryNames.asDirectory(EntryNames.checkRelative(path));
    }

    addDirectoryContents(prefix, sourceDirectory);
  }

  private void addDirectoryContents(String prefix, File directory) throws IOException {
    File[] children = directory.listFiles();
    if (children == null) {
      throw new IOException("Cannot list directory '" + directory.getAbsolutePath() + "'.");
    }

    Arrays.sort(children, Comparator.comparing(File::getName));
    for (File child : children) {
      if (options.getExcludePredicate().apply(child.getName())) {
        continue;
      }

      String name = prefix + child.getName();
      if (child.isDirectory()) {
        addEmptyDirectory(name);
        addDirectoryContents(EntryNames.asDirectory(name), child);
      } else {
        addFile(name, child);
      }
    }
  }

  /**
   * Removes the entry at {@code index}.
   *
   * @param index position of the entry in {@link #entries()}
   */
  public void delete(int index) {
    checkNotClosed();
    Preconditions.checkElementIndex(index, entries.size());
    entries.remove(index);
    changed = true;
  }

  /**
   * Removes the entries named {@code name}.
   *
   * @param name the entry name; directories must include the trailing slash
   * @return was any entry removed?
   */
  public boolean delete(String name) {
    checkNotClosed();
    String entryName = EntryNames.normalize(name);
    boolean removed = entries.removeIf(entry -> entry.getName().equals(entryName));
    if (removed) {
      changed = true;
    }

    return removed;
  }

  /**
   * Extracts the archive, or some of its entries, reporting every extracted entry to the default
   * extraction visitor. Pending changes are not visible: flush first.
   *
   * @param destRoot the directory to extract into; created if needed
   * @param selectedNames if not empty, only the entries with these names are extracted
   * @throws IOException failed to extract
   */
  public void extractTo(File destRoot, String... selectedNames) throws IOException {
    extractTo(destRoot, EntryVisitors.extracting(options.isVerbose()), selectedNames);
  }

  /**
   * Extracts the archive, or some of its entries. Pending changes are not visible: flush first.
   *
   * @param destRoot the directory to extract into; created if needed. Backslashes in the path are
   *     read as separators
   * @param visitor invoked for every entry before it is extracted; aborts extraction by throwing
   * @param selectedNames if not empty, only the entries with these names are extracted
   * @throws IOException failed to extract, or {@code visitor} aborted extraction
   * @throws IllegalStateException there is no archive on disk to extract from
   */
  public void extractTo(File destRoot, EntryVisitor visitor, String... selectedNames)
      throws IOException {
    checkNotClosed();
    ZipFile source = archive;
    Preconditions.checkState(source != null, "There is no archive on disk to extract from");

    if (options.isVerbose()) {
      logger.info("Unzipping {}...", source.getName());
    }

    File root = new File(EntryNames.normalize(destRoot.getPath()));
    Files.createDirectories(root.toPath());
    ImmutableSet<String> selection =
        Arrays.stream(selectedNames).map(EntryNames::normalize).collect(toImmutableSet());
    TransferEngine.extractAll(source, root, visitor, selection);
  }

  /**
   * Writes pending changes. Does nothing if there are none. If this fails, the session still has
   * pending changes and the archive file, if any, is unchanged.
   *
   * <p>A stream-backed session writes its archive into the stream once. Flushing it again with new
   * changes throws {@link IllegalStateException}, because a second archive appended to the stream
   * would not form a valid zip file.
   *
   * <p>If the archive file was replaced but cannot be read back, the exception propagates and the
   * session can only be closed afterwards.
   *
   * @throws IOException failed to write the archive
   */
  public void flush() throws IOException {
    checkNotClosed();
    if (!changed) {
      return;
    }

    ImmutableList<ArchiveEntry> snapshot = ImmutableList.copyOf(entries);
    switch (target.getKind()) {
      case PATH:
        rewrite(target.path(), snapshot);
        break;
      case STREAM:
        Preconditions.checkState(
            !streamWritten,
            "An archive was already written into the stream; it cannot be rewritten");
        OutputStream stream = target.stream();
        repacker.repack(
            "stream",
            snapshot,
            this::extractFile,
            new ByteSink() {
              @Override
              public OutputStream openStream() {
                return new NonClosingOutputStream(stream);
              }
            });
        streamWritten = true;
        break;
    }

    changed = false;
    logger.debug("Flushed {} entries", snapshot.size());
  }

  /**
   * Writes the archive next to the target file and, once complete, replaces the target file with it
   * and reads it back.
   */
  private void rewrite(PathTarget pathTarget, ImmutableList<ArchiveEntry> snapshot)
      throws IOException {
    File file = pathTarget.getFile();
    try (TemporaryFile staged = TemporaryFile.siblingOf(file)) {
      repacker.repack(
          file.getName(),
          snapshot,
          this::extractFile,
          MoreFiles.asByteSink(staged.getPath()));

      closeArchive();
      try {
        replace(staged.getPath(), file.toPath());
      } catch (IOException e) {
        if (file.isFile()) {
          try {
            archive = openZipFile(file);
          } catch (IOException reopenFailure) {
            e.addSuppressed(reopenFailure);
          }
        }

        throw e;
      }
    }

    ZipFile reopened;
    try {
      reopened = openZipFile(file);
    } catch (IOException e) {
      unreadable = true;
      throw e;
    }

    archive = reopened;
    entries.clear();
    entries.addAll(readEntries(reopened));

    Optional<ImmutableSet<PosixFilePermission>> permissions = pathTarget.getPermissions();
    if (permissions.isPresent()
        && Files.getFileAttributeView(file.toPath(), PosixFileAttributeView.class) != null) {
      Files.setPosixFilePermissions(file.toPath(), permissions.get());
    }
  }

  private static void replace(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /**
   * Writes the content of a file entry into {@code destination}. Entries bound to a file are copied
   * from it; other entries are read from the archive the session was opened on.
   */
  private void extractFile(ArchiveEntry entry, File destination) throws IOException {
    File sourceFile = entry.getSourceFile();
    if (sourceFile != null) {
      MoreFiles.createParentDirectories(destination.toPath());
      Files.copy(
          sourceFile.toPath(),
          destination.toPath(),
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.COPY_ATTRIBUTES);
      return;
    }

    String archiveName = entry.getArchiveName();
    if (archive != null && archiveName != null) {
      ZipEntry member = archive.getEntry(archiveName);
      if (member != null) {
        TransferEngine.extractEntry(archive, member, destination);
        return;
      }
    }

    throw new IOException("No content available for entry '" + entry.getName() + "'.");
  }

  /**
   * Flushes pending changes and releases the archive. If flushing fails, the session stays open
   * with its changes pending.
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }

    if (unreadable) {
      logger.warn("Closing session on '{}', which could not be read back", getFile());
      closed = true;
      return;
    }

    flush();
    closeArchive();
    closed = true;
  }

  private void closeArchive() throws IOException {
    if (archive != null) {
      ZipFile toClose = archive;
      archive = null;
      toClose.close();
    }
  }

  /** Adds missing directory entries for the ancestors of {@code name}. */
  private boolean addAncestors(String name) {
    boolean added = false;
    for (String ancestor : EntryNames.ancestors(name)) {
      if (indexOf(ancestor) < 0) {
        entries.add(ArchiveEntry.directory(ancestor));
        added = true;
      }
    }

    return added;
  }

  private int indexOf(String name) {
    for (int i = 0; i < entries.size(); i++) {
      if (entries.get(i).getName().equals(name)) {
        return i;
      }
    }

    return -1;
  }

  private void checkNotClosed() {
    Preconditions.checkState(!closed, "Archive session is closed");
    Preconditions.checkState(
        !unreadable,
        "Archive '%s' was rewritten but could not be read back; the session can only be closed",
        getFile());
  }
}
