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

package com.android.tools.build.zipsession.zip;

import com.android.tools.build.zipsession.utils.NonClosingOutputStream;
import com.google.common.base.Predicate;
import com.google.common.io.ByteStreams;
import com.google.common.io.MoreFiles;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Moves bytes between archive members and files on disk, in both directions. Extraction goes from
 * a {@link ZipFile} to a directory; packing goes from a file or directory to a {@link
 * ZipOutputStream}. Member names always use forward slashes.
 */
public final class TransferEngine {

  private TransferEngine() {}

  /**
   * Extracts a single file member.
   *
   * @param zipFile the archive
   * @param member the member to extract; must not be a directory
   * @param destination the file to create or truncate; missing parent directories are created
   * @throws IOException failed to read the member or to write the file
   */
  public static void extractEntry(ZipFile zipFile, ZipEntry member, File destination)
      throws IOException {
    Path destinationPath = destination.toPath();
    MoreFiles.createParentDirectories(destinationPath);
    try (InputStream in = zipFile.getInputStream(member)) {
      MoreFiles.asByteSink(destinationPath).writeFrom(in);
    }

    if (member.getTime() != ArchiveEntry.UNKNOWN_TIME) {
      destination.setLastModified(member.getTime());
    }
  }

  /**
   * Extracts members of an archive into a directory, in the order they are stored.
   *
   * @param zipFile the archive
   * @param destRoot the directory to extract into; members are placed at their name relative to it
   * @param visitor invoked for each extracted member before it is written
   * @param selectedNames if not empty, only members whose normalized name is in this set are
   *     extracted and visited
   * @throws IOException failed to extract, or the visitor aborted the extraction
   */
  public static void extractAll(
      ZipFile zipFile, File destRoot, EntryVisitor visitor, Set<String> selectedNames)
      throws IOException {
    boolean selective = !selectedNames.isEmpty();
    Enumeration<? extends ZipEntry> members = zipFile.entries();
    while (members.hasMoreElements()) {
      ZipEntry member = members.nextElement();
      String name = EntryNames.normalize(member.getName());
      if (selective && !selectedNames.contains(name)) {
        continue;
      }

      boolean directory = EntryNames.isDirectory(name);
      visitor.visit(name, EntryMetadata.create(directory, member.getSize()));

      File destination = EntryNames.resolve(destRoot, name);
      if (directory) {
        Files.createDirectories(destination.toPath());
      } else {
        extractEntry(zipFile, member, destination);
      }
    }
  }

  /**
   * Writes a single member. A directory produces an empty member whose name ends in {@code /}. A
   * file produces a member declaring {@code metadata.getSize()} bytes, followed by the file's
   * contents.
   *
   * @param source the file or directory to pack
   * @param recordedName the member name
   * @param zipOut the stream to write to
   * @param metadata metadata of {@code source}
   * @throws ZipException the number of bytes read from {@code source} differs from the declared
   *     size
   * @throws IOException failed to read {@code source} or to write the member
   */
  public static void packFile(
      File source, String recordedName, ZipOutputStream zipOut, EntryMetadata metadata)
      throws IOException {
    String name = EntryNames.normalize(recordedName);
    long lastModified = source.lastModified();

    if (metadata.isDirectory()) {
      ZipEntry member = new ZipEntry(EntryNames.asDirectory(name));
      member.setSize(0);
      if (lastModified > 0) {
        member.setTime(lastModified);
      }

      zipOut.putNextEntry(member);
      zipOut.closeEntry();
      return;
    }

    ZipEntry member = new ZipEntry(name);
    member.setSize(metadata.getSize());
    if (lastModified > 0) {
      member.setTime(lastModified);
    }

    zipOut.putNextEntry(member);
    long written;
    try (InputStream in = new FileInputStream(source)) {
      written = ByteStreams.copy(in, zipOut);
    }

    if (written != metadata.getSize()) {
      throw new ZipException(
          "Entry '"
              + name
              + "' declares "
              + metadata.getSize()
              + " bytes but "
              + written
              + " bytes were read from '"
              + source.getAbsolutePath()
              + "'.");
    }

    zipOut.closeEntry();
  }

  /**
   * Packs the children of a directory, recursively. Children are processed in the order the file
   * system lists them.
   *
   * @param source the directory
   * @param recordedPrefix the member name of {@code source}, without trailing slash; empty to pack
   *     the children at the archive's root
   * @param zipOut the stream to write to
   * @param visitor invoked for each child before it is written
   * @param excluded children whose file name matches are skipped, along with their contents
   * @throws IOException failed to pack, or the visitor aborted packing
   */
  public static void packDirectory(
      File source,
      String recordedPrefix,
      ZipOutputStream zipOut,
      EntryVisitor visitor,
      Predicate<String> excluded)
      throws IOException {
    File[] children = source.listFiles();
    if (children == null) {
      throw new IOException("Cannot list directory '" + source.getAbsolutePath() + "'.");
    }

    for (File child : children) {
      if (excluded.apply(child.getName())) {
        continue;
      }

      EntryMetadata metadata = EntryMetadata.of(child);
      visitor.visit(EntryNames.normalize(child.getPath()), metadata);

      String recordedName =
          recordedPrefix.isEmpty()
              ? child.getName()
              : recordedPrefix + EntryNames.SEPARATOR + child.getName();
      packFile(child, recordedName, zipOut, metadata);
      if (metadata.isDirectory()) {
        packDirectory(child, recordedName, zipOut, visitor, excluded);
      }
    }
  }

  /**
   * Packs a file or a directory tree into a new archive written to {@code out}. A file is stored at
   * the archive's root under its own name. The archive is complete when this method returns, but
   * {@code out} is left open.
   *
   * @param source the file or directory to pack
   * @param out the stream receiving the archive
   * @param visitor invoked for every member below {@code source}
   * @param includeRootDir if {@code source} is a directory, should it be stored as a member with
   *     everything else below it? If {@code false}, its children are stored at the archive's root
   * @param excluded file names to skip inside directories
   * @throws IOException failed to pack, or the visitor aborted packing
   */
  public static void packTree(
      File source,
      OutputStream out,
      EntryVisitor visitor,
      boolean includeRootDir,
      Predicate<String> excluded)
      throws IOException {
    EntryMetadata metadata = EntryMetadata.of(source);
    Path fileName = source.toPath().toAbsolutePath().normalize().getFileName();
    String baseName = fileName == null ? "" : fileName.toString();

    try (ZipOutputStream zipOut = new ZipOutputStream(new NonClosingOutputStream(out))) {
      if (!metadata.isDirectory()) {
        packFile(source, baseName, zipOut, metadata);
        return;
      }

      String prefix = "";
      if (includeRootDir && !baseName.isEmpty()) {
        packFile(source, baseName, zipOut, metadata);
        prefix = baseName;
      }

      packDirectory(source, prefix, zipOut, visitor, excluded);
    }
  }
}
