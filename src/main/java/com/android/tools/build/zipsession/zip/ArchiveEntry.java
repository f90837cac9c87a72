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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import java.io.File;
import java.util.zip.ZipEntry;
import javax.annotation.Nullable;

/**
 * One logical member of an archive. The content of a file entry comes either from a member of the
 * archive the entry was read from ({@link #getArchiveName()}) or from a file on disk ({@link
 * #getSourceFile()}). Directory entries have names ending in {@code /} and no content.
 */
@AutoValue
public abstract class ArchiveEntry {

  /** Value of {@link #getLastModified()} when the time is not known. */
  public static final long UNKNOWN_TIME = -1;

  /** The member name, using forward slashes. */
  public abstract String getName();

  public abstract long getUncompressedSize();

  /** Modification time in milliseconds since the epoch, or {@link #UNKNOWN_TIME}. */
  public abstract long getLastModified();

  /**
   * The raw name of the member in the archive this entry was read from, or {@code null} if the
   * entry was not read from an archive.
   */
  @Nullable
  public abstract String getArchiveName();

  /** The file the entry's content is read from, or {@code null} if not bound to a file. */
  @Nullable
  public abstract File getSourceFile();

  public boolean isDirectory() {
    return EntryNames.isDirectory(getName());
  }

  /** Creates a directory marker. */
  public static ArchiveEntry directory(String name) {
    return create(EntryNames.asDirectory(name), 0, UNKNOWN_TIME, null, null);
  }

  /** Creates an entry for a member of an open archive. */
  public static ArchiveEntry fromArchive(ZipEntry member) {
    String name = EntryNames.normalize(member.getName());
    long size = EntryNames.isDirectory(name) ? 0 : Math.max(0, member.getSize());
    return create(name, size, member.getTime(), member.getName(), null);
  }

  /**
   * Creates an entry whose content will be read from {@code sourceFile}.
   *
   * @param name the member name
   * @param sourceFile an existing regular file
   */
  public static ArchiveEntry fromFile(String name, File sourceFile) {
    Preconditions.checkArgument(sourceFile.isFile(), "'%s' is not a file", sourceFile);
    return create(name, sourceFile.length(), sourceFile.lastModified(), null, sourceFile);
  }

  private static ArchiveEntry create(
      String name,
      long size,
      long lastModified,
      @Nullable String archiveName,
      @Nullable File sourceFile) {
    Preconditions.checkArgument(name.indexOf('\\') < 0, "Name '%s' has backslashes", name);
    Preconditions.checkArgument(
        !EntryNames.isDirectory(name) || (size == 0 && sourceFile == null),
        "Directory '%s' cannot have content",
        name);
    return new AutoValue_ArchiveEntry(name, size, lastModified, archiveName, sourceFile);
  }
}
