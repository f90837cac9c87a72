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
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.attribute.BasicFileAttributes;

/** What a visitor learns about an entry: whether it is a directory, and its size. */
@AutoValue
public abstract class EntryMetadata {

  public abstract boolean isDirectory();

  /** Number of bytes of content; always {@code 0} for directories. */
  public abstract long getSize();

  public static EntryMetadata create(boolean directory, long size) {
    return new AutoValue_EntryMetadata(directory, directory ? 0 : size);
  }

  /**
   * Reads the metadata of a file or directory on disk.
   *
   * @param file the file or directory
   * @return the metadata
   * @throws IOException failed to read the file's attributes, for example because it does not
   *     exist
   */
  public static EntryMetadata of(File file) throws IOException {
    BasicFileAttributes attributes = Files.readAttributes(file.toPath(), BasicFileAttributes.class);
    return create(attributes.isDirectory(), attributes.size());
  }
}
