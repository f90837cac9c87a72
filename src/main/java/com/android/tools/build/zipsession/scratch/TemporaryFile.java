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

import com.google.common.base.Preconditions;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.UUID;

/**
 * A scratch path that is removed from disk when closed. Nothing is created up front: the owner may
 * create the path as a file or a directory, fill it, or move it away before closing. Whatever is
 * found at the path on close is deleted, directories recursively.
 */
public class TemporaryFile implements Closeable {

  private final Path path;

  /** Set by {@link #close()}; the path may no longer be handed out. */
  private boolean released;

  public TemporaryFile(Path path) {
    this.path = path;
    this.released = false;
  }

  /**
   * Reserves a hidden, uniquely named path in the same directory as {@code target}. Renaming the
   * reserved path over {@code target} replaces it in one step, since both share a file system.
   *
   * @param target the file that will eventually be replaced
   * @return the reserved path; nothing is created on disk
   */
  public static TemporaryFile siblingOf(File target) {
    Path directory = target.getAbsoluteFile().toPath().getParent();
    return new TemporaryFile(
        directory.resolve("." + target.getName() + "." + UUID.randomUUID() + ".tmp"));
  }

  /** Obtains the scratch path. */
  public Path getPath() {
    Preconditions.checkState(!released, "Temporary path '%s' was already released", path);
    return path;
  }

  /** Obtains the scratch path as a file. */
  public File getFile() {
    return getPath().toFile();
  }

  @Override
  public void close() throws IOException {
    if (released) {
      return;
    }

    released = true;
    if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
      return;
    }

    if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
      MoreFiles.deleteRecursively(path, RecursiveDeleteOption.ALLOW_INSECURE);
    } else {
      Files.delete(path);
    }
  }
}
