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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import java.io.File;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Optional;

/** An archive stored in a file. */
@AutoValue
public abstract class PathTarget {

  public abstract File getFile();

  /**
   * POSIX permissions to give the file whenever it is rewritten. Empty if the permissions are not
   * known or the file system does not support them.
   */
  public abstract Optional<ImmutableSet<PosixFilePermission>> getPermissions();

  public static PathTarget create(File file, Optional<ImmutableSet<PosixFilePermission>> permissions) {
    return new AutoValue_PathTarget(file, permissions);
  }
}
