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

import com.android.tools.build.zipsession.scratch.TemporaryDirectoryFactory;
import com.android.tools.build.zipsession.zip.EntryVisitors;
import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableSet;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import javax.annotation.Nullable;

/** Options to open, create and pack archives. */
public class ArchiveOptions {

  /** File names skipped by default when packing directories. */
  public static final ImmutableSet<String> DEFAULT_EXCLUDED_NAMES =
      ImmutableSet.of(".git", ".svn", ".hg", ".bzr", ".DS_Store");

  /** Should the default visitors report every entry at info level? */
  private boolean verbose;

  /** Which file names are skipped when packing or adding directories? */
  private Predicate<String> excludePredicate;

  /** Creates the scratch directories used when flushing. */
  private TemporaryDirectoryFactory scratchDirectoryFactory;

  /** Permissions given to archives created by sessions. */
  private ImmutableSet<PosixFilePermission> newArchivePermissions;

  /** Repacker used when flushing; {@code null} to use a {@link ScratchTreeRepacker}. */
  @Nullable private ArchiveRepacker repacker;

  public ArchiveOptions() {
    verbose = true;
    excludePredicate = Predicates.in(DEFAULT_EXCLUDED_NAMES);
    scratchDirectoryFactory = TemporaryDirectoryFactory.system();
    newArchivePermissions = ImmutableSet.copyOf(PosixFilePermissions.fromString("rw-r--r--"));
    repacker = null;
  }

  public boolean isVerbose() {
    return verbose;
  }

  public ArchiveOptions setVerbose(boolean verbose) {
    this.verbose = verbose;
    return this;
  }

  public Predicate<String> getExcludePredicate() {
    return excludePredicate;
  }

  /**
   * Sets which file names are skipped when packing or adding directories. The predicate receives
   * the file name only, not its path.
   */
  public ArchiveOptions setExcludePredicate(Predicate<String> excludePredicate) {
    this.excludePredicate = excludePredicate;
    return this;
  }

  public TemporaryDirectoryFactory getScratchDirectoryFactory() {
    return scratchDirectoryFactory;
  }

  public ArchiveOptions setScratchDirectoryFactory(
      TemporaryDirectoryFactory scratchDirectoryFactory) {
    this.scratchDirectoryFactory = scratchDirectoryFactory;
    return this;
  }

  public ImmutableSet<PosixFilePermission> getNewArchivePermissions() {
    return newArchivePermissions;
  }

  public ArchiveOptions setNewArchivePermissions(
      ImmutableSet<PosixFilePermission> newArchivePermissions) {
    this.newArchivePermissions = newArchivePermissions;
    return this;
  }

  /**
   * Obtains the repacker used when flushing. Unless one was set, this is a {@link
   * ScratchTreeRepacker} using the current scratch directory factory and verbosity.
   */
  public ArchiveRepacker getRepacker() {
    if (repacker != null) {
      return repacker;
    }

    return new ScratchTreeRepacker(scratchDirectoryFactory, EntryVisitors.packing(verbose));
  }

  public ArchiveOptions setRepacker(@Nullable ArchiveRepacker repacker) {
    this.repacker = repacker;
    return this;
  }
}
