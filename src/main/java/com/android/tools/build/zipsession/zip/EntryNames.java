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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Utilities to handle archive member names. */
public final class EntryNames {

  /** Separator used in member names, whatever the host's separator is. */
  public static final char SEPARATOR = '/';

  private static final Splitter SEGMENT_SPLITTER = Splitter.on(SEPARATOR).omitEmptyStrings();

  private EntryNames() {}

  /** Replaces backslashes with forward slashes. */
  public static String normalize(String name) {
    return name.replace('\\', SEPARATOR);
  }

  /** Is {@code name} a directory marker? */
  public static boolean isDirectory(String name) {
    return !name.isEmpty() && name.charAt(name.length() - 1) == SEPARATOR;
  }

  /** Appends a trailing slash to {@code name}, unless it already has one. */
  public static String asDirectory(String name) {
    return isDirectory(name) ? name : name + SEPARATOR;
  }

  /**
   * Normalizes a name supplied by a caller that wants to add it to an archive. The name must be
   * relative and must not contain {@code .} or {@code ..} segments.
   *
   * @param name the name to check
   * @return the normalized name
   * @throws IllegalArgumentException the name is empty, absolute or contains relative segments
   */
  public static String checkRelative(String name) {
    String normalized = normalize(name);
    Preconditions.checkArgument(
        !CharMatcher.is(SEPARATOR).matchesAllOf(normalized), "Empty entry name '%s'", name);
    Preconditions.checkArgument(
        normalized.charAt(0) != SEPARATOR, "Entry name '%s' is absolute", name);
    for (String segment : SEGMENT_SPLITTER.split(normalized)) {
      Preconditions.checkArgument(
          !segment.equals(".") && !segment.equals(".."),
          "Entry name '%s' contains relative segments",
          name);
    }
    return normalized;
  }

  /**
   * Obtains the directory markers of all ancestors of {@code name}, outermost first. For {@code
   * a/b/c} and {@code a/b/c/} this is {@code [a/, a/b/]}.
   */
  public static ImmutableList<String> ancestors(String name) {
    List<String> segments = SEGMENT_SPLITTER.splitToList(normalize(name));
    ImmutableList.Builder<String> ancestors = ImmutableList.builder();
    StringBuilder current = new StringBuilder();
    for (int i = 0; i < segments.size() - 1; i++) {
      current.append(segments.get(i)).append(SEPARATOR);
      ancestors.add(current.toString());
    }
    return ancestors.build();
  }

  /**
   * Resolves a member name against a directory on disk.
   *
   * @param root the directory
   * @param name the member name
   * @return the file for the member
   * @throws IOException the member would land outside {@code root}
   */
  public static File resolve(File root, String name) throws IOException {
    Path rootPath = root.toPath().toAbsolutePath().normalize();
    Path resolved = rootPath.resolve(normalize(name)).normalize();
    if (!resolved.startsWith(rootPath)) {
      throw new IOException(
          "Entry '" + name + "' is outside of directory '" + rootPath + "'.");
    }

    return resolved.toFile();
  }
}
