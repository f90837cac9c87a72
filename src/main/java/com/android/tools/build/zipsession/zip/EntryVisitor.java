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

import java.io.IOException;

/**
 * Callback invoked for every entry that is about to be extracted or packed, before the entry is
 * touched on disk. Throwing aborts the whole operation, and the exception is rethrown to the caller
 * of the operation unchanged.
 */
@FunctionalInterface
public interface EntryVisitor {

  /**
   * Visits an entry.
   *
   * @param fullName the member name when extracting, or the full source path when packing; always
   *     uses forward slashes
   * @param metadata the entry's metadata
   * @throws IOException the visitor rejects the entry; see {@link VisitorAbortException}
   */
  void visit(String fullName, EntryMetadata metadata) throws IOException;
}
