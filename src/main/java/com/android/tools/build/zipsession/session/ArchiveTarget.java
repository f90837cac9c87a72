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

import com.google.auto.value.AutoOneOf;
import java.io.OutputStream;

/** Where an {@link ArchiveSession} writes the archive when flushed. */
@AutoOneOf(ArchiveTarget.Kind.class)
public abstract class ArchiveTarget {

  /** The kinds of targets. */
  public enum Kind {
    /** The archive is a file that is read from, and rewritten in place. */
    PATH,
    /** The archive is written into a stream owned by the caller. */
    STREAM
  }

  public abstract Kind getKind();

  public abstract PathTarget path();

  public abstract OutputStream stream();

  public static ArchiveTarget ofPath(PathTarget path) {
    return AutoOneOf_ArchiveTarget.path(path);
  }

  public static ArchiveTarget ofStream(OutputStream stream) {
    return AutoOneOf_ArchiveTarget.stream(stream);
  }
}
