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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default visitors. They report progress and never abort. */
public final class EntryVisitors {

  private static final Logger logger = LoggerFactory.getLogger(EntryVisitors.class);

  private EntryVisitors() {}

  /**
   * Visitor used when extracting. Logs every entry at info level if {@code verbose}, at debug level
   * otherwise.
   */
  public static EntryVisitor extracting(boolean verbose) {
    return (fullName, metadata) -> log(verbose, "Unzipping file...{}", fullName);
  }

  /**
   * Visitor used when packing. Logs every file and directory at info level if {@code verbose}, at
   * debug level otherwise.
   */
  public static EntryVisitor packing(boolean verbose) {
    return (fullName, metadata) -> {
      if (metadata.isDirectory()) {
        log(verbose, "Adding dir...{}", fullName);
      } else {
        log(verbose, "Adding file...{}", fullName);
      }
    };
  }

  /** Visitor that does nothing. */
  public static EntryVisitor none() {
    return (fullName, metadata) -> {};
  }

  private static void log(boolean verbose, String format, String fullName) {
    if (verbose) {
      logger.info(format, fullName);
    } else {
      logger.debug(format, fullName);
    }
  }
}
