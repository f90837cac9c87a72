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

package com.android.tools.build.zipsession.utils;

import static com.google.common.truth.Truth.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NonClosingOutputStreamTest {

  @Test
  public void forwardsWritesButNotClose() throws Exception {
    AtomicBoolean closed = new AtomicBoolean(false);
    ByteArrayOutputStream target =
        new ByteArrayOutputStream() {
          @Override
          public void close() throws IOException {
            closed.set(true);
            super.close();
          }
        };

    try (NonClosingOutputStream out = new NonClosingOutputStream(target)) {
      out.write(1);
      out.write(new byte[] {2, 3, 4}, 1, 2);
    }

    assertThat(closed.get()).isFalse();
    assertThat(target.toByteArray()).isEqualTo(new byte[] {1, 3, 4});
  }
}
