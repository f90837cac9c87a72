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

import static com.android.tools.build.zipsession.zip.ZipTestUtils.memberNames;
import static com.android.tools.build.zipsession.zip.ZipTestUtils.read;
import static com.android.tools.build.zipsession.zip.ZipTestUtils.readZip;
import static com.android.tools.build.zipsession.zip.ZipTestUtils.write;
import static com.android.tools.build.zipsession.zip.ZipTestUtils.writeSimpleZip;
import static com.android.tools.build.zipsession.zip.ZipTestUtils.writeZip;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TransferEngineTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  /** Creates {@code out/a.txt} and {@code out/sub/b.txt} and returns {@code out}. */
  private File makeSimpleTree() throws IOException {
    File out = new File(temporaryFolder.getRoot(), "out");
    write(new File(out, "a.txt"), "hello");
    write(new File(out, "sub/b.txt"), "world");
    return out;
  }

  @Test
  public void extractAllWritesEveryMember() throws Exception {
    File zip = writeSimpleZip(temporaryFolder.newFile("simple.zip"));
    File dest = temporaryFolder.newFolder("dest");
    List<String> visited = new ArrayList<>();

    try (ZipFile zf = new ZipFile(zip)) {
      TransferEngine.extractAll(
          zf, dest, (name, metadata) -> visited.add(name), ImmutableSet.of());
    }

    assertThat(visited).containsExactly("a.txt", "sub/", "sub/b.txt").inOrder();
    assertThat(read(new File(dest, "a.txt"))).isEqualTo("hello");
    assertThat(new File(dest, "sub").isDirectory()).isTrue();
    assertThat(read(new File(dest, "sub/b.txt"))).isEqualTo("world");
  }

  @Test
  public void extractAllReportsMetadata() throws Exception {
    File zip = writeSimpleZip(temporaryFolder.newFile("simple.zip"));
    File dest = temporaryFolder.newFolder("dest");
    List<EntryMetadata> visited = new ArrayList<>();

    try (ZipFile zf = new ZipFile(zip)) {
      TransferEngine.extractAll(
          zf, dest, (name, metadata) -> visited.add(metadata), ImmutableSet.of());
    }

    assertThat(visited)
        .containsExactly(
            EntryMetadata.create(false, 5),
            EntryMetadata.create(true, 0),
            EntryMetadata.create(false, 5))
        .inOrder();
  }

  @Test
  public void extractSelectedFileOnlyTouchesThatFile() throws Exception {
    File zip = writeSimpleZip(temporaryFolder.newFile("simple.zip"));
    File dest = temporaryFolder.newFolder("dest");
    EntryVisitor visitor = mock(EntryVisitor.class);

    try (ZipFile zf = new ZipFile(zip)) {
      TransferEngine.extractAll(zf, dest, visitor, ImmutableSet.of("sub/b.txt"));
    }

    verify(visitor).visit("sub/b.txt", EntryMetadata.create(false, 5));
    verify(visitor, times(1)).visit(anyString(), any());
    assertThat(dest.list()).asList().containsExactly("sub");
    assertThat(new File(dest, "sub").list()).asList().containsExactly("b.txt");
    assertThat(read(new File(dest, "sub/b.txt"))).isEqualTo("world");
  }

  @Test
  public void extractSelectedDirectoryCreatesOnlyTheDirectory() throws Exception {
    File zip = writeSimpleZip(temporaryFolder.newFile("simple.zip"));
    File dest = temporaryFolder.newFolder("dest");

    try (ZipFile zf = new ZipFile(zip)) {
      TransferEngine.extractAll(zf, dest, EntryVisitors.none(), ImmutableSet.of("sub/"));
    }

    assertThat(dest.list()).asList().containsExactly("sub");
    assertThat(new File(dest, "sub").list()).isEmpty();
  }

  @Test
  public void extractNormalizesBackslashes() throws Exception {
    File zip =
        writeZip(temporaryFolder.newFile("win.zip"), ImmutableMap.of("dir\\file.txt", "data"));
    File dest = temporaryFolder.newFolder("dest");
    List<String> visited = new ArrayList<>();

    try (ZipFile zf = new ZipFile(zip)) {
      TransferEngine.extractAll(
          zf, dest, (name, metadata) -> visited.add(name), ImmutableSet.of("dir/file.txt"));
    }

    assertThat(visited).containsExactly("dir/file.txt");
    assertThat(read(new File(dest, "dir/file.txt"))).isEqualTo("data");
  }

  @Test
  public void extractRejectsMembersOutsideDestination() throws Exception {
    File zip =
        writeZip(temporaryFolder.newFile("evil.zip"), ImmutableMap.of("../evil.txt", "boom"));
    File dest = temporaryFolder.newFolder("dest");

    try (ZipFile zf = new ZipFile(zip)) {
      TransferEngine.extractAll(zf, dest, EntryVisitors.none(), ImmutableSet.of());
      fail();
    } catch (IOException e) {
      assertThat(e).hasMessageThat().contains("../evil.txt");
    }

    assertThat(new File(temporaryFolder.getRoot(), "evil.txt").exists()).isFalse();
  }

  @Test
  public void visitorFailureStopsExtraction() throws Exception {
    File zip = writeSimpleZip(temporaryFolder.newFile("simple.zip"));
    File dest = temporaryFolder.newFolder("dest");
    VisitorAbortException abort = new VisitorAbortException("stop");
    EntryVisitor visitor = mock(EntryVisitor.class);
    doNothing().doNothing().doThrow(abort).when(visitor).visit(anyString(), any());

    try (ZipFile zf = new ZipFile(zip)) {
      TransferEngine.extractAll(zf, dest, visitor, ImmutableSet.of());
      fail();
    } catch (VisitorAbortException e) {
      assertSame(abort, e);
    }

    verify(visitor, times(3)).visit(anyString(), any());
    assertThat(new File(dest, "a.txt").isFile()).isTrue();
    assertThat(new File(dest, "sub").isDirectory()).isTrue();
    assertThat(new File(dest, "sub/b.txt").exists()).isFalse();
  }

  @Test
  public void extractEntryPreservesModificationTime() throws Exception {
    long time = 1_600_000_000_000L;
    File zip = temporaryFolder.newFile("timed.zip");
    try (ZipOutputStream zos = new ZipOutputStream(new FileOutputStream(zip))) {
      ZipEntry entry = new ZipEntry("f");
      entry.setTime(time);
      zos.putNextEntry(entry);
      zos.write(new byte[] {1, 2, 3});
      zos.closeEntry();
    }

    File dest = new File(temporaryFolder.getRoot(), "deep/down/f");
    try (ZipFile zf = new ZipFile(zip)) {
      TransferEngine.extractEntry(zf, zf.getEntry("f"), dest);
    }

    assertThat(dest.length()).isEqualTo(3);
    assertThat(dest.lastModified()).isEqualTo(time);
  }

  @Test
  public void packTreeIncludingRootDirectoryPrefixesNames() throws Exception {
    File out = makeSimpleTree();
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    TransferEngine.packTree(
        out, bytes, EntryVisitors.none(), true, Predicates.alwaysFalse());

    File zip = temporaryFolder.newFile("x.zip");
    Files.write(bytes.toByteArray(), zip);
    assertThat(memberNames(zip)).containsExactly("out/", "out/a.txt", "out/sub/", "out/sub/b.txt");
    assertThat(readZip(zip)).containsEntry("out/a.txt", "hello");
    assertThat(readZip(zip)).containsEntry("out/sub/b.txt", "world");
  }

  @Test
  public void packTreeWithoutRootDirectoryFlattens() throws Exception {
    File out = makeSimpleTree();
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    TransferEngine.packTree(
        out, bytes, EntryVisitors.none(), false, Predicates.alwaysFalse());

    File zip = temporaryFolder.newFile("x.zip");
    Files.write(bytes.toByteArray(), zip);
    assertThat(memberNames(zip)).containsExactly("a.txt", "sub/", "sub/b.txt");
  }

  @Test
  public void packTreeOfSingleFileStoresItAtRoot() throws Exception {
    File file = write(new File(temporaryFolder.getRoot(), "dir/single.txt"), "alone");
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    TransferEngine.packTree(
        file, bytes, EntryVisitors.none(), true, Predicates.alwaysFalse());

    File zip = temporaryFolder.newFile("x.zip");
    Files.write(bytes.toByteArray(), zip);
    assertThat(readZip(zip)).containsExactly("single.txt", "alone");
  }

  @Test
  public void packTreeOfMissingSourceFails() throws Exception {
    try {
      TransferEngine.packTree(
          new File(temporaryFolder.getRoot(), "nope"),
          new ByteArrayOutputStream(),
          EntryVisitors.none(),
          false,
          Predicates.alwaysFalse());
      fail();
    } catch (IOException e) {
      // Expected.
    }
  }

  @Test
  public void directoriesArePackedWithTrailingSlashAndNoContent() throws Exception {
    File out = makeSimpleTree();
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    TransferEngine.packTree(
        out, bytes, EntryVisitors.none(), false, Predicates.alwaysFalse());

    File zip = temporaryFolder.newFile("x.zip");
    Files.write(bytes.toByteArray(), zip);
    try (ZipFile zf = new ZipFile(zip)) {
      ZipEntry sub = zf.getEntry("sub/");
      assertThat(sub).isNotNull();
      assertThat(sub.isDirectory()).isTrue();
      assertThat(sub.getSize()).isEqualTo(0);

      ZipEntry a = zf.getEntry("a.txt");
      assertThat(a.getSize()).isEqualTo(5);
    }
  }

  @Test
  public void packDirectorySkipsExcludedNames() throws Exception {
    File out = makeSimpleTree();
    write(new File(out, ".git/HEAD"), "ref: refs/heads/main");
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    TransferEngine.packTree(
        out, bytes, EntryVisitors.none(), false, Predicates.equalTo(".git"));

    File zip = temporaryFolder.newFile("x.zip");
    Files.write(bytes.toByteArray(), zip);
    assertThat(memberNames(zip)).containsExactly("a.txt", "sub/", "sub/b.txt");
  }

  @Test
  public void packVisitorReceivesSourcePaths() throws Exception {
    File out = makeSimpleTree();
    List<String> visited = new ArrayList<>();

    TransferEngine.packTree(
        out,
        new ByteArrayOutputStream(),
        (name, metadata) -> visited.add(name),
        false,
        Predicates.alwaysFalse());

    String root = EntryNames.normalize(out.getPath());
    assertThat(visited).containsExactly(root + "/a.txt", root + "/sub", root + "/sub/b.txt");
  }

  @Test
  public void visitorFailureStopsPacking() throws Exception {
    File dir = temporaryFolder.newFolder("many");
    for (int i = 0; i < 5; i++) {
      write(new File(dir, "file" + i), "content " + i);
    }

    VisitorAbortException abort = new VisitorAbortException("stop");
    EntryVisitor visitor = mock(EntryVisitor.class);
    doNothing().doNothing().doThrow(abort).when(visitor).visit(anyString(), any());

    try {
      TransferEngine.packTree(
          dir, new ByteArrayOutputStream(), visitor, false, Predicates.alwaysFalse());
      fail();
    } catch (VisitorAbortException e) {
      assertSame(abort, e);
    }

    verify(visitor, times(3)).visit(anyString(), any());
  }

  @Test
  public void packFileRejectsSizeMismatch() throws Exception {
    File file = write(new File(temporaryFolder.getRoot(), "five"), "12345");

    try (ZipOutputStream zos = new ZipOutputStream(new ByteArrayOutputStream())) {
      try {
        TransferEngine.packFile(file, "five", zos, EntryMetadata.create(false, 3));
        fail();
      } catch (ZipException e) {
        assertThat(e).hasMessageThat().contains("declares 3 bytes but 5");
      }
    } catch (ZipException e) {
      // Closing the stream with a broken entry may also fail.
    }
  }

  @Test
  public void packFileKeepsModificationTime() throws Exception {
    long time = 1_500_000_000_000L;
    File file = write(new File(temporaryFolder.getRoot(), "timed"), "tick");
    assertThat(file.setLastModified(time)).isTrue();

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ZipOutputStream zos = new ZipOutputStream(bytes)) {
      TransferEngine.packFile(file, "timed", zos, EntryMetadata.of(file));
    }

    File zip = temporaryFolder.newFile("x.zip");
    Files.write(bytes.toByteArray(), zip);
    try (ZipFile zf = new ZipFile(zip)) {
      assertThat(zf.getEntry("timed").getTime()).isEqualTo(time);
    }
  }
}
