// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.starlark.skytest.watch;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class WatcherTest {

  private final List<WatchEvent> events = new ArrayList<>();
  private final List<WatchException> errors = new ArrayList<>();
  private FileSystem fs;
  private Watcher watcher;

  @Before
  public void setUp() throws Exception {
    fs = Jimfs.newFileSystem(Configuration.unix());
    Files.createDirectories(fs.getPath("/w/lib"));
    watcher =
        new Watcher(
            fs,
            new Watcher.Listener() {
              @Override
              public void onChange(WatchEvent event) {
                events.add(event);
              }

              @Override
              public void onError(WatchException error) {
                errors.add(error);
              }
            });
  }

  @After
  public void tearDown() throws Exception {
    watcher.close();
    fs.close();
  }

  private Path write(String name, String... lines) throws Exception {
    Path path = fs.getPath(name);
    Files.write(path, (Joiner.on('\n').join(lines) + "\n").getBytes(UTF_8));
    return path;
  }

  @Test
  public void transitiveDependencies() throws Exception {
    Path a = write("/w/a_test.star", "load(\"lib/b.star\", \"b\")", "def test_a(): pass");
    Path b = write("/w/lib/b.star", "load(\"c.star\", \"c\")", "b = c");
    Path c = write("/w/lib/c.star", "c = 1");

    watcher.add(a);

    assertThat(watcher.watchedFiles()).containsExactly(a, b, c);
    assertThat(watcher.loadsOf(a)).containsExactly(b);
    assertThat(watcher.loadsOf(b)).containsExactly(c);
    assertThat(watcher.affectedTestFiles(c)).containsExactly(a);
    assertThat(watcher.affectedTestFiles(a)).containsExactly(a);
    assertThat(errors).isEmpty();
  }

  @Test
  public void sharedDependencyAffectsEveryTestSorted() throws Exception {
    write("/w/lib/b.star", "b = 1");
    Path z = write("/w/z_test.star", "load(\"lib/b.star\", \"b\")");
    Path a = write("/w/a_test.star", "load(\"./lib/b.star\", \"b\")");

    watcher.add(z);
    watcher.add(a);

    assertThat(watcher.affectedTestFiles(fs.getPath("/w/lib/b.star")))
        .containsExactly(a, z)
        .inOrder();

    watcher.remove(z);

    assertThat(watcher.affectedTestFiles(fs.getPath("/w/lib/b.star"))).containsExactly(a);
    assertThat(watcher.affectedTestFiles(z)).isEmpty();
  }

  @Test
  public void labelsAndMissingFilesAreNotDependencies() throws Exception {
    Path a =
        write(
            "/w/a_test.star",
            "load(\"//pkg:defs.star\", \"x\")",
            "load(\"@repo//:y.star\", \"y\")",
            "load(\"missing.star\", \"z\")");

    watcher.add(a);

    assertThat(watcher.loadsOf(a)).isEmpty();
    assertThat(watcher.watchedFiles()).containsExactly(a);
  }

  @Test
  public void cyclicLoadsTerminate() throws Exception {
    Path a = write("/w/a_test.star", "load(\"lib/b.star\", \"b\")");
    Path b = write("/w/lib/b.star", "load(\"c.star\", \"c\")");
    Path c = write("/w/lib/c.star", "load(\"b.star\", \"b\")");

    watcher.add(a);

    assertThat(watcher.watchedFiles()).containsExactly(a, b, c);
    assertThat(watcher.affectedTestFiles(b)).containsExactly(a);
  }

  @Test
  public void refreshDropsStaleEdges() throws Exception {
    Path a = write("/w/a_test.star", "load(\"lib/b.star\", \"b\")");
    Path b = write("/w/lib/b.star", "b = 1");
    Path c = write("/w/lib/c.star", "c = 1");
    watcher.add(a);

    write("/w/a_test.star", "load(\"lib/c.star\", \"c\")");
    watcher.refreshDependencies(a);

    assertThat(watcher.affectedTestFiles(b)).isEmpty();
    assertThat(watcher.affectedTestFiles(c)).containsExactly(a);
    assertThat(watcher.loadsOf(a)).containsExactly(c);
  }

  @Test
  public void refreshIgnoresNonTestFiles() throws Exception {
    Path a = write("/w/a_test.star", "load(\"lib/b.star\", \"b\")");
    Path b = write("/w/lib/b.star", "b = 1");
    watcher.add(a);

    watcher.refreshDependencies(b);

    assertThat(watcher.affectedTestFiles(b)).containsExactly(a);
  }

  @Test
  public void unreadableDependencyIsReported() throws Exception {
    Path a = write("/w/a_test.star", "load(\"bad.star\", \"x\")");
    write("/w/bad.star", "x = 'oops");

    watcher.add(a);

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0)).hasMessageThat().startsWith("reading dependencies of /w/bad.star");
    assertThat(watcher.affectedTestFiles(fs.getPath("/w/bad.star"))).containsExactly(a);
  }

  @Test
  public void handleChange() throws Exception {
    Path a = write("/w/a_test.star", "load(\"lib/b.star\", \"b\")");
    Path b = write("/w/lib/b.star", "b = 1");
    Path other = write("/w/lib/other.star", "o = 1");
    watcher.add(a);

    WatchEvent event = watcher.handleChange(b);

    assertThat(event.file()).isEqualTo(b);
    assertThat(event.affectedTests()).containsExactly(a);
    assertThat(watcher.handleChange(other)).isNull();
  }
}
