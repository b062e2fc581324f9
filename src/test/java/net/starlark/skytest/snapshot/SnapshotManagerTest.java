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
package net.starlark.skytest.snapshot;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static net.starlark.skytest.testing.FakeStarlarkEngine.callMember;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.engine.ExecutionContext;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SnapshotManagerTest {

  private FileSystem fs;

  @Before
  public void setUp() throws IOException {
    fs = Jimfs.newFileSystem(Configuration.unix());
    Files.createDirectories(fs.getPath("/work"));
  }

  @After
  public void tearDown() throws IOException {
    fs.close();
  }

  private SnapshotManager manager(boolean updateMode) {
    SnapshotManager manager = new SnapshotManager(fs, updateMode);
    manager.setContext("/work/api_test.star", "test_render");
    return manager;
  }

  private String read(Path path) throws IOException {
    return new String(Files.readAllBytes(path), UTF_8);
  }

  @Test
  public void snapshotPath_sanitizesName() {
    assertThat(manager(false).snapshotPath("out/put:1").toString())
        .isEqualTo("/work/__snapshots__/api_test/test_render__out_put_1.snap");
  }

  @Test
  public void snapshotPath_sanitizesParametrizedTestName() throws Exception {
    SnapshotManager manager = new SnapshotManager(fs, false);
    manager.setContext("/work/api_test.star", "test_r[a/../../evil]");

    Path path = manager.snapshotPath("out");
    assertThat(path.toString())
        .isEqualTo("/work/__snapshots__/api_test/test_r[a_.._.._evil]__out.snap");

    manager.compare(1, "out");
    assertThat(Files.exists(path)).isTrue();
    assertThat(path.getParent().toString()).isEqualTo("/work/__snapshots__/api_test");
  }

  @Test
  public void firstCompareCreates_secondMatches() throws Exception {
    SnapshotManager manager = manager(false);
    manager.compare(ImmutableList.of(1, 2), "list");
    Path path = manager.snapshotPath("list");
    assertThat(read(path)).isEqualTo("[\n  1,\n  2,\n]");
    assertThat(manager.created()).containsExactly("list");

    manager.compare(ImmutableList.of(1, 2), "list");
    assertThat(read(path)).isEqualTo("[\n  1,\n  2,\n]");
    assertThat(manager.mismatches()).isEmpty();
  }

  @Test
  public void changedValue_failsAndLeavesFileUntouched() throws Exception {
    manager(false).compare("old", "s");
    SnapshotManager manager = manager(false);

    SnapshotMismatchException e =
        assertThrows(SnapshotMismatchException.class, () -> manager.compare("new", "s"));

    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "snapshot \"s\" does not match:\n"
                + "--- Expected\n+++ Actual\n@@ -1 +1 @@\n-\"old\"\n+\"new\"\n");
    assertThat(e).isInstanceOf(EvalException.class);
    assertThat(read(manager.snapshotPath("s"))).isEqualTo("\"old\"");
    assertThat(manager.mismatches()).hasSize(1);
    assertThat(manager.mismatches().get(0).actual()).isEqualTo("\"new\"");
  }

  @Test
  public void updateMode_rewrites() throws Exception {
    manager(false).compare("old", "s");
    SnapshotManager manager = manager(true);

    manager.compare("new", "s");

    assertThat(read(manager.snapshotPath("s"))).isEqualTo("\"new\"");
    assertThat(manager.updated()).containsExactly("s");
  }

  @Test
  public void module_compare() throws Exception {
    SnapshotManager manager = manager(false);
    Object module = SnapshotModule.create(manager);
    ExecutionContext context = new ExecutionContext("t");

    callMember(context, module, "compare", 7, "seven");
    assertThat(manager.created()).containsExactly("seven");

    EvalException e =
        assertThrows(EvalException.class, () -> callMember(context, module, "compare", 7, 8));
    assertThat(e).hasMessageThat().contains("name must be a string, got int");
  }
}
