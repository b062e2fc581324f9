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
package net.starlark.skytest.runner;

import static com.google.common.truth.Truth.assertThat;
import static net.starlark.skytest.testing.FakeStarlarkEngine.callMember;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import net.starlark.skytest.engine.BuiltinFunction;
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.engine.ExecutionContext;
import net.starlark.skytest.engine.Starlark;
import net.starlark.skytest.engine.StarlarkStruct;
import net.starlark.skytest.snapshot.SnapshotManager;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the built-in {@code assert} module. */
@RunWith(JUnit4.class)
public final class AssertModuleTest {

  private final StarlarkStruct assertModule = AssertModule.create();
  private final ExecutionContext context = new ExecutionContext("test");

  private Object call(String fn, Object... args) throws Exception {
    return callMember(context, assertModule, fn, args);
  }

  private String failure(String fn, Object... args) {
    return assertThrows(EvalException.class, () -> call(fn, args)).getMessage();
  }

  @Test
  public void passingAssertionsReturnNone() throws Exception {
    assertThat(call("eq", 1, 1L)).isEqualTo(Starlark.NONE);
    call("ne", 1, 2);
    call("true", "x");
    call("false", ImmutableList.of());
    call("contains", ImmutableList.of(1, 2), 2);
    call("contains", "haystack", "st");
    call("lt", 1, 2);
    call("le", 2, 2);
    call("gt", "b", "a");
    call("ge", 2.5, 2);
    call("len", ImmutableMap.of("a", 1), 1);
    call("empty", "");
    call("not_empty", ImmutableList.of(0));
  }

  @Test
  public void failureMessages() {
    assertThat(failure("eq", 1, 2)).isEqualTo("assertion failed: expected 1 == 2");
    assertThat(failure("ne", "a", "a")).isEqualTo("assertion failed: expected \"a\" != \"a\"");
    assertThat(failure("true", 0)).isEqualTo("assertion failed: expected 0 to be true");
    assertThat(failure("false", 1)).isEqualTo("assertion failed: expected 1 to be false");
    assertThat(failure("contains", ImmutableList.of(1), 3))
        .isEqualTo("assertion failed: expected [1] to contain 3");
    assertThat(failure("lt", 2, 1)).isEqualTo("assertion failed: expected 2 < 1");
    assertThat(failure("len", ImmutableList.of(1, 2), 3))
        .isEqualTo("assertion failed: expected len(list) == 3, got 2");
    assertThat(failure("empty", ImmutableList.of(1)))
        .isEqualTo("assertion failed: expected list to be empty, got length 1");
    assertThat(failure("not_empty", ""))
        .isEqualTo("assertion failed: expected string to not be empty");
  }

  @Test
  public void customMessageReplacesDetail() {
    assertThat(failure("eq", 1, 2, "totals differ")).isEqualTo("assertion failed: totals differ");
  }

  @Test
  public void typeErrors() {
    assertThat(failure("len", 5, 1)).isEqualTo("assert.len: type int has no len()");
    assertThat(failure("contains", 5, 1))
        .isEqualTo("assert.contains: unsupported container type int");
    assertThat(failure("lt", 1, "a")).contains("unsupported comparison");
  }

  @Test
  public void fails() throws Exception {
    BuiltinFunction boom =
        BuiltinFunction.of(
            "boom",
            (ctx, args) -> {
              throw new EvalException("division by zero");
            });
    BuiltinFunction ok = BuiltinFunction.of("ok", (ctx, args) -> Starlark.NONE);

    call("fails", boom);
    call("fails", boom, "division");
    assertThat(failure("fails", boom, "overflow"))
        .isEqualTo(
            "assert.fails: error \"division by zero\" does not match pattern \"overflow\"");
    assertThat(failure("fails", ok))
        .isEqualTo("assert.fails: expected function to fail, but it succeeded");
    assertThat(failure("fails", 3)).isEqualTo("assert.fails: expected callable, got int");
  }

  @Test
  public void snapshotUsesContextManager() throws Exception {
    assertThat(failure("snapshot", 1, "n")).contains("no snapshot manager");

    try (FileSystem fs = Jimfs.newFileSystem(Configuration.unix())) {
      SnapshotManager manager = new SnapshotManager(fs, false);
      manager.setContext("/t/a_test.star", "test_x");
      context.setThreadLocal(SnapshotManager.class, manager);

      call("snapshot", ImmutableList.of(1), "v");

      assertThat(Files.exists(fs.getPath("/t/__snapshots__/a_test/test_x__v.snap"))).isTrue();
    }
  }
}
