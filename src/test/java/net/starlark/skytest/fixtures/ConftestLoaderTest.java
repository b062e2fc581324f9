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
package net.starlark.skytest.fixtures;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.starlark.skytest.engine.ExecutionContext;
import net.starlark.skytest.fixtures.ConftestLoader.ConftestException;
import net.starlark.skytest.testing.FakeStarlarkEngine;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ConftestLoaderTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private Path repo;
  private Path testFile;

  @Before
  public void setUp() throws IOException {
    Path root = tmp.getRoot().toPath();
    repo = root.resolve("repo");
    Files.createDirectories(repo.resolve(".git"));
    Files.createDirectories(repo.resolve("sub"));
    write(root.resolve(ConftestLoader.CONFTEST_FILE), "");
    write(repo.resolve(ConftestLoader.CONFTEST_FILE), "");
    write(repo.resolve("sub").resolve(ConftestLoader.CONFTEST_FILE), "");
    testFile = repo.resolve("sub").resolve("x_test.star");
    write(testFile, "");
  }

  private static void write(Path path, String content) throws IOException {
    Files.write(path, content.getBytes(UTF_8));
  }

  @Test
  public void findConftestFiles_stopsAtCheckoutRootOutermostFirst() {
    assertThat(ConftestLoader.findConftestFiles(testFile))
        .containsExactly(
            repo.resolve(ConftestLoader.CONFTEST_FILE),
            repo.resolve("sub").resolve(ConftestLoader.CONFTEST_FILE))
        .inOrder();
  }

  @Test
  public void load_nearerDefinitionsWin() throws Exception {
    FakeStarlarkEngine engine =
        new FakeStarlarkEngine()
            .define(
                "repo/conftest.star",
                m ->
                    m.def("fixture_value", (ctx, args) -> "outer")
                        .def("fixture_outer_only", (ctx, args) -> "outer only"))
            .define("sub/conftest.star", m -> m.def("fixture_value", (ctx, args) -> "inner"));

    FixtureRegistry registry =
        new ConftestLoader(engine).load(testFile, ImmutableMap.of());

    ExecutionContext context = new ExecutionContext("t");
    assertThat(registry.getFixtureNames()).containsExactly("value", "outer_only");
    assertThat(registry.getOrCompute(engine, context, "value")).isEqualTo("inner");
    assertThat(registry.getOrCompute(engine, context, "outer_only")).isEqualTo("outer only");
  }

  @Test
  public void load_executionFailure() throws IOException {
    Path conftest = repo.resolve("sub").resolve(ConftestLoader.CONFTEST_FILE);
    write(conftest, "!syntax");

    ConftestException e =
        assertThrows(
            ConftestException.class,
            () -> new ConftestLoader(new FakeStarlarkEngine()).load(testFile, ImmutableMap.of()));
    assertThat(e.getPath()).isEqualTo(conftest);
    assertThat(e).hasMessageThat().startsWith("executing conftest " + conftest + ": ");
  }
}
