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

import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import net.starlark.skytest.discovery.TestDiscovery;
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.engine.Starlark;
import net.starlark.skytest.exec.TestSession;
import net.starlark.skytest.report.TextReporter;
import net.starlark.skytest.runner.TestOptions;
import net.starlark.skytest.testing.FakeStarlarkEngine;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests of {@link WatchLoop}. Signals are queued before {@link WatchLoop#run} so that each test
 * is independent of file system event timing.
 */
@RunWith(JUnit4.class)
public final class WatchLoopTest {

  private final FakeStarlarkEngine engine = new FakeStarlarkEngine();
  private final StringWriter buffer = new StringWriter();
  private final PrintWriter out = new PrintWriter(buffer);
  private FileSystem fs;
  private Path a;
  private Path b;

  @Before
  public void setUp() throws Exception {
    fs = Jimfs.newFileSystem(Configuration.unix());
    Files.createDirectories(fs.getPath("/w"));
    a = Files.write(fs.getPath("/w/a_test.star"), new byte[0]);
    b = Files.write(fs.getPath("/w/b_test.star"), new byte[0]);
    engine.define("a_test.star", m -> m.def("test_a", (ctx, args) -> Starlark.NONE));
    engine.define("b_test.star", m -> m.def("test_b", (ctx, args) -> Starlark.NONE));
  }

  @After
  public void tearDown() throws Exception {
    fs.close();
  }

  private WatchLoop newLoop(boolean affectedOnly) {
    TestSession session =
        new TestSession(
            engine,
            TestOptions.defaults(),
            new TestDiscovery(fs, TestDiscovery.DEFAULT_PATTERNS, /* recursive= */ true),
            new TextReporter(false, false),
            1,
            out,
            out);
    return new WatchLoop(session, fs, affectedOnly, out);
  }

  @Test
  public void runsOnceAndStops() throws Exception {
    WatchLoop loop = newLoop(false);
    loop.stop();

    int code = loop.run(ImmutableList.of("/w"));

    assertThat(code).isEqualTo(TestSession.EXIT_SUCCESS);
    assertThat(buffer.toString())
        .isEqualTo(
            "PASS  test_a\nPASS  test_b\n\n"
                + "Results: 2 passed, 0 failed, 0 skipped, 2 total in 2 file(s)\n"
                + "\nWatching for changes...\n");
  }

  @Test
  public void rerunsAffectedTestsOnChange() throws Exception {
    WatchLoop loop = newLoop(true);
    engine.define(
        "b_test.star",
        m ->
            m.def(
                "test_b",
                (ctx, args) -> {
                  throw new EvalException("broken");
                }));
    loop.onChange(WatchEvent.create(b, ImmutableList.of(b)));
    loop.stop();

    int code = loop.run(ImmutableList.of("/w"));

    assertThat(code).isEqualTo(TestSession.EXIT_TESTS_FAILED);
    String output = buffer.toString();
    String rerun = output.substring(output.indexOf("Change detected: /w/b_test.star\n"));
    assertThat(rerun).contains("FAIL  test_b");
    assertThat(rerun).doesNotContain("test_a");
    assertThat(rerun).contains("Results: 0 passed, 1 failed");
  }

  @Test
  public void rerunsAllTestsWhenNotAffectedOnly() throws Exception {
    WatchLoop loop = newLoop(false);
    loop.onChange(WatchEvent.create(b, ImmutableList.of(b)));
    loop.stop();

    loop.run(ImmutableList.of("/w"));

    String output = buffer.toString();
    String rerun = output.substring(output.indexOf("Change detected:"));
    assertThat(rerun).contains("PASS  test_a\nPASS  test_b\n");
  }

  @Test
  public void changeWithNoAffectedTests() throws Exception {
    WatchLoop loop = newLoop(true);
    loop.onChange(WatchEvent.create(fs.getPath("/w/lib.star"), ImmutableList.of()));
    loop.stop();

    int code = loop.run(ImmutableList.of("/w/a_test.star"));

    assertThat(code).isEqualTo(TestSession.EXIT_SUCCESS);
    assertThat(buffer.toString())
        .endsWith("Change detected: /w/lib.star\nNo affected tests to run.\n");
  }

  @Test
  public void errorsArePrinted() throws Exception {
    WatchLoop loop = newLoop(false);
    loop.onError(new WatchException("file system events were lost", null));
    loop.stop();

    loop.run(ImmutableList.of("/w"));

    assertThat(buffer.toString()).endsWith("watch error: file system events were lost\n");
  }

  @Test
  public void noTestFiles() throws Exception {
    Files.createDirectories(fs.getPath("/empty"));

    int code = newLoop(false).run(ImmutableList.of("/empty"));

    assertThat(code).isEqualTo(TestSession.EXIT_ERROR);
    assertThat(buffer.toString()).startsWith("error: ");
  }
}
