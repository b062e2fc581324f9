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
package net.starlark.skytest.exec;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import javax.annotation.Nullable;
import net.starlark.skytest.coverage.CoverageCollector;
import net.starlark.skytest.coverage.CoverageReport;
import net.starlark.skytest.discovery.NoTestFilesFoundException;
import net.starlark.skytest.discovery.TestDiscovery;
import net.starlark.skytest.discovery.TestDiscovery.Selection;
import net.starlark.skytest.engine.StarlarkEngine;
import net.starlark.skytest.report.Reporter;
import net.starlark.skytest.runner.FileResult;
import net.starlark.skytest.runner.RunResult;
import net.starlark.skytest.runner.TestFileException;
import net.starlark.skytest.runner.TestOptions;
import net.starlark.skytest.runner.TestRunner;

/**
 * One invocation of the test tool: expands the path arguments, runs the files sequentially or on
 * a worker pool, and reports.
 */
public final class TestSession {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final int EXIT_SUCCESS = 0;
  public static final int EXIT_TESTS_FAILED = 1;
  public static final int EXIT_ERROR = 2;

  private final StarlarkEngine engine;
  private final TestOptions options;
  private final TestDiscovery discovery;
  private final Reporter reporter;
  private final int workers;
  private final PrintWriter out;
  private final PrintWriter err;
  @Nullable private final CoverageCollector coverage;

  public TestSession(
      StarlarkEngine engine,
      TestOptions options,
      TestDiscovery discovery,
      Reporter reporter,
      int workers,
      PrintWriter out,
      PrintWriter err) {
    Preconditions.checkArgument(workers > 0, "workers must be positive: %s", workers);
    this.engine = Preconditions.checkNotNull(engine);
    this.options = Preconditions.checkNotNull(options);
    this.discovery = discovery;
    this.reporter = reporter;
    this.workers = workers;
    this.out = out;
    this.err = err;
    this.coverage = options.coverage() ? new CoverageCollector() : null;
  }

  public TestDiscovery getDiscovery() {
    return discovery;
  }

  /** Returns the coverage of every file run by this session, or null if coverage is off. */
  @Nullable
  public CoverageReport getCoverageReport() {
    return coverage == null ? null : coverage.report();
  }

  /**
   * Runs the tests named by {@code args}: files, directories, globs and {@code file::test}
   * selectors.
   *
   * @return the process exit code
   */
  public int run(List<String> args) throws InterruptedException {
    Selection selection = TestDiscovery.parseSelectors(args);
    ImmutableList<Path> files;
    try {
      files = discovery.expandPaths(selection.paths());
    } catch (NoTestFilesFoundException | IOException e) {
      err.println("error: " + e.getMessage());
      err.flush();
      return EXIT_ERROR;
    }
    return execute(files, selection);
  }

  /** Runs and reports {@code files}, returning the process exit code. */
  public int execute(List<Path> files, Selection selection) throws InterruptedException {
    RunResult result;
    try {
      result = runFiles(files, selection);
    } catch (TestFileException e) {
      err.println("error: " + e.getMessage());
      err.flush();
      return EXIT_ERROR;
    }
    reporter.reportSummary(out, result);
    out.flush();
    return result.hasFailures() ? EXIT_TESTS_FAILED : EXIT_SUCCESS;
  }

  /** Runs {@code files} without printing the summary. */
  public RunResult runFiles(List<Path> files, Selection selection)
      throws TestFileException, InterruptedException {
    RunExecutor executor =
        workers > 1 && files.size() > 1
            ? new ParallelExecutor(workers, reporter, out, options.failFast())
            : new SequentialExecutor(reporter, out, options.failFast());
    logger.atFine().log("Running %d files with %s", files.size(), executor.getClass().getName());
    return executor.execute(files, file -> runFile(file, selection));
  }

  private FileResult runFile(Path file, Selection selection)
      throws TestFileException, InterruptedException {
    byte[] source;
    try {
      source = Files.readAllBytes(file);
    } catch (IOException e) {
      throw new TestFileException(
          file.toString(), String.format("reading %s: %s", file, e.getMessage()), e);
    }
    TestOptions fileOptions = options;
    ImmutableList<String> selected = selection.testNamesFor(file);
    if (!selected.isEmpty()) {
      fileOptions = options.toBuilder().setTestNames(selected).build();
    }
    TestRunner runner = new TestRunner(engine, fileOptions, coverage, file.getFileSystem());
    return runner.runFile(file.toString(), source);
  }
}
