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

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import net.starlark.skytest.coverage.CoverageCollector;
import net.starlark.skytest.coverage.CoverageReport;
import net.starlark.skytest.engine.BuiltinFunction;
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.engine.ExecutionContext;
import net.starlark.skytest.engine.Namespace;
import net.starlark.skytest.engine.StarlarkCallable;
import net.starlark.skytest.engine.StarlarkEngine;
import net.starlark.skytest.engine.StarlarkStruct;
import net.starlark.skytest.engine.SyntaxException;
import net.starlark.skytest.fixtures.ConftestLoader;
import net.starlark.skytest.fixtures.ConftestLoader.ConftestException;
import net.starlark.skytest.fixtures.FixtureException;
import net.starlark.skytest.fixtures.FixtureRegistry;
import net.starlark.skytest.mock.MockManager;
import net.starlark.skytest.mock.MockModule;
import net.starlark.skytest.snapshot.SnapshotManager;
import net.starlark.skytest.snapshot.SnapshotModule;

/**
 * Runs the tests of Starlark files.
 *
 * <p>For each file the runner executes the preludes and the shared fixture files, executes the
 * file once, and then runs every selected test function (or every case of a parametrized test) on
 * a fresh {@link ExecutionContext}:
 *
 * <ol>
 *   <li>tests excluded by the marker or name filters produce no result;
 *   <li>tests marked {@code skip} produce a skipped result without running;
 *   <li>otherwise {@code setup}, the test body with its fixtures, and {@code teardown} run under
 *       the per-test timeout, and {@code xfail} inverts the outcome.
 * </ol>
 *
 * <p>A runner owns the snapshot and mock state of its tests and is not meant to run files
 * concurrently; the parallel executor uses one runner per file.
 */
public final class TestRunner {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final String SETUP = "setup";
  static final String TEARDOWN = "teardown";
  static final String SETUP_FILE = "setup_file";
  static final String TEARDOWN_FILE = "teardown_file";

  @SuppressWarnings("unchecked")
  private static final BuiltinFunction STRUCT =
      BuiltinFunction.of(
          "struct",
          (ctx, args) -> StarlarkStruct.create((Map<String, Object>) args[0]),
          "**kwargs");

  private final StarlarkEngine engine;
  private final TestOptions options;
  private final TestFilter filter;
  @Nullable private final CoverageCollector coverage;
  private final FileSystem fileSystem;
  private final SnapshotManager snapshots;
  private final MockManager mocks = new MockManager();
  private final ConftestLoader conftestLoader;

  public TestRunner(StarlarkEngine engine, TestOptions options) {
    this(engine, options, null);
  }

  /**
   * Creates a runner. If coverage is enabled and {@code coverage} is null, the runner collects
   * into a collector of its own.
   */
  public TestRunner(
      StarlarkEngine engine, TestOptions options, @Nullable CoverageCollector coverage) {
    this(engine, options, coverage, FileSystems.getDefault());
  }

  /** Creates a runner whose test files and snapshots live on {@code fileSystem}. */
  public TestRunner(
      StarlarkEngine engine,
      TestOptions options,
      @Nullable CoverageCollector coverage,
      FileSystem fileSystem) {
    this.engine = Preconditions.checkNotNull(engine);
    this.options = Preconditions.checkNotNull(options);
    this.filter = new TestFilter(options);
    this.fileSystem = fileSystem;
    if (options.coverage()) {
      this.coverage = coverage != null ? coverage : new CoverageCollector();
    } else {
      this.coverage = null;
    }
    this.snapshots = new SnapshotManager(fileSystem, options.updateSnapshots());
    this.conftestLoader = new ConftestLoader(engine);
  }

  public TestOptions getOptions() {
    return options;
  }

  public SnapshotManager getSnapshotManager() {
    return snapshots;
  }

  public MockManager getMockManager() {
    return mocks;
  }

  /** Returns the coverage collected so far, or null if coverage is disabled. */
  @Nullable
  public CoverageReport getCoverageReport() {
    return coverage == null ? null : coverage.report();
  }

  /** The functions of a test file that the runner calls around its tests. */
  private static final class Hooks {
    @Nullable final StarlarkCallable setup;
    @Nullable final StarlarkCallable teardown;

    Hooks(Namespace globals) {
      this.setup = globals.getCallable(SETUP);
      this.teardown = globals.getCallable(TEARDOWN);
    }
  }

  /**
   * Runs all selected tests in a file.
   *
   * @param filename the path of the file, used to locate shared fixtures and snapshots
   * @param source the contents of the file
   * @throws TestFileException if the file, a prelude or a shared fixture file cannot be executed
   */
  public FileResult runFile(String filename, byte[] source)
      throws TestFileException, InterruptedException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    ImmutableMap<String, Object> predeclared = loadPreludes(filename, basePredeclared());

    FixtureRegistry shared;
    try {
      shared = conftestLoader.load(fileSystem.getPath(filename), predeclared);
    } catch (ConftestException e) {
      throw new TestFileException(filename, e.getMessage(), e);
    }

    Namespace globals;
    try {
      globals = engine.execFile(newContext(filename), filename, source, predeclared);
    } catch (SyntaxException | EvalException e) {
      throw new TestFileException(
          filename, String.format("executing %s: %s", filename, e.getMessage()), e);
    }

    FixtureRegistry fixtures =
        FixtureRegistry.merge(ImmutableList.of(shared, FixtureRegistry.fromNamespace(globals)));
    fixtures.registerBuiltin("mock", MockModule.create(mocks));
    fixtures.registerBuiltin("snapshot", SnapshotModule.create(snapshots));

    ImmutableList<String> tests = findTests(globals);
    ImmutableMap<String, TestMeta> meta = TestMeta.fromNamespace(globals);
    ImmutableMap<String, ImmutableList<ParamCase>> params = ParamCase.fromNamespace(globals);
    Hooks hooks = new Hooks(globals);
    logger.atFine().log("Running %d tests in %s", tests.size(), filename);

    FileResult.Builder result = FileResult.builder(filename);
    ScheduledExecutorService timer = options.timeout().isZero() ? null : newTimer();
    try {
      StarlarkCallable setupFile = globals.getCallable(SETUP_FILE);
      if (setupFile != null) {
        try {
          engine.call(newContext(SETUP_FILE), setupFile, ImmutableList.of(), ImmutableMap.of());
        } catch (EvalException e) {
          logger.atFine().withCause(e).log("setup_file failed in %s", filename);
          return result
              .setSetupError(new EvalException("setup_file failed: " + e.getMessage(), e))
              .setDuration(stopwatch.elapsed())
              .build();
        }
      }

      boolean stop = false;
      for (String name : tests) {
        if (stop) {
          break;
        }
        TestMeta testMeta = meta.getOrDefault(name, TestMeta.NONE);
        if (!filter.matchesMarkers(testMeta)) {
          continue;
        }
        StarlarkCallable fn = globals.getCallable(name);
        ImmutableList<ParamCase> cases = params.get(name);
        if (cases == null) {
          if (filter.matchesName(name)) {
            stop =
                record(
                    result,
                    runTest(filename, name, fn, null, testMeta, hooks, fixtures, timer));
          }
          continue;
        }
        for (ParamCase c : cases) {
          String displayName = c.displayName(name);
          if (!filter.matchesCase(name, displayName)) {
            continue;
          }
          stop =
              record(
                  result,
                  runTest(filename, displayName, fn, c, testMeta, hooks, fixtures, timer));
          if (stop) {
            break;
          }
        }
      }

      StarlarkCallable teardownFile = globals.getCallable(TEARDOWN_FILE);
      if (teardownFile != null) {
        try {
          engine.call(
              newContext(TEARDOWN_FILE), teardownFile, ImmutableList.of(), ImmutableMap.of());
        } catch (EvalException e) {
          logger.atWarning().withCause(e).log("teardown_file failed in %s", filename);
          result.setTeardownError(
              new EvalException("teardown_file failed: " + e.getMessage(), e));
        }
      }
    } finally {
      if (timer != null) {
        timer.shutdownNow();
      }
      fixtures.clearAll();
    }
    return result.setDuration(stopwatch.elapsed()).build();
  }

  /** Adds a result and reports whether fail-fast stops the file. */
  private boolean record(FileResult.Builder result, TestResult test) {
    result.addTest(test);
    return options.failFast() && test.failed();
  }

  private TestResult runTest(
      String filename,
      String name,
      StarlarkCallable fn,
      @Nullable ParamCase paramCase,
      TestMeta meta,
      Hooks hooks,
      FixtureRegistry fixtures,
      @Nullable ScheduledExecutorService timer)
      throws InterruptedException {
    if (meta.skip()) {
      return TestResult.skipped(name, filename, meta.skipReason());
    }

    Stopwatch stopwatch = Stopwatch.createStarted();
    StringBuilder output = new StringBuilder();
    ExecutionContext context = newContext(name);
    context.setPrintHandler(
        (ctx, msg) -> {
          synchronized (output) {
            output.append(msg).append('\n');
          }
        });
    snapshots.setContext(filename, name);
    context.setThreadLocal(SnapshotManager.class, snapshots);

    Duration timeout = options.timeout();
    ScheduledFuture<?> deadline =
        timer == null
            ? null
            : timer.schedule(
                () -> context.cancel("test timeout after " + timeout),
                timeout.toNanos(),
                TimeUnit.NANOSECONDS);
    Exception error;
    try {
      error = runBody(context, fn, paramCase, hooks, fixtures);
    } finally {
      if (deadline != null) {
        deadline.cancel(false);
      }
      fixtures.clearTestCache();
      mocks.reset();
    }

    TestResult.Builder result =
        TestResult.builder(name, filename)
            .setDuration(stopwatch.elapsed())
            .setStatus(error == null ? TestResult.Status.PASSED : TestResult.Status.FAILED)
            .setError(error)
            .setOutput(output.toString());
    if (meta.xfail()) {
      result.setXfail(true).setXfailReason(meta.xfailReason());
      if (error == null) {
        result.setStatus(TestResult.Status.FAILED).setXpass(true);
      } else {
        result.setStatus(TestResult.Status.PASSED).setError(null);
      }
    }
    TestResult built = result.build();
    logger.atFine().log("%s %s in %s", built.status(), name, built.duration());
    return built;
  }

  /** Runs setup, the test and teardown, and returns the error that decides the outcome. */
  @Nullable
  private Exception runBody(
      ExecutionContext context,
      StarlarkCallable fn,
      @Nullable ParamCase paramCase,
      Hooks hooks,
      FixtureRegistry fixtures)
      throws InterruptedException {
    if (hooks.setup != null) {
      try {
        engine.call(context, hooks.setup, ImmutableList.of(), ImmutableMap.of());
      } catch (EvalException e) {
        return new EvalException("setup failed: " + e.getMessage(), e);
      }
    }

    Exception error = null;
    try {
      List<Object> args = new ArrayList<>();
      if (paramCase != null) {
        args.add(paramCase.values());
      }
      args.addAll(fixtures.resolveArguments(engine, context, fn, args.size()));
      engine.call(context, fn, args, ImmutableMap.of());
    } catch (FixtureException | EvalException e) {
      error = e;
    }

    if (hooks.teardown != null) {
      try {
        engine.call(context, hooks.teardown, ImmutableList.of(), ImmutableMap.of());
      } catch (EvalException e) {
        logger.atWarning().withCause(e).log("teardown failed for %s", context.getName());
        if (error == null) {
          error = new EvalException("teardown failed: " + e.getMessage(), e);
        }
      }
    }
    return error;
  }

  private ImmutableList<String> findTests(Namespace globals) {
    return globals.getNames().stream()
        .filter(name -> name.startsWith(options.testPrefix()))
        .filter(name -> globals.getCallable(name) != null)
        .sorted()
        .collect(ImmutableList.toImmutableList());
  }

  private ExecutionContext newContext(String name) {
    ExecutionContext context = engine.newContext(name);
    context.setCoverageRecorder(coverage);
    return context;
  }

  private static ScheduledExecutorService newTimer() {
    return Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setNameFormat("skytest-timeout-%d").setDaemon(true).build());
  }

  private ImmutableMap<String, Object> basePredeclared() {
    Map<String, Object> predeclared = new LinkedHashMap<>(options.predeclared());
    if (!options.disableAssert()) {
      predeclared.put("assert", AssertModule.create());
    }
    predeclared.put("struct", STRUCT);
    return ImmutableMap.copyOf(predeclared);
  }

  /** Executes the preludes in order, each seeing the globals of those before it. */
  private ImmutableMap<String, Object> loadPreludes(
      String filename, ImmutableMap<String, Object> predeclared)
      throws TestFileException, InterruptedException {
    if (options.preludes().isEmpty()) {
      return predeclared;
    }
    Map<String, Object> combined = new LinkedHashMap<>(predeclared);
    for (String prelude : options.preludes()) {
      Path path = fileSystem.getPath(prelude);
      byte[] source;
      try {
        source = Files.readAllBytes(path);
      } catch (IOException e) {
        throw new TestFileException(
            filename, String.format("reading prelude %s: %s", prelude, e.getMessage()), e);
      }
      try {
        Namespace globals =
            engine.execFile(newContext(prelude), prelude, source, ImmutableMap.copyOf(combined));
        combined.putAll(globals.asMap());
      } catch (SyntaxException | EvalException e) {
        throw new TestFileException(
            filename, String.format("executing prelude %s: %s", prelude, e.getMessage()), e);
      }
    }
    return ImmutableMap.copyOf(combined);
  }
}
