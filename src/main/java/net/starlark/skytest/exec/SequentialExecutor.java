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

import com.google.common.base.Stopwatch;
import com.google.common.flogger.GoogleLogger;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.starlark.skytest.report.Reporter;
import net.starlark.skytest.runner.FileResult;
import net.starlark.skytest.runner.RunResult;
import net.starlark.skytest.runner.TestFileException;

/** Runs files one after another on the calling thread. */
public final class SequentialExecutor implements RunExecutor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Reporter reporter;
  private final PrintWriter out;
  private final boolean failFast;

  public SequentialExecutor(Reporter reporter, PrintWriter out, boolean failFast) {
    this.reporter = reporter;
    this.out = out;
    this.failFast = failFast;
  }

  @Override
  public RunResult execute(List<Path> files, FileTask task)
      throws TestFileException, InterruptedException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<FileResult> results = new ArrayList<>();
    for (Path file : files) {
      FileResult result = task.run(file);
      results.add(result);
      if (reporter.supportsIncrementalOutput()) {
        reporter.reportFile(out, result);
      }
      if (failFast && result.hasFailures()) {
        logger.atFine().log("Stopping after %s: fail-fast", file);
        break;
      }
    }
    return RunResult.create(results, stopwatch.elapsed());
  }
}
