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
package net.starlark.skytest.report;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.io.PrintWriter;
import net.starlark.skytest.runner.FileResult;
import net.starlark.skytest.runner.RunResult;
import net.starlark.skytest.runner.TestResult;

/** Plain-text output: one status line per test and a summary line. */
public final class TextReporter implements Reporter {

  private static final Splitter LINES = Splitter.on('\n');
  private static final CharMatcher TRAILING_NEWLINES = CharMatcher.is('\n');
  private static final String DETAIL_INDENT = "      ";

  private final boolean verbose;
  private final boolean showDuration;

  public TextReporter(boolean verbose, boolean showDuration) {
    this.verbose = verbose;
    this.showDuration = showDuration;
  }

  @Override
  public boolean supportsIncrementalOutput() {
    return true;
  }

  /** Returns the label shown for a test: SKIP, XPASS, XFAIL, PASS or FAIL. */
  static String statusLabel(TestResult test) {
    if (test.skipped()) {
      return "SKIP";
    } else if (test.xpass()) {
      return "XPASS";
    } else if (test.xfail() && test.passed()) {
      return "XFAIL";
    } else if (test.passed()) {
      return "PASS";
    }
    return "FAIL";
  }

  @Override
  public void reportFile(PrintWriter out, FileResult result) {
    if (result.setupError() != null) {
      out.printf("SETUP FAILED: %s\n  %s\n", result.file(), result.setupError().getMessage());
      out.flush();
      return;
    }
    for (TestResult test : result.tests()) {
      if (showDuration) {
        out.printf(
            "%s  %s  (%s)\n",
            statusLabel(test), test.name(), DurationFormat.format(test.duration()));
      } else {
        out.printf("%s  %s\n", statusLabel(test), test.name());
      }
      if (test.skipped() && !test.skipReason().isEmpty()) {
        out.println(DETAIL_INDENT + test.skipReason());
      }
      if (test.xfail() && !test.xfailReason().isEmpty()) {
        out.println(DETAIL_INDENT + test.xfailReason());
      }
      if (!test.passed() && test.error() != null && !test.xfail()) {
        for (String line : LINES.split(test.errorMessage())) {
          out.println(DETAIL_INDENT + line);
        }
      }
      if (verbose && !test.output().isEmpty()) {
        out.println(DETAIL_INDENT + "Output:");
        for (String line : LINES.split(TRAILING_NEWLINES.trimTrailingFrom(test.output()))) {
          out.println(DETAIL_INDENT + "  " + line);
        }
      }
    }
    if (result.teardownError() != null) {
      out.printf("TEARDOWN FAILED: %s\n  %s\n", result.file(), result.teardownError().getMessage());
    }
    out.flush();
  }

  @Override
  public void reportSummary(PrintWriter out, RunResult result) {
    out.println();
    out.printf(
        "Results: %d passed, %d failed, %d skipped, %d total in %d file(s)\n",
        result.passedCount(),
        result.failedCount(),
        result.skippedCount(),
        result.totalCount(),
        result.files().size());
    if (showDuration) {
      out.printf("Duration: %s\n", DurationFormat.format(result.duration()));
    }
    out.flush();
  }
}
