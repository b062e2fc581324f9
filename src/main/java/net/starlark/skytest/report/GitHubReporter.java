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

import java.io.PrintWriter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import net.starlark.skytest.runner.FileResult;
import net.starlark.skytest.runner.RunResult;
import net.starlark.skytest.runner.TestResult;

/**
 * GitHub Actions workflow commands. Each file is wrapped in a collapsible group, failures become
 * {@code ::error} annotations pointing at the failing line where the message names one, and
 * skipped tests become {@code ::notice} annotations.
 */
public final class GitHubReporter implements Reporter {

  // "file.star:15:5: message" or "... at file.star:15"
  private static final Pattern LEADING_LOCATION =
      Pattern.compile("^([^\\s:]+\\.star):(\\d+)(?::\\d+)?:");
  private static final Pattern AT_LOCATION = Pattern.compile("\\bat ([^\\s:]+\\.star):(\\d+)");

  @Override
  public boolean supportsIncrementalOutput() {
    return true;
  }

  @Override
  public void reportFile(PrintWriter out, FileResult result) {
    out.printf("::group::📁 %s\n", result.file());
    if (result.setupError() != null) {
      out.printf(
          "::error file=%s,title=Setup Failed::%s\n",
          escapeValue(result.file()),
          escapeMessage(result.setupError().getMessage()));
    }
    for (TestResult test : result.tests()) {
      out.printf("%s  %s\n", TextReporter.statusLabel(test), test.name());
      if (test.skipped()) {
        String message =
            test.skipReason().isEmpty() ? test.name() : test.name() + ": " + test.skipReason();
        out.printf(
            "::notice file=%s,title=Skipped::%s\n",
            escapeValue(result.file()), escapeMessage(message));
      } else if (test.xpass()) {
        out.printf(
            "::error file=%s,title=Unexpected Pass::%s\n",
            escapeValue(result.file()),
            escapeMessage(test.name() + " was expected to fail but passed"));
      } else if (test.failed()) {
        String message = test.error() != null ? test.errorMessage() : test.name() + " failed";
        Location location = findLocation(message);
        String file = location != null ? location.file : result.file();
        String lineProperty = location != null ? ",line=" + location.line : "";
        out.printf(
            "::error file=%s%s,title=Test Failed::%s\n",
            escapeValue(file), lineProperty, escapeMessage(test.name() + ": " + message));
      }
    }
    if (result.teardownError() != null) {
      out.printf(
          "::error file=%s,title=Teardown Failed::%s\n",
          escapeValue(result.file()),
          escapeMessage(result.teardownError().getMessage()));
    }
    out.println("::endgroup::");
    out.flush();
  }

  @Override
  public void reportSummary(PrintWriter out, RunResult result) {
    int ran = result.passedCount() + result.failedCount();
    out.println();
    if (result.hasFailures()) {
      out.printf("❌ %d/%d tests failed\n", result.failedCount(), ran);
    } else {
      out.printf("✅ %d tests passed\n", result.passedCount());
    }
    out.flush();
  }

  /** A source position named in an error message. */
  static final class Location {
    final String file;
    final int line;

    Location(String file, int line) {
      this.file = file;
      this.line = line;
    }
  }

  @Nullable
  static Location findLocation(String message) {
    Matcher m = LEADING_LOCATION.matcher(message);
    if (!m.find()) {
      m = AT_LOCATION.matcher(message);
      if (!m.find()) {
        return null;
      }
    }
    return new Location(m.group(1), Integer.parseInt(m.group(2)));
  }

  /** Escapes the text after the final {@code ::} of a workflow command. */
  static String escapeMessage(String s) {
    return s.replace("%", "%25").replace("\r", "%0D").replace("\n", "%0A");
  }

  /** Escapes a {@code key=value} property of a workflow command. */
  static String escapeValue(String s) {
    return escapeMessage(s).replace(":", "%3A").replace(",", "%2C");
  }
}
