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
import net.starlark.skytest.runner.FileResult;
import net.starlark.skytest.runner.RunResult;
import net.starlark.skytest.runner.TestResult;

/** GitHub-flavored Markdown, suitable for a workflow step summary. */
public final class MarkdownReporter implements Reporter {

  @Override
  public void reportFile(PrintWriter out, FileResult result) {}

  @Override
  public void reportSummary(PrintWriter out, RunResult result) {
    out.println("## 🧪 Test Results");
    out.println();
    out.printf(
        "**%d tests** in %d files completed in **%s**\n",
        result.totalCount(), result.files().size(), DurationFormat.format(result.duration()));
    out.println();
    out.println("| Status | Count |");
    out.println("|--------|-------|");
    out.printf("| ✅ Passed | %d |\n", result.passedCount());
    out.printf("| ❌ Failed | %d |\n", result.failedCount());
    out.printf("| ⏭️ Skipped | %d |\n", result.skippedCount());
    out.println();

    boolean fileErrors = result.files().stream().anyMatch(f -> f.setupError() != null);
    if (result.failedCount() > 0 || fileErrors) {
      out.println("### ❌ Failed Tests");
      out.println();
      for (FileResult file : result.files()) {
        if (file.setupError() != null) {
          writeFailure(out, file.file(), "setup_file", file.setupError().getMessage());
        }
        for (TestResult test : file.tests()) {
          if (!test.failed()) {
            continue;
          }
          String message =
              test.error() != null ? test.errorMessage() : "unexpected pass of xfail test";
          writeFailure(out, file.file(), test.name(), message);
        }
      }
    }

    if (result.skippedCount() > 0) {
      out.println("### ⏭️ Skipped Tests");
      out.println();
      for (FileResult file : result.files()) {
        for (TestResult test : file.tests()) {
          if (!test.skipped()) {
            continue;
          }
          if (test.skipReason().isEmpty()) {
            out.printf("- `%s::%s`\n", file.file(), test.name());
          } else {
            out.printf("- `%s::%s` - %s\n", file.file(), test.name(), test.skipReason());
          }
        }
      }
      out.println();
    }
    out.flush();
  }

  private static void writeFailure(PrintWriter out, String file, String name, String message) {
    out.println("<details>");
    out.printf("<summary><code>%s::%s</code></summary>\n", file, name);
    out.println();
    out.println("```");
    out.println(message);
    out.println("```");
    out.println();
    out.println("</details>");
    out.println();
  }
}
