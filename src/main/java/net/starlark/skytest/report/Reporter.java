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

/**
 * Renders test results. {@link #reportFile} is called once per file, in input order, and {@link
 * #reportSummary} once at the end of the run.
 */
public interface Reporter {

  void reportFile(PrintWriter out, FileResult result);

  void reportSummary(PrintWriter out, RunResult result);

  /**
   * Whether {@link #reportFile} output is meaningful as soon as a file finishes. Drivers print such
   * output per file; for other reporters all output comes from {@link #reportSummary}.
   */
  default boolean supportsIncrementalOutput() {
    return false;
  }
}
