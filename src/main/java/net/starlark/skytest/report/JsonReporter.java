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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.io.PrintWriter;
import net.starlark.skytest.runner.FileResult;
import net.starlark.skytest.runner.RunResult;
import net.starlark.skytest.runner.TestResult;

/** Writes the whole run as a single JSON document. */
public final class JsonReporter implements Reporter {

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  @Override
  public void reportFile(PrintWriter out, FileResult result) {}

  @Override
  public void reportSummary(PrintWriter out, RunResult result) {
    out.println(GSON.toJson(toJson(result)));
    out.flush();
  }

  static JsonObject toJson(RunResult result) {
    JsonObject root = new JsonObject();
    root.addProperty("passed", result.passedCount());
    root.addProperty("failed", result.failedCount());
    root.addProperty("skipped", result.skippedCount());
    root.addProperty("total", result.totalCount());
    root.addProperty("files", result.files().size());
    root.addProperty("duration_ms", result.duration().toMillis());

    JsonArray files = new JsonArray();
    for (FileResult file : result.files()) {
      JsonObject fileJson = new JsonObject();
      fileJson.addProperty("file", file.file());
      fileJson.addProperty("duration_ms", file.duration().toMillis());
      if (file.setupError() != null) {
        fileJson.addProperty("setup_error", file.setupError().getMessage());
      }
      if (file.teardownError() != null) {
        fileJson.addProperty("teardown_error", file.teardownError().getMessage());
      }
      JsonArray tests = new JsonArray();
      for (TestResult test : file.tests()) {
        JsonObject testJson = new JsonObject();
        testJson.addProperty("name", test.name());
        testJson.addProperty("passed", !test.failed());
        testJson.addProperty("status", TextReporter.statusLabel(test));
        testJson.addProperty("duration_ms", test.duration().toMillis());
        if (test.error() != null) {
          testJson.addProperty("error", test.errorMessage());
        }
        if (test.skipped() && !test.skipReason().isEmpty()) {
          testJson.addProperty("skip_reason", test.skipReason());
        }
        tests.add(testJson);
      }
      fileJson.add("tests", tests);
      files.add(fileJson);
    }
    root.add("results", files);
    return root;
  }
}
