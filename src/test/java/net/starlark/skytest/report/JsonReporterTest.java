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

import static com.google.common.truth.Truth.assertThat;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class JsonReporterTest {

  private static JsonObject report() {
    StringWriter out = new StringWriter();
    JsonReporter reporter = new JsonReporter();
    reporter.reportFile(new PrintWriter(out), SampleResults.mixed());
    assertThat(out.toString()).isEmpty();
    reporter.reportSummary(
        new PrintWriter(out),
        SampleResults.run(SampleResults.mixed(), SampleResults.setupFailed()));
    return JsonParser.parseString(out.toString()).getAsJsonObject();
  }

  @Test
  public void totals() {
    JsonObject root = report();

    assertThat(root.get("passed").getAsInt()).isEqualTo(1);
    assertThat(root.get("failed").getAsInt()).isEqualTo(2);
    assertThat(root.get("skipped").getAsInt()).isEqualTo(1);
    assertThat(root.get("total").getAsInt()).isEqualTo(4);
    assertThat(root.get("files").getAsInt()).isEqualTo(2);
    assertThat(root.get("duration_ms").getAsLong()).isEqualTo(1500);
  }

  @Test
  public void tests() {
    JsonArray results = report().getAsJsonArray("results");
    JsonObject file = results.get(0).getAsJsonObject();
    JsonArray tests = file.getAsJsonArray("tests");

    assertThat(file.get("file").getAsString()).isEqualTo(SampleResults.A);
    assertThat(file.has("setup_error")).isFalse();
    assertThat(tests.size()).isEqualTo(4);

    JsonObject ok = tests.get(0).getAsJsonObject();
    assertThat(ok.get("name").getAsString()).isEqualTo("test_ok");
    assertThat(ok.get("passed").getAsBoolean()).isTrue();
    assertThat(ok.get("status").getAsString()).isEqualTo("PASS");
    assertThat(ok.get("duration_ms").getAsLong()).isEqualTo(12);
    assertThat(ok.has("error")).isFalse();

    JsonObject bad = tests.get(1).getAsJsonObject();
    assertThat(bad.get("passed").getAsBoolean()).isFalse();
    assertThat(bad.get("error").getAsString()).isEqualTo(SampleResults.LOCATED_ERROR);

    JsonObject skip = tests.get(2).getAsJsonObject();
    assertThat(skip.get("passed").getAsBoolean()).isTrue();
    assertThat(skip.get("status").getAsString()).isEqualTo("SKIP");
    assertThat(skip.get("skip_reason").getAsString()).isEqualTo("slow");

    assertThat(tests.get(3).getAsJsonObject().get("status").getAsString()).isEqualTo("XPASS");
  }

  @Test
  public void setupError() {
    JsonObject file = report().getAsJsonArray("results").get(1).getAsJsonObject();

    assertThat(file.get("setup_error").getAsString()).isEqualTo("setup_file failed: db down");
    assertThat(file.getAsJsonArray("tests").size()).isEqualTo(0);
  }
}
