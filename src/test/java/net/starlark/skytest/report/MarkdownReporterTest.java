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

import java.io.PrintWriter;
import java.io.StringWriter;
import net.starlark.skytest.runner.RunResult;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MarkdownReporterTest {

  private static String report(RunResult result) {
    StringWriter out = new StringWriter();
    new MarkdownReporter().reportSummary(new PrintWriter(out), result);
    return out.toString();
  }

  @Test
  public void summaryTable() {
    String md = report(SampleResults.run(SampleResults.mixed(), SampleResults.setupFailed()));

    assertThat(md)
        .startsWith("## 🧪 Test Results\n\n**4 tests** in 2 files completed in **1.5s**\n");
    assertThat(md).contains("| ✅ Passed | 1 |\n| ❌ Failed | 2 |\n| ⏭️ Skipped | 1 |\n");
  }

  @Test
  public void failureDetails() {
    String md = report(SampleResults.run(SampleResults.mixed(), SampleResults.setupFailed()));

    assertThat(md).contains("### ❌ Failed Tests\n");
    assertThat(md)
        .contains(
            "<details>\n<summary><code>/w/a_test.star::test_bad</code></summary>\n\n```\n"
                + SampleResults.LOCATED_ERROR
                + "\n```\n\n</details>\n");
    assertThat(md).contains("<summary><code>/w/a_test.star::test_xp</code></summary>");
    assertThat(md).contains("unexpected pass of xfail test");
    assertThat(md).contains("<summary><code>/w/b_test.star::setup_file</code></summary>");
  }

  @Test
  public void skippedList() {
    String md = report(SampleResults.run(SampleResults.mixed()));

    assertThat(md).contains("### ⏭️ Skipped Tests\n\n- `/w/a_test.star::test_skip` - slow\n");
  }

  @Test
  public void allPassingHasNoSections() {
    String md = report(SampleResults.run(SampleResults.allPassing("x.star", "test_a", "test_b")));

    assertThat(md).contains("**2 tests** in 1 files");
    assertThat(md).doesNotContain("###");
  }
}
