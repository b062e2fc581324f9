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
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.runner.FileResult;
import net.starlark.skytest.runner.RunResult;
import net.starlark.skytest.runner.TestResult;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class GitHubReporterTest {

  private final GitHubReporter reporter = new GitHubReporter();

  private String reportFile(FileResult result) {
    StringWriter out = new StringWriter();
    reporter.reportFile(new PrintWriter(out), result);
    return out.toString();
  }

  private String summary(RunResult result) {
    StringWriter out = new StringWriter();
    reporter.reportSummary(new PrintWriter(out), result);
    return out.toString();
  }

  @Test
  public void annotations() {
    assertThat(reportFile(SampleResults.mixed()))
        .isEqualTo(
            "::group::📁 /w/a_test.star\n"
                + "PASS  test_ok\n"
                + "FAIL  test_bad\n"
                + "::error file=a_test.star,line=15,title=Test Failed::test_bad: "
                + SampleResults.LOCATED_ERROR
                + "\n"
                + "SKIP  test_skip\n"
                + "::notice file=/w/a_test.star,title=Skipped::test_skip: slow\n"
                + "XPASS  test_xp\n"
                + "::error file=/w/a_test.star,title=Unexpected Pass::"
                + "test_xp was expected to fail but passed\n"
                + "::endgroup::\n");
  }

  @Test
  public void failureWithoutLocationUsesTestFile() {
    FileResult result =
        FileResult.builder("x_test.star")
            .addTest(
                TestResult.builder("test_x", "x_test.star")
                    .setStatus(TestResult.Status.FAILED)
                    .setError(new EvalException("boom\nsecond line"))
                    .build())
            .build();

    assertThat(reportFile(result))
        .contains("::error file=x_test.star,title=Test Failed::test_x: boom%0Asecond line\n");
  }

  @Test
  public void setupFailure() {
    assertThat(reportFile(SampleResults.setupFailed()))
        .isEqualTo(
            "::group::📁 /w/b_test.star\n"
                + "::error file=/w/b_test.star,title=Setup Failed::setup_file failed: db down\n"
                + "::endgroup::\n");
  }

  @Test
  public void summaryLines() {
    assertThat(summary(SampleResults.run(SampleResults.mixed())))
        .isEqualTo("\n❌ 2/3 tests failed\n");
    assertThat(summary(SampleResults.run(SampleResults.allPassing("x.star", "test_a", "test_b"))))
        .isEqualTo("\n✅ 2 tests passed\n");
  }

  @Test
  public void findLocation() {
    GitHubReporter.Location leading = GitHubReporter.findLocation("lib/x.star:7: oops");
    assertThat(leading.file).isEqualTo("lib/x.star");
    assertThat(leading.line).isEqualTo(7);

    GitHubReporter.Location at =
        GitHubReporter.findLocation("Traceback: error at helpers.star:42 in check");
    assertThat(at.file).isEqualTo("helpers.star");
    assertThat(at.line).isEqualTo(42);

    assertThat(GitHubReporter.findLocation("assertion failed")).isNull();
  }

  @Test
  public void escaping() {
    assertThat(GitHubReporter.escapeMessage("100%\r\n")).isEqualTo("100%25%0D%0A");
    assertThat(GitHubReporter.escapeValue("a:b,c")).isEqualTo("a%3Ab%2Cc");
  }
}
