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

import com.google.auto.value.AutoValue;
import java.time.Duration;
import javax.annotation.Nullable;

/**
 * The outcome of one test or parametrized case. The base outcome is exactly one of {@link
 * Status#PASSED}, {@link Status#FAILED} and {@link Status#SKIPPED}; {@link #xfail} and {@link
 * #xpass} record how an expected failure was resolved.
 */
@AutoValue
public abstract class TestResult {

  /** The base outcome of a test. */
  public enum Status {
    PASSED,
    FAILED,
    SKIPPED
  }

  public abstract String name();

  public abstract String file();

  public abstract Status status();

  /** Whether the test was marked as an expected failure. */
  public abstract boolean xfail();

  /** Whether an expected failure passed unexpectedly; such a result is a failure. */
  public abstract boolean xpass();

  public abstract String skipReason();

  public abstract String xfailReason();

  public abstract Duration duration();

  @Nullable
  public abstract Exception error();

  /** Text printed by the test, its fixtures and its setup and teardown. */
  public abstract String output();

  public boolean passed() {
    return status() == Status.PASSED;
  }

  public boolean failed() {
    return status() == Status.FAILED;
  }

  public boolean skipped() {
    return status() == Status.SKIPPED;
  }

  @Nullable
  public String errorMessage() {
    Exception error = error();
    return error == null ? null : error.getMessage();
  }

  public abstract Builder toBuilder();

  public static Builder builder(String name, String file) {
    return new AutoValue_TestResult.Builder()
        .setName(name)
        .setFile(file)
        .setStatus(Status.PASSED)
        .setXfail(false)
        .setXpass(false)
        .setSkipReason("")
        .setXfailReason("")
        .setDuration(Duration.ZERO)
        .setOutput("");
  }

  /** Returns the result of a test that was skipped without running. */
  public static TestResult skipped(String name, String file, String reason) {
    return builder(name, file).setStatus(Status.SKIPPED).setSkipReason(reason).build();
  }

  /** Builder for {@link TestResult}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String value);

    public abstract Builder setFile(String value);

    public abstract Builder setStatus(Status value);

    public abstract Builder setXfail(boolean value);

    public abstract Builder setXpass(boolean value);

    public abstract Builder setSkipReason(String value);

    public abstract Builder setXfailReason(String value);

    public abstract Builder setDuration(Duration value);

    public abstract Builder setError(@Nullable Exception value);

    public abstract Builder setOutput(String value);

    public abstract TestResult build();
  }
}
