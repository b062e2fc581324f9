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
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import javax.annotation.Nullable;

/**
 * The results of one test file, in execution order. A file whose {@code setup_file} hook failed
 * has a {@link #setupError} and no test results.
 */
@AutoValue
public abstract class FileResult {

  public abstract String file();

  public abstract ImmutableList<TestResult> tests();

  @Nullable
  public abstract Exception setupError();

  @Nullable
  public abstract Exception teardownError();

  public abstract Duration duration();

  public int passedCount() {
    return (int) tests().stream().filter(TestResult::passed).count();
  }

  public int failedCount() {
    return (int) tests().stream().filter(TestResult::failed).count();
  }

  public int skippedCount() {
    return (int) tests().stream().filter(TestResult::skipped).count();
  }

  /** Reports whether any test failed, or a file-level hook did. */
  public boolean hasFailures() {
    return failedCount() > 0 || setupError() != null || teardownError() != null;
  }

  public static Builder builder(String file) {
    return new AutoValue_FileResult.Builder().setFile(file).setDuration(Duration.ZERO);
  }

  /** Builder for {@link FileResult}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFile(String value);

    public abstract ImmutableList.Builder<TestResult> testsBuilder();

    public Builder addTest(TestResult result) {
      testsBuilder().add(result);
      return this;
    }

    public abstract Builder setSetupError(@Nullable Exception value);

    public abstract Builder setTeardownError(@Nullable Exception value);

    public abstract Builder setDuration(Duration value);

    public abstract FileResult build();
  }
}
