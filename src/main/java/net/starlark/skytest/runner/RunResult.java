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
import java.util.List;

/** The results of every file of one run, in input order. */
@AutoValue
public abstract class RunResult {

  public abstract ImmutableList<FileResult> files();

  public abstract Duration duration();

  public static RunResult create(List<FileResult> files, Duration duration) {
    return new AutoValue_RunResult(ImmutableList.copyOf(files), duration);
  }

  public int passedCount() {
    return files().stream().mapToInt(FileResult::passedCount).sum();
  }

  public int failedCount() {
    return files().stream().mapToInt(FileResult::failedCount).sum();
  }

  public int skippedCount() {
    return files().stream().mapToInt(FileResult::skippedCount).sum();
  }

  public int totalCount() {
    return files().stream().mapToInt(f -> f.tests().size()).sum();
  }

  public boolean hasFailures() {
    return files().stream().anyMatch(FileResult::hasFailures);
  }
}
