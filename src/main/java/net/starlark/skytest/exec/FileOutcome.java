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
package net.starlark.skytest.exec;

import com.google.auto.value.AutoValue;
import java.nio.file.Path;
import javax.annotation.Nullable;
import net.starlark.skytest.runner.FileResult;
import net.starlark.skytest.runner.TestFileException;

/** What a worker produced for one file: a result or an error, and the report text it buffered. */
@AutoValue
abstract class FileOutcome {

  abstract Path file();

  @Nullable
  abstract FileResult result();

  @Nullable
  abstract TestFileException error();

  abstract String output();

  static FileOutcome success(Path file, FileResult result, String output) {
    return new AutoValue_FileOutcome(file, result, null, output);
  }

  static FileOutcome failure(Path file, TestFileException error) {
    return new AutoValue_FileOutcome(file, null, error, "");
  }
}
