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

import javax.annotation.Nullable;

/**
 * A test file could not be run at all: it, one of its preludes or one of its shared fixture files
 * could not be read or executed.
 */
public final class TestFileException extends Exception {
  private final String file;

  public TestFileException(String file, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.file = file;
  }

  /** Returns the test file whose run failed. */
  public String getFile() {
    return file;
  }
}
