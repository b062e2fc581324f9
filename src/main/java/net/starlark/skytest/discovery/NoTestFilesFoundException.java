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
package net.starlark.skytest.discovery;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Thrown when path expansion yields no test files at all. */
public final class NoTestFilesFoundException extends Exception {
  private final ImmutableList<String> paths;

  public NoTestFilesFoundException(List<String> paths) {
    super("no test files found in " + Joiner.on(", ").join(paths));
    this.paths = ImmutableList.copyOf(paths);
  }

  /** Returns the path arguments that were searched. */
  public ImmutableList<String> getPaths() {
    return paths;
  }
}
