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
package net.starlark.skytest.engine;

/**
 * Receives line-execution notifications from the engine. The engine maps each executed position
 * back to a (filename, line) pair before calling {@link #recordLine}.
 */
public interface CoverageRecorder {

  void recordLine(String filename, int line);

  /** Called when a Starlark function is entered. Engines that cannot tell may skip this. */
  default void recordFunctionEntry(String filename, String function, int line) {}
}
