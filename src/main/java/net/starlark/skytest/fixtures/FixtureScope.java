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
package net.starlark.skytest.fixtures;

import javax.annotation.Nullable;

/** The lifetime of a fixture's computed value. */
public enum FixtureScope {
  /** Computed afresh for every test, and shared between a test and the fixtures it requests. */
  TEST("test"),
  /** Computed at most once per file and shared by every test in it. */
  FILE("file");

  private final String label;

  FixtureScope(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** Returns the scope with the given label, or null if there is none. */
  @Nullable
  public static FixtureScope fromLabel(String label) {
    for (FixtureScope scope : values()) {
      if (scope.label.equals(label)) {
        return scope;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return label;
  }
}
