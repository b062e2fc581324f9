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
 * Base interface for values defined by the test framework and exchanged with the execution
 * engine. Plain Java values (strings, numbers, booleans, lists, maps, sets) are also legal Starlark
 * values and need not implement this interface.
 */
public interface StarlarkValue {

  /** Returns the name of the Starlark type of this value, as reported by {@code type(x)}. */
  String getTypeName();

  /** Appends the Starlark representation of this value, as produced by {@code repr(x)}. */
  default void repr(StringBuilder out) {
    out.append(toString());
  }

  /** Returns the truth-value of this Starlark value. */
  default boolean truth() {
    return true;
  }
}
