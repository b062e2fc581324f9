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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** Reports the static errors (scan, parse, resolve) found in a Starlark file. */
public final class SyntaxException extends Exception {
  private final ImmutableList<String> errors;

  public SyntaxException(String filename, Iterable<String> errors) {
    super(filename + ": " + Joiner.on("\n").join(errors));
    this.errors = ImmutableList.copyOf(errors);
  }

  /** Returns the individual error messages, in the order the engine reported them. */
  public ImmutableList<String> errors() {
    return errors;
  }
}
