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

import com.google.common.base.Ascii;
import com.google.common.primitives.Ints;

/** Parses the worker-count setting. */
public final class Parallelism {

  public static final String AUTO = "auto";

  private Parallelism() {}

  /**
   * Returns the number of workers for {@code value}: the number of available processors for
   * {@code "auto"}, the value itself for a positive integer, and 1 for anything else, including
   * the empty string.
   */
  public static int parse(String value) {
    String trimmed = value.trim();
    if (Ascii.equalsIgnoreCase(trimmed, AUTO)) {
      return Runtime.getRuntime().availableProcessors();
    }
    Integer n = Ints.tryParse(trimmed);
    return n == null || n < 1 ? 1 : n;
  }
}
