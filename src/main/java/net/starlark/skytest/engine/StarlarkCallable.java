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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;

/**
 * A Starlark value that can be called: a function defined in Starlark source (exposed by the
 * engine adapter) or a built-in provided by the test framework.
 */
public interface StarlarkCallable {

  /** Returns the name of the function, for error messages. */
  String getName();

  /**
   * Returns the declared parameter names, in order. The runner binds fixtures and parametrized
   * cases to a test function by these names.
   */
  ImmutableList<String> getParameterNames();

  /**
   * Calls this function with the given positional and named arguments. The argument collections
   * must not be retained or mutated by the callee.
   */
  Object call(ExecutionContext context, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException;
}
