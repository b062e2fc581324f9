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

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * The boundary to the external Starlark execution engine. An implementation parses and executes
 * source files, calls functions, and honors the cancellation and coverage hooks of the {@link
 * ExecutionContext} it is given.
 *
 * <p>Implementations must be safe for concurrent use by distinct contexts: the parallel executor
 * runs several files at once, each on its own contexts.
 */
public interface StarlarkEngine {

  /**
   * Parses and executes a file, returning the values it declared at top level.
   *
   * @param context the context in which top-level statements run
   * @param filename the name used in error messages and coverage attribution
   * @param source the file contents, UTF-8 encoded
   * @param predeclared values visible to the file without being declared
   * @throws SyntaxException if the file contains static errors
   * @throws EvalException if a top-level statement fails
   */
  Namespace execFile(
      ExecutionContext context,
      String filename,
      byte[] source,
      ImmutableMap<String, Object> predeclared)
      throws SyntaxException, EvalException, InterruptedException;

  /** Calls a function within the given context. */
  default Object call(
      ExecutionContext context,
      StarlarkCallable fn,
      List<Object> positional,
      Map<String, Object> named)
      throws EvalException, InterruptedException {
    return fn.call(context, positional, named);
  }

  /** Creates a fresh execution context. */
  default ExecutionContext newContext(String name) {
    return new ExecutionContext(name);
  }
}
