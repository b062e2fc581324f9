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
package net.starlark.skytest.snapshot;

import com.google.common.collect.ImmutableMap;
import net.starlark.skytest.engine.BuiltinFunction;
import net.starlark.skytest.engine.Starlark;
import net.starlark.skytest.engine.StarlarkStruct;

/** Builds the value of the built-in {@code snapshot} fixture. */
public final class SnapshotModule {

  private SnapshotModule() {}

  /** Returns a {@code snapshot} module whose {@code compare(value, name)} uses {@code manager}. */
  public static StarlarkStruct create(SnapshotManager manager) {
    return StarlarkStruct.module(
        "snapshot",
        ImmutableMap.of(
            "compare",
            BuiltinFunction.of(
                "snapshot.compare",
                (ctx, args) -> {
                  if (!(args[1] instanceof String)) {
                    throw Starlark.errorf(
                        "snapshot.compare: name must be a string, got %s",
                        Starlark.type(args[1]));
                  }
                  manager.compare(args[0], (String) args[1]);
                  return Starlark.NONE;
                },
                "value",
                "name")));
  }
}
