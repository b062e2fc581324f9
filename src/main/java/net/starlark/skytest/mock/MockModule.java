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
package net.starlark.skytest.mock;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.starlark.skytest.engine.BuiltinFunction;
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.engine.Starlark;
import net.starlark.skytest.engine.StarlarkStruct;

/** Builds the {@code mock} module that tests receive through the built-in {@code mock} fixture. */
public final class MockModule {

  private MockModule() {}

  /** Returns a {@code mock} module bound to the given manager. */
  public static StarlarkStruct create(MockManager manager) {
    return StarlarkStruct.module(
        "mock",
        ImmutableMap.<String, Object>builder()
            .put("wrap", BuiltinFunction.of("mock.wrap", (ctx, a) -> manager.wrap(a[0]), "fn"))
            .put(
                "when",
                BuiltinFunction.of(
                    "mock.when", (ctx, a) -> new MockWhen(asMock("mock.when", a[0]), null), "fn"))
            .put(
                "was_called",
                BuiltinFunction.of(
                    "mock.was_called",
                    (ctx, a) -> manager.wasCalled(asMock("mock.was_called", a[0])),
                    "fn"))
            .put(
                "call_count",
                BuiltinFunction.of(
                    "mock.call_count",
                    (ctx, a) -> manager.callCount(asMock("mock.call_count", a[0])),
                    "fn"))
            .put(
                "calls",
                BuiltinFunction.of(
                    "mock.calls",
                    (ctx, a) -> {
                      List<Object> calls = new ArrayList<>();
                      for (MockCall call : manager.calls(asMock("mock.calls", a[0]))) {
                        calls.add(call.toDict());
                      }
                      return calls;
                    },
                    "fn"))
            .put(
                "reset",
                BuiltinFunction.of(
                    "mock.reset",
                    (ctx, a) -> {
                      manager.reset();
                      return Starlark.NONE;
                    }))
            .buildOrThrow());
  }

  private static MockWrapper asMock(String function, Object fn) throws EvalException {
    if (!(fn instanceof MockWrapper)) {
      throw Starlark.errorf(
          "%s: expected mock wrapper, got %s (use mock.wrap() first)",
          function, Starlark.type(fn));
    }
    return (MockWrapper) fn;
  }
}
