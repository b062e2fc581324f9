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
package net.starlark.skytest.runner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import net.starlark.skytest.engine.BuiltinFunction;
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.engine.ExecutionContext;
import net.starlark.skytest.engine.Starlark;
import net.starlark.skytest.engine.StarlarkCallable;
import net.starlark.skytest.engine.StarlarkStruct;
import net.starlark.skytest.snapshot.SnapshotManager;

/**
 * The {@code assert} module predeclared in test files. Each function returns None on success and
 * fails with an {@code assertion failed: ...} error otherwise; the optional {@code msg} argument
 * replaces the generated description.
 */
final class AssertModule {

  private AssertModule() {}

  private interface Comparison {
    boolean test(int cmp);
  }

  static StarlarkStruct create() {
    return StarlarkStruct.module(
        "assert",
        ImmutableMap.<String, Object>builder()
            .put(
                "eq",
                BuiltinFunction.of(
                    "assert.eq",
                    (ctx, a) -> {
                      if (!Starlark.equal(a[0], a[1])) {
                        throw failure(a[2], "expected %s == %s", repr(a[0]), repr(a[1]));
                      }
                      return Starlark.NONE;
                    },
                    "a",
                    "b",
                    "msg?"))
            .put(
                "ne",
                BuiltinFunction.of(
                    "assert.ne",
                    (ctx, a) -> {
                      if (Starlark.equal(a[0], a[1])) {
                        throw failure(a[2], "expected %s != %s", repr(a[0]), repr(a[1]));
                      }
                      return Starlark.NONE;
                    },
                    "a",
                    "b",
                    "msg?"))
            .put(
                "true",
                BuiltinFunction.of(
                    "assert.true",
                    (ctx, a) -> {
                      if (!Starlark.truth(a[0])) {
                        throw failure(a[1], "expected %s to be true", repr(a[0]));
                      }
                      return Starlark.NONE;
                    },
                    "cond",
                    "msg?"))
            .put(
                "false",
                BuiltinFunction.of(
                    "assert.false",
                    (ctx, a) -> {
                      if (Starlark.truth(a[0])) {
                        throw failure(a[1], "expected %s to be false", repr(a[0]));
                      }
                      return Starlark.NONE;
                    },
                    "cond",
                    "msg?"))
            .put(
                "contains",
                BuiltinFunction.of(
                    "assert.contains",
                    (ctx, a) -> {
                      boolean found;
                      try {
                        found = Starlark.contains(a[0], a[1]);
                      } catch (EvalException e) {
                        throw Starlark.errorf(
                            "assert.contains: unsupported container type %s",
                            Starlark.type(a[0]));
                      }
                      if (!found) {
                        throw failure(a[2], "expected %s to contain %s", repr(a[0]), repr(a[1]));
                      }
                      return Starlark.NONE;
                    },
                    "container",
                    "item",
                    "msg?"))
            .put("fails", BuiltinFunction.of("assert.fails", AssertModule::fails, "fn", "pattern?"))
            .put("lt", ordering("assert.lt", "<", cmp -> cmp < 0))
            .put("le", ordering("assert.le", "<=", cmp -> cmp <= 0))
            .put("gt", ordering("assert.gt", ">", cmp -> cmp > 0))
            .put("ge", ordering("assert.ge", ">=", cmp -> cmp >= 0))
            .put(
                "len",
                BuiltinFunction.of(
                    "assert.len",
                    (ctx, a) -> {
                      int actual = length("assert.len", a[0]);
                      if (!(a[1] instanceof Number) || !Starlark.isIntegral((Number) a[1])) {
                        throw Starlark.errorf(
                            "assert.len: expected length must be an int, got %s",
                            Starlark.type(a[1]));
                      }
                      long expected = ((Number) a[1]).longValue();
                      if (actual != expected) {
                        throw failure(
                            a[2],
                            "expected len(%s) == %d, got %d",
                            Starlark.type(a[0]),
                            expected,
                            actual);
                      }
                      return Starlark.NONE;
                    },
                    "container",
                    "expected",
                    "msg?"))
            .put(
                "empty",
                BuiltinFunction.of(
                    "assert.empty",
                    (ctx, a) -> {
                      int actual = length("assert.empty", a[0]);
                      if (actual != 0) {
                        throw failure(
                            a[1],
                            "expected %s to be empty, got length %d",
                            Starlark.type(a[0]),
                            actual);
                      }
                      return Starlark.NONE;
                    },
                    "container",
                    "msg?"))
            .put(
                "not_empty",
                BuiltinFunction.of(
                    "assert.not_empty",
                    (ctx, a) -> {
                      if (length("assert.not_empty", a[0]) == 0) {
                        throw failure(a[1], "expected %s to not be empty", Starlark.type(a[0]));
                      }
                      return Starlark.NONE;
                    },
                    "container",
                    "msg?"))
            .put(
                "snapshot",
                BuiltinFunction.of("assert.snapshot", AssertModule::snapshot, "value", "name"))
            .buildOrThrow());
  }

  private static BuiltinFunction ordering(String name, String op, Comparison comparison) {
    return BuiltinFunction.of(
        name,
        (ctx, a) -> {
          if (!comparison.test(Starlark.compare(a[0], a[1]))) {
            throw failure(a[2], "expected %s %s %s", repr(a[0]), op, repr(a[1]));
          }
          return Starlark.NONE;
        },
        "a",
        "b",
        "msg?");
  }

  private static Object fails(ExecutionContext ctx, Object[] a)
      throws EvalException, InterruptedException {
    if (!(a[0] instanceof StarlarkCallable)) {
      throw Starlark.errorf("assert.fails: expected callable, got %s", Starlark.type(a[0]));
    }
    try {
      ((StarlarkCallable) a[0]).call(ctx, ImmutableList.of(), ImmutableMap.of());
    } catch (EvalException e) {
      ctx.checkCancelled();
      Object pattern = a[1];
      if (pattern instanceof String
          && !((String) pattern).isEmpty()
          && !e.getMessage().contains((String) pattern)) {
        throw Starlark.errorf(
            "assert.fails: error %s does not match pattern %s",
            repr(e.getMessage()),
            repr(pattern));
      }
      return Starlark.NONE;
    }
    throw Starlark.errorf("assert.fails: expected function to fail, but it succeeded");
  }

  private static Object snapshot(ExecutionContext ctx, Object[] a) throws EvalException {
    SnapshotManager manager = ctx.getThreadLocal(SnapshotManager.class);
    if (manager == null) {
      throw Starlark.errorf("assert.snapshot: no snapshot manager (not running in a test)");
    }
    if (!(a[1] instanceof String)) {
      throw Starlark.errorf(
          "assert.snapshot: name must be a string, got %s", Starlark.type(a[1]));
    }
    manager.compare(a[0], (String) a[1]);
    return Starlark.NONE;
  }

  private static int length(String function, Object x) throws EvalException {
    int len = Starlark.len(x);
    if (len < 0) {
      throw Starlark.errorf("%s: type %s has no len()", function, Starlark.type(x));
    }
    return len;
  }

  private static String repr(Object x) {
    return Starlark.repr(x);
  }

  @FormatMethod
  private static EvalException failure(Object msg, String format, Object... args) {
    if (msg instanceof String && !((String) msg).isEmpty()) {
      return new EvalException("assertion failed: " + msg);
    }
    return new EvalException("assertion failed: " + String.format(format, args));
  }
}
