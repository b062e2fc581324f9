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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A callable implemented in Java. Parameters are declared by name; a trailing {@code ?} marks an
 * optional parameter, a leading {@code *} collects surplus positional arguments into a {@link
 * Tuple}, and a leading {@code **} collects surplus named arguments into a map. Arguments are
 * bound in declaration order and handed to the {@link Body} as an array, with null for omitted
 * optional parameters.
 */
public final class BuiltinFunction implements StarlarkCallable, StarlarkValue {

  /** The implementation of a built-in function. */
  @FunctionalInterface
  public interface Body {
    Object call(ExecutionContext context, Object[] args)
        throws EvalException, InterruptedException;
  }

  private enum Kind {
    REQUIRED,
    OPTIONAL,
    VARARGS,
    KWARGS
  }

  private final String name;
  private final ImmutableList<String> paramNames;
  private final ImmutableList<Kind> paramKinds;
  private final Body body;

  private BuiltinFunction(
      String name, ImmutableList<String> paramNames, ImmutableList<Kind> paramKinds, Body body) {
    this.name = name;
    this.paramNames = paramNames;
    this.paramKinds = paramKinds;
    this.body = body;
  }

  /**
   * Returns a new built-in with the given name, parameter declarations and implementation, for
   * example {@code of("assert.eq", body, "x", "y", "msg?")}.
   */
  public static BuiltinFunction of(String name, Body body, String... params) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    ImmutableList.Builder<Kind> kinds = ImmutableList.builder();
    for (String param : params) {
      if (param.startsWith("**")) {
        names.add(param.substring(2));
        kinds.add(Kind.KWARGS);
      } else if (param.startsWith("*")) {
        names.add(param.substring(1));
        kinds.add(Kind.VARARGS);
      } else if (param.endsWith("?")) {
        names.add(param.substring(0, param.length() - 1));
        kinds.add(Kind.OPTIONAL);
      } else {
        names.add(param);
        kinds.add(Kind.REQUIRED);
      }
    }
    return new BuiltinFunction(
        Preconditions.checkNotNull(name), names.build(), kinds.build(), body);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public ImmutableList<String> getParameterNames() {
    return paramNames;
  }

  @Override
  public Object call(ExecutionContext context, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException {
    return body.call(context, bind(positional, named));
  }

  private Object[] bind(List<Object> positional, Map<String, Object> named)
      throws EvalException {
    int n = paramNames.size();
    Object[] args = new Object[n];
    List<Object> varargs = new ArrayList<>();
    Map<String, Object> kwargs = new LinkedHashMap<>();

    int next = 0;
    for (Object arg : positional) {
      while (next < n && paramKinds.get(next) == Kind.KWARGS) {
        next++;
      }
      if (next < n && paramKinds.get(next) == Kind.VARARGS) {
        varargs.add(arg);
        continue;
      }
      if (next >= n) {
        throw Starlark.errorf(
            "%s() accepts no more than %d positional arguments but got %d",
            name, positionalCapacity(), positional.size());
      }
      args[next++] = arg;
    }

    for (Map.Entry<String, Object> e : named.entrySet()) {
      int i = paramNames.indexOf(e.getKey());
      Kind kind = i < 0 ? null : paramKinds.get(i);
      if (kind == Kind.REQUIRED || kind == Kind.OPTIONAL) {
        if (args[i] != null) {
          throw Starlark.errorf(
              "%s() got multiple values for parameter '%s'", name, e.getKey());
        }
        args[i] = e.getValue();
      } else if (paramKinds.contains(Kind.KWARGS)) {
        kwargs.put(e.getKey(), e.getValue());
      } else {
        throw Starlark.errorf(
            "%s() got unexpected keyword argument '%s'", name, e.getKey());
      }
    }

    for (int i = 0; i < n; i++) {
      switch (paramKinds.get(i)) {
        case REQUIRED:
          if (args[i] == null) {
            throw Starlark.errorf(
                "%s() missing 1 required positional argument: %s", name, paramNames.get(i));
          }
          break;
        case VARARGS:
          args[i] = Tuple.copyOf(varargs);
          break;
        case KWARGS:
          args[i] = kwargs;
          break;
        case OPTIONAL:
          break;
      }
    }
    return args;
  }

  private int positionalCapacity() {
    int count = 0;
    for (Kind kind : paramKinds) {
      if (kind == Kind.REQUIRED || kind == Kind.OPTIONAL) {
        count++;
      }
    }
    return count;
  }

  @Override
  public String getTypeName() {
    return "builtin_function_or_method";
  }

  @Override
  public void repr(StringBuilder out) {
    out.append("<built-in function ").append(name).append('>');
  }

  @Override
  public String toString() {
    return Starlark.repr(this);
  }
}
