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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;
import net.starlark.skytest.engine.BuiltinFunction;
import net.starlark.skytest.engine.Starlark;
import net.starlark.skytest.engine.Structure;
import net.starlark.skytest.engine.Tuple;

/**
 * The value of {@code mock.when(m)}: a builder that configures what a mock returns, either for
 * every call ({@code mock.when(m).then_return(v)}) or only for particular positional arguments
 * ({@code mock.when(m).called_with(1, 2).then_return(v)}).
 */
public final class MockWhen implements Structure {

  private static final ImmutableList<String> FIELDS =
      ImmutableList.of("called_with", "then_return");

  private final MockWrapper wrapper;
  @Nullable private final Tuple args;

  MockWhen(MockWrapper wrapper, @Nullable Tuple args) {
    this.wrapper = wrapper;
    this.args = args;
  }

  @Override
  public ImmutableList<String> getFieldNames() {
    return FIELDS;
  }

  @Override
  @Nullable
  public Object getValue(String name) {
    switch (name) {
      case "called_with":
        return BuiltinFunction.of(
            "called_with", (ctx, a) -> new MockWhen(wrapper, (Tuple) a[0]), "*args");
      case "then_return":
        return BuiltinFunction.of(
            "then_return",
            (ctx, a) -> {
              wrapper.getManager().setReturn(wrapper, args, a[0]);
              return wrapper;
            },
            "value");
      default:
        return null;
    }
  }

  @Override
  public String getTypeName() {
    return "mock_when";
  }

  @Override
  public void repr(StringBuilder out) {
    out.append("<mock.when(");
    Starlark.repr(out, wrapper);
    out.append(")>");
  }
}
