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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.engine.ExecutionContext;
import net.starlark.skytest.engine.Starlark;
import net.starlark.skytest.engine.StarlarkCallable;
import net.starlark.skytest.engine.StarlarkValue;
import net.starlark.skytest.engine.Tuple;

/**
 * A callable standing in for another. Each call is recorded; if a return value is configured for
 * the call it is returned, otherwise the wrapped callable runs.
 */
public final class MockWrapper implements StarlarkCallable, StarlarkValue {

  private final int id;
  private final StarlarkCallable wrapped;
  private final MockManager manager;

  MockWrapper(int id, StarlarkCallable wrapped, MockManager manager) {
    this.id = id;
    this.wrapped = wrapped;
    this.manager = manager;
  }

  public int getId() {
    return id;
  }

  public StarlarkCallable getWrapped() {
    return wrapped;
  }

  MockManager getManager() {
    return manager;
  }

  @Override
  public String getName() {
    return wrapped.getName();
  }

  @Override
  public ImmutableList<String> getParameterNames() {
    return wrapped.getParameterNames();
  }

  @Override
  public Object call(ExecutionContext context, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException {
    Tuple args = Tuple.copyOf(positional);
    manager.recordCall(this, MockCall.create(args, named));
    Optional<Object> configured = manager.getReturn(this, args);
    if (configured.isPresent()) {
      return configured.get();
    }
    return wrapped.call(context, positional, named);
  }

  @Override
  public String getTypeName() {
    return "mock";
  }

  @Override
  public void repr(StringBuilder out) {
    out.append("<mock #").append(id).append(" wrapping ");
    Starlark.repr(out, wrapped);
    out.append('>');
  }

  @Override
  public String toString() {
    return Starlark.repr(this);
  }
}
