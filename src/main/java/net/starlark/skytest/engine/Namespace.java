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
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import javax.annotation.Nullable;

/** The global values a Starlark file declared, in declaration order. */
public final class Namespace {

  private static final Namespace EMPTY = new Namespace(ImmutableMap.of());

  private final ImmutableMap<String, Object> globals;

  private Namespace(ImmutableMap<String, Object> globals) {
    this.globals = globals;
  }

  public static Namespace empty() {
    return EMPTY;
  }

  public static Namespace of(Map<String, ?> globals) {
    return new Namespace(ImmutableMap.copyOf(globals));
  }

  public ImmutableSet<String> getNames() {
    return globals.keySet();
  }

  public boolean contains(String name) {
    return globals.containsKey(name);
  }

  @Nullable
  public Object get(String name) {
    return globals.get(name);
  }

  /** Returns the named global if it is callable, or null otherwise. */
  @Nullable
  public StarlarkCallable getCallable(String name) {
    Object value = globals.get(name);
    return value instanceof StarlarkCallable ? (StarlarkCallable) value : null;
  }

  /** Returns the named global if it is a dict, or null otherwise. */
  @Nullable
  public Map<?, ?> getDict(String name) {
    Object value = globals.get(name);
    return value instanceof Map ? (Map<?, ?>) value : null;
  }

  public ImmutableMap<String, Object> asMap() {
    return globals;
  }

  @Override
  public String toString() {
    return "Namespace" + globals.keySet();
  }
}
