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

import com.google.common.collect.ImmutableCollection;
import javax.annotation.Nullable;

/**
 * A Starlark value with named fields, accessed with the dot operator ({@code x.f}). Built-in
 * modules, structs and the mock configuration builder are all structures.
 */
public interface Structure extends StarlarkValue {

  /** Returns the names of the fields of this value, in a stable order. */
  ImmutableCollection<String> getFieldNames();

  /** Returns the value of the named field, or null if there is no such field. */
  @Nullable
  Object getValue(String name) throws EvalException;
}
