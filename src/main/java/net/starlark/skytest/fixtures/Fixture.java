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
package net.starlark.skytest.fixtures;

import com.google.auto.value.AutoValue;
import net.starlark.skytest.engine.StarlarkCallable;

/** A named value producer that tests request by parameter name. */
@AutoValue
public abstract class Fixture {

  public abstract String name();

  /** The producer; its own parameters are resolved as fixtures too. */
  public abstract StarlarkCallable function();

  public abstract FixtureScope scope();

  public static Fixture create(String name, StarlarkCallable function, FixtureScope scope) {
    return new AutoValue_Fixture(name, function, scope);
  }
}
