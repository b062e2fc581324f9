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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A fixture depends, directly or transitively, on itself. */
public final class FixtureCycleException extends FixtureException {
  private final ImmutableList<String> cycle;

  /** @param cycle the fixtures on the cycle, starting and ending with the same name */
  public FixtureCycleException(List<String> cycle) {
    super("fixture dependency cycle: " + Joiner.on(" -> ").join(cycle));
    this.cycle = ImmutableList.copyOf(cycle);
  }

  public ImmutableList<String> getCycle() {
    return cycle;
  }
}
