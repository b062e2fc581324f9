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

/** No fixture or built-in value matches a requested parameter name. */
public final class FixtureNotFoundException extends FixtureException {
  private final String fixtureName;

  public FixtureNotFoundException(String fixtureName) {
    super(String.format("fixture \"%s\" not found", fixtureName));
    this.fixtureName = fixtureName;
  }

  public String getFixtureName() {
    return fixtureName;
  }
}
