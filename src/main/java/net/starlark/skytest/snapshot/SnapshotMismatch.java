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
package net.starlark.skytest.snapshot;

import com.google.auto.value.AutoValue;

/** A snapshot whose stored text differs from the serialized value it was compared with. */
@AutoValue
public abstract class SnapshotMismatch {

  public abstract String name();

  public abstract String expected();

  public abstract String actual();

  public static SnapshotMismatch create(String name, String expected, String actual) {
    return new AutoValue_SnapshotMismatch(name, expected, actual);
  }

  /** Returns a unified diff from the stored text to the actual one. */
  public String diff() {
    return UnifiedDiff.diff(expected(), actual());
  }
}
