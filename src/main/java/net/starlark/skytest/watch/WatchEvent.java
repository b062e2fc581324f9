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
package net.starlark.skytest.watch;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.Collection;

/** A change to a watched file and the test files it affects. */
@AutoValue
public abstract class WatchEvent {

  /** The absolute path that changed. */
  public abstract Path file();

  /** The affected test files, sorted. */
  public abstract ImmutableList<Path> affectedTests();

  static WatchEvent create(Path file, Collection<Path> affectedTests) {
    return new AutoValue_WatchEvent(file, ImmutableList.sortedCopyOf(affectedTests));
  }
}
