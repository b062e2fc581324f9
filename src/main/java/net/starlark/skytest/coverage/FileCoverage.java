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
package net.starlark.skytest.coverage;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.TreeMap;

/** Line and function hit counts for one file. A line with zero hits is known but not covered. */
@AutoValue
public abstract class FileCoverage {

  public abstract String path();

  public abstract ImmutableSortedMap<Integer, Long> lineHits();

  public abstract ImmutableSortedMap<String, Long> functionHits();

  public static FileCoverage create(
      String path, Map<Integer, Long> lineHits, Map<String, Long> functionHits) {
    return new AutoValue_FileCoverage(
        path, ImmutableSortedMap.copyOf(lineHits), ImmutableSortedMap.copyOf(functionHits));
  }

  public int totalLines() {
    return lineHits().size();
  }

  public int coveredLines() {
    return (int) lineHits().values().stream().filter(hits -> hits > 0).count();
  }

  /** Returns the percentage of covered lines; a file with no known lines is fully covered. */
  public double percentage() {
    return totalLines() == 0 ? 100.0 : 100.0 * coveredLines() / totalLines();
  }

  /** Returns the sum of this and another coverage of the same file. */
  public FileCoverage merge(FileCoverage other) {
    Map<Integer, Long> lines = new TreeMap<>(lineHits());
    other.lineHits().forEach((line, hits) -> lines.merge(line, hits, Long::sum));
    Map<String, Long> functions = new TreeMap<>(functionHits());
    other.functionHits().forEach((fn, hits) -> functions.merge(fn, hits, Long::sum));
    return create(path(), lines, functions);
  }
}
