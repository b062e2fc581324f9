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

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nullable;

/** An immutable snapshot of the coverage collected for a set of files. */
public final class CoverageReport {

  private static final CoverageReport EMPTY = new CoverageReport(ImmutableSortedMap.of());

  private final ImmutableSortedMap<String, FileCoverage> files;

  private CoverageReport(ImmutableSortedMap<String, FileCoverage> files) {
    this.files = files;
  }

  public static CoverageReport empty() {
    return EMPTY;
  }

  public static CoverageReport of(Map<String, FileCoverage> files) {
    return new CoverageReport(ImmutableSortedMap.copyOf(files));
  }

  /** Returns the per-file coverage, keyed and sorted by path. */
  public ImmutableSortedMap<String, FileCoverage> files() {
    return files;
  }

  @Nullable
  public FileCoverage getFile(String path) {
    return files.get(path);
  }

  public int totalLines() {
    return files.values().stream().mapToInt(FileCoverage::totalLines).sum();
  }

  public int coveredLines() {
    return files.values().stream().mapToInt(FileCoverage::coveredLines).sum();
  }

  public double percentage() {
    int total = totalLines();
    return total == 0 ? 100.0 : 100.0 * coveredLines() / total;
  }

  /** Returns a report holding the summed hit counts of this report and {@code other}. */
  public CoverageReport merge(CoverageReport other) {
    Map<String, FileCoverage> merged = new TreeMap<>(files);
    other.files.forEach((path, coverage) -> merged.merge(path, coverage, FileCoverage::merge));
    return of(merged);
  }
}
