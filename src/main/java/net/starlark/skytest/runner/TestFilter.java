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
package net.starlark.skytest.runner;

import com.google.common.collect.ImmutableList;
import java.util.Locale;

/** Decides which tests of a file run, from the name and marker settings of {@link TestOptions}. */
final class TestFilter {

  private static final String NOT = "not ";

  private final ImmutableList<String> testNames;
  private final String nameFilter;
  private final boolean negateName;
  private final String marker;
  private final boolean negateMarker;

  TestFilter(TestOptions options) {
    this.testNames = options.testNames();
    String filter = options.filter();
    this.negateName = filter.toLowerCase(Locale.ROOT).startsWith(NOT);
    this.nameFilter =
        (negateName ? filter.substring(NOT.length()) : filter).trim().toLowerCase(Locale.ROOT);
    String markerFilter = options.markerFilter().trim();
    this.negateMarker = markerFilter.toLowerCase(Locale.ROOT).startsWith(NOT);
    this.marker = negateMarker ? markerFilter.substring(NOT.length()).trim() : markerFilter;
  }

  /**
   * Reports whether a test or case name is selected. An explicit list of names takes precedence
   * over the substring filter.
   */
  boolean matchesName(String name) {
    if (!testNames.isEmpty()) {
      return testNames.contains(name);
    }
    if (nameFilter.isEmpty()) {
      return true;
    }
    return name.toLowerCase(Locale.ROOT).contains(nameFilter) != negateName;
  }

  /** Reports whether a parametrized case is selected, by its own name or its test's name. */
  boolean matchesCase(String testName, String caseName) {
    if (!testNames.isEmpty()) {
      return testNames.contains(caseName) || testNames.contains(testName);
    }
    return matchesName(caseName);
  }

  /** Reports whether a test's markers satisfy the marker filter. */
  boolean matchesMarkers(TestMeta meta) {
    if (marker.isEmpty()) {
      return true;
    }
    return meta.hasMarker(marker) != negateMarker;
  }
}
