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
package net.starlark.skytest.report;

import com.google.common.base.Ascii;

/** The supported report formats. */
public enum OutputFormat {
  TEXT,
  JSON,
  JUNIT,
  MARKDOWN,
  GITHUB;

  /** Returns the format named {@code name}, ignoring case. */
  public static OutputFormat fromName(String name) {
    for (OutputFormat format : values()) {
      if (format.name().equals(Ascii.toUpperCase(name))) {
        return format;
      }
    }
    throw new IllegalArgumentException("unknown output format: " + name);
  }

  public Reporter newReporter(boolean verbose) {
    switch (this) {
      case TEXT:
        return new TextReporter(verbose, /* showDuration= */ true);
      case JSON:
        return new JsonReporter();
      case JUNIT:
        return new JUnitReporter();
      case MARKDOWN:
        return new MarkdownReporter();
      case GITHUB:
        return new GitHubReporter();
    }
    throw new AssertionError(this);
  }
}
