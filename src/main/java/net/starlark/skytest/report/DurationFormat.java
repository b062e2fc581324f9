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

import java.time.Duration;
import java.util.Locale;

/** Short human-readable durations, rounded to the millisecond. */
final class DurationFormat {

  private DurationFormat() {}

  static String format(Duration duration) {
    long millis = duration.toMillis();
    if (millis < 1000) {
      return millis + "ms";
    }
    if (millis < 60_000) {
      String seconds = String.format(Locale.ROOT, "%.3f", millis / 1000.0);
      // 1.500 -> 1.5
      seconds = seconds.replaceAll("0+$", "").replaceAll("\\.$", "");
      return seconds + "s";
    }
    return String.format(Locale.ROOT, "%dm%ds", millis / 60_000, (millis % 60_000) / 1000);
  }

  static String seconds(Duration duration) {
    return String.format(Locale.ROOT, "%.3f", duration.toNanos() / 1e9);
  }
}
