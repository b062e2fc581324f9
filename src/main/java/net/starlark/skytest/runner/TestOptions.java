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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import net.starlark.skytest.discovery.TestDiscovery;

/** Configuration of a {@link TestRunner}. */
@AutoValue
public abstract class TestOptions {

  /** Prefix that identifies test functions. */
  public abstract String testPrefix();

  /**
   * Substring that test names must contain, case-insensitively, or {@code not <substring>} to
   * exclude. Empty matches everything. Ignored when {@link #testNames} is set.
   */
  public abstract String filter();

  /** Marker that tests must carry, or {@code not <marker>} to exclude. Empty matches everything. */
  public abstract String markerFilter();

  /** If non-empty, only these tests (or parametrized cases) run. */
  public abstract ImmutableList<String> testNames();

  /** Files whose globals are predeclared in every test file, in load order. */
  public abstract ImmutableList<String> preludes();

  /** Per-test timeout; zero disables it. */
  public abstract Duration timeout();

  public abstract boolean failFast();

  public abstract boolean updateSnapshots();

  public abstract boolean coverage();

  /** Extra values predeclared in every test file. */
  public abstract ImmutableMap<String, Object> predeclared();

  /** Leaves out the built-in {@code assert} module. */
  public abstract boolean disableAssert();

  public abstract boolean verbose();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_TestOptions.Builder()
        .setTestPrefix(TestDiscovery.DEFAULT_TEST_PREFIX)
        .setFilter("")
        .setMarkerFilter("")
        .setTestNames(ImmutableList.of())
        .setPreludes(ImmutableList.of())
        .setTimeout(Duration.ZERO)
        .setFailFast(false)
        .setUpdateSnapshots(false)
        .setCoverage(false)
        .setPredeclared(ImmutableMap.of())
        .setDisableAssert(false)
        .setVerbose(false);
  }

  public static TestOptions defaults() {
    return builder().build();
  }

  /** Builder for {@link TestOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setTestPrefix(String value);

    public abstract Builder setFilter(String value);

    public abstract Builder setMarkerFilter(String value);

    public abstract Builder setTestNames(List<String> value);

    public abstract Builder setPreludes(List<String> value);

    public abstract Builder setTimeout(Duration value);

    public abstract Builder setFailFast(boolean value);

    public abstract Builder setUpdateSnapshots(boolean value);

    public abstract Builder setCoverage(boolean value);

    public abstract Builder setPredeclared(Map<String, Object> value);

    public abstract Builder setDisableAssert(boolean value);

    public abstract Builder setVerbose(boolean value);

    abstract String testPrefix();

    abstract Duration timeout();

    abstract TestOptions autoBuild();

    public TestOptions build() {
      if (testPrefix().isEmpty()) {
        setTestPrefix(TestDiscovery.DEFAULT_TEST_PREFIX);
      }
      Preconditions.checkArgument(!timeout().isNegative(), "negative timeout: %s", timeout());
      return autoBuild();
    }
  }
}
