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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TestFilterTest {

  private static final TestMeta SLOW =
      TestMeta.create(false, "", false, "", ImmutableList.of("Slow"));

  private static TestFilter filter(TestOptions.Builder options) {
    return new TestFilter(options.build());
  }

  @Test
  public void emptyFilterMatchesEverything() {
    TestFilter filter = filter(TestOptions.builder());

    assertThat(filter.matchesName("test_anything")).isTrue();
    assertThat(filter.matchesMarkers(TestMeta.NONE)).isTrue();
    assertThat(filter.matchesCase("test_p", "test_p[0]")).isTrue();
  }

  @Test
  public void substringIgnoresCase() {
    TestFilter filter = filter(TestOptions.builder().setFilter("Parse"));

    assertThat(filter.matchesName("test_parse_int")).isTrue();
    assertThat(filter.matchesName("test_format")).isFalse();
  }

  @Test
  public void negatedSubstring() {
    TestFilter filter = filter(TestOptions.builder().setFilter("NOT parse"));

    assertThat(filter.matchesName("test_parse_int")).isFalse();
    assertThat(filter.matchesName("test_format")).isTrue();
  }

  @Test
  public void explicitNamesOverrideSubstring() {
    TestFilter filter =
        filter(
            TestOptions.builder()
                .setFilter("parse")
                .setTestNames(ImmutableList.of("test_format", "test_p[one]")));

    assertThat(filter.matchesName("test_format")).isTrue();
    assertThat(filter.matchesName("test_parse_int")).isFalse();
    assertThat(filter.matchesCase("test_p", "test_p[one]")).isTrue();
    assertThat(filter.matchesCase("test_p", "test_p[two]")).isFalse();
  }

  @Test
  public void caseSelectedByTestName() {
    TestFilter filter = filter(TestOptions.builder().setTestNames(ImmutableList.of("test_p")));

    assertThat(filter.matchesCase("test_p", "test_p[two]")).isTrue();
  }

  @Test
  public void markers() {
    TestFilter slow = filter(TestOptions.builder().setMarkerFilter("slow"));
    TestFilter notSlow = filter(TestOptions.builder().setMarkerFilter(" not slow "));

    assertThat(slow.matchesMarkers(SLOW)).isTrue();
    assertThat(slow.matchesMarkers(TestMeta.NONE)).isFalse();
    assertThat(notSlow.matchesMarkers(SLOW)).isFalse();
    assertThat(notSlow.matchesMarkers(TestMeta.NONE)).isTrue();
  }
}
