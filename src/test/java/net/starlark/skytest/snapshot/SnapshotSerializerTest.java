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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import net.starlark.skytest.engine.Starlark;
import net.starlark.skytest.engine.StarlarkStruct;
import net.starlark.skytest.engine.Tuple;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SnapshotSerializerTest {

  @Test
  public void scalars() {
    assertThat(SnapshotSerializer.serialize(Starlark.NONE)).isEqualTo("None");
    assertThat(SnapshotSerializer.serialize(true)).isEqualTo("True");
    assertThat(SnapshotSerializer.serialize(42)).isEqualTo("42");
    assertThat(SnapshotSerializer.serialize("hi\n")).isEqualTo("\"hi\\n\"");
  }

  @Test
  public void nestedContainers_oneElementPerLine() {
    Map<String, Object> dict = new LinkedHashMap<>();
    dict.put("b", 1);
    dict.put("a", ImmutableList.of(1, 2));

    assertThat(SnapshotSerializer.serialize(dict))
        .isEqualTo("{\n  \"a\": [\n    1,\n    2,\n  ],\n  \"b\": 1,\n}");
  }

  @Test
  public void dictOrderDoesNotMatter() {
    Map<String, Object> first = new LinkedHashMap<>();
    first.put("x", 1);
    first.put("y", 2);
    Map<String, Object> second = new LinkedHashMap<>();
    second.put("y", 2);
    second.put("x", 1);

    assertThat(SnapshotSerializer.serialize(first))
        .isEqualTo(SnapshotSerializer.serialize(second));
  }

  @Test
  public void mixedKeysSortByTypeFirst() {
    Map<Object, Object> dict = new LinkedHashMap<>();
    dict.put("a", 1);
    dict.put(2, 1);
    assertThat(SnapshotSerializer.serialize(dict)).isEqualTo("{\n  2: 1,\n  \"a\": 1,\n}");
  }

  @Test
  public void tuplesAndSets() {
    assertThat(SnapshotSerializer.serialize(Tuple.of(1))).isEqualTo("(1,)");
    assertThat(SnapshotSerializer.serialize(Tuple.empty())).isEqualTo("()");
    assertThat(SnapshotSerializer.serialize(Tuple.of(1, 2))).isEqualTo("(\n  1,\n  2,\n)");
    assertThat(SnapshotSerializer.serialize(ImmutableSet.of())).isEqualTo("set()");
    assertThat(SnapshotSerializer.serialize(ImmutableSet.of(3, 1)))
        .isEqualTo("set([\n  1,\n  3,\n])");
  }

  @Test
  public void structsSortFields() {
    StarlarkStruct struct = StarlarkStruct.create(ImmutableMap.of("y", 2, "x", "s"));
    assertThat(SnapshotSerializer.serialize(struct))
        .isEqualTo("struct(\n  x = \"s\",\n  y = 2,\n)");
  }

  @Test
  public void otherValuesShowTypeAndRepr() {
    StarlarkStruct module = StarlarkStruct.module("m", ImmutableMap.of());
    assertThat(SnapshotSerializer.serialize(module)).isEqualTo("<module: <module \"m\">>");
  }
}
