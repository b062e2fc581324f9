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
package net.starlark.skytest.engine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Starlark} value operations. */
@RunWith(JUnit4.class)
public final class StarlarkTest {

  @Test
  public void repr_quotesAndNests() {
    assertThat(Starlark.repr("a\"b\n")).isEqualTo("\"a\\\"b\\n\"");
    assertThat(Starlark.repr(ImmutableList.of(1, "x", true))).isEqualTo("[1, \"x\", True]");
    assertThat(Starlark.repr(ImmutableMap.of("k", Starlark.NONE))).isEqualTo("{\"k\": None}");
    assertThat(Starlark.repr(Tuple.of(1))).isEqualTo("(1,)");
    assertThat(Starlark.repr(Tuple.of(1, 2))).isEqualTo("(1, 2)");
    assertThat(Starlark.repr(ImmutableSet.of(3))).isEqualTo("set([3])");
  }

  @Test
  public void str_leavesStringsUnquoted() {
    assertThat(Starlark.str("plain")).isEqualTo("plain");
    assertThat(Starlark.str(1.5)).isEqualTo("1.5");
  }

  @Test
  public void type_namesValues() {
    assertThat(Starlark.type(Starlark.NONE)).isEqualTo("NoneType");
    assertThat(Starlark.type(1)).isEqualTo("int");
    assertThat(Starlark.type(2.0)).isEqualTo("float");
    assertThat(Starlark.type("s")).isEqualTo("string");
    assertThat(Starlark.type(ImmutableList.of())).isEqualTo("list");
    assertThat(Starlark.type(ImmutableMap.of())).isEqualTo("dict");
    assertThat(Starlark.type(Tuple.empty())).isEqualTo("tuple");
    assertThat(Starlark.type(StarlarkStruct.create(ImmutableMap.of()))).isEqualTo("struct");
  }

  @Test
  public void truth() {
    assertThat(Starlark.truth(Starlark.NONE)).isFalse();
    assertThat(Starlark.truth(0)).isFalse();
    assertThat(Starlark.truth(0L)).isFalse();
    assertThat(Starlark.truth("")).isFalse();
    assertThat(Starlark.truth(ImmutableList.of())).isFalse();
    assertThat(Starlark.truth(Tuple.empty())).isFalse();
    assertThat(Starlark.truth(7)).isTrue();
    assertThat(Starlark.truth(ImmutableMap.of("a", 1))).isTrue();
  }

  @Test
  public void equal_normalizesNumbers() {
    assertThat(Starlark.equal(1, 1L)).isTrue();
    assertThat(Starlark.equal(1, 1.0)).isTrue();
    assertThat(Starlark.equal(ImmutableList.of(1, 2), ImmutableList.of(1L, 2L))).isTrue();
    assertThat(Starlark.equal(ImmutableMap.of("a", 1), ImmutableMap.of("a", 1L))).isTrue();
    assertThat(Starlark.equal(Tuple.of(1), ImmutableList.of(1))).isFalse();
    assertThat(Starlark.equal("1", 1)).isFalse();
  }

  @Test
  public void compare() throws Exception {
    assertThat(Starlark.compare(1, 2L)).isLessThan(0);
    assertThat(Starlark.compare("b", "a")).isGreaterThan(0);
    assertThat(Starlark.compare(ImmutableList.of(1, 2), ImmutableList.of(1))).isGreaterThan(0);
    EvalException e = assertThrows(EvalException.class, () -> Starlark.compare(1, "a"));
    assertThat(e).hasMessageThat().contains("unsupported comparison: int <=> string");
  }

  @Test
  public void lenAndContains() throws Exception {
    assertThat(Starlark.len("abc")).isEqualTo(3);
    assertThat(Starlark.len(Tuple.of(1, 2))).isEqualTo(2);
    assertThat(Starlark.len(5)).isEqualTo(-1);
    assertThat(Starlark.contains("hello", "ell")).isTrue();
    assertThat(Starlark.contains(ImmutableList.of(1, 2), 2L)).isTrue();
    assertThat(Starlark.contains(ImmutableMap.of("k", 1), "k")).isTrue();
    assertThrows(EvalException.class, () -> Starlark.contains("hello", 1));
  }
}
