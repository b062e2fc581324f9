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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.starlark.skytest.engine.Namespace;

/**
 * Per-test flags read from the {@code __test_meta__} dict of a test file, for example:
 *
 * <pre>
 * __test_meta__ = {
 *     "test_slow": {"skip": "too slow on CI", "markers": ["slow"]},
 *     "test_bug": {"xfail": True},
 * }
 * </pre>
 *
 * A string value for {@code skip} or {@code xfail} means true and gives the reason.
 */
@AutoValue
public abstract class TestMeta {

  public static final String GLOBAL_NAME = "__test_meta__";

  public static final TestMeta NONE = create(false, "", false, "", ImmutableList.of());

  public abstract boolean skip();

  public abstract String skipReason();

  public abstract boolean xfail();

  public abstract String xfailReason();

  public abstract ImmutableList<String> markers();

  public static TestMeta create(
      boolean skip, String skipReason, boolean xfail, String xfailReason, List<String> markers) {
    return new AutoValue_TestMeta(
        skip, skipReason, xfail, xfailReason, ImmutableList.copyOf(markers));
  }

  /** Reports whether the test carries the marker, ignoring case. */
  public boolean hasMarker(String marker) {
    for (String m : markers()) {
      if (m.equalsIgnoreCase(marker)) {
        return true;
      }
    }
    return false;
  }

  /** Reads one test's metadata dict. Entries of the wrong type are ignored. */
  static TestMeta parse(Map<?, ?> dict) {
    Object skip = dict.get("skip");
    Object xfail = dict.get("xfail");
    ImmutableList.Builder<String> markers = ImmutableList.builder();
    Object markerList = dict.get("markers");
    if (markerList instanceof List) {
      for (Object marker : (List<?>) markerList) {
        if (marker instanceof String) {
          markers.add((String) marker);
        }
      }
    }
    return create(flag(skip), reason(skip), flag(xfail), reason(xfail), markers.build());
  }

  private static boolean flag(Object value) {
    return value instanceof String || Boolean.TRUE.equals(value);
  }

  private static String reason(Object value) {
    return value instanceof String ? (String) value : "";
  }

  /** Returns the metadata declared by a file, keyed by test name. */
  static ImmutableMap<String, TestMeta> fromNamespace(Namespace globals) {
    Map<?, ?> meta = globals.getDict(GLOBAL_NAME);
    if (meta == null) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<String, TestMeta> result = ImmutableMap.builder();
    for (Map.Entry<?, ?> e : meta.entrySet()) {
      if (e.getKey() instanceof String && e.getValue() instanceof Map) {
        result.put((String) e.getKey(), parse((Map<?, ?>) e.getValue()));
      }
    }
    return result.buildKeepingLast();
  }
}
