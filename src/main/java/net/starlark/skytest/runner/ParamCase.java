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
 * One case of a parametrized test, read from the {@code __test_params__} dict. The case dict is
 * passed to the test function as its first argument.
 */
@AutoValue
public abstract class ParamCase {

  public static final String GLOBAL_NAME = "__test_params__";

  /** The case's {@code "name"} entry, or its position in the case list. */
  public abstract String name();

  public abstract Map<?, ?> values();

  public static ParamCase create(String name, Map<?, ?> values) {
    return new AutoValue_ParamCase(name, values);
  }

  /** Returns the name under which this case of {@code testName} is reported. */
  public String displayName(String testName) {
    return testName + "[" + name() + "]";
  }

  /**
   * Returns the cases declared by a file, keyed by test name. Elements that are not dicts are
   * skipped but still count towards the index of later cases; tests with no valid case are
   * omitted.
   */
  static ImmutableMap<String, ImmutableList<ParamCase>> fromNamespace(Namespace globals) {
    Map<?, ?> params = globals.getDict(GLOBAL_NAME);
    if (params == null) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<String, ImmutableList<ParamCase>> result = ImmutableMap.builder();
    for (Map.Entry<?, ?> e : params.entrySet()) {
      if (!(e.getKey() instanceof String) || !(e.getValue() instanceof List)) {
        continue;
      }
      ImmutableList.Builder<ParamCase> cases = ImmutableList.builder();
      int index = 0;
      for (Object c : (List<?>) e.getValue()) {
        if (c instanceof Map) {
          Map<?, ?> dict = (Map<?, ?>) c;
          Object name = dict.get("name");
          cases.add(create(name instanceof String ? (String) name : Integer.toString(index), dict));
        }
        index++;
      }
      ImmutableList<ParamCase> built = cases.build();
      if (!built.isEmpty()) {
        result.put((String) e.getKey(), built);
      }
    }
    return result.buildKeepingLast();
  }
}
