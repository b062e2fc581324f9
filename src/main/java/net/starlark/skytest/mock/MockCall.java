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
package net.starlark.skytest.mock;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.starlark.skytest.engine.Tuple;

/** One recorded invocation of a mock. */
@AutoValue
public abstract class MockCall {

  public abstract Tuple args();

  public abstract ImmutableMap<String, Object> kwargs();

  public static MockCall create(Tuple args, Map<String, Object> kwargs) {
    return new AutoValue_MockCall(args, ImmutableMap.copyOf(kwargs));
  }

  /** Returns the call as a Starlark dict with keys {@code args} and {@code kwargs}. */
  public Map<String, Object> toDict() {
    Map<String, Object> dict = new LinkedHashMap<>();
    dict.put("args", args());
    dict.put("kwargs", new LinkedHashMap<>(kwargs()));
    return dict;
  }
}
