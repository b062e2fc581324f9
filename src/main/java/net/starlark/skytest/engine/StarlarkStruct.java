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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * An immutable {@link Structure} backed by a map of fields. Values created with {@link #create}
 * have type {@code struct}; values created with {@link #module} have type {@code module} and are
 * used for the built-in namespaces such as {@code assert}.
 */
public final class StarlarkStruct implements Structure {

  private final String typeName;
  @Nullable private final String moduleName;
  private final ImmutableMap<String, Object> fields;

  private StarlarkStruct(
      String typeName, @Nullable String moduleName, ImmutableMap<String, Object> fields) {
    this.typeName = typeName;
    this.moduleName = moduleName;
    this.fields = fields;
  }

  /** Returns a struct whose fields are sorted by name, as {@code struct(**kwargs)} does. */
  public static StarlarkStruct create(Map<String, ?> fields) {
    return new StarlarkStruct("struct", null, ImmutableSortedMap.copyOf(fields));
  }

  /** Returns a named module whose members are kept in declaration order. */
  public static StarlarkStruct module(String name, Map<String, ?> members) {
    return new StarlarkStruct(
        "module", Preconditions.checkNotNull(name), ImmutableMap.copyOf(members));
  }

  @Override
  public ImmutableCollection<String> getFieldNames() {
    return fields.keySet();
  }

  @Override
  @Nullable
  public Object getValue(String name) {
    return fields.get(name);
  }

  @Override
  public String getTypeName() {
    return typeName;
  }

  @Override
  public void repr(StringBuilder out) {
    if (moduleName != null) {
      out.append("<module \"").append(moduleName).append("\">");
      return;
    }
    out.append("struct(");
    String sep = "";
    for (Map.Entry<String, Object> e : fields.entrySet()) {
      out.append(sep).append(e.getKey()).append(" = ");
      Starlark.repr(out, e.getValue());
      sep = ", ";
    }
    out.append(')');
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof StarlarkStruct)) {
      return false;
    }
    StarlarkStruct other = (StarlarkStruct) that;
    if (moduleName != null || other.moduleName != null) {
      return this == other;
    }
    if (!fields.keySet().equals(other.fields.keySet())) {
      return false;
    }
    for (Map.Entry<String, Object> e : fields.entrySet()) {
      if (!Starlark.equal(e.getValue(), other.fields.get(e.getKey()))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return moduleName != null ? System.identityHashCode(this) : fields.keySet().hashCode();
  }

  @Override
  public String toString() {
    return Starlark.repr(this);
  }
}
