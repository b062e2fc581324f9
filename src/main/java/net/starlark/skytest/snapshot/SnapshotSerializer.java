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

import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.engine.Starlark;
import net.starlark.skytest.engine.StarlarkStruct;
import net.starlark.skytest.engine.Tuple;

/**
 * Renders a Starlark value as deterministic text for snapshot files. Containers are written one
 * element per line with two-space indentation; dict keys, set elements and struct fields are
 * sorted so that the output does not depend on insertion order.
 */
public final class SnapshotSerializer {

  private SnapshotSerializer() {}

  /** Orders values by type name, then by Starlark ordering, then by repr. */
  private static final Comparator<Object> VALUE_ORDER =
      (x, y) -> {
        int byType = Starlark.type(x).compareTo(Starlark.type(y));
        if (byType != 0) {
          return byType;
        }
        try {
          return Starlark.compare(x, y);
        } catch (EvalException e) {
          return Starlark.repr(x).compareTo(Starlark.repr(y));
        }
      };

  public static String serialize(Object value) {
    StringBuilder out = new StringBuilder();
    write(out, value, 0);
    return out.toString();
  }

  private static void write(StringBuilder out, Object value, int indent) {
    if (value == null || value == Starlark.NONE) {
      out.append("None");
    } else if (value instanceof Boolean || value instanceof Number || value instanceof String) {
      Starlark.repr(out, value);
    } else if (value instanceof List) {
      writeElements(out, "[", (List<?>) value, "]", indent);
    } else if (value instanceof Tuple) {
      Tuple tuple = (Tuple) value;
      if (tuple.size() == 1) {
        out.append('(');
        write(out, tuple.get(0), indent);
        out.append(",)");
      } else {
        writeElements(out, "(", tuple.asList(), ")", indent);
      }
    } else if (value instanceof Map) {
      writeDict(out, (Map<?, ?>) value, indent);
    } else if (value instanceof Set) {
      if (((Set<?>) value).isEmpty()) {
        out.append("set()");
      } else {
        writeElements(out, "set([", sorted((Set<?>) value), "])", indent);
      }
    } else if (value instanceof StarlarkStruct && Starlark.type(value).equals("struct")) {
      writeStruct(out, (StarlarkStruct) value, indent);
    } else {
      out.append('<').append(Starlark.type(value)).append(": ");
      Starlark.repr(out, value);
      out.append('>');
    }
  }

  private static void writeElements(
      StringBuilder out, String open, Collection<?> elems, String close, int indent) {
    if (elems.isEmpty()) {
      out.append(open).append(close);
      return;
    }
    String pad = Strings.repeat("  ", indent);
    out.append(open).append('\n');
    for (Object elem : elems) {
      out.append(pad).append("  ");
      write(out, elem, indent + 1);
      out.append(",\n");
    }
    out.append(pad).append(close);
  }

  private static void writeDict(StringBuilder out, Map<?, ?> dict, int indent) {
    if (dict.isEmpty()) {
      out.append("{}");
      return;
    }
    String pad = Strings.repeat("  ", indent);
    out.append("{\n");
    for (Object key : sorted(dict.keySet())) {
      out.append(pad).append("  ");
      write(out, key, indent + 1);
      out.append(": ");
      write(out, dict.get(key), indent + 1);
      out.append(",\n");
    }
    out.append(pad).append('}');
  }

  private static void writeStruct(StringBuilder out, StarlarkStruct struct, int indent) {
    String pad = Strings.repeat("  ", indent);
    out.append("struct(\n");
    for (Object field : sorted(struct.getFieldNames())) {
      out.append(pad).append("  ").append(field).append(" = ");
      write(out, struct.getValue((String) field), indent + 1);
      out.append(",\n");
    }
    out.append(pad).append(')');
  }

  private static List<Object> sorted(Collection<?> values) {
    List<Object> list = new ArrayList<>(values);
    list.sort(VALUE_ORDER);
    return list;
  }
}
