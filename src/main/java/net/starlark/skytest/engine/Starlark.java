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

import com.google.errorprone.annotations.FormatMethod;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The Starlark class defines the operations on Starlark values that the test framework relies on:
 * truth, type, repr, equality, ordering and length. Values follow the model shared with the
 * execution engine: {@link #NONE}, {@link Boolean}, {@link String}, integral {@link Number}s,
 * {@link Double}, {@link List}, {@link Tuple}, {@link Map}, {@link Set}, {@link Structure} and
 * {@link StarlarkCallable}.
 */
public final class Starlark {

  private Starlark() {} // uninstantiable

  /** The Starlark None value. */
  public static final NoneType NONE = NoneType.NONE;

  /** Returns the truth value of a value, as if by the Starlark expression {@code bool(x)}. */
  public static boolean truth(Object x) {
    if (x == null || x == NONE) {
      return false;
    } else if (x instanceof Boolean) {
      return (Boolean) x;
    } else if (x instanceof Double) {
      return (Double) x != 0.0;
    } else if (x instanceof Number) {
      return isIntegral((Number) x) && toBigInteger((Number) x).signum() != 0;
    } else if (x instanceof String) {
      return !((String) x).isEmpty();
    } else if (x instanceof Collection) {
      return !((Collection<?>) x).isEmpty();
    } else if (x instanceof Map) {
      return !((Map<?, ?>) x).isEmpty();
    } else if (x instanceof StarlarkValue) {
      return ((StarlarkValue) x).truth();
    }
    return true;
  }

  /** Returns the name of the type of a value as if by the Starlark expression {@code type(x)}. */
  public static String type(Object x) {
    if (x == null || x == NONE) {
      return "NoneType";
    } else if (x instanceof Boolean) {
      return "bool";
    } else if (x instanceof Double || x instanceof Float) {
      return "float";
    } else if (x instanceof Number) {
      return "int";
    } else if (x instanceof String) {
      return "string";
    } else if (x instanceof StarlarkValue) {
      return ((StarlarkValue) x).getTypeName();
    } else if (x instanceof List) {
      return "list";
    } else if (x instanceof Map) {
      return "dict";
    } else if (x instanceof Set) {
      return "set";
    } else if (x instanceof StarlarkCallable) {
      return "function";
    }
    return x.getClass().getSimpleName();
  }

  /** Returns the string form of a value as if by the Starlark expression {@code repr(x)}. */
  public static String repr(Object x) {
    StringBuilder buf = new StringBuilder();
    repr(buf, x);
    return buf.toString();
  }

  /** Returns the string form of a value as if by the Starlark expression {@code str(x)}. */
  public static String str(Object x) {
    return x instanceof String ? (String) x : repr(x);
  }

  /** Appends the repr of {@code x} to {@code out}. */
  public static void repr(StringBuilder out, Object x) {
    if (x == null || x == NONE) {
      out.append("None");
    } else if (x instanceof Boolean) {
      out.append((Boolean) x ? "True" : "False");
    } else if (x instanceof String) {
      quote(out, (String) x);
    } else if (x instanceof Double || x instanceof Float) {
      double d = ((Number) x).doubleValue();
      if (Double.isNaN(d)) {
        out.append("nan");
      } else if (Double.isInfinite(d)) {
        out.append(d > 0 ? "+inf" : "-inf");
      } else {
        out.append(d);
      }
    } else if (x instanceof Number) {
      out.append(x);
    } else if (x instanceof StarlarkValue) {
      ((StarlarkValue) x).repr(out);
    } else if (x instanceof List) {
      out.append('[');
      appendElements(out, (List<?>) x);
      out.append(']');
    } else if (x instanceof Map) {
      out.append('{');
      String sep = "";
      for (Map.Entry<?, ?> e : ((Map<?, ?>) x).entrySet()) {
        out.append(sep);
        repr(out, e.getKey());
        out.append(": ");
        repr(out, e.getValue());
        sep = ", ";
      }
      out.append('}');
    } else if (x instanceof Set) {
      out.append("set([");
      appendElements(out, (Set<?>) x);
      out.append("])");
    } else if (x instanceof StarlarkCallable) {
      out.append("<function ").append(((StarlarkCallable) x).getName()).append('>');
    } else {
      out.append(x);
    }
  }

  private static void appendElements(StringBuilder out, Iterable<?> elems) {
    String sep = "";
    for (Object elem : elems) {
      out.append(sep);
      repr(out, elem);
      sep = ", ";
    }
  }

  private static void quote(StringBuilder out, String s) {
    out.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          out.append("\\\"");
          break;
        case '\\':
          out.append("\\\\");
          break;
        case '\n':
          out.append("\\n");
          break;
        case '\r':
          out.append("\\r");
          break;
        case '\t':
          out.append("\\t");
          break;
        default:
          if (c < 0x20 || c == 0x7f) {
            out.append(String.format("\\x%02x", (int) c));
          } else {
            out.append(c);
          }
      }
    }
    out.append('"');
  }

  /** Reports whether a number has an integral (int) representation. */
  public static boolean isIntegral(Number n) {
    return n instanceof Integer
        || n instanceof Long
        || n instanceof Short
        || n instanceof Byte
        || n instanceof BigInteger;
  }

  private static BigInteger toBigInteger(Number n) {
    return n instanceof BigInteger ? (BigInteger) n : BigInteger.valueOf(n.longValue());
  }

  /** Reports whether two values are equal as if by the Starlark expression {@code x == y}. */
  public static boolean equal(Object x, Object y) {
    if (x == y) {
      return true;
    }
    if (x == null || y == null) {
      return false;
    }
    if (x instanceof Number && y instanceof Number) {
      Number a = (Number) x;
      Number b = (Number) y;
      if (isIntegral(a) && isIntegral(b)) {
        return toBigInteger(a).equals(toBigInteger(b));
      }
      return a.doubleValue() == b.doubleValue();
    }
    if (x instanceof Tuple && y instanceof Tuple) {
      return sequenceEqual(((Tuple) x).asList(), ((Tuple) y).asList());
    }
    if (x instanceof List && y instanceof List) {
      return sequenceEqual((List<?>) x, (List<?>) y);
    }
    if (x instanceof Map && y instanceof Map) {
      Map<?, ?> a = (Map<?, ?>) x;
      Map<?, ?> b = (Map<?, ?>) y;
      if (a.size() != b.size()) {
        return false;
      }
      for (Map.Entry<?, ?> e : a.entrySet()) {
        if (!b.containsKey(e.getKey()) || !equal(e.getValue(), b.get(e.getKey()))) {
          return false;
        }
      }
      return true;
    }
    return x.equals(y);
  }

  private static boolean sequenceEqual(List<?> x, List<?> y) {
    if (x.size() != y.size()) {
      return false;
    }
    for (int i = 0; i < x.size(); i++) {
      if (!equal(x.get(i), y.get(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Compares two values as if by the Starlark ordering operators. Numbers, strings, booleans and
   * sequences of the same kind are ordered; any other combination is an error.
   */
  public static int compare(Object x, Object y) throws EvalException {
    if (x instanceof Number && y instanceof Number) {
      Number a = (Number) x;
      Number b = (Number) y;
      if (isIntegral(a) && isIntegral(b)) {
        return toBigInteger(a).compareTo(toBigInteger(b));
      }
      return Double.compare(a.doubleValue(), b.doubleValue());
    }
    if (x instanceof String && y instanceof String) {
      return ((String) x).compareTo((String) y);
    }
    if (x instanceof Boolean && y instanceof Boolean) {
      return Boolean.compare((Boolean) x, (Boolean) y);
    }
    if (x instanceof Tuple && y instanceof Tuple) {
      return compareSequences(((Tuple) x).asList(), ((Tuple) y).asList());
    }
    if (x instanceof List && y instanceof List) {
      return compareSequences((List<?>) x, (List<?>) y);
    }
    throw errorf("unsupported comparison: %s <=> %s", type(x), type(y));
  }

  private static int compareSequences(List<?> x, List<?> y) throws EvalException {
    Iterator<?> i = x.iterator();
    Iterator<?> j = y.iterator();
    while (i.hasNext() && j.hasNext()) {
      Object a = i.next();
      Object b = j.next();
      if (!equal(a, b)) {
        return compare(a, b);
      }
    }
    return Integer.compare(x.size(), y.size());
  }

  /** Returns the length of a sequence, mapping or string, or -1 if the value has no length. */
  public static int len(Object x) {
    if (x instanceof String) {
      return ((String) x).length();
    } else if (x instanceof Collection) {
      return ((Collection<?>) x).size();
    } else if (x instanceof Map) {
      return ((Map<?, ?>) x).size();
    } else if (x instanceof Tuple) {
      return ((Tuple) x).size();
    }
    return -1;
  }

  /**
   * Reports whether {@code item} is in {@code container}, as if by the Starlark expression {@code
   * item in container}.
   */
  public static boolean contains(Object container, Object item) throws EvalException {
    if (container instanceof String) {
      if (!(item instanceof String)) {
        throw errorf("'in <string>' requires string as left operand, not '%s'", type(item));
      }
      return ((String) container).contains((String) item);
    } else if (container instanceof Map) {
      return ((Map<?, ?>) container).containsKey(item);
    } else if (container instanceof Tuple || container instanceof Collection) {
      Iterable<?> elems =
          container instanceof Tuple ? (Tuple) container : (Collection<?>) container;
      for (Object elem : elems) {
        if (equal(elem, item)) {
          return true;
        }
      }
      return false;
    }
    throw errorf("unsupported binary operation: %s in %s", type(item), type(container));
  }

  /** Returns a new EvalException with no location and an error message built from a format. */
  @FormatMethod
  public static EvalException errorf(String format, Object... args) {
    return new EvalException(String.format(format, args));
  }

  /** Returns the value, substituting {@link #NONE} for Java null. */
  public static Object nullToNone(@Nullable Object x) {
    return Objects.requireNonNullElse(x, NONE);
  }
}
