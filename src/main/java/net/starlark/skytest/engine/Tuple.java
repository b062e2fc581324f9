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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Iterator;

/** A Starlark tuple: an immutable, fixed-length sequence. */
public final class Tuple implements StarlarkValue, Iterable<Object> {

  private static final Tuple EMPTY = new Tuple(ImmutableList.of());

  private final ImmutableList<Object> elems;

  private Tuple(ImmutableList<Object> elems) {
    this.elems = elems;
  }

  /** Returns the empty tuple. */
  public static Tuple empty() {
    return EMPTY;
  }

  public static Tuple of(Object... elems) {
    return elems.length == 0 ? EMPTY : new Tuple(ImmutableList.copyOf(Arrays.asList(elems)));
  }

  public static Tuple copyOf(Iterable<?> elems) {
    ImmutableList<Object> list = ImmutableList.copyOf(elems);
    return list.isEmpty() ? EMPTY : new Tuple(list);
  }

  public int size() {
    return elems.size();
  }

  public Object get(int i) {
    return elems.get(i);
  }

  public boolean isEmpty() {
    return elems.isEmpty();
  }

  /** Returns the elements as an immutable list. */
  public ImmutableList<Object> asList() {
    return elems;
  }

  @Override
  public Iterator<Object> iterator() {
    return elems.iterator();
  }

  @Override
  public String getTypeName() {
    return "tuple";
  }

  @Override
  public boolean truth() {
    return !elems.isEmpty();
  }

  @Override
  public void repr(StringBuilder out) {
    out.append('(');
    String sep = "";
    for (Object x : elems) {
      out.append(sep);
      Starlark.repr(out, x);
      sep = ", ";
    }
    if (elems.size() == 1) {
      out.append(',');
    }
    out.append(')');
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof Tuple && Starlark.equal(this, that);
  }

  @Override
  public int hashCode() {
    return elems.hashCode();
  }

  @Override
  public String toString() {
    return Starlark.repr(this);
  }
}
