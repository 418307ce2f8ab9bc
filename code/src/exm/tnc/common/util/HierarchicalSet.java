/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.tnc.common.util;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A set that allows cheap creation of child scopes.  Lookups see the
 * elements of this scope and all enclosing scopes; additions only affect
 * this scope.  Used to track which index variables are bound while walking
 * down a statement.
 */
public class HierarchicalSet<T> {
  private final HierarchicalSet<T> parent;
  private final Set<T> set;

  private HierarchicalSet(HierarchicalSet<T> parent) {
    this.parent = parent;
    this.set = new HashSet<T>();
  }

  public HierarchicalSet() {
    this(null);
  }

  /**
   * Make a new hierarchical set with this as the parent
   * @return
   */
  public HierarchicalSet<T> makeChild() {
    return new HierarchicalSet<T>(this);
  }

  public HierarchicalSet<T> getParent() {
    return parent;
  }

  public boolean add(T e) {
    return set.add(e);
  }

  public boolean contains(Object o) {
    HierarchicalSet<T> curr = this;
    while (curr != null) {
      if (curr.set.contains(o)) {
        return true;
      }
      curr = curr.parent;
    }
    return false;
  }

  /**
   * Check this scope and enclosing scopes, stopping after scope stop.
   * @param o
   * @param stop an ancestor of this set, or this set.  If not an ancestor,
   *        behaves like {@link #contains(Object)}
   * @return true if found in a scope between this and stop inclusive
   */
  public boolean containsUpTo(Object o, HierarchicalSet<T> stop) {
    HierarchicalSet<T> curr = this;
    while (curr != null) {
      if (curr.set.contains(o)) {
        return true;
      }
      if (curr == stop) {
        return false;
      }
      curr = curr.parent;
    }
    return false;
  }

  /**
   * @return true if element was added directly to this scope
   */
  public boolean containsLocal(Object o) {
    return set.contains(o);
  }

  public boolean isEmpty() {
    HierarchicalSet<T> curr = this;
    while (curr != null) {
      if (!curr.set.isEmpty()) {
        return false;
      }
      curr = curr.parent;
    }
    return true;
  }

  public int size() {
    int parentSize = parent == null ? 0 : parent.size();
    return set.size() + parentSize;
  }

  /**
   * @return all elements, outermost scope first
   */
  public List<T> toList() {
    List<T> res = parent == null ? new ArrayList<T>() : parent.toList();
    res.addAll(set);
    return res;
  }

  @Override
  public String toString() {
    StringBuilder accum = new StringBuilder();
    accum.append("{");
    boolean first = true;
    for (T i: toList()) {
      if (first) {
        first = false;
      } else {
        accum.append(",");
      }
      accum.append(i);
    }
    accum.append("}");
    return accum.toString();
  }
}
