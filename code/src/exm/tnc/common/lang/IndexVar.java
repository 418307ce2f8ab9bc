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
package exm.tnc.common.lang;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Index variables are used to index into tensors in index expressions, and
 * they represent iteration over the tensor modes they index into.
 *
 * Each index variable is distinct from every other: two variables created
 * with the same name are different variables.  The name is only used for
 * printing.
 */
public class IndexVar implements Comparable<IndexVar> {
  private static final AtomicLong nextId = new AtomicLong(0);

  private final long id;
  private final String name;

  public IndexVar() {
    this(null);
  }

  /**
   * @param name name to print, or null to generate one
   */
  public IndexVar(String name) {
    this.id = nextId.getAndIncrement();
    this.name = name != null ? name : "i" + id;
  }

  public String getName() {
    return name;
  }

  public long getId() {
    return id;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(id);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof IndexVar)) {
      return false;
    }
    return id == ((IndexVar)obj).id;
  }

  @Override
  public int compareTo(IndexVar o) {
    return Long.compare(id, o.id);
  }

  @Override
  public String toString() {
    return name;
  }
}
