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

/**
 * The size of one tensor mode.  Either fixed, or variable if the size is
 * only known at runtime.  Compared by value.
 */
public class Dimension {
  private static final long VARIABLE_SIZE = -1;

  private final long size;

  private Dimension(long size) {
    this.size = size;
  }

  /**
   * @param size size of dimension, must be non-negative
   */
  public static Dimension fixed(long size) {
    if (size < 0) {
      throw new IllegalArgumentException("Negative dimension: " + size);
    }
    return new Dimension(size);
  }

  public static Dimension variable() {
    return new Dimension(VARIABLE_SIZE);
  }

  public boolean isFixed() {
    return size != VARIABLE_SIZE;
  }

  public boolean isVariable() {
    return size == VARIABLE_SIZE;
  }

  public long getSize() {
    assert(isFixed()) : "size of variable dimension";
    return size;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(size);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Dimension)) {
      return false;
    }
    return size == ((Dimension)obj).size;
  }

  @Override
  public String toString() {
    return isFixed() ? Long.toString(size) : "?";
  }
}
