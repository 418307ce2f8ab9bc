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

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.ic.tree.NotationExprs.Access;
import exm.tnc.ic.tree.NotationStmts.Assignment;

/**
 * A tensor variable in an index expression, which can either be an operand
 * or the result of the expression.
 *
 * Tensor variables are compared by identity.  The type and format are fixed
 * at construction.  The name and the defining assignment are the only
 * mutable state: they are written by whoever drives compilation, and must
 * not be written concurrently for the same tensor.
 */
public class TensorVar implements Comparable<TensorVar> {
  private static final AtomicLong nextId = new AtomicLong(0);

  private final long id;
  private final Type type;
  private final Format format;
  private final Schedule schedule = new Schedule();

  private String name;
  private final Definition definition = new Definition();

  public TensorVar(Type type) {
    this(null, type, null);
  }

  public TensorVar(String name, Type type) {
    this(name, type, null);
  }

  public TensorVar(Type type, Format format) {
    this(null, type, format);
  }

  /**
   * @param name name, or null to generate a unique one
   * @param type
   * @param format storage format, or null for all-dense
   */
  public TensorVar(String name, Type type, Format format) {
    if (type == null) {
      throw new TNCRuntimeError("Tensor variable " + name +
                                " constructed with undefined type");
    }
    if (format != null && format.getOrder() != type.getOrder()) {
      throw new TNCRuntimeError("Format " + format + " does not match order "
                                + type.getOrder() + " of tensor " + name);
    }
    this.id = nextId.getAndIncrement();
    this.name = name != null ? name : "A" + id;
    this.type = type;
    this.format = format != null ? format : Format.dense(type.getOrder());
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public int getOrder() {
    return type.getOrder();
  }

  public Type getType() {
    return type;
  }

  public Format getFormat() {
    return format;
  }

  public Schedule getSchedule() {
    return schedule;
  }

  /**
   * @return the last assignment set for this tensor, or null if none
   */
  public Assignment getAssignment() {
    return definition.assignment;
  }

  public boolean hasAssignment() {
    return definition.assignment != null;
  }

  /**
   * Set the statement that computes this tensor's values, replacing any
   * previous one.
   */
  public void setAssignment(Assignment assignment) {
    definition.assignment = assignment;
  }

  /**
   * Create an expression that accesses this tensor
   */
  public Access access(IndexVar... indices) {
    return access(Arrays.asList(indices));
  }

  public Access access(List<IndexVar> indices) {
    return new Access(this, indices);
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
    if (!(obj instanceof TensorVar)) {
      return false;
    }
    return id == ((TensorVar)obj).id;
  }

  @Override
  public int compareTo(TensorVar o) {
    return Long.compare(id, o.id);
  }

  @Override
  public String toString() {
    return name;
  }

  /**
   * The one mutable cell of a tensor variable: the statement defining it.
   */
  private static final class Definition {
    private Assignment assignment = null;
  }
}
