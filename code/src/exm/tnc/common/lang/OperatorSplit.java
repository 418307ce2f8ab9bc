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
 * Directive to split the computation of a binary expression over an index
 * variable: the left operand is computed into a workspace while iterating
 * over left, and the whole expression is computed while iterating over
 * right, reading the left operand from the workspace.
 */
public class OperatorSplit {
  private final IndexVar old;
  private final IndexVar left;
  private final IndexVar right;

  public OperatorSplit(IndexVar old, IndexVar left, IndexVar right) {
    this.old = old;
    this.left = left;
    this.right = right;
  }

  public IndexVar getOld() {
    return old;
  }

  public IndexVar getLeft() {
    return left;
  }

  public IndexVar getRight() {
    return right;
  }

  @Override
  public String toString() {
    return "split(" + old + " -> " + left + ", " + right + ")";
  }
}
