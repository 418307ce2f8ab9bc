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

package exm.tnc.common.exceptions;

import exm.tnc.common.lang.Dimension;
import exm.tnc.common.lang.IndexVar;

/**
 * An index variable is used to index two tensor modes with
 * different dimensions.
 */
public class DimensionMismatchException
extends UserException
{
  private final IndexVar indexVar;
  private final Dimension first;
  private final Dimension second;

  public DimensionMismatchException(IndexVar indexVar, Dimension first,
                                    Dimension second)
  {
    super("Index variable " + indexVar + " used to index incompatible " +
          "dimensions " + first + " and " + second);
    this.indexVar = indexVar;
    this.first = first;
    this.second = second;
  }

  public IndexVar getIndexVar() {
    return indexVar;
  }

  /** @return dimension the variable was first seen indexing */
  public Dimension getFirst() {
    return first;
  }

  public Dimension getSecond() {
    return second;
  }

  private static final long serialVersionUID = 1L;
}
