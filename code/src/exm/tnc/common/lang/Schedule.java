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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scheduling directives attached to an expression or tensor.  Recorded here
 * and consumed by later lowering.
 *
 * Like {@link TensorVar#setAssignment}, adding directives is not
 * synchronized: callers must confine scheduling to one thread.
 */
public class Schedule {
  private final List<OperatorSplit> operatorSplits =
                                      new ArrayList<OperatorSplit>();

  public void addOperatorSplit(OperatorSplit split) {
    operatorSplits.add(split);
  }

  public void addOperatorSplits(Schedule other) {
    operatorSplits.addAll(other.operatorSplits);
  }

  public List<OperatorSplit> getOperatorSplits() {
    return Collections.unmodifiableList(operatorSplits);
  }

  public boolean isEmpty() {
    return operatorSplits.isEmpty();
  }

  @Override
  public String toString() {
    return operatorSplits.toString();
  }
}
