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
package exm.tnc.ic.opt;

import org.apache.log4j.Logger;

import exm.tnc.common.exceptions.UserException;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;

public interface NotationPass {
  public abstract String getPassName();

  /**
   * @return Settings key for a boolean that enables the pass,
   *         or null if it always runs
   */
  public abstract String getConfigEnabledKey();

  /**
   * @return the rewritten statement.  The input is not modified.
   */
  public abstract IndexStmt apply(Logger logger, IndexStmt stmt)
                                              throws UserException;
}
