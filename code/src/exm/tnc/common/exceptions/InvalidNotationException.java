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

import exm.tnc.ic.tree.NotationStmts.IndexStmt;

/**
 * A lowering pass was given a statement that is not in the notation
 * dialect it requires.
 */
public class InvalidNotationException extends UserException {

  private final String reason;

  public InvalidNotationException(String reason, IndexStmt stmt) {
    super(reason + ": " + stmt);
    this.reason = reason;
  }

  public InvalidNotationException(String message) {
    super(message);
    this.reason = message;
  }

  /**
   * @return why the statement was rejected, without the statement text
   */
  public String getReason() {
    return reason;
  }

  private static final long serialVersionUID = 1L;
}
