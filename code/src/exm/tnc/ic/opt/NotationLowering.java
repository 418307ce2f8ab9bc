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

import java.io.PrintStream;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.tnc.common.Settings;
import exm.tnc.common.exceptions.UserException;
import exm.tnc.ic.tree.NotationExprs.Access;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;

/**
 * Drive lowering of a statement to concrete notation with operator splits
 * applied.
 */
public class NotationLowering {

  /**
   * @param logger
   * @param out if not null, print the statement after every pass
   * @param stmt statement in einsum, reduction or concrete notation
   * @return statement in concrete notation
   * @throws UserException if the statement can't be lowered
   */
  public static IndexStmt lower(Logger logger, PrintStream out,
                                IndexStmt stmt) throws UserException {
    return lower(logger, out, stmt, null);
  }

  /**
   * @param zeroed if not null, accesses known to be zero, propagated
   *               before lowering
   */
  public static IndexStmt lower(Logger logger, PrintStream out,
        IndexStmt stmt, Set<Access> zeroed) throws UserException {
    if (logger.isDebugEnabled()) {
      logger.debug("Lowering " + describeNotation(stmt) + ": " + stmt);
    }
    if (out != null) {
      out.println("Input: " + stmt);
    }

    boolean debug = Settings.getBooleanUnchecked(Settings.COMPILER_DEBUG);
    NotationPipeline pipeline = new NotationPipeline(out,
                          debug ? Validate.standardValidator() : null);
    if (zeroed != null) {
      pipeline.addPass(new ZeroPropagation(zeroed));
    }

    pipeline.addPass(new MakeReductionNotation());
    if (NotationDialects.isEinsumNotation(stmt)) {
      pipeline.addPass(Validate.reductionValidator());
    }
    pipeline.addPass(new MakeConcreteNotation());
    pipeline.addPass(Validate.concreteValidator());
    pipeline.addPass(new SplitOperators());
    pipeline.addPass(Validate.concreteValidator());
    return pipeline.runPipeline(logger, stmt);
  }

  /**
   * @return name of the dialect the statement is in
   */
  public static String describeNotation(IndexStmt stmt) {
    if (NotationDialects.isEinsumNotation(stmt)) {
      return "einsum notation";
    } else if (NotationDialects.isReductionNotation(stmt)) {
      return "reduction notation";
    } else if (NotationDialects.isConcreteNotation(stmt)) {
      return "concrete notation";
    } else {
      return "mixed notation";
    }
  }
}
