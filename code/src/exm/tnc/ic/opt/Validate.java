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

import exm.tnc.common.Settings;
import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.common.exceptions.UserException;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.util.HierarchicalSet;
import exm.tnc.ic.tree.NotationStmts.Forall;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;
import exm.tnc.ic.tree.NotationStmts.Multi;
import exm.tnc.ic.tree.NotationStmts.Sequence;
import exm.tnc.ic.tree.NotationStmts.Where;

/**
 * Sanity checks on statements produced by passes:
 * - Check no forall rebinds a variable bound by an enclosing forall
 * - Check index variables index consistent dimensions
 * - Optionally check the statement is in a target dialect
 */
public class Validate implements NotationPass {
  public static enum Target {
    ANY,
    REDUCTION,
    CONCRETE,
  }

  private final Target target;

  private Validate(Target target) {
    this.target = target;
  }

  public static Validate standardValidator() {
    return new Validate(Target.ANY);
  }

  /**
   * @return validator for the output of reduction notation lowering
   */
  public static Validate reductionValidator() {
    return new Validate(Target.REDUCTION);
  }

  /**
   * @return validator for the output of concrete notation lowering
   */
  public static Validate concreteValidator() {
    return new Validate(Target.CONCRETE);
  }

  public Target getTarget() {
    return target;
  }

  @Override
  public String getPassName() {
    return "Validate";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.COMPILER_DEBUG;
  }

  @Override
  public IndexStmt apply(Logger logger, IndexStmt stmt) throws UserException {
    checkUniqueForalls(stmt, new HierarchicalSet<IndexVar>());
    stmt.getIndexVarDomains();

    String reason = null;
    switch (target) {
      case ANY:
        break;
      case REDUCTION:
        reason = NotationDialects.whyNotReductionNotation(stmt);
        break;
      case CONCRETE:
        reason = NotationDialects.whyNotConcreteNotation(stmt);
        break;
      default:
        throw new TNCRuntimeError("Unknown target " + target);
    }
    if (reason != null) {
      throw new TNCRuntimeError("Expected " + target.toString().toLowerCase()
                                + " notation, but " + reason + ": " + stmt);
    }
    logger.trace("Validated " + target + ": " + stmt);
    return stmt;
  }

  private static void checkUniqueForalls(IndexStmt stmt,
                                         HierarchicalSet<IndexVar> bound) {
    switch (stmt.type()) {
      case ASSIGNMENT:
        break;
      case FORALL: {
        Forall forall = (Forall)stmt;
        if (bound.contains(forall.getIndexVar())) {
          throw new TNCRuntimeError("Index variable " +
              forall.getIndexVar() + " bound twice in " + stmt);
        }
        HierarchicalSet<IndexVar> inner = bound.makeChild();
        inner.add(forall.getIndexVar());
        checkUniqueForalls(forall.getStmt(), inner);
        break;
      }
      case WHERE:
        checkUniqueForalls(((Where)stmt).getConsumer(), bound);
        checkUniqueForalls(((Where)stmt).getProducer(), bound);
        break;
      case MULTI:
        checkUniqueForalls(((Multi)stmt).getStmt1(), bound);
        checkUniqueForalls(((Multi)stmt).getStmt2(), bound);
        break;
      case SEQUENCE:
        checkUniqueForalls(((Sequence)stmt).getDefinition(), bound);
        checkUniqueForalls(((Sequence)stmt).getMutation(), bound);
        break;
      default:
        throw new TNCRuntimeError("Unknown statement type " + stmt.type());
    }
  }
}
