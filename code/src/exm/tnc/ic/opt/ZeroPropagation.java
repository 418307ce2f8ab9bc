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

import java.util.Set;

import org.apache.log4j.Logger;

import exm.tnc.common.Settings;
import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.ic.tree.NotationExprs.Access;
import exm.tnc.ic.tree.NotationExprs.BinaryExpr;
import exm.tnc.ic.tree.NotationExprs.IndexExpr;
import exm.tnc.ic.tree.NotationExprs.Literal;
import exm.tnc.ic.tree.NotationExprs.Neg;
import exm.tnc.ic.tree.NotationExprs.Reduction;
import exm.tnc.ic.tree.NotationRewriter;
import exm.tnc.ic.tree.NotationStmts.Assignment;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;

/**
 * Propagate accesses known to be zero through expressions.
 *
 * x * 0 = 0, x + 0 = x, 0 - x = -x, 0 / x = 0, -0 = 0 and a reduction of
 * 0 is 0.  Division by zero is kept.  Only accesses in the zero set are
 * treated as zero, literal zeros already in the expression are left alone.
 */
public class ZeroPropagation implements NotationPass {

  private final Set<Access> zeroed;

  public ZeroPropagation(Set<Access> zeroed) {
    this.zeroed = zeroed;
  }

  @Override
  public String getPassName() {
    return "Zero propagation";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_SIMPLIFY;
  }

  @Override
  public IndexStmt apply(Logger logger, IndexStmt stmt) {
    if (logger.isTraceEnabled()) {
      logger.trace("Zero accesses: " + zeroed);
    }
    return simplify(stmt, zeroed);
  }

  /**
   * @param expr
   * @param zeroed accesses that evaluate to zero, compared structurally
   * @return simplified expression.  If the whole expression is zero, a zero
   *         literal of the expression's type.
   */
  public static IndexExpr simplify(IndexExpr expr, Set<Access> zeroed) {
    IndexExpr result = propagate(expr, zeroed);
    if (result == null) {
      return Literal.zero(expr.getDataType());
    }
    return result;
  }

  /**
   * Simplify the rhs of every assignment in the statement
   */
  public static IndexStmt simplify(IndexStmt stmt, final Set<Access> zeroed) {
    return new NotationRewriter() {
      @Override
      protected IndexStmt rewriteAssignment(Assignment assignment) {
        IndexExpr rhs = simplify(assignment.getRhs(), zeroed);
        if (rhs == assignment.getRhs()) {
          return assignment;
        }
        return new Assignment(assignment.getLhs(), rhs, assignment.getOp());
      }
    }.rewrite(stmt);
  }

  /**
   * @return the simplified expression, or null if it is zero
   */
  private static IndexExpr propagate(IndexExpr expr, Set<Access> zeroed) {
    switch (expr.type()) {
      case ACCESS:
        return zeroed.contains(expr) ? null : expr;
      case LITERAL:
        return expr;
      case NEG: {
        Neg neg = (Neg)expr;
        IndexExpr a = propagate(neg.getA(), zeroed);
        if (a == null) {
          return null;
        }
        return a == neg.getA() ? expr : new Neg(a);
      }
      case BINARY:
        return propagateBinary((BinaryExpr)expr, zeroed);
      case REDUCTION: {
        Reduction red = (Reduction)expr;
        IndexExpr a = propagate(red.getA(), zeroed);
        if (a == null) {
          return null;
        }
        return a == red.getA() ? expr :
                  new Reduction(red.getOp(), red.getVar(), a);
      }
      default:
        throw new TNCRuntimeError("Unknown expression type " + expr.type());
    }
  }

  private static IndexExpr propagateBinary(BinaryExpr expr,
                                           Set<Access> zeroed) {
    IndexExpr a = propagate(expr.getA(), zeroed);
    IndexExpr b = propagate(expr.getB(), zeroed);
    switch (expr.getOp()) {
      case ADD:
        if (a == null) {
          return b;
        } else if (b == null) {
          return a;
        }
        break;
      case SUB:
        if (a == null) {
          return b == null ? null : new Neg(b);
        } else if (b == null) {
          return a;
        }
        break;
      case MUL:
        if (a == null || b == null) {
          return null;
        }
        break;
      case DIV:
        if (a == null) {
          return null;
        } else if (b == null) {
          b = Literal.zero(expr.getB().getDataType());
        }
        break;
      default:
        throw new TNCRuntimeError("Unknown operator " + expr.getOp());
    }
    if (a == expr.getA() && b == expr.getB()) {
      return expr;
    }
    return NotationRewriter.rebuild(expr, a, b);
  }
}
