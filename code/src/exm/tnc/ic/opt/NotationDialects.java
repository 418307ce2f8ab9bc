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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.util.HierarchicalSet;
import exm.tnc.ic.tree.IndexNotation;
import exm.tnc.ic.tree.NotationExprs.Access;
import exm.tnc.ic.tree.NotationExprs.BinaryExpr;
import exm.tnc.ic.tree.NotationExprs.IndexExpr;
import exm.tnc.ic.tree.NotationExprs.Neg;
import exm.tnc.ic.tree.NotationExprs.Reduction;
import exm.tnc.ic.tree.NotationStmts.Assignment;
import exm.tnc.ic.tree.NotationStmts.Forall;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;
import exm.tnc.ic.tree.NotationStmts.Multi;
import exm.tnc.ic.tree.NotationStmts.Sequence;
import exm.tnc.ic.tree.NotationStmts.StmtType;
import exm.tnc.ic.tree.NotationStmts.Where;

/**
 * Classify statements into the three notation dialects.
 *
 * Einsum notation: a single plain assignment whose rhs is a sum of
 * products, with any variable not on the lhs implicitly summed.
 *
 * Reduction notation: a single plain assignment where every use of a
 * variable not on the lhs is enclosed by a reduction over it.
 *
 * Concrete notation: every variable is bound by a forall, there are no
 * reductions, and accumulation over a loop is done by compound assignment.
 *
 * Each whyNot method returns null if the statement is in the dialect, or
 * a reason why not.
 */
public class NotationDialects {

  public static boolean isEinsumNotation(IndexStmt stmt) {
    return whyNotEinsumNotation(stmt) == null;
  }

  public static boolean isReductionNotation(IndexStmt stmt) {
    return whyNotReductionNotation(stmt) == null;
  }

  public static boolean isConcreteNotation(IndexStmt stmt) {
    return whyNotConcreteNotation(stmt) == null;
  }

  public static String whyNotEinsumNotation(IndexStmt stmt) {
    if (stmt.type() != StmtType.ASSIGNMENT) {
      return "einsum notation must be a single assignment";
    }
    Assignment a = (Assignment)stmt;
    if (a.isCompound()) {
      return "einsum notation may not contain compound assignments";
    }
    if (containsReduction(a.getRhs())) {
      return "einsum notation may not contain reductions";
    }
    if (!isSumOfProducts(a.getRhs())) {
      return "einsum notation must be a sum of products";
    }
    return null;
  }

  public static String whyNotReductionNotation(IndexStmt stmt) {
    if (stmt.type() != StmtType.ASSIGNMENT) {
      return "reduction notation must be a single assignment";
    }
    return whyNotReductionNotation((Assignment)stmt,
                                   Collections.<IndexVar>emptySet());
  }

  /**
   * @param bound variables bound outside the assignment, which are treated
   *              like lhs variables
   */
  static String whyNotReductionNotation(Assignment a,
                                        Collection<IndexVar> bound) {
    if (a.isCompound()) {
      return "reduction notation may not contain compound assignments";
    }
    Set<IndexVar> free = new HashSet<IndexVar>(a.getLhs().getIndexVars());
    free.addAll(bound);
    return checkReductions(a.getRhs(), free, new HierarchicalSet<IndexVar>());
  }

  private static String checkReductions(IndexExpr expr, Set<IndexVar> free,
                                        HierarchicalSet<IndexVar> reduced) {
    switch (expr.type()) {
      case ACCESS:
        for (IndexVar var: ((Access)expr).getIndexVars()) {
          if (!free.contains(var) && !reduced.contains(var)) {
            return "index variable " + var + " is not reduced";
          }
        }
        return null;
      case LITERAL:
        return null;
      case NEG:
        return checkReductions(((Neg)expr).getA(), free, reduced);
      case BINARY: {
        BinaryExpr binary = (BinaryExpr)expr;
        String reason = checkReductions(binary.getA(), free, reduced);
        if (reason != null) {
          return reason;
        }
        return checkReductions(binary.getB(), free, reduced);
      }
      case REDUCTION: {
        Reduction red = (Reduction)expr;
        IndexVar var = red.getVar();
        if (free.contains(var)) {
          return "reduction over free index variable " + var;
        }
        if (reduced.contains(var)) {
          return "index variable " + var + " is reduced more than once";
        }
        HierarchicalSet<IndexVar> inner = reduced.makeChild();
        inner.add(var);
        return checkReductions(red.getA(), free, inner);
      }
      default:
        throw new TNCRuntimeError("Unknown expression type " + expr.type());
    }
  }

  public static String whyNotConcreteNotation(IndexStmt stmt) {
    HierarchicalSet<IndexVar> root = new HierarchicalSet<IndexVar>();
    return checkConcrete(stmt, root, root);
  }

  /**
   * @param bound variables bound by enclosing foralls
   * @param whereScope scope of the nearest enclosing where, or the root.
   *        Variables bound inside it are loops of the current producer
   *        or consumer.
   */
  private static String checkConcrete(IndexStmt stmt,
        HierarchicalSet<IndexVar> bound,
        HierarchicalSet<IndexVar> whereScope) {
    switch (stmt.type()) {
      case ASSIGNMENT:
        return checkConcreteAssignment((Assignment)stmt, bound, whereScope);
      case FORALL: {
        Forall forall = (Forall)stmt;
        IndexVar var = forall.getIndexVar();
        if (bound.contains(var)) {
          return "index variable " + var + " is bound by more than one " +
                 "forall";
        }
        HierarchicalSet<IndexVar> inner = bound.makeChild();
        inner.add(var);
        return checkConcrete(forall.getStmt(), inner, whereScope);
      }
      case WHERE: {
        Where where = (Where)stmt;
        HierarchicalSet<IndexVar> inner = bound.makeChild();
        String reason = checkConcrete(where.getConsumer(), inner, inner);
        if (reason != null) {
          return reason;
        }
        return checkConcrete(where.getProducer(), inner, inner);
      }
      case MULTI: {
        Multi multi = (Multi)stmt;
        String reason = checkConcrete(multi.getStmt1(), bound, whereScope);
        if (reason != null) {
          return reason;
        }
        return checkConcrete(multi.getStmt2(), bound, whereScope);
      }
      case SEQUENCE: {
        Sequence seq = (Sequence)stmt;
        String reason = checkConcrete(seq.getDefinition(), bound,
                                      whereScope);
        if (reason != null) {
          return reason;
        }
        return checkConcrete(seq.getMutation(), bound, whereScope);
      }
      default:
        throw new TNCRuntimeError("Unknown statement type " + stmt.type());
    }
  }

  private static String checkConcreteAssignment(Assignment a,
        HierarchicalSet<IndexVar> bound,
        HierarchicalSet<IndexVar> whereScope) {
    if (containsReduction(a.getRhs())) {
      return "concrete notation may not contain reductions";
    }
    for (IndexVar var: IndexNotation.getIndexVars(a)) {
      if (!bound.contains(var)) {
        return "index variable " + var + " is not bound by a forall";
      }
    }
    if (!a.isCompound()) {
      for (IndexVar var: a.getReductionVars()) {
        if (bound.containsUpTo(var, whereScope)) {
          return "reduction variable " + var + " requires a compound " +
                 "assignment";
        }
      }
    }
    return null;
  }

  public static boolean containsReduction(IndexExpr expr) {
    switch (expr.type()) {
      case ACCESS:
      case LITERAL:
        return false;
      case NEG:
        return containsReduction(((Neg)expr).getA());
      case BINARY: {
        BinaryExpr binary = (BinaryExpr)expr;
        return containsReduction(binary.getA()) ||
               containsReduction(binary.getB());
      }
      case REDUCTION:
        return true;
      default:
        throw new TNCRuntimeError("Unknown expression type " + expr.type());
    }
  }

  /**
   * A sum of products is a tree of additions and subtractions whose
   * operands are products: multiplications and divisions of accesses and
   * literals.  Negation may appear anywhere.
   */
  public static boolean isSumOfProducts(IndexExpr expr) {
    switch (expr.type()) {
      case NEG:
        return isSumOfProducts(((Neg)expr).getA());
      case BINARY: {
        BinaryExpr binary = (BinaryExpr)expr;
        if (binary.getOp().isAdditive()) {
          return isSumOfProducts(binary.getA()) &&
                 isSumOfProducts(binary.getB());
        }
        return isProduct(expr);
      }
      default:
        return isProduct(expr);
    }
  }

  private static boolean isProduct(IndexExpr expr) {
    switch (expr.type()) {
      case ACCESS:
      case LITERAL:
        return true;
      case NEG:
        return isProduct(((Neg)expr).getA());
      case BINARY: {
        BinaryExpr binary = (BinaryExpr)expr;
        return binary.getOp().isMultiplicative() &&
               isProduct(binary.getA()) && isProduct(binary.getB());
      }
      case REDUCTION:
        return false;
      default:
        throw new TNCRuntimeError("Unknown expression type " + expr.type());
    }
  }
}
