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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.tnc.common.exceptions.InvalidNotationException;
import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.common.exceptions.UserException;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.lang.TensorVar;
import exm.tnc.common.lang.Type;
import exm.tnc.common.util.HierarchicalSet;
import exm.tnc.ic.tree.IndexNotation;
import exm.tnc.ic.tree.NotationExprs.Access;
import exm.tnc.ic.tree.NotationExprs.BinaryExpr;
import exm.tnc.ic.tree.NotationExprs.BinaryOp;
import exm.tnc.ic.tree.NotationExprs.ExprType;
import exm.tnc.ic.tree.NotationExprs.IndexExpr;
import exm.tnc.ic.tree.NotationExprs.Neg;
import exm.tnc.ic.tree.NotationExprs.Reduction;
import exm.tnc.ic.tree.NotationRewriter;
import exm.tnc.ic.tree.NotationStmts.Assignment;
import exm.tnc.ic.tree.NotationStmts.Forall;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;
import exm.tnc.ic.tree.NotationStmts.Multi;
import exm.tnc.ic.tree.NotationStmts.Sequence;
import exm.tnc.ic.tree.NotationStmts.Where;

/**
 * Lower reduction notation to concrete notation.
 *
 * Reductions at the top of the rhs become foralls around a compound
 * assignment, outer reductions as outer loops.  Any other reduction is
 * computed into a scalar temporary by a producer statement
 * forall(k, t += body), paired with the rewritten statement in a where.
 * The leftmost outermost reduction is replaced first.  Finally the lhs
 * variables are bound by foralls in lhs order.
 *
 * Einsum notation is lowered to reduction notation first.
 */
public class MakeConcreteNotation implements NotationPass {

  private final UniqueNames names;

  private MakeConcreteNotation(UniqueNames names) {
    this.names = names;
  }

  /**
   * Constructor for use as pass
   */
  public MakeConcreteNotation() {
    this(null);
  }

  @Override
  public String getPassName() {
    return "Make concrete notation";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public IndexStmt apply(Logger logger, IndexStmt stmt) throws UserException {
    IndexStmt result = makeConcreteNotation(stmt);
    if (logger.isTraceEnabled()) {
      logger.trace("Concrete notation: " + stmt + " => " + result);
    }
    return result;
  }

  /**
   * @param assignment an assignment in reduction or einsum notation
   * @return equivalent statement in concrete notation
   * @throws InvalidNotationException if in neither notation
   */
  public static IndexStmt makeConcreteNotation(Assignment assignment)
      throws InvalidNotationException {
    HierarchicalSet<IndexVar> root = new HierarchicalSet<IndexVar>();
    MakeConcreteNotation lowering =
        new MakeConcreteNotation(new UniqueNames(assignment));
    return lowering.lowerAssignment(assignment, root, root);
  }

  /**
   * Lower every plain assignment in the statement.  Variables bound by
   * enclosing foralls are not bound again, and compound assignments are
   * left as they are.
   * @throws InvalidNotationException
   */
  public static IndexStmt makeConcreteNotation(IndexStmt stmt)
      throws InvalidNotationException {
    HierarchicalSet<IndexVar> root = new HierarchicalSet<IndexVar>();
    MakeConcreteNotation lowering =
        new MakeConcreteNotation(new UniqueNames(stmt));
    return lowering.lowerStmt(stmt, root, root);
  }

  private IndexStmt lowerStmt(IndexStmt stmt,
        HierarchicalSet<IndexVar> bound,
        HierarchicalSet<IndexVar> whereScope)
            throws InvalidNotationException {
    switch (stmt.type()) {
      case ASSIGNMENT: {
        Assignment assignment = (Assignment)stmt;
        if (assignment.isCompound()) {
          return stmt;
        }
        return lowerAssignment(assignment, bound, whereScope);
      }
      case FORALL: {
        Forall forall = (Forall)stmt;
        HierarchicalSet<IndexVar> inner = bound.makeChild();
        inner.add(forall.getIndexVar());
        IndexStmt body = lowerStmt(forall.getStmt(), inner, whereScope);
        if (body == forall.getStmt()) {
          return stmt;
        }
        return new Forall(forall.getIndexVar(), body);
      }
      case WHERE: {
        Where where = (Where)stmt;
        HierarchicalSet<IndexVar> inner = bound.makeChild();
        IndexStmt consumer = lowerStmt(where.getConsumer(), inner, inner);
        IndexStmt producer = lowerStmt(where.getProducer(), inner, inner);
        if (consumer == where.getConsumer() &&
            producer == where.getProducer()) {
          return stmt;
        }
        return new Where(consumer, producer);
      }
      case MULTI: {
        Multi multi = (Multi)stmt;
        IndexStmt s1 = lowerStmt(multi.getStmt1(), bound, whereScope);
        IndexStmt s2 = lowerStmt(multi.getStmt2(), bound, whereScope);
        if (s1 == multi.getStmt1() && s2 == multi.getStmt2()) {
          return stmt;
        }
        return new Multi(s1, s2);
      }
      case SEQUENCE: {
        Sequence seq = (Sequence)stmt;
        IndexStmt def = lowerStmt(seq.getDefinition(), bound, whereScope);
        IndexStmt mut = lowerStmt(seq.getMutation(), bound, whereScope);
        if (def == seq.getDefinition() && mut == seq.getMutation()) {
          return stmt;
        }
        return new Sequence(def, mut);
      }
      default:
        throw new TNCRuntimeError("Unknown statement type " + stmt.type());
    }
  }

  private IndexStmt lowerAssignment(Assignment assignment,
        HierarchicalSet<IndexVar> bound,
        HierarchicalSet<IndexVar> whereScope)
            throws InvalidNotationException {
    List<IndexVar> boundVars = bound.toList();
    String reason = NotationDialects.whyNotReductionNotation(assignment,
                                                             boundVars);
    if (reason != null) {
      if (NotationDialects.isEinsumNotation(assignment)) {
        assignment = MakeReductionNotation.lower(assignment, boundVars);
      } else {
        throw new InvalidNotationException(
            "not in einsum or reduction notation, " + reason, assignment);
      }
    }

    List<IndexVar> loops = new ArrayList<IndexVar>();
    BinaryOp op = peelReductions(assignment.getRhs(), loops);
    IndexExpr rhs = stripReductions(assignment.getRhs(), loops.size());

    if (op == null) {
      // An enclosing loop over a variable not on the lhs accumulates
      for (IndexVar var: assignment.getReductionVars()) {
        if (bound.containsUpTo(var, whereScope)) {
          op = BinaryOp.ADD;
          break;
        }
      }
    }

    IndexStmt body = replaceReductions(
                      new Assignment(assignment.getLhs(), rhs, op));
    body = IndexNotation.forall(loops, body);

    Set<IndexVar> freeLoops = new LinkedHashSet<IndexVar>();
    for (IndexVar var: assignment.getLhs().getIndexVars()) {
      if (!bound.contains(var)) {
        freeLoops.add(var);
      }
    }
    return IndexNotation.forall(new ArrayList<IndexVar>(freeLoops), body);
  }

  /**
   * Find the chain of reductions with the same operator at the top of an
   * expression.
   * @param loops filled in with reduction variables, outermost first
   * @return the operator of the reductions, or null if none
   */
  private static BinaryOp peelReductions(IndexExpr expr,
                                         List<IndexVar> loops) {
    BinaryOp op = null;
    IndexExpr curr = expr;
    while (curr.type() == ExprType.REDUCTION) {
      Reduction red = (Reduction)curr;
      if (op != null && red.getOp() != op) {
        break;
      }
      op = red.getOp();
      loops.add(red.getVar());
      curr = red.getA();
    }
    return op;
  }

  private static IndexExpr stripReductions(IndexExpr expr, int count) {
    IndexExpr curr = expr;
    for (int i = 0; i < count; i++) {
      curr = ((Reduction)curr).getA();
    }
    return curr;
  }

  /**
   * Replace reductions inside the rhs with temporaries, each computed by a
   * producer in a where statement.
   */
  private IndexStmt replaceReductions(Assignment assignment) {
    final Reduction red = findReduction(assignment.getRhs());
    if (red == null) {
      return assignment;
    }

    Type tempType = Type.scalar(red.getDataType());
    TensorVar temp = names.createTemporary(red.getVar(), tempType);
    final Access tempAccess = new Access(temp,
                                Collections.<IndexVar>emptyList());

    IndexExpr consumerRhs = new NotationRewriter() {
      @Override
      protected IndexExpr rewriteReduction(Reduction expr) {
        if (expr == red) {
          return tempAccess;
        }
        return super.rewriteReduction(expr);
      }
    }.rewrite(assignment.getRhs());
    Assignment consumer = new Assignment(assignment.getLhs(), consumerRhs,
                                         assignment.getOp());

    List<IndexVar> loops = new ArrayList<IndexVar>();
    BinaryOp op = peelReductions(red, loops);
    IndexExpr body = stripReductions(red, loops.size());
    IndexStmt producer = IndexNotation.forall(loops,
        replaceReductions(new Assignment(tempAccess, body, op)));

    return new Where(replaceReductions(consumer), producer);
  }

  /**
   * @return leftmost outermost reduction, or null if none
   */
  private static Reduction findReduction(IndexExpr expr) {
    switch (expr.type()) {
      case ACCESS:
      case LITERAL:
        return null;
      case NEG:
        return findReduction(((Neg)expr).getA());
      case BINARY: {
        BinaryExpr binary = (BinaryExpr)expr;
        Reduction red = findReduction(binary.getA());
        if (red != null) {
          return red;
        }
        return findReduction(binary.getB());
      }
      case REDUCTION:
        return (Reduction)expr;
      default:
        throw new TNCRuntimeError("Unknown expression type " + expr.type());
    }
  }
}
