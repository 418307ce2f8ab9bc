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
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.tnc.common.exceptions.InvalidNotationException;
import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.common.exceptions.UserException;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.util.HierarchicalSet;
import exm.tnc.ic.tree.IndexNotation;
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
 * Lower einsum notation to reduction notation by making the implicit
 * summations explicit.
 *
 * A summed variable is reduced at the smallest subexpression that covers
 * all of its uses, but only where every product term of that subexpression
 * uses it: sums distribute over addition, so B(k) + C(k) becomes
 * sum(k, B(k) + C(k)) while B(k) * C(k) + D becomes sum(k, B(k) * C(k)) + D.
 * Variables reduced at the same node nest in order of first use.
 */
public class MakeReductionNotation implements NotationPass {

  @Override
  public String getPassName() {
    return "Make reduction notation";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public IndexStmt apply(Logger logger, IndexStmt stmt) throws UserException {
    IndexStmt result = makeReductionNotation(stmt);
    if (logger.isTraceEnabled()) {
      logger.trace("Reduction notation: " + stmt + " => " + result);
    }
    return result;
  }

  /**
   * @param assignment an assignment in einsum notation
   * @return the equivalent assignment in reduction notation
   * @throws InvalidNotationException if not in einsum notation
   */
  public static Assignment makeReductionNotation(Assignment assignment)
      throws InvalidNotationException {
    String reason = NotationDialects.whyNotEinsumNotation(assignment);
    if (reason != null) {
      throw new InvalidNotationException(reason, assignment);
    }
    return lower(assignment, new ArrayList<IndexVar>());
  }

  /**
   * Lower every assignment in the statement.  Plain assignments must be in
   * einsum notation or already in reduction notation.  Variables bound
   * by enclosing foralls are never summed.
   * @throws InvalidNotationException
   */
  public static IndexStmt makeReductionNotation(IndexStmt stmt)
      throws InvalidNotationException {
    return lowerStmt(stmt, new HierarchicalSet<IndexVar>());
  }

  private static IndexStmt lowerStmt(IndexStmt stmt,
        HierarchicalSet<IndexVar> bound) throws InvalidNotationException {
    switch (stmt.type()) {
      case ASSIGNMENT:
        return lowerLeaf((Assignment)stmt, bound.toList());
      case FORALL: {
        Forall forall = (Forall)stmt;
        HierarchicalSet<IndexVar> inner = bound.makeChild();
        inner.add(forall.getIndexVar());
        IndexStmt body = lowerStmt(forall.getStmt(), inner);
        if (body == forall.getStmt()) {
          return stmt;
        }
        return new Forall(forall.getIndexVar(), body);
      }
      case WHERE: {
        Where where = (Where)stmt;
        IndexStmt consumer = lowerStmt(where.getConsumer(), bound);
        IndexStmt producer = lowerStmt(where.getProducer(), bound);
        if (consumer == where.getConsumer() &&
            producer == where.getProducer()) {
          return stmt;
        }
        return new Where(consumer, producer);
      }
      case MULTI: {
        Multi multi = (Multi)stmt;
        IndexStmt s1 = lowerStmt(multi.getStmt1(), bound);
        IndexStmt s2 = lowerStmt(multi.getStmt2(), bound);
        if (s1 == multi.getStmt1() && s2 == multi.getStmt2()) {
          return stmt;
        }
        return new Multi(s1, s2);
      }
      case SEQUENCE: {
        Sequence seq = (Sequence)stmt;
        IndexStmt def = lowerStmt(seq.getDefinition(), bound);
        IndexStmt mut = lowerStmt(seq.getMutation(), bound);
        if (def == seq.getDefinition() && mut == seq.getMutation()) {
          return stmt;
        }
        return new Sequence(def, mut);
      }
      default:
        throw new TNCRuntimeError("Unknown statement type " + stmt.type());
    }
  }

  private static Assignment lowerLeaf(Assignment assignment,
        List<IndexVar> bound) throws InvalidNotationException {
    if (assignment.isCompound()) {
      return assignment;
    }
    String einsumReason = NotationDialects.whyNotEinsumNotation(assignment);
    if (einsumReason == null) {
      return lower(assignment, bound);
    }
    String reductionReason =
            NotationDialects.whyNotReductionNotation(assignment, bound);
    if (reductionReason == null) {
      return assignment;
    }
    if (NotationDialects.containsReduction(assignment.getRhs())) {
      throw new InvalidNotationException(reductionReason, assignment);
    } else {
      throw new InvalidNotationException(einsumReason, assignment);
    }
  }

  /**
   * Lower an assignment already checked to be in einsum notation
   * @param bound variables bound outside the assignment
   */
  static Assignment lower(Assignment assignment,
                          Collection<IndexVar> bound) {
    Set<IndexVar> free = new LinkedHashSet<IndexVar>(
                                    assignment.getLhs().getIndexVars());
    free.addAll(bound);

    IndexExpr rhs = assignment.getRhs();
    List<IndexVar> summed = new ArrayList<IndexVar>();
    for (IndexVar var: IndexNotation.getIndexVars(rhs)) {
      if (!free.contains(var)) {
        summed.add(var);
      }
    }
    if (summed.isEmpty()) {
      return assignment;
    }

    // Product terms that use each summed variable
    ListMultimap<IndexVar, IndexExpr> uses = ArrayListMultimap.create();
    for (IndexExpr term: productTerms(rhs)) {
      for (IndexVar var: IndexNotation.getIndexVars(term)) {
        if (!free.contains(var)) {
          uses.put(var, term);
        }
      }
    }

    IndexExpr newRhs = placeReductions(rhs, summed, uses);
    return new Assignment(assignment.getLhs(), newRhs, null);
  }

  /**
   * @param vars summed variables used in expr that must be reduced within
   *             expr, in order of first use
   */
  private static IndexExpr placeReductions(IndexExpr expr,
        List<IndexVar> vars, ListMultimap<IndexVar, IndexExpr> uses) {
    if (vars.isEmpty()) {
      return expr;
    }

    if (expr.type() == ExprType.NEG) {
      Neg neg = (Neg)expr;
      return new Neg(placeReductions(neg.getA(), vars, uses));
    }

    if (!isAdditive(expr)) {
      // A single product term: everything is reduced here
      return wrap(vars, expr);
    }

    BinaryExpr binary = (BinaryExpr)expr;
    List<IndexExpr> terms = productTerms(expr);
    List<IndexVar> here = new ArrayList<IndexVar>();
    List<IndexVar> rest = new ArrayList<IndexVar>();
    for (IndexVar var: vars) {
      if (uses.get(var).containsAll(terms)) {
        here.add(var);
      } else {
        rest.add(var);
      }
    }

    IndexExpr a = placeReductions(binary.getA(),
                      usedIn(rest, binary.getA()), uses);
    IndexExpr b = placeReductions(binary.getB(),
                      usedIn(rest, binary.getB()), uses);
    IndexExpr result = expr;
    if (a != binary.getA() || b != binary.getB()) {
      result = NotationRewriter.rebuild(binary, a, b);
    }
    return wrap(here, result);
  }

  private static List<IndexVar> usedIn(List<IndexVar> vars, IndexExpr expr) {
    List<IndexVar> exprVars = IndexNotation.getIndexVars(expr);
    List<IndexVar> result = new ArrayList<IndexVar>();
    for (IndexVar var: vars) {
      if (exprVars.contains(var)) {
        result.add(var);
      }
    }
    return result;
  }

  /**
   * Wrap in summations, first variable outermost
   */
  private static IndexExpr wrap(List<IndexVar> vars, IndexExpr expr) {
    IndexExpr result = expr;
    for (int i = vars.size() - 1; i >= 0; i--) {
      result = new Reduction(BinaryOp.ADD, vars.get(i), result);
    }
    return result;
  }

  private static boolean isAdditive(IndexExpr expr) {
    return expr.type() == ExprType.BINARY &&
           ((BinaryExpr)expr).getOp().isAdditive();
  }

  /**
   * The operands of the top-level sum, looking through negations
   */
  static List<IndexExpr> productTerms(IndexExpr expr) {
    List<IndexExpr> terms = new ArrayList<IndexExpr>();
    addProductTerms(expr, terms);
    return terms;
  }

  private static void addProductTerms(IndexExpr expr, List<IndexExpr> terms) {
    if (isAdditive(expr)) {
      BinaryExpr binary = (BinaryExpr)expr;
      addProductTerms(binary.getA(), terms);
      addProductTerms(binary.getB(), terms);
    } else if (expr.type() == ExprType.NEG) {
      addProductTerms(((Neg)expr).getA(), terms);
    } else {
      terms.add(expr);
    }
  }
}
