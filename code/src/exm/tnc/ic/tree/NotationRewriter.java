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
package exm.tnc.ic.tree;

import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.ic.tree.NotationExprs.Access;
import exm.tnc.ic.tree.NotationExprs.BinaryExpr;
import exm.tnc.ic.tree.NotationExprs.IndexExpr;
import exm.tnc.ic.tree.NotationExprs.Literal;
import exm.tnc.ic.tree.NotationExprs.Neg;
import exm.tnc.ic.tree.NotationExprs.Reduction;
import exm.tnc.ic.tree.NotationStmts.Assignment;
import exm.tnc.ic.tree.NotationStmts.Forall;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;
import exm.tnc.ic.tree.NotationStmts.Multi;
import exm.tnc.ic.tree.NotationStmts.Sequence;
import exm.tnc.ic.tree.NotationStmts.Where;

/**
 * Bottom-up rebuilding of index notation.  The default for each node type
 * rewrites the children and returns the original node if none changed, so
 * unchanged subtrees stay shared.  Subclasses override the node types they
 * rewrite.
 */
public abstract class NotationRewriter {

  public IndexExpr rewrite(IndexExpr expr) {
    switch (expr.type()) {
      case ACCESS:
        return rewriteAccess((Access)expr);
      case LITERAL:
        return rewriteLiteral((Literal)expr);
      case NEG:
        return rewriteNeg((Neg)expr);
      case BINARY:
        return rewriteBinary((BinaryExpr)expr);
      case REDUCTION:
        return rewriteReduction((Reduction)expr);
      default:
        throw new TNCRuntimeError("Unknown expression type " + expr.type());
    }
  }

  public IndexStmt rewrite(IndexStmt stmt) {
    switch (stmt.type()) {
      case ASSIGNMENT:
        return rewriteAssignment((Assignment)stmt);
      case FORALL:
        return rewriteForall((Forall)stmt);
      case WHERE:
        return rewriteWhere((Where)stmt);
      case MULTI:
        return rewriteMulti((Multi)stmt);
      case SEQUENCE:
        return rewriteSequence((Sequence)stmt);
      default:
        throw new TNCRuntimeError("Unknown statement type " + stmt.type());
    }
  }

  protected IndexExpr rewriteAccess(Access expr) {
    return expr;
  }

  protected IndexExpr rewriteLiteral(Literal expr) {
    return expr;
  }

  protected IndexExpr rewriteNeg(Neg expr) {
    IndexExpr a = rewrite(expr.getA());
    if (a == expr.getA()) {
      return expr;
    }
    return new Neg(a);
  }

  protected IndexExpr rewriteBinary(BinaryExpr expr) {
    IndexExpr a = rewrite(expr.getA());
    IndexExpr b = rewrite(expr.getB());
    if (a == expr.getA() && b == expr.getB()) {
      return expr;
    }
    return rebuild(expr, a, b);
  }

  protected IndexExpr rewriteReduction(Reduction expr) {
    IndexExpr a = rewrite(expr.getA());
    if (a == expr.getA()) {
      return expr;
    }
    return new Reduction(expr.getOp(), expr.getVar(), a);
  }

  protected IndexStmt rewriteAssignment(Assignment stmt) {
    Access lhs = IndexNotation.to(rewrite(stmt.getLhs()), Access.class);
    IndexExpr rhs = rewrite(stmt.getRhs());
    if (lhs == stmt.getLhs() && rhs == stmt.getRhs()) {
      return stmt;
    }
    return new Assignment(lhs, rhs, stmt.getOp());
  }

  protected IndexStmt rewriteForall(Forall stmt) {
    IndexStmt body = rewrite(stmt.getStmt());
    if (body == stmt.getStmt()) {
      return stmt;
    }
    return new Forall(stmt.getIndexVar(), body);
  }

  protected IndexStmt rewriteWhere(Where stmt) {
    IndexStmt consumer = rewrite(stmt.getConsumer());
    IndexStmt producer = rewrite(stmt.getProducer());
    if (consumer == stmt.getConsumer() && producer == stmt.getProducer()) {
      return stmt;
    }
    return new Where(consumer, producer);
  }

  protected IndexStmt rewriteMulti(Multi stmt) {
    IndexStmt s1 = rewrite(stmt.getStmt1());
    IndexStmt s2 = rewrite(stmt.getStmt2());
    if (s1 == stmt.getStmt1() && s2 == stmt.getStmt2()) {
      return stmt;
    }
    return new Multi(s1, s2);
  }

  protected IndexStmt rewriteSequence(Sequence stmt) {
    IndexStmt def = rewrite(stmt.getDefinition());
    IndexStmt mut = rewrite(stmt.getMutation());
    if (def == stmt.getDefinition() && mut == stmt.getMutation()) {
      return stmt;
    }
    return new Sequence(def, mut);
  }

  /**
   * Build a replacement for a binary expression with new operands,
   * keeping the scheduling directives of the original.
   */
  public static BinaryExpr rebuild(BinaryExpr orig, IndexExpr a,
                                   IndexExpr b) {
    BinaryExpr result = new BinaryExpr(orig.getOp(), a, b);
    result.getSchedule().addOperatorSplits(orig.getSchedule());
    return result;
  }
}
