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

public class NotationWalk {

  /**
   * Top-down walk of a statement, children visited left to right
   */
  public static void walk(IndexStmt stmt, NotationVisitor visitor) {
    stmt.accept(visitor);
  }

  public static void walk(IndexExpr expr, NotationVisitor visitor) {
    expr.accept(visitor);
  }

  /**
   * Every node type dispatches to exactly one of these methods.
   */
  public static interface NotationVisitorStrict {
    public void visit(Access expr);
    public void visit(Literal expr);
    public void visit(Neg expr);
    public void visit(BinaryExpr expr);
    public void visit(Reduction expr);

    public void visit(Assignment stmt);
    public void visit(Forall stmt);
    public void visit(Where stmt);
    public void visit(Multi stmt);
    public void visit(Sequence stmt);
  }

  /**
   * Visitor that walks into children by default.  Subclasses override the
   * node types they care about, and call the superclass method if they want
   * to keep walking into children.
   */
  public static abstract class NotationVisitor
                                  implements NotationVisitorStrict {
    @Override
    public void visit(Access expr) {
      // Leaf
    }

    @Override
    public void visit(Literal expr) {
      // Leaf
    }

    @Override
    public void visit(Neg expr) {
      expr.getA().accept(this);
    }

    @Override
    public void visit(BinaryExpr expr) {
      expr.getA().accept(this);
      expr.getB().accept(this);
    }

    @Override
    public void visit(Reduction expr) {
      expr.getA().accept(this);
    }

    @Override
    public void visit(Assignment stmt) {
      stmt.getLhs().accept(this);
      stmt.getRhs().accept(this);
    }

    @Override
    public void visit(Forall stmt) {
      stmt.getStmt().accept(this);
    }

    @Override
    public void visit(Where stmt) {
      stmt.getConsumer().accept(this);
      stmt.getProducer().accept(this);
    }

    @Override
    public void visit(Multi stmt) {
      stmt.getStmt1().accept(this);
      stmt.getStmt2().accept(this);
    }

    @Override
    public void visit(Sequence stmt) {
      stmt.getDefinition().accept(this);
      stmt.getMutation().accept(this);
    }
  }
}
