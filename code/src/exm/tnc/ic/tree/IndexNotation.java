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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.tnc.common.exceptions.DimensionMismatchException;
import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.common.lang.Dimension;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.lang.TensorVar;
import exm.tnc.ic.tree.NotationExprs.Access;
import exm.tnc.ic.tree.NotationExprs.BinaryExpr;
import exm.tnc.ic.tree.NotationExprs.BinaryOp;
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
import exm.tnc.ic.tree.NotationWalk.NotationVisitor;

/**
 * Construction, comparison and queries over index notation trees.
 */
public class IndexNotation {

  public static Access access(TensorVar tensor, IndexVar... indexVars) {
    return new Access(tensor, Arrays.asList(indexVars));
  }

  public static Access access(TensorVar tensor, List<IndexVar> indexVars) {
    return new Access(tensor, indexVars);
  }

  public static Literal literal(long val) {
    return Literal.intLit(val);
  }

  public static Literal literal(double val) {
    return Literal.floatLit(val);
  }

  public static Literal literal(boolean val) {
    return Literal.boolLit(val);
  }

  public static Neg neg(IndexExpr a) {
    return new Neg(a);
  }

  public static BinaryExpr add(IndexExpr a, IndexExpr b) {
    return new BinaryExpr(BinaryOp.ADD, a, b);
  }

  public static BinaryExpr sub(IndexExpr a, IndexExpr b) {
    return new BinaryExpr(BinaryOp.SUB, a, b);
  }

  public static BinaryExpr mul(IndexExpr a, IndexExpr b) {
    return new BinaryExpr(BinaryOp.MUL, a, b);
  }

  public static BinaryExpr div(IndexExpr a, IndexExpr b) {
    return new BinaryExpr(BinaryOp.DIV, a, b);
  }

  public static Reduction sum(IndexVar var, IndexExpr a) {
    return new Reduction(BinaryOp.ADD, var, a);
  }

  public static Reduction reduction(BinaryOp op, IndexVar var, IndexExpr a) {
    return new Reduction(op, var, a);
  }

  public static Assignment assign(Access lhs, IndexExpr rhs) {
    return new Assignment(lhs, rhs, null);
  }

  public static Assignment compound(Access lhs, IndexExpr rhs, BinaryOp op) {
    if (op == null) {
      throw new TNCRuntimeError("Compound assignment to " + lhs +
                                " without operator");
    }
    return new Assignment(lhs, rhs, op);
  }

  public static Forall forall(IndexVar var, IndexStmt stmt) {
    return new Forall(var, stmt);
  }

  /**
   * Bind several variables, the first outermost
   */
  public static IndexStmt forall(List<IndexVar> vars, IndexStmt stmt) {
    IndexStmt result = stmt;
    for (int i = vars.size() - 1; i >= 0; i--) {
      result = new Forall(vars.get(i), result);
    }
    return result;
  }

  public static Where where(IndexStmt consumer, IndexStmt producer) {
    return new Where(consumer, producer);
  }

  public static Multi multi(IndexStmt stmt1, IndexStmt stmt2) {
    return new Multi(stmt1, stmt2);
  }

  public static Sequence sequence(IndexStmt definition, IndexStmt mutation) {
    return new Sequence(definition, mutation);
  }

  /**
   * Structural equality.  Index variables and tensors must be the same
   * objects, so renaming a variable makes trees unequal.
   */
  public static boolean equals(IndexExpr a, IndexExpr b) {
    if (a == null || b == null) {
      return a == b;
    }
    return a.equals(b);
  }

  public static boolean equals(IndexStmt a, IndexStmt b) {
    if (a == null || b == null) {
      return a == b;
    }
    return a.equals(b);
  }

  public static boolean isa(IndexExpr expr, Class<? extends IndexExpr> cls) {
    return expr != null && cls.isInstance(expr);
  }

  public static boolean isa(IndexStmt stmt, Class<? extends IndexStmt> cls) {
    return stmt != null && cls.isInstance(stmt);
  }

  public static <T extends IndexExpr> T to(IndexExpr expr, Class<T> cls) {
    if (!isa(expr, cls)) {
      throw new TNCRuntimeError("Expected " + cls.getSimpleName() +
                                " but got: " + expr);
    }
    return cls.cast(expr);
  }

  public static <T extends IndexStmt> T to(IndexStmt stmt, Class<T> cls) {
    if (!isa(stmt, cls)) {
      throw new TNCRuntimeError("Expected " + cls.getSimpleName() +
                                " but got: " + stmt);
    }
    return cls.cast(stmt);
  }

  /**
   * @return index variables used by accesses in the expression, in order
   *         of first use
   */
  public static List<IndexVar> getIndexVars(IndexExpr expr) {
    IndexVarCollector collector = new IndexVarCollector();
    NotationWalk.walk(expr, collector);
    return new ArrayList<IndexVar>(collector.vars);
  }

  /**
   * @return index variables used by accesses in the statement, in order
   *         of first use.  The lhs of an assignment is visited before
   *         its rhs.
   */
  public static List<IndexVar> getIndexVars(IndexStmt stmt) {
    IndexVarCollector collector = new IndexVarCollector();
    NotationWalk.walk(stmt, collector);
    return new ArrayList<IndexVar>(collector.vars);
  }

  /**
   * Find all tensors read or written, in order of first use
   */
  public static List<TensorVar> getTensorVars(IndexStmt stmt) {
    final Set<TensorVar> tensors = new LinkedHashSet<TensorVar>();
    NotationWalk.walk(stmt, new NotationVisitor() {
      @Override
      public void visit(Access expr) {
        tensors.add(expr.getTensorVar());
      }
    });
    return new ArrayList<TensorVar>(tensors);
  }

  /**
   * Infer the dimension each index variable ranges over from the tensor
   * modes it indexes.  A variable dimension is refined by a fixed one.
   * @throws DimensionMismatchException if a variable indexes two modes
   *         of different fixed sizes
   */
  public static Map<IndexVar, Dimension> getIndexVarDomains(IndexStmt stmt)
      throws DimensionMismatchException {
    DomainCollector collector = new DomainCollector();
    NotationWalk.walk(stmt, collector);
    if (collector.mismatch != null) {
      throw collector.mismatch;
    }
    return collector.domains;
  }

  public static Map<IndexVar, Dimension> getIndexVarDomains(IndexExpr expr)
      throws DimensionMismatchException {
    DomainCollector collector = new DomainCollector();
    NotationWalk.walk(expr, collector);
    if (collector.mismatch != null) {
      throw collector.mismatch;
    }
    return collector.domains;
  }

  private static class IndexVarCollector extends NotationVisitor {
    private final Set<IndexVar> vars = new LinkedHashSet<IndexVar>();

    @Override
    public void visit(Access expr) {
      vars.addAll(expr.getIndexVars());
    }
  }

  private static class DomainCollector extends NotationVisitor {
    private final Map<IndexVar, Dimension> domains =
                              new LinkedHashMap<IndexVar, Dimension>();
    /** First conflict found */
    private DimensionMismatchException mismatch = null;

    @Override
    public void visit(Access expr) {
      List<IndexVar> vars = expr.getIndexVars();
      for (int mode = 0; mode < vars.size(); mode++) {
        IndexVar var = vars.get(mode);
        Dimension dim = expr.getTensorVar().getType().getDimension(mode);
        Dimension prev = domains.get(var);
        if (prev == null || (prev.isVariable() && dim.isFixed())) {
          domains.put(var, dim);
        } else if (prev.isFixed() && dim.isFixed() && !prev.equals(dim)) {
          if (mismatch == null) {
            mismatch = new DimensionMismatchException(var, prev, dim);
          }
        }
      }
    }
  }
}
