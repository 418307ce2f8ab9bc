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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.tnc.common.exceptions.DimensionMismatchException;
import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.common.lang.Dimension;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.ic.tree.NotationExprs.Access;
import exm.tnc.ic.tree.NotationExprs.BinaryOp;
import exm.tnc.ic.tree.NotationExprs.IndexExpr;
import exm.tnc.ic.tree.NotationWalk.NotationVisitorStrict;

/**
 * Index statement nodes.  An index statement computes one or more tensors:
 * assignments compute values, foralls iterate, and where, multi and
 * sequence compose statements.
 */
public class NotationStmts {

  public static enum StmtType {
    ASSIGNMENT,
    FORALL,
    WHERE,
    MULTI,
    SEQUENCE,
  }

  public static abstract class IndexStmt {
    public abstract StmtType type();

    public abstract void accept(NotationVisitorStrict visitor);

    /**
     * @return the free and reduction index variables used in the statement,
     *         in order of first use
     */
    public List<IndexVar> getIndexVars() {
      return IndexNotation.getIndexVars(this);
    }

    /**
     * @return dimension ranged over by each index variable, inferred from
     *         the tensor modes it indexes
     * @throws DimensionMismatchException if a variable indexes modes of
     *         different dimensions
     */
    public Map<IndexVar, Dimension> getIndexVarDomains()
        throws DimensionMismatchException {
      return IndexNotation.getIndexVarDomains(this);
    }

    public abstract void prettyPrint(StringBuilder sb);

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      prettyPrint(sb);
      return sb.toString();
    }
  }

  /**
   * Assigns an index expression to the locations of a tensor given by the
   * lhs access.  A compound assignment (e.g. +=) combines the rhs with the
   * current value using its operator.
   */
  public static class Assignment extends IndexStmt {
    private final Access lhs;
    private final IndexExpr rhs;
    /** Compound operator, null for plain assignment */
    private final BinaryOp op;

    /**
     * @param lhs
     * @param rhs
     * @param op compound operator, or null for a plain assignment
     */
    public Assignment(Access lhs, IndexExpr rhs, BinaryOp op) {
      if (lhs == null || rhs == null) {
        throw new TNCRuntimeError("Assignment with undefined lhs or rhs: " +
                                  lhs + " = " + rhs);
      }
      this.lhs = lhs;
      this.rhs = rhs;
      this.op = op;
    }

    @Override
    public StmtType type() {
      return StmtType.ASSIGNMENT;
    }

    public Access getLhs() {
      return lhs;
    }

    public IndexExpr getRhs() {
      return rhs;
    }

    /**
     * @return compound operator, or null if not a compound assignment
     */
    public BinaryOp getOp() {
      return op;
    }

    public boolean isCompound() {
      return op != null;
    }

    /**
     * @return variables used to access the left hand side, i.e. those
     *         ranging over the result
     */
    public List<IndexVar> getFreeVars() {
      return new ArrayList<IndexVar>(new LinkedHashSet<IndexVar>(
                                                      lhs.getIndexVars()));
    }

    /**
     * @return variables used in the right hand side that are not free,
     *         in order of first use
     */
    public List<IndexVar> getReductionVars() {
      Set<IndexVar> free = new LinkedHashSet<IndexVar>(lhs.getIndexVars());
      List<IndexVar> result = new ArrayList<IndexVar>();
      for (IndexVar var: IndexNotation.getIndexVars(rhs)) {
        if (!free.contains(var)) {
          result.add(var);
        }
      }
      return result;
    }

    @Override
    public void accept(NotationVisitorStrict visitor) {
      visitor.visit(this);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      lhs.prettyPrint(sb);
      sb.append(" ");
      if (op != null) {
        sb.append(op.symbol());
      }
      sb.append("= ");
      rhs.prettyPrint(sb);
    }

    @Override
    public int hashCode() {
      int result = lhs.hashCode();
      result = 31 * result + rhs.hashCode();
      result = 31 * result + (op == null ? 0 : op.hashCode());
      return result;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Assignment)) {
        return false;
      }
      Assignment other = (Assignment)obj;
      return op == other.op && lhs.equals(other.lhs) &&
             rhs.equals(other.rhs);
    }
  }

  /**
   * Binds an index variable to each value in its domain and executes the
   * body statement for each of them.
   */
  public static class Forall extends IndexStmt {
    private final IndexVar indexVar;
    private final IndexStmt stmt;

    public Forall(IndexVar indexVar, IndexStmt stmt) {
      if (indexVar == null || stmt == null) {
        throw new TNCRuntimeError("Forall with undefined index variable or " +
                                  "body");
      }
      this.indexVar = indexVar;
      this.stmt = stmt;
    }

    @Override
    public StmtType type() {
      return StmtType.FORALL;
    }

    public IndexVar getIndexVar() {
      return indexVar;
    }

    public IndexStmt getStmt() {
      return stmt;
    }

    @Override
    public void accept(NotationVisitorStrict visitor) {
      visitor.visit(this);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("forall(").append(indexVar).append(", ");
      stmt.prettyPrint(sb);
      sb.append(")");
    }

    @Override
    public int hashCode() {
      return 31 * indexVar.hashCode() + stmt.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Forall)) {
        return false;
      }
      Forall other = (Forall)obj;
      return indexVar.equals(other.indexVar) && stmt.equals(other.stmt);
    }
  }

  /**
   * The producer computes a temporary tensor that is read by the consumer.
   * The producer runs to completion before the consumer reads its result.
   */
  public static class Where extends IndexStmt {
    private final IndexStmt consumer;
    private final IndexStmt producer;

    public Where(IndexStmt consumer, IndexStmt producer) {
      if (consumer == null || producer == null) {
        throw new TNCRuntimeError("Where with undefined consumer or " +
                                  "producer");
      }
      this.consumer = consumer;
      this.producer = producer;
    }

    @Override
    public StmtType type() {
      return StmtType.WHERE;
    }

    public IndexStmt getConsumer() {
      return consumer;
    }

    public IndexStmt getProducer() {
      return producer;
    }

    @Override
    public void accept(NotationVisitorStrict visitor) {
      visitor.visit(this);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("where(");
      consumer.prettyPrint(sb);
      sb.append(", ");
      producer.prettyPrint(sb);
      sb.append(")");
    }

    @Override
    public int hashCode() {
      return 31 * consumer.hashCode() + producer.hashCode() + 1;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Where)) {
        return false;
      }
      Where other = (Where)obj;
      return consumer.equals(other.consumer) &&
             producer.equals(other.producer);
    }
  }

  /**
   * Two independent statements, possibly computing different tensors.
   */
  public static class Multi extends IndexStmt {
    private final IndexStmt stmt1;
    private final IndexStmt stmt2;

    public Multi(IndexStmt stmt1, IndexStmt stmt2) {
      if (stmt1 == null || stmt2 == null) {
        throw new TNCRuntimeError("Multi with undefined statement");
      }
      this.stmt1 = stmt1;
      this.stmt2 = stmt2;
    }

    @Override
    public StmtType type() {
      return StmtType.MULTI;
    }

    public IndexStmt getStmt1() {
      return stmt1;
    }

    public IndexStmt getStmt2() {
      return stmt2;
    }

    @Override
    public void accept(NotationVisitorStrict visitor) {
      visitor.visit(this);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("multi(");
      stmt1.prettyPrint(sb);
      sb.append(", ");
      stmt2.prettyPrint(sb);
      sb.append(")");
    }

    @Override
    public int hashCode() {
      return 31 * stmt1.hashCode() + stmt2.hashCode() + 2;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Multi)) {
        return false;
      }
      Multi other = (Multi)obj;
      return stmt1.equals(other.stmt1) && stmt2.equals(other.stmt2);
    }
  }

  /**
   * A definition that establishes a value followed by a mutation that
   * updates it.
   */
  public static class Sequence extends IndexStmt {
    private final IndexStmt definition;
    private final IndexStmt mutation;

    public Sequence(IndexStmt definition, IndexStmt mutation) {
      if (definition == null || mutation == null) {
        throw new TNCRuntimeError("Sequence with undefined statement");
      }
      this.definition = definition;
      this.mutation = mutation;
    }

    @Override
    public StmtType type() {
      return StmtType.SEQUENCE;
    }

    public IndexStmt getDefinition() {
      return definition;
    }

    public IndexStmt getMutation() {
      return mutation;
    }

    @Override
    public void accept(NotationVisitorStrict visitor) {
      visitor.visit(this);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("sequence(");
      definition.prettyPrint(sb);
      sb.append(", ");
      mutation.prettyPrint(sb);
      sb.append(")");
    }

    @Override
    public int hashCode() {
      return 31 * definition.hashCode() + mutation.hashCode() + 3;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Sequence)) {
        return false;
      }
      Sequence other = (Sequence)obj;
      return definition.equals(other.definition) &&
             mutation.equals(other.mutation);
    }
  }
}
