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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.tnc.common.Logging;
import exm.tnc.common.Settings;
import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.common.exceptions.UserException;
import exm.tnc.common.lang.Dimension;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.lang.OperatorSplit;
import exm.tnc.common.lang.TensorVar;
import exm.tnc.common.lang.Type;
import exm.tnc.ic.tree.IndexNotation;
import exm.tnc.ic.tree.NotationExprs.Access;
import exm.tnc.ic.tree.NotationExprs.BinaryExpr;
import exm.tnc.ic.tree.NotationExprs.IndexExpr;
import exm.tnc.ic.tree.NotationExprs.Neg;
import exm.tnc.ic.tree.NotationExprs.Reduction;
import exm.tnc.ic.tree.NotationRewriter;
import exm.tnc.ic.tree.NotationStmts.Assignment;
import exm.tnc.ic.tree.NotationStmts.Forall;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;
import exm.tnc.ic.tree.NotationStmts.Multi;
import exm.tnc.ic.tree.NotationStmts.Sequence;
import exm.tnc.ic.tree.NotationStmts.StmtType;
import exm.tnc.ic.tree.NotationStmts.Where;
import exm.tnc.ic.tree.NotationWalk;
import exm.tnc.ic.tree.NotationWalk.NotationVisitor;

/**
 * Lower operator splits recorded on binary expressions of a concrete
 * statement.
 *
 * A split of old into left and right on L op R, where the statement has
 * the form forall(old, S) and S is a chain of foralls around an assignment
 * containing L op R, becomes
 *
 *   where(forall(right, S'), forall(left, ..., w(left, v...) = L'))
 *
 * w is a new workspace indexed by left and the variables v of L bound
 * inside S.  L' is L with old renamed to left, and S' is S with old
 * renamed to right and L op R replaced by w(right, v...) op R.
 */
public class SplitOperators implements NotationPass {

  @Override
  public String getPassName() {
    return "Split operators";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_SPLIT_OPERATORS;
  }

  @Override
  public IndexStmt apply(Logger logger, IndexStmt stmt) throws UserException {
    if (findSplits(stmt).isEmpty()) {
      return stmt;
    }
    Splitter splitter = new Splitter(logger, new UniqueNames(stmt));
    IndexStmt result = splitter.lowerStmt(stmt);

    for (OperatorSplit split: findSplits(result)) {
      if (!splitter.applied.contains(split)) {
        Logging.uniqueWarn("Could not apply operator " + split + ": " +
            split.getOld() + " must be bound by a forall directly " +
            "enclosing a nest of foralls around the split expression");
      }
    }
    return result;
  }

  /**
   * @return all operator splits recorded in the statement
   */
  public static List<OperatorSplit> findSplits(IndexStmt stmt) {
    final List<OperatorSplit> splits = new ArrayList<OperatorSplit>();
    NotationWalk.walk(stmt, new NotationVisitor() {
      @Override
      public void visit(BinaryExpr expr) {
        splits.addAll(expr.getSchedule().getOperatorSplits());
        super.visit(expr);
      }
    });
    return splits;
  }

  private static class Splitter {
    private final Logger logger;
    private final UniqueNames names;
    private final Set<OperatorSplit> applied = new HashSet<OperatorSplit>();

    Splitter(Logger logger, UniqueNames names) {
      this.logger = logger;
      this.names = names;
    }

    IndexStmt lowerStmt(IndexStmt stmt) throws UserException {
      switch (stmt.type()) {
        case ASSIGNMENT:
          return stmt;
        case FORALL: {
          Forall forall = (Forall)stmt;
          IndexStmt body = lowerStmt(forall.getStmt());
          if (body != forall.getStmt()) {
            forall = new Forall(forall.getIndexVar(), body);
          }
          return splitForall(forall);
        }
        case WHERE: {
          Where where = (Where)stmt;
          IndexStmt consumer = lowerStmt(where.getConsumer());
          IndexStmt producer = lowerStmt(where.getProducer());
          if (consumer == where.getConsumer() &&
              producer == where.getProducer()) {
            return stmt;
          }
          return new Where(consumer, producer);
        }
        case MULTI: {
          Multi multi = (Multi)stmt;
          IndexStmt s1 = lowerStmt(multi.getStmt1());
          IndexStmt s2 = lowerStmt(multi.getStmt2());
          if (s1 == multi.getStmt1() && s2 == multi.getStmt2()) {
            return stmt;
          }
          return new Multi(s1, s2);
        }
        case SEQUENCE: {
          Sequence seq = (Sequence)stmt;
          IndexStmt def = lowerStmt(seq.getDefinition());
          IndexStmt mut = lowerStmt(seq.getMutation());
          if (def == seq.getDefinition() && mut == seq.getMutation()) {
            return stmt;
          }
          return new Sequence(def, mut);
        }
        default:
          throw new TNCRuntimeError("Unknown statement type " + stmt.type());
      }
    }

    private IndexStmt splitForall(Forall forall) throws UserException {
      IndexVar old = forall.getIndexVar();
      List<IndexVar> innerVars = new ArrayList<IndexVar>();
      IndexStmt curr = forall.getStmt();
      while (curr.type() == StmtType.FORALL) {
        innerVars.add(((Forall)curr).getIndexVar());
        curr = ((Forall)curr).getStmt();
      }
      if (curr.type() != StmtType.ASSIGNMENT) {
        return forall;
      }

      Assignment assignment = (Assignment)curr;
      BinaryExpr node = findSplitNode(assignment.getRhs(), old);
      if (node == null) {
        return forall;
      }
      OperatorSplit split = null;
      for (OperatorSplit s: node.getSchedule().getOperatorSplits()) {
        if (s.getOld().equals(old) && !applied.contains(s)) {
          split = s;
          break;
        }
      }
      applied.add(split);
      logger.debug("Applying operator " + split + " to " + node);

      IndexVar left = split.getLeft();
      IndexVar right = split.getRight();
      List<IndexVar> leftVars = new ArrayList<IndexVar>();
      List<IndexVar> usedByLeft = IndexNotation.getIndexVars(node.getA());
      for (IndexVar var: innerVars) {
        if (usedByLeft.contains(var)) {
          leftVars.add(var);
        }
      }

      Map<IndexVar, Dimension> domains = forall.getIndexVarDomains();
      List<Dimension> dims = new ArrayList<Dimension>();
      dims.add(domain(domains, old));
      for (IndexVar var: leftVars) {
        dims.add(domain(domains, var));
      }
      TensorVar workspace = names.createWorkspace(old,
                            new Type(node.getA().getDataType(), dims));

      List<IndexVar> producerVars = new ArrayList<IndexVar>();
      producerVars.add(left);
      producerVars.addAll(leftVars);
      IndexExpr leftExpr = new RenameIndexVar(old, left).rewrite(
                                                          node.getA());
      IndexStmt producer = IndexNotation.forall(producerVars,
          new Assignment(new Access(workspace, producerVars), leftExpr,
                         null));

      List<IndexVar> consumerVars = new ArrayList<IndexVar>();
      consumerVars.add(right);
      consumerVars.addAll(leftVars);
      BinaryExpr replacement = new BinaryExpr(node.getOp(),
              new Access(workspace, consumerVars), node.getB());
      for (OperatorSplit s: node.getSchedule().getOperatorSplits()) {
        if (s != split) {
          replacement.getSchedule().addOperatorSplit(s);
        }
      }
      IndexStmt consumer = new ReplaceExpr(node, replacement).rewrite(
                                                    forall.getStmt());
      consumer = new RenameIndexVar(old, right).rewrite(consumer);

      IndexStmt result = new Where(new Forall(right, consumer), producer);
      if (logger.isTraceEnabled()) {
        logger.trace("Split " + forall + " => " + result);
      }
      return result;
    }

    /**
     * @return first binary expression with an unapplied split of var
     */
    private BinaryExpr findSplitNode(IndexExpr expr, IndexVar var) {
      switch (expr.type()) {
        case ACCESS:
        case LITERAL:
          return null;
        case NEG:
          return findSplitNode(((Neg)expr).getA(), var);
        case REDUCTION:
          return findSplitNode(((Reduction)expr).getA(), var);
        case BINARY: {
          BinaryExpr binary = (BinaryExpr)expr;
          for (OperatorSplit split:
                        binary.getSchedule().getOperatorSplits()) {
            if (split.getOld().equals(var) && !applied.contains(split)) {
              return binary;
            }
          }
          BinaryExpr result = findSplitNode(binary.getA(), var);
          if (result != null) {
            return result;
          }
          return findSplitNode(binary.getB(), var);
        }
        default:
          throw new TNCRuntimeError("Unknown expression type " + expr.type());
      }
    }

    private static Dimension domain(Map<IndexVar, Dimension> domains,
                                    IndexVar var) {
      Dimension dim = domains.get(var);
      return dim != null ? dim : Dimension.variable();
    }
  }

  /**
   * Replace one expression node, found by identity
   */
  private static class ReplaceExpr extends NotationRewriter {
    private final IndexExpr target;
    private final IndexExpr replacement;

    ReplaceExpr(IndexExpr target, IndexExpr replacement) {
      this.target = target;
      this.replacement = replacement;
    }

    @Override
    public IndexExpr rewrite(IndexExpr expr) {
      if (expr == target) {
        return replacement;
      }
      return super.rewrite(expr);
    }
  }

  /**
   * Rename uses and bindings of an index variable
   */
  static class RenameIndexVar extends NotationRewriter {
    private final IndexVar from;
    private final IndexVar to;

    RenameIndexVar(IndexVar from, IndexVar to) {
      this.from = from;
      this.to = to;
    }

    @Override
    protected IndexExpr rewriteAccess(Access expr) {
      if (!expr.getIndexVars().contains(from)) {
        return expr;
      }
      List<IndexVar> vars = new ArrayList<IndexVar>();
      for (IndexVar var: expr.getIndexVars()) {
        vars.add(var.equals(from) ? to : var);
      }
      return new Access(expr.getTensorVar(), vars);
    }

    @Override
    protected IndexExpr rewriteReduction(Reduction expr) {
      if (!expr.getVar().equals(from)) {
        return super.rewriteReduction(expr);
      }
      return new Reduction(expr.getOp(), to, rewrite(expr.getA()));
    }

    @Override
    protected IndexStmt rewriteForall(Forall stmt) {
      if (!stmt.getIndexVar().equals(from)) {
        return super.rewriteForall(stmt);
      }
      return new Forall(to, rewrite(stmt.getStmt()));
    }
  }
}
