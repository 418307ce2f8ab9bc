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

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.common.lang.DataType;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.lang.OperatorSplit;
import exm.tnc.common.lang.Schedule;
import exm.tnc.common.lang.TensorVar;
import exm.tnc.ic.tree.NotationStmts.Assignment;
import exm.tnc.ic.tree.NotationWalk.NotationVisitorStrict;

/**
 * Index expression nodes.  An index expression describes a tensor
 * computation as a scalar expression where tensors are indexed by index
 * variables.  Index variables range over the tensor dimensions they index.
 *
 * Nodes are immutable apart from their schedule, and compare structurally:
 * two expressions are equal when they have the same shape and refer to the
 * same index variables, tensors and literal values.  Rewrites build new
 * nodes and share unchanged subtrees.
 */
public class NotationExprs {

  public static enum ExprType {
    ACCESS,
    LITERAL,
    NEG,
    BINARY,
    REDUCTION,
  }

  public static enum BinaryOp {
    ADD("+", "add", 1),
    SUB("-", "sub", 1),
    MUL("*", "mul", 2),
    DIV("/", "div", 2);

    private final String symbol;
    private final String opName;
    private final int precedence;

    private BinaryOp(String symbol, String opName, int precedence) {
      this.symbol = symbol;
      this.opName = opName;
      this.precedence = precedence;
    }

    public String symbol() {
      return symbol;
    }

    public String opName() {
      return opName;
    }

    int precedence() {
      return precedence;
    }

    public boolean isAdditive() {
      return this == ADD || this == SUB;
    }

    public boolean isMultiplicative() {
      return this == MUL || this == DIV;
    }
  }

  /** Binds tighter than any binary operator */
  private static final int ATOM_PRECEDENCE = 3;

  public static abstract class IndexExpr {
    private final Schedule schedule = new Schedule();

    public abstract ExprType type();

    /**
     * @return component type of the value computed by the expression
     */
    public abstract DataType getDataType();

    public abstract void accept(NotationVisitorStrict visitor);

    /**
     * Scheduling directives for this expression node
     */
    public Schedule getSchedule() {
      return schedule;
    }

    /**
     * Split the index variable old into left and right at this expression.
     * Only has an effect on binary expressions: the left variable computes
     * the left operand into a workspace and the right variable computes
     * the whole expression, reading the left operand from the workspace.
     */
    public void splitOperator(IndexVar old, IndexVar left, IndexVar right) {
      // Nothing to split
    }

    public abstract void prettyPrint(StringBuilder sb);

    int precedence() {
      return ATOM_PRECEDENCE;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      prettyPrint(sb);
      return sb.toString();
    }
  }

  /**
   * A read of a tensor at a list of index variables, e.g. A(i,j).
   * Scalars are accessed with no index variables.
   */
  public static class Access extends IndexExpr {
    private final TensorVar tensorVar;
    private final ImmutableList<IndexVar> indexVars;

    public Access(TensorVar tensorVar, List<IndexVar> indexVars) {
      if (tensorVar == null) {
        throw new TNCRuntimeError("Access of undefined tensor");
      }
      if (indexVars.contains(null)) {
        throw new TNCRuntimeError("Access of " + tensorVar +
                                  " with undefined index variable");
      }
      if (indexVars.size() != tensorVar.getOrder()) {
        throw new TNCRuntimeError("Accessing order " + tensorVar.getOrder()
            + " tensor " + tensorVar + " with " + indexVars.size()
            + " index variables");
      }
      this.tensorVar = tensorVar;
      this.indexVars = ImmutableList.copyOf(indexVars);
    }

    @Override
    public ExprType type() {
      return ExprType.ACCESS;
    }

    public TensorVar getTensorVar() {
      return tensorVar;
    }

    public List<IndexVar> getIndexVars() {
      return indexVars;
    }

    @Override
    public DataType getDataType() {
      return tensorVar.getType().getDataType();
    }

    /**
     * Assign the result of an expression to this access: lhs = rhs
     */
    public Assignment assign(IndexExpr rhs) {
      return new Assignment(this, rhs, null);
    }

    /**
     * Accumulate the result of an expression into this access: lhs += rhs
     */
    public Assignment accumulate(IndexExpr rhs) {
      return new Assignment(this, rhs, BinaryOp.ADD);
    }

    @Override
    public void accept(NotationVisitorStrict visitor) {
      visitor.visit(this);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append(tensorVar.getName());
      if (!indexVars.isEmpty()) {
        sb.append("(");
        sb.append(StringUtils.join(indexVars, ","));
        sb.append(")");
      }
    }

    @Override
    public int hashCode() {
      return 31 * tensorVar.hashCode() + indexVars.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Access)) {
        return false;
      }
      Access other = (Access)obj;
      return tensorVar.equals(other.tensorVar) &&
             indexVars.equals(other.indexVars);
    }
  }

  /**
   * A scalar constant embedded in an expression
   */
  public static class Literal extends IndexExpr {
    private final DataType dataType;
    /** Storage for literal, dependent on data type */
    private final long intVal;
    private final double realVal;
    private final double imagVal;

    private Literal(DataType dataType, long intVal, double realVal,
                    double imagVal) {
      this.dataType = dataType;
      this.intVal = intVal;
      // -0.0 and 0.0 are the same literal
      this.realVal = realVal == 0.0 ? 0.0 : realVal;
      this.imagVal = imagVal == 0.0 ? 0.0 : imagVal;
    }

    public static Literal intLit(long val) {
      return new Literal(DataType.INT64, val, 0.0, 0.0);
    }

    /**
     * @param val bits of an unsigned 64-bit value
     */
    public static Literal uintLit(long val) {
      return new Literal(DataType.UINT64, val, 0.0, 0.0);
    }

    public static Literal floatLit(double val) {
      return new Literal(DataType.FLOAT64, 0, val, 0.0);
    }

    public static Literal complexLit(double real, double imag) {
      return new Literal(DataType.COMPLEX128, 0, real, imag);
    }

    public static Literal boolLit(boolean val) {
      return new Literal(DataType.BOOL, val ? 1 : 0, 0.0, 0.0);
    }

    /**
     * The additive identity of the given type
     */
    public static Literal zero(DataType dataType) {
      return new Literal(dataType, 0, 0.0, 0.0);
    }

    @Override
    public ExprType type() {
      return ExprType.LITERAL;
    }

    @Override
    public DataType getDataType() {
      return dataType;
    }

    public long getIntVal() {
      if (dataType.isInt() || dataType.isUInt()) {
        return intVal;
      }
      throw new TNCRuntimeError("getIntVal for " + dataType + " literal");
    }

    public double getFloatVal() {
      if (dataType.isFloat()) {
        return realVal;
      }
      throw new TNCRuntimeError("getFloatVal for " + dataType + " literal");
    }

    public double getRealVal() {
      if (dataType.isFloat() || dataType.isComplex()) {
        return realVal;
      }
      throw new TNCRuntimeError("getRealVal for " + dataType + " literal");
    }

    public double getImagVal() {
      if (dataType.isComplex()) {
        return imagVal;
      }
      throw new TNCRuntimeError("getImagVal for " + dataType + " literal");
    }

    public boolean getBoolVal() {
      if (dataType.isBool()) {
        return intVal != 0;
      }
      throw new TNCRuntimeError("getBoolVal for " + dataType + " literal");
    }

    public boolean isZero() {
      switch (dataType.getKind()) {
        case BOOL:
        case UINT:
        case INT:
          return intVal == 0;
        case FLOAT:
          return realVal == 0.0;
        case COMPLEX:
          return realVal == 0.0 && imagVal == 0.0;
        default:
          throw new TNCRuntimeError("Unknown data type " + dataType);
      }
    }

    @Override
    public void accept(NotationVisitorStrict visitor) {
      visitor.visit(this);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      switch (dataType.getKind()) {
        case BOOL:
          sb.append(intVal != 0);
          break;
        case UINT:
          sb.append(Long.toUnsignedString(intVal));
          break;
        case INT:
          sb.append(intVal);
          break;
        case FLOAT:
          sb.append(realVal);
          break;
        case COMPLEX:
          sb.append("(").append(realVal);
          sb.append(imagVal < 0 ? "-" : "+");
          sb.append(Math.abs(imagVal)).append("i)");
          break;
        default:
          throw new TNCRuntimeError("Unknown data type " + dataType);
      }
    }

    @Override
    public int hashCode() {
      int result = dataType.hashCode();
      result = 31 * result + Long.hashCode(intVal);
      result = 31 * result + Double.hashCode(realVal);
      result = 31 * result + Double.hashCode(imagVal);
      return result;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Literal)) {
        return false;
      }
      Literal other = (Literal)obj;
      return dataType == other.dataType && intVal == other.intVal &&
          Double.compare(realVal, other.realVal) == 0 &&
          Double.compare(imagVal, other.imagVal) == 0;
    }
  }

  /**
   * Arithmetic negation
   */
  public static class Neg extends IndexExpr {
    private final IndexExpr a;

    public Neg(IndexExpr a) {
      if (a == null) {
        throw new TNCRuntimeError("Negation of undefined expression");
      }
      this.a = a;
    }

    @Override
    public ExprType type() {
      return ExprType.NEG;
    }

    public IndexExpr getA() {
      return a;
    }

    @Override
    public DataType getDataType() {
      return a.getDataType();
    }

    @Override
    public void accept(NotationVisitorStrict visitor) {
      visitor.visit(this);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("-");
      boolean paren = a.precedence() < ATOM_PRECEDENCE;
      if (paren) {
        sb.append("(");
      }
      a.prettyPrint(sb);
      if (paren) {
        sb.append(")");
      }
    }

    @Override
    public int hashCode() {
      return 17 + a.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Neg)) {
        return false;
      }
      return a.equals(((Neg)obj).a);
    }
  }

  /**
   * Elementwise add, subtract, multiply or divide
   */
  public static class BinaryExpr extends IndexExpr {
    private final BinaryOp op;
    private final IndexExpr a;
    private final IndexExpr b;

    public BinaryExpr(BinaryOp op, IndexExpr a, IndexExpr b) {
      if (op == null || a == null || b == null) {
        throw new TNCRuntimeError("Binary expression with undefined " +
                                  "operator or operand: " + a + " " +
                                  op + " " + b);
      }
      this.op = op;
      this.a = a;
      this.b = b;
    }

    @Override
    public ExprType type() {
      return ExprType.BINARY;
    }

    public BinaryOp getOp() {
      return op;
    }

    public IndexExpr getA() {
      return a;
    }

    public IndexExpr getB() {
      return b;
    }

    @Override
    public DataType getDataType() {
      return DataType.max(a.getDataType(), b.getDataType());
    }

    @Override
    public void splitOperator(IndexVar old, IndexVar left, IndexVar right) {
      if (old == null || left == null || right == null) {
        throw new TNCRuntimeError("Operator split with undefined index " +
                                  "variable");
      }
      getSchedule().addOperatorSplit(new OperatorSplit(old, left, right));
    }

    @Override
    int precedence() {
      return op.precedence();
    }

    @Override
    public void accept(NotationVisitorStrict visitor) {
      visitor.visit(this);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      printOperand(sb, a, a.precedence() < precedence());
      sb.append(" ").append(op.symbol()).append(" ");
      // Operators are left associative
      printOperand(sb, b, b.precedence() <= precedence());
    }

    private static void printOperand(StringBuilder sb, IndexExpr operand,
                                     boolean paren) {
      if (paren) {
        sb.append("(");
      }
      operand.prettyPrint(sb);
      if (paren) {
        sb.append(")");
      }
    }

    @Override
    public int hashCode() {
      int result = op.hashCode();
      result = 31 * result + a.hashCode();
      result = 31 * result + b.hashCode();
      return result;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof BinaryExpr)) {
        return false;
      }
      BinaryExpr other = (BinaryExpr)obj;
      return op == other.op && a.equals(other.a) && b.equals(other.b);
    }
  }

  /**
   * A reduction of the operand over all values of an index variable, using
   * the given combining operator, e.g. sum(k, B(i,k)).
   */
  public static class Reduction extends IndexExpr {
    private final BinaryOp op;
    private final IndexVar var;
    private final IndexExpr a;

    public Reduction(BinaryOp op, IndexVar var, IndexExpr a) {
      if (op == null || var == null || a == null) {
        throw new TNCRuntimeError("Reduction with undefined operator, " +
                                  "variable or operand");
      }
      this.op = op;
      this.var = var;
      this.a = a;
    }

    @Override
    public ExprType type() {
      return ExprType.REDUCTION;
    }

    public BinaryOp getOp() {
      return op;
    }

    public IndexVar getVar() {
      return var;
    }

    public IndexExpr getA() {
      return a;
    }

    @Override
    public DataType getDataType() {
      return a.getDataType();
    }

    @Override
    public void accept(NotationVisitorStrict visitor) {
      visitor.visit(this);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      if (op == BinaryOp.ADD) {
        sb.append("sum(");
      } else {
        sb.append("reduction(").append(op.opName()).append(", ");
      }
      sb.append(var).append(", ");
      a.prettyPrint(sb);
      sb.append(")");
    }

    @Override
    public int hashCode() {
      int result = op.hashCode();
      result = 31 * result + var.hashCode();
      result = 31 * result + a.hashCode();
      return result;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Reduction)) {
        return false;
      }
      Reduction other = (Reduction)obj;
      return op == other.op && var.equals(other.var) && a.equals(other.a);
    }
  }
}
