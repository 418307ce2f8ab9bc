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
package exm.tnc.ui;

import static exm.tnc.ic.tree.IndexNotation.access;
import static exm.tnc.ic.tree.IndexNotation.add;
import static exm.tnc.ic.tree.IndexNotation.assign;
import static exm.tnc.ic.tree.IndexNotation.mul;
import static exm.tnc.ic.tree.IndexNotation.sub;

import java.util.Arrays;
import java.util.List;

import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.common.lang.DataType;
import exm.tnc.common.lang.Format;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.lang.ModeFormat;
import exm.tnc.common.lang.TensorVar;
import exm.tnc.common.lang.Type;
import exm.tnc.ic.tree.NotationExprs.BinaryExpr;
import exm.tnc.ic.tree.NotationStmts.Assignment;

/**
 * Example tensor algebra kernels in einsum notation
 */
public class Kernels {
  public static final List<String> NAMES = Arrays.asList("matmul", "spmv",
                        "mttkrp", "ttv", "add", "inner", "residual");

  private static final DataType DT = DataType.FLOAT64;

  /**
   * Build a kernel.  Tensors are fresh on every call and each result
   * tensor has its assignment set.
   * @param name one of {@link #NAMES}
   */
  public static Assignment build(String name) {
    String kernel = name.toLowerCase();
    Assignment result;
    if (kernel.equals("matmul")) {
      result = matmul();
    } else if (kernel.equals("spmv")) {
      result = spmv();
    } else if (kernel.equals("mttkrp")) {
      result = mttkrp();
    } else if (kernel.equals("ttv")) {
      result = ttv();
    } else if (kernel.equals("add")) {
      result = add2();
    } else if (kernel.equals("inner")) {
      result = inner();
    } else if (kernel.equals("residual")) {
      result = residual();
    } else {
      throw new TNCRuntimeError("Unknown kernel: " + name);
    }
    result.getLhs().getTensorVar().setAssignment(result);
    return result;
  }

  /** A(i,j) = B(i,k) * C(k,j) */
  private static Assignment matmul() {
    IndexVar i = new IndexVar("i"), j = new IndexVar("j"),
             k = new IndexVar("k");
    TensorVar A = new TensorVar("A", Type.fixed(DT, 3, 4));
    TensorVar B = new TensorVar("B", Type.fixed(DT, 3, 5));
    TensorVar C = new TensorVar("C", Type.fixed(DT, 5, 4));
    return assign(access(A, i, j), mul(access(B, i, k), access(C, k, j)));
  }

  /** y(i) = A(i,j) * x(j), A in CSR format */
  private static Assignment spmv() {
    IndexVar i = new IndexVar("i"), j = new IndexVar("j");
    TensorVar y = new TensorVar("y", Type.fixed(DT, 8));
    Format csr = new Format(ModeFormat.DENSE, ModeFormat.SPARSE);
    TensorVar A = new TensorVar("A", Type.fixed(DT, 8, 6), csr);
    TensorVar x = new TensorVar("x", Type.fixed(DT, 6));
    return assign(access(y, i), mul(access(A, i, j), access(x, j)));
  }

  /**
   * A(i,j) = B(i,k,l) * D(l,j) * C(k,j), with B(i,k,l) * D(l,j) split
   * over j into a workspace
   */
  private static Assignment mttkrp() {
    IndexVar i = new IndexVar("i"), j = new IndexVar("j"),
             k = new IndexVar("k"), l = new IndexVar("l");
    TensorVar A = new TensorVar("A", Type.fixed(DT, 4, 3));
    Format sparse3 = new Format(ModeFormat.SPARSE, ModeFormat.SPARSE,
                                ModeFormat.SPARSE);
    TensorVar B = new TensorVar("B", Type.fixed(DT, 4, 5, 6), sparse3);
    TensorVar C = new TensorVar("C", Type.fixed(DT, 5, 3));
    TensorVar D = new TensorVar("D", Type.fixed(DT, 6, 3));
    BinaryExpr bd = mul(access(B, i, k, l), access(D, l, j));
    BinaryExpr rhs = mul(bd, access(C, k, j));
    rhs.splitOperator(j, new IndexVar("jl"), new IndexVar("jr"));
    return assign(access(A, i, j), rhs);
  }

  /** A(i,j) = B(i,j,k) * c(k) */
  private static Assignment ttv() {
    IndexVar i = new IndexVar("i"), j = new IndexVar("j"),
             k = new IndexVar("k");
    TensorVar A = new TensorVar("A", Type.fixed(DT, 3, 4));
    TensorVar B = new TensorVar("B", Type.fixed(DT, 3, 4, 5));
    TensorVar c = new TensorVar("c", Type.fixed(DT, 5));
    return assign(access(A, i, j), mul(access(B, i, j, k), access(c, k)));
  }

  /** A(i,j) = B(i,j) + C(i,j) */
  private static Assignment add2() {
    IndexVar i = new IndexVar("i"), j = new IndexVar("j");
    TensorVar A = new TensorVar("A", Type.fixed(DT, 3, 4));
    TensorVar B = new TensorVar("B", Type.fixed(DT, 3, 4));
    TensorVar C = new TensorVar("C", Type.fixed(DT, 3, 4));
    return assign(access(A, i, j), add(access(B, i, j), access(C, i, j)));
  }

  /** a = B(i,j,k) * C(i,j,k) */
  private static Assignment inner() {
    IndexVar i = new IndexVar("i"), j = new IndexVar("j"),
             k = new IndexVar("k");
    TensorVar a = new TensorVar("a", Type.scalar(DT));
    TensorVar B = new TensorVar("B", Type.fixed(DT, 3, 4, 5));
    TensorVar C = new TensorVar("C", Type.fixed(DT, 3, 4, 5));
    return assign(access(a), mul(access(B, i, j, k), access(C, i, j, k)));
  }

  /** r(i) = b(i) - A(i,j) * x(j) */
  private static Assignment residual() {
    IndexVar i = new IndexVar("i"), j = new IndexVar("j");
    TensorVar r = new TensorVar("r", Type.fixed(DT, 6));
    TensorVar b = new TensorVar("b", Type.fixed(DT, 6));
    TensorVar A = new TensorVar("A", Type.fixed(DT, 6, 6));
    TensorVar x = new TensorVar("x", Type.fixed(DT, 6));
    return assign(access(r, i),
                  sub(access(b, i), mul(access(A, i, j), access(x, j))));
  }
}
