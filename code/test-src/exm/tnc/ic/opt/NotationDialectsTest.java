package exm.tnc.ic.opt;

import static exm.tnc.ic.opt.NotationDialects.isConcreteNotation;
import static exm.tnc.ic.opt.NotationDialects.isEinsumNotation;
import static exm.tnc.ic.opt.NotationDialects.isReductionNotation;
import static exm.tnc.ic.opt.NotationDialects.whyNotConcreteNotation;
import static exm.tnc.ic.opt.NotationDialects.whyNotEinsumNotation;
import static exm.tnc.ic.opt.NotationDialects.whyNotReductionNotation;
import static exm.tnc.ic.tree.IndexNotation.access;
import static exm.tnc.ic.tree.IndexNotation.add;
import static exm.tnc.ic.tree.IndexNotation.assign;
import static exm.tnc.ic.tree.IndexNotation.compound;
import static exm.tnc.ic.tree.IndexNotation.div;
import static exm.tnc.ic.tree.IndexNotation.forall;
import static exm.tnc.ic.tree.IndexNotation.literal;
import static exm.tnc.ic.tree.IndexNotation.mul;
import static exm.tnc.ic.tree.IndexNotation.neg;
import static exm.tnc.ic.tree.IndexNotation.sub;
import static exm.tnc.ic.tree.IndexNotation.sum;
import static exm.tnc.ic.tree.IndexNotation.where;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.tnc.common.Logging;
import exm.tnc.common.lang.DataType;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.lang.TensorVar;
import exm.tnc.common.lang.Type;
import exm.tnc.ic.tree.NotationExprs.BinaryOp;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;

public class NotationDialectsTest {

  private static final DataType DT = DataType.FLOAT64;

  private final IndexVar i = new IndexVar("i");
  private final IndexVar j = new IndexVar("j");
  private final IndexVar k = new IndexVar("k");

  private final TensorVar A = new TensorVar("A", Type.fixed(DT, 3, 4));
  private final TensorVar B = new TensorVar("B", Type.fixed(DT, 3, 4, 5));
  private final TensorVar C = new TensorVar("C", Type.fixed(DT, 5, 4));
  private final TensorVar a = new TensorVar("a", Type.fixed(DT, 3));
  private final TensorVar b = new TensorVar("b", Type.fixed(DT, 3));
  private final TensorVar c = new TensorVar("c", Type.fixed(DT, 3));
  private final TensorVar M = new TensorVar("M", Type.fixed(DT, 3, 5));
  private final TensorVar t = new TensorVar("t", Type.scalar(DT));

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/NotationDialectsTest.tnc.log", true);
  }

  private IndexStmt einsum() {
    return assign(access(A, i, j), mul(access(B, i, j, k), access(C, k, j)));
  }

  private IndexStmt reduction() {
    return assign(access(A, i, j),
                  sum(k, mul(access(B, i, j, k), access(C, k, j))));
  }

  private IndexStmt concrete() {
    return forall(Arrays.asList(i, j, k), compound(access(A, i, j),
              mul(access(B, i, j, k), access(C, k, j)), BinaryOp.ADD));
  }

  @Test
  public void testEinsum() {
    assertTrue(isEinsumNotation(einsum()));
    assertFalse(isReductionNotation(einsum()));
    assertEquals("index variable k is not reduced",
                 whyNotReductionNotation(einsum()));
    assertFalse(isConcreteNotation(einsum()));
  }

  @Test
  public void testReduction() {
    assertTrue(isReductionNotation(reduction()));
    assertEquals("einsum notation may not contain reductions",
                 whyNotEinsumNotation(reduction()));
    assertFalse(isConcreteNotation(reduction()));
  }

  @Test
  public void testConcrete() {
    assertTrue(isConcreteNotation(concrete()));
    assertNull(whyNotConcreteNotation(concrete()));
    assertEquals("einsum notation must be a single assignment",
                 whyNotEinsumNotation(concrete()));
    assertEquals("reduction notation must be a single assignment",
                 whyNotReductionNotation(concrete()));
  }

  @Test
  public void testNoReductionVariablesOverlap() {
    IndexStmt stmt = assign(access(A, i, j),
                     add(access(M, i, j), access(A, i, j)));
    assertTrue(isEinsumNotation(stmt));
    assertTrue(isReductionNotation(stmt));
    assertFalse(isConcreteNotation(stmt));
  }

  @Test
  public void testSumOfProducts() {
    assertTrue(NotationDialects.isSumOfProducts(
        sub(mul(access(a, i), access(b, i)), neg(div(access(c, i),
                                                     literal(2.0))))));
    assertFalse(NotationDialects.isSumOfProducts(
        mul(add(access(a, i), access(b, i)), access(c, i))));
    assertFalse(NotationDialects.isSumOfProducts(
        div(access(a, i), sub(access(b, i), access(c, i)))));

    IndexStmt stmt = assign(access(a, i),
                     mul(add(access(b, i), access(c, i)), access(b, i)));
    assertEquals("einsum notation must be a sum of products",
                 whyNotEinsumNotation(stmt));
  }

  @Test
  public void testCompoundIsNotEinsumOrReduction() {
    IndexStmt stmt = compound(access(a, i), access(b, i), BinaryOp.ADD);
    assertEquals("einsum notation may not contain compound assignments",
                 whyNotEinsumNotation(stmt));
    assertEquals("reduction notation may not contain compound assignments",
                 whyNotReductionNotation(stmt));
  }

  @Test
  public void testBadReductions() {
    assertEquals("index variable k is reduced more than once",
        whyNotReductionNotation(assign(access(a, i),
                                sum(k, sum(k, access(M, i, k))))));
    assertEquals("reduction over free index variable i",
        whyNotReductionNotation(assign(access(a, i), sum(i, access(b, i)))));
  }

  @Test
  public void testSeparateReductionsOfOneVariable() {
    IndexStmt stmt = assign(access(a, i),
        add(sum(k, access(M, i, k)), sum(k, access(M, i, k))));
    assertTrue(isReductionNotation(stmt));
  }

  @Test
  public void testConcreteRequiresCompound() {
    IndexStmt stmt = forall(Arrays.asList(i, j, k), assign(access(A, i, j),
                       mul(access(B, i, j, k), access(C, k, j))));
    assertEquals("reduction variable k requires a compound assignment",
                 whyNotConcreteNotation(stmt));
  }

  @Test
  public void testConcreteRequiresForall() {
    IndexStmt stmt = forall(i, assign(access(A, i, j), access(M, i, j)));
    assertEquals("index variable j is not bound by a forall",
                 whyNotConcreteNotation(stmt));
  }

  @Test
  public void testConcreteNoReductions() {
    IndexStmt stmt = forall(i, assign(access(a, i), sum(k, access(M, i, k))));
    assertEquals("concrete notation may not contain reductions",
                 whyNotConcreteNotation(stmt));
  }

  @Test
  public void testConcreteUniqueForalls() {
    IndexStmt stmt = forall(i, forall(i, assign(access(a, i), access(b, i))));
    assertEquals("index variable i is bound by more than one forall",
                 whyNotConcreteNotation(stmt));
  }

  @Test
  public void testConcreteWhere() {
    // Producer reduces over k into t, consumer reads t
    IndexStmt stmt = forall(i, where(
        assign(access(a, i), add(access(t), access(b, i))),
        forall(k, compound(access(t), access(M, i, k), BinaryOp.ADD))));
    assertTrue(isConcreteNotation(stmt));
  }

  @Test
  public void testConcreteWhereFixesOuterLoops() {
    // k is bound outside the where, so it is fixed inside
    IndexStmt stmt = forall(k, where(
        forall(i, assign(access(a, i), add(access(t), access(b, i)))),
        assign(access(t), access(c, k))));
    assertTrue(isConcreteNotation(stmt));

    // Without the where, k is a reduction variable of the assignment
    IndexStmt noWhere = forall(k, forall(i, assign(access(a, i),
                                                   access(M, i, k))));
    assertFalse(isConcreteNotation(noWhere));
  }
}
