package exm.tnc.ic.opt;

import static exm.tnc.ic.opt.MakeReductionNotation.makeReductionNotation;
import static exm.tnc.ic.tree.IndexNotation.access;
import static exm.tnc.ic.tree.IndexNotation.add;
import static exm.tnc.ic.tree.IndexNotation.assign;
import static exm.tnc.ic.tree.IndexNotation.compound;
import static exm.tnc.ic.tree.IndexNotation.forall;
import static exm.tnc.ic.tree.IndexNotation.mul;
import static exm.tnc.ic.tree.IndexNotation.neg;
import static exm.tnc.ic.tree.IndexNotation.sum;
import static exm.tnc.ic.tree.IndexNotation.where;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tnc.common.Logging;
import exm.tnc.common.exceptions.InvalidNotationException;
import exm.tnc.common.lang.DataType;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.lang.TensorVar;
import exm.tnc.common.lang.Type;
import exm.tnc.ic.tree.IndexNotation;
import exm.tnc.ic.tree.NotationExprs.BinaryOp;
import exm.tnc.ic.tree.NotationStmts.Assignment;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;

public class MakeReductionNotationTest {

  private static final DataType DT = DataType.FLOAT64;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private final IndexVar i = new IndexVar("i");
  private final IndexVar j = new IndexVar("j");
  private final IndexVar k = new IndexVar("k");
  private final IndexVar l = new IndexVar("l");

  private final TensorVar a = new TensorVar("a", Type.scalar(DT));
  private final TensorVar A = new TensorVar("A", Type.fixed(DT, 3));
  private final TensorVar M = new TensorVar("A", Type.fixed(DT, 3, 4));
  private final TensorVar B = new TensorVar("B", Type.fixed(DT, 3, 5));
  private final TensorVar C = new TensorVar("C", Type.fixed(DT, 3, 5));
  private final TensorVar D = new TensorVar("D", Type.fixed(DT, 3));
  private final TensorVar c = new TensorVar("c", Type.fixed(DT, 5));

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/MakeReductionNotationTest.tnc.log", true);
  }

  @Test
  public void testMatrixMultiply() throws InvalidNotationException {
    TensorVar B3 = new TensorVar("B", Type.fixed(DT, 3, 4, 5));
    TensorVar C2 = new TensorVar("C", Type.fixed(DT, 5, 4));
    Assignment einsum = assign(access(M, i, j),
                          mul(access(B3, i, j, k), access(C2, k, j)));
    Assignment result = makeReductionNotation(einsum);
    assertEquals("A(i,j) = sum(k, B(i,j,k) * C(k,j))", result.toString());
    assertTrue(NotationDialects.isReductionNotation(result));
  }

  @Test
  public void testNoSummedVariables() throws InvalidNotationException {
    Assignment einsum = assign(access(A, i), add(access(D, i), access(D, i)));
    assertSame(einsum, makeReductionNotation(einsum));
  }

  @Test
  public void testSumOutsideProductOnly() throws InvalidNotationException {
    Assignment result = makeReductionNotation(assign(access(A, i),
        add(mul(access(B, i, k), access(c, k)), access(D, i))));
    assertEquals("A(i) = sum(k, B(i,k) * c(k)) + D(i)", result.toString());
  }

  @Test
  public void testSumDistributesOverAddition()
      throws InvalidNotationException {
    Assignment result = makeReductionNotation(assign(access(A, i),
        add(access(B, i, k), access(C, i, k))));
    assertEquals("A(i) = sum(k, B(i,k) + C(i,k))", result.toString());
  }

  @Test
  public void testSeparateSums() throws InvalidNotationException {
    Assignment result = makeReductionNotation(assign(access(A, i),
        add(add(access(B, i, k), access(D, i)), access(C, i, k))));
    assertEquals("A(i) = sum(k, B(i,k)) + D(i) + sum(k, C(i,k))",
                 result.toString());
    assertTrue(NotationDialects.isReductionNotation(result));
  }

  @Test
  public void testScalarResult() throws InvalidNotationException {
    Assignment result = makeReductionNotation(assign(access(a),
        mul(access(B, i, j), access(C, i, j))));
    assertEquals("a = sum(i, sum(j, B(i,j) * C(i,j)))", result.toString());
  }

  @Test
  public void testNestedPlacement() throws InvalidNotationException {
    TensorVar B3 = new TensorVar("B", Type.fixed(DT, 3, 5, 6));
    TensorVar c6 = new TensorVar("C", Type.fixed(DT, 6));
    TensorVar D2 = new TensorVar("D", Type.fixed(DT, 3, 5));
    Assignment result = makeReductionNotation(assign(access(A, i),
        add(mul(access(B3, i, k, l), access(c6, l)), access(D2, i, k))));
    assertEquals("A(i) = sum(k, sum(l, B(i,k,l) * C(l)) + D(i,k))",
                 result.toString());
  }

  @Test
  public void testNegation() throws InvalidNotationException {
    Assignment result = makeReductionNotation(assign(access(A, i),
        neg(mul(access(B, i, k), access(c, k)))));
    assertEquals("A(i) = -sum(k, B(i,k) * c(k))", result.toString());
  }

  @Test
  public void testNotEinsum() throws InvalidNotationException {
    exception.expect(InvalidNotationException.class);
    exception.expectMessage("einsum notation may not contain reductions");
    makeReductionNotation(assign(access(A, i), sum(k, access(B, i, k))));
  }

  @Test
  public void testReason() {
    Assignment bad = assign(access(A, i),
        mul(add(access(D, i), access(D, i)), access(B, i, k)));
    try {
      makeReductionNotation(bad);
      fail("Expected InvalidNotationException");
    } catch (InvalidNotationException ex) {
      assertEquals("einsum notation must be a sum of products",
                   ex.getReason());
      assertEquals(ex.getReason() + ": " + bad, ex.getMessage());
    }
  }

  @Test
  public void testStatementKeepsBoundVariables()
      throws InvalidNotationException {
    IndexStmt stmt = forall(k, assign(access(A, i), access(B, i, k)));
    assertSame(stmt, makeReductionNotation(stmt));
  }

  @Test
  public void testStatementLowersLeaves() throws InvalidNotationException {
    IndexStmt stmt = forall(i, where(
        assign(access(A, i), add(access(a), access(D, i))),
        assign(access(a), mul(access(B, i, k), access(c, k)))));
    IndexStmt result = makeReductionNotation(stmt);
    assertEquals("forall(i, where(A(i) = a + D(i), " +
                 "a = sum(k, B(i,k) * c(k))))", result.toString());
  }

  @Test
  public void testStatementKeepsReductionsAndCompounds()
      throws InvalidNotationException {
    IndexStmt stmt = IndexNotation.multi(
        assign(access(A, i), sum(k, access(B, i, k))),
        forall(i, forall(k, compound(access(A, i), access(C, i, k),
                                     BinaryOp.ADD))));
    assertSame(stmt, makeReductionNotation(stmt));
  }

  @Test
  public void testStatementRejectsBadLeaf() throws InvalidNotationException {
    exception.expect(InvalidNotationException.class);
    exception.expectMessage("index variable j is not reduced");
    makeReductionNotation(forall(i, assign(access(A, i),
        add(sum(k, access(B, i, k)), access(M, i, j)))));
  }
}
