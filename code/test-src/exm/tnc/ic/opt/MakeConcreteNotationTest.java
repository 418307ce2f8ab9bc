package exm.tnc.ic.opt;

import static exm.tnc.ic.opt.MakeConcreteNotation.makeConcreteNotation;
import static exm.tnc.ic.tree.IndexNotation.access;
import static exm.tnc.ic.tree.IndexNotation.add;
import static exm.tnc.ic.tree.IndexNotation.assign;
import static exm.tnc.ic.tree.IndexNotation.forall;
import static exm.tnc.ic.tree.IndexNotation.mul;
import static exm.tnc.ic.tree.IndexNotation.reduction;
import static exm.tnc.ic.tree.IndexNotation.sum;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;

import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tnc.common.Logging;
import exm.tnc.common.Settings;
import exm.tnc.common.exceptions.InvalidNotationException;
import exm.tnc.common.exceptions.UserException;
import exm.tnc.common.lang.DataType;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.lang.TensorVar;
import exm.tnc.common.lang.Type;
import exm.tnc.ic.tree.IndexNotation;
import exm.tnc.ic.tree.NotationExprs.BinaryOp;
import exm.tnc.ic.tree.NotationStmts.Assignment;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;

public class MakeConcreteNotationTest {

  private static final DataType DT = DataType.FLOAT64;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private final IndexVar i = new IndexVar("i");
  private final IndexVar j = new IndexVar("j");
  private final IndexVar k = new IndexVar("k");
  private final IndexVar l = new IndexVar("l");

  private final TensorVar A = new TensorVar("A", Type.fixed(DT, 3));
  private final TensorVar M = new TensorVar("A", Type.fixed(DT, 3, 4));
  private final TensorVar B = new TensorVar("B", Type.fixed(DT, 3, 5));
  private final TensorVar C = new TensorVar("C", Type.fixed(DT, 3, 5));
  private final TensorVar D = new TensorVar("D", Type.fixed(DT, 3));
  private final TensorVar c = new TensorVar("c", Type.fixed(DT, 5));

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/MakeConcreteNotationTest.tnc.log", true);
  }

  @After
  public void resetSettings() {
    Settings.reset(Settings.TEMPORARY_PREFIX);
  }

  private Assignment matmul() {
    TensorVar B3 = new TensorVar("B", Type.fixed(DT, 3, 4, 5));
    TensorVar C2 = new TensorVar("C", Type.fixed(DT, 5, 4));
    return assign(access(M, i, j), mul(access(B3, i, j, k), access(C2, k, j)));
  }

  private void checkConcrete(String expected, IndexStmt input)
      throws InvalidNotationException {
    IndexStmt result = makeConcreteNotation(input);
    assertEquals(expected, result.toString());
    assertTrue(NotationDialects.whyNotConcreteNotation(result),
               NotationDialects.isConcreteNotation(result));
  }

  @Test
  public void testEinsum() throws InvalidNotationException {
    checkConcrete("forall(i, forall(j, forall(k, " +
                  "A(i,j) += B(i,j,k) * C(k,j))))", matmul());
  }

  @Test
  public void testReduction() throws InvalidNotationException {
    Assignment einsum = matmul();
    Assignment red = MakeReductionNotation.makeReductionNotation(einsum);
    IndexStmt viaReduction = makeConcreteNotation(red);
    assertTrue(viaReduction.toString(),
        IndexNotation.equals(makeConcreteNotation(einsum), viaReduction));
  }

  @Test
  public void testNoReduction() throws InvalidNotationException {
    TensorVar B2 = new TensorVar("B", Type.fixed(DT, 3, 4));
    TensorVar C2 = new TensorVar("C", Type.fixed(DT, 3, 4));
    checkConcrete("forall(i, forall(j, A(i,j) = B(i,j) + C(i,j)))",
        assign(access(M, i, j), add(access(B2, i, j), access(C2, i, j))));
  }

  @Test
  public void testTemporary() throws InvalidNotationException {
    checkConcrete("forall(i, where(A(i) = tk + D(i), " +
                  "forall(k, tk += B(i,k) * c(k))))",
        assign(access(A, i), add(sum(k, mul(access(B, i, k), access(c, k))),
                                 access(D, i))));
  }

  @Test
  public void testTemporaryPrefix() throws InvalidNotationException {
    Settings.set(Settings.TEMPORARY_PREFIX, "tmp_");
    checkConcrete("forall(i, where(A(i) = tmp_k + D(i), " +
                  "forall(k, tmp_k += B(i,k) * c(k))))",
        assign(access(A, i), add(sum(k, mul(access(B, i, k), access(c, k))),
                                 access(D, i))));
  }

  @Test
  public void testNestedReduction() throws InvalidNotationException {
    TensorVar C2 = new TensorVar("C", Type.fixed(DT, 5, 6));
    checkConcrete("forall(i, forall(k, where(A(i) += B(i,k) * tl, " +
                  "forall(l, tl += C(k,l)))))",
        assign(access(A, i), sum(k, mul(access(B, i, k),
                                        sum(l, access(C2, k, l))))));
  }

  @Test
  public void testProductReduction() throws InvalidNotationException {
    checkConcrete("forall(i, forall(k, A(i) *= B(i,k)))",
        assign(access(A, i), reduction(BinaryOp.MUL, k, access(B, i, k))));
  }

  @Test
  public void testUniqueTemporaries() throws InvalidNotationException {
    checkConcrete("forall(i, where(where(A(i) = tk + D(i) + tk_1, " +
                  "forall(k, tk_1 += C(i,k))), forall(k, tk += B(i,k))))",
        assign(access(A, i), add(add(sum(k, access(B, i, k)), access(D, i)),
                                 sum(k, access(C, i, k)))));
  }

  @Test
  public void testTemporaryAvoidsTensorNames()
      throws InvalidNotationException {
    TensorVar tk = new TensorVar("tk", Type.fixed(DT, 3));
    IndexStmt result = makeConcreteNotation(assign(access(A, i),
        add(sum(k, access(B, i, k)), access(tk, i))));
    assertEquals("forall(i, where(A(i) = tk_1 + tk(i), " +
                 "forall(k, tk_1 += B(i,k))))", result.toString());
  }

  @Test
  public void testEnclosingLoopAccumulates() throws InvalidNotationException {
    checkConcrete("forall(k, forall(i, A(i) += B(i,k)))",
        forall(k, assign(access(A, i), access(B, i, k))));
  }

  @Test
  public void testIdempotent() throws InvalidNotationException {
    IndexStmt once = makeConcreteNotation(assign(access(A, i),
        add(sum(k, mul(access(B, i, k), access(c, k))), access(D, i))));
    IndexStmt twice = makeConcreteNotation(once);
    assertTrue(IndexNotation.equals(once, twice));
  }

  @Test
  public void testIndexVarsPreserved() throws UserException {
    Assignment input = assign(access(A, i),
        add(sum(k, mul(access(B, i, k), access(c, k))), access(D, i)));
    IndexStmt result = makeConcreteNotation(input);
    assertEquals(new HashSet<IndexVar>(IndexNotation.getIndexVars(input)),
                 new HashSet<IndexVar>(IndexNotation.getIndexVars(result)));
    assertEquals(IndexNotation.getIndexVarDomains(input),
                 IndexNotation.getIndexVarDomains(result));
  }

  @Test
  public void testInvalidInput() throws InvalidNotationException {
    exception.expect(InvalidNotationException.class);
    exception.expectMessage("not in einsum or reduction notation");
    makeConcreteNotation(assign(access(A, i),
        add(sum(k, access(B, i, k)), access(M, i, j))));
  }
}
