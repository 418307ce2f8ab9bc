package exm.tnc.ic.opt;

import static exm.tnc.ic.tree.IndexNotation.access;
import static exm.tnc.ic.tree.IndexNotation.add;
import static exm.tnc.ic.tree.IndexNotation.assign;
import static exm.tnc.ic.tree.IndexNotation.forall;
import static exm.tnc.ic.tree.IndexNotation.mul;
import static exm.tnc.ic.tree.IndexNotation.sub;
import static exm.tnc.ic.tree.IndexNotation.sum;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Set;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tnc.common.Logging;
import exm.tnc.common.Settings;
import exm.tnc.common.exceptions.InvalidNotationException;
import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.common.exceptions.UserException;
import exm.tnc.common.lang.DataType;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.lang.TensorVar;
import exm.tnc.common.lang.Type;
import exm.tnc.ic.tree.NotationExprs.Access;
import exm.tnc.ic.tree.NotationStmts.Assignment;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;

public class NotationLoweringTest {

  private static final DataType DT = DataType.FLOAT64;

  private static Logger logger;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private final IndexVar i = new IndexVar("i");
  private final IndexVar j = new IndexVar("j");
  private final IndexVar k = new IndexVar("k");

  private final TensorVar A = new TensorVar("A", Type.fixed(DT, 3, 4));
  private final TensorVar B = new TensorVar("B", Type.fixed(DT, 3, 5));
  private final TensorVar C = new TensorVar("C", Type.fixed(DT, 5, 4));
  private final TensorVar r = new TensorVar("r", Type.fixed(DT, 3));
  private final TensorVar b = new TensorVar("b", Type.fixed(DT, 3));
  private final TensorVar x = new TensorVar("x", Type.fixed(DT, 5));

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("target/NotationLoweringTest.tnc.log",
                                  true);
  }

  @After
  public void resetSettings() {
    for (String key: Settings.getKeys()) {
      Settings.reset(key);
    }
  }

  private Assignment matmul() {
    return assign(access(A, i, j), mul(access(B, i, k), access(C, k, j)));
  }

  private Assignment residual() {
    return assign(access(r, i),
                  sub(access(b, i), mul(access(B, i, k), access(x, k))));
  }

  @Test
  public void testEinsum() throws UserException {
    IndexStmt result = NotationLowering.lower(logger, null, matmul());
    assertEquals("forall(i, forall(j, forall(k, " +
                 "A(i,j) += B(i,k) * C(k,j))))", result.toString());
  }

  @Test
  public void testReductionInput() throws UserException {
    IndexStmt red = assign(access(A, i, j),
                           sum(k, mul(access(B, i, k), access(C, k, j))));
    assertEquals("reduction notation", NotationLowering.describeNotation(red));
    IndexStmt result = NotationLowering.lower(logger, null, red);
    assertEquals("forall(i, forall(j, forall(k, " +
                 "A(i,j) += B(i,k) * C(k,j))))", result.toString());
  }

  @Test
  public void testConcreteInputUnchanged() throws UserException {
    IndexStmt concrete = NotationLowering.lower(logger, null, matmul());
    assertEquals("concrete notation",
                 NotationLowering.describeNotation(concrete));
    assertSame(concrete, NotationLowering.lower(logger, null, concrete));
  }

  @Test
  public void testDescribe() {
    assertEquals("einsum notation",
                 NotationLowering.describeNotation(matmul()));
    assertEquals("mixed notation", NotationLowering.describeNotation(
        forall(i, assign(access(r, i), sum(k, access(B, i, k))))));
  }

  @Test
  public void testStages() throws UserException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    NotationLowering.lower(logger, out, matmul());
    String text = buffer.toString(StandardCharsets.UTF_8);
    assertTrue(text, text.contains("Input: A(i,j) = B(i,k) * C(k,j)"));
    assertTrue(text, text.contains("Make reduction notation: " +
                                   "A(i,j) = sum(k, B(i,k) * C(k,j))"));
    assertTrue(text, text.contains("Make concrete notation: forall(i, "));
    assertTrue(text, text.contains("Split operators: forall(i, "));
  }

  @Test
  public void testTemporary() throws UserException {
    IndexStmt result = NotationLowering.lower(logger, null, residual());
    assertEquals("forall(i, where(r(i) = b(i) - tk, " +
                 "forall(k, tk += B(i,k) * x(k))))", result.toString());
  }

  @Test
  public void testZeroed() throws UserException {
    Set<Access> zeroed = Collections.singleton(access(B, i, k));
    IndexStmt result = NotationLowering.lower(logger, null, residual(),
                                              zeroed);
    assertEquals("forall(i, r(i) = b(i))", result.toString());
  }

  @Test
  public void testZeroedDisabled() throws UserException {
    Settings.set(Settings.OPT_SIMPLIFY, "false");
    Set<Access> zeroed = Collections.singleton(access(B, i, k));
    IndexStmt result = NotationLowering.lower(logger, null, residual(),
                                              zeroed);
    assertEquals("forall(i, where(r(i) = b(i) - tk, " +
                 "forall(k, tk += B(i,k) * x(k))))", result.toString());
  }

  @Test
  public void testSplitDisabled() throws UserException {
    Settings.set(Settings.OPT_SPLIT_OPERATORS, "false");
    Assignment stmt = matmul();
    stmt.getRhs().splitOperator(i, new IndexVar("il"), new IndexVar("ir"));
    IndexStmt result = NotationLowering.lower(logger, null, stmt);
    assertEquals("forall(i, forall(j, forall(k, " +
                 "A(i,j) += B(i,k) * C(k,j))))", result.toString());
    assertEquals(1, SplitOperators.findSplits(result).size());
  }

  @Test
  public void testSplit() throws UserException {
    Assignment stmt = matmul();
    stmt.getRhs().splitOperator(i, new IndexVar("il"), new IndexVar("ir"));
    IndexStmt result = NotationLowering.lower(logger, null, stmt);
    assertEquals("where(forall(ir, forall(j, forall(k, " +
                 "A(ir,j) += wi(ir,k) * C(k,j)))), " +
                 "forall(il, forall(k, wi(il,k) = B(il,k))))",
                 result.toString());
  }

  @Test
  public void testInvalid() throws UserException {
    TensorVar D = new TensorVar("D", Type.fixed(DT, 3, 4));
    exception.expect(InvalidNotationException.class);
    exception.expectMessage("index variable j is not reduced");
    NotationLowering.lower(logger, null, assign(access(r, i),
        add(sum(k, access(B, i, k)), access(D, i, j))));
  }

  @Test
  public void testPipelineValidates() throws UserException {
    NotationPipeline pipeline = new NotationPipeline(null,
                                      Validate.standardValidator());
    pipeline.addPass(new NotationPass() {
      @Override
      public String getPassName() {
        return "Bind twice";
      }

      @Override
      public String getConfigEnabledKey() {
        return null;
      }

      @Override
      public IndexStmt apply(Logger logger, IndexStmt stmt) {
        return forall(i, forall(i, stmt));
      }
    });
    assertEquals(1, pipeline.getPasses().size());
    exception.expect(TNCRuntimeError.class);
    exception.expectMessage("bound twice");
    pipeline.runPipeline(logger, matmul());
  }

  @Test
  public void testPipelineSkipsDisabled() throws UserException {
    Settings.set(Settings.COMPILER_DEBUG, "false");
    NotationPipeline pipeline = new NotationPipeline(null, null);
    pipeline.addPass(Validate.concreteValidator());
    assertFalse(pipeline.passEnabled(Validate.concreteValidator()));
    IndexStmt stmt = matmul();
    // Validation would fail, but the pass is disabled
    assertSame(stmt, pipeline.runPipeline(logger, stmt));
  }
}
