package exm.tnc.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.ic.tree.NotationStmts.Assignment;

public class SymbolTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testIndexVarIdentity() {
    IndexVar i1 = new IndexVar("i");
    IndexVar i2 = new IndexVar("i");
    assertEquals(i1, i1);
    assertNotEquals("Same name, different variable", i1, i2);
    assertEquals("i", i1.toString());
    assertTrue(i1.compareTo(i2) < 0);
  }

  @Test
  public void testIndexVarGeneratedName() {
    IndexVar v = new IndexVar();
    assertEquals("i" + v.getId(), v.getName());
  }

  @Test
  public void testTensorVar() {
    Type type = Type.fixed(DataType.FLOAT64, 3, 4);
    TensorVar a = new TensorVar("A", type);
    TensorVar b = new TensorVar("A", type);
    assertNotEquals("Compared by identity", a, b);
    assertEquals(2, a.getOrder());
    assertEquals(Format.dense(2), a.getFormat());
    assertEquals("float64[3,4]", a.getType().toString());
    assertTrue(a.getSchedule().isEmpty());

    a.setName("X");
    assertEquals("X", a.getName());
  }

  @Test
  public void testTensorVarGeneratedName() {
    TensorVar t = new TensorVar(Type.scalar(DataType.INT32));
    assertTrue(t.getName().startsWith("A"));
    assertEquals(0, t.getOrder());
  }

  @Test
  public void testTensorVarAssignment() {
    IndexVar i = new IndexVar("i");
    TensorVar a = new TensorVar("a", Type.fixed(DataType.FLOAT64, 3));
    TensorVar b = new TensorVar("b", Type.fixed(DataType.FLOAT64, 3));
    assertFalse(a.hasAssignment());
    assertNull(a.getAssignment());

    Assignment def = a.access(i).assign(b.access(i));
    a.setAssignment(def);
    assertTrue(a.hasAssignment());
    assertTrue(a.getAssignment() == def);

    Assignment redef = a.access(i).accumulate(b.access(i));
    a.setAssignment(redef);
    assertTrue("Overwrites previous", a.getAssignment() == redef);
  }

  @Test
  public void testFormatOrderMismatch() {
    exception.expect(TNCRuntimeError.class);
    new TensorVar("A", Type.fixed(DataType.FLOAT64, 3, 4),
                  new Format(ModeFormat.DENSE));
  }

  @Test
  public void testDimension() {
    assertEquals(Dimension.fixed(3), Dimension.fixed(3));
    assertNotEquals(Dimension.fixed(3), Dimension.variable());
    assertEquals("?", Dimension.variable().toString());
    assertEquals("5", Dimension.fixed(5).toString());
    assertEquals(new Type(DataType.INT32, Arrays.asList(Dimension.fixed(2))),
                 Type.fixed(DataType.INT32, 2));
  }

  @Test
  public void testNegativeDimension() {
    exception.expect(IllegalArgumentException.class);
    Dimension.fixed(-1);
  }

  @Test
  public void testDataTypePromotion() {
    assertEquals(DataType.FLOAT64,
                 DataType.max(DataType.INT64, DataType.FLOAT64));
    assertEquals(DataType.INT64,
                 DataType.max(DataType.INT64, DataType.INT32));
    assertEquals(DataType.COMPLEX64,
                 DataType.max(DataType.FLOAT64, DataType.COMPLEX64));
    assertEquals(DataType.UINT32,
                 DataType.max(DataType.BOOL, DataType.UINT32));
    assertEquals("complex128", DataType.COMPLEX128.toString());
  }
}
