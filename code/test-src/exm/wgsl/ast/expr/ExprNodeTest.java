package exm.wgsl.ast.expr;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.wgsl.common.exceptions.WGSLRuntimeError;
import exm.wgsl.common.lang.Operators.BinaryOp;
import exm.wgsl.common.lang.Operators.UnaryOp;
import exm.wgsl.common.lang.Types;
import exm.wgsl.common.lang.Types.DataType;
import exm.wgsl.common.lang.Types.ScalarType;

public class ExprNodeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final ExprNode A = ExprNode.varRef("a", Types.I32);
  private static final ExprNode B = ExprNode.varRef("b", Types.I32);

  @Test
  public void testLiterals() {
    assertEquals("5u", ExprNode.uintLit(5).toString());
    assertEquals("4294967295u", ExprNode.uintLit(0xFFFFFFFFL).toString());
    assertEquals("-12", ExprNode.intLit(-12).toString());
    assertEquals("true", ExprNode.boolLit(true).toString());
    assertEquals("false", ExprNode.boolLit(false).toString());
  }

  @Test
  public void testLiteralTypes() {
    assertEquals(Types.U32, ExprNode.uintLit(5).dataType());
    assertEquals(Types.I32, ExprNode.intLit(5).dataType());
    assertEquals(Types.BOOL, ExprNode.boolLit(true).dataType());
  }

  @Test
  public void testUIntOutOfRange() {
    exception.expect(IllegalArgumentException.class);
    Lit.createUIntLit(-1);
  }

  @Test
  public void testWrongLiteralAccessor() {
    exception.expect(WGSLRuntimeError.class);
    Lit.createIntLit(3).getBoolLit();
  }

  @Test
  public void testBinOpParenthesized() {
    assertEquals("(a) + (b)", ExprNode.binOp(BinaryOp.PLUS, A, B).toString());
  }

  @Test
  public void testUnOpParenthesized() {
    ExprNode x = ExprNode.varRef("x", Types.BOOL);
    assertEquals("!(x)", ExprNode.unOp(UnaryOp.NOT, x).toString());
    assertEquals("~(5u)",
        ExprNode.unOp(UnaryOp.BIT_NOT, ExprNode.uintLit(5)).toString());
  }

  @Test
  public void testNestedOps() {
    ExprNode sum = ExprNode.binOp(BinaryOp.PLUS, A, ExprNode.intLit(1));
    ExprNode cmp = ExprNode.binOp(BinaryOp.LESS_EQUAL,
        ExprNode.unOp(UnaryOp.NEGATE, sum), B);
    assertEquals("(-((a) + (1))) <= (b)", cmp.toString());
    assertEquals(Types.BOOL, cmp.dataType());
  }

  @Test
  public void testTypeCons() {
    DataType vec3 = Types.vector(3, ScalarType.U32);
    ExprNode cons = ExprNode.typeCons(vec3, ExprNode.uintLit(1),
        ExprNode.uintLit(2), ExprNode.varRef("z", Types.U32));
    assertEquals("vec3<u32>(1u, 2u, z)", cons.toString());
    assertEquals(vec3, cons.dataType());
  }

  @Test
  public void testTypeConsNoArgs() {
    assertEquals("i32()", ExprNode.typeCons(Types.I32).toString());
  }

  @Test
  public void testBuilderStampsTypes() {
    DataType vec2 = Types.vector(2, ScalarType.I32);
    ExprNode v = ExprNode.varRef("v", vec2);
    assertEquals(vec2, ExprNode.binOp(BinaryOp.TIMES, v, v).dataType());
    assertEquals(Types.vector(2, ScalarType.BOOL),
                 ExprNode.binOp(BinaryOp.NOT_EQUAL, v, v).dataType());
    assertEquals(Types.BOOL,
        ExprNode.binOp(BinaryOp.LOG_AND, ExprNode.boolLit(true),
                       ExprNode.boolLit(false)).dataType());
    assertEquals(vec2, ExprNode.unOp(UnaryOp.NEGATE, v).dataType());
  }

  @Test
  public void testStructuralEquality() {
    ExprNode e1 = ExprNode.binOp(BinaryOp.MINUS, A, ExprNode.intLit(2));
    ExprNode e2 = ExprNode.binOp(BinaryOp.MINUS,
        ExprNode.varRef("a", Types.I32), ExprNode.intLit(2));
    assertEquals(e1, e2);
    assertEquals(e1.hashCode(), e2.hashCode());
    assertFalse(e1.equals(ExprNode.binOp(BinaryOp.PLUS, A,
                                         ExprNode.intLit(2))));
    assertFalse("Type is part of node identity",
        A.equals(ExprNode.varRef("a", Types.U32)));
  }
}
