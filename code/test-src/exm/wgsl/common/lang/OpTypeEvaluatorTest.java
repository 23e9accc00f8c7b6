package exm.wgsl.common.lang;

import static exm.wgsl.common.lang.OpTypeEvaluator.evalBinary;
import static exm.wgsl.common.lang.OpTypeEvaluator.evalUnary;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import exm.wgsl.common.lang.Operators.BinaryOp;
import exm.wgsl.common.lang.Operators.OpGroup;
import exm.wgsl.common.lang.Operators.UnaryOp;
import exm.wgsl.common.lang.Types.DataType;
import exm.wgsl.common.lang.Types.ScalarType;

public class OpTypeEvaluatorTest {

  private static final List<DataType> SAMPLE_TYPES = Arrays.asList(
      Types.BOOL, Types.I32, Types.U32,
      Types.vector(2, ScalarType.I32),
      Types.vector(3, ScalarType.BOOL),
      Types.vector(4, ScalarType.U32),
      Types.array(Types.I32, 4),
      Types.runtimeArray(Types.vector(2, ScalarType.U32)),
      Types.named("T"));

  @Test
  public void testUnaryPreservesType() {
    for (UnaryOp op: UnaryOp.values()) {
      for (DataType t: SAMPLE_TYPES) {
        assertEquals(op + " on " + t, t, evalUnary(op, t));
      }
    }
  }

  @Test
  public void testArithmeticTakesLeftType() {
    for (BinaryOp op: Operators.getOps(OpGroup.ARITHMETIC)) {
      for (DataType l: SAMPLE_TYPES) {
        for (DataType r: SAMPLE_TYPES) {
          assertEquals(op + " on " + l + ", " + r, l, evalBinary(op, l, r));
        }
      }
    }
  }

  @Test
  public void testLogicalAlwaysScalarBool() {
    for (BinaryOp op: Operators.getOps(OpGroup.LOGICAL)) {
      for (DataType l: SAMPLE_TYPES) {
        for (DataType r: SAMPLE_TYPES) {
          assertEquals(op + " on " + l + ", " + r, Types.BOOL,
                       evalBinary(op, l, r));
        }
      }
    }
  }

  @Test
  public void testRelationalKeepsLeftShape() {
    for (BinaryOp op: Operators.getOps(OpGroup.RELATIONAL)) {
      for (DataType l: SAMPLE_TYPES) {
        for (DataType r: SAMPLE_TYPES) {
          assertEquals(op + " on " + l + ", " + r,
                       l.withScalarKind(ScalarType.BOOL),
                       evalBinary(op, l, r));
        }
      }
    }
  }

  @Test
  public void testRelationalConcrete() {
    DataType vec3i = Types.vector(3, ScalarType.I32);
    assertEquals("Vector comparison gives bool vector",
        Types.vector(3, ScalarType.BOOL),
        evalBinary(BinaryOp.LESS, vec3i, vec3i));
    assertEquals("Scalar comparison gives scalar bool",
        Types.BOOL, evalBinary(BinaryOp.EQUAL, Types.U32, Types.U32));
    assertEquals("Logical op on vectors still gives scalar bool",
        Types.BOOL, evalBinary(BinaryOp.LOG_OR,
            Types.vector(2, ScalarType.BOOL), Types.vector(2, ScalarType.BOOL)));
  }

  @Test
  public void testRightOperandIgnored() {
    assertEquals(Types.I32,
        evalBinary(BinaryOp.PLUS, Types.I32, Types.vector(4, ScalarType.U32)));
    assertEquals(Types.vector(2, ScalarType.BOOL),
        evalBinary(BinaryOp.GREATER_EQUAL, Types.vector(2, ScalarType.U32),
                   Types.BOOL));
  }

  @Test
  public void testGroupsPartitionOperators() {
    assertEquals(10, Operators.getOps(OpGroup.ARITHMETIC).size());
    assertEquals(2, Operators.getOps(OpGroup.LOGICAL).size());
    assertEquals(6, Operators.getOps(OpGroup.RELATIONAL).size());

    Set<BinaryOp> seen = EnumSet.noneOf(BinaryOp.class);
    for (OpGroup g: OpGroup.values()) {
      seen.addAll(Operators.getOps(g));
    }
    assertEquals("Every operator in some group",
                 EnumSet.allOf(BinaryOp.class), seen);
    assertEquals(18, BinaryOp.values().length);
  }
}
