package exm.wgsl.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;

import org.junit.Test;

import exm.wgsl.common.lang.Types.DataType;
import exm.wgsl.common.lang.Types.ScalarType;

public class TypesTest {

  @Test
  public void testTypeNames() {
    assertEquals("bool", Types.BOOL.typeName());
    assertEquals("i32", Types.I32.typeName());
    assertEquals("u32", Types.U32.typeName());
    assertEquals("vec3<i32>", Types.vector(3, ScalarType.I32).typeName());
    assertEquals("array<u32, 8>", Types.array(Types.U32, 8).typeName());
    assertEquals("array<vec2<bool>>",
        Types.runtimeArray(Types.vector(2, ScalarType.BOOL)).typeName());
    assertEquals("T", Types.named("T").typeName());
  }

  @Test
  public void testStructuralEquality() {
    assertEquals(Types.vector(4, ScalarType.U32),
                 Types.vector(4, ScalarType.U32));
    assertEquals(Types.vector(4, ScalarType.U32).hashCode(),
                 Types.vector(4, ScalarType.U32).hashCode());
    assertFalse(Types.vector(4, ScalarType.U32).equals(
                Types.vector(3, ScalarType.U32)));
    assertFalse(Types.array(Types.I32, 2).equals(
                Types.runtimeArray(Types.I32)));
    assertFalse(Types.I32.equals(Types.named("i32")));
  }

  @Test
  public void testWithScalarKind() {
    assertEquals(Types.BOOL, Types.I32.withScalarKind(ScalarType.BOOL));
    assertEquals(Types.vector(2, ScalarType.BOOL),
        Types.vector(2, ScalarType.U32).withScalarKind(ScalarType.BOOL));
    assertEquals(Types.array(Types.vector(3, ScalarType.BOOL), 5),
        Types.array(Types.vector(3, ScalarType.I32), 5)
             .withScalarKind(ScalarType.BOOL));

    DataType named = Types.named("S");
    assertSame("Named types have no scalar part", named,
               named.withScalarKind(ScalarType.BOOL));
  }

  @Test(expected=IllegalArgumentException.class)
  public void testBadVectorWidth() {
    Types.vector(5, ScalarType.I32);
  }

  @Test(expected=IllegalArgumentException.class)
  public void testZeroSizeArray() {
    Types.array(Types.U32, 0);
  }
}
