package exm.wgsl.ast.stmt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.wgsl.ast.expr.ExprNode;
import exm.wgsl.ast.stmt.AssignmentLhs.Postfix;
import exm.wgsl.common.exceptions.WGSLRuntimeError;
import exm.wgsl.common.lang.Operators.BinaryOp;
import exm.wgsl.common.lang.Types;

public class StatementTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final ExprNode FLAG = ExprNode.varRef("flag", Types.BOOL);

  @Test
  public void testDeclarations() {
    assertEquals("let y = 1;",
        new LetDecl("y", ExprNode.intLit(1)).toString());
    assertEquals("var z = (y) * (2u);",
        new VarDecl("z", ExprNode.binOp(BinaryOp.TIMES,
            ExprNode.varRef("y", Types.U32), ExprNode.uintLit(2))).toString());
  }

  @Test
  public void testAssignmentTargets() {
    assertEquals("_ = true;",
        new Assignment(AssignmentLhs.UNDERSCORE,
                       ExprNode.boolLit(true)).toString());
    assertEquals("x = 0;",
        new Assignment(AssignmentLhs.simple("x"),
                       ExprNode.intLit(0)).toString());

    AssignmentLhs lhs = AssignmentLhs.simple("a",
        Postfix.arrayIndex(ExprNode.varRef("i", Types.I32)),
        Postfix.member("pos"),
        Postfix.arrayIndex(ExprNode.uintLit(2)));
    assertEquals("a[i].pos[2u] = 7;",
        new Assignment(lhs, ExprNode.intLit(7)).toString());
    assertTrue(AssignmentLhs.UNDERSCORE.isUnderscore());
  }

  @Test
  public void testCompound() {
    Statement s = new CompoundStatement(new LetDecl("y", ExprNode.intLit(1)));
    assertEquals("{\n" +
                 "    let y = 1;\n" +
                 "}", s.toString());
  }

  @Test
  public void testEmptyCompound() {
    assertEquals("{\n}", new CompoundStatement().toString());
  }

  @Test
  public void testIf() {
    Statement s = new IfStatement(FLAG, Arrays.<Statement>asList(
        new Assignment(AssignmentLhs.UNDERSCORE, ExprNode.boolLit(true))));
    assertEquals("if (flag) {\n" +
                 "    _ = true;\n" +
                 "}", s.toString());
  }

  @Test
  public void testNestedBlocks() {
    Statement inner = new IfStatement(FLAG, Arrays.<Statement>asList(
        new LetDecl("x", ExprNode.intLit(1))));
    Statement s = new CompoundStatement(inner, new CompoundStatement(),
                                        new VarDecl("w", ExprNode.intLit(2)));
    assertEquals("{\n" +
                 "    if (flag) {\n" +
                 "        let x = 1;\n" +
                 "    }\n" +
                 "    {\n" +
                 "    }\n" +
                 "    var w = 2;\n" +
                 "}", s.toString());
  }

  /**
   * Each line is indented by its nesting depth, however deep
   */
  private static int leadingSpaces(String line) {
    return line.length() - StringUtils.stripStart(line, " ").length();
  }

  @Test
  public void testDeepNesting() {
    final int depth = 40;
    Statement s = new LetDecl("deep", ExprNode.intLit(0));
    for (int i = 0; i < depth; i++) {
      if (i % 2 == 0) {
        s = new CompoundStatement(s);
      } else {
        s = new IfStatement(FLAG, Collections.singletonList(s));
      }
    }

    String text = s.toString();
    String[] lines = text.split("\n");
    assertEquals(2 * depth + 1, lines.length);

    int opens = 0;
    int closes = 0;
    for (int i = 0; i < lines.length; i++) {
      int expectedDepth = i <= depth ? i : 2 * depth - i;
      assertEquals("Indent of line " + i, 4 * expectedDepth,
                   leadingSpaces(lines[i]));
      opens += lines[i].endsWith("{") ? 1 : 0;
      closes += lines[i].trim().equals("}") ? 1 : 0;
    }
    assertEquals(depth, opens);
    assertEquals(depth, closes);
    assertEquals("let deep = 0;", lines[depth].trim());
  }

  @Test
  public void testUnwrapCompound() {
    Statement let = new LetDecl("y", ExprNode.intLit(1));
    List<Statement> stmts = new CompoundStatement(let).toCompoundStatements();
    assertEquals(1, stmts.size());
    assertSame(let, stmts.get(0));
  }

  @Test
  public void testUnwrapNonCompoundFails() {
    exception.expect(WGSLRuntimeError.class);
    exception.expectMessage("IF");
    new IfStatement(FLAG, Collections.<Statement>emptyList())
        .toCompoundStatements();
  }

  @Test
  public void testPrintingIsDeterministic() {
    Statement s = new CompoundStatement(
        new IfStatement(FLAG, Arrays.<Statement>asList(
            new VarDecl("q", ExprNode.uintLit(3)))));
    assertEquals(s.toString(), s.toString());
  }

  @Test
  public void testStructuralEquality() {
    Statement s1 = new CompoundStatement(new LetDecl("y", ExprNode.intLit(1)));
    Statement s2 = new CompoundStatement(new LetDecl("y", ExprNode.intLit(1)));
    assertEquals(s1, s2);
    assertEquals(s1.hashCode(), s2.hashCode());
    assertTrue(!s1.equals(new CompoundStatement(
        new VarDecl("y", ExprNode.intLit(1)))));
  }
}
