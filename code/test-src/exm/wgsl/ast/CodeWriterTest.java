package exm.wgsl.ast;

import static org.junit.Assert.assertEquals;

import java.io.IOException;

import org.junit.Test;

public class CodeWriterTest {

  @Test
  public void testRootWriterPassesThrough() throws IOException {
    StringBuilder sb = new StringBuilder();
    CodeWriter out = new CodeWriter(sb);
    out.append("a\n\nb").newline();
    assertEquals("a\n\nb\n", sb.toString());
  }

  @Test
  public void testIndentedPrefixesEachLine() throws IOException {
    StringBuilder sb = new StringBuilder();
    CodeWriter out = new CodeWriter(sb);
    out.append("x {").newline();
    out.indented().append("one\ntwo\n");
    out.append('}');
    assertEquals("x {\n    one\n    two\n}", sb.toString());
  }

  @Test
  public void testEmptyLinesNotIndented() throws IOException {
    StringBuilder sb = new StringBuilder();
    CodeWriter inner = new CodeWriter(sb).indented();
    inner.append("a\n\nb\n");
    assertEquals("    a\n\n    b\n", sb.toString());
  }

  @Test
  public void testNestedWritersCompose() throws IOException {
    StringBuilder sb = new StringBuilder();
    CodeWriter out = new CodeWriter(sb, 2);
    CodeWriter level1 = out.indented();
    CodeWriter level2 = level1.indented();
    level1.append("a\n");
    level2.append("b\n");
    // Partial lines are only indented once
    level2.append("c");
    level2.append("d\n");
    level1.append("e\n");
    assertEquals("  a\n    b\n    cd\n  e\n", sb.toString());
  }

  @Test
  public void testZeroIndentWidth() throws IOException {
    StringBuilder sb = new StringBuilder();
    new CodeWriter(sb, 0).indented().indented().append("flat\n");
    assertEquals("flat\n", sb.toString());
  }

  @Test
  public void testNegativeIndentWidth() {
    try {
      new CodeWriter(new StringBuilder(), -1);
      throw new AssertionError("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertEquals("Negative indent width -1", e.getMessage());
    }
  }
}
