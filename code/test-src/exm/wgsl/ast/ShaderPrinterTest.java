package exm.wgsl.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.wgsl.ast.decl.FnAttr;
import exm.wgsl.ast.decl.FnDecl;
import exm.wgsl.ast.decl.FnInput;
import exm.wgsl.ast.decl.GlobalVarDecl;
import exm.wgsl.ast.decl.ShaderStage;
import exm.wgsl.ast.decl.StructDecl;
import exm.wgsl.ast.stmt.Statement;
import exm.wgsl.common.Settings;
import exm.wgsl.common.exceptions.InvalidOptionException;
import exm.wgsl.common.exceptions.WGSLRuntimeError;

public class ShaderPrinterTest {

  private static final String LOG_FILE = "target/ShaderPrinterTest.wgsl.log";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void restoreDefaults() {
    Settings.reset(Settings.LOG_FILE);
    Settings.reset(Settings.LOG_TRACE);
    Settings.reset(Settings.PRINT_INDENT_WIDTH);
  }

  private static ShaderModule emptyModule() {
    FnDecl main = new FnDecl(AttrList.of(FnAttr.stage(ShaderStage.VERTEX)),
        "main", Collections.<FnInput>emptyList(), null,
        Collections.<Statement>emptyList());
    return new ShaderModule(Collections.<StructDecl>emptyList(),
        Collections.<GlobalVarDecl>emptyList(),
        Collections.<FnDecl>emptyList(), main);
  }

  /**
   * The log file named in settings is written when printing through a
   * printer made from settings
   */
  @Test
  public void testLogFileFromSettings()
      throws IOException, InvalidOptionException {
    File logFile = new File(LOG_FILE);
    logFile.getParentFile().mkdirs();
    Settings.set(Settings.LOG_FILE, LOG_FILE);
    Settings.set(Settings.LOG_TRACE, "true");

    StringBuilder sb = new StringBuilder();
    ShaderPrinter.fromSettings().print(emptyModule(), sb);
    assertEquals("[[stage(vertex)]]\nfn main() {\n}\n", sb.toString());

    assertTrue("Log file not written: " + LOG_FILE, logFile.exists());
    String log = new String(Files.readAllBytes(logFile.toPath()),
                            StandardCharsets.UTF_8);
    assertTrue(log, log.contains("Printing ShaderModule"));
  }

  @Test
  public void testRenderBadIndentWidth() {
    Settings.set(Settings.PRINT_INDENT_WIDTH, "-3");
    exception.expect(WGSLRuntimeError.class);
    exception.expectMessage(Settings.PRINT_INDENT_WIDTH);
    ShaderPrinter.render(emptyModule());
  }
}
