package exm.wgsl.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.wgsl.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void restoreDefaults() {
    Settings.reset(Settings.PRINT_INDENT_WIDTH);
    Settings.reset(Settings.LOG_TRACE);
    System.clearProperty(Settings.LOG_TRACE);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(Settings.DEFAULT_INDENT_WIDTH, Settings.getIndentWidth());
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals("", Settings.get(Settings.LOG_FILE));
  }

  @Test
  public void testSystemPropertyOverride() throws InvalidOptionException {
    System.setProperty(Settings.LOG_TRACE, "TRUE");
    Settings.initProperties();
    assertEquals(true, Settings.getBoolean(Settings.LOG_TRACE));
  }

  @Test
  public void testBadSystemPropertyRejectedOnLoad()
      throws InvalidOptionException {
    System.setProperty(Settings.LOG_TRACE, "maybe");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("maybe");
    Settings.initProperties();
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "yes");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(Settings.LOG_TRACE);
    Settings.getBoolean(Settings.LOG_TRACE);
  }

  @Test
  public void testNegativeIndentWidth() throws InvalidOptionException {
    Settings.set(Settings.PRINT_INDENT_WIDTH, "-2");
    exception.expect(InvalidOptionException.class);
    Settings.getIndentWidth();
  }

  @Test
  public void testNonIntegralIndentWidth() throws InvalidOptionException {
    Settings.set(Settings.PRINT_INDENT_WIDTH, "four");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("Invalid integral value");
    Settings.getIndentWidth();
  }
}
