/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.wgsl.ast;

import java.io.IOException;

import org.apache.log4j.Logger;

import exm.wgsl.common.Logging;
import exm.wgsl.common.Settings;
import exm.wgsl.common.exceptions.InvalidOptionException;
import exm.wgsl.common.exceptions.WGSLRuntimeError;

/**
 * Renders trees to text.
 *
 * A printer holds no state besides its indent width, so one instance
 * may print any number of trees, from any number of threads.
 */
public class ShaderPrinter
{
  private static final Logger logger = Logging.getWGSLLogger();

  static final String UNPRINTED_FUNCTIONS_WARNING =
      "Functions besides the module entry point are not printed";

  private final int indentWidth;

  public ShaderPrinter(int indentWidth)
  {
    this.indentWidth = indentWidth;
  }

  /**
   * Set up logging from settings and make a printer using the indent
   * width from settings
   * @throws InvalidOptionException
   */
  public static ShaderPrinter fromSettings() throws InvalidOptionException
  {
    Logging.setupLogging();
    return new ShaderPrinter(Settings.getIndentWidth());
  }

  /**
   * Print tree to sink.
   * @param tree
   * @param sink
   * @throws IOException any failure of the sink, unchanged
   */
  public void print(Printable tree, Appendable sink) throws IOException
  {
    logger.trace("Printing " + tree.getClass().getSimpleName());
    if (tree instanceof ShaderModule &&
        !((ShaderModule)tree).functions().isEmpty()) {
      Logging.uniqueWarn(UNPRINTED_FUNCTIONS_WARNING);
    }
    tree.appendTo(new CodeWriter(sink, indentWidth));
  }

  /**
   * Print tree to a string
   */
  public String toText(Printable tree)
  {
    StringBuilder sb = new StringBuilder(2048);
    try {
      print(tree, sb);
    } catch (IOException e) {
      throw new WGSLRuntimeError("Printing to string buffer failed", e);
    }
    return sb.toString();
  }

  /**
   * Print tree to a string using settings
   */
  public static String render(Printable tree)
  {
    ShaderPrinter printer;
    try {
      printer = fromSettings();
    } catch (InvalidOptionException e) {
      throw new WGSLRuntimeError("Bad print settings: " + e.getMessage(), e);
    }
    return printer.toText(tree);
  }
}
