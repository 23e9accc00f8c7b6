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

package exm.wgsl.common;

import java.util.Properties;

import exm.wgsl.common.exceptions.InvalidOptionException;

/**
 * General settings
 *
 * Every key can be overridden by a Java system property of the
 * same name, picked up by {@link #initProperties()}.
 * */
public class Settings
{
  public static final String LOG_FILE = "wgsl.log.file";
  public static final String LOG_TRACE = "wgsl.log.trace";

  /** Number of spaces per nesting level in printed code */
  public static final String PRINT_INDENT_WIDTH = "wgsl.print.indent-width";

  public static final int DEFAULT_INDENT_WIDTH = 4;

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(PRINT_INDENT_WIDTH,
                         Integer.toString(DEFAULT_INDENT_WIDTH));
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set since startup, reverting key to its default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getIndentWidth();
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  /**
   * @return validated indentation width for printing
   * @throws InvalidOptionException if not a non-negative integer
   */
  public static int getIndentWidth() throws InvalidOptionException {
    int width = getInt(PRINT_INDENT_WIDTH);
    if (width < 0) {
      throw new InvalidOptionException("Expected property " +
          PRINT_INDENT_WIDTH + " to be non-negative but was " + width);
    }
    return width;
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
