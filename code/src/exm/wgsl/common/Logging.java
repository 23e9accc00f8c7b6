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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.wgsl.common.exceptions.InvalidOptionException;
import exm.wgsl.common.exceptions.WGSLRuntimeError;

public class Logging
{
  private static final String WGSL_LOGGER_NAME = "exm.wgsl";

  private static final String FILE_APPENDER_NAME = "wgsl-file";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<Pair<Level, String>> emitted =
       new HashSet<Pair<Level, String>>();

  /** Log file currently attached, null if none */
  private static String currentLogFile = null;

  public static Logger getWGSLLogger()
  {
    return Logger.getLogger(WGSL_LOGGER_NAME);
  }

  /**
   * Configure the project logger from {@link Settings#LOG_FILE} and
   * {@link Settings#LOG_TRACE}.
   * @return the configured logger
   * @throws InvalidOptionException
   */
  public static Logger setupLogging() throws InvalidOptionException
  {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return setupLogging(logfile, trace);
  }

  /**
   * Configure the project logger.  Calling again with the same file
   * only updates the level, so the file is not truncated.
   * @param logfile file to log to, or empty string for no file log
   * @param trace if true, log at trace level, otherwise debug
   * @return the configured logger
   */
  public static synchronized Logger setupLogging(String logfile,
                                                 boolean trace)
  {
    Logger wgslLogger = getWGSLLogger();
    if (logfile == null || logfile.length() == 0) {
      // Even if logging is disabled, this must be valid:
      return wgslLogger;
    }

    if (!logfile.equals(currentLogFile)) {
      Appender old = wgslLogger.getAppender(FILE_APPENDER_NAME);
      if (old != null) {
        wgslLogger.removeAppender(old);
        old.close();
      }
      try {
        FileAppender appender = new FileAppender(
                      new PatternLayout(LOG_PATTERN), logfile, false);
        appender.setName(FILE_APPENDER_NAME);
        wgslLogger.addAppender(appender);
      } catch (IOException e) {
        throw new WGSLRuntimeError("Could not open log file: " + logfile, e);
      }
      currentLogFile = logfile;
    }
    wgslLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return wgslLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    synchronized (emitted) {
      return emitted.add(Pair.of(level, msg));
    }
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getWGSLLogger().warn(msg);
    else
      getWGSLLogger().debug("Duplicate Warning: " + msg);
  }
}
