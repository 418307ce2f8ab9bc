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

package exm.tnc.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.tnc.common.exceptions.TNCRuntimeError;

public class Logging
{
  private static final String TNC_LOGGER_NAME = "exm.tnc";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /**
   * Messages already emitted, keyed by level and text.
   */
  static final Set<String> emitted = new HashSet<String>();

  public static Logger getTNCLogger()
  {
    return Logger.getLogger(TNC_LOGGER_NAME);
  }

  /**
   * Attach an appender to the compiler logger.
   * @param logfile file to log to.  If null or empty, log warnings and
   *                errors to the console only
   * @param trace if true, log everything including TRACE messages
   * @return the compiler logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger tncLogger = getTNCLogger();
    tncLogger.removeAllAppenders();
    tncLogger.setAdditivity(false);

    Layout layout = new PatternLayout(LOG_PATTERN);
    if (logfile != null && logfile.length() > 0) {
      try {
        tncLogger.addAppender(new FileAppender(layout, logfile, false));
      } catch (IOException e) {
        throw new TNCRuntimeError("Could not open log file " + logfile, e);
      }
      tncLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      ConsoleAppender console = new ConsoleAppender(layout,
                                         ConsoleAppender.SYSTEM_ERR);
      tncLogger.addAppender(console);
      tncLogger.setLevel(trace ? Level.TRACE : Level.WARN);
    }
    // Even if logging is disabled, this must be valid:
    return tncLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    synchronized (emitted) {
      return emitted.add(level + ":" + msg);
    }
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getTNCLogger().warn(msg);
    else
      getTNCLogger().debug("Duplicate Warning: " + msg);
  }
}
