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

package exm.pjc.common;

import java.io.IOException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.pjc.common.exceptions.InvalidOptionException;
import exm.pjc.common.util.Pair;

public class Logging
{
  private static final String PJC_LOGGER_NAME = "exm.pjc";

  private static final String FILE_LOG_PATTERN = "%-5p %d{HH:mm:ss,SSS} %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<Pair<Level, String>> emitted =
       Collections.synchronizedSet(new HashSet<Pair<Level, String>>());

  public static Logger getPJCLogger()
  {
    return Logger.getLogger(PJC_LOGGER_NAME);
  }

  /**
   * Direct compiler log output to a file if one is given.  Otherwise the
   * log4j configuration found on the classpath stays in effect.
   * @param logfile file name, or null/empty for none
   * @param trace if true, log at TRACE level instead of DEBUG
   * @return the compiler logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException
  {
    Logger pjcLogger = getPJCLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
                    new PatternLayout(FILE_LOG_PATTERN), logfile, false);
        pjcLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file "
                                        + logfile + ": " + e.getMessage());
      }
      pjcLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    // Even if logging is disabled, this must be valid:
    return pjcLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getPJCLogger().warn(msg);
    else
      getPJCLogger().debug("Duplicate Warning: " + msg);
  }
}
