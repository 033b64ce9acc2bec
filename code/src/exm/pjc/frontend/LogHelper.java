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
package exm.pjc.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.pjc.common.Logging;

/**
 * Helper functions to augment log messages with contextual information about
 * the current line.
 *
 */
public class LogHelper {
  static final Logger logger = Logging.getPJCLogger();

  /**
   * @param file input name, or null
   * @param token
   * @return location prefix, e.g. "prog.py:3:5: "
   */
  public static String location(String file, Token token) {
    StringBuilder sb = new StringBuilder();
    if (file != null) {
      sb.append(file).append(':');
    }
    sb.append(token.line()).append(':').append(token.column() + 1);
    sb.append(": ");
    return sb.toString();
  }

  public static void trace(String file, Token token, String msg) {
    log(Level.TRACE, location(file, token), msg);
  }

  private static void log(Level level, String location, String msg) {
    if (logger.isEnabledFor(level)) {
      logger.log(level, location + msg);
    }
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}
