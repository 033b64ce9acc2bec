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

package exm.pjc.common.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;

/**
 * Miscellaneous utility functions
 * @author wozniak
 * */
public class Misc {

  /**
   * @param pattern SimpleDateFormat pattern
   * @return date formatted as human-readable String
   */
  public static String timestamp(String pattern, Date date) {
    // SimpleDateFormat is not thread-safe
    DateFormat df = new SimpleDateFormat(pattern);
    return df.format(date);
  }

  public static String stackTrace(Throwable e) {
    StringWriter sw = new StringWriter();
    PrintWriter pw = new PrintWriter(sw);
    e.printStackTrace(pw);
    return sw.toString();
  }

  /**
   * @return elapsed milliseconds since given System.nanoTime() value
   */
  public static long elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1000000L;
  }
}
