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

import java.util.List;

public class StringUtil {

  /**
   * Append the given number of spaces into given StringBuilder
   */
  public static void spaces(StringBuilder sb, int c) {
    for (int i = 0; i < c; i++)
      sb.append(' ');
  }

  /**
   * Join string forms of objects with separator
   */
  public static String concat(String separator, List<? extends Object> objs) {
    StringBuilder sb = new StringBuilder();
    boolean first = true;
    for (Object o: objs) {
      if (!first)
        sb.append(separator);
      sb.append(o);
      first = false;
    }
    return sb.toString();
  }

  /**
   * @return number of times c occurs in s
   */
  public static int count(CharSequence s, char c) {
    int n = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == c)
        n++;
    }
    return n;
  }

  /**
   * Short, printable rendering of source text for error messages
   */
  public static String describe(String text) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\n': sb.append("\\n"); break;
        case '\t': sb.append("\\t"); break;
        case '\r': sb.append("\\r"); break;
        default:
          if (Character.isISOControl(c)) {
            sb.append(String.format("\\u%04x", (int)c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }
}
