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
package exm.pjc.jsbackend;

import com.google.common.collect.ImmutableSet;

import exm.pjc.common.Logging;

/**
 * Maps source identifiers to JavaScript identifiers.  Identifiers are kept
 * verbatim unless they collide with a JavaScript reserved word and renaming
 * is enabled, in which case an underscore is appended.
 */
public class JsNamer {

  public static final ImmutableSet<String> RESERVED_WORDS = ImmutableSet.of(
      "await", "break", "case", "catch", "class", "const", "continue",
      "debugger", "default", "delete", "do", "else", "enum", "export",
      "extends", "false", "finally", "for", "function", "if", "implements",
      "import", "in", "instanceof", "interface", "let", "new", "null",
      "package", "private", "protected", "public", "return", "static",
      "super", "switch", "this", "throw", "true", "try", "typeof", "var",
      "void", "while", "with", "yield", "arguments", "eval");

  private final boolean rename;

  public JsNamer(boolean rename) {
    this.rename = rename;
  }

  public static boolean isReserved(String id) {
    return RESERVED_WORDS.contains(id);
  }

  /**
   * @param id source identifier
   * @return identifier to emit
   */
  public String name(String id) {
    if (!isReserved(id)) {
      return id;
    }
    if (rename) {
      String renamed = id + "_";
      Logging.uniqueWarn("Identifier '" + id + "' is a JavaScript reserved " +
                         "word, renamed to '" + renamed + "'");
      return renamed;
    }
    Logging.uniqueWarn("Identifier '" + id + "' is a JavaScript reserved " +
                       "word and is emitted verbatim");
    return id;
  }
}
