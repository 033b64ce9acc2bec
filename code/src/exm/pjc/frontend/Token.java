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

import exm.pjc.common.util.StringUtil;

/**
 * Lexical token.  Immutable.
 *
 * Columns are 0-based offsets into the line the token starts on, except
 * the end column of a token that spans lines, which is an offset into
 * the line it ends on.
 */
public class Token {

  public static enum Kind {
    KEYWORD,
    NUMBER,
    STRING,
    IDENT,
    SYMBOL,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF,
  }

  private final Kind kind;
  /** Exact source text, empty for synthetic tokens */
  private final String text;
  /**
   * Literal value: BigInteger or Double for NUMBER, the unescaped body
   * for STRING, the indentation width for INDENT/DEDENT, otherwise null
   */
  private final Object value;
  private final int line;
  private final int column;
  private final int endColumn;

  public Token(Kind kind, String text, Object value, int line,
               int column, int endColumn) {
    this.kind = kind;
    this.text = text;
    this.value = value;
    this.line = line;
    this.column = column;
    this.endColumn = endColumn;
  }

  public Kind kind() {
    return kind;
  }

  public String text() {
    return text;
  }

  public Object value() {
    return value;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  public int endColumn() {
    return endColumn;
  }

  public boolean is(Kind k) {
    return kind == k;
  }

  /**
   * @return true if kind and text both match
   */
  public boolean is(Kind k, String t) {
    return kind == k && text.equals(t);
  }

  /**
   * @return true if this is the given keyword
   */
  public boolean isKeyword(String keyword) {
    return is(Kind.KEYWORD, keyword);
  }

  /**
   * @return true if this is the given symbol
   */
  public boolean isSymbol(String symbol) {
    return is(Kind.SYMBOL, symbol);
  }

  /**
   * Human-readable description for error messages
   */
  public String describe() {
    switch (kind) {
      case NEWLINE:
        return "end of line";
      case INDENT:
        return "indent";
      case DEDENT:
        return "dedent";
      case EOF:
        return "end of input";
      case STRING:
        return "string literal";
      default:
        return "'" + StringUtil.describe(text) + "'";
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind).append("(");
    if (kind == Kind.INDENT || kind == Kind.DEDENT) {
      sb.append(value);
    } else {
      sb.append(StringUtil.describe(text));
    }
    sb.append(")@").append(line).append(":").append(column);
    return sb.toString();
  }
}
