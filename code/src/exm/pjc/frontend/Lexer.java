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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import exm.pjc.common.Logging;
import exm.pjc.common.exceptions.LexException;
import exm.pjc.common.util.StringUtil;
import exm.pjc.frontend.Token.Kind;

/**
 * Converts source text into a flat token sequence.  Block structure
 * is made explicit with INDENT and DEDENT tokens computed from a stack
 * of indentation widths, so the parser never looks at whitespace.
 *
 * Each logical line holding tokens ends with one NEWLINE token.  Blank
 * and comment-only lines produce nothing, and newlines inside brackets
 * are ignored.  The stream always ends with NEWLINE (if there were any
 * tokens), enough DEDENTs to close all open blocks, and EOF.
 *
 * A Lexer instance is single-use and not thread-safe.
 */
public class Lexer {
  private static final Logger logger = Logging.getPJCLogger();

  public static final ImmutableSet<String> KEYWORDS = ImmutableSet.of(
      "False", "None", "True", "and", "as", "assert", "async", "await",
      "break", "class", "continue", "def", "del", "elif", "else", "except",
      "finally", "for", "from", "global", "if", "import", "in", "is",
      "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
      "while", "with", "yield");

  /** Longest first so that multi-character operators win */
  static final ImmutableList<String> SYMBOLS = ImmutableList.of(
      "**=", "//=", "<<=", ">>=",
      "**", "//", "<<", ">>", "==", "!=", "<=", ">=",
      "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "->", ":=",
      "(", ")", "[", "]", "{", "}", ",", ":", ";", "=",
      "+", "-", "*", "/", "%", "<", ">", "|", "&", "^", "~", ".", "@");

  /** Columns a tab counts for in indentation */
  public static final int TAB_WIDTH = 4;

  /** Everything that could be meant as one number */
  private static final Pattern NUMBER_RUN =
        Pattern.compile("\\.?[0-9](?:[eE][+-][0-9]|[A-Za-z0-9_.])*");
  private static final Pattern NUMBER =
        Pattern.compile(
            "(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

  private final String file;
  private final String src;
  private final List<Token> tokens = new ArrayList<Token>();
  private final List<Integer> indentStack = new ArrayList<Integer>();

  private int pos = 0;
  private int line = 1;
  /** Offset of first character of current line */
  private int lineStart = 0;
  /** Depth of open brackets */
  private int nesting = 0;
  private boolean atLineStart = true;
  private List<Token> result = null;

  /**
   * @param file input name used in messages, or null
   * @param source complete source text
   */
  public Lexer(String file, String source) {
    this.file = file;
    this.src = source;
    indentStack.add(0);
  }

  public static List<Token> tokenize(String source) throws LexException {
    return new Lexer(null, source).tokenize();
  }

  /**
   * @return immutable token list ending in EOF
   * @throws LexException on the first lexical error
   */
  public List<Token> tokenize() throws LexException {
    if (result != null) {
      return result;
    }
    while (pos < src.length()) {
      if (atLineStart && nesting == 0) {
        if (!startLine()) {
          continue;
        }
      }
      char c = src.charAt(pos);
      if (c == '\n') {
        endLine();
      } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
        pos++;
      } else if (c == '#') {
        skipComment();
      } else if (c == '\\' && lineContinuation()) {
        // Joined with next line
      } else if (isDigit(c) || (c == '.' && pos + 1 < src.length() &&
                                isDigit(src.charAt(pos + 1)))) {
        lexNumber();
      } else if (c == '"' || c == '\'') {
        lexString();
      } else if (isIdentStart(c)) {
        lexWord();
      } else {
        lexSymbol();
      }
    }
    finish();

    result = ImmutableList.copyOf(tokens);
    logger.debug("Lexed " + result.size() + " tokens" +
                 (file != null ? " from " + file : ""));
    if (LogHelper.isTraceEnabled()) {
      for (Token t: result) {
        LogHelper.trace(file, t, t.toString());
      }
    }
    return result;
  }

  /**
   * Measure indentation at the start of a line and emit INDENT or
   * DEDENT tokens for any change.
   * @return false if the line was blank or comment-only and was skipped
   */
  private boolean startLine() throws LexException {
    int i = pos;
    int width = 0;
    boolean spaces = false, tabs = false;
    while (i < src.length()) {
      char c = src.charAt(i);
      if (c == ' ') {
        spaces = true;
        width++;
      } else if (c == '\t') {
        tabs = true;
        width += TAB_WIDTH;
      } else if (c != '\f') {
        break;
      }
      i++;
    }

    if (i >= src.length() || src.charAt(i) == '\n' ||
        src.charAt(i) == '\r' || src.charAt(i) == '#') {
      pos = i;
      skipRestOfLine();
      return false;
    }

    if (spaces && tabs) {
      throw error(line, 0, "inconsistent use of tabs and spaces " +
                           "in indentation");
    }

    int endCol = i - lineStart;
    if (width > topIndent()) {
      indentStack.add(width);
      add(Kind.INDENT, "", width, line, 0, endCol);
    } else {
      while (width < topIndent()) {
        indentStack.remove(indentStack.size() - 1);
        add(Kind.DEDENT, "", width, line, 0, endCol);
      }
      if (width != topIndent()) {
        throw error(line, endCol, "unindent does not match any outer " +
                                  "indentation level");
      }
    }
    pos = i;
    atLineStart = false;
    return true;
  }

  private int topIndent() {
    return indentStack.get(indentStack.size() - 1);
  }

  private void endLine() {
    if (nesting == 0) {
      if (!tokens.isEmpty() && !lastToken().is(Kind.NEWLINE)) {
        int col = pos - lineStart;
        add(Kind.NEWLINE, "\n", null, line, col, col + 1);
      }
      atLineStart = true;
    }
    pos++;
    newLine();
  }

  private void newLine() {
    line++;
    lineStart = pos;
  }

  private void skipComment() {
    while (pos < src.length() && src.charAt(pos) != '\n') {
      pos++;
    }
  }

  private void skipRestOfLine() {
    skipComment();
    if (pos < src.length()) {
      pos++;
      newLine();
    }
  }

  /**
   * Backslash immediately before a line break joins the two lines
   */
  private boolean lineContinuation() {
    if (src.startsWith("\\\n", pos)) {
      pos += 2;
    } else if (src.startsWith("\\\r\n", pos)) {
      pos += 3;
    } else {
      return false;
    }
    newLine();
    return true;
  }

  private void lexNumber() throws LexException {
    Matcher m = NUMBER_RUN.matcher(src);
    m.region(pos, src.length());
    if (!m.lookingAt()) {
      throw error(line, pos - lineStart, "malformed numeric literal");
    }
    String text = m.group();
    if (!NUMBER.matcher(text).matches()) {
      throw error(line, pos - lineStart,
                  "malformed numeric literal '" + text + "'");
    }

    Object value;
    if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 ||
        text.indexOf('E') >= 0) {
      value = Double.valueOf(text);
    } else {
      value = new BigInteger(text);
    }
    int col = pos - lineStart;
    add(Kind.NUMBER, text, value, line, col, col + text.length());
    pos = m.end();
  }

  private void lexString() throws LexException {
    int start = pos;
    int startLine = line;
    int startCol = pos - lineStart;
    char quote = src.charAt(pos);
    String triple = new String(new char[] {quote, quote, quote});
    boolean isTriple = src.startsWith(triple, pos);
    int delimLen = isTriple ? 3 : 1;

    int i = pos + delimLen;
    int end = -1;
    while (i < src.length()) {
      char c = src.charAt(i);
      if (c == '\\') {
        i += 2;
        continue;
      }
      if (isTriple) {
        if (src.startsWith(triple, i)) {
          end = i + 3;
          break;
        }
      } else if (c == quote) {
        end = i + 1;
        break;
      } else if (c == '\n') {
        break;
      }
      i++;
    }
    if (end < 0) {
      throw error(startLine, startCol, "unterminated string literal");
    }

    String text = src.substring(start, end);
    String body = text.substring(delimLen, text.length() - delimLen);
    pos = end;

    int breaks = StringUtil.count(text, '\n');
    if (breaks > 0) {
      line += breaks;
      lineStart = start + text.lastIndexOf('\n') + 1;
    }
    add(Kind.STRING, text, unescape(body, quote), startLine, startCol,
        end - lineStart);
  }

  /**
   * Only backslash and the literal's own quote character are unescaped.
   * Other escape sequences are kept as written.
   */
  static String unescape(String body, char quote) {
    StringBuilder sb = new StringBuilder(body.length());
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == '\\' && i + 1 < body.length()) {
        char next = body.charAt(i + 1);
        if (next == '\\' || next == quote) {
          sb.append(next);
          i++;
          continue;
        }
      }
      sb.append(c);
    }
    return sb.toString();
  }

  private void lexWord() {
    int start = pos;
    while (pos < src.length() && isIdentPart(src.charAt(pos))) {
      pos++;
    }
    String text = src.substring(start, pos);
    Kind kind = KEYWORDS.contains(text) ? Kind.KEYWORD : Kind.IDENT;
    add(kind, text, null, line, start - lineStart, pos - lineStart);
  }

  private void lexSymbol() throws LexException {
    for (String sym: SYMBOLS) {
      if (src.startsWith(sym, pos)) {
        char c = sym.charAt(0);
        if (c == '(' || c == '[' || c == '{') {
          nesting++;
        } else if ((c == ')' || c == ']' || c == '}') && nesting > 0) {
          nesting--;
        }
        int col = pos - lineStart;
        add(Kind.SYMBOL, sym, null, line, col, col + sym.length());
        pos += sym.length();
        return;
      }
    }
    throw error(line, pos - lineStart, "unexpected character '" +
                StringUtil.describe(src.substring(pos, pos + 1)) + "'");
  }

  private void finish() {
    int col = pos - lineStart;
    if (!tokens.isEmpty() && !lastToken().is(Kind.NEWLINE)) {
      add(Kind.NEWLINE, "", null, line, col, col);
    }
    while (indentStack.size() > 1) {
      indentStack.remove(indentStack.size() - 1);
      add(Kind.DEDENT, "", 0, line, 0, 0);
    }
    add(Kind.EOF, "", null, line, col, col);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private Token lastToken() {
    return tokens.get(tokens.size() - 1);
  }

  private void add(Kind kind, String text, Object value, int tokLine,
                   int col, int endCol) {
    tokens.add(new Token(kind, text, value, tokLine, col, endCol));
  }

  private LexException error(int errLine, int col, String msg) {
    return new LexException(file, errLine, col, msg);
  }
}
