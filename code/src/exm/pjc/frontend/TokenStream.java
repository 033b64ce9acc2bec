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

import java.util.List;

import com.google.common.base.Preconditions;

import exm.pjc.common.exceptions.InvalidSyntaxException;
import exm.pjc.frontend.Token.Kind;

/**
 * Forward-only cursor over a lexed token list.  The list must end with
 * an EOF token; the cursor never moves past it.
 */
public class TokenStream {
  private final String file;
  private final List<Token> tokens;
  private int index = 0;

  public TokenStream(String file, List<Token> tokens) {
    Preconditions.checkArgument(!tokens.isEmpty() &&
        tokens.get(tokens.size() - 1).is(Kind.EOF),
        "token list must end with EOF");
    this.file = file;
    this.tokens = tokens;
  }

  public String file() {
    return file;
  }

  public Token peek() {
    return tokens.get(index);
  }

  /**
   * @param ahead number of tokens to look past the current one
   * @return token, or the final EOF if past the end
   */
  public Token peek(int ahead) {
    int i = Math.min(index + ahead, tokens.size() - 1);
    return tokens.get(i);
  }

  public Token next() {
    Token t = tokens.get(index);
    if (!t.is(Kind.EOF)) {
      index++;
    }
    return t;
  }

  public boolean atEnd() {
    return peek().is(Kind.EOF);
  }

  public boolean check(Kind kind) {
    return peek().is(kind);
  }

  public boolean checkSymbol(String symbol) {
    return peek().isSymbol(symbol);
  }

  public boolean checkKeyword(String keyword) {
    return peek().isKeyword(keyword);
  }

  /**
   * Consume the current token if it is the given symbol
   * @return true if consumed
   */
  public boolean acceptSymbol(String symbol) {
    if (checkSymbol(symbol)) {
      index++;
      return true;
    }
    return false;
  }

  public boolean acceptKeyword(String keyword) {
    if (checkKeyword(keyword)) {
      index++;
      return true;
    }
    return false;
  }

  public Token expect(Kind kind, String what) throws InvalidSyntaxException {
    if (!check(kind)) {
      throw unexpected(what);
    }
    return next();
  }

  public Token expectSymbol(String symbol) throws InvalidSyntaxException {
    if (!checkSymbol(symbol)) {
      throw unexpected("'" + symbol + "'");
    }
    return next();
  }

  public Token expectKeyword(String keyword) throws InvalidSyntaxException {
    if (!checkKeyword(keyword)) {
      throw unexpected("'" + keyword + "'");
    }
    return next();
  }

  /**
   * @param expected description of what was expected
   * @return exception positioned at the current token
   */
  public InvalidSyntaxException unexpected(String expected) {
    Token t = peek();
    return new InvalidSyntaxException(file, t,
        "expected " + expected + " but found " + t.describe());
  }
}
