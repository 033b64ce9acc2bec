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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import exm.pjc.common.exceptions.InvalidSyntaxException;
import exm.pjc.common.exceptions.UnsupportedConstructException;
import exm.pjc.common.lang.Operators;
import exm.pjc.common.lang.Operators.BinaryOp;
import exm.pjc.common.lang.Operators.CompareOp;
import exm.pjc.common.lang.Operators.UnaryOp;
import exm.pjc.frontend.Token.Kind;
import exm.pjc.ic.tree.ICExprs.BinaryExpr;
import exm.pjc.ic.tree.ICExprs.BoolLiteral;
import exm.pjc.ic.tree.ICExprs.Call;
import exm.pjc.ic.tree.ICExprs.Compare;
import exm.pjc.ic.tree.ICExprs.Expr;
import exm.pjc.ic.tree.ICExprs.ListLiteral;
import exm.pjc.ic.tree.ICExprs.Name;
import exm.pjc.ic.tree.ICExprs.NullLiteral;
import exm.pjc.ic.tree.ICExprs.NumberLiteral;
import exm.pjc.ic.tree.ICExprs.StringLiteral;
import exm.pjc.ic.tree.ICExprs.Subscript;
import exm.pjc.ic.tree.ICExprs.UnaryExpr;

/**
 * Precedence-climbing expression parser.  Levels, loosest first:
 * <pre>
 *   not_test   := 'not' not_test | comparison
 *   comparison := bit_or (comp_op bit_or)*
 *   bit_or     := bit_xor ('|' bit_xor)*
 *   bit_xor    := bit_and ('^' bit_and)*
 *   bit_and    := shift ('&' shift)*
 *   shift      := arith (('<<' | '>>') arith)*
 *   arith      := term (('+' | '-') term)*
 *   term       := factor (('*' | '/' | '//' | '%') factor)*
 *   factor     := ('+' | '-' | '~') factor | power
 *   power      := postfix ['**' factor]
 *   postfix    := atom ('[' expr ']' | '(' args ')')*
 * </pre>
 */
public class ExprParser {

  /** Binary operator levels from loosest to tightest */
  private static final ImmutableList<ImmutableSet<String>> BINARY_LEVELS =
      ImmutableList.of(
          ImmutableSet.of("|"),
          ImmutableSet.of("^"),
          ImmutableSet.of("&"),
          ImmutableSet.of("<<", ">>"),
          ImmutableSet.of("+", "-"),
          ImmutableSet.of("*", "/", "//", "%"));

  private static final ImmutableSet<String> COMPARE_SYMBOLS =
      ImmutableSet.of("==", "!=", "<", "<=", ">", ">=");

  private static final ImmutableSet<String> UNARY_SYMBOLS =
      ImmutableSet.of("+", "-", "~");

  /** Keywords that begin an expression form outside the subset */
  private static final ImmutableSet<String> UNSUPPORTED_EXPR_KEYWORDS =
      ImmutableSet.of("lambda", "await", "yield");

  /** Lower-cased prefixes that modify a directly following string */
  private static final ImmutableSet<String> STRING_PREFIXES =
      ImmutableSet.of("r", "f", "b", "u", "rb", "br", "fr", "rf");

  private final TokenStream in;

  public ExprParser(TokenStream in) {
    this.in = in;
  }

  /**
   * Parse a complete expression.  Boolean operators and conditional
   * expressions are rejected here since they can only follow a complete
   * operand.
   */
  public Expr expression() throws InvalidSyntaxException {
    Expr result = notTest();
    Token t = in.peek();
    if (t.isKeyword("and") || t.isKeyword("or")) {
      throw unsupported(t, "boolean operator '" + t.text() + "'");
    } else if (t.isKeyword("if")) {
      throw unsupported(t, "conditional expression");
    } else if (t.isSymbol(":=")) {
      throw unsupported(t, "assignment expression");
    }
    return result;
  }

  private Expr notTest() throws InvalidSyntaxException {
    if (in.acceptKeyword("not")) {
      return new UnaryExpr(UnaryOp.NOT, notTest());
    }
    return comparison();
  }

  private Expr comparison() throws InvalidSyntaxException {
    Expr left = binary(0);
    List<CompareOp> ops = new ArrayList<CompareOp>();
    List<Expr> comparators = new ArrayList<Expr>();
    CompareOp op;
    while ((op = compareOp()) != null) {
      ops.add(op);
      comparators.add(binary(0));
    }
    if (ops.isEmpty()) {
      return left;
    }
    return new Compare(left, ops, comparators);
  }

  /**
   * Consume a comparison operator if present
   * @return operator, or null if next tokens are not one
   */
  private CompareOp compareOp() {
    Token t = in.peek();
    if (t.is(Kind.SYMBOL) && COMPARE_SYMBOLS.contains(t.text())) {
      in.next();
      return Operators.compareOp(t.text());
    } else if (t.isKeyword("in")) {
      in.next();
      return CompareOp.IN;
    } else if (t.isKeyword("not") && in.peek(1).isKeyword("in")) {
      in.next();
      in.next();
      return CompareOp.NOT_IN;
    } else if (t.isKeyword("is")) {
      in.next();
      if (in.acceptKeyword("not")) {
        return CompareOp.IS_NOT;
      }
      return CompareOp.IS;
    }
    return null;
  }

  /**
   * Left-associative binary operators at the given level and tighter
   */
  private Expr binary(int level) throws InvalidSyntaxException {
    if (level >= BINARY_LEVELS.size()) {
      return factor();
    }
    ImmutableSet<String> symbols = BINARY_LEVELS.get(level);
    Expr left = binary(level + 1);
    while (true) {
      Token t = in.peek();
      if (t.isSymbol("@")) {
        throw unsupported(t, "matrix multiplication");
      }
      if (!t.is(Kind.SYMBOL) || !symbols.contains(t.text())) {
        return left;
      }
      in.next();
      BinaryOp op = Operators.binaryOp(t.text());
      left = new BinaryExpr(left, op, binary(level + 1));
    }
  }

  private Expr factor() throws InvalidSyntaxException {
    Token t = in.peek();
    if (t.is(Kind.SYMBOL) && UNARY_SYMBOLS.contains(t.text())) {
      in.next();
      UnaryOp op;
      if (t.text().equals("+")) {
        op = UnaryOp.PLUS;
      } else if (t.text().equals("-")) {
        op = UnaryOp.MINUS;
      } else {
        op = UnaryOp.INVERT;
      }
      return new UnaryExpr(op, factor());
    }
    return power();
  }

  private Expr power() throws InvalidSyntaxException {
    Expr base = postfix();
    if (in.acceptSymbol("**")) {
      // Right associative, and right operand may carry a unary sign
      return new BinaryExpr(base, BinaryOp.POW, factor());
    }
    return base;
  }

  private Expr postfix() throws InvalidSyntaxException {
    Expr e = atom();
    while (true) {
      Token t = in.peek();
      if (t.isSymbol("[")) {
        in.next();
        e = new Subscript(e, subscriptIndex());
      } else if (t.isSymbol("(")) {
        in.next();
        e = new Call(e, callArgs());
      } else if (t.isSymbol(".")) {
        throw unsupported(t, "attribute access");
      } else {
        return e;
      }
    }
  }

  private Expr subscriptIndex() throws InvalidSyntaxException {
    Token t = in.peek();
    if (t.isSymbol(":")) {
      throw unsupported(t, "slice");
    }
    Expr index = expression();
    t = in.peek();
    if (t.isSymbol(":")) {
      throw unsupported(t, "slice");
    } else if (t.isSymbol(",")) {
      throw unsupported(t, "tuple index");
    }
    in.expectSymbol("]");
    return index;
  }

  /**
   * Parse arguments after the opening parenthesis, through the closing one
   */
  private List<Expr> callArgs() throws InvalidSyntaxException {
    List<Expr> args = new ArrayList<Expr>();
    while (!in.checkSymbol(")")) {
      Token t = in.peek();
      if (t.isSymbol("*") || t.isSymbol("**")) {
        throw unsupported(t, "starred argument");
      } else if (t.is(Kind.IDENT) && in.peek(1).isSymbol("=")) {
        throw unsupported(t, "keyword argument");
      }
      args.add(expression());
      if (in.checkKeyword("for")) {
        throw unsupported(in.peek(), "generator expression");
      }
      if (!in.acceptSymbol(",")) {
        break;
      }
    }
    in.expectSymbol(")");
    return args;
  }

  private Expr atom() throws InvalidSyntaxException {
    Token t = in.peek();
    switch (t.kind()) {
      case NUMBER:
        in.next();
        return numberLiteral(t);
      case STRING:
        return stringLiteral();
      case IDENT: {
        if (isStringPrefix(t, in.peek(1))) {
          throw unsupported(t, "string prefix");
        }
        in.next();
        Expr lit = namedConstant(t.text());
        return lit != null ? lit : new Name(t.text());
      }
      case KEYWORD: {
        Expr lit = namedConstant(t.text());
        if (lit != null) {
          in.next();
          return lit;
        } else if (UNSUPPORTED_EXPR_KEYWORDS.contains(t.text())) {
          throw unsupported(t, t.text());
        }
        throw in.unexpected("expression");
      }
      case SYMBOL:
        if (t.isSymbol("(")) {
          in.next();
          return parenthesized(t);
        } else if (t.isSymbol("[")) {
          in.next();
          return listLiteral();
        } else if (t.isSymbol("{")) {
          throw unsupported(t, "dict or set literal");
        } else if (t.isSymbol("*")) {
          throw unsupported(t, "starred expression");
        }
        throw in.unexpected("expression");
      default:
        throw in.unexpected("expression");
    }
  }

  private static boolean isStringPrefix(Token ident, Token following) {
    return following.is(Kind.STRING) && following.line() == ident.line() &&
           following.column() == ident.endColumn() &&
           STRING_PREFIXES.contains(ident.text().toLowerCase());
  }

  /**
   * True, False and None are literals whether lexed as keywords or
   * as identifiers
   */
  private static Expr namedConstant(String text) {
    if (text.equals("True")) {
      return BoolLiteral.TRUE;
    } else if (text.equals("False")) {
      return BoolLiteral.FALSE;
    } else if (text.equals("None")) {
      return NullLiteral.INSTANCE;
    }
    return null;
  }

  private static Expr numberLiteral(Token t) {
    Object value = t.value();
    if (value instanceof BigInteger) {
      return new NumberLiteral((BigInteger)value);
    }
    return new NumberLiteral(((Double)value).doubleValue());
  }

  /**
   * Adjacent string literals are concatenated
   */
  private Expr stringLiteral() throws InvalidSyntaxException {
    StringBuilder sb = new StringBuilder();
    while (in.check(Kind.STRING)) {
      sb.append((String)in.next().value());
    }
    return new StringLiteral(sb.toString());
  }

  private Expr parenthesized(Token open) throws InvalidSyntaxException {
    if (in.checkSymbol(")")) {
      throw unsupported(open, "tuple");
    }
    Expr inner = expression();
    Token t = in.peek();
    if (t.isSymbol(",")) {
      throw unsupported(t, "tuple");
    } else if (t.isKeyword("for")) {
      throw unsupported(t, "generator expression");
    }
    in.expectSymbol(")");
    return inner;
  }

  private Expr listLiteral() throws InvalidSyntaxException {
    List<Expr> elements = new ArrayList<Expr>();
    while (!in.checkSymbol("]")) {
      if (in.checkSymbol("*")) {
        throw unsupported(in.peek(), "starred expression");
      }
      elements.add(expression());
      if (in.checkKeyword("for")) {
        throw unsupported(in.peek(), "list comprehension");
      }
      if (!in.acceptSymbol(",")) {
        break;
      }
    }
    in.expectSymbol("]");
    return new ListLiteral(elements);
  }

  private UnsupportedConstructException unsupported(Token t,
                                                    String construct) {
    return new UnsupportedConstructException(in.file(), t, construct);
  }
}
