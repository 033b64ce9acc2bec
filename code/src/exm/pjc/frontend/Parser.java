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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableMap;

import exm.pjc.common.Logging;
import exm.pjc.common.exceptions.InvalidSyntaxException;
import exm.pjc.common.exceptions.UnsupportedConstructException;
import exm.pjc.common.lang.Operators;
import exm.pjc.common.lang.Operators.BinaryOp;
import exm.pjc.frontend.Token.Kind;
import exm.pjc.ic.tree.ICExprs.Expr;
import exm.pjc.ic.tree.ICExprs.ExprType;
import exm.pjc.ic.tree.ICExprs.Name;
import exm.pjc.ic.tree.ICStatements.AugAssign;
import exm.pjc.ic.tree.ICStatements.ExprStatement;
import exm.pjc.ic.tree.ICStatements.ForStatement;
import exm.pjc.ic.tree.ICStatements.FunctionDef;
import exm.pjc.ic.tree.ICStatements.IfStatement;
import exm.pjc.ic.tree.ICStatements.Return;
import exm.pjc.ic.tree.ICStatements.VariableAssign;
import exm.pjc.ic.tree.ICStatements.WhileStatement;
import exm.pjc.ic.tree.ICTree.Program;
import exm.pjc.ic.tree.ICTree.Statement;

/**
 * Recursive descent parser from the token stream to the IC tree.
 * Tokens are consumed left to right without backtracking.
 */
public class Parser {

  private static final Logger logger = Logging.getPJCLogger();

  /** Statement keywords outside the subset, with the name reported */
  private static final ImmutableMap<String, String> UNSUPPORTED_STATEMENTS =
      ImmutableMap.<String, String>builder()
        .put("class", "class definition")
        .put("import", "import statement")
        .put("from", "import statement")
        .put("pass", "pass statement")
        .put("break", "break statement")
        .put("continue", "continue statement")
        .put("global", "global declaration")
        .put("nonlocal", "nonlocal declaration")
        .put("del", "del statement")
        .put("assert", "assert statement")
        .put("raise", "raise statement")
        .put("try", "try statement")
        .put("with", "with statement")
        .put("async", "async statement")
        .build();

  private final String file;
  private final TokenStream in;
  private final ExprParser exprs;

  /**
   * @param file input name used in messages, or null
   * @param tokens output of the lexer, ending in EOF
   */
  public Parser(String file, List<Token> tokens) {
    this.file = file;
    this.in = new TokenStream(file, tokens);
    this.exprs = new ExprParser(in);
  }

  /**
   * Parse the whole token stream
   * @throws InvalidSyntaxException at the first malformed or unsupported
   *          construct
   */
  public Program parse() throws InvalidSyntaxException {
    List<Statement> body = new ArrayList<Statement>();
    while (!in.atEnd()) {
      if (in.check(Kind.NEWLINE)) {
        in.next();
        continue;
      }
      statement(body);
    }
    logger.debug("Parsed " + body.size() + " top-level statements" +
                 (file != null ? " from " + file : ""));
    return new Program(body);
  }

  /**
   * Parse one compound statement, or one line of simple statements,
   * appending the result to block
   */
  private void statement(List<Statement> block)
      throws InvalidSyntaxException {
    Token t = in.peek();
    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(file, t, "statement at " + t.describe());
    }

    if (t.is(Kind.INDENT)) {
      throw new InvalidSyntaxException(file, t, "unexpected indent");
    } else if (t.isKeyword("def")) {
      block.add(functionDef());
    } else if (t.isKeyword("if")) {
      in.next();
      block.add(ifTail());
    } else if (t.isKeyword("for")) {
      block.add(forStatement());
    } else if (t.isKeyword("while")) {
      block.add(whileStatement());
    } else if (t.isSymbol("@")) {
      throw unsupported(t, "decorator");
    } else {
      simpleStatements(block);
    }
  }

  private FunctionDef functionDef() throws InvalidSyntaxException {
    in.expectKeyword("def");
    String name = in.expect(Kind.IDENT, "function name").text();
    in.expectSymbol("(");
    List<String> params = new ArrayList<String>();
    while (!in.checkSymbol(")")) {
      Token t = in.peek();
      if (t.isSymbol("*") || t.isSymbol("**") || t.isSymbol("/")) {
        throw unsupported(t, "variadic or positional-only parameters");
      }
      String param = in.expect(Kind.IDENT, "parameter name").text();
      if (params.contains(param)) {
        throw new InvalidSyntaxException(file, t,
            "duplicate parameter '" + param + "'");
      }
      params.add(param);
      if (in.checkSymbol("=")) {
        throw unsupported(in.peek(), "default parameter value");
      } else if (in.checkSymbol(":")) {
        throw unsupported(in.peek(), "parameter annotation");
      }
      if (!in.acceptSymbol(",")) {
        break;
      }
    }
    in.expectSymbol(")");
    if (in.checkSymbol("->")) {
      throw unsupported(in.peek(), "return annotation");
    }
    List<Statement> body = block();
    return new FunctionDef(name, params, body);
  }

  /**
   * Parse the rest of an if or elif clause after its keyword.  Each elif
   * becomes an IfStatement nested as the sole statement of the else block.
   */
  private IfStatement ifTail() throws InvalidSyntaxException {
    Expr test = exprs.expression();
    List<Statement> thenBlock = block();
    if (in.acceptKeyword("elif")) {
      List<Statement> elseBlock = new ArrayList<Statement>(1);
      elseBlock.add(ifTail());
      return new IfStatement(test, thenBlock, elseBlock);
    } else if (in.acceptKeyword("else")) {
      return new IfStatement(test, thenBlock, block());
    }
    return new IfStatement(test, thenBlock);
  }

  private ForStatement forStatement() throws InvalidSyntaxException {
    in.expectKeyword("for");
    Token targetTok = in.expect(Kind.IDENT, "loop variable");
    if (in.checkSymbol(",")) {
      throw unsupported(in.peek(), "tuple loop target");
    } else if (!in.checkKeyword("in")) {
      throw unsupported(targetTok, "non-identifier loop target");
    }
    in.expectKeyword("in");
    Expr iterable = exprs.expression();
    if (in.checkSymbol(",")) {
      throw unsupported(in.peek(), "tuple");
    }
    List<Statement> body = block();
    rejectLoopElse("for");
    return new ForStatement(targetTok.text(), iterable, body);
  }

  private WhileStatement whileStatement() throws InvalidSyntaxException {
    in.expectKeyword("while");
    Expr test = exprs.expression();
    List<Statement> body = block();
    rejectLoopElse("while");
    return new WhileStatement(test, body);
  }

  private void rejectLoopElse(String loop)
      throws UnsupportedConstructException {
    if (in.checkKeyword("else")) {
      throw unsupported(in.peek(), loop + "-else clause");
    }
  }

  /**
   * Parse ':' and the suite after it: either an indented block on the
   * following lines, or simple statements on the same line
   */
  private List<Statement> block() throws InvalidSyntaxException {
    in.expectSymbol(":");
    List<Statement> stmts = new ArrayList<Statement>();
    if (!in.check(Kind.NEWLINE)) {
      Token t = in.peek();
      if (t.isKeyword("def") || t.isKeyword("if") || t.isKeyword("for") ||
          t.isKeyword("while")) {
        throw in.unexpected("simple statement");
      }
      simpleStatements(stmts);
      return stmts;
    }

    in.next();
    in.expect(Kind.INDENT, "indented block");
    while (!in.check(Kind.DEDENT) && !in.atEnd()) {
      statement(stmts);
    }
    in.expect(Kind.DEDENT, "dedent");
    return stmts;
  }

  /**
   * simple_stmt (';' simple_stmt)* [';'] NEWLINE
   */
  private void simpleStatements(List<Statement> block)
      throws InvalidSyntaxException {
    block.add(simpleStatement());
    while (in.acceptSymbol(";")) {
      if (in.check(Kind.NEWLINE)) {
        break;
      }
      block.add(simpleStatement());
    }
    in.expect(Kind.NEWLINE, "end of line");
  }

  private Statement simpleStatement() throws InvalidSyntaxException {
    Token start = in.peek();
    if (start.is(Kind.KEYWORD)) {
      String construct = UNSUPPORTED_STATEMENTS.get(start.text());
      if (construct != null) {
        throw unsupported(start, construct);
      } else if (start.isKeyword("return")) {
        return returnStatement();
      } else if (start.isKeyword("elif") || start.isKeyword("else")) {
        throw new InvalidSyntaxException(file, start,
            "'" + start.text() + "' without matching 'if'");
      }
    }

    Expr e = exprs.expression();
    Token t = in.peek();
    if (t.isSymbol(",")) {
      throw unsupported(t, "tuple");
    } else if (t.isSymbol(":")) {
      throw unsupported(t, "variable annotation");
    } else if (t.isSymbol("=")) {
      in.next();
      String target = assignTarget(e, start, "assignment to non-identifier " +
                                             "target");
      Expr value = exprs.expression();
      if (in.checkSymbol("=")) {
        throw unsupported(in.peek(), "multiple assignment targets");
      } else if (in.checkSymbol(",")) {
        throw unsupported(in.peek(), "tuple");
      }
      return new VariableAssign(target, value);
    } else if (t.is(Kind.SYMBOL)) {
      BinaryOp op = Operators.augmentedOp(t.text());
      if (op != null) {
        in.next();
        String target = assignTarget(e, start, "augmented assignment to " +
                                               "non-identifier target");
        Expr value = exprs.expression();
        if (in.checkSymbol(",")) {
          throw unsupported(in.peek(), "tuple");
        }
        return new AugAssign(target, op, value);
      }
    }
    return new ExprStatement(e);
  }

  private String assignTarget(Expr e, Token start, String construct)
      throws UnsupportedConstructException {
    if (e.type() != ExprType.NAME) {
      throw unsupported(start, construct);
    }
    return ((Name)e).id();
  }

  private Return returnStatement() throws InvalidSyntaxException {
    in.expectKeyword("return");
    if (in.check(Kind.NEWLINE) || in.checkSymbol(";")) {
      return new Return();
    }
    Expr value = exprs.expression();
    if (in.checkSymbol(",")) {
      throw unsupported(in.peek(), "tuple");
    }
    return new Return(value);
  }

  private UnsupportedConstructException unsupported(Token t,
                                                    String construct) {
    return new UnsupportedConstructException(file, t, construct);
  }
}
