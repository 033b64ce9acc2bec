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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.pjc.common.exceptions.CodeGenerationError;
import exm.pjc.common.lang.Operators.BinaryOp;
import exm.pjc.common.lang.Operators.CompareOp;
import exm.pjc.ic.tree.ICExprs;
import exm.pjc.ic.tree.ICExprs.BoolLiteral;
import exm.pjc.ic.tree.ICExprs.Compare;
import exm.pjc.ic.tree.ICExprs.Expr;
import exm.pjc.ic.tree.ICExprs.ListLiteral;
import exm.pjc.ic.tree.ICExprs.Name;
import exm.pjc.ic.tree.ICExprs.NumberLiteral;
import exm.pjc.ic.tree.ICExprs.StringLiteral;
import exm.pjc.ic.tree.ICExprs.Subscript;
import exm.pjc.ic.tree.ICExprs.UnaryExpr;
import exm.pjc.ic.tree.ICStatements;
import exm.pjc.ic.tree.ICStatements.AugAssign;
import exm.pjc.ic.tree.ICStatements.ForStatement;
import exm.pjc.ic.tree.ICStatements.FunctionDef;
import exm.pjc.ic.tree.ICStatements.IfStatement;
import exm.pjc.ic.tree.ICStatements.VariableAssign;
import exm.pjc.ic.tree.ICStatements.WhileStatement;
import exm.pjc.ic.tree.ICTree.Program;
import exm.pjc.ic.tree.ICTree.Statement;
import exm.pjc.jsbackend.tree.BinaryExpr;
import exm.pjc.jsbackend.tree.Call;
import exm.pjc.jsbackend.tree.Conjunction;
import exm.pjc.jsbackend.tree.ExprStatement;
import exm.pjc.jsbackend.tree.Expression;
import exm.pjc.jsbackend.tree.ForLoop;
import exm.pjc.jsbackend.tree.ForOf;
import exm.pjc.jsbackend.tree.FunctionDecl;
import exm.pjc.jsbackend.tree.If;
import exm.pjc.jsbackend.tree.Index;
import exm.pjc.jsbackend.tree.JsArray;
import exm.pjc.jsbackend.tree.JsString;
import exm.pjc.jsbackend.tree.JsTree;
import exm.pjc.jsbackend.tree.Not;
import exm.pjc.jsbackend.tree.Prefix;
import exm.pjc.jsbackend.tree.Return;
import exm.pjc.jsbackend.tree.Sequence;
import exm.pjc.jsbackend.tree.SetVariable;
import exm.pjc.jsbackend.tree.Token;
import exm.pjc.jsbackend.tree.WhileLoop;

/**
 * Lowers the IC tree to JavaScript text.
 *
 * Each IC node is translated into a node of the JavaScript code tree,
 * which is then rendered in one pass.  The generator holds no state
 * between calls to {@link #generate(Program)}; the same program always
 * produces the same text.
 */
public class JsGenerator {

  /** Builtin called as console.log */
  public static final String PRINT_FUNCTION = "print";
  /** Builtin lowered to a counted loop when iterated over */
  public static final String RANGE_FUNCTION = "range";

  private final Logger logger;
  private final GenOptions options;
  private final JsNamer namer;

  public JsGenerator(Logger logger, GenOptions options) {
    this.logger = logger;
    this.options = options;
    this.namer = new JsNamer(options.renameReserved());
  }

  /**
   * @return complete program text, statements separated by newlines and
   *         with no trailing newline
   * @throws CodeGenerationError if the tree holds a node this generator
   *         does not know
   */
  public String generate(Program program) {
    logger.debug("Generating JavaScript for " + program.body().size() +
                 " top-level statements, " + options);
    Sequence top = block(program.body());
    top.setIndentation(0);
    top.setLayout(options.layout());
    String code = StringUtils.removeEnd(top.toString(), "\n");
    logger.debug("Generated " + code.length() + " characters");
    return code;
  }

  private Sequence block(List<Statement> stmts) {
    Sequence seq = new Sequence();
    for (Statement stmt: stmts) {
      seq.add(statement(stmt));
    }
    return seq;
  }

  private JsTree statement(Statement stmt) {
    if (stmt == null || stmt.type() == null) {
      throw new CodeGenerationError("statement without type: " + stmt);
    }
    try {
      switch (stmt.type()) {
        case VARIABLE_ASSIGN:
          return variableAssign((VariableAssign)stmt);
        case AUG_ASSIGN:
          return augAssign((AugAssign)stmt);
        case FUNCTION_DEF:
          return functionDef((FunctionDef)stmt);
        case RETURN:
          return returnStatement((ICStatements.Return)stmt);
        case IF:
          return ifStatement((IfStatement)stmt);
        case FOR:
          return forStatement((ForStatement)stmt);
        case WHILE:
          return whileStatement((WhileStatement)stmt);
        case EXPR:
          return new ExprStatement(
                        expr(((ICStatements.ExprStatement)stmt).value()));
        default:
          throw new CodeGenerationError("unknown statement type " +
                                        stmt.type());
      }
    } catch (ClassCastException e) {
      throw new CodeGenerationError("statement of type " + stmt.type() +
          " has unexpected class " + stmt.getClass().getName());
    }
  }

  private JsTree variableAssign(VariableAssign stmt) {
    return SetVariable.declare(namer.name(stmt.name()), expr(stmt.value()));
  }

  private JsTree augAssign(AugAssign stmt) {
    String target = namer.name(stmt.target());
    Expression value = expr(stmt.value());
    BinaryOp op = stmt.op();
    if (op.needsLowering()) {
      // x **= v becomes x = Math.pow(x, v)
      return SetVariable.update(target, "=",
                        binaryOp(op, new Token(target), value));
    }
    return SetVariable.update(target, op.symbol() + "=", value);
  }

  private JsTree functionDef(FunctionDef stmt) {
    List<String> params = new ArrayList<String>(stmt.params().size());
    for (String param: stmt.params()) {
      params.add(namer.name(param));
    }
    return new FunctionDecl(namer.name(stmt.name()), params,
                            block(stmt.body()));
  }

  private JsTree returnStatement(ICStatements.Return stmt) {
    if (stmt.hasValue()) {
      return new Return(expr(stmt.value()));
    }
    return new Return();
  }

  private If ifStatement(IfStatement stmt) {
    If result = new If(expr(stmt.test()), block(stmt.thenBlock()));
    IfStatement elseIf = stmt.elseIf();
    if (elseIf != null) {
      result.setElseIf(ifStatement(elseIf));
    } else if (stmt.hasElse()) {
      result.setElse(block(stmt.elseBlock()));
    }
    return result;
  }

  private JsTree forStatement(ForStatement stmt) {
    String loopVar = namer.name(stmt.target());
    Sequence body = block(stmt.body());
    Expr iterable = stmt.iterable();
    if (iterable.type() == ICExprs.ExprType.CALL) {
      ICExprs.Call call = (ICExprs.Call)iterable;
      List<Expr> args = call.args();
      if (call.calls(RANGE_FUNCTION) && args.size() >= 1 &&
          args.size() <= 3) {
        Expression start, end, step = null;
        if (args.size() == 1) {
          start = new Token("0");
          end = expr(args.get(0));
        } else {
          start = expr(args.get(0));
          end = expr(args.get(1));
          if (args.size() == 3) {
            step = expr(args.get(2));
          }
        }
        return new ForLoop(loopVar, start, end, step, body);
      }
    }
    return new ForOf(loopVar, expr(iterable), body);
  }

  private JsTree whileStatement(WhileStatement stmt) {
    return new WhileLoop(expr(stmt.test()), block(stmt.body()));
  }

  private Expression expr(Expr e) {
    if (e == null || e.type() == null) {
      throw new CodeGenerationError("expression without type: " + e);
    }
    try {
      switch (e.type()) {
        case NAME:
          return new Token(namer.name(((Name)e).id()));
        case NUMBER:
          return new Token(((NumberLiteral)e).canonicalText());
        case STRING:
          return new JsString(((StringLiteral)e).value());
        case BOOL:
          return new Token(((BoolLiteral)e).value() ? "true" : "false");
        case NULL:
          return new Token("null");
        case BINARY_OP: {
          ICExprs.BinaryExpr bin = (ICExprs.BinaryExpr)e;
          return binaryOp(bin.op(), expr(bin.left()), expr(bin.right()));
        }
        case UNARY_OP:
          return unaryOp((UnaryExpr)e);
        case SUBSCRIPT: {
          Subscript sub = (Subscript)e;
          return new Index(expr(sub.value()), expr(sub.index()));
        }
        case CALL:
          return call((ICExprs.Call)e);
        case COMPARE:
          return compare((Compare)e);
        case LIST: {
          List<Expression> elements = new ArrayList<Expression>();
          for (Expr elem: ((ListLiteral)e).elements()) {
            elements.add(expr(elem));
          }
          return new JsArray(elements);
        }
        default:
          throw new CodeGenerationError("unknown expression type " +
                                        e.type());
      }
    } catch (ClassCastException ex) {
      throw new CodeGenerationError("expression of type " + e.type() +
          " has unexpected class " + e.getClass().getName());
    }
  }

  private static Expression binaryOp(BinaryOp op, Expression left,
                                     Expression right) {
    switch (op) {
      case POW:
        return new Call("Math.pow", left, right);
      case FLOOR_DIV:
        return new Call("Math.floor", new BinaryExpr(left, "/", right, false));
      default:
        return new BinaryExpr(left, op.symbol(), right);
    }
  }

  private Expression unaryOp(UnaryExpr e) {
    Expression operand = expr(e.operand());
    switch (e.op()) {
      case NOT:
        return new Not(operand);
      default:
        return new Prefix(e.op().targetSymbol(), operand);
    }
  }

  private Expression call(ICExprs.Call e) {
    List<Expression> args = new ArrayList<Expression>(e.args().size());
    for (Expr arg: e.args()) {
      args.add(expr(arg));
    }
    Expression callee;
    if (e.calls(PRINT_FUNCTION)) {
      callee = new Token("console.log");
    } else {
      callee = expr(e.callee());
    }
    return new Call(callee, args);
  }

  /**
   * Each adjacent pair is compared independently.  A chain is the
   * conjunction of its pairs, so middle operands are evaluated twice.
   */
  private Expression compare(Compare e) {
    List<Expression> pairs = new ArrayList<Expression>(e.ops().size());
    Expression left = expr(e.left());
    for (int i = 0; i < e.ops().size(); i++) {
      Expression right = expr(e.comparators().get(i));
      pairs.add(comparePair(e.ops().get(i), left, right));
      left = right;
    }
    if (pairs.size() == 1) {
      return pairs.get(0);
    }
    return new Conjunction(pairs);
  }

  private static Expression comparePair(CompareOp op, Expression left,
                                        Expression right) {
    Expression test = new BinaryExpr(left, op.targetSymbol(), right);
    if (op.negated()) {
      return new Not(test);
    }
    return test;
  }
}
