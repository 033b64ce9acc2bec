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
package exm.pjc.ic.tree;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.pjc.common.lang.Operators.BinaryOp;
import exm.pjc.common.util.StringUtil;
import exm.pjc.ic.tree.ICExprs.Expr;
import exm.pjc.ic.tree.ICTree.Statement;
import exm.pjc.ic.tree.ICTree.StatementType;

/**
 * Statement nodes of the intermediate representation
 */
public class ICStatements {

  /**
   * Single-target assignment: name = value
   */
  public static class VariableAssign implements Statement {
    private final String name;
    private final Expr value;

    public VariableAssign(String name, Expr value) {
      this.name = Preconditions.checkNotNull(name);
      this.value = Preconditions.checkNotNull(value);
    }

    public String name() {
      return name;
    }

    public Expr value() {
      return value;
    }

    @Override
    public StatementType type() {
      return StatementType.VARIABLE_ASSIGN;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append(name).append(" = ");
      value.prettyPrint(sb);
      sb.append('\n');
    }
  }

  /**
   * target op= value, where target is a bare identifier
   */
  public static class AugAssign implements Statement {
    private final String target;
    private final BinaryOp op;
    private final Expr value;

    public AugAssign(String target, BinaryOp op, Expr value) {
      this.target = Preconditions.checkNotNull(target);
      this.op = Preconditions.checkNotNull(op);
      this.value = Preconditions.checkNotNull(value);
    }

    public String target() {
      return target;
    }

    public BinaryOp op() {
      return op;
    }

    public Expr value() {
      return value;
    }

    @Override
    public StatementType type() {
      return StatementType.AUG_ASSIGN;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append(target).append(' ')
        .append(op.symbol()).append("= ");
      value.prettyPrint(sb);
      sb.append('\n');
    }
  }

  public static class FunctionDef implements Statement {
    private final String name;
    private final ImmutableList<String> params;
    private final ImmutableList<Statement> body;

    public FunctionDef(String name, List<String> params,
                       List<? extends Statement> body) {
      this.name = Preconditions.checkNotNull(name);
      this.params = ImmutableList.copyOf(params);
      this.body = ImmutableList.copyOf(body);
    }

    public String name() {
      return name;
    }

    public List<String> params() {
      return params;
    }

    public List<Statement> body() {
      return body;
    }

    @Override
    public StatementType type() {
      return StatementType.FUNCTION_DEF;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append("def ").append(name).append('(')
        .append(StringUtil.concat(", ", params)).append("):\n");
      ICTree.prettyPrintBlock(sb, body, indent + ICTree.indent);
    }
  }

  public static class Return implements Statement {
    /** Null for bare return */
    private final Expr value;

    public Return(Expr value) {
      this.value = value;
    }

    public Return() {
      this(null);
    }

    /**
     * @return returned value, or null if none
     */
    public Expr value() {
      return value;
    }

    public boolean hasValue() {
      return value != null;
    }

    @Override
    public StatementType type() {
      return StatementType.RETURN;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append("return");
      if (value != null) {
        sb.append(' ');
        value.prettyPrint(sb);
      }
      sb.append('\n');
    }
  }

  /**
   * Two-way conditional.  A multi-way branch is a chain of these: the else
   * block of all but the last holds exactly one nested IfStatement.
   */
  public static class IfStatement implements Statement {
    private final Expr test;
    private final ImmutableList<Statement> thenBlock;
    private final ImmutableList<Statement> elseBlock;

    public IfStatement(Expr test, List<? extends Statement> thenBlock,
                       List<? extends Statement> elseBlock) {
      this.test = Preconditions.checkNotNull(test);
      this.thenBlock = ImmutableList.copyOf(thenBlock);
      this.elseBlock = ImmutableList.copyOf(elseBlock);
    }

    public IfStatement(Expr test, List<? extends Statement> thenBlock) {
      this(test, thenBlock, ImmutableList.<Statement>of());
    }

    public Expr test() {
      return test;
    }

    public List<Statement> thenBlock() {
      return thenBlock;
    }

    /**
     * @return else block, empty if there is no else
     */
    public List<Statement> elseBlock() {
      return elseBlock;
    }

    public boolean hasElse() {
      return !elseBlock.isEmpty();
    }

    /**
     * @return the nested conditional if the else block is an else-if,
     *         otherwise null
     */
    public IfStatement elseIf() {
      if (elseBlock.size() == 1 &&
          elseBlock.get(0).type() == StatementType.IF) {
        return (IfStatement)elseBlock.get(0);
      }
      return null;
    }

    @Override
    public StatementType type() {
      return StatementType.IF;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append("if ");
      test.prettyPrint(sb);
      sb.append(":\n");
      ICTree.prettyPrintBlock(sb, thenBlock, indent + ICTree.indent);
      if (hasElse()) {
        sb.append(indent).append("else:\n");
        ICTree.prettyPrintBlock(sb, elseBlock, indent + ICTree.indent);
      }
    }
  }

  public static class ForStatement implements Statement {
    private final String target;
    private final Expr iterable;
    private final ImmutableList<Statement> body;

    public ForStatement(String target, Expr iterable,
                        List<? extends Statement> body) {
      this.target = Preconditions.checkNotNull(target);
      this.iterable = Preconditions.checkNotNull(iterable);
      this.body = ImmutableList.copyOf(body);
    }

    public String target() {
      return target;
    }

    public Expr iterable() {
      return iterable;
    }

    public List<Statement> body() {
      return body;
    }

    @Override
    public StatementType type() {
      return StatementType.FOR;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append("for ").append(target).append(" in ");
      iterable.prettyPrint(sb);
      sb.append(":\n");
      ICTree.prettyPrintBlock(sb, body, indent + ICTree.indent);
    }
  }

  public static class WhileStatement implements Statement {
    private final Expr test;
    private final ImmutableList<Statement> body;

    public WhileStatement(Expr test, List<? extends Statement> body) {
      this.test = Preconditions.checkNotNull(test);
      this.body = ImmutableList.copyOf(body);
    }

    public Expr test() {
      return test;
    }

    public List<Statement> body() {
      return body;
    }

    @Override
    public StatementType type() {
      return StatementType.WHILE;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent).append("while ");
      test.prettyPrint(sb);
      sb.append(":\n");
      ICTree.prettyPrintBlock(sb, body, indent + ICTree.indent);
    }
  }

  /**
   * Expression evaluated for its effect
   */
  public static class ExprStatement implements Statement {
    private final Expr value;

    public ExprStatement(Expr value) {
      this.value = Preconditions.checkNotNull(value);
    }

    public Expr value() {
      return value;
    }

    @Override
    public StatementType type() {
      return StatementType.EXPR;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent);
      value.prettyPrint(sb);
      sb.append('\n');
    }
  }
}
