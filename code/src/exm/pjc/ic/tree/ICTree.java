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

import java.io.PrintStream;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * This has the definitions for the top-level constructs in the intermediate
 * representation.  The tree is built once by the parser and only read
 * afterwards: every node is immutable, and each node is owned by exactly
 * one parent.
 *
 * The IC tree looks like:
 *
 * Program -> Statement
 *         -> Statement -> Expr
 *         -> Statement -> Statement (nested block)
 *                      -> Statement
 *
 * Statement and expression kinds are closed sets, identified by
 * {@link StatementType} and {@link ICExprs.ExprType}.
 */
public class ICTree {

  public static final String indent = "  ";

  public static class Program {
    private final ImmutableList<Statement> body;

    public Program(List<? extends Statement> body) {
      this.body = ImmutableList.copyOf(body);
    }

    /**
     * @return top-level statements in order
     */
    public List<Statement> body() {
      return body;
    }

    public void log(PrintStream icOutput, String codeTitle) {
      StringBuilder sb = new StringBuilder();
      sb.append("\n\n===========================\n");
      sb.append(codeTitle);
      sb.append("\n===========================\n\n");
      prettyPrint(sb);
      icOutput.println(sb.toString());
      icOutput.flush();
    }

    public void prettyPrint(StringBuilder out) {
      prettyPrintBlock(out, body, "");
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      prettyPrint(sb);
      return sb.toString();
    }
  }

  public static enum StatementType {
    VARIABLE_ASSIGN,
    AUG_ASSIGN,
    FUNCTION_DEF,
    RETURN,
    IF,
    FOR,
    WHILE,
    EXPR,
  }

  public static interface Statement {
    public StatementType type();
    /**
     * Append one line per statement, nested blocks indented further
     */
    public void prettyPrint(StringBuilder sb, String indent);
  }

  static void prettyPrintBlock(StringBuilder sb, List<Statement> block,
                               String currentIndent) {
    for (Statement stmt: block) {
      stmt.prettyPrint(sb, currentIndent);
    }
  }
}
