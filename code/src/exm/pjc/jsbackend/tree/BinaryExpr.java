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
package exm.pjc.jsbackend.tree;

/**
 * Infix operator application, parenthesized unless requested otherwise
 */
public class BinaryExpr extends Expression
{
  private final Expression left;
  private final String op;
  private final Expression right;
  private final boolean parenthesized;

  public BinaryExpr(Expression left, String op, Expression right)
  {
    this(left, op, right, true);
  }

  /**
   * @param parenthesized false if the enclosing text already delimits the
   *        expression, e.g. the argument of a call
   */
  public BinaryExpr(Expression left, String op, Expression right,
                    boolean parenthesized)
  {
    this.left = left;
    this.op = op;
    this.right = right;
    this.parenthesized = parenthesized;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    if (parenthesized)
      sb.append('(');
    left.appendTo(sb);
    sb.append(' ').append(op).append(' ');
    right.appendTo(sb);
    if (parenthesized)
      sb.append(')');
  }
}
