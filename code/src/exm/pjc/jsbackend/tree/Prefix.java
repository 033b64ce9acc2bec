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
 * Prefix operator applied with no separating space: -x, ~x, +x
 */
public class Prefix extends Expression
{
  private final String op;
  private final Expression operand;

  public Prefix(String op, Expression operand)
  {
    this.op = op;
    this.operand = operand;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append(op);
    String text = operand.toString();
    // "- -x" must not become the decrement operator "--x"
    if (!text.isEmpty() && (op.equals("-") || op.equals("+")) &&
        text.charAt(0) == op.charAt(0)) {
      sb.append(' ');
    }
    sb.append(text);
  }
}
