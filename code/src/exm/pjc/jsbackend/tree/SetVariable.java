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
 * Variable binding or update.  Declarations always introduce a fresh
 * mutable binding with let.
 */
public class SetVariable extends JsTree
{
  private final boolean declare;
  private final String variable;
  private final String op;
  private final Expression value;

  private SetVariable(boolean declare, String variable, String op,
                      Expression value)
  {
    this.declare = declare;
    this.variable = variable;
    this.op = op;
    this.value = value;
  }

  /**
   * let variable = value;
   */
  public static SetVariable declare(String variable, Expression value)
  {
    return new SetVariable(true, variable, "=", value);
  }

  /**
   * variable op value; where op is an assignment operator such as "+="
   */
  public static SetVariable update(String variable, String op,
                                   Expression value)
  {
    return new SetVariable(false, variable, op, value);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    if (declare)
      sb.append("let ");
    sb.append(variable).append(' ').append(op).append(' ');
    value.appendTo(sb);
    sb.append(";\n");
  }
}
