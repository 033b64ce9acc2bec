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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Function call: callee(arg, arg, ...)
 */
public class Call extends Expression
{
  private final Expression callee;
  private final List<Expression> args;

  public Call(Expression callee, List<? extends Expression> args)
  {
    this.callee = callee;
    this.args = new ArrayList<Expression>(args);
  }

  public Call(String callee, Expression... args)
  {
    this(new Token(callee), Arrays.asList(args));
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    callee.appendTo(sb);
    sb.append('(');
    ExprList.appendCommaSeparated(sb, args);
    sb.append(')');
  }
}
