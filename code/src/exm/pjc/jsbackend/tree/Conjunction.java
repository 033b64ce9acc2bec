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
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * (p1 && p2 && ...)
 */
public class Conjunction extends Expression
{
  private final List<Expression> terms;

  public Conjunction(List<? extends Expression> terms)
  {
    Preconditions.checkArgument(!terms.isEmpty(), "empty conjunction");
    this.terms = new ArrayList<Expression>(terms);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append('(');
    boolean first = true;
    for (Expression term : terms)
    {
      if (!first)
        sb.append(" && ");
      term.appendTo(sb);
      first = false;
    }
    sb.append(')');
  }
}
