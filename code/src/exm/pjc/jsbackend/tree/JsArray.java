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

/**
 * Array literal [e1, e2, ...]
 */
public class JsArray extends Expression
{
  private final List<Expression> elements;

  public JsArray(List<? extends Expression> elements)
  {
    this.elements = new ArrayList<Expression>(elements);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append('[');
    ExprList.appendCommaSeparated(sb, elements);
    sb.append(']');
  }
}
