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

import exm.pjc.common.util.StringUtil;

/**
 * function name(p1, p2) { body }
 */
public class FunctionDecl extends JsTree
{
  private final String name;
  private final List<String> params;
  private final Sequence body;

  public FunctionDecl(String name, List<String> params, Sequence body)
  {
    this.name = name;
    this.params = new ArrayList<String>(params);
    this.body = body;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("function ").append(name).append('(');
    sb.append(StringUtil.concat(", ", params));
    sb.append(") ");
    inherit(body);
    body.appendToAsBlock(sb);
    sb.append("\n");
  }
}
