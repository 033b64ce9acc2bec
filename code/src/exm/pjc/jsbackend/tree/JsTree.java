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

import org.apache.commons.lang3.StringUtils;

import exm.pjc.common.util.StringUtil;

/**
 * Node of generated JavaScript.  Statements render their own indentation
 * and a trailing newline; expressions render neither.
 */
public abstract class JsTree
{
  int indentation = 0;
  Layout layout = Layout.DEFAULT;

  public abstract void appendTo(StringBuilder sb);

  /**
   * Append the tree to the StringBuilder inside
   * curly braces.  Body and closing brace positions come from the layout.
   * @param sb
   */
  public void appendToAsBlock(StringBuilder sb) {
    int outer = indentation;
    sb.append("{\n");
    indentation = layout.bodyIndentation(outer);
    appendTo(sb);
    indentation = outer;
    sb.append(StringUtils.repeat(' ', layout.closingIndentation(outer)));
    sb.append("}");
  }

  public void indent(StringBuilder sb)
  {
    StringUtil.spaces(sb, indentation);
  }

  public void setIndentation(int i)
  {
    indentation = i;
  }

  public void setLayout(Layout layout)
  {
    this.layout = layout;
  }

  /**
   * Prepare child to be rendered as part of this node
   */
  protected void inherit(JsTree child)
  {
    child.setIndentation(indentation);
    child.setLayout(layout);
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(2048);
    appendTo(sb);
    return sb.toString();
  }
}
