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

import exm.pjc.common.exceptions.PJCRuntimeError;

/**
 * Conditional.  The else part is either a block or another If, which is
 * rendered directly after the else keyword on the same line.
 */
public class If extends JsTree
{
  private final Expression condition;
  private final Sequence thenBlock;
  private Sequence elseBlock = null;
  private If elseIf = null;

  public If(Expression condition, Sequence thenBlock)
  {
    this.condition = condition;
    this.thenBlock = thenBlock;
  }

  public If(Expression condition, Sequence thenBlock, Sequence elseBlock)
  {
    this(condition, thenBlock);
    setElse(elseBlock);
  }

  public void setElse(Sequence elseBlock)
  {
    checkNoElse();
    this.elseBlock = elseBlock;
  }

  public void setElseIf(If elseIf)
  {
    checkNoElse();
    this.elseIf = elseIf;
  }

  private void checkNoElse()
  {
    if (elseBlock != null || elseIf != null) {
      throw new PJCRuntimeError("if: else part already set");
    }
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    appendClauses(sb);
    sb.append("\n");
  }

  /**
   * Render from the if keyword through the last closing brace
   */
  private void appendClauses(StringBuilder sb)
  {
    sb.append("if (");
    condition.appendTo(sb);
    sb.append(") ");
    inherit(thenBlock);
    thenBlock.appendToAsBlock(sb);
    if (elseIf != null) {
      sb.append(" else ");
      inherit(elseIf);
      elseIf.appendClauses(sb);
    } else if (elseBlock != null) {
      sb.append(" else ");
      inherit(elseBlock);
      elseBlock.appendToAsBlock(sb);
    }
  }
}
