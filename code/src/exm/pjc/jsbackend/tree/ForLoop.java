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
 * Counted loop over a half-open range
 */
public class ForLoop extends JsTree {
  private final String loopVar;
  private final Sequence loopBody;
  private final Expression start;
  private final Expression end;
  /** Null for a step of one */
  private final Expression incr;

  /**
   * @param loopVar
   * @param start first value
   * @param end end of range, exclusive
   * @param incr amount to increment each iteration, or null for one
   * @param loopBody
   */
  public ForLoop(String loopVar, Expression start, Expression end,
      Expression incr, Sequence loopBody)
  {
    this.loopVar = loopVar;
    this.start = start;
    this.end = end;
    this.incr = incr;
    this.loopBody = loopBody;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);

    // E.g. for (let i = 0; i < n; i += k)
    sb.append("for (let ").append(loopVar).append(" = ");
    start.appendTo(sb);
    sb.append("; ").append(loopVar).append(" < ");
    end.appendTo(sb);
    sb.append("; ").append(loopVar);
    if (incr == null) {
      sb.append("++");
    } else {
      sb.append(" += ");
      incr.appendTo(sb);
    }
    sb.append(") ");

    inherit(loopBody);
    loopBody.appendToAsBlock(sb);
    sb.append("\n");
  }
}
