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
 * for (let x of iterable) { body }
 */
public class ForOf extends JsTree {
  private final String loopVar;
  private final Expression iterable;
  private final Sequence loopBody;

  public ForOf(String loopVar, Expression iterable, Sequence loopBody) {
    this.loopVar = loopVar;
    this.iterable = iterable;
    this.loopBody = loopBody;
  }

  @Override
  public void appendTo(StringBuilder sb) {
    indent(sb);
    sb.append("for (let ").append(loopVar).append(" of ");
    iterable.appendTo(sb);
    sb.append(") ");
    inherit(loopBody);
    loopBody.appendToAsBlock(sb);
    sb.append("\n");
  }
}
