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
 * value[index]
 */
public class Index extends Expression
{
  private final Expression value;
  private final Expression index;

  public Index(Expression value, Expression index)
  {
    this.value = value;
    this.index = index;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    value.appendTo(sb);
    sb.append('[');
    index.appendTo(sb);
    sb.append(']');
  }
}
