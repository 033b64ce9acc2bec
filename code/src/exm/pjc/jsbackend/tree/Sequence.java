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
 * Sequence of statements at the same indentation
 */
public class Sequence extends JsTree
{
  private final List<JsTree> members = new ArrayList<JsTree>();

  public Sequence()
  {
  }

  public Sequence(List<? extends JsTree> trees)
  {
    members.addAll(trees);
  }

  public void add(JsTree tree)
  {
    members.add(tree);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    for (JsTree member : members)
    {
      inherit(member);
      member.appendTo(sb);
    }
  }
}
