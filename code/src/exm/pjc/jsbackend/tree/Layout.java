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

import com.google.common.base.Preconditions;

/**
 * How nested blocks are indented
 */
public class Layout {

  public static enum IndentPolicy {
    /** Each block one unit deeper than the line that opens it */
    CUMULATIVE,
    /**
     * Every block body one unit from the margin and every closing brace at
     * the margin, regardless of nesting depth
     */
    FLAT;

    /**
     * @param name case-insensitive policy name
     */
    public static IndentPolicy fromString(String name) {
      return valueOf(name.trim().toUpperCase());
    }
  }

  public static final int DEFAULT_WIDTH = 4;

  public static final Layout DEFAULT =
      new Layout(IndentPolicy.CUMULATIVE, DEFAULT_WIDTH);

  private final IndentPolicy policy;
  private final int width;

  public Layout(IndentPolicy policy, int width) {
    Preconditions.checkArgument(width > 0, "bad indent width %s", width);
    this.policy = Preconditions.checkNotNull(policy);
    this.width = width;
  }

  public IndentPolicy policy() {
    return policy;
  }

  public int width() {
    return width;
  }

  /**
   * @param outer indentation of the line opening the block
   * @return indentation of statements in the block
   */
  public int bodyIndentation(int outer) {
    if (policy == IndentPolicy.FLAT) {
      return width;
    }
    return outer + width;
  }

  /**
   * @param outer indentation of the line opening the block
   * @return indentation of the closing brace
   */
  public int closingIndentation(int outer) {
    if (policy == IndentPolicy.FLAT) {
      return 0;
    }
    return outer;
  }
}
