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
package exm.pjc.jsbackend;

import exm.pjc.common.Settings;
import exm.pjc.common.exceptions.InvalidOptionException;
import exm.pjc.jsbackend.tree.Layout;
import exm.pjc.jsbackend.tree.Layout.IndentPolicy;

/**
 * Options affecting the generated code.  Immutable.
 */
public class GenOptions {
  private final Layout layout;
  private final boolean renameReserved;

  public GenOptions(Layout layout, boolean renameReserved) {
    this.layout = layout;
    this.renameReserved = renameReserved;
  }

  public GenOptions(IndentPolicy policy, int indentWidth,
                    boolean renameReserved) {
    this(new Layout(policy, indentWidth), renameReserved);
  }

  /**
   * Cumulative indentation of four spaces, identifiers kept verbatim
   */
  public static GenOptions defaults() {
    return new GenOptions(Layout.DEFAULT, false);
  }

  /**
   * Build from the pjc.codegen.* settings
   * @throws InvalidOptionException if a setting has a bad value
   */
  public static GenOptions fromSettings() throws InvalidOptionException {
    int width = Settings.getInt(Settings.CODEGEN_INDENT_WIDTH);
    IndentPolicy policy;
    try {
      policy = IndentPolicy.fromString(
                  Settings.get(Settings.CODEGEN_INDENT_POLICY));
    } catch (IllegalArgumentException e) {
      throw new InvalidOptionException("Unknown indentation policy: " +
                  Settings.get(Settings.CODEGEN_INDENT_POLICY));
    }
    boolean rename = Settings.getBoolean(Settings.CODEGEN_RENAME_RESERVED);
    return new GenOptions(policy, width, rename);
  }

  public Layout layout() {
    return layout;
  }

  public boolean renameReserved() {
    return renameReserved;
  }

  @Override
  public String toString() {
    return "indent=" + layout.policy().toString().toLowerCase() + "/" +
           layout.width() + " renameReserved=" + renameReserved;
  }
}
