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

package exm.pjc.common.exceptions;

import exm.pjc.common.lang.Stage;

/**
 * Represents an error caused by user input
 * Thus, this should contain good error message information
 * */
public class UserException
extends Exception
{
  /** Column is unknown */
  public static final int NO_COLUMN = -1;

  private final Stage stage;
  private final String file;
  private final int line;
  private final int column;
  private final String rawMessage;

  /**
   * @param stage pipeline stage that failed
   * @param file input name, or null if not known
   * @param line 1-based line, or 0 if not known
   * @param col 0-based column, or {@link #NO_COLUMN}
   * @param message
   */
  public UserException(Stage stage, String file, int line, int col,
                       String message) {
    super(buildMessage(stage, file, line, col, message));
    this.stage = stage;
    this.file = file;
    this.line = line;
    this.column = col;
    this.rawMessage = message;
  }

  public UserException(Stage stage, String message) {
    this(stage, null, 0, NO_COLUMN, message);
  }

  private static String buildMessage(Stage stage, String file, int line,
                                     int col, String message) {
    StringBuilder sb = new StringBuilder();
    if (file != null) {
      sb.append(file).append(":");
    }
    if (line > 0) {
      sb.append(line).append(":");
      if (col >= 0) {
        sb.append(col + 1).append(":");
      }
    }
    if (sb.length() > 0) {
      sb.append(" ");
    }
    sb.append(stage.label()).append(" error: ").append(message);
    return sb.toString();
  }

  public Stage getStage() {
    return stage;
  }

  /**
   * @return input name, or null
   */
  public String getFile() {
    return file;
  }

  public int getLine() {
    return line;
  }

  /**
   * @return 0-based column or {@link #NO_COLUMN}
   */
  public int getColumn() {
    return column;
  }

  /**
   * @return message without location prefix
   */
  public String getRawMessage() {
    return rawMessage;
  }

  private static final long serialVersionUID = 1L;
}
