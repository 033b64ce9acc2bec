package exm.pjc.common.exceptions;

import exm.pjc.common.lang.Stage;

/**
 * Source text could not be split into tokens: unknown character,
 * malformed literal or bad indentation
 */
public class LexException extends UserException {

  public LexException(String file, int line, int col, String message) {
    super(Stage.LEX, file, line, col, message);
  }

  private static final long serialVersionUID = 1L;
}
