package exm.pjc.common.exceptions;

import exm.pjc.common.lang.Stage;

/**
 * Code generator was handed a tree node it does not know how to lower.
 * A conforming parser never produces one.
 */
public class CodeGenerationError extends PJCRuntimeError {

  public CodeGenerationError(String msg) {
    super(Stage.GENERATE.label() + " error: " + msg);
  }

  public Stage getStage() {
    return Stage.GENERATE;
  }

  private static final long serialVersionUID = 1L;
}
