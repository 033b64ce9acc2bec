package exm.pjc.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class PJCFatal extends RuntimeException {
  public final int exitCode;

  public PJCFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

  private static final long serialVersionUID = 1L;
}
