package exm.pjc.common.exceptions;

/**
 * Bad value for a compiler setting
 */
public class InvalidOptionException extends Exception {

  public InvalidOptionException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
