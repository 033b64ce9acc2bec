package exm.pjc.common.exceptions;

/**
 * This represents a compiler internal error.
 * These always indicate a compiler bug (or missing feature).
 * @author wozniak
 * */
public class PJCRuntimeError extends RuntimeException
{
  public PJCRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
