package exm.pjc.common.exceptions;

import exm.pjc.frontend.Token;

/**
 * Well-formed source construct that is outside the compiled subset
 */
public class UnsupportedConstructException extends InvalidSyntaxException {
  private final String construct;

  public UnsupportedConstructException(String file, Token token,
                                       String construct) {
    super(file, token, "unsupported construct: " + construct);
    this.construct = construct;
  }

  /**
   * @return name of the rejected construct
   */
  public String getConstruct() {
    return construct;
  }

  private static final long serialVersionUID = 1L;
}
