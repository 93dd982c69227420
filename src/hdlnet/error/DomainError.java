package hdlnet.error;

import hdlnet.ast.SrcLoc;

/** A clock domain that is used but not defined, or a reset requested from a reset-less domain. */
public class DomainError extends HdlException {
  private static final long serialVersionUID = 1L;

  public DomainError(String message) { super(ErrorKind.DOMAIN, message, null); }
  public DomainError(String message, SrcLoc srcLoc) { super(ErrorKind.DOMAIN, message, srcLoc); }
}
