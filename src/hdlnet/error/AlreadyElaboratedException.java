package hdlnet.error;

import hdlnet.ast.SrcLoc;

/** Raised when a frozen module or fragment is modified. */
public class AlreadyElaboratedException extends HdlException {
  private static final long serialVersionUID = 1L;

  public AlreadyElaboratedException(String message) { super(ErrorKind.ALREADY_ELABORATED, message, null); }
  public AlreadyElaboratedException(String message, SrcLoc srcLoc) { super(ErrorKind.ALREADY_ELABORATED, message, srcLoc); }
}
