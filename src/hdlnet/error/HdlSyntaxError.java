package hdlnet.error;

import hdlnet.ast.SrcLoc;

/** A construct used outside of its required context, a malformed pattern or an assignment to a non-assignable expression. */
public class HdlSyntaxError extends HdlException {
  private static final long serialVersionUID = 1L;

  public HdlSyntaxError(String message) { super(ErrorKind.SYNTAX, message, null); }
  public HdlSyntaxError(String message, SrcLoc srcLoc) { super(ErrorKind.SYNTAX, message, srcLoc); }
}
