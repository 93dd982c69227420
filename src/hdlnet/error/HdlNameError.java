package hdlnet.error;

import hdlnet.ast.SrcLoc;

/** A duplicate submodule, domain or port name, or an FSM state that is referenced but never defined. */
public class HdlNameError extends HdlException {
  private static final long serialVersionUID = 1L;

  public HdlNameError(String message) { super(ErrorKind.NAME, message, null); }
  public HdlNameError(String message, SrcLoc srcLoc) { super(ErrorKind.NAME, message, srcLoc); }
}
