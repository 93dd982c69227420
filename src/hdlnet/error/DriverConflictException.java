package hdlnet.error;

import hdlnet.ast.SrcLoc;

/**
 * The same signal bit is driven from two domains or from two modules.
 * The message names both source locations; {@link #getOtherSrcLoc()} returns the earlier one.
 */
public class DriverConflictException extends HdlException {
  private static final long serialVersionUID = 1L;

  private final SrcLoc otherSrcLoc;

  public DriverConflictException(String message, SrcLoc srcLoc, SrcLoc otherSrcLoc) {
    super(ErrorKind.DRIVER_CONFLICT, message, srcLoc);
    this.otherSrcLoc = otherSrcLoc;
  }

  public SrcLoc getOtherSrcLoc() { return otherSrcLoc; }
}
