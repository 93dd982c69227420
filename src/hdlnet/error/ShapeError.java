package hdlnet.error;

import hdlnet.ast.SrcLoc;

/** Invalid shape, width or signedness, or an object that cannot be cast to a shape or value. */
public class ShapeError extends HdlException {
  private static final long serialVersionUID = 1L;

  public ShapeError(String message) { super(ErrorKind.SHAPE, message, null); }
  public ShapeError(String message, SrcLoc srcLoc) { super(ErrorKind.SHAPE, message, srcLoc); }
}
