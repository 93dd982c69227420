package hdlnet.error;

import hdlnet.ast.SrcLoc;

/**
 * Base class of all diagnostics raised by the elaboration pipeline.
 * Callers tell the kinds apart through {@link #getKind()} or by catching the subclass.
 */
public abstract class HdlException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;
  private final SrcLoc srcLoc;

  protected HdlException(ErrorKind kind, String message, SrcLoc srcLoc) {
    super(srcLoc == null ? message : srcLoc + ": " + message);
    this.kind = kind;
    this.srcLoc = srcLoc;
  }

  public ErrorKind getKind() { return kind; }
  /** The source location of the offending construct, or null if unknown. */
  public SrcLoc getSrcLoc() { return srcLoc; }
}
