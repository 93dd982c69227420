package hdlnet.ast;

import java.util.Set;

/** A statement of a fragment's per-domain statement list. */
public abstract class Statement {
  protected final SrcLoc srcLoc;

  protected Statement(SrcLoc srcLoc) { this.srcLoc = srcLoc; }

  public SrcLoc getSrcLoc() { return srcLoc; }

  /** Signals this statement drives. */
  public abstract Set<Signal> lhsSignals();
  /** Signals this statement reads, including signals used to index an assignment target. */
  public abstract Set<Signal> rhsSignals();
}
