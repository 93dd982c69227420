package hdlnet.ast;

import hdlnet.error.HdlSyntaxError;
import java.util.LinkedHashSet;
import java.util.Set;

/** {@code lhs = rhs}; the right-hand side is truncated or extended to the width of the target. */
public final class Assign extends Statement {
  private final Value lhs;
  private final Value rhs;

  public Assign(Value lhs, Value rhs, SrcLoc srcLoc) {
    super(srcLoc);
    if (!lhs.isAssignable())
      throw new HdlSyntaxError("Value " + lhs + " cannot be assigned to", srcLoc);
    this.lhs = lhs;
    this.rhs = rhs;
  }

  public Value getLhs() { return lhs; }
  public Value getRhs() { return rhs; }

  @Override
  public Set<Signal> lhsSignals() {
    return lhs.lhsSignals();
  }

  @Override
  public Set<Signal> rhsSignals() {
    Set<Signal> result = new LinkedHashSet<>(rhs.rhsSignals());
    Set<Signal> indexSignals = new LinkedHashSet<>(lhs.rhsSignals());
    indexSignals.removeAll(lhs.lhsSignals());
    result.addAll(indexSignals);
    return result;
  }

  @Override
  public String toString() {
    return "(eq " + lhs + " " + rhs + ")";
  }
}
