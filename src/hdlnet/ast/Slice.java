package hdlnet.ast;

import hdlnet.error.ShapeError;
import java.util.List;
import java.util.Set;

/** Bits {@code [start, stop)} of a value. The result is always unsigned. */
public final class Slice extends Value {
  private final Value base;
  private final int start;
  private final int stop;

  public Slice(Value base, int start, int stop, SrcLoc srcLoc) {
    super(srcLoc);
    int n = base.width();
    if (start < -n || start > n)
      throw new ShapeError("Cannot start slice " + start + " bits into " + n + "-bit value", srcLoc);
    if (stop < -n || stop > n)
      throw new ShapeError("Cannot stop slice " + stop + " bits into " + n + "-bit value", srcLoc);
    if (start < 0)
      start += n;
    if (stop < 0)
      stop += n;
    if (start > stop)
      throw new ShapeError("Slice start " + start + " must be less than slice stop " + stop, srcLoc);
    this.base = base;
    this.start = start;
    this.stop = stop;
  }

  public Value getBase() { return base; }
  public int getStart() { return start; }
  public int getStop() { return stop; }

  @Override
  public Shape shape() {
    return Shape.unsigned(stop - start);
  }

  @Override
  public List<Value> operands() {
    return List.of(base);
  }

  @Override
  public boolean isAssignable() {
    return base.isAssignable();
  }

  @Override
  protected void collectLhsSignals(Set<Signal> out) {
    base.collectLhsSignals(out);
  }

  @Override
  public String toString() {
    return "(slice " + base + " " + start + ":" + stop + ")";
  }
}
