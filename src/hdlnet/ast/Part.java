package hdlnet.ast;

import hdlnet.error.ShapeError;
import java.util.List;
import java.util.Set;

/** {@code width} bits of a value starting at bit {@code offset * stride}, where the offset is a run-time value. */
public final class Part extends Value {
  private final Value base;
  private final Value offset;
  private final int partWidth;
  private final int stride;

  public Part(Value base, Value offset, int width, int stride, SrcLoc srcLoc) {
    super(srcLoc);
    if (width < 0)
      throw new ShapeError("Part width must be a non-negative integer, not " + width, srcLoc);
    if (stride <= 0)
      throw new ShapeError("Part stride must be a positive integer, not " + stride, srcLoc);
    if (offset.shape().isSigned())
      throw new ShapeError("Part offset must be unsigned", srcLoc);
    this.base = base;
    this.offset = offset;
    this.partWidth = width;
    this.stride = stride;
  }

  public Value getBase() { return base; }
  public Value getOffset() { return offset; }
  public int getStride() { return stride; }

  @Override
  public Shape shape() {
    return Shape.unsigned(partWidth);
  }

  @Override
  public List<Value> operands() {
    return List.of(base, offset);
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
    return "(part " + base + " " + offset + " " + partWidth + " " + stride + ")";
  }
}
