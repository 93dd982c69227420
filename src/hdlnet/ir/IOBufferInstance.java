package hdlnet.ir;

import hdlnet.ast.Const;
import hdlnet.ast.Signal;
import hdlnet.ast.SrcLoc;
import hdlnet.ast.Value;
import hdlnet.error.HdlSyntaxError;
import hdlnet.error.ShapeError;
import java.util.LinkedHashSet;
import java.util.Set;

/** A bidirectional IO buffer between a pad and internal input, output and output-enable values. */
public class IOBufferInstance extends Fragment {
  private Value pad;
  private Value i;
  private Value o;
  private Value oe;

  /**
   * @param pad The pad, which becomes an inout net of the design
   * @param i Receives the pad value, or null
   * @param o Driven onto the pad, or null for an input-only buffer
   * @param oe One-bit output enable, or null to always drive {@code o}; must be null if {@code o} is null
   */
  public IOBufferInstance(Object pad, Object i, Object o, Object oe) {
    super(SrcLoc.capture());
    this.pad = Value.cast(pad);
    if (!this.pad.isAssignable())
      throw new HdlSyntaxError("IO buffer pad must be assignable, not " + this.pad, srcLoc);
    int width = this.pad.width();
    if (i != null) {
      this.i = Value.cast(i);
      if (this.i.width() != width)
        throw new ShapeError("`pad` length (" + width + ") doesn't match `i` length (" + this.i.width() + ")", srcLoc);
      if (!this.i.isAssignable())
        throw new HdlSyntaxError("IO buffer input must be assignable, not " + this.i, srcLoc);
    }
    if (o == null) {
      if (oe != null)
        throw new ShapeError("`oe` must not be used if `o` is not used", srcLoc);
      this.o = Const.of(0, width);
      this.oe = Const.of(0, 1);
    } else {
      this.o = Value.cast(o);
      if (this.o.width() != width)
        throw new ShapeError("`pad` length (" + width + ") doesn't match `o` length (" + this.o.width() + ")", srcLoc);
      if (oe == null) {
        this.oe = Const.of(1, 1);
      } else {
        this.oe = Value.cast(oe);
        if (this.oe.width() != 1)
          throw new ShapeError("`oe` length (" + this.oe.width() + ") must be 1", srcLoc);
      }
    }
  }

  public Value getPad() { return pad; }
  /** The input connection, or null. */
  public Value getI() { return i; }
  public Value getO() { return o; }
  public Value getOe() { return oe; }

  @Override
  public boolean isLeaf() {
    return true;
  }

  @Override
  protected Set<Signal> portSignals() {
    Set<Signal> result = new LinkedHashSet<>(pad.lhsSignals());
    if (i != null)
      result.addAll(i.lhsSignals());
    result.addAll(o.rhsSignals());
    result.addAll(oe.rhsSignals());
    return result;
  }

  @Override
  protected void transformValues(ValueTransformer transformer) {
    pad = transformer.onValue(pad);
    if (i != null)
      i = transformer.onValue(i);
    o = transformer.onValue(o);
    oe = transformer.onValue(oe);
  }

  @Override
  protected void visitValues(ValueTransformer transformer) {
    transformer.onValue(pad);
    if (i != null)
      transformer.onValue(i);
    transformer.onValue(o);
    transformer.onValue(oe);
  }
}
