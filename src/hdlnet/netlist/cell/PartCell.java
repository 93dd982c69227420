package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.NetValue;
import java.util.List;
import java.util.function.UnaryOperator;

/** Selects {@code width} bits of {@code value} starting at {@code offset * stride}; out-of-range bits read as fill. */
public class PartCell extends Cell {
  private NetValue value;
  private final boolean valueSigned;
  private NetValue offset;
  private final int width;
  private final int stride;

  public PartCell(int module, NetValue value, boolean valueSigned, NetValue offset, int width, int stride, SrcLoc srcLoc) {
    super(module, srcLoc);
    this.value = value;
    this.valueSigned = valueSigned;
    this.offset = offset;
    this.width = width;
    this.stride = stride;
  }

  public NetValue getValue() { return value; }
  public boolean isValueSigned() { return valueSigned; }
  public NetValue getOffset() { return offset; }
  public int getStride() { return stride; }

  @Override
  public int getWidth() {
    return width;
  }

  @Override
  protected List<NetValue> inputs() {
    return List.of(value, offset);
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    value = resolver.apply(value);
    offset = resolver.apply(offset);
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return edgesFrom(value, offset);
  }

  @Override
  public String toString() {
    return "(part " + value + " " + (valueSigned ? "signed" : "unsigned") + " " + offset + " " + width + " " + stride + ")";
  }
}
