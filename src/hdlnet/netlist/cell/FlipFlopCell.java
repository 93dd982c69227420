package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.ir.ClockDomain.ClockEdge;
import hdlnet.netlist.Net;
import hdlnet.netlist.NetValue;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/** A register: samples {@code data} on the {@code clkEdge} of {@code clk} and loads {@code init} while {@code arst} is set. */
public class FlipFlopCell extends Cell {
  private NetValue data;
  private final BigInteger init;
  private Net clk;
  private final ClockEdge clkEdge;
  private Net arst;
  private final Map<String, Object> attrs;

  public FlipFlopCell(int module, NetValue data, BigInteger init, Net clk, ClockEdge clkEdge, Net arst, Map<String, Object> attrs,
                      SrcLoc srcLoc) {
    super(module, srcLoc);
    this.data = data;
    this.init = init;
    this.clk = clk;
    this.clkEdge = clkEdge;
    this.arst = arst;
    this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
  }

  public NetValue getData() { return data; }
  public BigInteger getInit() { return init; }
  public Net getClk() { return clk; }
  public ClockEdge getClkEdge() { return clkEdge; }
  public Net getArst() { return arst; }
  public Map<String, Object> getAttrs() { return attrs; }

  /** Used when the data input can only be known after the cell has an index, e.g. for a register holding its own value. */
  public void setData(NetValue data) {
    if (data.size() != this.data.size())
      throw new IllegalArgumentException("Flip-flop data width cannot change from " + this.data.size() + " to " + data.size());
    this.data = data;
  }

  @Override
  public int getWidth() {
    return data.size();
  }

  @Override
  protected List<NetValue> inputs() {
    return List.of(data, NetValue.of(clk), NetValue.of(arst));
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    data = resolver.apply(data);
    clk = resolver.apply(NetValue.of(clk)).get(0);
    arst = resolver.apply(NetValue.of(arst)).get(0);
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return edgesFrom(NetValue.of(clk, arst));
  }

  @Override
  public String toString() {
    return "(flipflop " + data + " " + init + " " + clkEdge.getSerialName() + " " + clk + " " + arst + attrsRepr(attrs) + ")";
  }
}
