package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.ir.ClockDomain.ClockEdge;
import hdlnet.netlist.Net;
import hdlnet.netlist.NetValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/** Prints a message while {@code en} is set; synchronous prints fire on a clock edge, asynchronous ones on any change. */
public class PrintCell extends Cell {
  private Net en;
  private Net clk;
  private final ClockEdge clkEdge;
  private NetFormat format;

  /** An asynchronous print. */
  public PrintCell(int module, Net en, NetFormat format, SrcLoc srcLoc) { this(module, en, null, null, format, srcLoc); }

  public PrintCell(int module, Net en, Net clk, ClockEdge clkEdge, NetFormat format, SrcLoc srcLoc) {
    super(module, srcLoc);
    this.en = en;
    this.clk = clk;
    this.clkEdge = clkEdge;
    this.format = format;
  }

  public boolean isSync() { return clk != null; }
  public Net getEn() { return en; }
  /** The clock, or null for an asynchronous print. */
  public Net getClk() { return clk; }
  public ClockEdge getClkEdge() { return clkEdge; }
  public NetFormat getFormat() { return format; }

  @Override
  public int getWidth() {
    return 0;
  }

  @Override
  protected List<NetValue> inputs() {
    List<NetValue> result = new ArrayList<>();
    result.add(isSync() ? NetValue.of(en, clk) : NetValue.of(en));
    result.addAll(format.values());
    return result;
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    en = resolver.apply(NetValue.of(en)).get(0);
    if (clk != null)
      clk = resolver.apply(NetValue.of(clk)).get(0);
    format = format.resolve(resolver);
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return List.of();
  }

  @Override
  public String toString() {
    String clock = isSync() ? " " + clkEdge.getSerialName() + " " + clk : "";
    return "(print " + en + clock + " " + format + ")";
  }
}
