package hdlnet.netlist.cell;

import hdlnet.ast.Property;
import hdlnet.ast.SrcLoc;
import hdlnet.ir.ClockDomain.ClockEdge;
import hdlnet.netlist.Net;
import hdlnet.netlist.NetValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/** An assertion, assumption or cover point checked while {@code en} is set. */
public class PropertyCell extends Cell {
  private final Property.Kind kind;
  private Net test;
  private Net en;
  private Net clk;
  private final ClockEdge clkEdge;
  private NetFormat format;

  /**
   * @param clk The clock for a synchronous check, or null
   * @param format The failure message, or null
   */
  public PropertyCell(int module, Property.Kind kind, Net test, Net en, Net clk, ClockEdge clkEdge, NetFormat format, SrcLoc srcLoc) {
    super(module, srcLoc);
    this.kind = kind;
    this.test = test;
    this.en = en;
    this.clk = clk;
    this.clkEdge = clkEdge;
    this.format = format;
  }

  public Property.Kind getKind() { return kind; }
  public boolean isSync() { return clk != null; }
  public Net getTest() { return test; }
  public Net getEn() { return en; }
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
    result.add(isSync() ? NetValue.of(test, en, clk) : NetValue.of(test, en));
    if (format != null)
      result.addAll(format.values());
    return result;
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    test = resolver.apply(NetValue.of(test)).get(0);
    en = resolver.apply(NetValue.of(en)).get(0);
    if (clk != null)
      clk = resolver.apply(NetValue.of(clk)).get(0);
    if (format != null)
      format = format.resolve(resolver);
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return List.of();
  }

  @Override
  public String toString() {
    String clock = isSync() ? " " + clkEdge.getSerialName() + " " + clk : "";
    return "(" + kind.getSerialName() + " " + test + " " + en + clock + " " + (format == null ? "None" : format.toString()) + ")";
  }
}
