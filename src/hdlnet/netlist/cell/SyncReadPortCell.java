package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.ir.ClockDomain.ClockEdge;
import hdlnet.netlist.Net;
import hdlnet.netlist.NetValue;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Reads the memory word at {@code addr} on a clock edge while {@code en} is set.
 * Writes through the ports in {@code transparentFor} (cell indices) are visible in the same cycle.
 */
public class SyncReadPortCell extends Cell {
  private final int memory;
  private final int width;
  private NetValue addr;
  private Net en;
  private Net clk;
  private final ClockEdge clkEdge;
  private final List<Integer> transparentFor;

  public SyncReadPortCell(int module, int memory, int width, NetValue addr, Net en, Net clk, ClockEdge clkEdge,
                          List<Integer> transparentFor, SrcLoc srcLoc) {
    super(module, srcLoc);
    this.memory = memory;
    this.width = width;
    this.addr = addr;
    this.en = en;
    this.clk = clk;
    this.clkEdge = clkEdge;
    this.transparentFor = List.copyOf(transparentFor);
  }

  public int getMemory() { return memory; }
  public NetValue getAddr() { return addr; }
  public Net getEn() { return en; }
  public Net getClk() { return clk; }
  public List<Integer> getTransparentFor() { return transparentFor; }

  @Override
  public int getWidth() {
    return width;
  }

  @Override
  protected List<NetValue> inputs() {
    return List.of(addr, NetValue.of(en, clk));
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    addr = resolver.apply(addr);
    NetValue control = resolver.apply(NetValue.of(en, clk));
    en = control.get(0);
    clk = control.get(1);
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return List.of();
  }

  @Override
  public String toString() {
    String transparent = transparentFor.stream().map(String::valueOf).collect(Collectors.joining(" "));
    return "(read_port " + memory + " " + width + " " + addr + " " + en + " " + clkEdge.getSerialName() + " " + clk +
        " (" + transparent + "))";
  }
}
