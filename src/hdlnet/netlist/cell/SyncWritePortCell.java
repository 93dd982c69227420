package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.ir.ClockDomain.ClockEdge;
import hdlnet.netlist.Net;
import hdlnet.netlist.NetValue;
import java.util.List;
import java.util.function.UnaryOperator;

/** Writes {@code data} to {@code addr} of a memory on a clock edge; {@code en} has one bit per data bit. */
public class SyncWritePortCell extends Cell {
  private final int memory;
  private NetValue data;
  private NetValue addr;
  private NetValue en;
  private Net clk;
  private final ClockEdge clkEdge;

  public SyncWritePortCell(int module, int memory, NetValue data, NetValue addr, NetValue en, Net clk, ClockEdge clkEdge, SrcLoc srcLoc) {
    super(module, srcLoc);
    this.memory = memory;
    this.data = data;
    this.addr = addr;
    this.en = en;
    this.clk = clk;
    this.clkEdge = clkEdge;
  }

  public int getMemory() { return memory; }
  public NetValue getData() { return data; }
  public NetValue getAddr() { return addr; }
  public NetValue getEn() { return en; }
  public Net getClk() { return clk; }

  @Override
  public int getWidth() {
    return 0;
  }

  @Override
  protected List<NetValue> inputs() {
    return List.of(data, addr, en, NetValue.of(clk));
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    data = resolver.apply(data);
    addr = resolver.apply(addr);
    en = resolver.apply(en);
    clk = resolver.apply(NetValue.of(clk)).get(0);
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return List.of();
  }

  @Override
  public String toString() {
    return "(write_port " + memory + " " + data + " " + addr + " " + en + " " + clkEdge.getSerialName() + " " + clk + ")";
  }
}
