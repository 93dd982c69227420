package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.NetValue;
import java.util.List;
import java.util.function.UnaryOperator;

/** Reads the memory word at {@code addr} combinationally. */
public class AsyncReadPortCell extends Cell {
  private final int memory;
  private final int width;
  private NetValue addr;

  public AsyncReadPortCell(int module, int memory, int width, NetValue addr, SrcLoc srcLoc) {
    super(module, srcLoc);
    this.memory = memory;
    this.width = width;
    this.addr = addr;
  }

  public int getMemory() { return memory; }
  public NetValue getAddr() { return addr; }

  @Override
  public int getWidth() {
    return width;
  }

  @Override
  protected List<NetValue> inputs() {
    return List.of(addr);
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    addr = resolver.apply(addr);
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return edgesFrom(addr);
  }

  @Override
  public String toString() {
    return "(read_port " + memory + " " + width + " " + addr + ")";
  }
}
