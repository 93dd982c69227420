package hdlnet.netlist.cell;

import hdlnet.netlist.Net;
import hdlnet.netlist.NetValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * The top-level ports of the design; always cell 0 of module 0.
 * Inputs and inouts are outputs of this cell, starting at bit 2 since bits 0 and 1 are the constants.
 */
public class Top extends Cell {
  /** A range of output bits of the top cell. */
  public record PortRange(int start, int width) {
    public int stop() { return start + width; }
  }

  private final LinkedHashMap<String, PortRange> portsI = new LinkedHashMap<>();
  private final LinkedHashMap<String, NetValue> portsO = new LinkedHashMap<>();
  private final LinkedHashMap<String, PortRange> portsIO = new LinkedHashMap<>();

  public Top() { super(0, null); }

  public Map<String, PortRange> getInputs() { return Collections.unmodifiableMap(portsI); }
  public Map<String, NetValue> getOutputs() { return Collections.unmodifiableMap(portsO); }
  public Map<String, PortRange> getInouts() { return Collections.unmodifiableMap(portsIO); }

  public void addInput(String name, PortRange range) { portsI.put(name, range); }
  public void addOutput(String name, NetValue value) { portsO.put(name, value); }
  public void addInout(String name, PortRange range) { portsIO.put(name, range); }

  public NetValue valueOf(PortRange range) {
    List<Net> nets = new ArrayList<>();
    for (int bit = range.start(); bit < range.stop(); ++bit)
      nets.add(Net.fromCell(0, bit));
    return NetValue.of(nets);
  }

  @Override
  public int getWidth() {
    int width = 2;
    for (PortRange range : portsI.values())
      width = Math.max(width, range.stop());
    for (PortRange range : portsIO.values())
      width = Math.max(width, range.stop());
    return width;
  }

  @Override
  protected List<NetValue> inputs() {
    return new ArrayList<>(portsO.values());
  }

  @Override
  public Set<Net> outputNets(int selfIdx) {
    Set<Net> result = new LinkedHashSet<>();
    for (PortRange range : portsI.values())
      valueOf(range).forEach(result::add);
    for (PortRange range : portsIO.values())
      valueOf(range).forEach(result::add);
    return result;
  }

  @Override
  public Set<Net> ioNets() {
    Set<Net> result = new LinkedHashSet<>();
    for (PortRange range : portsIO.values())
      valueOf(range).forEach(result::add);
    return result;
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    portsO.replaceAll((name, value) -> resolver.apply(value));
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return List.of();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(top");
    portsI.forEach((name, range) -> sb.append(" (input ").append(quote(name)).append(' ').append(range.start()).append(':').append(range.stop()).append(')'));
    portsO.forEach((name, value) -> sb.append(" (output ").append(quote(name)).append(' ').append(value).append(')'));
    portsIO.forEach((name, range) -> sb.append(" (inout ").append(quote(name)).append(' ').append(range.start()).append(':').append(range.stop()).append(')'));
    return sb.append(')').toString();
  }
}
