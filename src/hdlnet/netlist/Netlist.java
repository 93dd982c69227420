package hdlnet.netlist;

import hdlnet.ast.Signal;
import hdlnet.ast.SrcLoc;
import hdlnet.error.CombinationalCycleException;
import hdlnet.netlist.cell.Cell;
import hdlnet.netlist.cell.CombEdge;
import hdlnet.netlist.cell.Top;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The flat, cell-based result of building a design.
 * <p>
 * Cell 0 is always the {@link Top} cell. Signals are first represented by late nets, which are
 * connected to their drivers as emission goes on and replaced by the drivers in {@link #resolveAllNets()}.
 */
public class Netlist {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** The signal bit a late net stands for. */
  public record SignalBit(Signal signal, int bit) {}

  private final List<NetlistModule> modules = new ArrayList<>();
  private final List<Cell> cells = new ArrayList<>();
  private final LinkedHashMap<Net, Net> connections = new LinkedHashMap<>();
  private final LinkedHashMap<Net, SignalBit> lateToSignal = new LinkedHashMap<>();
  private final LinkedHashMap<Signal, NetValue> signals = new LinkedHashMap<>();
  private long lastLateNet = 0;

  public Netlist() { cells.add(new Top()); }

  public List<NetlistModule> getModules() { return Collections.unmodifiableList(modules); }
  public NetlistModule getModule(int idx) { return modules.get(idx); }
  public List<Cell> getCells() { return Collections.unmodifiableList(cells); }
  public Cell getCell(int idx) { return cells.get(idx); }
  public Top getTop() { return (Top)cells.get(0); }
  /** Late net to driver connections; empty in meaning once all nets are resolved. */
  public Map<Net, Net> getConnections() { return Collections.unmodifiableMap(connections); }
  public Map<Net, SignalBit> getLateToSignal() { return Collections.unmodifiableMap(lateToSignal); }
  /** The nets of every signal of the design. */
  public Map<Signal, NetValue> getSignals() { return Collections.unmodifiableMap(signals); }
  public NetValue getSignalValue(Signal signal) { return signals.get(signal); }

  //// Construction ////

  public int addModule(Integer parent, List<String> name, SrcLoc srcLoc) {
    int idx = modules.size();
    modules.add(new NetlistModule(parent, name, srcLoc));
    if (idx == 0)
      modules.get(0).addCell(0);
    if (parent != null)
      modules.get(parent).addSubmodule(idx);
    return idx;
  }

  public int addCell(Cell cell) {
    int idx = cells.size();
    cells.add(cell);
    modules.get(cell.getModule()).addCell(idx);
    return idx;
  }

  /** Adds a cell and returns all of its output bits. */
  public NetValue addValueCell(int width, Cell cell) {
    int idx = addCell(cell);
    List<Net> nets = new ArrayList<>(width);
    for (int bit = 0; bit < width; ++bit)
      nets.add(Net.fromCell(idx, bit));
    return NetValue.of(nets);
  }

  /** Allocates the late nets standing for {@code signal} until its drivers are known. */
  public NetValue allocLateValue(Signal signal) {
    int width = signal.width();
    lastLateNet -= width;
    List<Net> nets = new ArrayList<>(width);
    for (int bit = 0; bit < width; ++bit) {
      Net net = Net.fromLate(lastLateNet + bit);
      nets.add(net);
      lateToSignal.put(net, new SignalBit(signal, bit));
    }
    NetValue value = NetValue.of(nets);
    signals.put(signal, value);
    return value;
  }

  /** Connects a late net to its driver. Conflicting connections are the caller's responsibility. */
  public void connect(Net late, Net driver) {
    if (!late.isLate())
      throw new IllegalArgumentException("Only late nets can be connected, not " + late);
    connections.put(late, driver);
  }

  public boolean isConnected(Net late) { return connections.containsKey(late); }

  //// Resolution ////

  public Net resolveNet(Net net) {
    Net current = net;
    int steps = 0;
    while (current.isLate()) {
      Net next = connections.get(current);
      if (next == null) {
        SignalBit signalBit = lateToSignal.get(current);
        throw new IllegalStateException("Late net " + current + (signalBit == null ? "" : " (bit " + signalBit.bit() + " of signal " +
                                        signalBit.signal().getName() + ")") + " is not connected");
      }
      if (++steps > connections.size())
        throw new IllegalStateException("Late net " + net + " is connected to itself");
      current = next;
    }
    return current;
  }

  public NetValue resolveValue(NetValue value) { return value.map(this::resolveNet); }

  /** Replaces every late net in cells and signals by its driver. */
  public void resolveAllNets() {
    for (Cell cell : cells)
      cell.resolveNets(this::resolveValue);
    signals.replaceAll((signal, value) -> resolveValue(value));
    logger.debug("Resolved nets of {} cells and {} signals", cells.size(), signals.size());
  }

  //// Combinational cycle check ////

  private static class Cycle {
    final Net start;
    final List<String> path = new ArrayList<>();

    Cycle(Net start) { this.start = start; }
  }

  /**
   * Fails if any net depends on itself without a storage element in between.
   * Late nets are followed through their connections, so this can run before or after resolution.
   */
  public void checkCombCycles() {
    Set<Net> checked = new HashSet<>();
    Set<Net> busy = new HashSet<>();
    for (int idx = 0; idx < cells.size(); ++idx)
      for (Net net : cells.get(idx).outputNets(idx))
        traverse(net, checked, busy);
    for (NetValue value : signals.values())
      for (Net net : value)
        traverse(net, checked, busy);
  }

  private Cycle traverse(Net net, Set<Net> checked, Set<Net> busy) {
    if (checked.contains(net))
      return null;
    if (!busy.add(net))
      return new Cycle(net);

    Cycle cycle = null;
    if (net.isLate()) {
      Net driver = connections.get(net);
      if (driver != null) {
        cycle = traverse(driver, checked, busy);
        if (cycle != null) {
          SignalBit signalBit = lateToSignal.get(net);
          cycle.path.add(locString(signalBit.signal().getSrcLoc()) + ": signal " + signalBit.signal().getName() + " bit " + signalBit.bit());
        }
      }
    } else if (net.isCell()) {
      Cell cell = cells.get(net.getCell());
      for (CombEdge edge : cell.combEdgesTo(net.getBit())) {
        cycle = traverse(edge.source(), checked, busy);
        if (cycle != null) {
          cycle.path.add(locString(edge.srcLoc()) + ": " + cell.getKindName() + " bit " + net.getBit());
          break;
        }
      }
    }

    if (cycle != null && cycle.start.equals(net)) {
      List<String> path = new ArrayList<>(cycle.path);
      Collections.reverse(path);
      throw new CombinationalCycleException(path);
    }
    busy.remove(net);
    checked.add(net);
    return cycle;
  }

  private static String locString(SrcLoc srcLoc) { return srcLoc == null ? "<unknown>:0" : srcLoc.toString(); }

  //// Dump ////

  /** One line per module, then one line per cell. */
  @Override
  public String toString() {
    List<String> lines = new ArrayList<>();
    for (int idx = 0; idx < modules.size(); ++idx) {
      NetlistModule module = modules.get(idx);
      String name = module.getName().stream().map(n -> "'" + n + "'").collect(Collectors.joining(" "));
      StringBuilder sb = new StringBuilder("(module ").append(idx).append(' ').append(module.getParent() == null ? "-" : module.getParent());
      sb.append(" (").append(name).append(')');
      module.getPorts().forEach((portName, port) ->
          sb.append(" (").append(port.flow().getSerialName()).append(" '").append(portName).append("' ").append(port.value()).append(')'));
      lines.add(sb.append(')').toString());
    }
    for (int idx = 0; idx < cells.size(); ++idx)
      lines.add("(cell " + idx + " " + cells.get(idx).getModule() + " " + cells.get(idx) + ")");
    return String.join("\n", lines);
  }
}
