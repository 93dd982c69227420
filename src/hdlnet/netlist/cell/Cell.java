package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.Net;
import hdlnet.netlist.NetValue;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * One operation, decision or storage unit of the netlist. Every cell belongs to exactly one module.
 * <p>
 * Output bit {@code b} of the cell stored at index {@code c} is the net {@code Net.fromCell(c, b)}.
 */
public abstract class Cell {
  protected final int module;
  protected final SrcLoc srcLoc;

  protected Cell(int module, SrcLoc srcLoc) {
    this.module = module;
    this.srcLoc = srcLoc;
  }

  public int getModule() { return module; }
  public SrcLoc getSrcLoc() { return srcLoc; }

  /** Number of output bits. */
  public abstract int getWidth();

  /** All values read by this cell. */
  protected abstract List<NetValue> inputs();

  /** Replaces every value read by this cell by {@code resolver.apply(value)}. */
  public abstract void resolveNets(UnaryOperator<NetValue> resolver);

  /** Nets this cell output bit depends on without an intervening clock edge. */
  public abstract List<CombEdge> combEdgesTo(int bit);

  public Set<Net> inputNets() {
    Set<Net> result = new LinkedHashSet<>();
    for (NetValue value : inputs())
      value.forEach(result::add);
    return result;
  }

  public Set<Net> outputNets(int selfIdx) {
    Set<Net> result = new LinkedHashSet<>();
    for (int bit = 0; bit < getWidth(); ++bit)
      result.add(Net.fromCell(selfIdx, bit));
    return result;
  }

  /** Nets that are connected to the pads of the design. */
  public Set<Net> ioNets() { return Set.of(); }

  /** Short kind name used in diagnostics. */
  public String getKindName() { return "cell " + getClass().getSimpleName(); }

  //// Helpers for subclasses ////

  protected List<CombEdge> edgesFrom(NetValue... values) {
    List<CombEdge> result = new ArrayList<>();
    for (NetValue value : values)
      for (Net net : value)
        result.add(new CombEdge(net, srcLoc));
    return result;
  }

  protected static String quote(String str) {
    return "'" + str.replace("\\", "\\\\").replace("'", "\\'").replace("\n", "\\n") + "'";
  }

  protected static String attrsRepr(Map<String, Object> attrs) {
    return attrs.entrySet().stream()
        .map(e -> " (attr " + e.getKey() + " " + (e.getValue() instanceof String ? quote((String)e.getValue()) : e.getValue()) + ")")
        .collect(Collectors.joining());
  }
}
