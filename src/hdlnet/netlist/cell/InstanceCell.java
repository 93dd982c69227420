package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.Net;
import hdlnet.netlist.NetValue;
import hdlnet.netlist.cell.Top.PortRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/** A black box of a foreign type. Output ports are ranges of this cell's output bits. */
public class InstanceCell extends Cell {
  private final String type;
  private final String name;
  private final Map<String, Object> parameters;
  private final Map<String, Object> attrs;
  private final LinkedHashMap<String, NetValue> portsI;
  private final LinkedHashMap<String, PortRange> portsO;
  private final LinkedHashMap<String, NetValue> portsIO;

  public InstanceCell(int module, String type, String name, Map<String, Object> parameters, Map<String, Object> attrs,
                      Map<String, NetValue> portsI, Map<String, PortRange> portsO, Map<String, NetValue> portsIO, SrcLoc srcLoc) {
    super(module, srcLoc);
    this.type = type;
    this.name = name;
    this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    this.portsI = new LinkedHashMap<>(portsI);
    this.portsO = new LinkedHashMap<>(portsO);
    this.portsIO = new LinkedHashMap<>(portsIO);
  }

  public String getType() { return type; }
  public String getName() { return name; }
  public Map<String, Object> getParameters() { return parameters; }
  public Map<String, Object> getAttrs() { return attrs; }
  public Map<String, NetValue> getInputPorts() { return Collections.unmodifiableMap(portsI); }
  public Map<String, PortRange> getOutputPorts() { return Collections.unmodifiableMap(portsO); }
  public Map<String, NetValue> getInoutPorts() { return Collections.unmodifiableMap(portsIO); }

  @Override
  public int getWidth() {
    int width = 0;
    for (PortRange range : portsO.values())
      width = Math.max(width, range.stop());
    return width;
  }

  @Override
  protected List<NetValue> inputs() {
    List<NetValue> result = new ArrayList<>(portsI.values());
    result.addAll(portsIO.values());
    return result;
  }

  @Override
  public Set<Net> ioNets() {
    Set<Net> result = new LinkedHashSet<>();
    for (NetValue value : portsIO.values())
      value.forEach(result::add);
    return result;
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    portsI.replaceAll((port, value) -> resolver.apply(value));
    portsIO.replaceAll((port, value) -> resolver.apply(value));
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return List.of();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(instance ").append(quote(type)).append(' ').append(quote(name));
    parameters.forEach((param, value) -> sb.append(" (param ").append(quote(param)).append(' ').append(paramRepr(value)).append(')'));
    attrs.forEach((attr, value) -> sb.append(" (attr ").append(quote(attr)).append(' ').append(paramRepr(value)).append(')'));
    portsI.forEach((port, value) -> sb.append(" (input ").append(quote(port)).append(' ').append(value).append(')'));
    portsO.forEach((port, range) -> sb.append(" (output ").append(quote(port)).append(' ').append(range.start()).append(':').append(range.stop()).append(')'));
    portsIO.forEach((port, value) -> sb.append(" (io ").append(quote(port)).append(' ').append(value).append(')'));
    return sb.append(')').toString();
  }

  private static String paramRepr(Object value) {
    return value instanceof String ? quote((String)value) : String.valueOf(value);
  }
}
