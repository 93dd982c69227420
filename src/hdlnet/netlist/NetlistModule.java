package hdlnet.netlist;

import hdlnet.ast.Signal;
import hdlnet.ast.SrcLoc;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A node of the netlist hierarchy, one per non-leaf fragment of the design. */
public class NetlistModule {
  /** A named port of a module. */
  public record ModulePort(NetValue value, ModuleNetFlow flow) {}

  private final Integer parent;
  private final List<String> name;
  private final SrcLoc srcLoc;
  private final List<Integer> submodules = new ArrayList<>();
  private final List<Integer> cells = new ArrayList<>();
  private final LinkedHashMap<Signal, String> signalNames = new LinkedHashMap<>();
  final LinkedHashMap<Net, ModuleNetFlow> netFlow = new LinkedHashMap<>();
  final LinkedHashMap<String, ModulePort> ports = new LinkedHashMap<>();

  NetlistModule(Integer parent, List<String> name, SrcLoc srcLoc) {
    this.parent = parent;
    this.name = List.copyOf(name);
    this.srcLoc = srcLoc;
  }

  /** Index of the parent module, or null for the top module. */
  public Integer getParent() { return parent; }
  public List<String> getName() { return name; }
  public SrcLoc getSrcLoc() { return srcLoc; }
  public List<Integer> getSubmodules() { return Collections.unmodifiableList(submodules); }
  public List<Integer> getCells() { return Collections.unmodifiableList(cells); }
  public Map<Signal, String> getSignalNames() { return Collections.unmodifiableMap(signalNames); }
  public Map<Net, ModuleNetFlow> getNetFlow() { return Collections.unmodifiableMap(netFlow); }
  public Map<String, ModulePort> getPorts() { return Collections.unmodifiableMap(ports); }

  void addSubmodule(int idx) { submodules.add(idx); }
  void addCell(int idx) { cells.add(idx); }
  void setSignalNames(Map<Signal, String> names) {
    signalNames.clear();
    signalNames.putAll(names);
  }
}
