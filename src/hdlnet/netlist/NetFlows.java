package hdlnet.netlist;

import hdlnet.ast.Signal;
import hdlnet.netlist.NetlistModule.ModulePort;
import hdlnet.netlist.cell.Cell;
import hdlnet.netlist.cell.InstanceCell;
import hdlnet.netlist.cell.Top;
import hdlnet.netlist.cell.Top.PortRange;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides how each net crosses each module boundary, then groups boundary nets into named ports.
 * <p>
 * The modules that know a net form a subtree: its root has the flow {@code INTERNAL}, modules on the path
 * from the definition up to the root have {@code OUTPUT} and all other modules {@code INPUT}
 * ({@code INOUT} for top-level pads).
 */
public final class NetFlows {
  private NetFlows() {}

  /** Requires resolved nets. */
  public static void computeNetFlows(Netlist netlist) {
    Map<Net, Integer> lca = new HashMap<>();
    List<NetlistModule> modules = netlist.getModules();
    for (int idx = 0; idx < netlist.getCells().size(); ++idx) {
      Cell cell = netlist.getCell(idx);
      for (Net net : cell.outputNets(idx)) {
        lca.put(net, cell.getModule());
        modules.get(cell.getModule()).netFlow.put(net, ModuleNetFlow.INTERNAL);
      }
    }
    for (Cell cell : netlist.getCells())
      for (Net net : cell.inputNets())
        useNet(modules, lca, net, cell.getModule());
    for (int idx = 0; idx < modules.size(); ++idx)
      for (Signal signal : modules.get(idx).getSignalNames().keySet())
        for (Net net : netlist.getSignalValue(signal))
          useNet(modules, lca, net, idx);
  }

  private static int depth(List<NetlistModule> modules, int idx) { return modules.get(idx).getName().size(); }

  private static void useNet(List<NetlistModule> modules, Map<Net, Integer> lca, Net net, int useModule) {
    if (net.isConst())
      return;
    if (modules.get(useModule).netFlow.containsKey(net))
      return;
    Integer defModuleIdx = lca.get(net);
    if (defModuleIdx == null)
      throw new IllegalStateException("Net " + net + " is used but has no definition; were the nets resolved?");
    int defModule = defModuleIdx;
    while (depth(modules, defModule) > depth(modules, useModule)) {
      modules.get(defModule).netFlow.put(net, ModuleNetFlow.OUTPUT);
      defModule = modules.get(defModule).getParent();
    }
    // The use side may reach a module that already routes the net before meeting the definition.
    while (depth(modules, defModule) < depth(modules, useModule)) {
      if (modules.get(useModule).netFlow.containsKey(net))
        return;
      modules.get(useModule).netFlow.put(net, ModuleNetFlow.INPUT);
      useModule = modules.get(useModule).getParent();
    }
    while (defModule != useModule) {
      modules.get(defModule).netFlow.put(net, ModuleNetFlow.OUTPUT);
      defModule = modules.get(defModule).getParent();
      modules.get(useModule).netFlow.put(net, ModuleNetFlow.INPUT);
      useModule = modules.get(useModule).getParent();
    }
    modules.get(defModule).netFlow.put(net, ModuleNetFlow.INTERNAL);
    lca.put(net, defModule);
  }

  /** Groups runs of consecutive output bits of one cell with the same flow into ports. Requires {@link #computeNetFlows}. */
  public static void computePorts(Netlist netlist) {
    Top top = netlist.getTop();
    Set<Net> portStarts = new HashSet<>();
    for (PortRange range : top.getInputs().values())
      portStarts.add(Net.fromCell(0, range.start()));
    for (PortRange range : top.getInouts().values())
      portStarts.add(Net.fromCell(0, range.start()));
    for (int idx = 0; idx < netlist.getCells().size(); ++idx) {
      Cell cell = netlist.getCell(idx);
      if (cell instanceof InstanceCell)
        for (PortRange range : ((InstanceCell)cell).getOutputPorts().values())
          if (range.width() > 0)
            portStarts.add(Net.fromCell(idx, range.start()));
    }
    Set<Net> inouts = top.ioNets();

    for (NetlistModule module : netlist.getModules()) {
      Map<NetValue, String> nameTable = new HashMap<>();
      module.getSignalNames().forEach((signal, name) -> {
        NetValue value = netlist.getSignalValue(signal);
        if (!name.startsWith("$"))
          nameTable.putIfAbsent(value, name);
      });

      module.netFlow.replaceAll((net, flow) -> flow == ModuleNetFlow.INPUT && inouts.contains(net) ? ModuleNetFlow.INOUT : flow);

      Set<Net> visited = new HashSet<>();
      for (Net first : new TreeSet<>(module.netFlow.keySet())) {
        ModuleNetFlow flow = module.netFlow.get(first);
        if (flow == ModuleNetFlow.INTERNAL || visited.contains(first))
          continue;
        List<Net> nets = new ArrayList<>();
        nets.add(first);
        Net net = first;
        while (net.getBit() + 1 < (1 << 16)) {
          Net next = Net.fromCell(net.getCell(), net.getBit() + 1);
          if (portStarts.contains(next) || module.netFlow.get(next) != flow)
            break;
          net = next;
          nets.add(net);
        }
        NetValue value = NetValue.of(nets);
        String name = nameTable.get(value);
        if (name == null)
          name = "port$" + first.getCell() + "$" + first.getBit();
        module.ports.put(name, new ModulePort(value, flow));
        visited.addAll(nets);
      }
    }

    NetlistModule topModule = netlist.getModule(0);
    top.getInputs().forEach((name, range) -> topModule.ports.put(name, new ModulePort(top.valueOf(range), ModuleNetFlow.INPUT)));
    top.getInouts().forEach((name, range) -> topModule.ports.put(name, new ModulePort(top.valueOf(range), ModuleNetFlow.INOUT)));
    top.getOutputs().forEach((name, value) -> topModule.ports.put(name, new ModulePort(value, ModuleNetFlow.OUTPUT)));
  }
}
